package com.bulksubmit.recipient.transfer.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Single-consumer FIFO queue of cancellable tasks. Tasks of one queue never run concurrently with
 * each other; the drain loop runs on the supplied executor and exits once the queue is empty.
 */
public class TaskQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final Executor executor;
    private final Object lock = new Object();
    private final Deque<QueueItem<T>> queue = new ArrayDeque<>();
    private final List<Consumer<T>> successListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> idleListeners = new CopyOnWriteArrayList<>();

    private boolean processing;
    private CancellationSignal signal = new CancellationSignal();

    public TaskQueue(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<T> enqueue(QueuedTask<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        boolean startDrain;
        synchronized (lock) {
            queue.addLast(new QueueItem<>(task, future));
            startDrain = !processing;
            if (startDrain) {
                processing = true;
            }
        }
        if (startDrain) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                synchronized (lock) {
                    processing = false;
                    queue.clear();
                }
                future.completeExceptionally(e);
            }
        }
        return future;
    }

    /**
     * Drops every task that has not started yet and cancels the signal seen by the running task.
     * Futures of dropped tasks are abandoned and never complete.
     */
    public void abortAll() {
        CancellationSignal previous;
        int dropped;
        synchronized (lock) {
            dropped = queue.size();
            queue.clear();
            previous = signal;
            signal = new CancellationSignal();
        }
        previous.cancel();
        if (dropped > 0) {
            log.debug("Task queue aborted with {} pending tasks dropped", dropped);
        }
    }

    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public boolean isProcessing() {
        synchronized (lock) {
            return processing;
        }
    }

    public void addSuccessListener(Consumer<T> listener) {
        successListeners.add(listener);
    }

    public void removeSuccessListener(Consumer<T> listener) {
        successListeners.remove(listener);
    }

    public void addErrorListener(Consumer<Throwable> listener) {
        errorListeners.add(listener);
    }

    public void removeErrorListener(Consumer<Throwable> listener) {
        errorListeners.remove(listener);
    }

    public void addIdleListener(Runnable listener) {
        idleListeners.add(listener);
    }

    public void removeIdleListener(Runnable listener) {
        idleListeners.remove(listener);
    }

    public void removeAllListeners() {
        successListeners.clear();
        errorListeners.clear();
        idleListeners.clear();
    }

    private void drain() {
        while (true) {
            QueueItem<T> item;
            CancellationSignal current;
            synchronized (lock) {
                item = queue.pollFirst();
                if (item == null) {
                    processing = false;
                    break;
                }
                current = signal;
            }
            T result;
            try {
                result = item.task().run(current);
            } catch (Throwable e) {
                item.future().completeExceptionally(e);
                if (errorListeners.isEmpty()) {
                    log.debug("Queued task failed with no error listener attached: {}", e.toString());
                } else {
                    for (Consumer<Throwable> listener : errorListeners) {
                        notifyListener(() -> listener.accept(e));
                    }
                }
                continue;
            }
            for (Consumer<T> listener : successListeners) {
                notifyListener(() -> listener.accept(result));
            }
            item.future().complete(result);
        }
        for (Runnable listener : idleListeners) {
            notifyListener(listener);
        }
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (Throwable e) {
            log.warn("Task queue listener failed", e);
        }
    }

    private record QueueItem<T>(QueuedTask<T> task, CompletableFuture<T> future) {
    }
}
