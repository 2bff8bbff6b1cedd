package com.bulksubmit.recipient.transfer.queue;

@FunctionalInterface
public interface QueuedTask<T> {
    T run(CancellationSignal signal) throws Exception;
}
