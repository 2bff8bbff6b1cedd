package com.bulksubmit.recipient.transfer.service;

public record JobEvent(
    Type type,
    int downloaded,
    int total,
    String message
) {
    public enum Type {
        START,
        PROGRESS,
        ERROR,
        COMPLETE,
        ABORT
    }

    public static JobEvent start() {
        return new JobEvent(Type.START, 0, 0, null);
    }

    public static JobEvent progress(int downloaded, int total) {
        return new JobEvent(Type.PROGRESS, downloaded, total, null);
    }

    public static JobEvent error(String message) {
        return new JobEvent(Type.ERROR, 0, 0, message);
    }

    public static JobEvent complete() {
        return new JobEvent(Type.COMPLETE, 0, 0, null);
    }

    public static JobEvent abort() {
        return new JobEvent(Type.ABORT, 0, 0, null);
    }
}
