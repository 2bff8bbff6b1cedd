package com.bulksubmit.recipient.transfer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record StatusPollResult(
    boolean ready,
    double progress,
    ObjectNode manifest
) {
    public static StatusPollResult inProgress(double progress) {
        return new StatusPollResult(false, progress, null);
    }

    public static StatusPollResult ready(ObjectNode manifest) {
        return new StatusPollResult(true, 100, manifest);
    }
}
