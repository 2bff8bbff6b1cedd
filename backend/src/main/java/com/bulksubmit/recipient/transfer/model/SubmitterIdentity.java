package com.bulksubmit.recipient.transfer.model;

public record SubmitterIdentity(
    String system,
    String value
) {
    public String display() {
        return system + "|" + value;
    }
}
