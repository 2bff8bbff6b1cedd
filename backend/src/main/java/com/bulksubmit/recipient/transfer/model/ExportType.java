package com.bulksubmit.recipient.transfer.model;

public enum ExportType {
    OUTPUT("output"),
    DELETED("deleted"),
    ERROR("error");

    private final String folder;

    ExportType(String folder) {
        this.folder = folder;
    }

    public String folder() {
        return folder;
    }
}
