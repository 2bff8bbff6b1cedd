package com.bulksubmit.recipient.transfer.service;

public enum SubmitAction {
    START,
    REPLACE,
    COMPLETE,
    ABORT
}
