package com.bulksubmit.recipient.transfer.service;

import com.bulksubmit.recipient.transfer.model.TransferException;

public interface TransferJobListener {
    default void onError(TransferJob job, TransferException error) {
    }

    default void onFileComplete(TransferJob job, String fileUrl, int resourceCount) {
    }
}
