package com.bulksubmit.recipient.transfer.fetch;

import com.bulksubmit.recipient.transfer.model.TransferException;

public interface ManifestFetcherListener {
    default void onStart() {
    }

    default void onProgress(int downloaded, int total) {
    }

    default void onError(TransferException error) {
    }

    default void onComplete() {
    }

    default void onAbort() {
    }

    default void onDownloadStart(String fileUrl) {
    }

    default void onDownloadComplete(String fileUrl, int resourceCount) {
    }
}
