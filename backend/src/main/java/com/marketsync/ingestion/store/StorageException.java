package com.marketsync.ingestion.store;

import com.marketsync.common.PipelineException;

/**
 * Persistence failure while writing pipeline state. Fails the run; the watermark stays where it was.
 */
public class StorageException extends PipelineException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
