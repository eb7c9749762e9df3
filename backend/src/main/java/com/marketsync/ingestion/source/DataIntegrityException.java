package com.marketsync.ingestion.source;

import com.marketsync.common.PipelineException;

/**
 * Malformed item. Isolated to the item: it is dropped and logged with this reason, the batch continues.
 */
public class DataIntegrityException extends PipelineException {

    public DataIntegrityException(String message) {
        super(message);
    }
}
