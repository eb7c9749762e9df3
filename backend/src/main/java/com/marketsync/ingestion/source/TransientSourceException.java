package com.marketsync.ingestion.source;

import com.marketsync.common.PipelineException;

/**
 * Network, rate-limit or upstream availability failure. The run fails without partial records and the
 * watermark is left untouched, so the next tick retries the same window.
 */
public class TransientSourceException extends PipelineException {

    public TransientSourceException(String message) {
        super(message);
    }

    public TransientSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
