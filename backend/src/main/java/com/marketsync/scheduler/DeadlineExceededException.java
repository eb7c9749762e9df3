package com.marketsync.scheduler;

import com.marketsync.common.PipelineException;

public class DeadlineExceededException extends PipelineException {

    public DeadlineExceededException(String message) {
        super(message);
    }
}
