package com.marketsync.common;

/**
 * Invalid job, source, rule or retention definition. Fatal at startup: the job is never scheduled.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }
}
