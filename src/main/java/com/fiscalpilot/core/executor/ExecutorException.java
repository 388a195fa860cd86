package com.fiscalpilot.core.executor;

/**
 * Thrown by an executor when the external system of record refuses or fails a real side effect.
 */
public class ExecutorException extends RuntimeException {

    private final String executorName;

    public ExecutorException(String executorName, String message) {
        super(message);
        this.executorName = executorName;
    }

    public ExecutorException(String executorName, String message, Throwable cause) {
        super(message, cause);
        this.executorName = executorName;
    }

    public String getExecutorName() {
        return executorName;
    }
}
