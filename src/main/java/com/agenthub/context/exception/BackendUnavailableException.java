package com.agenthub.context.exception;

/**
 * 后端（MongoDB / Redis）不可用、熔断打开或读超时
 * 与 "未找到" 严格区分
 */
public class BackendUnavailableException extends ContextStoreException {

    private final String backend;

    public BackendUnavailableException(String backend, String message) {
        super("[" + backend + "] " + message);
        this.backend = backend;
    }

    public BackendUnavailableException(String backend, String message, Throwable cause) {
        super("[" + backend + "] " + message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
