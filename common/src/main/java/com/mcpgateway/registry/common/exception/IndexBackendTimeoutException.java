package com.mcpgateway.registry.common.exception;

/** Нативный векторный запрос превысил таймаут */
public class IndexBackendTimeoutException extends IndexBackendException {

    public IndexBackendTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
