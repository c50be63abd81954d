package com.mcpgateway.registry.common.exception;

/** Ошибка хранилища векторного индекса */
public class IndexBackendException extends RegistrySearchException {

    public IndexBackendException(String message) {
        super(message);
    }

    public IndexBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
