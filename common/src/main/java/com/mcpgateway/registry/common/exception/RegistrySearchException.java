package com.mcpgateway.registry.common.exception;

/**
 * Базовое исключение поискового движка реестра
 */
public class RegistrySearchException extends RuntimeException {

    public RegistrySearchException(String message) {
        super(message);
    }

    public RegistrySearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
