package com.mcpgateway.registry.common.exception;

/** Провайдер эмбеддингов не ответил за отведённое время */
public class EmbeddingTimeoutException extends EmbeddingUnavailableException {

    public EmbeddingTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
