package com.mcpgateway.registry.common.exception;

/**
 * Провайдер эмбеддингов недоступен: сеть, HTTP ошибка, некорректный ответ
 * или отсутствующая локальная модель. Ошибка считается повторяемой.
 */
public class EmbeddingUnavailableException extends RegistrySearchException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
