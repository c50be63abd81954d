package com.mcpgateway.registry.common.exception;

/**
 * Фатальная ошибка конфигурации: несовпадение размерности, неподдерживаемая метрика,
 * отсутствующие учётные данные. Прерывает запуск.
 */
public class SearchConfigurationException extends RegistrySearchException {

    public SearchConfigurationException(String message) {
        super(message);
    }

    public SearchConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
