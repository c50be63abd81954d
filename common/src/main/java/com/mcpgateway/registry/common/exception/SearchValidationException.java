package com.mcpgateway.registry.common.exception;

/** Некорректный поисковый запрос или сущность */
public class SearchValidationException extends RegistrySearchException {

    public SearchValidationException(String message) {
        super(message);
    }
}
