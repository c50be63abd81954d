package com.mcpgateway.registry.storage.index;

import java.util.Locale;

/**
 * Режим работы хранилища: нативный векторный поиск бэкенда или точный перебор на стороне клиента
 */
public enum SearchMode {
    NATIVE,
    FALLBACK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
