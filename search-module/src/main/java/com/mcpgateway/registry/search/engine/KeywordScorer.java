package com.mcpgateway.registry.search.engine;

import com.mcpgateway.registry.common.model.EmbeddingRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Доля токенов запроса, найденных в пути, имени, описании или тегах записи
 */
@Component
public class KeywordScorer {

    public double fraction(EmbeddingRecord record, List<String> tokens) {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        String path = lower(record.path());
        String name = lower(record.name());
        String description = lower(record.description());
        List<String> tags = record.tags().stream().map(KeywordScorer::lower).toList();

        int matched = 0;
        for (String token : tokens) {
            if (path.contains(token) || name.contains(token) || description.contains(token)
                    || tags.stream().anyMatch(tag -> tag.contains(token))) {
                matched++;
            }
        }
        return (double) matched / tokens.size();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
