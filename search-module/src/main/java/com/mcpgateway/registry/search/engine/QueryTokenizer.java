package com.mcpgateway.registry.search.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Нормализация запроса и разбиение на ключевые токены
 */
@Component
public class QueryTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]+");
    private static final int MIN_TOKEN_LENGTH = 2;

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could", "should",
            "may", "might", "can", "to", "of", "in", "on", "at", "by", "for", "with",
            "about", "as", "into", "through", "from", "what", "when", "where", "who",
            "which", "how", "why", "get", "set", "put", "and", "or", "me", "my", "i");

    /** Обрезать пробелы по краям и схлопнуть повторяющиеся */
    public String normalize(String query) {
        if (query == null) {
            return "";
        }
        return WHITESPACE.matcher(query.trim()).replaceAll(" ");
    }

    /** Запрос в нижнем регистре без знаков препинания, по нему проверяется минимальная длина */
    public String stripPunctuation(String query) {
        return String.join(" ", NON_WORD.split(normalize(query).toLowerCase(Locale.ROOT))).trim();
    }

    /** Токены в нижнем регистре без стоп-слов, без повторов, в порядке появления */
    public List<String> tokenize(String query) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String raw : NON_WORD.split(normalize(query).toLowerCase(Locale.ROOT))) {
            if (raw.length() >= MIN_TOKEN_LENGTH && !STOPWORDS.contains(raw)) {
                tokens.add(raw);
            }
        }
        return new ArrayList<>(tokens);
    }
}
