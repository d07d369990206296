package org.mediacatalog.util;

import java.util.Arrays;
import java.util.List;

/**
 * Разбор полей, в которых несколько значений записаны через запятую (актеры, страны, жанры).
 */
public final class TokenSplitter {

    private TokenSplitter() {
    }

    public static List<String> split(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
