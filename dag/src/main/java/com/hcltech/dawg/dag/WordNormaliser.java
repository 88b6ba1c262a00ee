package com.hcltech.dawg.dag;

import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.util.Locale;

/**
 * The single place the word policy lives: surrounding whitespace is trimmed, case is folded to
 * lower case using {@link Locale#ROOT}, and empty or blank words are rejected. Words that differ
 * only in case are the same word.
 */
public final class WordNormaliser {
    private WordNormaliser() {}

    public static ErrorsOr<String> normalise(String raw) {
        if (raw == null) return ErrorsOr.error("Word is null");
        String trimmed = raw.strip();
        if (trimmed.isEmpty()) return ErrorsOr.error("Word is empty: '" + raw + "'");
        return ErrorsOr.lift(trimmed.toLowerCase(Locale.ROOT));
    }
}
