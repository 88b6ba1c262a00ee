package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.errorsor.ErrorsOr;

import java.util.List;

/**
 * Supplies the words to build a graph from: trimmed, non-empty lines. Where they come from is
 * the implementation's business; failing to read them is an error value, not an exception.
 */
@FunctionalInterface
public interface WordSource {

    ErrorsOr<List<String>> lines();

    static WordSource of(List<String> words) {
        List<String> lines = cleanLines(words);
        return () -> ErrorsOr.lift(lines);
    }

    /** Strips each line (and a leading byte order mark) and drops the blank ones. */
    static List<String> cleanLines(List<String> raw) {
        return raw.stream().map(WordSource::stripBom).map(String::strip).filter(s -> !s.isEmpty()).toList();
    }

    private static String stripBom(String s) {
        return (!s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
    }
}
