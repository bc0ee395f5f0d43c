package com.pagereader.core.correction.engine;

import java.util.List;
import java.util.Objects;

/**
 * Фрагмент, помеченный грамматическим движком.
 * offset/length: позиции символов в точности той строки, что передали в check().
 */
public record GrammarFlag(String category, int offset, int length, List<String> replacements) {
    public GrammarFlag {
        Objects.requireNonNull(category, "category");
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("negative span: offset=" + offset + " length=" + length);
        }
        replacements = replacements == null ? List.of() : List.copyOf(replacements);
    }
}
