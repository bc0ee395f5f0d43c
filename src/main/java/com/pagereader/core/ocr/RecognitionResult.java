package com.pagereader.core.ocr;

import java.util.Objects;

/** Победивший вариант и его текст (уже trimmed). */
public record RecognitionResult(String variantTag, String text) {
    public static final RecognitionResult EMPTY = new RecognitionResult("none", "");

    public RecognitionResult {
        Objects.requireNonNull(variantTag, "variantTag");
        text = text == null ? "" : text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /** Длина в кодовых точках. */
    public int length() {
        return text.codePointCount(0, text.length());
    }
}
