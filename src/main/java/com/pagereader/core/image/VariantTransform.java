package com.pagereader.core.image;

import java.util.Locale;

/** Преобразования в фиксированном порядке генерации. Порядок объявления = порядок вариантов. */
public enum VariantTransform {
    GRAYSCALE,
    CLAHE,
    OTSU,
    ADAPTIVE,
    MORPH_CLOSE,
    DENOISE,
    SHARPEN;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "morph_close", "Morph-Close" → MORPH_CLOSE. */
    public static VariantTransform fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("empty transform tag");
        }
        String norm = tag.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(norm);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown transform: " + tag, e);
        }
    }
}
