package com.pagereader.core.pipeline;

import java.util.regex.Pattern;

/** characters: кодовые точки текста; words: токены между пробельными символами. */
public record TextStatistics(int characters, int words) {
    private static final Pattern WS = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public static final TextStatistics EMPTY = new TextStatistics(0, 0);

    public static TextStatistics of(String text) {
        if (text == null || text.isEmpty()) return EMPTY;
        int chars = text.codePointCount(0, text.length());
        int words = 0;
        for (String token : WS.split(text)) {
            if (!token.isEmpty()) words++;
        }
        return new TextStatistics(chars, words);
    }
}
