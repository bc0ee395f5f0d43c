package com.pagereader.core.correction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Склейка переносов: "чер-\nный" → "черный".
 * Ищет "буква, дефис, перевод строки, буква" и расширяет до целого слова в обе стороны.
 */
public final class HyphenationPass implements CorrectionPass {
    /** Кириллица по умолчанию. */
    public static final String DEFAULT_LETTERS = "а-яёА-ЯЁ";

    private final Pattern pattern;

    public HyphenationPass() {
        this(DEFAULT_LETTERS);
    }

    /** @param letters содержимое символьного класса regex, напр. "а-яёА-ЯЁ" */
    public HyphenationPass(String letters) {
        String cls = "[" + letters + "]";
        this.pattern = Pattern.compile("(" + cls + ")-\n(" + cls + ")");
    }

    @Override
    public IssueKind kind() {
        return IssueKind.HYPHENATION;
    }

    @Override
    public List<CorrectionIssue> find(String text) {
        List<CorrectionIssue> out = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            int start = m.start();
            int end = m.end();

            int wordStart = start;
            while (wordStart > 0 && Character.isLetter(text.charAt(wordStart - 1))) wordStart--;
            int wordEnd = end;
            while (wordEnd < text.length() && Character.isLetter(text.charAt(wordEnd))) wordEnd++;

            String fullOriginal = text.substring(wordStart, wordEnd);
            String fullSuggestion = text.substring(wordStart, start)
                    + m.group(1) + m.group(2)
                    + text.substring(end, wordEnd);

            out.add(CorrectionIssue.of(IssueKind.HYPHENATION, fullOriginal, fullSuggestion, m.group(),
                    "Hyphenation: \"" + fullOriginal + "\" → \"" + fullSuggestion + "\"",
                    ReplacementPolicy.REPLACE_ALL));
        }
        return out;
    }
}
