package com.pagereader.core.correction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Типичные путаницы OCR: цифры и латиница на месте похожих кириллических букв.
 * Одно замечание на каждый различающийся токен; меняются только символы из таблицы.
 */
public final class ConfusableCharPass implements CorrectionPass {
    /** 0→О, 1→І, 3→З, l→і (справа кириллица). */
    public static final Map<String, String> DEFAULT_MAPPING;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("0", "О");
        m.put("1", "І");
        m.put("3", "З");
        m.put("l", "і");
        DEFAULT_MAPPING = Collections.unmodifiableMap(m);
    }

    private static final Pattern TOKEN = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<Integer, String> mapping;

    public ConfusableCharPass() {
        this(DEFAULT_MAPPING);
    }

    /** @param mapping ключ: ровно один символ */
    public ConfusableCharPass(Map<String, String> mapping) {
        Map<Integer, String> cp = new LinkedHashMap<>();
        mapping.forEach((from, to) -> {
            if (from == null || from.codePointCount(0, from.length()) != 1) {
                throw new IllegalArgumentException("confusable key must be a single character: '" + from + "'");
            }
            cp.put(from.codePointAt(0), to == null ? "" : to);
        });
        this.mapping = Map.copyOf(cp);
    }

    @Override
    public IssueKind kind() {
        return IssueKind.CONFUSABLE_CHAR;
    }

    @Override
    public List<CorrectionIssue> find(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) tokens.add(m.group());

        List<CorrectionIssue> out = new ArrayList<>();
        for (String token : tokens) {
            String fixed = substitute(token);
            if (!fixed.equals(token)) {
                out.add(CorrectionIssue.of(IssueKind.CONFUSABLE_CHAR, token, fixed, token,
                        "OCR confusable: " + token + " → " + fixed, ReplacementPolicy.REPLACE_ALL));
            }
        }
        return out;
    }

    String substitute(String token) {
        StringBuilder sb = new StringBuilder(token.length());
        token.codePoints().forEach(c -> {
            String to = mapping.get(c);
            if (to != null) sb.append(to);
            else sb.appendCodePoint(c);
        });
        return sb.toString();
    }
}
