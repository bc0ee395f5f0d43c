package com.pagereader.core.correction;

import java.util.List;

/**
 * Единственное место, где меняется текст. Замена по подстроке, без учёта позиции срабатывания.
 */
public final class Substitutions {
    private Substitutions() {}

    /** Применяет замечания по очереди, каждое к результату предыдущего. */
    public static String apply(String text, List<CorrectionIssue> issues) {
        String out = text;
        for (CorrectionIssue issue : issues) {
            out = apply(out, issue);
        }
        return out;
    }

    public static String apply(String text, CorrectionIssue issue) {
        String from = issue.original();
        if (from.isEmpty()) return text;
        return switch (issue.policy()) {
            case REPLACE_ALL -> text.replace(from, issue.suggestion());
            case REPLACE_FIRST -> replaceFirst(text, from, issue.suggestion());
            case NONE -> text;
        };
    }

    static String replaceFirst(String text, String from, String to) {
        int at = text.indexOf(from);
        if (at < 0) return text;
        return text.substring(0, at) + to + text.substring(at + from.length());
    }
}
