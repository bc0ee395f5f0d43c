package com.pagereader.core.correction;

import java.util.List;
import java.util.Objects;

/**
 * Одно замечание одного прохода.
 *
 * @param original    подстрока, которую заменяем
 * @param suggestion  замена
 * @param matchedSpan фрагмент, на котором сработало правило (для переносов "р-\nн")
 * @param confidence  null, если проход уверенность не выставляет
 * @param candidates  варианты замены по убыванию, может быть пустым
 */
public record CorrectionIssue(IssueKind kind,
                              String original,
                              String suggestion,
                              String matchedSpan,
                              String description,
                              Double confidence,
                              List<String> candidates,
                              ReplacementPolicy policy) {

    public CorrectionIssue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(suggestion, "suggestion");
        Objects.requireNonNull(policy, "policy");
        matchedSpan = matchedSpan == null ? original : matchedSpan;
        description = description == null ? "" : description;
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    /** Замечание без уверенности и кандидатов. */
    public static CorrectionIssue of(IssueKind kind, String original, String suggestion,
                                     String matchedSpan, String description, ReplacementPolicy policy) {
        return new CorrectionIssue(kind, original, suggestion, matchedSpan, description, null, List.of(), policy);
    }

    public boolean applied() {
        return policy != ReplacementPolicy.NONE;
    }
}
