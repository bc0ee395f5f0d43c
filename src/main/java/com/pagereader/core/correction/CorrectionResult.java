package com.pagereader.core.correction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Итог одного прогона конвейера: исходный текст, исправленный текст, замечания в порядке проходов. */
public record CorrectionResult(String originalText, String correctedText, List<CorrectionIssue> issues) {

    public CorrectionResult {
        Objects.requireNonNull(originalText, "originalText");
        Objects.requireNonNull(correctedText, "correctedText");
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public int issueCount() {
        return issues.size();
    }

    /** Все виды присутствуют, ноль где замечаний нет. */
    public Map<IssueKind, Integer> countsByKind() {
        Map<IssueKind, Integer> counts = new EnumMap<>(IssueKind.class);
        for (IssueKind k : IssueKind.values()) counts.put(k, 0);
        for (CorrectionIssue i : issues) counts.merge(i.kind(), 1, Integer::sum);
        return Collections.unmodifiableMap(counts);
    }

    public List<CorrectionIssue> issuesOf(IssueKind kind) {
        return issues.stream().filter(i -> i.kind() == kind).toList();
    }

    public boolean changed() {
        return !originalText.equals(correctedText);
    }
}
