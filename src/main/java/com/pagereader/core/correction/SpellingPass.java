package com.pagereader.core.correction;

import com.pagereader.core.correction.engine.CapabilityGuard;
import com.pagereader.core.correction.engine.SpellChecker;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Орфография через внешний словарь: слова целевого алфавита → unknown() → первый кандидат.
 * Замена первого вхождения.
 */
public final class SpellingPass implements CorrectionPass {
    private final SpellChecker checker;
    private final CapabilityGuard guard;
    private final Pattern word;
    private final int maxCandidates;

    public SpellingPass(SpellChecker checker, CapabilityGuard guard, String letters, int maxCandidates) {
        this.checker = Objects.requireNonNull(checker, "checker");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.word = Pattern.compile("\\b[" + letters + "]+\\b", Pattern.UNICODE_CHARACTER_CLASS);
        this.maxCandidates = Math.max(1, maxCandidates);
    }

    @Override
    public IssueKind kind() {
        return IssueKind.SPELLING;
    }

    @Override
    public List<CorrectionIssue> find(String text) {
        // порядок первого появления в тексте
        Set<String> words = new LinkedHashSet<>();
        Matcher m = word.matcher(text);
        while (m.find()) words.add(m.group());
        if (words.isEmpty()) return List.of();

        Set<String> unknown = guard.call("spelling lookup", () -> checker.unknown(Set.copyOf(words)));
        if (unknown == null || unknown.isEmpty()) return List.of();

        List<CorrectionIssue> out = new ArrayList<>();
        for (String w : words) {
            if (!unknown.contains(w)) continue;
            List<String> candidates = guard.call("spelling candidates", () -> checker.candidates(w));
            if (candidates == null || candidates.isEmpty()) continue;
            String suggestion = candidates.get(0);
            out.add(new CorrectionIssue(IssueKind.SPELLING, w, suggestion, w,
                    "Spelling: " + w + " → " + suggestion,
                    null, candidates.subList(0, Math.min(maxCandidates, candidates.size())),
                    ReplacementPolicy.REPLACE_FIRST));
        }
        return out;
    }
}
