package com.pagereader.core.correction;

import com.pagereader.core.correction.engine.CapabilityGuard;
import com.pagereader.core.correction.engine.GrammarChecker;
import com.pagereader.core.correction.engine.GrammarFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Грамматика через внешний движок. Берутся только категории из списка (по умолчанию TYPOS, GRAMMAR).
 * Уверенность фиксированная; замена применяется к первому вхождению и только если уверенность выше порога.
 */
public final class GrammarPass implements CorrectionPass {
    private static final Logger log = LoggerFactory.getLogger(GrammarPass.class);

    private final GrammarChecker checker;
    private final CapabilityGuard guard;
    private final Set<String> categories;
    private final double confidence;
    private final double applyThreshold;
    private final int maxCandidates;

    public GrammarPass(GrammarChecker checker, CapabilityGuard guard, Set<String> categories,
                       double confidence, double applyThreshold, int maxCandidates) {
        this.checker = Objects.requireNonNull(checker, "checker");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.categories = Set.copyOf(categories);
        this.confidence = confidence;
        this.applyThreshold = applyThreshold;
        this.maxCandidates = Math.max(1, maxCandidates);
    }

    @Override
    public IssueKind kind() {
        return IssueKind.GRAMMAR;
    }

    @Override
    public List<CorrectionIssue> find(String text) {
        List<GrammarFlag> flags = guard.call("grammar check", () -> checker.check(text));
        if (flags == null) return List.of();

        ReplacementPolicy policy = confidence > applyThreshold
                ? ReplacementPolicy.REPLACE_FIRST
                : ReplacementPolicy.NONE;
        List<CorrectionIssue> out = new ArrayList<>();
        for (GrammarFlag f : flags) {
            if (!categories.contains(f.category()) || f.replacements().isEmpty()) continue;
            int end = f.offset() + f.length();
            if (end > text.length()) {
                log.debug("Correction: grammar flag outside text, skipped: {}", f);
                continue;
            }
            String original = text.substring(f.offset(), end);
            String suggestion = f.replacements().get(0);
            List<String> candidates = f.replacements().subList(0, Math.min(maxCandidates, f.replacements().size()));
            out.add(new CorrectionIssue(IssueKind.GRAMMAR, original, suggestion, original,
                    "Grammar [" + f.category() + "]: \"" + original + "\" → \"" + suggestion + "\"",
                    confidence, candidates, policy));
        }
        return out;
    }
}
