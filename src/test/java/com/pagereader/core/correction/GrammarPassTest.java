package com.pagereader.core.correction;

import com.pagereader.core.correction.engine.CapabilityCallException;
import com.pagereader.core.correction.engine.CapabilityGuard;
import com.pagereader.core.correction.engine.GrammarChecker;
import com.pagereader.core.correction.engine.GrammarFlag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GrammarPassTest {
    private static final String TEXT = "Это малако тут";
    private final CapabilityGuard guard = new CapabilityGuard(1_000);

    private static final GrammarChecker CHECKER = text -> List.of(
            new GrammarFlag("TYPOS", 4, 6, List.of("молоко", "малина", "малька", "мало")),
            new GrammarFlag("STYLE", 0, 3, List.of("Этот")),
            new GrammarFlag("GRAMMAR", 11, 3, List.of()),
            new GrammarFlag("TYPOS", 12, 10, List.of("далеко")));

    @AfterEach
    void tearDown() {
        guard.close();
    }

    @Test
    void keeps_only_allowed_categories_with_replacements() {
        GrammarPass pass = new GrammarPass(CHECKER, guard, Set.of("TYPOS", "GRAMMAR"), 0.8, 0.8, 3);
        List<CorrectionIssue> issues = pass.find(TEXT);

        assertEquals(1, issues.size());
        CorrectionIssue i = issues.get(0);
        assertEquals(IssueKind.GRAMMAR, i.kind());
        assertEquals("малако", i.original());
        assertEquals("молоко", i.suggestion());
        assertEquals(List.of("молоко", "малина", "малька"), i.candidates());
        assertEquals(0.8, i.confidence());
    }

    @Test
    void confidence_at_threshold_is_reported_but_not_applied() {
        GrammarPass pass = new GrammarPass(CHECKER, guard, Set.of("TYPOS"), 0.8, 0.8, 3);
        CorrectionIssue i = pass.find(TEXT).get(0);

        assertEquals(ReplacementPolicy.NONE, i.policy());
        assertEquals(TEXT, Substitutions.apply(TEXT, i));
    }

    @Test
    void confidence_above_threshold_is_applied() {
        GrammarPass pass = new GrammarPass(CHECKER, guard, Set.of("TYPOS"), 0.8, 0.5, 3);
        List<CorrectionIssue> issues = pass.find(TEXT);

        assertEquals(ReplacementPolicy.REPLACE_FIRST, issues.get(0).policy());
        assertEquals("Это молоко тут", Substitutions.apply(TEXT, issues));
    }

    @Test
    void engine_failure_surfaces_as_call_exception() {
        GrammarChecker broken = text -> {
            throw new IllegalStateException("engine crashed");
        };
        GrammarPass pass = new GrammarPass(broken, guard, Set.of("TYPOS"), 0.8, 0.8, 3);

        assertThrows(CapabilityCallException.class, () -> pass.find(TEXT));
    }

    @Test
    void hung_engine_times_out() {
        CapabilityGuard quick = new CapabilityGuard(100);
        GrammarChecker slow = text -> {
            Thread.sleep(5_000);
            return List.of();
        };
        try {
            GrammarPass pass = new GrammarPass(slow, quick, Set.of("TYPOS"), 0.8, 0.8, 3);
            assertThrows(CapabilityCallException.class, () -> pass.find(TEXT));
        } finally {
            quick.close();
        }
    }
}
