package com.pagereader.core.correction;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubstitutionsTest {

    private static CorrectionIssue issue(String from, String to, ReplacementPolicy policy) {
        return CorrectionIssue.of(IssueKind.SPELLING, from, to, from, "", policy);
    }

    @Test
    void replace_all_hits_every_occurrence() {
        assertEquals("b b b", Substitutions.apply("a a a", issue("a", "b", ReplacementPolicy.REPLACE_ALL)));
    }

    @Test
    void replace_first_hits_only_first() {
        assertEquals("b a a", Substitutions.apply("a a a", issue("a", "b", ReplacementPolicy.REPLACE_FIRST)));
        assertEquals("x", Substitutions.replaceFirst("x", "y", "z"));
    }

    @Test
    void none_and_empty_original_are_noops() {
        assertEquals("a a", Substitutions.apply("a a", issue("a", "b", ReplacementPolicy.NONE)));
        assertEquals("a a", Substitutions.apply("a a", issue("", "b", ReplacementPolicy.REPLACE_ALL)));
        assertFalse(issue("a", "b", ReplacementPolicy.NONE).applied());
    }

    @Test
    void issues_apply_in_order() {
        String out = Substitutions.apply("ab", List.of(
                issue("a", "b", ReplacementPolicy.REPLACE_ALL),
                issue("bb", "c", ReplacementPolicy.REPLACE_ALL)));
        assertEquals("c", out);
    }

    @Test
    void confidence_outside_unit_range_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new CorrectionIssue(IssueKind.GRAMMAR,
                "a", "b", "a", "", 1.5, List.of(), ReplacementPolicy.NONE));
    }
}
