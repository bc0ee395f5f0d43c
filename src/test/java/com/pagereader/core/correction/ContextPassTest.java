package com.pagereader.core.correction;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextPassTest {
    private final ContextPass pass = new ContextPass();

    @Test
    void fixes_known_phrase() {
        String text = "Я смотрю в нес";
        List<CorrectionIssue> issues = pass.find(text);

        assertEquals(1, issues.size());
        assertEquals(IssueKind.CONTEXT, issues.get(0).kind());
        assertEquals("в нес", issues.get(0).original());
        assertEquals("в нее", issues.get(0).suggestion());
        assertEquals("Я смотрю в нее", Substitutions.apply(text, issues));
    }

    @Test
    void match_ignores_case_and_keeps_matched_text_as_original() {
        List<CorrectionIssue> issues = pass.find("В НЕС");

        assertEquals(1, issues.size());
        assertEquals("В НЕС", issues.get(0).original());
        assertEquals("в нее", Substitutions.apply("В НЕС", issues));
    }

    @Test
    void every_occurrence_is_reported() {
        ContextPass p = new ContextPass(Map.of("кнам", "к нам"));
        assertEquals(2, p.find("кнам и снова кнам").size());
    }

    @Test
    void short_rule_also_matches_inside_words() {
        List<CorrectionIssue> issues = pass.find("Привет всем");

        assertEquals(1, issues.size());
        assertEquals("ве", issues.get(0).original());
        assertEquals("Приеёт всем", Substitutions.apply("Привет всем", issues));
    }

    @Test
    void rule_table_is_configurable() {
        assertTrue(new ContextPass(Map.of("в нес", "в нее")).find("Привет всем").isEmpty());
    }
}
