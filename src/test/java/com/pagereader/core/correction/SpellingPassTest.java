package com.pagereader.core.correction;

import com.pagereader.core.correction.engine.CapabilityGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SpellingPassTest {
    private final CapabilityGuard guard = new CapabilityGuard(1_000);

    @AfterEach
    void tearDown() {
        guard.close();
    }

    @Test
    void flags_each_unknown_word_once_and_fixes_first_occurrence() {
        FakeSpellChecker checker = new FakeSpellChecker().with("малоко", "молоко", "малолко", "малость", "мало");
        SpellingPass pass = new SpellingPass(checker, guard, HyphenationPass.DEFAULT_LETTERS, 3);

        String text = "малоко и малоко хлеб";
        List<CorrectionIssue> issues = pass.find(text);

        assertEquals(1, issues.size());
        CorrectionIssue i = issues.get(0);
        assertEquals(IssueKind.SPELLING, i.kind());
        assertEquals("малоко", i.original());
        assertEquals("молоко", i.suggestion());
        assertEquals(3, i.candidates().size());
        assertNull(i.confidence());
        assertEquals(ReplacementPolicy.REPLACE_FIRST, i.policy());
        assertEquals("молоко и малоко хлеб", Substitutions.apply(text, issues));
    }

    @Test
    void only_words_of_configured_alphabet_are_looked_up() {
        FakeSpellChecker checker = new FakeSpellChecker();
        SpellingPass pass = new SpellingPass(checker, guard, HyphenationPass.DEFAULT_LETTERS, 3);

        pass.find("hello мир, 42 мир");

        assertEquals(1, checker.lookups.size());
        assertEquals(Set.of("мир"), checker.lookups.get(0));
    }

    @Test
    void unknown_word_without_candidates_is_skipped() {
        FakeSpellChecker checker = new FakeSpellChecker().with("ыыы");
        SpellingPass pass = new SpellingPass(checker, guard, HyphenationPass.DEFAULT_LETTERS, 3);

        assertTrue(pass.find("ыыы").isEmpty());
    }

    @Test
    void text_without_words_skips_engine() {
        FakeSpellChecker checker = new FakeSpellChecker();
        SpellingPass pass = new SpellingPass(checker, guard, HyphenationPass.DEFAULT_LETTERS, 3);

        assertTrue(pass.find("123 ...").isEmpty());
        assertTrue(checker.lookups.isEmpty());
    }
}
