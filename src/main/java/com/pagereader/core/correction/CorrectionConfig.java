package com.pagereader.core.correction;

import com.pagereader.core.correction.engine.GrammarChecker;
import com.pagereader.core.correction.engine.SpellChecker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Неизменяемая конфигурация конвейера: переключатели проходов, таблицы, пороги и хэндлы движков.
 * Хэндл null = движок недоступен, проход отключён на всё время жизни конвейера.
 */
public record CorrectionConfig(boolean hyphenation,
                               boolean confusable,
                               boolean context,
                               boolean grammar,
                               boolean spelling,
                               String letters,
                               Map<String, String> confusables,
                               Map<String, String> contextPhrases,
                               Set<String> grammarCategories,
                               double grammarConfidence,
                               double grammarApplyThreshold,
                               int maxCandidates,
                               long callTimeoutMs,
                               GrammarChecker grammarChecker,
                               SpellChecker spellChecker) {

    public CorrectionConfig {
        Objects.requireNonNull(letters, "letters");
        // порядок таблиц важен: замены применяются по очереди
        confusables = Collections.unmodifiableMap(new LinkedHashMap<>(confusables));
        contextPhrases = Collections.unmodifiableMap(new LinkedHashMap<>(contextPhrases));
        grammarCategories = Collections.unmodifiableSet(new LinkedHashSet<>(grammarCategories));
        maxCandidates = Math.max(1, maxCandidates);
        callTimeoutMs = Math.max(0, callTimeoutMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Все проходы включены, встроенные таблицы, движков нет. */
    public static CorrectionConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.hyphenation = hyphenation;
        b.confusable = confusable;
        b.context = context;
        b.grammar = grammar;
        b.spelling = spelling;
        b.letters = letters;
        b.confusables = confusables;
        b.contextPhrases = contextPhrases;
        b.grammarCategories = grammarCategories;
        b.grammarConfidence = grammarConfidence;
        b.grammarApplyThreshold = grammarApplyThreshold;
        b.maxCandidates = maxCandidates;
        b.callTimeoutMs = callTimeoutMs;
        b.grammarChecker = grammarChecker;
        b.spellChecker = spellChecker;
        return b;
    }

    public static final class Builder {
        private boolean hyphenation = true;
        private boolean confusable = true;
        private boolean context = true;
        private boolean grammar = true;
        private boolean spelling = true;
        private String letters = HyphenationPass.DEFAULT_LETTERS;
        private Map<String, String> confusables = ConfusableCharPass.DEFAULT_MAPPING;
        private Map<String, String> contextPhrases = ContextPass.DEFAULT_PHRASES;
        private Set<String> grammarCategories = Set.of("TYPOS", "GRAMMAR");
        private double grammarConfidence = 0.8;
        private double grammarApplyThreshold = 0.8;
        private int maxCandidates = 3;
        private long callTimeoutMs = 30_000;
        private GrammarChecker grammarChecker;
        private SpellChecker spellChecker;

        private Builder() {}

        public Builder hyphenation(boolean on) { this.hyphenation = on; return this; }
        public Builder confusable(boolean on) { this.confusable = on; return this; }
        public Builder context(boolean on) { this.context = on; return this; }
        public Builder grammar(boolean on) { this.grammar = on; return this; }
        public Builder spelling(boolean on) { this.spelling = on; return this; }
        public Builder letters(String letters) { this.letters = letters; return this; }
        public Builder confusables(Map<String, String> m) { this.confusables = m; return this; }
        public Builder contextPhrases(Map<String, String> m) { this.contextPhrases = m; return this; }
        public Builder grammarCategories(Set<String> c) { this.grammarCategories = c; return this; }
        public Builder grammarConfidence(double v) { this.grammarConfidence = v; return this; }
        public Builder grammarApplyThreshold(double v) { this.grammarApplyThreshold = v; return this; }
        public Builder maxCandidates(int n) { this.maxCandidates = n; return this; }
        public Builder callTimeoutMs(long ms) { this.callTimeoutMs = ms; return this; }
        public Builder grammarChecker(GrammarChecker c) { this.grammarChecker = c; return this; }
        public Builder spellChecker(SpellChecker c) { this.spellChecker = c; return this; }

        public CorrectionConfig build() {
            return new CorrectionConfig(hyphenation, confusable, context, grammar, spelling,
                    letters, confusables, contextPhrases, grammarCategories,
                    grammarConfidence, grammarApplyThreshold, maxCandidates, callTimeoutMs,
                    grammarChecker, spellChecker);
        }
    }
}
