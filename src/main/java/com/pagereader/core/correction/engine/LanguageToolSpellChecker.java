package com.pagereader.core.correction.engine;

import org.languagetool.JLanguageTool;
import org.languagetool.Language;
import org.languagetool.Languages;
import org.languagetool.rules.Rule;
import org.languagetool.rules.RuleMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Словарная проверка через LanguageTool: включены только словарные правила орфографии,
 * слово проверяется отдельно.
 */
public final class LanguageToolSpellChecker implements SpellChecker {
    private static final Logger log = LoggerFactory.getLogger(LanguageToolSpellChecker.class);

    private final JLanguageTool lt;
    private final String languageCode;

    /** @throws CapabilityUnavailableException язык не найден или нет словарного правила */
    public LanguageToolSpellChecker(String languageCode) {
        this.languageCode = languageCode;
        try {
            Language lang = Languages.getLanguageForShortCode(languageCode);
            this.lt = new JLanguageTool(lang);
            int spelling = 0;
            for (Rule r : lt.getAllRules()) {
                if (r.isDictionaryBasedSpellingRule()) spelling++;
                else lt.disableRule(r.getId());
            }
            if (spelling == 0) {
                throw new IllegalStateException("no dictionary-based spelling rule");
            }
            lt.check("проверка");
        } catch (IOException | RuntimeException e) {
            throw new CapabilityUnavailableException("LanguageTool speller init failed for '" + languageCode + "'", e);
        }
        log.info("Spelling: LanguageTool ready, language={}", languageCode);
    }

    @Override
    public synchronized Set<String> unknown(Set<String> words) throws IOException {
        Set<String> out = new LinkedHashSet<>();
        for (String w : words) {
            if (!lt.check(w).isEmpty()) out.add(w);
        }
        return out;
    }

    @Override
    public synchronized List<String> candidates(String word) throws IOException {
        List<RuleMatch> matches = lt.check(word);
        for (RuleMatch m : matches) {
            List<String> s = m.getSuggestedReplacements();
            if (!s.isEmpty()) return List.copyOf(s);
        }
        return List.of();
    }

    @Override
    public void close() {
        log.info("Spelling: LanguageTool released, language={}", languageCode);
    }
}
