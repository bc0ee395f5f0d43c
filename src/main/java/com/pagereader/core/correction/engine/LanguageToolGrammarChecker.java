package com.pagereader.core.correction.engine;

import org.languagetool.JLanguageTool;
import org.languagetool.Language;
import org.languagetool.Languages;
import org.languagetool.rules.RuleMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Грамматика через локальный LanguageTool. JLanguageTool не потокобезопасен: доступ синхронизирован. */
public final class LanguageToolGrammarChecker implements GrammarChecker {
    private static final Logger log = LoggerFactory.getLogger(LanguageToolGrammarChecker.class);

    private final JLanguageTool lt;
    private final String languageCode;

    /**
     * @param languageCode короткий код, напр. "ru"
     * @throws CapabilityUnavailableException язык не найден или движок не поднялся
     */
    public LanguageToolGrammarChecker(String languageCode) {
        this.languageCode = languageCode;
        try {
            Language lang = Languages.getLanguageForShortCode(languageCode);
            this.lt = new JLanguageTool(lang);
            // прогрев: словари и правила грузятся лениво, ошибки загрузки ловим сразу
            lt.check("Проверка.");
        } catch (IOException | RuntimeException e) {
            throw new CapabilityUnavailableException("LanguageTool grammar init failed for '" + languageCode + "'", e);
        }
        log.info("Grammar: LanguageTool ready, language={}", languageCode);
    }

    @Override
    public synchronized List<GrammarFlag> check(String text) throws IOException {
        List<RuleMatch> matches = lt.check(text);
        List<GrammarFlag> out = new ArrayList<>(matches.size());
        for (RuleMatch m : matches) {
            String category = m.getRule().getCategory().getId().toString();
            out.add(new GrammarFlag(category, m.getFromPos(), m.getToPos() - m.getFromPos(),
                    m.getSuggestedReplacements()));
        }
        return out;
    }

    @Override
    public void close() {
        log.info("Grammar: LanguageTool released, language={}", languageCode);
    }
}
