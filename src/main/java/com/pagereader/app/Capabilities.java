package com.pagereader.app;

import com.pagereader.core.correction.engine.CapabilityUnavailableException;
import com.pagereader.core.correction.engine.GrammarChecker;
import com.pagereader.core.correction.engine.LanguageToolGrammarChecker;
import com.pagereader.core.correction.engine.LanguageToolSpellChecker;
import com.pagereader.core.correction.engine.SpellChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Доступность внешних движков, вычисленная один раз при старте.
 * null = движок выключен в конфиге или не поднялся.
 */
public record Capabilities(GrammarChecker grammar, SpellChecker spelling) {
    private static final Logger log = LoggerFactory.getLogger(Capabilities.class);

    public static final Capabilities NONE = new Capabilities(null, null);

    public boolean grammarAvailable() {
        return grammar != null;
    }

    public boolean spellingAvailable() {
        return spelling != null;
    }

    public static Capabilities load(Config.Correction cfg) {
        GrammarChecker g = null;
        if (cfg.grammar()) {
            try {
                g = new LanguageToolGrammarChecker(cfg.language());
            } catch (CapabilityUnavailableException | LinkageError e) {
                log.warn("Grammar engine unavailable: {}", rootMessage(e));
            }
        }
        SpellChecker s = null;
        if (cfg.spelling()) {
            try {
                s = new LanguageToolSpellChecker(cfg.language());
            } catch (CapabilityUnavailableException | LinkageError e) {
                log.warn("Spelling engine unavailable: {}", rootMessage(e));
            }
        }
        return new Capabilities(g, s);
    }

    private static String rootMessage(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null && c.getCause() != c) c = c.getCause();
        return c == t ? t.toString() : t.getMessage() + " (" + c + ")";
    }
}
