package com.pagereader.core.correction;

import com.pagereader.core.correction.engine.CapabilityCallException;
import com.pagereader.core.correction.engine.CapabilityGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Проходы в фиксированном порядке: переносы → путаницы OCR → контекст → грамматика → орфография.
 * Каждый проход видит текст после предыдущего. Сбой прохода не останавливает следующие.
 * Хэндлы движков принадлежат конвейеру: закрываются один раз в {@link #close()}.
 */
public final class CorrectionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CorrectionPipeline.class);

    private final CorrectionConfig cfg;
    private final CapabilityGuard guard;
    private final List<CorrectionPass> passes;
    private final boolean grammarAvailable;
    private final boolean spellingAvailable;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CorrectionPipeline(CorrectionConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.guard = new CapabilityGuard(cfg.callTimeoutMs());
        this.grammarAvailable = cfg.grammarChecker() != null;
        this.spellingAvailable = cfg.spellChecker() != null;

        List<CorrectionPass> list = new ArrayList<>();
        if (cfg.hyphenation()) list.add(new HyphenationPass(cfg.letters()));
        if (cfg.confusable()) list.add(new ConfusableCharPass(cfg.confusables()));
        if (cfg.context()) list.add(new ContextPass(cfg.contextPhrases()));
        if (cfg.grammar()) {
            if (grammarAvailable) {
                list.add(new GrammarPass(cfg.grammarChecker(), guard, cfg.grammarCategories(),
                        cfg.grammarConfidence(), cfg.grammarApplyThreshold(), cfg.maxCandidates()));
            } else {
                log.info("Correction: grammar pass disabled, engine unavailable");
            }
        }
        if (cfg.spelling()) {
            if (spellingAvailable) {
                list.add(new SpellingPass(cfg.spellChecker(), guard, cfg.letters(), cfg.maxCandidates()));
            } else {
                log.info("Correction: spelling pass disabled, engine unavailable");
            }
        }
        this.passes = List.copyOf(list);
        log.info("Correction: passes={} callTimeoutMs={}", activePasses(), guard.timeoutMs());
    }

    public boolean grammarAvailable() {
        return grammarAvailable;
    }

    public boolean spellingAvailable() {
        return spellingAvailable;
    }

    public List<IssueKind> activePasses() {
        return passes.stream().map(CorrectionPass::kind).toList();
    }

    public CorrectionConfig config() {
        return cfg;
    }

    public CorrectionResult check(String text) {
        if (closed.get()) {
            throw new IllegalStateException("CorrectionPipeline is closed");
        }
        String original = text == null ? "" : text;
        String current = original;
        List<CorrectionIssue> issues = new ArrayList<>();
        for (CorrectionPass pass : passes) {
            List<CorrectionIssue> found;
            try {
                found = pass.find(current);
            } catch (CapabilityCallException e) {
                log.warn("Correction: {} pass skipped for this text: {}", pass.kind().wireName(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.warn("Correction: {} pass failed: {}", pass.kind().wireName(), e.toString(), e);
                continue;
            }
            if (found.isEmpty()) continue;
            issues.addAll(found);
            current = Substitutions.apply(current, found);
            log.debug("Correction: {} → {} issues", pass.kind().wireName(), found.size());
        }
        log.info("Correction: checked {} chars, {} issues", original.length(), issues.size());
        return new CorrectionResult(original, current, issues);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        // каждый ресурс закрываем отдельно: сбой одного не мешает остальным
        try {
            guard.close();
        } catch (RuntimeException e) {
            log.warn("Correction: guard close failed: {}", e.toString());
        }
        if (cfg.grammarChecker() != null) {
            try {
                cfg.grammarChecker().close();
            } catch (Exception e) {
                log.warn("Correction: grammar engine close failed: {}", e.toString());
            }
        }
        if (cfg.spellChecker() != null) {
            try {
                cfg.spellChecker().close();
            } catch (Exception e) {
                log.warn("Correction: spelling engine close failed: {}", e.toString());
            }
        }
        log.info("Correction: pipeline closed");
    }
}
