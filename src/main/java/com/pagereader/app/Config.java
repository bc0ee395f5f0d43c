package com.pagereader.app;

import com.pagereader.core.batch.FolderScanner;
import com.pagereader.core.correction.ConfusableCharPass;
import com.pagereader.core.correction.ContextPass;
import com.pagereader.core.correction.CorrectionConfig;
import com.pagereader.core.correction.HyphenationPass;
import com.pagereader.core.correction.engine.GrammarChecker;
import com.pagereader.core.correction.engine.SpellChecker;
import com.pagereader.core.image.VariantGenerator;
import com.pagereader.core.image.VariantTransform;
import com.pagereader.core.ocr.TesseractTextExtractor;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record Config(Ocr ocr, Preprocess preprocess, Correction correction, Input input, Output output) {
    public record Ocr(String datapath, String languages, int psm, int oem, int dpi,
                      int parallelism, long timeoutMs) {
        public TesseractTextExtractor.Config toExtractorConfig() {
            return new TesseractTextExtractor.Config(datapath, languages, psm, oem, dpi);
        }
    }

    public record Preprocess(List<String> variants,
                             double claheClipLimit, int claheTileGrid,
                             String adaptiveMethod, int adaptiveBlockSize, double adaptiveC,
                             int morphKernel,
                             double denoiseH, int denoiseTemplateWindow, int denoiseSearchWindow) {
        public VariantGenerator.Params toParams() {
            Set<VariantTransform> enabled = EnumSet.noneOf(VariantTransform.class);
            for (String v : variants) enabled.add(VariantTransform.fromTag(v));
            return new VariantGenerator.Params(enabled,
                    claheClipLimit, claheTileGrid,
                    !"mean".equalsIgnoreCase(adaptiveMethod), adaptiveBlockSize, adaptiveC,
                    morphKernel,
                    (float) denoiseH, denoiseTemplateWindow, denoiseSearchWindow);
        }
    }

    public record Correction(boolean hyphenation, boolean confusable, boolean context,
                             boolean grammar, boolean spelling,
                             String language, String letters,
                             Map<String, String> confusables, Map<String, String> contextPhrases,
                             List<String> grammarCategories,
                             double grammarConfidence, double grammarApplyThreshold,
                             int maxCandidates, long callTimeoutMs) {
        public CorrectionConfig toCorrectionConfig(GrammarChecker grammarChecker, SpellChecker spellChecker) {
            return CorrectionConfig.builder()
                    .hyphenation(hyphenation)
                    .confusable(confusable)
                    .context(context)
                    .grammar(grammar)
                    .spelling(spelling)
                    .letters(letters)
                    .confusables(confusables)
                    .contextPhrases(contextPhrases)
                    .grammarCategories(new LinkedHashSet<>(grammarCategories))
                    .grammarConfidence(grammarConfidence)
                    .grammarApplyThreshold(grammarApplyThreshold)
                    .maxCandidates(maxCandidates)
                    .callTimeoutMs(callTimeoutMs)
                    .grammarChecker(grammarChecker)
                    .spellChecker(spellChecker)
                    .build();
        }
    }

    public record Input(List<String> patterns) {}

    public record Output(String dir) {}

    public static Config load() {
        try (InputStream in = Config.class.getResourceAsStream("/application.yaml")) {
            if (in == null) {
                throw new IllegalStateException("application.yaml not found on classpath");
            }
            return load(in);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application.yaml", e);
        }
    }

    /** Любой ключ может отсутствовать: берётся значение по умолчанию. */
    public static Config load(InputStream in) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(in);
        if (root == null) root = Map.of();

        Map<String, Object> ocr = section(root, "ocr");
        Map<String, Object> pre = section(root, "preprocess");
        Map<String, Object> clahe = section(pre, "clahe");
        Map<String, Object> adapt = section(pre, "adaptive");
        Map<String, Object> den = section(pre, "denoise");
        Map<String, Object> cor = section(root, "correction");
        Map<String, Object> grm = section(cor, "grammar");
        Map<String, Object> inp = section(root, "input");
        Map<String, Object> out = section(root, "output");

        List<String> variants = strings(pre.get("variants"),
                EnumSet.allOf(VariantTransform.class).stream().map(VariantTransform::tag).toList());

        return new Config(
                new Ocr(str(ocr, "datapath", "./tessdata"),
                        str(ocr, "languages", "rus+eng"),
                        num(ocr, "psm", 3).intValue(),
                        num(ocr, "oem", 1).intValue(),
                        num(ocr, "dpi", 300).intValue(),
                        num(ocr, "parallelism", 1).intValue(),
                        num(ocr, "timeoutMs", 60_000).longValue()),
                new Preprocess(variants,
                        num(clahe, "clipLimit", 3.0).doubleValue(),
                        num(clahe, "tileGrid", 8).intValue(),
                        str(adapt, "method", "gaussian"),
                        num(adapt, "blockSize", 11).intValue(),
                        num(adapt, "c", 2).doubleValue(),
                        num(pre, "morphKernel", 2).intValue(),
                        num(den, "h", 10).doubleValue(),
                        num(den, "templateWindow", 7).intValue(),
                        num(den, "searchWindow", 21).intValue()),
                new Correction(bool(cor, "hyphenation", true),
                        bool(cor, "confusable", true),
                        bool(cor, "context", true),
                        bool(grm, "enabled", true),
                        bool(section(cor, "spelling"), "enabled", true),
                        str(cor, "language", "ru"),
                        str(cor, "letters", HyphenationPass.DEFAULT_LETTERS),
                        stringMap(cor.get("confusables"), ConfusableCharPass.DEFAULT_MAPPING),
                        stringMap(cor.get("contextPhrases"), ContextPass.DEFAULT_PHRASES),
                        strings(grm.get("categories"), List.of("TYPOS", "GRAMMAR")),
                        num(grm, "confidence", 0.8).doubleValue(),
                        num(grm, "applyThreshold", 0.8).doubleValue(),
                        num(cor, "maxCandidates", 3).intValue(),
                        num(cor, "callTimeoutMs", 30_000).longValue()),
                new Input(strings(inp.get("patterns"), FolderScanner.DEFAULT_PATTERNS)),
                new Output(System.getProperty("pr.output.dir", str(out, "dir", "output")))
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object v = parent.get(key);
        return v instanceof Map ? (Map<String, Object>) v : Map.of();
    }

    private static Number num(Map<String, Object> m, String key, Number def) {
        Object v = m.get(key);
        return v instanceof Number n ? n : def;
    }

    private static String str(Map<String, Object> m, String key, String def) {
        Object v = m.get(key);
        return v != null ? String.valueOf(v) : def;
    }

    private static boolean bool(Map<String, Object> m, String key, boolean def) {
        Object v = m.get(key);
        return v instanceof Boolean b ? b : def;
    }

    private static List<String> strings(Object v, List<String> def) {
        if (!(v instanceof List<?> list)) return def;
        return list.stream().map(String::valueOf).toList();
    }

    /** Ключи YAML вроде 0 или 1 приходят числами: приводим к строке. */
    private static Map<String, String> stringMap(Object v, Map<String, String> def) {
        if (!(v instanceof Map<?, ?> map)) return def;
        Map<String, String> out = new LinkedHashMap<>();
        map.forEach((k, val) -> out.put(String.valueOf(k), val == null ? "" : String.valueOf(val)));
        return out;
    }
}
