package com.pagereader.app;

import com.pagereader.core.correction.CorrectionConfig;
import com.pagereader.core.image.VariantGenerator;
import com.pagereader.core.image.VariantTransform;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    private static Config yaml(String text) {
        return Config.load(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void bundled_config_loads() {
        Config c = Config.load();

        assertEquals("rus+eng", c.ocr().languages());
        assertEquals(3, c.ocr().psm());
        assertEquals(7, c.preprocess().variants().size());
        assertEquals("ru", c.correction().language());
        // ключ 0 в YAML без кавычек тоже строка
        assertEquals("О", c.correction().confusables().get("0"));
        assertEquals("в нес", c.correction().contextPhrases().keySet().iterator().next());
        assertEquals(List.of("TYPOS", "GRAMMAR"), c.correction().grammarCategories());
        assertEquals(List.of("*.jpg", "*.jpeg", "*.png", "*.bmp", "*.gif"), c.input().patterns());
    }

    @Test
    void empty_document_gives_defaults() {
        Config c = yaml("");

        assertEquals("./tessdata", c.ocr().datapath());
        assertEquals(1, c.ocr().parallelism());
        assertEquals(11, c.preprocess().adaptiveBlockSize());
        assertTrue(c.correction().grammar());
        assertEquals(0.8, c.correction().grammarApplyThreshold());
        assertEquals(4, c.correction().confusables().size());
        assertFalse(c.correction().contextPhrases().isEmpty());
    }

    @Test
    void partial_document_overrides_only_given_keys() {
        Config c = yaml("""
                ocr:
                  languages: rus
                  parallelism: 4
                preprocess:
                  variants: [otsu, sharpen]
                  adaptive:
                    method: mean
                correction:
                  grammar:
                    enabled: false
                  confusables:
                    0: "О"
                """);

        assertEquals("rus", c.ocr().languages());
        assertEquals(4, c.ocr().parallelism());
        assertEquals(1, c.ocr().oem());
        assertFalse(c.correction().grammar());
        assertTrue(c.correction().spelling());
        assertEquals(1, c.correction().confusables().size());
        assertEquals("О", c.correction().confusables().get("0"));

        VariantGenerator.Params p = c.preprocess().toParams();
        assertEquals(EnumSet.of(VariantTransform.GRAYSCALE, VariantTransform.OTSU, VariantTransform.SHARPEN),
                p.enabled());
        assertFalse(p.adaptiveGaussian());
    }

    @Test
    void correction_section_maps_to_pipeline_config() {
        CorrectionConfig cc = yaml("correction:\n  maxCandidates: 5\n  callTimeoutMs: 100\n")
                .correction().toCorrectionConfig(null, null);

        assertEquals(5, cc.maxCandidates());
        assertEquals(100, cc.callTimeoutMs());
        assertNull(cc.grammarChecker());
        assertTrue(cc.hyphenation());
    }
}
