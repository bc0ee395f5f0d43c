package com.pagereader.core.ocr;

import com.pagereader.core.image.ImageVariant;
import com.pagereader.core.image.Rasters;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * OCR страницы через Tess4J.
 * Инициализация через datapath (каталог tessdata) и languages (напр. "rus+eng").
 * Переводы строк сохраняются: по ним работает склейка переносов.
 */
public final class TesseractTextExtractor implements TextExtractor {
    private static final Logger log = LoggerFactory.getLogger(TesseractTextExtractor.class);

    public static final class Config {
        public final String datapath;  // путь к каталогу с *.traineddata
        public final String languages; // "rus+eng"
        public final int psm;          // Page Segmentation Mode
        public final int oem;          // OCR Engine Mode
        public final int dpi;

        public Config(String datapath, String languages, int psm, int oem, int dpi) {
            this.datapath = datapath;
            this.languages = Objects.requireNonNull(languages, "languages");
            this.psm = psm;
            this.oem = oem;
            this.dpi = dpi;
        }
    }

    private final Path datapath;
    private final String languages;
    private final int psm;
    private final int oem;
    private final int dpi;
    // Tesseract не потокобезопасен: по экземпляру на воркер
    private final ThreadLocal<Tesseract> tess = ThreadLocal.withInitial(this::newTesseract);

    public TesseractTextExtractor(Config cfg) {
        // Путь к tessdata: -Dpr.ocr.tessdataDir → cfg.datapath → ENV TESSDATA_PREFIX
        String overrideDir = System.getProperty("pr.ocr.tessdataDir");
        String dir = (overrideDir != null && !overrideDir.isBlank()) ? overrideDir : cfg.datapath;
        if (dir == null || dir.isBlank()) dir = System.getenv("TESSDATA_PREFIX");
        Path dp = Path.of(Objects.requireNonNull(dir, "tessdataDir is required"))
                .toAbsolutePath().normalize();
        if (!Files.isDirectory(dp)) {
            throw new IllegalStateException("tessdataDir not found: " + dp);
        }
        this.datapath = dp;
        this.languages = System.getProperty("pr.ocr.lang", cfg.languages);
        this.psm = Integer.getInteger("pr.ocr.psm", cfg.psm);
        this.oem = Integer.getInteger("pr.ocr.oem", cfg.oem);
        this.dpi = cfg.dpi;
        log.info("OCR: init datapath={} languages={} psm={} oem={} dpi={}", dp, languages, psm, oem, dpi);
    }

    public String languages() {
        return languages;
    }

    private Tesseract newTesseract() {
        Tesseract t = new Tesseract();
        t.setDatapath(datapath.toString());
        t.setLanguage(languages);
        t.setPageSegMode(psm);
        t.setOcrEngineMode(oem);
        if (dpi > 0) t.setVariable("user_defined_dpi", String.valueOf(dpi));
        t.setVariable("preserve_interword_spaces", "1");
        return t;
    }

    @Override
    public String extract(ImageVariant variant, String languageHint) {
        if (variant == null) return "";
        Tesseract t = tess.get();
        t.setLanguage(languageHint == null || languageHint.isBlank() ? languages : languageHint);
        try {
            BufferedImage img = Rasters.toBufferedImage(variant.raster());
            String raw = t.doOCR(img);
            if (raw == null) return "";
            return raw.replace("\r\n", "\n").replace('\r', '\n');
        } catch (TesseractException e) {
            log.warn("OCR: doOCR failed on {}: {}", variant.tag(), e.getMessage());
            return "";
        }
    }
}
