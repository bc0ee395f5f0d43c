package com.pagereader.core.pipeline;

import com.pagereader.core.correction.CorrectionPipeline;
import com.pagereader.core.correction.CorrectionResult;
import com.pagereader.core.image.DecodeException;
import com.pagereader.core.image.ImageLoader;
import com.pagereader.core.image.ImageNotFoundException;
import com.pagereader.core.image.ImageVariant;
import com.pagereader.core.image.VariantGenerator;
import com.pagereader.core.ocr.RecognitionResult;
import com.pagereader.core.ocr.RecognitionSelector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Изображение → варианты → лучший OCR → (опционально) исправления.
 * Ничего не пишет на диск; ошибки одного изображения возвращаются в отчёте, а не бросаются.
 */
public final class DocumentProcessor {
    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final ImageLoader loader;
    private final VariantGenerator generator;
    private final RecognitionSelector selector;
    private final CorrectionPipeline pipeline;
    private final String languageHint;

    /** @param pipeline null: исправления недоступны, отчёт всегда без correction */
    public DocumentProcessor(ImageLoader loader, VariantGenerator generator, RecognitionSelector selector,
                             CorrectionPipeline pipeline, String languageHint) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.pipeline = pipeline;
        this.languageHint = Objects.requireNonNull(languageHint, "languageHint");
    }

    public ProcessingReport process(Path imagePath) {
        return process(imagePath, ProcessOptions.DEFAULT);
    }

    public ProcessingReport process(Path imagePath, ProcessOptions options) {
        Objects.requireNonNull(options, "options");
        long t0 = System.nanoTime();
        try {
            if (imagePath == null || !Files.exists(imagePath)) {
                throw new ImageNotFoundException(imagePath);
            }
            log.info("Processing: {}", imagePath);
            RecognitionResult best = recognize(imagePath);

            CorrectionResult correction = null;
            if (options.checkErrors()) {
                if (pipeline != null) {
                    correction = pipeline.check(best.text());
                } else {
                    log.debug("Processing: correction requested but no pipeline configured");
                }
            }
            ProcessingReport report = ProcessingReport.ok(imagePath, best.text(), best.variantTag(), correction);
            log.info("Processing done: {} variant={} chars={} words={} issues={} in {} ms",
                    imagePath.getFileName(), best.variantTag(),
                    report.statistics().characters(), report.statistics().words(),
                    report.issueCount(), (System.nanoTime() - t0) / 1_000_000);
            return report;
        } catch (ImageNotFoundException e) {
            log.warn("Processing: file not found: {}", imagePath);
            return ProcessingReport.failure(imagePath, e.getMessage());
        } catch (DecodeException e) {
            log.warn("Processing: cannot decode {}: {}", imagePath, e.getMessage());
            return ProcessingReport.failure(imagePath, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Processing failed: {}", imagePath, e);
            return ProcessingReport.failure(imagePath, e.toString());
        }
    }

    private RecognitionResult recognize(Path imagePath) {
        Mat image = loader.load(imagePath);
        List<ImageVariant> variants = List.of();
        try {
            variants = generator.generate(image);
            return selector.select(variants, languageHint);
        } finally {
            // варианты живут только до распознавания
            variants.forEach(ImageVariant::close);
            image.release();
        }
    }
}
