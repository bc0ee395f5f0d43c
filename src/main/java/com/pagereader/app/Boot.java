package com.pagereader.app;

import com.pagereader.core.batch.FolderScanner;
import com.pagereader.core.correction.CorrectionPipeline;
import com.pagereader.core.image.OpenCvImageLoader;
import com.pagereader.core.image.VariantGenerator;
import com.pagereader.core.ocr.RecognitionSelector;
import com.pagereader.core.ocr.TesseractTextExtractor;
import com.pagereader.core.pipeline.DocumentProcessor;
import com.pagereader.core.pipeline.ProcessOptions;
import com.pagereader.core.pipeline.ProcessingReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.function.BiFunction;

// CLI (main)
public final class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    private Boot() {}

    public static void main(String[] args) {
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.out.println(CliArgs.USAGE);
            System.exit(1);
            return;
        }
        if (cli.help()) {
            System.out.println(CliArgs.USAGE);
            return;
        }
        if (!cli.hasTarget()) {
            System.out.println(CliArgs.USAGE);
            System.exit(1);
            return;
        }

        int code;
        try {
            code = launch(cli, Config.load());
        } catch (RuntimeException e) {
            log.error("Fatal: {}", e.toString(), e);
            System.out.println(" Error: " + e.getMessage());
            code = 1;
        }
        System.exit(code);
    }

    /** Собирает компоненты из конфига, прогоняет и гарантированно освобождает ресурсы. */
    static int launch(CliArgs cli, Config cfg) {
        var extractor = new TesseractTextExtractor(cfg.ocr().toExtractorConfig());
        Capabilities caps = cli.checkErrors() ? Capabilities.load(cfg.correction()) : Capabilities.NONE;
        RecognitionSelector selector = new RecognitionSelector(extractor,
                cfg.ocr().parallelism(), cfg.ocr().timeoutMs());
        CorrectionPipeline pipeline = new CorrectionPipeline(
                cfg.correction().toCorrectionConfig(caps.grammar(), caps.spelling()));
        // страховка на случай Ctrl+C: close() идемпотентны
        Thread hook = new Thread(() -> {
            selector.close();
            pipeline.close();
        }, "pr-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            if (cli.checkErrors()) {
                System.out.println("Grammar engine: " + (pipeline.grammarAvailable() ? "available" : "unavailable")
                        + ", spelling engine: " + (pipeline.spellingAvailable() ? "available" : "unavailable"));
            }
            DocumentProcessor processor = new DocumentProcessor(new OpenCvImageLoader(),
                    new VariantGenerator(cfg.preprocess().toParams()), selector, pipeline, extractor.languages());
            return run(cli, processor::process, new FolderScanner(cfg.input().patterns()),
                    new ResultWriter(Path.of(cfg.output().dir())), System.out);
        } finally {
            selector.close();
            pipeline.close();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignore) {
                // JVM уже завершается, хук отработает сам
            }
        }
    }

    /**
     * Одиночное изображение: 0 при успехе, 1 при ошибке.
     * Папка: сбой одного файла не прерывает остальные; 1 только если папку не удалось прочитать.
     */
    static int run(CliArgs cli, BiFunction<Path, ProcessOptions, ProcessingReport> processor,
                   FolderScanner scanner, ResultWriter writer, PrintStream out) {
        ReportPrinter printer = new ReportPrinter(out);
        if (cli.image() != null) {
            ProcessingReport r = processor.apply(cli.image(), new ProcessOptions(cli.checkErrors(), cli.saveOutput()));
            printer.print(r);
            if (!r.success()) return 1;
            if (cli.saveOutput()) {
                try {
                    out.println(" Result saved: " + writer.write(r));
                } catch (Exception e) {
                    log.error("Save failed: {}", cli.image(), e);
                    out.println(" Error: cannot save result: " + e.getMessage());
                    return 1;
                }
            }
            return 0;
        }

        List<Path> files;
        try {
            files = scanner.scan(cli.folder());
        } catch (RuntimeException e) {
            out.println(" Error: " + e.getMessage());
            return 1;
        }
        int ok = 0, failed = 0;
        for (Path img : files) {
            out.println();
            out.println(" Processing: " + img.getFileName());
            ProcessingReport r;
            try {
                r = processor.apply(img, new ProcessOptions(cli.checkErrors(), false));
            } catch (RuntimeException e) {
                log.error("Processing failed: {}", img, e);
                r = ProcessingReport.failure(img, e.toString());
            }
            printer.print(r);
            if (r.success()) ok++;
            else failed++;
        }
        log.info("Batch done: ok={} failed={} folder={}", ok, failed, cli.folder());
        out.printf(" Done. processed=%d failed=%d%n", ok, failed);
        return 0;
    }
}
