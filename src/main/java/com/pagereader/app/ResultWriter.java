package com.pagereader.app;

import com.pagereader.core.pipeline.ProcessingReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Сохраняет распознанный текст в UTF-8: &lt;outputDir&gt;/&lt;имя изображения без расширения&gt;.txt */
public final class ResultWriter {
    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    private final Path outputDir;

    public ResultWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path write(ProcessingReport report) throws IOException {
        if (!report.success()) {
            throw new IllegalArgumentException("nothing to save for failed report: " + report.imagePath());
        }
        Files.createDirectories(outputDir);
        Path out = outputDir.resolve(baseNoExt(report.imagePath()) + ".txt");
        Files.writeString(out, report.fullText(), StandardCharsets.UTF_8);
        log.info("Saved: {}", out.toAbsolutePath());
        return out;
    }

    static String baseNoExt(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
