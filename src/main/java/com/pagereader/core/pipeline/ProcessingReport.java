package com.pagereader.core.pipeline;

import com.pagereader.core.correction.CorrectionIssue;
import com.pagereader.core.correction.CorrectionResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Результат обработки одного изображения. Форма одинакова при любом исходе:
 * correction == null, если исправление не запускалось; error != null только при success == false.
 */
public record ProcessingReport(boolean success,
                               String error,
                               Path imagePath,
                               String fullText,
                               TextStatistics statistics,
                               String variantTag,
                               CorrectionResult correction) {

    public ProcessingReport {
        fullText = fullText == null ? "" : fullText;
        statistics = statistics == null ? TextStatistics.EMPTY : statistics;
    }

    public static ProcessingReport ok(Path imagePath, String fullText, String variantTag,
                                      CorrectionResult correction) {
        return new ProcessingReport(true, null, imagePath, fullText, TextStatistics.of(fullText),
                variantTag, correction);
    }

    public static ProcessingReport failure(Path imagePath, String error) {
        return new ProcessingReport(false, error, imagePath, "", TextStatistics.EMPTY, null, null);
    }

    public boolean corrected() {
        return correction != null;
    }

    public List<CorrectionIssue> issues() {
        return correction == null ? List.of() : correction.issues();
    }

    public int issueCount() {
        return correction == null ? 0 : correction.issueCount();
    }

    /** Исправленный текст, либо распознанный, если исправление не запускалось. */
    public String correctedText() {
        return correction == null ? fullText : correction.correctedText();
    }
}
