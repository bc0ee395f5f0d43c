package com.pagereader.app;

import com.pagereader.core.correction.CorrectionIssue;
import com.pagereader.core.pipeline.ProcessingReport;

import java.io.PrintStream;
import java.util.List;

/** Консольный отчёт по одному изображению. */
public final class ReportPrinter {
    private static final String RULE = "=".repeat(70);

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(ProcessingReport r) {
        if (!r.success()) {
            out.println(" Error: " + r.error());
            return;
        }
        out.println();
        out.println(RULE);
        out.println("  RECOGNIZED TEXT (" + r.variantTag() + "):");
        out.println(RULE);
        out.println(r.fullText().isEmpty() ? "(empty)" : r.fullText());
        out.println();
        out.println("  STATISTICS:");
        out.println("  Characters: " + r.statistics().characters());
        out.println("  Words: " + r.statistics().words());

        if (r.corrected()) {
            out.println();
            out.println("  ISSUES FOUND: " + r.issueCount());
            List<CorrectionIssue> issues = r.issues();
            for (int i = 0; i < issues.size(); i++) {
                CorrectionIssue e = issues.get(i);
                out.printf("  %d. [%s] '%s' -> '%s'%s%n", i + 1, e.kind().wireName(),
                        oneLine(e.original()), oneLine(e.suggestion()), e.applied() ? "" : " (not applied)");
            }
            if (r.correction().changed()) {
                out.println();
                out.println("  CORRECTED TEXT:");
                out.println(r.correctedText());
            }
        }
        out.println(RULE);
        out.println();
    }

    private static String oneLine(String s) {
        return s.replace("\n", "\\n");
    }
}
