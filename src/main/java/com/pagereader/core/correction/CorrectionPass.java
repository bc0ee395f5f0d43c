package com.pagereader.core.correction;

import java.util.List;

/** Один проход конвейера: находит замечания, текст не меняет (замены применяет {@link Substitutions}). */
public interface CorrectionPass {
    IssueKind kind();

    List<CorrectionIssue> find(String text);
}
