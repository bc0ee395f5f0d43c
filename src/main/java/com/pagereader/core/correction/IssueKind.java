package com.pagereader.core.correction;

/** Вид замечания; порядок объявления совпадает с порядком проходов. */
public enum IssueKind {
    HYPHENATION("hyphenation"),
    CONFUSABLE_CHAR("confusable_char"),
    CONTEXT("context"),
    GRAMMAR("grammar"),
    SPELLING("spelling");

    private final String wireName;

    IssueKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
