package com.pagereader.core.correction;

public enum ReplacementPolicy {
    /** Каждое вхождение original в тексте. */
    REPLACE_ALL,
    /** Только первое вхождение. */
    REPLACE_FIRST,
    /** Замечание только в отчёт, текст не меняется. */
    NONE
}
