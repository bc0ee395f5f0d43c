package com.pagereader.core.correction.engine;

import java.util.List;
import java.util.Set;

/** Внешний словарь. Хэндл принадлежит конвейеру и закрывается вместе с ним. */
public interface SpellChecker extends AutoCloseable {
    /** Подмножество words, которого нет в словаре. */
    Set<String> unknown(Set<String> words) throws Exception;

    /** Варианты исправления, лучший первым; пустой список, если вариантов нет. */
    List<String> candidates(String word) throws Exception;

    @Override
    default void close() {}
}
