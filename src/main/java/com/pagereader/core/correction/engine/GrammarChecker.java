package com.pagereader.core.correction.engine;

import java.util.List;

/** Внешняя проверка грамматики. Хэндл принадлежит конвейеру и закрывается вместе с ним. */
public interface GrammarChecker extends AutoCloseable {
    List<GrammarFlag> check(String text) throws Exception;

    @Override
    default void close() {}
}
