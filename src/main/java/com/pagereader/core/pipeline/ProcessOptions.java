package com.pagereader.core.pipeline;

/**
 * @param checkErrors прогонять ли текст через конвейер исправлений
 * @param saveOutput  сохранить текст в файл (выполняет вызывающий код, ядро файлов не пишет)
 */
public record ProcessOptions(boolean checkErrors, boolean saveOutput) {
    public static final ProcessOptions DEFAULT = new ProcessOptions(true, false);
}
