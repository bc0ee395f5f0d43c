package com.pagereader.core.image;

import org.bytedeco.opencv.opencv_core.Mat;

import java.nio.file.Path;

public interface ImageLoader {
    /**
     * Загружает растр. Результатом владеет вызывающий код (обязан release()).
     * @throws ImageNotFoundException файла нет
     * @throws DecodeException файл есть, но не декодируется
     */
    Mat load(Path path);
}
