package com.pagereader.core.image;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Загрузка через imdecode по байтам файла: imread не открывает пути с кириллицей на части платформ.
 */
public final class OpenCvImageLoader implements ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(OpenCvImageLoader.class);

    @Override
    public Mat load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ImageNotFoundException(path);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DecodeException("Cannot read image: " + path, e);
        }
        if (bytes.length == 0) {
            throw new DecodeException("Empty image file: " + path);
        }

        BytePointer data = new BytePointer(bytes);
        Mat buf = new Mat(1, bytes.length, opencv_core.CV_8UC1, data);
        Mat img;
        try {
            img = opencv_imgcodecs.imdecode(buf, opencv_imgcodecs.IMREAD_COLOR);
        } catch (RuntimeException e) {
            throw new DecodeException("Cannot decode image: " + path, e);
        } finally {
            buf.release();
            data.deallocate();
        }
        if (img == null || img.empty()) {
            if (img != null) img.release();
            throw new DecodeException("Cannot decode image: " + path);
        }
        log.debug("Image loaded: {} {}x{} ch={}", path, img.cols(), img.rows(), img.channels());
        return img;
    }
}
