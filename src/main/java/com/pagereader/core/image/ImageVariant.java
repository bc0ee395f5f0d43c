package com.pagereader.core.image;

import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Objects;

/**
 * Один вариант страницы. Растр не меняется после создания; освобождается владельцем через close().
 */
public record ImageVariant(VariantTransform transform, Mat raster) implements AutoCloseable {

    public ImageVariant {
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(raster, "raster");
    }

    public String tag() {
        return transform.tag();
    }

    public int width() {
        return raster.cols();
    }

    public int height() {
        return raster.rows();
    }

    @Override
    public void close() {
        raster.release();
    }
}
