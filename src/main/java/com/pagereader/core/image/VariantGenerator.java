package com.pagereader.core.image;

import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.global.opencv_photo;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Набор вариантов страницы для OCR: серый базовый + независимые преобразования поверх серого.
 * Детерминирован: одинаковый растр → одинаковый список в одинаковом порядке.
 */
public final class VariantGenerator {
    private static final Logger log = LoggerFactory.getLogger(VariantGenerator.class);

    /** 3x3 high-pass: центр против 8 соседей. */
    private static final float[][] SHARPEN_KERNEL = {
            {-1, -1, -1},
            {-1,  9, -1},
            {-1, -1, -1}
    };

    public record Params(Set<VariantTransform> enabled,
                         double claheClipLimit, int claheTileGrid,
                         boolean adaptiveGaussian, int adaptiveBlockSize, double adaptiveC,
                         int morphKernel,
                         float denoiseH, int denoiseTemplateWindow, int denoiseSearchWindow) {

        public Params {
            enabled = (enabled == null || enabled.isEmpty())
                    ? EnumSet.allOf(VariantTransform.class)
                    : EnumSet.copyOf(enabled);
            // серый базовый вариант есть всегда
            enabled.add(VariantTransform.GRAYSCALE);
            enabled = Set.copyOf(enabled);
            claheTileGrid = Math.max(1, claheTileGrid);
            // blockSize должен быть нечётным и >= 3
            adaptiveBlockSize = Math.max(3, adaptiveBlockSize);
            if ((adaptiveBlockSize & 1) == 0) adaptiveBlockSize++;
            morphKernel = Math.max(1, morphKernel);
        }

        public static Params defaults() {
            return new Params(EnumSet.allOf(VariantTransform.class),
                    3.0, 8,
                    true, 11, 2,
                    2,
                    10f, 7, 21);
        }
    }

    private final Params params;

    public VariantGenerator() {
        this(Params.defaults());
    }

    public VariantGenerator(Params params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public Params params() {
        return params;
    }

    /**
     * Варианты в порядке {@link VariantTransform}. Упавшее преобразование пропускается,
     * серый базовый вариант присутствует всегда.
     * @throws DecodeException пустой растр или не удалось получить серый
     */
    public List<ImageVariant> generate(Mat image) {
        if (image == null || image.isNull() || image.empty()) {
            throw new DecodeException("Empty raster");
        }
        Mat gray;
        try {
            gray = toGray(image);
        } catch (RuntimeException e) {
            throw new DecodeException("Grayscale conversion failed: " + e.getMessage(), e);
        }
        if (gray.empty()) {
            gray.release();
            throw new DecodeException("Grayscale conversion produced empty raster");
        }

        List<ImageVariant> out = new ArrayList<>();
        out.add(new ImageVariant(VariantTransform.GRAYSCALE, gray));
        for (VariantTransform t : VariantTransform.values()) {
            if (t == VariantTransform.GRAYSCALE || !params.enabled().contains(t)) continue;
            Mat dst = new Mat();
            try {
                apply(t, gray, dst);
                if (dst.empty()) {
                    log.warn("Preprocess: {} produced empty raster, skipped", t.tag());
                    dst.release();
                    continue;
                }
                out.add(new ImageVariant(t, dst));
            } catch (RuntimeException e) {
                log.warn("Preprocess: {} failed, skipped: {}", t.tag(), e.getMessage());
                dst.release();
            }
        }
        log.debug("Preprocess: {}x{} → {} variants", gray.cols(), gray.rows(), out.size());
        return List.copyOf(out);
    }

    private static Mat toGray(Mat src) {
        Mat gray = new Mat();
        switch (src.channels()) {
            case 1 -> src.copyTo(gray);
            case 3 -> opencv_imgproc.cvtColor(src, gray, opencv_imgproc.COLOR_BGR2GRAY);
            case 4 -> opencv_imgproc.cvtColor(src, gray, opencv_imgproc.COLOR_BGRA2GRAY);
            default -> {
                gray.release();
                throw new DecodeException("Unsupported channel count: " + src.channels());
            }
        }
        if (gray.depth() != opencv_core.CV_8U) {
            Mat g8 = new Mat();
            gray.convertTo(g8, opencv_core.CV_8U);
            gray.release();
            gray = g8;
        }
        return gray;
    }

    private void apply(VariantTransform t, Mat gray, Mat dst) {
        switch (t) {
            case CLAHE -> {
                CLAHE clahe = opencv_imgproc.createCLAHE(params.claheClipLimit(),
                        new Size(params.claheTileGrid(), params.claheTileGrid()));
                try {
                    clahe.apply(gray, dst);
                } finally {
                    clahe.close();
                }
            }
            case OTSU -> opencv_imgproc.threshold(gray, dst, 0, 255,
                    opencv_imgproc.THRESH_BINARY | opencv_imgproc.THRESH_OTSU);
            case ADAPTIVE -> opencv_imgproc.adaptiveThreshold(gray, dst, 255,
                    params.adaptiveGaussian()
                            ? opencv_imgproc.ADAPTIVE_THRESH_GAUSSIAN_C
                            : opencv_imgproc.ADAPTIVE_THRESH_MEAN_C,
                    opencv_imgproc.THRESH_BINARY, params.adaptiveBlockSize(), params.adaptiveC());
            case MORPH_CLOSE -> {
                // dilate → erode: склейка разрывов штрихов
                Mat k = opencv_imgproc.getStructuringElement(opencv_imgproc.MORPH_RECT,
                        new Size(params.morphKernel(), params.morphKernel()));
                try {
                    opencv_imgproc.morphologyEx(gray, dst, opencv_imgproc.MORPH_CLOSE, k);
                } finally {
                    k.release();
                }
            }
            case DENOISE -> opencv_photo.fastNlMeansDenoising(gray, dst,
                    params.denoiseH(), params.denoiseTemplateWindow(), params.denoiseSearchWindow());
            case SHARPEN -> {
                Mat k = sharpenKernel();
                try {
                    opencv_imgproc.filter2D(gray, dst, -1, k);
                } finally {
                    k.release();
                }
            }
            default -> throw new IllegalArgumentException("not a derived transform: " + t);
        }
    }

    private static Mat sharpenKernel() {
        Mat k = new Mat(3, 3, opencv_core.CV_32F);
        FloatIndexer idx = k.createIndexer();
        try {
            for (int r = 0; r < 3; r++)
                for (int c = 0; c < 3; c++)
                    idx.put(r, c, SHARPEN_KERNEL[r][c]);
        } finally {
            idx.release();
        }
        return k;
    }
}
