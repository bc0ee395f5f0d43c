package com.pagereader.core.image;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

public final class Rasters {
    private Rasters() {}

    /** Mat → BufferedImage через PNG-кодек (без потерь, сохраняет число каналов). */
    public static BufferedImage toBufferedImage(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new DecodeException("Empty raster");
        }
        BytePointer buf = new BytePointer();
        try {
            if (!opencv_imgcodecs.imencode(".png", mat, buf)) {
                throw new DecodeException("PNG encode failed");
            }
            byte[] bytes = new byte[(int) buf.limit()];
            buf.get(bytes);
            BufferedImage bi = ImageIO.read(new ByteArrayInputStream(bytes));
            if (bi == null) {
                throw new DecodeException("PNG decode failed");
            }
            return bi;
        } catch (IOException e) {
            throw new DecodeException("PNG decode failed", e);
        } finally {
            buf.deallocate();
        }
    }
}
