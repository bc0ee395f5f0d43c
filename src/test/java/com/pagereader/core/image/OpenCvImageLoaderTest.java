package com.pagereader.core.image;

import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OpenCvImageLoaderTest {
    static {
        System.setProperty("org.bytedeco.javacpp.cachedir",
                System.getProperty("user.home") + "/.javacpp-cache");
        Loader.load(opencv_core.class);
        Loader.load(opencv_imgcodecs.class);
    }

    @TempDir
    Path dir;

    private final OpenCvImageLoader loader = new OpenCvImageLoader();

    static Path writePng(Path file, int w, int h) throws IOException {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, w, h);
        g.setColor(Color.BLACK);
        g.fillRect(w / 4, h / 4, w / 2, h / 4);
        g.dispose();
        ImageIO.write(img, "png", file.toFile());
        return file;
    }

    @Test
    void loads_png_as_three_channel_raster() throws IOException {
        Mat m = loader.load(writePng(dir.resolve("page.png"), 40, 30));
        try {
            assertEquals(40, m.cols());
            assertEquals(30, m.rows());
            assertEquals(3, m.channels());
        } finally {
            m.release();
        }
    }

    @Test
    void non_ascii_file_name_is_fine() throws IOException {
        // кириллическое имя файла представимо только в UTF-8 локали JVM
        Assumptions.assumeTrue("UTF-8".equalsIgnoreCase(System.getProperty("sun.jnu.encoding")),
                "file system encoding is not UTF-8");
        Mat m = loader.load(writePng(dir.resolve("страница.png"), 8, 8));
        assertFalse(m.empty());
        m.release();
    }

    @Test
    void missing_file_is_not_found() {
        ImageNotFoundException e = assertThrows(ImageNotFoundException.class,
                () -> loader.load(dir.resolve("nope.png")));
        assertEquals(dir.resolve("nope.png"), e.path());
    }

    @Test
    void garbage_or_empty_file_is_not_decodable() throws IOException {
        Path junk = Files.writeString(dir.resolve("junk.png"), "not an image", StandardCharsets.UTF_8);
        Path empty = Files.createFile(dir.resolve("empty.jpg"));

        assertThrows(DecodeException.class, () -> loader.load(junk));
        assertThrows(DecodeException.class, () -> loader.load(empty));
    }
}
