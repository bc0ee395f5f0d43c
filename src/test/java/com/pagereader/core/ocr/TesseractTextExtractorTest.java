package com.pagereader.core.ocr;

import com.pagereader.core.image.ImageVariant;
import com.pagereader.core.image.OpenCvImageLoader;
import com.pagereader.core.image.VariantTransform;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TesseractTextExtractorTest {
    static {
        System.setProperty("org.bytedeco.javacpp.cachedir",
                System.getProperty("user.home") + "/.javacpp-cache");
        Loader.load(opencv_core.class);
        Loader.load(opencv_imgproc.class);
    }

    @TempDir
    Path dir;

    @Test
    void missing_tessdata_dir_fails_fast() {
        Assumptions.assumeTrue(System.getProperty("pr.ocr.tessdataDir") == null, "override set");
        Path nowhere = dir.resolve("no-tessdata");
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new TesseractTextExtractor(new TesseractTextExtractor.Config(nowhere.toString(), "eng", 3, 1, 300)));
        assertTrue(e.getMessage().contains("tessdataDir not found"));
    }

    @Test
    void reads_rendered_line() throws Exception {
        // нужен реальный каталог с eng.traineddata: -Dpr.ocr.tessdataDir или TESSDATA_PREFIX
        String dp = System.getProperty("pr.ocr.tessdataDir", System.getenv("TESSDATA_PREFIX"));
        Assumptions.assumeTrue(dp != null && Files.isRegularFile(Path.of(dp, "eng.traineddata")),
                "no eng.traineddata available");

        BufferedImage img = new BufferedImage(420, 80, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 420, 80);
        g.setColor(Color.BLACK);
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 36));
        g.drawString("HELLO WORLD", 20, 55);
        g.dispose();
        Path png = dir.resolve("line.png");
        ImageIO.write(img, "png", png.toFile());

        TesseractTextExtractor ex = new TesseractTextExtractor(new TesseractTextExtractor.Config(dp, "eng", 7, 1, 300));
        Mat color = new OpenCvImageLoader().load(png);
        Mat gray = new Mat();
        opencv_imgproc.cvtColor(color, gray, opencv_imgproc.COLOR_BGR2GRAY);
        color.release();
        try (ImageVariant v = new ImageVariant(VariantTransform.GRAYSCALE, gray)) {
            String text = ex.extract(v, "eng");
            assertTrue(text.toUpperCase().contains("HELLO"), text);
        }
    }
}
