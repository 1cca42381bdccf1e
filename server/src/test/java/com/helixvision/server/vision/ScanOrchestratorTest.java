package com.helixvision.server.vision;

import com.helixvision.server.vision.io.BilinearImageResizer;
import com.helixvision.server.vision.io.ImageIoDecoder;
import com.helixvision.server.vision.io.LumaGrayscaleConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScanOrchestratorTest {

    private static final SamplingConfig SMALL = new SamplingConfig(10, 1, 0.5, 1 / 1.8);

    private static BufferedImage constantGray(int width, int height, int value) {
        BufferedImage bi = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = bi.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                raster.setSample(x, y, 0, value);
            }
        }
        return bi;
    }

    private static BufferedImage constantRgb(int width, int height, Color color) {
        BufferedImage bi = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = bi.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, width, height);
        g.dispose();
        return bi;
    }

    @Test
    void testConstantImageYieldsConstantStreams() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL);
        ScanResult result = orchestrator.scan(constantGray(100, 100, 128));

        int expected = orchestrator.getSpiralPath().size();
        assertEquals(9, expected);
        assertEquals(expected, result.getAlphaStream().length);
        assertEquals(expected, result.getBetaStream().length);
        assertEquals(expected, result.getDepthStream().length);
        for (int i = 0; i < expected; i++) {
            assertEquals(128, result.getAlphaStream()[i]);
            assertEquals(128, result.getBetaStream()[i]);
        }
    }

    @Test
    void testColorImageIsConvertedToGray() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL);
        ScanResult result = orchestrator.scan(constantRgb(100, 100, new Color(128, 128, 128)));
        for (int v : result.getAlphaStream()) {
            assertEquals(128, v);
        }

        // pure red: 0.299 * 255 = 76.2
        result = orchestrator.scan(constantRgb(100, 100, Color.RED));
        for (int v : result.getBetaStream()) {
            assertEquals(76, v);
        }
    }

    @Test
    void testMismatchedInputIsResizedToViewport() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL);
        ScanResult result = orchestrator.scan(constantRgb(37, 250, new Color(200, 200, 200)));

        assertEquals(100, result.getSourceImage().getWidth());
        assertEquals(100, result.getSourceImage().getHeight());
        assertEquals(100, result.getGrayImage().getWidth());
        assertEquals(100, result.getGrayImage().getHeight());
        // samples well inside the image, away from interpolation at the borders
        double[] depth = result.getDepthStream();
        int[] alpha = result.getAlphaStream();
        int[] beta = result.getBetaStream();
        for (int i = 0; i < depth.length; i++) {
            if (depth[i] < 40) {
                assertEquals(200, alpha[i]);
                assertEquals(200, beta[i]);
            }
        }
    }

    @Test
    void testMatchingInputIsNotCopied() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL);
        BufferedImage input = constantRgb(100, 100, Color.BLUE);
        assertSame(input, orchestrator.scan(input).getSourceImage());
    }

    @Test
    void testDepthStreamMatchesSpiralPath() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(320, 240), SamplingConfig.defaults());
        ScanResult result = orchestrator.scan(constantGray(320, 240, 10));
        assertArrayEquals(orchestrator.getSpiralPath().getDepths(), result.getDepthStream(), 0.0);
    }

    @Test
    void testRepeatedScansAreIdentical() {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(200, 150), SamplingConfig.defaults());
        BufferedImage image = new BufferedImage(200, 150, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 150; y++) {
            for (int x = 0; x < 200; x++) {
                image.setRGB(x, y, ((x * 7) & 0xff) << 16 | ((y * 3) & 0xff) << 8 | ((x + y) & 0xff));
            }
        }

        ScanResult first = orchestrator.scan(image);
        ScanResult second = orchestrator.scan(image);
        assertArrayEquals(first.getAlphaStream(), second.getAlphaStream());
        assertArrayEquals(first.getBetaStream(), second.getBetaStream());
        assertArrayEquals(first.getDepthStream(), second.getDepthStream(), 0.0);
    }

    @Test
    void testSpiralPathIsComputedOnce() {
        AtomicInteger calls = new AtomicInteger();
        SpiralPathGenerator counting = new SpiralPathGenerator() {
            @Override
            public SpiralPath generate(Viewport viewport, SamplingConfig config) {
                calls.incrementAndGet();
                return super.generate(viewport, config);
            }
        };
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL, counting,
                new ImageSampler(), new ImageIoDecoder(), new BilinearImageResizer(), new LumaGrayscaleConverter());

        assertEquals(0, calls.get());
        SpiralPath path = orchestrator.getSpiralPath();
        orchestrator.scan(constantGray(100, 100, 1));
        orchestrator.scan(constantGray(64, 64, 1));
        assertSame(path, orchestrator.getSpiralPath());
        assertEquals(1, calls.get());
    }

    @Test
    void testScanFromFilePath(@TempDir Path tempDir) throws Exception {
        File png = tempDir.resolve("gray.png").toFile();
        assertTrue(ImageIO.write(constantRgb(100, 100, new Color(90, 90, 90)), "png", png));

        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL);
        ScanResult result = orchestrator.scan(png.getAbsolutePath());
        assertEquals(9, result.size());
        for (int v : result.getAlphaStream()) {
            assertEquals(90, v);
        }
    }

    @Test
    void testNonexistentPathFailsWithDecodeException(@TempDir Path tempDir) {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL);
        String missing = tempDir.resolve("missing.png").toString();

        DecodeException e = assertThrows(DecodeException.class, () -> orchestrator.scan(missing));
        assertEquals(missing, e.getSource());
    }

    @Test
    void testUndecodableDataFailsWithDecodeException(@TempDir Path tempDir) throws Exception {
        ScanOrchestrator orchestrator = new ScanOrchestrator(new Viewport(100, 100), SMALL);
        Path text = tempDir.resolve("notes.png");
        Files.write(text, "not an image".getBytes(StandardCharsets.UTF_8));

        assertThrows(DecodeException.class, () -> orchestrator.scan(text.toString()));
        assertThrows(DecodeException.class, () -> orchestrator
                .scan(new ByteArrayInputStream(new byte[] { 1, 2, 3 }), "bytes"));
    }
}
