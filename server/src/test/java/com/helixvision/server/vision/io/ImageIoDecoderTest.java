package com.helixvision.server.vision.io;

import com.helixvision.server.vision.DecodeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageIoDecoderTest {

    private final ImageIoDecoder decoder = new ImageIoDecoder();

    @Test
    void testDecodesPngFromFileAndStream(@TempDir Path tempDir) throws Exception {
        BufferedImage source = new BufferedImage(7, 5, BufferedImage.TYPE_INT_RGB);
        source.setRGB(3, 2, 0x123456);
        Path file = tempDir.resolve("tiny.png");
        assertTrue(ImageIO.write(source, "png", file.toFile()));

        BufferedImage fromFile = decoder.decode(file.toString());
        assertEquals(7, fromFile.getWidth());
        assertEquals(5, fromFile.getHeight());
        assertEquals(0x123456, fromFile.getRGB(3, 2) & 0xffffff);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ImageIO.write(source, "png", bytes);
        BufferedImage fromStream = decoder.decode(new ByteArrayInputStream(bytes.toByteArray()), "bytes");
        assertEquals(0x123456, fromStream.getRGB(3, 2) & 0xffffff);
    }

    @Test
    void testMissingFile(@TempDir Path tempDir) {
        String missing = tempDir.resolve("nope.jpg").toString();
        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode(missing));
        assertTrue(e.getMessage().contains(missing));
    }

    @Test
    void testDirectoryIsNotAnImage(@TempDir Path tempDir) {
        assertThrows(DecodeException.class, () -> decoder.decode(tempDir.toString()));
    }

    @Test
    void testEmptyPath() {
        assertThrows(DecodeException.class, () -> decoder.decode(""));
        assertThrows(DecodeException.class, () -> decoder.decode((String) null));
    }

    @Test
    void testGarbageBytes(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("garbage.png");
        Files.write(file, new byte[] { 0x00, 0x01, 0x02, 0x03 });
        assertThrows(DecodeException.class, () -> decoder.decode(file.toString()));
    }
}
