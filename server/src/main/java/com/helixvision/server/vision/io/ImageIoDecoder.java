package com.helixvision.server.vision.io;

import com.helixvision.server.vision.DecodeException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ImageIoDecoder implements ImageDecoder {

    @Override
    public BufferedImage decode(String path) {
        if (path == null || path.isEmpty()) {
            throw new DecodeException(String.valueOf(path), "Image path is empty");
        }
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            throw new DecodeException(path, "No such image file");
        }
        try (InputStream is = Files.newInputStream(file)) {
            return decode(is, path);
        } catch (IOException e) {
            throw new DecodeException(path, "Failed to read image", e);
        }
    }

    @Override
    public BufferedImage decode(InputStream encoded, String description) {
        if (encoded == null) {
            throw new DecodeException(description, "No image data");
        }
        BufferedImage bi;
        try {
            bi = ImageIO.read(encoded);
        } catch (IOException e) {
            throw new DecodeException(description, "Failed to decode image", e);
        }
        // ImageIO returns null when no registered reader recognizes the data
        if (bi == null) {
            throw new DecodeException(description, "Unsupported or corrupt image data");
        }
        return bi;
    }
}
