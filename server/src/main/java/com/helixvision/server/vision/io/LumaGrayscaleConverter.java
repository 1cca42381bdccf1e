package com.helixvision.server.vision.io;

import com.helixvision.server.vision.GrayImage;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;

/**
 * ITU-R BT.601 luma: 0.299 R + 0.587 G + 0.114 B, rounded to the nearest
 * integer. Alpha is ignored. 8-bit gray images are read straight from the
 * raster so the color model does not re-map their values.
 */
public class LumaGrayscaleConverter implements GrayscaleConverter {

    @Override
    public GrayImage toGrayscale(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[][] pixels = new int[height][width];

        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            Raster raster = image.getRaster();
            for (int y = 0; y < height; y++) {
                raster.getSamples(0, y, width, 1, 0, pixels[y]);
            }
            return new GrayImage(pixels);
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[y][x] = luma(image.getRGB(x, y));
            }
        }
        return new GrayImage(pixels);
    }

    static int luma(int rgb) {
        int red = (rgb & 0x00ff0000) >> 16;
        int green = (rgb & 0x0000ff00) >> 8;
        int blue = rgb & 0x000000ff;
        return (299 * red + 587 * green + 114 * blue + 500) / 1000;
    }
}
