package com.helixvision.server.vision;

/**
 * Single-channel intensity buffer.
 */
public final class GrayImage {
    // pixels[row][col]
    private final int[][] pixels;
    private final int width;
    private final int height;

    public GrayImage(int[][] pixels) {
        if (pixels == null || pixels.length == 0 || pixels[0] == null || pixels[0].length == 0) {
            throw new IllegalArgumentException("Gray image must have at least one row and one column");
        }
        this.height = pixels.length;
        this.width = pixels[0].length;
        this.pixels = new int[height][];
        for (int y = 0; y < height; y++) {
            if (pixels[y] == null || pixels[y].length != width) {
                throw new IllegalArgumentException("Row " + y + " does not have width " + width);
            }
            this.pixels[y] = pixels[y].clone();
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int get(int x, int y) {
        return pixels[y][x];
    }
}
