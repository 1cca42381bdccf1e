package com.helixvision.server.vision;

/**
 * Fixed-size sampling canvas. The center uses integer division, so a 1920x1080
 * viewport is centered on (960, 540).
 */
public final class Viewport {

    private final int width;
    private final int height;
    private final int centerX;
    private final int centerY;
    // TL, TR, BR, BL as {x, y}
    private final int[][] corners;

    public Viewport(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new ConfigurationException("Viewport dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.centerX = width / 2;
        this.centerY = height / 2;
        this.corners = new int[][] {
                { 0, 0 },
                { width, 0 },
                { width, height },
                { 0, height }
        };
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getCenterX() {
        return centerX;
    }

    public int getCenterY() {
        return centerY;
    }

    public int getMinDimension() {
        return Math.min(width, height);
    }

    /**
     * @return copy of the four corners in top-left, top-right, bottom-right,
     *         bottom-left order
     */
    public int[][] getCorners() {
        int[][] copy = new int[corners.length][];
        for (int i = 0; i < corners.length; i++) {
            copy[i] = corners[i].clone();
        }
        return copy;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public boolean matches(int otherWidth, int otherHeight) {
        return width == otherWidth && height == otherHeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Viewport))
            return false;
        Viewport other = (Viewport) o;
        return width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return 31 * width + height;
    }

    @Override
    public String toString() {
        return "Viewport[" + width + "x" + height + ", center=(" + centerX + "," + centerY + ")]";
    }
}
