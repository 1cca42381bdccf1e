package com.helixvision.server.vision;

/**
 * A gray image handed to {@link ImageSampler} does not match the viewport the
 * spiral path was generated for. {@link ScanOrchestrator} resizes beforehand,
 * so only direct sampler callers can see this.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expectedWidth;
    private final int expectedHeight;
    private final int actualWidth;
    private final int actualHeight;

    public DimensionMismatchException(int expectedWidth, int expectedHeight, int actualWidth, int actualHeight) {
        super("Image is " + actualWidth + "x" + actualHeight + " but spiral path was built for "
                + expectedWidth + "x" + expectedHeight);
        this.expectedWidth = expectedWidth;
        this.expectedHeight = expectedHeight;
        this.actualWidth = actualWidth;
        this.actualHeight = actualHeight;
    }

    public int getExpectedWidth() {
        return expectedWidth;
    }

    public int getExpectedHeight() {
        return expectedHeight;
    }

    public int getActualWidth() {
        return actualWidth;
    }

    public int getActualHeight() {
        return actualHeight;
    }
}
