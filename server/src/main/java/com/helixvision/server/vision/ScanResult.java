package com.helixvision.server.vision;

import java.awt.image.BufferedImage;

/**
 * Output of one scan. Owned by the caller; nothing here is cached.
 */
public class ScanResult {
    private final int[] alphaStream;
    private final int[] betaStream;
    private final double[] depthStream;
    private final BufferedImage sourceImage;
    private final GrayImage grayImage;

    public ScanResult(int[] alphaStream, int[] betaStream, double[] depthStream, BufferedImage sourceImage,
            GrayImage grayImage) {
        if (alphaStream.length != betaStream.length || alphaStream.length != depthStream.length) {
            throw new IllegalArgumentException("alpha, beta and depth streams must have the same length");
        }
        this.alphaStream = alphaStream;
        this.betaStream = betaStream;
        this.depthStream = depthStream;
        this.sourceImage = sourceImage;
        this.grayImage = grayImage;
    }

    public int size() {
        return depthStream.length;
    }

    public int[] getAlphaStream() {
        return alphaStream.clone();
    }

    public int[] getBetaStream() {
        return betaStream.clone();
    }

    public double[] getDepthStream() {
        return depthStream.clone();
    }

    /**
     * @return the image after resizing to the viewport, before gray conversion
     */
    public BufferedImage getSourceImage() {
        return sourceImage;
    }

    public GrayImage getGrayImage() {
        return grayImage;
    }
}
