package com.helixvision.server.vision;

/**
 * Branch A and branch B intensities gathered in sample order.
 */
public final class IntensityStreams {
    private final int[] alpha;
    private final int[] beta;

    IntensityStreams(int[] alpha, int[] beta) {
        if (alpha.length != beta.length) {
            throw new IllegalArgumentException("alpha and beta streams must have the same length");
        }
        this.alpha = alpha;
        this.beta = beta;
    }

    public int size() {
        return alpha.length;
    }

    public int[] getAlpha() {
        return alpha.clone();
    }

    public int[] getBeta() {
        return beta.clone();
    }
}
