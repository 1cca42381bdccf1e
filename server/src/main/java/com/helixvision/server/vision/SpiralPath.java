package com.helixvision.server.vision;

/**
 * Filtered double-spiral sample set. Both branches and the depth sequence
 * share one index space, so index {@code i} addresses the same sample in every
 * array. Instances are never mutated and may be shared freely.
 */
public final class SpiralPath {

    private final Viewport viewport;
    private final double[] theta;
    private final double[] radius;
    private final int[] xa;
    private final int[] ya;
    private final int[] xb;
    private final int[] yb;

    SpiralPath(Viewport viewport, double[] theta, double[] radius,
            int[] xa, int[] ya, int[] xb, int[] yb) {
        int n = radius.length;
        if (theta.length != n || xa.length != n || ya.length != n || xb.length != n || yb.length != n) {
            throw new IllegalArgumentException("Spiral path arrays must share one length");
        }
        this.viewport = viewport;
        this.theta = theta;
        this.radius = radius;
        this.xa = xa;
        this.ya = ya;
        this.xb = xb;
        this.yb = yb;
    }

    public Viewport getViewport() {
        return viewport;
    }

    public int size() {
        return radius.length;
    }

    public boolean isEmpty() {
        return radius.length == 0;
    }

    public double getTheta(int i) {
        return theta[i];
    }

    public double getRadius(int i) {
        return radius[i];
    }

    public int getXa(int i) {
        return xa[i];
    }

    public int getYa(int i) {
        return ya[i];
    }

    public int getXb(int i) {
        return xb[i];
    }

    public int getYb(int i) {
        return yb[i];
    }

    public double[] getThetas() {
        return theta.clone();
    }

    /**
     * @return copy of the radius sequence, non-decreasing in sample order
     */
    public double[] getDepths() {
        return radius.clone();
    }

    public int[] getXaValues() {
        return xa.clone();
    }

    public int[] getYaValues() {
        return ya.clone();
    }

    public int[] getXbValues() {
        return xb.clone();
    }

    public int[] getYbValues() {
        return yb.clone();
    }
}
