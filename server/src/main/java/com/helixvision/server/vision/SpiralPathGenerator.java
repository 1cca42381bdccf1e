package com.helixvision.server.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the double spiral for a viewport.
 * <p>
 * Angles run evenly from 0 to {@code rotations * 2pi}. The radius at each angle
 * is {@code maxRadius * (theta / thetaMax) ^ growthFactor}; with a growth factor
 * below 1 samples crowd near the center and thin out toward the edge. Branch A
 * sits at {@code theta}, branch B at {@code theta + pi} with the same radius.
 * Samples where either branch leaves the viewport are dropped from both.
 */
public class SpiralPathGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SpiralPathGenerator.class);

    // keeps the normalization finite when rotations == 0
    static final double ANGLE_EPSILON = 1e-9;

    public SpiralPath generate(Viewport viewport, SamplingConfig config) {
        double maxRadius = config.maxRadius(viewport);
        if (!Double.isFinite(maxRadius)) {
            throw new ConfigurationException("radiusScale " + config.getRadiusScale() + " overflows for " + viewport);
        }
        double[] thetas = sampleAngles(config);
        double[] radii = sampleRadii(thetas, config.getGrowthFactor(), maxRadius);

        int n = thetas.length;
        int cx = viewport.getCenterX();
        int cy = viewport.getCenterY();

        int[] xa = new int[n];
        int[] ya = new int[n];
        int[] xb = new int[n];
        int[] yb = new int[n];
        boolean[] valid = new boolean[n];
        int retained = 0;

        for (int i = 0; i < n; i++) {
            double r = radii[i];
            double t = thetas[i];
            // (int) truncates toward zero
            xa[i] = (int) (cx + r * Math.cos(t));
            ya[i] = (int) (cy + r * Math.sin(t));
            xb[i] = (int) (cx + r * Math.cos(t + Math.PI));
            yb[i] = (int) (cy + r * Math.sin(t + Math.PI));

            valid[i] = viewport.contains(xa[i], ya[i]) && viewport.contains(xb[i], yb[i]);
            if (valid[i]) {
                retained++;
            }
        }

        double[] keptTheta = new double[retained];
        double[] keptRadius = new double[retained];
        int[] keptXa = new int[retained];
        int[] keptYa = new int[retained];
        int[] keptXb = new int[retained];
        int[] keptYb = new int[retained];

        int k = 0;
        for (int i = 0; i < n; i++) {
            if (!valid[i]) {
                continue;
            }
            keptTheta[k] = thetas[i];
            keptRadius[k] = radii[i];
            keptXa[k] = xa[i];
            keptYa[k] = ya[i];
            keptXb[k] = xb[i];
            keptYb[k] = yb[i];
            k++;
        }

        SpiralPath path = new SpiralPath(viewport, keptTheta, keptRadius, keptXa, keptYa, keptXb, keptYb);
        if (path.isEmpty()) {
            logger.warn("No spiral samples fall inside {}", viewport);
        }
        logger.info("Generated spiral path for {}: {} of {} samples inside the viewport", viewport, retained, n);
        return path;
    }

    /**
     * Evenly spaced angles from 0 to {@code rotations * 2pi}, both ends included.
     */
    static double[] sampleAngles(SamplingConfig config) {
        int n = config.getNumPoints();
        double maxAngle = config.maxAngle();
        double[] thetas = new double[n];
        if (n == 1) {
            return thetas;
        }
        double step = maxAngle / (n - 1);
        for (int i = 0; i < n; i++) {
            thetas[i] = i * step;
        }
        thetas[n - 1] = maxAngle;
        return thetas;
    }

    static double[] sampleRadii(double[] thetas, double growthFactor, double maxRadius) {
        double[] radii = new double[thetas.length];
        if (thetas.length == 0) {
            return radii;
        }
        double denominator = thetas[thetas.length - 1] + ANGLE_EPSILON;
        for (int i = 0; i < thetas.length; i++) {
            radii[i] = maxRadius * Math.pow(thetas[i] / denominator, growthFactor);
        }
        return radii;
    }
}
