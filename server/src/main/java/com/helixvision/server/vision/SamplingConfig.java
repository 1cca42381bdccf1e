package com.helixvision.server.vision;

import java.util.Objects;

public final class SamplingConfig {

    public static final int DEFAULT_NUM_POINTS = 3000;
    public static final double DEFAULT_ROTATIONS = 8;
    public static final double DEFAULT_GROWTH_FACTOR = 0.55;
    public static final double DEFAULT_RADIUS_SCALE = 1.0 / 1.8;

    private final int numPoints;
    private final double rotations;
    private final double growthFactor;
    private final double radiusScale;

    public SamplingConfig(int numPoints, double rotations, double growthFactor, double radiusScale) {
        if (numPoints <= 0) {
            throw new ConfigurationException("numPoints must be positive, got " + numPoints);
        }
        if (!Double.isFinite(rotations) || rotations < 0) {
            throw new ConfigurationException("rotations must be a finite non-negative number, got " + rotations);
        }
        if (!Double.isFinite(rotations * 2 * Math.PI)) {
            throw new ConfigurationException("rotations too large, total angle overflows: " + rotations);
        }
        // pow(x, 0) is 1 for every x, the center included, which flattens the spiral onto one circle
        if (!(growthFactor > 0 && growthFactor <= 1)) {
            throw new ConfigurationException("growthFactor must lie in (0, 1], got " + growthFactor);
        }
        if (!Double.isFinite(radiusScale) || radiusScale <= 0) {
            throw new ConfigurationException("radiusScale must be a finite positive number, got " + radiusScale);
        }
        this.numPoints = numPoints;
        this.rotations = rotations;
        this.growthFactor = growthFactor;
        this.radiusScale = radiusScale;
    }

    public static SamplingConfig defaults() {
        return new SamplingConfig(DEFAULT_NUM_POINTS, DEFAULT_ROTATIONS, DEFAULT_GROWTH_FACTOR,
                DEFAULT_RADIUS_SCALE);
    }

    public int getNumPoints() {
        return numPoints;
    }

    public double getRotations() {
        return rotations;
    }

    public double getGrowthFactor() {
        return growthFactor;
    }

    public double getRadiusScale() {
        return radiusScale;
    }

    public double maxAngle() {
        return rotations * 2 * Math.PI;
    }

    public double maxRadius(Viewport viewport) {
        return radiusScale * viewport.getMinDimension();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SamplingConfig))
            return false;
        SamplingConfig other = (SamplingConfig) o;
        return numPoints == other.numPoints
                && Double.compare(rotations, other.rotations) == 0
                && Double.compare(growthFactor, other.growthFactor) == 0
                && Double.compare(radiusScale, other.radiusScale) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numPoints, rotations, growthFactor, radiusScale);
    }

    @Override
    public String toString() {
        return "SamplingConfig[numPoints=" + numPoints + ", rotations=" + rotations
                + ", growthFactor=" + growthFactor + ", radiusScale=" + radiusScale + "]";
    }
}
