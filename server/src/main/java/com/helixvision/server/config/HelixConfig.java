package com.helixvision.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.helixvision.server.vision.SamplingConfig;
import com.helixvision.server.vision.Viewport;
import com.helixvision.server.vision.present.ScanPresenter;

/**
 * Bound from helix_config.json. Missing values fall back to the defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HelixConfig {

    public static final int DEFAULT_WIDTH = 1920;
    public static final int DEFAULT_HEIGHT = 1080;
    public static final int DEFAULT_PANEL_HEIGHT = 540;
    public static final int DEFAULT_POINT_SIZE = 2;

    public ViewportSection viewport;
    public SamplingSection sampling;
    public PresenterSection presenter;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ViewportSection {
        public Integer width;
        public Integer height;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SamplingSection {
        public Integer numPoints;
        public Double rotations;
        public Double growthFactor;
        public Double radiusScale;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PresenterSection {
        public Integer panelHeight;
        public Integer pointSize;
    }

    public Viewport toViewport() {
        int w = viewport != null && viewport.width != null ? viewport.width : DEFAULT_WIDTH;
        int h = viewport != null && viewport.height != null ? viewport.height : DEFAULT_HEIGHT;
        return new Viewport(w, h);
    }

    public SamplingConfig toSamplingConfig() {
        SamplingSection s = sampling != null ? sampling : new SamplingSection();
        int np = s.numPoints != null ? s.numPoints : SamplingConfig.DEFAULT_NUM_POINTS;
        double rot = s.rotations != null ? s.rotations : SamplingConfig.DEFAULT_ROTATIONS;
        double gf = s.growthFactor != null ? s.growthFactor : SamplingConfig.DEFAULT_GROWTH_FACTOR;
        double rs = s.radiusScale != null ? s.radiusScale : SamplingConfig.DEFAULT_RADIUS_SCALE;
        return new SamplingConfig(np, rot, gf, rs);
    }

    public ScanPresenter toPresenter() {
        int ph = presenter != null && presenter.panelHeight != null ? presenter.panelHeight : DEFAULT_PANEL_HEIGHT;
        int ps = presenter != null && presenter.pointSize != null ? presenter.pointSize : DEFAULT_POINT_SIZE;
        return new ScanPresenter(ph, ps);
    }
}
