package com.helixvision.server.vision;

import com.helixvision.server.vision.io.BilinearImageResizer;
import com.helixvision.server.vision.io.GrayscaleConverter;
import com.helixvision.server.vision.io.ImageDecoder;
import com.helixvision.server.vision.io.ImageIoDecoder;
import com.helixvision.server.vision.io.ImageResizer;
import com.helixvision.server.vision.io.LumaGrayscaleConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.InputStream;

/**
 * End-to-end scan: decode, normalize to the viewport, convert to gray and
 * sample along the cached spiral path.
 * <p>
 * Input whose size differs from the viewport is resized rather than rejected.
 * The spiral path is computed on first use and kept for the lifetime of this
 * instance; a different viewport or sampling config needs a new orchestrator.
 */
public class ScanOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final Viewport viewport;
    private final SamplingConfig samplingConfig;
    private final SpiralPathGenerator generator;
    private final ImageSampler sampler;
    private final ImageDecoder decoder;
    private final ImageResizer resizer;
    private final GrayscaleConverter grayscaleConverter;

    private volatile SpiralPath spiralPath;

    public ScanOrchestrator(Viewport viewport, SamplingConfig samplingConfig) {
        this(viewport, samplingConfig, new SpiralPathGenerator(), new ImageSampler(), new ImageIoDecoder(),
                new BilinearImageResizer(), new LumaGrayscaleConverter());
    }

    public ScanOrchestrator(Viewport viewport, SamplingConfig samplingConfig, SpiralPathGenerator generator,
            ImageSampler sampler, ImageDecoder decoder, ImageResizer resizer,
            GrayscaleConverter grayscaleConverter) {
        if (viewport == null || samplingConfig == null) {
            throw new ConfigurationException("Viewport and sampling config are required");
        }
        this.viewport = viewport;
        this.samplingConfig = samplingConfig;
        this.generator = generator;
        this.sampler = sampler;
        this.decoder = decoder;
        this.resizer = resizer;
        this.grayscaleConverter = grayscaleConverter;
    }

    public Viewport getViewport() {
        return viewport;
    }

    public SamplingConfig getSamplingConfig() {
        return samplingConfig;
    }

    public SpiralPath getSpiralPath() {
        SpiralPath path = spiralPath;
        if (path == null) {
            synchronized (this) {
                path = spiralPath;
                if (path == null) {
                    path = generator.generate(viewport, samplingConfig);
                    spiralPath = path;
                }
            }
        }
        return path;
    }

    /**
     * @throws DecodeException if the path does not decode to an image
     */
    public ScanResult scan(String imagePath) {
        logger.debug("Decoding image from {}", imagePath);
        return scan(decoder.decode(imagePath));
    }

    /**
     * @throws DecodeException if the stream does not decode to an image
     */
    public ScanResult scan(InputStream encoded, String description) {
        logger.debug("Decoding image from {}", description);
        return scan(decoder.decode(encoded, description));
    }

    public ScanResult scan(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }

        BufferedImage normalized = image;
        if (!viewport.matches(image.getWidth(), image.getHeight())) {
            logger.debug("Resizing {}x{} input to {}x{}", image.getWidth(), image.getHeight(),
                    viewport.getWidth(), viewport.getHeight());
            normalized = resizer.resize(image, viewport.getWidth(), viewport.getHeight());
        }

        GrayImage gray = grayscaleConverter.toGrayscale(normalized);
        SpiralPath path = getSpiralPath();
        IntensityStreams streams = sampler.sample(path, gray);

        return new ScanResult(streams.getAlpha(), streams.getBeta(), path.getDepths(), normalized, gray);
    }
}
