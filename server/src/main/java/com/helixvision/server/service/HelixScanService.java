package com.helixvision.server.service;

import com.helixvision.server.config.ConfigResolver;
import com.helixvision.server.config.HelixConfig;
import com.helixvision.server.vision.ScanOrchestrator;
import com.helixvision.server.vision.ScanResult;
import com.helixvision.server.vision.SpiralPath;
import com.helixvision.server.vision.present.ScanPresenter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

@Service
public class HelixScanService {

    private static final Logger logger = LoggerFactory.getLogger(HelixScanService.class);

    private final ScanOrchestrator orchestrator;
    private final ScanPresenter presenter;

    public HelixScanService() {
        this(ConfigResolver.resolve());
    }

    public HelixScanService(HelixConfig config) {
        this.orchestrator = new ScanOrchestrator(config.toViewport(), config.toSamplingConfig());
        this.presenter = config.toPresenter();
    }

    @PostConstruct
    public void init() {
        logger.info("Initializing helix scan service for {} with {}", orchestrator.getViewport(),
                orchestrator.getSamplingConfig());
        SpiralPath path = orchestrator.getSpiralPath();
        logger.info("Spiral path ready: {} samples", path.size());
    }

    public ScanOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public SpiralPath getSpiralPath() {
        return orchestrator.getSpiralPath();
    }

    public ScanResult scan(String imagePath) {
        return orchestrator.scan(imagePath);
    }

    public ScanResult scan(byte[] encodedImage, String description) {
        return orchestrator.scan(new ByteArrayInputStream(encodedImage), description);
    }

    public byte[] renderPng(ScanResult result) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            presenter.writePng(presenter.render(result, orchestrator.getSpiralPath()), out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode scan visualization", e);
        }
        return out.toByteArray();
    }
}
