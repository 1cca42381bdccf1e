package com.helixvision.server.controller;

import com.helixvision.server.service.HelixScanService;
import com.helixvision.server.vision.DecodeException;
import com.helixvision.server.vision.ScanResult;
import com.helixvision.server.vision.SpiralPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
public class ScanController {

    private static final Logger logger = LoggerFactory.getLogger(ScanController.class);
    private final HelixScanService scanService;

    public ScanController(HelixScanService scanService) {
        this.scanService = scanService;
    }

    public static class ScanResponse {
        public int width;
        public int height;
        public int sampleCount;
        public int[] alphaStream;
        public int[] betaStream;
        public double[] depthStream;
    }

    public static class SpiralResponse {
        public int width;
        public int height;
        public int sampleCount;
        public int[] xa;
        public int[] ya;
        public int[] xb;
        public int[] yb;
        public double[] depth;
        public double[] theta;
    }

    @PostMapping(value = "/scan", consumes = MediaType.ALL_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> scan(@RequestBody(required = false) byte[] image) {
        if (image == null || image.length == 0) {
            return ResponseEntity.badRequest().body("Request body must contain an encoded image.");
        }
        logger.info("Received scan request ({} bytes).", image.length);

        try {
            ScanResult result = scanService.scan(image, "request body");
            return ResponseEntity.ok(toResponse(result));
        } catch (DecodeException e) {
            logger.warn("Rejected scan request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Scan failed", e);
            return ResponseEntity.internalServerError().body("Scan failed.");
        }
    }

    @PostMapping(value = "/scan/render", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<?> render(@RequestBody(required = false) byte[] image) {
        if (image == null || image.length == 0) {
            return ResponseEntity.badRequest().body("Request body must contain an encoded image.");
        }

        try {
            ScanResult result = scanService.scan(image, "request body");
            return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(scanService.renderPng(result));
        } catch (DecodeException e) {
            logger.warn("Rejected render request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Render failed", e);
            return ResponseEntity.internalServerError().body("Render failed.");
        }
    }

    @GetMapping(value = "/spiral", produces = MediaType.APPLICATION_JSON_VALUE)
    public SpiralResponse spiral() {
        SpiralPath path = scanService.getSpiralPath();
        SpiralResponse response = new SpiralResponse();
        response.width = path.getViewport().getWidth();
        response.height = path.getViewport().getHeight();
        response.sampleCount = path.size();
        response.xa = path.getXaValues();
        response.ya = path.getYaValues();
        response.xb = path.getXbValues();
        response.yb = path.getYbValues();
        response.depth = path.getDepths();
        response.theta = path.getThetas();
        return response;
    }

    private ScanResponse toResponse(ScanResult result) {
        ScanResponse response = new ScanResponse();
        response.width = result.getGrayImage().getWidth();
        response.height = result.getGrayImage().getHeight();
        response.sampleCount = result.size();
        response.alphaStream = result.getAlphaStream();
        response.betaStream = result.getBetaStream();
        response.depthStream = result.getDepthStream();
        return response;
    }
}
