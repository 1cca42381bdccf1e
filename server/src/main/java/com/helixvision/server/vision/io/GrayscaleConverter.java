package com.helixvision.server.vision.io;

import com.helixvision.server.vision.GrayImage;

import java.awt.image.BufferedImage;

public interface GrayscaleConverter {
    GrayImage toGrayscale(BufferedImage image);
}
