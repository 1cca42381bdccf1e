package com.helixvision.server.vision.io;

import java.awt.image.BufferedImage;

public interface ImageResizer {
    BufferedImage resize(BufferedImage image, int width, int height);
}
