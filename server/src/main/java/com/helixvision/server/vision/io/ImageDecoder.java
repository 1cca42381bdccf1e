package com.helixvision.server.vision.io;

import java.awt.image.BufferedImage;
import java.io.InputStream;

public interface ImageDecoder {
    /**
     * Decodes the image file at {@code path}.
     *
     * @throws com.helixvision.server.vision.DecodeException if the file is
     *                                                       missing or not a
     *                                                       readable image
     */
    BufferedImage decode(String path);

    /**
     * Decodes an encoded image from a stream. The stream is not closed.
     *
     * @param description used in error messages only
     */
    BufferedImage decode(InputStream encoded, String description);
}
