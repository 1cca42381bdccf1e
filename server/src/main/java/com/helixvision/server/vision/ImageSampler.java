package com.helixvision.server.vision;

public class ImageSampler {

    /**
     * Gathers the intensity under every retained sample of both branches.
     *
     * @param path  spiral path built for the image's viewport
     * @param image gray image with exactly the viewport's dimensions
     * @return streams index-aligned with {@link SpiralPath#getDepths()}
     * @throws DimensionMismatchException if the image size differs from the
     *                                    path's viewport
     */
    public IntensityStreams sample(SpiralPath path, GrayImage image) {
        Viewport viewport = path.getViewport();
        if (!viewport.matches(image.getWidth(), image.getHeight())) {
            throw new DimensionMismatchException(viewport.getWidth(), viewport.getHeight(),
                    image.getWidth(), image.getHeight());
        }

        int n = path.size();
        int[] alpha = new int[n];
        int[] beta = new int[n];
        for (int i = 0; i < n; i++) {
            alpha[i] = image.get(path.getXa(i), path.getYa(i));
            beta[i] = image.get(path.getXb(i), path.getYb(i));
        }
        return new IntensityStreams(alpha, beta);
    }
}
