package com.helixvision.server.vision.present;

import com.helixvision.server.vision.ScanResult;
import com.helixvision.server.vision.SpiralPath;
import com.helixvision.server.vision.Viewport;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Draws a scan as a two-panel PNG.
 * <p>
 * Left: the normalized image with branch A (lime), branch B (cyan) and the
 * viewport corners (red). Right: both intensity streams with the sample axis
 * reversed, so the outermost sample is plotted first and the center last.
 */
public class ScanPresenter {

    static final Color ALPHA_COLOR = new Color(0, 255, 0);
    static final Color BETA_COLOR = new Color(0, 255, 255);
    static final Color CORNER_COLOR = new Color(255, 0, 0);
    static final Color BACKGROUND = Color.WHITE;

    private static final int MARGIN = 40;
    private static final int MIN_PLOT_WIDTH = 200;
    private static final int LEGEND_SWATCH = 12;

    private final int panelHeight;
    private final int pointSize;

    public ScanPresenter(int panelHeight, int pointSize) {
        if (panelHeight <= 2 * MARGIN) {
            throw new IllegalArgumentException("panelHeight must exceed " + (2 * MARGIN) + ", got " + panelHeight);
        }
        if (pointSize <= 0) {
            throw new IllegalArgumentException("pointSize must be positive, got " + pointSize);
        }
        this.panelHeight = panelHeight;
        this.pointSize = pointSize;
    }

    public int getPanelHeight() {
        return panelHeight;
    }

    public BufferedImage render(ScanResult result, SpiralPath path) {
        Viewport viewport = path.getViewport();
        double scale = (double) panelHeight / viewport.getHeight();
        int imageWidth = Math.max(1, (int) Math.round(viewport.getWidth() * scale));
        int plotWidth = Math.max(MIN_PLOT_WIDTH, imageWidth);

        BufferedImage canvas = new BufferedImage(imageWidth + plotWidth, panelHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

            drawGeometry(g, result.getSourceImage(), path, scale, imageWidth);
            drawStreams(g, result, imageWidth, plotWidth);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    public void writePng(BufferedImage image, OutputStream out) throws IOException {
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
    }

    private void drawGeometry(Graphics2D g, BufferedImage source, SpiralPath path, double scale, int imageWidth) {
        if (source != null) {
            g.drawImage(source, 0, 0, imageWidth, panelHeight, null);
        }

        int half = pointSize / 2;
        for (int i = 0; i < path.size(); i++) {
            g.setColor(ALPHA_COLOR);
            g.fillRect((int) (path.getXa(i) * scale) - half, (int) (path.getYa(i) * scale) - half, pointSize,
                    pointSize);
            g.setColor(BETA_COLOR);
            g.fillRect((int) (path.getXb(i) * scale) - half, (int) (path.getYb(i) * scale) - half, pointSize,
                    pointSize);
        }

        g.setColor(CORNER_COLOR);
        g.setStroke(new BasicStroke(3f));
        g.drawPolygon(cornerFrame(path.getViewport(), scale, imageWidth, panelHeight));
    }

    private void drawStreams(Graphics2D g, ScanResult result, int originX, int plotWidth) {
        int left = originX + MARGIN;
        int right = originX + plotWidth - MARGIN / 2;
        int top = MARGIN;
        int bottom = panelHeight - MARGIN;

        g.setColor(Color.BLACK);
        g.setStroke(new BasicStroke(1f));
        g.drawLine(left, bottom, right, bottom);
        g.drawLine(left, top, left, bottom);

        int[] alpha = result.getAlphaStream();
        int[] beta = result.getBetaStream();
        int maxValue = 255;
        for (int i = 0; i < alpha.length; i++) {
            maxValue = Math.max(maxValue, Math.max(alpha[i], beta[i]));
        }

        g.setColor(ALPHA_COLOR.darker());
        g.draw(reversedSeries(alpha, maxValue, left, right, top, bottom));
        g.setColor(BETA_COLOR.darker());
        g.draw(reversedSeries(beta, maxValue, left, right, top, bottom));

        // legend: alpha swatch above beta swatch
        g.setColor(ALPHA_COLOR.darker());
        g.fillRect(right - LEGEND_SWATCH, top, LEGEND_SWATCH, LEGEND_SWATCH / 2);
        g.setColor(BETA_COLOR.darker());
        g.fillRect(right - LEGEND_SWATCH, top + LEGEND_SWATCH, LEGEND_SWATCH, LEGEND_SWATCH / 2);
    }

    /**
     * Viewport corners in panel pixels, clamped so the far edges stay on the
     * last column and row of the image panel.
     */
    static Polygon cornerFrame(Viewport viewport, double scale, int imageWidth, int imageHeight) {
        Polygon frame = new Polygon();
        for (int[] corner : viewport.getCorners()) {
            int x = Math.min((int) Math.round(corner[0] * scale), imageWidth - 1);
            int y = Math.min((int) Math.round(corner[1] * scale), imageHeight - 1);
            frame.addPoint(x, y);
        }
        return frame;
    }

    static Path2D reversedSeries(int[] values, int maxValue, int left, int right, int top, int bottom) {
        Path2D line = new Path2D.Double();
        int n = values.length;
        if (n == 0) {
            return line;
        }
        double dx = n > 1 ? (double) (right - left) / (n - 1) : 0;
        double dy = (double) (bottom - top) / maxValue;
        for (int j = 0; j < n; j++) {
            double x = left + j * dx;
            double y = bottom - values[n - 1 - j] * dy;
            if (j == 0) {
                line.moveTo(x, y);
            } else {
                line.lineTo(x, y);
            }
        }
        return line;
    }
}
