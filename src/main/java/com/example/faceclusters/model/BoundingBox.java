package com.example.faceclusters.model;

import java.awt.Rectangle;

/**
 * Face bounding box inside its source image. Either all pixel units or all
 * normalized (0..1) units; a box whose extent fits inside the unit square is
 * treated as normalized. Observations carry no units flag, so a pixel box of at
 * most one pixel at the origin reads as the whole image. Such a box is far below
 * any detectable face size.
 */
public record BoundingBox(double x, double y, double width, double height) {

    public boolean isEmpty() {
        return !(width > 0) || !(height > 0);
    }

    public boolean isNormalized() {
        return x >= 0 && y >= 0 && width <= 1.0 && height <= 1.0
                && x + width <= 1.0 + 1e-9 && y + height <= 1.0 + 1e-9;
    }

    public double aspectRatio() {
        return height > 0 ? width / height : 0.0;
    }

    /**
     * Converts to a pixel rectangle clamped to the image bounds. Returns an empty
     * rectangle when nothing of the box lies inside the image.
     */
    public Rectangle toPixels(int imageWidth, int imageHeight) {
        double px = x, py = y, pw = width, ph = height;
        if (isNormalized()) {
            px *= imageWidth;
            py *= imageHeight;
            pw *= imageWidth;
            ph *= imageHeight;
        }
        if (px >= imageWidth || py >= imageHeight || px + pw <= 0 || py + ph <= 0) {
            return new Rectangle(0, 0, 0, 0);
        }
        if (px < 0) {
            pw += px;
            px = 0;
        }
        if (py < 0) {
            ph += py;
            py = 0;
        }

        int left = (int) Math.max(0, Math.min(Math.floor(px), imageWidth - 1));
        int top = (int) Math.max(0, Math.min(Math.floor(py), imageHeight - 1));
        int w = (int) Math.min(Math.round(pw), imageWidth - left);
        int h = (int) Math.min(Math.round(ph), imageHeight - top);

        if (w <= 0 || h <= 0) {
            return new Rectangle(0, 0, 0, 0);
        }
        return new Rectangle(left, top, w, h);
    }
}
