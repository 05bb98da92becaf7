package com.phillippitts.simrecon.domain;

/**
 * XY crop applied to a PSF before OTF conversion.
 *
 * @param width crop width in pixels
 * @param height crop height in pixels
 * @param centreX 0-indexed centre column, or {@code null} for the image centre
 * @param centreY 0-indexed centre row, or {@code null} for the image centre
 */
public record CropRegion(int width, int height, Double centreX, Double centreY) {

    public CropRegion {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Crop shape must be positive: " + width + "x" + height);
        }
        if ((centreX == null) != (centreY == null)) {
            throw new IllegalArgumentException("Crop centre needs both X and Y");
        }
    }

    public boolean hasCentre() {
        return centreX != null;
    }
}
