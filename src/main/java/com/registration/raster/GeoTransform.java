package com.registration.raster;

import java.util.Arrays;

/**
 * Six-coefficient affine mapping from pixel (col, row) to world (x, y), GDAL order:
 * <pre>
 *   x = c[0] + col * c[1] + row * c[2]
 *   y = c[3] + col * c[4] + row * c[5]
 * </pre>
 */
public final class GeoTransform {
    private static final GeoTransform IDENTITY = new GeoTransform(0, 1, 0, 0, 0, 1);

    private final double[] c;

    public GeoTransform(double originX, double pixelWidth, double rowRotation,
                        double originY, double columnRotation, double pixelHeight) {
        this.c = new double[]{originX, pixelWidth, rowRotation, originY, columnRotation, pixelHeight};
    }

    public static GeoTransform of(double[] coefficients) {
        if (coefficients == null || coefficients.length != 6) {
            throw new IllegalArgumentException("GeoTransform needs exactly 6 coefficients");
        }
        return new GeoTransform(coefficients[0], coefficients[1], coefficients[2],
                coefficients[3], coefficients[4], coefficients[5]);
    }

    public static GeoTransform identity() {
        return IDENTITY;
    }

    public double[] coefficients() {
        return c.clone();
    }

    public double originX() { return c[0]; }
    public double pixelWidth() { return c[1]; }
    public double rowRotation() { return c[2]; }
    public double originY() { return c[3]; }
    public double columnRotation() { return c[4]; }
    public double pixelHeight() { return c[5]; }

    public double[] toWorld(double col, double row) {
        return new double[]{
                c[0] + col * c[1] + row * c[2],
                c[3] + col * c[4] + row * c[5]
        };
    }

    /**
     * Moves the origin by a pixel offset along the pixel axes. Used by the manual adjustment
     * step: {@code originX += dx * pixelWidth}, {@code originY += dy * pixelHeight}.
     */
    public GeoTransform shiftedByPixels(double dx, double dy) {
        return new GeoTransform(c[0] + dx * c[1], c[1], c[2], c[3] + dy * c[5], c[4], c[5]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoTransform)) return false;
        return Arrays.equals(c, ((GeoTransform) o).c);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(c);
    }

    @Override
    public String toString() {
        return "GeoTransform" + Arrays.toString(c);
    }
}
