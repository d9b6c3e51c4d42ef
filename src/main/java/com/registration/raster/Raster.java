package com.registration.raster;

import lombok.Getter;

/**
 * Multi-band float raster with its georeferencing.
 * <p>
 * Samples are stored band by band in row-major order: {@code bands[b][row * width + col]}.
 * The raster takes ownership of the arrays passed in; callers must not keep writing to them.
 */
@Getter
public class Raster {
    private final int width;
    private final int height;
    private final float[][] bands;
    private final GeoTransform geoTransform;
    private final String crs;

    public Raster(int width, int height, float[][] bands, GeoTransform geoTransform, String crs) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster size must be positive, got " + width + "x" + height);
        }
        if (bands == null || bands.length == 0) {
            throw new IllegalArgumentException("Raster needs at least one band");
        }
        for (int b = 0; b < bands.length; b++) {
            if (bands[b] == null || bands[b].length != width * height) {
                throw new IllegalArgumentException("Band " + b + " does not match raster size " + width + "x" + height);
            }
        }
        this.width = width;
        this.height = height;
        this.bands = bands;
        this.geoTransform = geoTransform == null ? GeoTransform.identity() : geoTransform;
        this.crs = crs == null ? "" : crs;
    }

    public int getBandCount() {
        return bands.length;
    }

    public float[] band(int index) {
        return bands[index];
    }

    public float get(int band, int row, int col) {
        return bands[band][row * width + col];
    }

    /**
     * Same samples, different georeferencing. The band arrays are shared, not copied.
     */
    public Raster withGeoReference(GeoTransform geoTransform, String crs) {
        return new Raster(width, height, bands, geoTransform, crs);
    }

    @Override
    public String toString() {
        return String.format("Raster[%dx%d, %d band(s), %s]", width, height, bands.length, geoTransform);
    }
}
