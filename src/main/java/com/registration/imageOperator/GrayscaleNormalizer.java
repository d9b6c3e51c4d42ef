package com.registration.imageOperator;

import com.registration.raster.Raster;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Reduces an N-band raster to an 8-bit surface that feature detectors can work on.
 * <p>
 * Bands are averaged per pixel, then the result is stretched linearly so that the low percentile
 * maps to 0 and the high percentile to 255. Percentile clipping keeps sensor noise and height
 * spikes from dominating the stretch.
 */
@Slf4j
public class GrayscaleNormalizer {
    public static final double DEFAULT_LOW_PERCENTILE = 2.0;
    public static final double DEFAULT_HIGH_PERCENTILE = 98.0;

    private final double lowPercentile;
    private final double highPercentile;

    public GrayscaleNormalizer() {
        this(DEFAULT_LOW_PERCENTILE, DEFAULT_HIGH_PERCENTILE);
    }

    public GrayscaleNormalizer(double lowPercentile, double highPercentile) {
        if (lowPercentile < 0 || highPercentile > 100 || lowPercentile > highPercentile) {
            throw new IllegalArgumentException("Invalid percentile pair (" + lowPercentile + ", " + highPercentile + ")");
        }
        this.lowPercentile = lowPercentile;
        this.highPercentile = highPercentile;
    }

    public GrayscaleSurface normalize(Raster raster) {
        float[] gray = meanOfBands(raster);

        float[] sorted = finiteSorted(gray);
        double min = percentile(sorted, lowPercentile);
        double max = percentile(sorted, highPercentile);
        // Ảnh hằng: tránh chia cho 0
        if (max == min) {
            max = min + 1.0;
        }
        log.debug("Stretching {}x{} surface from [{}, {}]", raster.getWidth(), raster.getHeight(), min, max);

        double range = max - min;
        byte[] pixels = new byte[gray.length];
        for (int i = 0; i < gray.length; i++) {
            float v = gray[i];
            if (!Float.isFinite(v)) {
                continue;
            }
            double t = (v - min) / range;
            t = Math.max(0.0, Math.min(1.0, t));
            pixels[i] = (byte) Math.round(t * 255.0);
        }
        return new GrayscaleSurface(raster.getWidth(), raster.getHeight(), pixels);
    }

    static float[] meanOfBands(Raster raster) {
        int bandCount = raster.getBandCount();
        if (bandCount == 1) {
            return raster.band(0);
        }
        int n = raster.getWidth() * raster.getHeight();
        float[] mean = new float[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int b = 0; b < bandCount; b++) {
                sum += raster.band(b)[i];
            }
            mean[i] = (float) (sum / bandCount);
        }
        return mean;
    }

    /**
     * Finite samples only, ascending. NaN and infinite nodata take no part in the stretch.
     */
    static float[] finiteSorted(float[] values) {
        float[] sorted = new float[values.length];
        int n = 0;
        for (float v : values) {
            if (Float.isFinite(v)) sorted[n++] = v;
        }
        sorted = Arrays.copyOf(sorted, n);
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * Percentile of ascending values with linear interpolation between closest ranks.
     * An empty input yields 0.
     */
    static double percentile(float[] sorted, double p) {
        int n = sorted.length;
        if (n == 0) {
            return 0.0;
        }
        double rank = p / 100.0 * (n - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        double frac = rank - lo;
        return sorted[lo] + (sorted[hi] - (double) sorted[lo]) * frac;
    }
}
