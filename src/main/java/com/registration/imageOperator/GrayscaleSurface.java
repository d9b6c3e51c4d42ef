package com.registration.imageOperator;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Single-band 8-bit intensity image used only for feature detection.
 */
@Getter
public class GrayscaleSurface {
    private final int width;
    private final int height;
    private final byte[] pixels;

    public GrayscaleSurface(int width, int height, byte[] pixels) {
        if (width <= 0 || height <= 0 || pixels.length != width * height) {
            throw new IllegalArgumentException("Invalid surface " + width + "x" + height + " with " + pixels.length + " pixels");
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /** Unsigned value in [0, 255]. */
    public int get(int row, int col) {
        return pixels[row * width + col] & 0xFF;
    }

    public Mat toMat() {
        return ImageUtils.byteMat(pixels, width, height);
    }
}
