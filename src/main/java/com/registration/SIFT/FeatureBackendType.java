package com.registration.SIFT;

public enum FeatureBackendType {
    /** OpenCV's SIFT implementation. */
    OPENCV_SIFT,
    /** In-house difference-of-Gaussians detector, see {@code scaleSpaceSIFT}. */
    SCALE_SPACE
}
