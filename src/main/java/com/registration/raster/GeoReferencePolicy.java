package com.registration.raster;

public enum GeoReferencePolicy {
    /** Output carries the target's geotransform and CRS unchanged. */
    TARGET,
    /**
     * Target geotransform with its origin moved by the homography's translation terms, in pixels.
     * Only the translation of the homography is reflected.
     */
    HOMOGRAPHY_TRANSLATION
}
