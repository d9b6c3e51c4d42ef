package com.registration.raster;

import com.registration.homography.HomographyMatrix;
import lombok.Getter;

/**
 * Chooses the georeferencing of a warped raster. The warp resamples into the target's pixel grid,
 * so by default the target's geotransform and CRS are adopted as they are.
 */
@Getter
public class GeoMetadataReconciler {
    private final GeoReferencePolicy policy;

    public GeoMetadataReconciler() {
        this(GeoReferencePolicy.TARGET);
    }

    public GeoMetadataReconciler(GeoReferencePolicy policy) {
        this.policy = policy;
    }

    public Raster reconcile(Raster warped, Raster target, HomographyMatrix homography) {
        GeoTransform geo = target.getGeoTransform();
        if (policy == GeoReferencePolicy.HOMOGRAPHY_TRANSLATION) {
            geo = geo.shiftedByPixels(homography.translationX(), homography.translationY());
        }
        return warped.withGeoReference(geo, target.getCrs());
    }
}
