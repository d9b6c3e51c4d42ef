package com.registration.imageRegistration;

import com.registration.exception.RegistrationException;
import com.registration.raster.GeoTransform;
import com.registration.raster.Raster;
import com.registration.raster.RasterStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Fine correction after registration: shifts the georeferencing of a raster by a whole or
 * fractional number of pixels. Samples are copied unchanged.
 */
@Slf4j
public class ManualAdjustment {
    private final RasterStore store;

    public ManualAdjustment(RasterStore store) {
        this.store = store;
    }

    public Raster apply(Path input, Path output, double dx, double dy) throws RegistrationException {
        Raster raster = store.read(input);
        GeoTransform shifted = raster.getGeoTransform().shiftedByPixels(dx, dy);
        Raster adjusted = raster.withGeoReference(shifted, raster.getCrs());
        store.write(output, adjusted);
        log.info("Shifted {} by ({}, {}) px -> {}", input, dx, dy, output);
        return adjusted;
    }
}
