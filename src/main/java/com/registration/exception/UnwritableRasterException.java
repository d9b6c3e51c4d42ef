package com.registration.exception;

import java.nio.file.Path;

public class UnwritableRasterException extends RegistrationException {

    public UnwritableRasterException(Path path, String reason) {
        super("Cannot write raster " + path + ": " + reason);
    }

    public UnwritableRasterException(Path path, Throwable cause) {
        super("Cannot write raster " + path + ": " + cause.getMessage(), cause);
    }

    @Override
    public String kind() {
        return "UnwritableRaster";
    }
}
