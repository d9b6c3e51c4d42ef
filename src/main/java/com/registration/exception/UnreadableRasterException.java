package com.registration.exception;

import java.nio.file.Path;

public class UnreadableRasterException extends RegistrationException {

    public UnreadableRasterException(Path path, String reason) {
        super("Cannot read raster " + path + ": " + reason);
    }

    public UnreadableRasterException(Path path, Throwable cause) {
        super("Cannot read raster " + path + ": " + cause.getMessage(), cause);
    }

    @Override
    public String kind() {
        return "UnreadableRaster";
    }
}
