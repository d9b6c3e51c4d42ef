package com.registration.raster;

import com.registration.exception.UnreadableRasterException;
import com.registration.exception.UnwritableRasterException;

import java.nio.file.Path;

/**
 * Raster decode/encode boundary. Calls block; nothing is retried here.
 */
public interface RasterStore {

    Raster read(Path path) throws UnreadableRasterException;

    /**
     * Writes the raster and its georeferencing. Either everything is written or nothing is left behind.
     */
    void write(Path path, Raster raster) throws UnwritableRasterException;
}
