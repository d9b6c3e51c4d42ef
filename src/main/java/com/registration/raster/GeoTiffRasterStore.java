package com.registration.raster;

import com.registration.exception.UnreadableRasterException;
import com.registration.exception.UnwritableRasterException;
import lombok.extern.slf4j.Slf4j;
import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * GeoTIFF store for {@code .tif}/{@code .tiff} paths; every other path goes to the fallback store.
 * <ul>
 *     <li>Reading: every sample of every full-resolution directory becomes one band, any sample type
 *     and planar configuration, converted to float. Reduced-resolution and mask directories are skipped.
 *     Compressions the TIFF reader does not decode are handed to the fallback for the samples.</li>
 *     <li>Georeferencing: GeoTIFF tags ({@link GeoTiffTags}); world file and {@code .prj} sidecars
 *     when the file has none.</li>
 *     <li>Writing: one directory, one 32-bit float sample per band, chunky, uncompressed, with the
 *     GeoTIFF tags. A CRS that is not an EPSG code goes to a {@code .prj} sidecar.</li>
 * </ul>
 */
@Slf4j
public class GeoTiffRasterStore implements RasterStore {

    private static final int SUBFILE_REDUCED_RESOLUTION = 1;
    private static final int SUBFILE_MASK = 4;

    private final RasterStore fallback;

    public GeoTiffRasterStore(RasterStore fallback) {
        this.fallback = fallback;
    }

    @Override
    public Raster read(Path path) throws UnreadableRasterException {
        if (!RasterFiles.isTiff(path)) {
            return fallback.read(path);
        }
        if (!Files.isRegularFile(path)) {
            throw new UnreadableRasterException(path, "file does not exist");
        }

        TIFFImage tiff;
        try {
            tiff = TiffReader.readTiff(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new UnreadableRasterException(path, e);
        }
        List<FileDirectory> directories = new ArrayList<>();
        for (FileDirectory directory : tiff.getFileDirectories()) {
            if ((subfileType(directory) & (SUBFILE_REDUCED_RESOLUTION | SUBFILE_MASK)) != 0) {
                log.debug("Skipping overview/mask directory in {}", path);
                continue;
            }
            directories.add(directory);
        }
        if (directories.isEmpty()) {
            throw new UnreadableRasterException(path, "no image directory");
        }

        FileDirectory first = directories.get(0);
        GeoTransform geo = GeoTiffTags.readGeoTransform(first);
        if (geo == null) {
            geo = WorldFile.geoTransformNextTo(path);
        }
        String crs = GeoTiffTags.readCrs(first);
        if (crs.isEmpty()) {
            crs = WorldFile.crsNextTo(path);
        }

        int width = first.getImageWidth().intValue();
        int height = first.getImageHeight().intValue();
        List<float[]> bands = new ArrayList<>();
        try {
            for (int d = 0; d < directories.size(); d++) {
                FileDirectory directory = directories.get(d);
                int w = directory.getImageWidth().intValue();
                int h = directory.getImageHeight().intValue();
                if (w != width || h != height) {
                    throw new UnreadableRasterException(path, String.format(
                            "directory %d is %dx%d, expected %dx%d", d, w, h, width, height));
                }
                bands.addAll(samples(directory.readRasters()));
            }
        } catch (RuntimeException e) {
            log.info("TIFF reader cannot decode {} ({}), decoding samples with the fallback store", path, e.getMessage());
            return fallback.read(path).withGeoReference(geo, crs);
        }

        Raster raster = new Raster(width, height, bands.toArray(new float[0][]), geo, crs);
        log.debug("Read {} from {}", raster, path);
        return raster;
    }

    @Override
    public void write(Path path, Raster raster) throws UnwritableRasterException {
        if (!RasterFiles.isTiff(path)) {
            fallback.write(path, raster);
            return;
        }
        Path absolute = path.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            throw new UnwritableRasterException(path, "directory " + dir + " does not exist");
        }
        Path tmp = RasterFiles.temporarySibling(absolute);
        Path prjFile = WorldFile.projectionFor(absolute);
        boolean moved = false;

        try {
            FileDirectory directory = floatDirectory(raster);
            boolean crsEmbedded = GeoTiffTags.write(directory, raster.getGeoTransform(), raster.getCrs());
            TIFFImage image = new TIFFImage();
            image.add(directory);
            TiffWriter.writeTiff(tmp.toFile(), image);

            RasterFiles.moveIntoPlace(tmp, absolute);
            moved = true;
            // Georeferencing is in the tags
            Files.deleteIfExists(WorldFile.sidecarFor(absolute));
            if (crsEmbedded || raster.getCrs().isEmpty()) {
                Files.deleteIfExists(prjFile);
            } else {
                Files.writeString(prjFile, raster.getCrs(), StandardCharsets.UTF_8);
            }
            log.debug("Wrote {} to {}", raster, path);
        } catch (IOException | RuntimeException e) {
            if (moved) {
                RasterFiles.deleteQuietly(absolute);
                RasterFiles.deleteQuietly(prjFile);
            }
            throw new UnwritableRasterException(path, e);
        } finally {
            RasterFiles.deleteQuietly(tmp);
        }
    }

    private static FileDirectory floatDirectory(Raster raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bandCount = raster.getBandCount();

        Rasters rasters = new Rasters(width, height, bandCount, FieldType.FLOAT);
        for (int b = 0; b < bandCount; b++) {
            float[] band = raster.band(b);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    rasters.setPixelSample(b, x, y, band[y * width + x]);
                }
            }
        }

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(Collections.nCopies(bandCount, FieldType.FLOAT.getBits()));
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(bandCount);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(Collections.nCopies(bandCount, TiffConstants.SAMPLE_FORMAT_FLOAT));
        directory.setWriteRasters(rasters);
        return directory;
    }

    private static List<float[]> samples(Rasters rasters) {
        int width = rasters.getWidth();
        int height = rasters.getHeight();
        List<float[]> bands = new ArrayList<>();
        for (int s = 0; s < rasters.getSamplesPerPixel(); s++) {
            float[] band = new float[width * height];
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    band[y * width + x] = rasters.getPixelSample(s, x, y).floatValue();
                }
            }
            bands.add(band);
        }
        return bands;
    }

    private static int subfileType(FileDirectory directory) {
        FileDirectoryEntry entry = directory.get(FieldTagType.NewSubfileType);
        if (entry != null && entry.getValues() instanceof Number) {
            return ((Number) entry.getValues()).intValue();
        }
        return 0;
    }
}
