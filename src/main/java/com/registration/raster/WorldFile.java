package com.registration.raster;

import com.registration.exception.UnreadableRasterException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ESRI world file sidecar ({@code .tfw}, {@code .wld}, ...). GDAL reads and writes the same format.
 * <p>
 * The six lines are A, D, B, E, C, F where C/F are the world coordinates of the <em>centre</em>
 * of the upper-left pixel, whereas a {@link GeoTransform} origin is its upper-left corner.
 */
@Slf4j
public final class WorldFile {

    private WorldFile() {
    }

    /**
     * {@code image.tif -> image.tfw}, {@code image.png -> image.pgw}: first and last letter of the
     * extension followed by {@code w}.
     */
    public static Path sidecarFor(Path raster) {
        String name = raster.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return raster.resolveSibling(name + ".wld");
        }
        String ext = name.substring(dot + 1);
        String worldExt = ext.length() >= 2
                ? "" + ext.charAt(0) + ext.charAt(ext.length() - 1) + "w"
                : ext + "w";
        return raster.resolveSibling(name.substring(0, dot) + "." + worldExt.toLowerCase(Locale.ROOT));
    }

    public static Path genericSidecarFor(Path raster) {
        return withExtension(raster, "wld");
    }

    public static Path projectionFor(Path raster) {
        return withExtension(raster, "prj");
    }

    /**
     * GeoTransform from the world file next to {@code raster} ({@code .tfw} style first, then {@code .wld}),
     * or identity when there is none.
     */
    public static GeoTransform geoTransformNextTo(Path raster) throws UnreadableRasterException {
        Path worldFile = sidecarFor(raster);
        if (!Files.isRegularFile(worldFile)) {
            worldFile = genericSidecarFor(raster);
        }
        if (!Files.isRegularFile(worldFile)) {
            log.debug("No world file for {}, using identity geotransform", raster);
            return GeoTransform.identity();
        }
        try {
            return read(worldFile);
        } catch (IOException | NumberFormatException e) {
            throw new UnreadableRasterException(raster, "invalid world file " + worldFile + ": " + e.getMessage());
        }
    }

    /**
     * CRS text of the {@code .prj} next to {@code raster}, empty when there is none.
     */
    public static String crsNextTo(Path raster) throws UnreadableRasterException {
        Path prj = projectionFor(raster);
        if (!Files.isRegularFile(prj)) {
            return "";
        }
        try {
            return Files.readString(prj, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UnreadableRasterException(raster, e);
        }
    }

    public static GeoTransform read(Path worldFile) throws IOException {
        List<Double> values = new ArrayList<>();
        for (String line : Files.readAllLines(worldFile, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                values.add(Double.parseDouble(trimmed));
            }
        }
        if (values.size() < 6) {
            throw new IOException("World file " + worldFile + " has " + values.size() + " values, expected 6");
        }
        double a = values.get(0), d = values.get(1), b = values.get(2);
        double e = values.get(3), c = values.get(4), f = values.get(5);
        // Tâm pixel (0,0) -> góc trên trái
        return new GeoTransform(c - 0.5 * a - 0.5 * b, a, b, f - 0.5 * d - 0.5 * e, d, e);
    }

    public static void write(Path worldFile, GeoTransform geo) throws IOException {
        double a = geo.pixelWidth(), b = geo.rowRotation(), d = geo.columnRotation(), e = geo.pixelHeight();
        double c = geo.originX() + 0.5 * a + 0.5 * b;
        double f = geo.originY() + 0.5 * d + 0.5 * e;
        List<String> lines = new ArrayList<>();
        for (double v : new double[]{a, d, b, e, c, f}) {
            lines.add(format(v));
        }
        Files.write(worldFile, lines, StandardCharsets.UTF_8);
    }

    private static String format(double v) {
        return String.format(Locale.ROOT, "%.17g", v).trim();
    }

    private static Path withExtension(Path raster, String ext) {
        String name = raster.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot < 0 ? name : name.substring(0, dot);
        return raster.resolveSibling(base + "." + ext);
    }
}
