package com.registration.raster;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GeoTIFF georeferencing tags of one TIFF directory.
 * <p>
 * Reading understands ModelPixelScale + ModelTiepoint (north-up) and ModelTransformation, and the
 * horizontal EPSG code of the GeoKeyDirectory. A PixelIsPoint raster is shifted half a pixel so the
 * returned {@link GeoTransform} is always anchored at the upper-left pixel corner, the way GDAL reports it.
 * Writing is always PixelIsArea.
 */
public final class GeoTiffTags {

    static final int KEY_MODEL_TYPE = 1024;
    static final int KEY_RASTER_TYPE = 1025;
    static final int KEY_GEOGRAPHIC_TYPE = 2048;
    static final int KEY_PROJECTED_CS_TYPE = 3072;

    static final int MODEL_TYPE_PROJECTED = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int RASTER_PIXEL_IS_AREA = 1;
    static final int RASTER_PIXEL_IS_POINT = 2;

    private static final Pattern EPSG = Pattern.compile("EPSG:(\\d+)", Pattern.CASE_INSENSITIVE);

    private GeoTiffTags() {
    }

    /**
     * @return the corner-anchored GeoTransform, or {@code null} when the directory carries no georeferencing
     */
    public static GeoTransform readGeoTransform(FileDirectory directory) {
        boolean pixelIsPoint = geoKeys(directory).getOrDefault(KEY_RASTER_TYPE, RASTER_PIXEL_IS_AREA)
                == RASTER_PIXEL_IS_POINT;
        double half = pixelIsPoint ? 0.5 : 0.0;

        double[] m = values(directory, FieldTagType.ModelTransformation);
        if (m != null && m.length >= 16) {
            return new GeoTransform(m[3] - half * m[0] - half * m[1], m[0], m[1],
                    m[7] - half * m[4] - half * m[5], m[4], m[5]);
        }

        double[] scale = values(directory, FieldTagType.ModelPixelScale);
        double[] tie = values(directory, FieldTagType.ModelTiepoint);
        if (scale != null && scale.length >= 2 && tie != null && tie.length >= 6) {
            double sx = scale[0], sy = scale[1];
            double i = tie[0], j = tie[1], x = tie[3], y = tie[4];
            return new GeoTransform(x - (i + half) * sx, sx, 0.0, y + (j + half) * sy, 0.0, -sy);
        }
        return null;
    }

    /**
     * @return {@code EPSG:<code>} of the projected or geographic CRS key, or empty
     */
    public static String readCrs(FileDirectory directory) {
        Map<Integer, Integer> keys = geoKeys(directory);
        Integer code = keys.get(KEY_PROJECTED_CS_TYPE);
        if (code == null) {
            code = keys.get(KEY_GEOGRAPHIC_TYPE);
        }
        // 32767 = user-defined, not an EPSG code
        if (code == null || code == 32767) {
            return "";
        }
        return "EPSG:" + code;
    }

    /**
     * Adds the georeferencing tags for {@code geo} and {@code crs} to a directory being written.
     * Nothing is added for the identity transform. The CRS is embedded only when it is an EPSG code.
     *
     * @return whether the CRS went into the GeoKeyDirectory
     */
    public static boolean write(FileDirectory directory, GeoTransform geo, String crs) {
        Integer epsg = epsgCode(crs);
        boolean hasTransform = !GeoTransform.identity().equals(geo);
        if (!hasTransform && epsg == null) {
            return false;
        }

        if (hasTransform) {
            boolean northUp = geo.rowRotation() == 0.0 && geo.columnRotation() == 0.0
                    && geo.pixelWidth() > 0.0 && geo.pixelHeight() < 0.0;
            if (northUp) {
                directory.addEntry(doubles(FieldTagType.ModelPixelScale,
                        geo.pixelWidth(), -geo.pixelHeight(), 0.0));
                directory.addEntry(doubles(FieldTagType.ModelTiepoint,
                        0.0, 0.0, 0.0, geo.originX(), geo.originY(), 0.0));
            } else {
                directory.addEntry(doubles(FieldTagType.ModelTransformation,
                        geo.pixelWidth(), geo.rowRotation(), 0.0, geo.originX(),
                        geo.columnRotation(), geo.pixelHeight(), 0.0, geo.originY(),
                        0.0, 0.0, 0.0, 0.0,
                        0.0, 0.0, 0.0, 1.0));
            }
        }

        Map<Integer, Integer> keys = new TreeMap<>();
        keys.put(KEY_RASTER_TYPE, RASTER_PIXEL_IS_AREA);
        if (epsg != null) {
            // EPSG geographic 2D CRS codes sit in 4000-4999
            boolean geographic = epsg >= 4000 && epsg < 5000;
            keys.put(KEY_MODEL_TYPE, geographic ? MODEL_TYPE_GEOGRAPHIC : MODEL_TYPE_PROJECTED);
            keys.put(geographic ? KEY_GEOGRAPHIC_TYPE : KEY_PROJECTED_CS_TYPE, epsg);
        }
        List<Integer> directoryValues = new ArrayList<>(Arrays.asList(1, 1, 0, keys.size()));
        for (Map.Entry<Integer, Integer> key : keys.entrySet()) {
            directoryValues.addAll(Arrays.asList(key.getKey(), 0, 1, key.getValue()));
        }
        directory.addEntry(new FileDirectoryEntry(FieldTagType.GeoKeyDirectory, FieldType.SHORT,
                directoryValues.size(), directoryValues));
        return epsg != null;
    }

    static Integer epsgCode(String crs) {
        if (crs == null) {
            return null;
        }
        Matcher matcher = EPSG.matcher(crs.trim());
        return matcher.matches() ? Integer.valueOf(matcher.group(1)) : null;
    }

    /**
     * Inline SHORT keys of the GeoKeyDirectory: header {@code 1,1,0,n} then {@code id, location, count, value}.
     */
    static Map<Integer, Integer> geoKeys(FileDirectory directory) {
        Map<Integer, Integer> keys = new TreeMap<>();
        double[] gk = values(directory, FieldTagType.GeoKeyDirectory);
        if (gk == null || gk.length < 4 || gk[0] != 1) {
            return keys;
        }
        int count = (int) gk[3];
        for (int k = 0, idx = 4; k < count && idx + 3 < gk.length; k++, idx += 4) {
            if (gk[idx + 1] == 0 && gk[idx + 2] == 1) {
                keys.put((int) gk[idx], (int) gk[idx + 3]);
            }
        }
        return keys;
    }

    private static double[] values(FileDirectory directory, FieldTagType tag) {
        FileDirectoryEntry entry = directory.get(tag);
        if (entry == null || entry.getValues() == null) {
            return null;
        }
        Object values = entry.getValues();
        if (values instanceof Number) {
            return new double[]{((Number) values).doubleValue()};
        }
        if (values instanceof List) {
            List<?> list = (List<?>) values;
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                out[i] = ((Number) list.get(i)).doubleValue();
            }
            return out;
        }
        return null;
    }

    private static FileDirectoryEntry doubles(FieldTagType tag, double... values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return new FileDirectoryEntry(tag, FieldType.DOUBLE, list.size(), list);
    }
}
