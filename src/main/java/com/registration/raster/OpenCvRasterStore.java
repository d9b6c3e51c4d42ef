package com.registration.raster;

import com.registration.exception.UnreadableRasterException;
import com.registration.exception.UnwritableRasterException;
import com.registration.imageOperator.ImageUtils;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.split;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_UNCHANGED;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imreadmulti;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imwritemulti;

/**
 * Raster store on top of OpenCV's image codecs, used for formats other than TIFF and for TIFF
 * encodings the GeoTIFF reader cannot decode.
 * <ul>
 *     <li>Reading: every page of the file, every channel of a page becomes one band, converted to float.
 *     OpenCV hands 3 and 4 channel pages over as BGR(A); they are put back in RGB(A) order.
 *     OpenCV only decodes 1, 3 or 4 channel pages.</li>
 *     <li>Writing: one 32-bit float page per band, when the format has a float encoder.</li>
 *     <li>Georeferencing lives in a world file and a {@code .prj} next to the raster.</li>
 * </ul>
 */
@Slf4j
public class OpenCvRasterStore implements RasterStore {

    @Override
    public Raster read(Path path) throws UnreadableRasterException {
        if (!Files.isRegularFile(path)) {
            throw new UnreadableRasterException(path, "file does not exist");
        }

        MatVector pages = new MatVector();
        try {
            boolean ok;
            try {
                ok = imreadmulti(path.toString(), pages, IMREAD_UNCHANGED);
            } catch (RuntimeException e) {
                throw new UnreadableRasterException(path, e);
            }
            if (!ok || pages.size() == 0) {
                throw new UnreadableRasterException(path, "unsupported format or corrupt file");
            }

            int width = pages.get(0).cols();
            int height = pages.get(0).rows();
            List<float[]> bands = new ArrayList<>();
            for (long p = 0; p < pages.size(); p++) {
                Mat page = pages.get(p);
                if (page.cols() != width || page.rows() != height) {
                    throw new UnreadableRasterException(path, String.format(
                            "page %d is %dx%d, expected %dx%d", p, page.cols(), page.rows(), width, height));
                }
                bands.addAll(pageBands(page));
            }

            GeoTransform geo = WorldFile.geoTransformNextTo(path);
            String crs = WorldFile.crsNextTo(path);
            Raster raster = new Raster(width, height, bands.toArray(new float[0][]), geo, crs);
            log.debug("Read {} from {}", raster, path);
            return raster;
        } finally {
            pages.close();
        }
    }

    @Override
    public void write(Path path, Raster raster) throws UnwritableRasterException {
        Path absolute = path.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            throw new UnwritableRasterException(path, "directory " + dir + " does not exist");
        }
        Path tmp = RasterFiles.temporarySibling(absolute);
        Path worldFile = WorldFile.sidecarFor(absolute);
        Path prjFile = WorldFile.projectionFor(absolute);
        boolean moved = false;

        MatVector pages = new MatVector(raster.getBandCount());
        try {
            for (int b = 0; b < raster.getBandCount(); b++) {
                pages.put(b, ImageUtils.floatMat(raster.band(b), raster.getWidth(), raster.getHeight()));
            }

            boolean ok;
            try {
                ok = imwritemulti(tmp.toString(), pages);
            } catch (RuntimeException e) {
                throw new UnwritableRasterException(path, e);
            }
            if (!ok || !Files.isRegularFile(tmp)) {
                throw new UnwritableRasterException(path, "no encoder could write " + raster.getBandCount()
                        + " float band(s) to this format");
            }

            RasterFiles.moveIntoPlace(tmp, absolute);
            moved = true;
            WorldFile.write(worldFile, raster.getGeoTransform());
            if (raster.getCrs().isEmpty()) {
                Files.deleteIfExists(prjFile);
            } else {
                Files.writeString(prjFile, raster.getCrs(), StandardCharsets.UTF_8);
            }
            log.debug("Wrote {} to {}", raster, path);
        } catch (IOException e) {
            if (moved) {
                RasterFiles.deleteQuietly(absolute);
                RasterFiles.deleteQuietly(worldFile);
                RasterFiles.deleteQuietly(prjFile);
            }
            throw new UnwritableRasterException(path, e);
        } finally {
            RasterFiles.deleteQuietly(tmp);
            pages.close();
        }
    }

    private static List<float[]> pageBands(Mat page) {
        Mat floatPage = new Mat();
        page.convertTo(floatPage, CV_32F);
        MatVector channels = new MatVector();
        split(floatPage, channels);

        List<float[]> bands = new ArrayList<>();
        for (long c = 0; c < channels.size(); c++) {
            bands.add(ImageUtils.toFloatArray(channels.get(c)));
        }
        // BGR(A) -> RGB(A)
        if (bands.size() == 3 || bands.size() == 4) {
            float[] blue = bands.get(0);
            bands.set(0, bands.get(2));
            bands.set(2, blue);
        }
        channels.close();
        floatPage.release();
        return bands;
    }
}
