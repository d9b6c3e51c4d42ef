package com.registration.warper;

import com.registration.homography.HomographyMatrix;
import com.registration.imageOperator.ImageUtils;
import com.registration.raster.Raster;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_imgproc.warpPerspective;

/**
 * Resamples every band of a source raster into a destination grid through one homography.
 * <p>
 * {@code warpPerspective} maps each destination pixel back through the inverse of the matrix;
 * lookups outside the source are filled with 0.
 */
@Slf4j
@Getter
public class PerspectiveWarper {
    public static final float FILL_VALUE = 0f;

    private final Interpolation interpolation;

    public PerspectiveWarper() {
        this(Interpolation.LINEAR);
    }

    public PerspectiveWarper(Interpolation interpolation) {
        this.interpolation = interpolation;
    }

    /**
     * @return a new float raster of size {@code width x height} with the source's band count;
     *         its georeferencing is the source's and is expected to be replaced by the caller
     */
    public Raster warp(Raster source, int width, int height, HomographyMatrix homography) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Destination size must be positive, got " + width + "x" + height);
        }
        if (!homography.isInvertible()) {
            throw new IllegalArgumentException("Cannot warp with a singular homography " + homography);
        }

        Mat H = homography.toMat();
        Size dsize = new Size(width, height);
        Scalar border = new Scalar(FILL_VALUE);
        float[][] warpedBands = new float[source.getBandCount()][];

        try {
            // Cùng một ma trận cho mọi band để các band luôn thẳng hàng
            for (int b = 0; b < source.getBandCount(); b++) {
                Mat src = ImageUtils.floatMat(source.band(b), source.getWidth(), source.getHeight());
                Mat dst = new Mat();
                warpPerspective(src, dst, H, dsize, interpolation.flag(), BORDER_CONSTANT, border);
                warpedBands[b] = ImageUtils.toFloatArray(dst);
                src.release();
                dst.release();
            }
        } finally {
            H.release();
        }
        log.debug("Warped {} band(s) {}x{} -> {}x{}", source.getBandCount(),
                source.getWidth(), source.getHeight(), width, height);

        return new Raster(width, height, warpedBands, source.getGeoTransform(), source.getCrs());
    }
}
