package com.registration.imageOperator;

import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;

/**
 * Copies between Java arrays and OpenCV {@link Mat}s. Every method makes a bulk copy,
 * so the returned objects never alias each other.
 */
public class ImageUtils {

    private ImageUtils() {
    }

    // Mat CV_32FC1 (rows = height, cols = width) từ mảng row-major
    public static Mat floatMat(float[] samples, int width, int height) {
        if (samples.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " samples, got " + samples.length);
        }
        Mat mat = new Mat(height, width, CV_32F);
        new FloatPointer(mat.data()).put(samples);
        return mat;
    }

    public static Mat byteMat(byte[] pixels, int width, int height) {
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " pixels, got " + pixels.length);
        }
        Mat mat = new Mat(height, width, CV_8U);
        mat.data().put(pixels);
        return mat;
    }

    public static float[] toFloatArray(Mat mat) {
        if (mat.type() != CV_32F) {
            throw new IllegalArgumentException("Expected a single channel float Mat, got type " + mat.type());
        }
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        float[] out = new float[continuous.rows() * continuous.cols()];
        new FloatPointer(continuous.data()).get(out);
        return out;
    }

    /**
     * Stacks equally sized float vectors into an {@code n x dim} CV_32F matrix, one row each.
     */
    public static Mat rowsToMat(float[][] rows, int dim) {
        Mat mat = new Mat(rows.length, dim, CV_32F);
        float[] buf = new float[rows.length * dim];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != dim) {
                throw new IllegalArgumentException("Row " + i + " has length " + rows[i].length + ", expected " + dim);
            }
            System.arraycopy(rows[i], 0, buf, i * dim, dim);
        }
        new FloatPointer(mat.data()).put(buf);
        return mat;
    }
}
