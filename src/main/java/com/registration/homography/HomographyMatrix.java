package com.registration.homography;

import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;

/**
 * 3x3 projective transform from source pixel coordinates to target pixel coordinates,
 * stored row-major and scaled so that the bottom-right entry is 1.
 */
public final class HomographyMatrix {
    private static final double EPS = 1e-12;

    private final double[] h;

    public HomographyMatrix(double[] rowMajor) {
        if (rowMajor == null || rowMajor.length != 9) {
            throw new IllegalArgumentException("Homography needs 9 coefficients");
        }
        double scale = rowMajor[8];
        if (Math.abs(scale) < EPS || !Double.isFinite(scale)) {
            throw new IllegalArgumentException("Homography cannot be normalized, h22 = " + scale);
        }
        this.h = new double[9];
        for (int i = 0; i < 9; i++) {
            h[i] = rowMajor[i] / scale;
        }
    }

    public HomographyMatrix(double[][] data) {
        this(new double[]{
                data[0][0], data[0][1], data[0][2],
                data[1][0], data[1][1], data[1][2],
                data[2][0], data[2][1], data[2][2]});
    }

    public static HomographyMatrix identity() {
        return new HomographyMatrix(new double[]{1, 0, 0, 0, 1, 0, 0, 0, 1});
    }

    public static HomographyMatrix translation(double dx, double dy) {
        return new HomographyMatrix(new double[]{1, 0, dx, 0, 1, dy, 0, 0, 1});
    }

    public double get(int row, int col) {
        return h[row * 3 + col];
    }

    public double[] toArray() {
        return h.clone();
    }

    public double translationX() {
        return h[2];
    }

    public double translationY() {
        return h[5];
    }

    /**
     * @return projected point, or {@code null} when it lands at infinity
     */
    public double[] project(double x, double y) {
        double zPrime = h[6] * x + h[7] * y + h[8];
        if (Math.abs(zPrime) < 1e-10) return null;

        double xPrime = (h[0] * x + h[1] * y + h[2]) / zPrime;
        double yPrime = (h[3] * x + h[4] * y + h[5]) / zPrime;
        return new double[]{xPrime, yPrime};
    }

    public double determinant() {
        return h[0] * (h[4] * h[8] - h[5] * h[7])
                - h[1] * (h[3] * h[8] - h[5] * h[6])
                + h[2] * (h[3] * h[7] - h[4] * h[6]);
    }

    public boolean isFinite() {
        for (double v : h) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }

    public boolean isInvertible() {
        return isFinite() && Math.abs(determinant()) > EPS;
    }

    public HomographyMatrix inverse() {
        double det = determinant();
        if (Math.abs(det) < EPS) {
            throw new IllegalStateException("Homography is singular, det = " + det);
        }
        // Ma trận phụ hợp / det
        double[] inv = new double[]{
                (h[4] * h[8] - h[5] * h[7]) / det, (h[2] * h[7] - h[1] * h[8]) / det, (h[1] * h[5] - h[2] * h[4]) / det,
                (h[5] * h[6] - h[3] * h[8]) / det, (h[0] * h[8] - h[2] * h[6]) / det, (h[2] * h[3] - h[0] * h[5]) / det,
                (h[3] * h[7] - h[4] * h[6]) / det, (h[1] * h[6] - h[0] * h[7]) / det, (h[0] * h[4] - h[1] * h[3]) / det
        };
        return new HomographyMatrix(inv);
    }

    public HomographyMatrix multiply(HomographyMatrix other) {
        double[] o = other.h;
        double[] r = new double[9];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                r[i * 3 + j] = h[i * 3] * o[j] + h[i * 3 + 1] * o[3 + j] + h[i * 3 + 2] * o[6 + j];
            }
        }
        return new HomographyMatrix(r);
    }

    /** CV_64F 3x3 copy, ready for {@code warpPerspective}. */
    public Mat toMat() {
        Mat mat = new Mat(3, 3, CV_64F);
        new DoublePointer(mat.data()).put(h);
        return mat;
    }

    public boolean isClose(HomographyMatrix other, double tolerance) {
        for (int i = 0; i < 9; i++) {
            if (Math.abs(h[i] - other.h[i]) > tolerance) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HomographyMatrix)) return false;
        return Arrays.equals(h, ((HomographyMatrix) o).h);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(h);
    }

    @Override
    public String toString() {
        return String.format("[[%.6f, %.6f, %.4f], [%.6f, %.6f, %.4f], [%.8f, %.8f, 1]]",
                h[0], h[1], h[2], h[3], h[4], h[5], h[6], h[7]);
    }
}
