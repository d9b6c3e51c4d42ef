package com.registration.scaleSpaceSIFT;

import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;

import java.util.ArrayList;
import java.util.List;

/**
 * Extrema detection, refinement, orientation and descriptor on prebuilt pyramids.
 */
public class SiftDetector {
    private static final int MAX_INTERPOLATION_STEPS = 5;

    private final SiftConfig config;

    public SiftDetector(SiftConfig config) {
        this.config = config;
    }

    // --- MAIN PIPELINE ---
    public List<SiftKeyPoint> run(List<MatVector> gaussianPyramid, List<MatVector> dogPyramid) {
        List<SiftKeyPoint> keypoints = new ArrayList<>();
        // Ngưỡng lọc sơ bộ bằng một nửa ngưỡng contrast (giống OpenCV)
        double prefilter = 0.5 * config.getScaledContrastThreshold();

        for (int o = 0; o < dogPyramid.size(); o++) {
            MatVector dogOctave = dogPyramid.get(o);
            MatVector gaussOctave = gaussianPyramid.get(o);
            int numLayers = (int) dogOctave.size();

            FloatIndexer[] dog = new FloatIndexer[numLayers];
            for (int s = 0; s < numLayers; s++) {
                dog[s] = dogOctave.get(s).createIndexer();
            }
            int rows = dogOctave.get(0).rows();
            int cols = dogOctave.get(0).cols();

            for (int s = 1; s < numLayers - 1; s++) {
                // 1. Find Extrema
                for (int y = SiftConfig.BORDER; y < rows - SiftConfig.BORDER; y++) {
                    for (int x = SiftConfig.BORDER; x < cols - SiftConfig.BORDER; x++) {
                        float val = dog[s].get(y, x);
                        if (Math.abs(val) <= prefilter) continue;
                        if (!isExtremum(val, x, y, dog[s - 1], dog[s], dog[s + 1])) continue;

                        // 2. Interpolation & Edge Rejection
                        SiftKeyPoint kp = interpolate(x, y, o, s, dog, rows, cols);
                        if (kp == null) continue;

                        // 3. Orientation Assignment - ảnh Gaussian tương ứng layer của keypoint
                        Mat gauss = gaussOctave.get(kp.layer);
                        assignOrientation(kp, gauss);

                        // 4. Descriptor Generation
                        computeDescriptor(kp, gauss);
                        keypoints.add(kp);
                    }
                }
            }
            for (FloatIndexer idx : dog) idx.release();
        }
        return keypoints;
    }

    // --- STEP 1: EXTREMA CHECK (26 lân cận, cả max và min) ---
    static boolean isExtremum(float val, int x, int y, FloatIndexer below, FloatIndexer curr, FloatIndexer above) {
        boolean isMax = true;
        boolean isMin = true;
        for (int dy = -1; dy <= 1 && (isMax || isMin); dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                float b = below.get(y + dy, x + dx);
                float a = above.get(y + dy, x + dx);
                if (val <= b || val <= a) isMax = false;
                if (val >= b || val >= a) isMin = false;
                if (dx == 0 && dy == 0) continue;
                float c = curr.get(y + dy, x + dx);
                if (val <= c) isMax = false;
                if (val >= c) isMin = false;
            }
        }
        return isMax || isMin;
    }

    // --- STEP 2: INTERPOLATION ---
    private SiftKeyPoint interpolate(int c, int r, int octave, int layer, FloatIndexer[] dog, int rows, int cols) {
        float ox = 0, oy = 0, os = 0;
        float dx = 0, dy = 0, ds = 0;
        float dxx = 0, dyy = 0, dxy = 0;
        int step = 0;

        for (; step < MAX_INTERPOLATION_STEPS; step++) {
            FloatIndexer below = dog[layer - 1];
            FloatIndexer curr = dog[layer];
            FloatIndexer above = dog[layer + 1];

            // Gradient (dx, dy, ds)
            dx = (curr.get(r, c + 1) - curr.get(r, c - 1)) * 0.5f;
            dy = (curr.get(r + 1, c) - curr.get(r - 1, c)) * 0.5f;
            ds = (above.get(r, c) - below.get(r, c)) * 0.5f;

            // Hessian (3x3)
            float v2 = 2.0f * curr.get(r, c);
            dxx = curr.get(r, c + 1) + curr.get(r, c - 1) - v2;
            dyy = curr.get(r + 1, c) + curr.get(r - 1, c) - v2;
            float dss = above.get(r, c) + below.get(r, c) - v2;
            dxy = (curr.get(r + 1, c + 1) - curr.get(r + 1, c - 1) - curr.get(r - 1, c + 1) + curr.get(r - 1, c - 1)) * 0.25f;
            float dxs = (above.get(r, c + 1) - above.get(r, c - 1) - below.get(r, c + 1) + below.get(r, c - 1)) * 0.25f;
            float dys = (above.get(r + 1, c) - above.get(r - 1, c) - below.get(r + 1, c) + below.get(r - 1, c)) * 0.25f;

            // Solve Hx = -D
            float[] offset = solve3x3(
                    new float[][]{{dxx, dxy, dxs}, {dxy, dyy, dys}, {dxs, dys, dss}},
                    new float[]{-dx, -dy, -ds});
            if (offset == null) return null;
            ox = offset[0];
            oy = offset[1];
            os = offset[2];

            // Check sự hội tụ
            if (Math.abs(ox) < 0.5f && Math.abs(oy) < 0.5f && Math.abs(os) < 0.5f) break;

            c += Math.round(ox);
            r += Math.round(oy);
            layer += Math.round(os);
            if (layer < 1 || layer > dog.length - 2
                    || c < SiftConfig.BORDER || c >= cols - SiftConfig.BORDER
                    || r < SiftConfig.BORDER || r >= rows - SiftConfig.BORDER) {
                return null;
            }
        }
        if (step >= MAX_INTERPOLATION_STEPS) return null;

        float response = dog[layer].get(r, c) + 0.5f * (dx * ox + dy * oy + ds * os);
        if (Math.abs(response) < config.getScaledContrastThreshold()) return null;

        // Edge check (Hessian determinant/trace) - Chỉ dùng dxx, dyy, dxy
        float tr = dxx + dyy;
        float det = dxx * dyy - dxy * dxy;
        if (det <= 0) return null;
        double edge = config.getEdgeThreshold();
        if (tr * tr / det >= (edge + 1) * (edge + 1) / edge) return null;

        // Tính tọa độ và scale cuối cùng
        double toOriginal = Math.pow(2.0, octave) / (config.isDoubleImageSize() ? 2.0 : 1.0);
        float scaleInOctave = (float) (config.getSigmaInit() * Math.pow(2.0, (layer + os) / config.getScalesPerOctave()));
        float realX = (float) ((c + ox) * toOriginal);
        float realY = (float) ((r + oy) * toOriginal);
        float realScale = (float) (scaleInOctave * toOriginal);

        SiftKeyPoint kp = new SiftKeyPoint(realX, realY, octave, layer, realScale, scaleInOctave, Math.abs(response));
        kp.octaveX = c + ox;
        kp.octaveY = r + oy;
        return kp;
    }

    // Cramer cho hệ 3x3, null nếu suy biến
    private static float[] solve3x3(float[][] a, float[] b) {
        double det = a[0][0] * (a[1][1] * a[2][2] - a[1][2] * a[2][1])
                - a[0][1] * (a[1][0] * a[2][2] - a[1][2] * a[2][0])
                + a[0][2] * (a[1][0] * a[2][1] - a[1][1] * a[2][0]);
        if (Math.abs(det) < 1e-12) return null;
        float[] x = new float[3];
        for (int k = 0; k < 3; k++) {
            double[][] m = new double[3][3];
            for (int i = 0; i < 3; i++) {
                for (int j = 0; j < 3; j++) m[i][j] = j == k ? b[i] : a[i][j];
            }
            double dk = m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                    - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                    + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
            x[k] = (float) (dk / det);
        }
        return x;
    }

    // --- STEP 3: ORIENTATION ---
    private void assignOrientation(SiftKeyPoint kp, Mat img) {
        // Ảnh này là ảnh Gaussian đã làm mờ tại layer tương ứng
        FloatIndexer idx = img.createIndexer();
        int rows = img.rows();
        int cols = img.cols();

        float scl = kp.octaveScale;
        int r = Math.round(kp.octaveY);
        int c = Math.round(kp.octaveX);
        double sigma = SiftConfig.ORI_SIGMA_FACTOR * scl;
        int radius = (int) Math.round(3 * sigma);

        int bins = SiftConfig.ORIENTATION_BINS;
        float[] hist = new float[bins];

        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++) {
                int y = r + i;
                int x = c + j;
                if (y <= 0 || y >= rows - 1 || x <= 0 || x >= cols - 1) continue;

                float dx = idx.get(y, x + 1) - idx.get(y, x - 1);
                float dy = idx.get(y + 1, x) - idx.get(y - 1, x);
                float mag = (float) Math.sqrt(dx * dx + dy * dy);
                double angle = Math.toDegrees(Math.atan2(dy, dx));
                if (angle < 0) angle += 360;

                float weight = (float) Math.exp(-(i * i + j * j) / (2 * sigma * sigma));
                int bin = (int) (angle * bins / 360.0);
                if (bin >= bins) bin = 0;

                hist[bin] += mag * weight;
            }
        }
        idx.release();

        // Tìm hướng chính (Max Peak) + nội suy parabol
        int maxBin = 0;
        for (int k = 1; k < bins; k++) {
            if (hist[k] > hist[maxBin]) maxBin = k;
        }
        float left = hist[(maxBin + bins - 1) % bins];
        float right = hist[(maxBin + 1) % bins];
        float denom = left - 2 * hist[maxBin] + right;
        float peak = denom == 0 ? 0 : 0.5f * (left - right) / denom;
        float angle = (maxBin + 0.5f + peak) * (360f / bins);
        if (angle < 0) angle += 360;
        if (angle >= 360) angle -= 360;
        kp.angle = angle;
    }

    // --- STEP 4: DESCRIPTOR ---
    private void computeDescriptor(SiftKeyPoint kp, Mat img) {
        FloatIndexer idx = img.createIndexer();
        int rows = img.rows();
        int cols = img.cols();

        int d = SiftConfig.DESCRIPTOR_HIST_WIDTH; // 4
        int bins = SiftConfig.DESCRIPTOR_HIST_BINS; // 8
        double histWidth = SiftConfig.DESCR_SCALE_FACTOR * kp.octaveScale;
        double angleRad = Math.toRadians(kp.angle);
        double cosT = Math.cos(angleRad) / histWidth;
        double sinT = Math.sin(angleRad) / histWidth;
        double expScale = -1.0 / (0.5 * d * d);

        // Vùng lấy mẫu thực tế
        int radius = (int) Math.round(histWidth * Math.sqrt(2) * (d + 1) * 0.5);
        if (radius < 1) radius = 1;

        int rKp = Math.round(kp.octaveY);
        int cKp = Math.round(kp.octaveX);

        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++) {
                // Xoay tọa độ (i,j) về hệ trục của Keypoint, đơn vị = 1 ô lưới
                double cRot = j * cosT + i * sinT;
                double rRot = -j * sinT + i * cosT;

                double rBin = rRot + d / 2.0 - 0.5;
                double cBin = cRot + d / 2.0 - 0.5;
                if (rBin <= -1 || rBin >= d || cBin <= -1 || cBin >= d) continue;

                int y = rKp + i;
                int x = cKp + j;
                if (y <= 0 || y >= rows - 1 || x <= 0 || x >= cols - 1) continue;

                float dx = idx.get(y, x + 1) - idx.get(y, x - 1);
                float dy = idx.get(y + 1, x) - idx.get(y - 1, x);
                double mod = Math.sqrt(dx * dx + dy * dy);
                double ori = Math.atan2(dy, dx) - angleRad;

                // Xoay hướng gradient theo hướng chính
                while (ori < 0) ori += 2 * Math.PI;
                while (ori >= 2 * Math.PI) ori -= 2 * Math.PI;

                double oBin = ori * bins / (2 * Math.PI);
                double weight = Math.exp((rRot * rRot + cRot * cRot) * expScale);

                // Nội suy 3 chiều (Trilinear interpolation) vào descriptor
                distributeToHistogram(kp.descriptor, (float) rBin, (float) cBin, (float) oBin, (float) (mod * weight));
            }
        }
        idx.release();

        // Chuẩn hóa và clamp
        normalizeAndClamp(kp.descriptor);
    }

    private static void distributeToHistogram(float[] desc, float r, float c, float o, float mag) {
        int d = SiftConfig.DESCRIPTOR_HIST_WIDTH;
        int bins = SiftConfig.DESCRIPTOR_HIST_BINS;
        int r0 = (int) Math.floor(r);
        int c0 = (int) Math.floor(c);
        int o0 = (int) Math.floor(o);

        float dr = r - r0;
        float dc = c - c0;
        float dO = o - o0;

        for (int ir = 0; ir <= 1; ir++) {
            int rIdx = r0 + ir;
            if (rIdx < 0 || rIdx >= d) continue;
            for (int ic = 0; ic <= 1; ic++) {
                int cIdx = c0 + ic;
                if (cIdx < 0 || cIdx >= d) continue;
                for (int io = 0; io <= 1; io++) {
                    int oIdx = ((o0 + io) % bins + bins) % bins; // Wrap around orientation
                    float val = mag * (ir == 0 ? 1 - dr : dr)
                            * (ic == 0 ? 1 - dc : dc)
                            * (io == 0 ? 1 - dO : dO);

                    // Index trong mảng 128 (4x4x8)
                    desc[(rIdx * d + cIdx) * bins + oIdx] += val;
                }
            }
        }
    }

    static void normalizeAndClamp(float[] vec) {
        float sum = 0;
        for (float v : vec) sum += v * v;
        sum = (float) Math.sqrt(sum);
        if (sum == 0) return;

        // Normalize
        for (int i = 0; i < vec.length; i++) {
            vec[i] /= sum;
            if (vec[i] > SiftConfig.DESCR_MAG_THRESHOLD) vec[i] = (float) SiftConfig.DESCR_MAG_THRESHOLD;
        }

        // Re-normalize
        sum = 0;
        for (float v : vec) sum += v * v;
        sum = (float) Math.sqrt(sum);
        if (sum == 0) return;
        for (int i = 0; i < vec.length; i++) vec[i] /= sum;
    }
}
