package com.registration.homography;

import com.registration.RANSAC_matching.Match;
import com.registration.SIFT.Feature;
import com.registration.exception.DegenerateTransformException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;
import java.util.Random;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.DECOMP_LU;
import static org.bytedeco.opencv.global.opencv_core.DECOMP_SVD;
import static org.bytedeco.opencv.global.opencv_core.solve;

/**
 * RANSAC homography fit over ratio-tested matches.
 * <p>
 * Each iteration draws 4 distinct matches, rejects the draw if any three of its source or target
 * points are collinear, solves the 8x8 DLT system and counts the matches whose projected source
 * point falls within the reprojection threshold of their target point. The candidate with the most
 * inliers wins and is refined by least squares over its inliers.
 */
@Slf4j
@Getter
public class TransformEstimator {
    static final int SAMPLE_SIZE = 4;
    // sin của góc nhỏ nhất giữa 2 cạnh để 3 điểm không bị coi là thẳng hàng
    private static final double COLLINEAR_SIN = 1e-2;
    private static final double MIN_POINT_DISTANCE = 1e-6;

    /**
     * Sees every candidate that passed the degeneracy checks, in sampling order.
     */
    @FunctionalInterface
    public interface CandidateListener {
        CandidateListener NONE = (homography, inliers) -> { };

        void onCandidate(HomographyMatrix homography, int inliers);
    }

    private final RansacParameters parameters;

    public TransformEstimator() {
        this(RansacParameters.defaults());
    }

    public TransformEstimator(RansacParameters parameters) {
        if (parameters.getMinInliers() < SAMPLE_SIZE) {
            throw new IllegalArgumentException("At least " + SAMPLE_SIZE + " inliers are needed, got " + parameters.getMinInliers());
        }
        this.parameters = parameters;
    }

    public HomographyFit estimate(List<Match> matches, List<Feature> source, List<Feature> target)
            throws DegenerateTransformException {
        return estimate(matches, source, target, CandidateListener.NONE);
    }

    public HomographyFit estimate(List<Match> matches, List<Feature> source, List<Feature> target,
                                  CandidateListener listener) throws DegenerateTransformException {
        int n = matches.size();
        if (n < SAMPLE_SIZE) {
            throw new DegenerateTransformException(0, parameters.getMinInliers(), n);
        }

        double[] sx = new double[n], sy = new double[n], tx = new double[n], ty = new double[n];
        for (int i = 0; i < n; i++) {
            Match m = matches.get(i);
            Feature a = source.get(m.getSourceIndex());
            Feature b = target.get(m.getTargetIndex());
            sx[i] = a.x();
            sy[i] = a.y();
            tx[i] = b.x();
            ty[i] = b.y();
        }

        Random rand = new Random(parameters.getSeed());
        int[] sample = new int[SAMPLE_SIZE];
        HomographyMatrix bestHomography = null;
        int maxInliers = 0;
        int budget = parameters.getMaxIterations();
        int iterations = 0;
        int degenerate = 0;

        for (; iterations < budget; iterations++) {
            drawSample(rand, n, sample);
            if (hasCollinearTriple(sx, sy, sample) || hasCollinearTriple(tx, ty, sample)) {
                degenerate++;
                continue;
            }

            HomographyMatrix H = fit(sx, sy, tx, ty, sample, true);
            if (H == null) {
                degenerate++;
                continue;
            }

            int currentInliers = countInliers(H, sx, sy, tx, ty, null);
            listener.onCandidate(H, currentInliers);

            if (currentInliers > maxInliers) {
                maxInliers = currentInliers;
                bestHomography = H;
                budget = Math.min(budget,
                        adaptiveIterations((double) currentInliers / n, parameters.getConfidence(), parameters.getMaxIterations()));
            }
        }
        log.debug("RANSAC stopped after {} iterations ({} degenerate samples), best support {}/{}",
                iterations, degenerate, maxInliers, n);

        if (bestHomography == null || maxInliers < parameters.getMinInliers()) {
            throw new DegenerateTransformException(maxInliers, parameters.getMinInliers(), n);
        }

        // Tinh chỉnh bằng bình phương tối thiểu trên toàn bộ inliers
        boolean[] mask = new boolean[n];
        countInliers(bestHomography, sx, sy, tx, ty, mask);
        HomographyMatrix refined = fit(sx, sy, tx, ty, indicesOf(mask), false);
        if (refined != null) {
            boolean[] refinedMask = new boolean[n];
            int refinedInliers = countInliers(refined, sx, sy, tx, ty, refinedMask);
            if (refinedInliers >= maxInliers) {
                bestHomography = refined;
                mask = refinedMask;
            }
        }

        InlierSet inliers = new InlierSet(mask);
        log.debug("Homography {} supported by {} of {} matches", bestHomography, inliers.size(), n);
        return new HomographyFit(bestHomography, inliers, iterations);
    }

    int countInliers(HomographyMatrix H, double[] sx, double[] sy, double[] tx, double[] ty, boolean[] mask) {
        double thresholdSq = parameters.getReprojectionThreshold() * parameters.getReprojectionThreshold();
        int count = 0;
        for (int i = 0; i < sx.length; i++) {
            double[] projected = H.project(sx[i], sy[i]);
            boolean inlier = false;
            if (projected != null) {
                double dx = projected[0] - tx[i];
                double dy = projected[1] - ty[i];
                inlier = dx * dx + dy * dy <= thresholdSq;
            }
            if (inlier) count++;
            if (mask != null) mask[i] = inlier;
        }
        return count;
    }

    static int adaptiveIterations(double inlierRatio, double confidence, int maxIterations) {
        double p = Math.pow(inlierRatio, SAMPLE_SIZE);
        if (p >= 1.0) return 1;
        double den = Math.log(1.0 - p);
        if (p <= 0.0 || den >= 0.0) return maxIterations;
        double k = Math.ceil(Math.log(1.0 - confidence) / den);
        return (int) Math.max(1, Math.min(maxIterations, k));
    }

    private static void drawSample(Random rand, int n, int[] sample) {
        for (int k = 0; k < sample.length; k++) {
            int candidate;
            boolean duplicate;
            do {
                candidate = rand.nextInt(n);
                duplicate = false;
                for (int j = 0; j < k; j++) {
                    if (sample[j] == candidate) {
                        duplicate = true;
                        break;
                    }
                }
            } while (duplicate);
            sample[k] = candidate;
        }
    }

    static boolean hasCollinearTriple(double[] xs, double[] ys, int[] idx) {
        for (int a = 0; a < idx.length; a++) {
            for (int b = a + 1; b < idx.length; b++) {
                for (int c = b + 1; c < idx.length; c++) {
                    double abx = xs[idx[b]] - xs[idx[a]], aby = ys[idx[b]] - ys[idx[a]];
                    double acx = xs[idx[c]] - xs[idx[a]], acy = ys[idx[c]] - ys[idx[a]];
                    double ab = Math.hypot(abx, aby);
                    double ac = Math.hypot(acx, acy);
                    if (ab < MIN_POINT_DISTANCE || ac < MIN_POINT_DISTANCE) return true;
                    double cross = abx * acy - aby * acx;
                    if (Math.abs(cross) <= COLLINEAR_SIN * ab * ac) return true;
                }
            }
        }
        return false;
    }

    private static int[] indicesOf(boolean[] mask) {
        return new InlierSet(mask).indices();
    }

    /**
     * Direct linear solve with h22 = 1 on Hartley-normalized coordinates.
     * Four points give an exact 8x8 system (LU); more give a least squares problem (SVD).
     *
     * @return the homography, or {@code null} if the system is singular or the result is not invertible
     */
    static HomographyMatrix fit(double[] sx, double[] sy, double[] tx, double[] ty, int[] idx, boolean minimal) {
        int m = idx.length;
        if (m < SAMPLE_SIZE) return null;

        double[] t1 = normalization(sx, sy, idx);
        double[] t2 = normalization(tx, ty, idx);

        double[] a = new double[2 * m * 8];
        double[] b = new double[2 * m];
        for (int i = 0; i < m; i++) {
            int k = idx[i];
            double x = t1[0] * sx[k] + t1[2];
            double y = t1[0] * sy[k] + t1[5];
            double u = t2[0] * tx[k] + t2[2];
            double v = t2[0] * ty[k] + t2[5];

            int r0 = (2 * i) * 8;
            a[r0] = x;
            a[r0 + 1] = y;
            a[r0 + 2] = 1;
            a[r0 + 6] = -x * u;
            a[r0 + 7] = -y * u;
            b[2 * i] = u;

            int r1 = (2 * i + 1) * 8;
            a[r1 + 3] = x;
            a[r1 + 4] = y;
            a[r1 + 5] = 1;
            a[r1 + 6] = -x * v;
            a[r1 + 7] = -y * v;
            b[2 * i + 1] = v;
        }

        Mat A = new Mat(2 * m, 8, CV_64F);
        Mat B = new Mat(2 * m, 1, CV_64F);
        Mat X = new Mat();
        try {
            new DoublePointer(A.data()).put(a);
            new DoublePointer(B.data()).put(b);
            boolean solved = solve(A, B, X, minimal ? DECOMP_LU : DECOMP_SVD);
            if (!solved || X.rows() != 8) return null;

            double[] h = new double[9];
            new DoublePointer(X.data()).get(h, 0, 8);
            h[8] = 1.0;

            // H = T2^-1 * Hn * T1
            double[] denormalized = multiply(multiply(invertSimilarity(t2), h), t1);
            if (!isFiniteArray(denormalized) || Math.abs(denormalized[8]) < 1e-12) return null;

            HomographyMatrix H = new HomographyMatrix(denormalized);
            return H.isInvertible() ? H : null;
        } finally {
            A.release();
            B.release();
            X.release();
        }
    }

    // T = [s 0 -s*cx; 0 s -s*cy; 0 0 1], khoảng cách trung bình tới tâm = sqrt(2)
    private static double[] normalization(double[] xs, double[] ys, int[] idx) {
        double cx = 0, cy = 0;
        for (int k : idx) {
            cx += xs[k];
            cy += ys[k];
        }
        cx /= idx.length;
        cy /= idx.length;
        double meanDist = 0;
        for (int k : idx) {
            meanDist += Math.hypot(xs[k] - cx, ys[k] - cy);
        }
        meanDist /= idx.length;
        double s = meanDist > 0 ? Math.sqrt(2) / meanDist : 1.0;
        return new double[]{s, 0, -s * cx, 0, s, -s * cy, 0, 0, 1};
    }

    private static double[] invertSimilarity(double[] t) {
        double s = t[0];
        return new double[]{1 / s, 0, -t[2] / s, 0, 1 / s, -t[5] / s, 0, 0, 1};
    }

    private static double[] multiply(double[] p, double[] q) {
        double[] r = new double[9];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                r[i * 3 + j] = p[i * 3] * q[j] + p[i * 3 + 1] * q[3 + j] + p[i * 3 + 2] * q[6 + j];
            }
        }
        return r;
    }

    private static boolean isFiniteArray(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
