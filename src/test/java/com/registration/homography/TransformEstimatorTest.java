package com.registration.homography;

import com.registration.RANSAC_matching.Match;
import com.registration.SIFT.Feature;
import com.registration.SyntheticRasters;
import com.registration.exception.DegenerateTransformException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TransformEstimatorTest {

    private final TransformEstimator estimator = new TransformEstimator();

    /** Nguồn và đích cho từng cặp, match i nối source i với target i. */
    private final List<Feature> source = new ArrayList<>();
    private final List<Feature> target = new ArrayList<>();
    private final List<Match> matches = new ArrayList<>();

    private void add(double sx, double sy, double tx, double ty) {
        int i = source.size();
        source.add(SyntheticRasters.unitFeature(sx, sy, 0, 4));
        target.add(SyntheticRasters.unitFeature(tx, ty, 0, 4));
        matches.add(new Match(i, i, 0f));
    }

    private void addCorrespondences(HomographyMatrix h, int count, Random rand) {
        for (int k = 0; k < count; k++) {
            double x = rand.nextDouble() * 200, y = rand.nextDouble() * 200;
            double[] p = h.project(x, y);
            add(x, y, p[0], p[1]);
        }
    }

    private void addOutliers(HomographyMatrix h, int count, Random rand) {
        for (int k = 0; k < count; k++) {
            double x = rand.nextDouble() * 200, y = rand.nextDouble() * 200;
            double[] p = h.project(x, y);
            double angle = rand.nextDouble() * 2 * Math.PI;
            double offset = 30 + rand.nextDouble() * 50;
            add(x, y, p[0] + offset * Math.cos(angle), p[1] + offset * Math.sin(angle));
        }
    }

    @Test
    void whenIdenticalPointsThenIdentity() throws Exception {
        addCorrespondences(HomographyMatrix.identity(), 20, new Random(1));

        HomographyFit fit = estimator.estimate(matches, source, target);

        assertThat(fit.getHomography().isClose(HomographyMatrix.identity(), 1e-6)).isTrue();
        assertThat(fit.getInliers().size()).isEqualTo(20);
    }

    @Test
    void whenTranslatedWithOutliersThenTranslationRecoveredAndOutliersRejected() throws Exception {
        HomographyMatrix truth = HomographyMatrix.translation(5, 3);
        Random rand = new Random(2);
        addCorrespondences(truth, 40, rand);
        addOutliers(truth, 15, rand);

        HomographyFit fit = estimator.estimate(matches, source, target);

        assertThat(fit.getHomography().translationX()).isCloseTo(5.0, within(1e-3));
        assertThat(fit.getHomography().translationY()).isCloseTo(3.0, within(1e-3));
        assertThat(fit.getInliers().size()).isEqualTo(40);
        for (int i = 40; i < 55; i++) {
            assertThat(fit.getInliers().contains(i)).isFalse();
        }
    }

    @Test
    void whenPerspectiveThenRecovered() throws Exception {
        HomographyMatrix truth = new HomographyMatrix(new double[]{
                0.9, 0.1, 12,
                -0.05, 1.1, -7,
                1e-4, 2e-4, 1});
        addCorrespondences(truth, 30, new Random(3));

        HomographyFit fit = estimator.estimate(matches, source, target);

        for (double[] p : new double[][]{{0, 0}, {200, 0}, {0, 200}, {200, 200}, {100, 50}}) {
            double[] expected = truth.project(p[0], p[1]);
            double[] actual = fit.getHomography().project(p[0], p[1]);
            assertThat(actual[0]).isCloseTo(expected[0], within(1e-3));
            assertThat(actual[1]).isCloseTo(expected[1], within(1e-3));
        }
    }

    @Test
    void bestFitHasAtLeastAsManyInliersAsEveryCandidate() throws Exception {
        HomographyMatrix truth = HomographyMatrix.translation(-4, 9);
        Random rand = new Random(4);
        addCorrespondences(truth, 25, rand);
        addOutliers(truth, 25, rand);
        AtomicInteger candidates = new AtomicInteger();
        AtomicInteger bestCandidate = new AtomicInteger();

        HomographyFit fit = estimator.estimate(matches, source, target, (h, inliers) -> {
            assertThat(h.isFinite()).isTrue();
            candidates.incrementAndGet();
            bestCandidate.accumulateAndGet(inliers, Math::max);
        });

        assertThat(candidates.get()).isPositive();
        assertThat(fit.getInliers().size()).isGreaterThanOrEqualTo(bestCandidate.get());
        assertThat(fit.getIterations()).isLessThanOrEqualTo(RansacParameters.defaults().getMaxIterations());
    }

    @Test
    void whenAllPointsCollinearThenDegenerate() {
        for (int k = 0; k < 20; k++) {
            double x = k * 7.5;
            add(x, 2 * x + 1, x + 5, 2 * x + 4);
        }

        assertThatThrownBy(() -> estimator.estimate(matches, source, target))
                .isInstanceOf(DegenerateTransformException.class);
    }

    @Test
    void whenCollinearCandidatesThenNoneReachesTheListener() throws Exception {
        for (int k = 0; k < 12; k++) {
            double x = k * 9.0;
            add(x, 0.5 * x, x + 1, 0.5 * x + 1);
        }
        List<HomographyMatrix> seen = new ArrayList<>();

        assertThatThrownBy(() -> estimator.estimate(matches, source, target, (h, inliers) -> seen.add(h)))
                .isInstanceOf(DegenerateTransformException.class);
        assertThat(seen).isEmpty();
    }

    @Test
    void whenFewerThanFourMatchesThenDegenerate() {
        add(0, 0, 1, 1);
        add(10, 0, 11, 1);
        add(0, 10, 1, 11);

        assertThatThrownBy(() -> estimator.estimate(matches, source, target))
                .isInstanceOf(DegenerateTransformException.class)
                .hasMessageContaining("out of 3 matches");
    }

    @Test
    void whenTooFewInliersThenDegenerate() {
        // Không có 5 cặp nào cùng một phép biến đổi
        Random rand = new Random(9);
        for (int k = 0; k < 12; k++) {
            add(rand.nextDouble() * 500, rand.nextDouble() * 500, rand.nextDouble() * 500, rand.nextDouble() * 500);
        }
        TransformEstimator strict = new TransformEstimator(new RansacParameters(1.0, 500, 0.995, 8, 42L));

        assertThatThrownBy(() -> strict.estimate(matches, source, target))
                .isInstanceOf(DegenerateTransformException.class);
    }

    @Test
    void sameSeedSameResult() throws Exception {
        HomographyMatrix truth = HomographyMatrix.translation(2, -6);
        Random rand = new Random(6);
        addCorrespondences(truth, 20, rand);
        addOutliers(truth, 20, rand);

        HomographyFit first = estimator.estimate(matches, source, target);
        HomographyFit second = estimator.estimate(matches, source, target);

        assertThat(second.getHomography().toArray()).containsExactly(first.getHomography().toArray());
        assertThat(second.getIterations()).isEqualTo(first.getIterations());
    }

    @Test
    void whenMinInliersBelowSampleSizeThenRejected() {
        assertThatThrownBy(() -> new TransformEstimator(new RansacParameters(5.0, 100, 0.99, 3, 1L)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void adaptiveIterationsShrinkWithInlierRatio() {
        assertThat(TransformEstimator.adaptiveIterations(1.0, 0.995, 2000)).isEqualTo(1);
        assertThat(TransformEstimator.adaptiveIterations(0.0, 0.995, 2000)).isEqualTo(2000);
        assertThat(TransformEstimator.adaptiveIterations(0.5, 0.995, 2000)).isEqualTo(83);
        assertThat(TransformEstimator.adaptiveIterations(0.8, 0.995, 2000))
                .isLessThan(TransformEstimator.adaptiveIterations(0.5, 0.995, 2000));
    }

    @Test
    void collinearTripleDetection() {
        double[] xs = {0, 1, 2, 0};
        double[] ys = {0, 1, 2, 5};
        assertThat(TransformEstimator.hasCollinearTriple(xs, ys, new int[]{0, 1, 2, 3})).isTrue();

        double[] qx = {0, 10, 0, 10};
        double[] qy = {0, 0, 10, 10};
        assertThat(TransformEstimator.hasCollinearTriple(qx, qy, new int[]{0, 1, 2, 3})).isFalse();
    }
}
