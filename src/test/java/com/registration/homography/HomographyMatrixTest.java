package com.registration.homography;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HomographyMatrixTest {

    @Test
    void scaledSoThatLastEntryIsOne() {
        HomographyMatrix h = new HomographyMatrix(new double[]{2, 0, 10, 0, 2, 6, 0, 0, 2});

        assertThat(h.get(2, 2)).isEqualTo(1.0);
        assertThat(h.translationX()).isEqualTo(5.0);
        assertThat(h.translationY()).isEqualTo(3.0);
        assertThat(h.isClose(HomographyMatrix.translation(5, 3), 1e-12)).isTrue();
    }

    @Test
    void whenLastEntryIsZeroThenRejected() {
        assertThatThrownBy(() -> new HomographyMatrix(new double[]{1, 0, 0, 0, 1, 0, 0, 0, 0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void inverseUndoesProjection() {
        HomographyMatrix h = new HomographyMatrix(new double[][]{
                {1.2, 0.1, 4},
                {-0.2, 0.9, 7},
                {1e-4, -2e-4, 1}});

        double[] p = h.project(37, 81);
        double[] back = h.inverse().project(p[0], p[1]);

        assertThat(back[0]).isCloseTo(37, within(1e-9));
        assertThat(back[1]).isCloseTo(81, within(1e-9));
        assertThat(h.multiply(h.inverse()).isClose(HomographyMatrix.identity(), 1e-9)).isTrue();
    }

    @Test
    void whenSingularThenNotInvertible() {
        HomographyMatrix singular = new HomographyMatrix(new double[]{1, 2, 3, 2, 4, 6, 0, 0, 1});

        assertThat(singular.isInvertible()).isFalse();
        assertThatThrownBy(singular::inverse).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pointAtInfinityProjectsToNull() {
        HomographyMatrix h = new HomographyMatrix(new double[]{1, 0, 0, 0, 1, 0, 0.01, 0, 1});

        assertThat(h.project(-100, 5)).isNull();
    }
}
