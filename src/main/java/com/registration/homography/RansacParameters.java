package com.registration.homography;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Tunable policy of the consensus search.
 */
@Getter
@AllArgsConstructor
public class RansacParameters {
    private final double reprojectionThreshold;
    private final int maxIterations;
    private final double confidence;
    private final int minInliers;
    private final long seed;

    public static RansacParameters defaults() {
        return new RansacParameters(5.0, 2000, 0.995, 4, 42L);
    }
}
