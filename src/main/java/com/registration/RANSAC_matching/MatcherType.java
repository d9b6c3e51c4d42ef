package com.registration.RANSAC_matching;

public enum MatcherType {
    /** Exact L2 nearest neighbours. */
    BRUTE_FORCE,
    /** Approximate KD-tree search, faster on large descriptor sets. */
    FLANN
}
