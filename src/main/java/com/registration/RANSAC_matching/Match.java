package com.registration.RANSAC_matching;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Một cặp feature khớp giữa ảnh nguồn và ảnh đích */
@Getter
@AllArgsConstructor
public class Match {
    private final int sourceIndex;
    private final int targetIndex;
    private final double distance;

    @Override
    public String toString() {
        return String.format("Match[%d -> %d, d=%.4f]", sourceIndex, targetIndex, distance);
    }
}
