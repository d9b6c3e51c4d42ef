package com.registration.homography;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HomographyFit {
    private final HomographyMatrix homography;
    private final InlierSet inliers;
    private final int iterations;
}
