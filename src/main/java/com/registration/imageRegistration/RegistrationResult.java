package com.registration.imageRegistration;

import com.registration.homography.HomographyMatrix;
import com.registration.homography.InlierSet;
import com.registration.raster.Raster;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RegistrationResult {
    private final HomographyMatrix homography;
    private final InlierSet inliers;
    private final int matchCount;
    private final int sourceKeypoints;
    private final int targetKeypoints;
    private final Raster output;
}
