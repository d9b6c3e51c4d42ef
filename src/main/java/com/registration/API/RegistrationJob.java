package com.registration.API;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RegistrationJob {
    private final String jobId;
    private final String imageUrl;
    private final int matches;
    private final int inliers;
}
