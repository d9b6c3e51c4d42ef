package com.registration.exception;

import lombok.Getter;

@Getter
public class DegenerateTransformException extends RegistrationException {
    private final int inliers;
    private final int required;
    private final int matches;

    public DegenerateTransformException(int inliers, int required, int matches) {
        super(String.format("Homography is not trustworthy: %d inliers out of %d matches, need at least %d",
                inliers, matches, required));
        this.inliers = inliers;
        this.required = required;
        this.matches = matches;
    }

    @Override
    public String kind() {
        return "DegenerateTransform";
    }
}
