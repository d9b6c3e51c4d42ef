package com.registration.imageRegistration;

public enum RegistrationStage {
    READING_SOURCE("Reading source"),
    READING_TARGET("Reading target"),
    EXTRACTING_FEATURES("Extracting features"),
    MATCHING_FEATURES("Matching features"),
    COMPUTING_HOMOGRAPHY("Computing homography"),
    WARPING_IMAGE("Warping image"),
    WRITING_OUTPUT("Writing output");

    private final String label;

    RegistrationStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
