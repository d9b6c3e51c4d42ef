package com.registration.imageRegistration;

import com.registration.homography.HomographyMatrix;

/**
 * Progress observer of a registration run. All methods are called on the thread running the
 * pipeline, in stage order.
 */
public interface RegistrationListener {
    RegistrationListener NONE = new RegistrationListener() {
    };

    default void stageStarted(RegistrationStage stage) {
    }

    /**
     * @param role "source" or "target"
     */
    default void featuresFound(String role, int count) {
    }

    default void matchesFound(int count) {
    }

    default void homographyFound(HomographyMatrix homography, int inliers, int matches) {
    }

    default void completed(RegistrationResult result) {
    }
}
