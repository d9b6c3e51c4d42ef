package com.registration.imageRegistration;

import com.registration.homography.HomographyMatrix;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingRegistrationListener implements RegistrationListener {
    private final String label;

    public LoggingRegistrationListener(String label) {
        this.label = label;
    }

    @Override
    public void stageStarted(RegistrationStage stage) {
        log.info("[{}] {}...", label, stage.label());
    }

    @Override
    public void featuresFound(String role, int count) {
        log.info("[{}] {} keypoints in {} image", label, count, role);
    }

    @Override
    public void matchesFound(int count) {
        log.info("[{}] {} matches passed the ratio test", label, count);
    }

    @Override
    public void homographyFound(HomographyMatrix homography, int inliers, int matches) {
        log.info("[{}] Homography {} ({} / {} inliers)", label, homography, inliers, matches);
    }

    @Override
    public void completed(RegistrationResult result) {
        log.info("[{}] Registration completed: {}x{}, {} band(s)", label,
                result.getOutput().getWidth(), result.getOutput().getHeight(), result.getOutput().getBandCount());
    }
}
