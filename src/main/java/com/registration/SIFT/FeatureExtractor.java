package com.registration.SIFT;

import com.registration.exception.InsufficientFeaturesException;
import com.registration.imageOperator.GrayscaleSurface;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs the configured backend and refuses surfaces that are too poor in features to register.
 */
@Slf4j
@Getter
public class FeatureExtractor {
    public static final int DEFAULT_MIN_KEYPOINTS = 10;

    private final FeatureBackend backend;
    private final int minKeypoints;

    public FeatureExtractor(FeatureBackend backend) {
        this(backend, DEFAULT_MIN_KEYPOINTS);
    }

    public FeatureExtractor(FeatureBackend backend, int minKeypoints) {
        this.backend = backend;
        this.minKeypoints = minKeypoints;
    }

    /**
     * @param role "source" or "target", used in diagnostics only
     */
    public List<Feature> extract(GrayscaleSurface surface, String role) throws InsufficientFeaturesException {
        long start = System.currentTimeMillis();
        List<Feature> features = backend.detectAndDescribe(surface);
        log.debug("{} found {} features in {} image ({} ms)",
                backend.name(), features.size(), role, System.currentTimeMillis() - start);

        if (features.size() < minKeypoints) {
            throw new InsufficientFeaturesException(role, features.size(), minKeypoints);
        }
        return features;
    }
}
