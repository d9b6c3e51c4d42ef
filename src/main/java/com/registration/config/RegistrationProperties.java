package com.registration.config;

import com.registration.RANSAC_matching.MatcherType;
import com.registration.SIFT.FeatureBackendType;
import com.registration.raster.GeoReferencePolicy;
import com.registration.warper.Interpolation;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Everything under {@code registration.*} in {@code application.properties}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "registration")
public class RegistrationProperties {
    /** Thư mục chứa job của API (upload + kết quả) */
    private String workspace = "workspace";

    private double lowPercentile = 2.0;
    private double highPercentile = 98.0;

    private FeatureBackendType featureBackend = FeatureBackendType.OPENCV_SIFT;
    private int minKeypoints = 10;

    private MatcherType matcher = MatcherType.BRUTE_FORCE;
    private double ratio = 0.75;
    private int minMatches = 10;

    private Interpolation interpolation = Interpolation.LINEAR;
    private GeoReferencePolicy geoPolicy = GeoReferencePolicy.TARGET;

    private final Sift sift = new Sift();
    private final Ransac ransac = new Ransac();

    @Getter
    @Setter
    public static class Sift {
        // OpenCV SIFT
        private int features = 0;
        private int octaveLayers = 3;
        private double contrastThreshold = 0.04;
        private double edgeThreshold = 10.0;
        private double sigma = 1.6;
        private boolean preciseUpscale = false;
        // Scale-space detector
        private int octaves = 4;
        private boolean doubleImage = false;
    }

    @Getter
    @Setter
    public static class Ransac {
        private double reprojectionThreshold = 5.0;
        private int maxIterations = 2000;
        private double confidence = 0.995;
        private int minInliers = 4;
        private long seed = 42L;
    }
}
