package com.registration.config;

import com.registration.RANSAC_matching.FeatureMatcher;
import com.registration.SIFT.FeatureBackend;
import com.registration.SIFT.FeatureExtractor;
import com.registration.SIFT.OpenCvSiftBackend;
import com.registration.homography.RansacParameters;
import com.registration.homography.TransformEstimator;
import com.registration.imageOperator.GrayscaleNormalizer;
import com.registration.imageRegistration.ImageRegistration;
import com.registration.imageRegistration.ManualAdjustment;
import com.registration.raster.GeoMetadataReconciler;
import com.registration.raster.GeoTiffRasterStore;
import com.registration.raster.OpenCvRasterStore;
import com.registration.raster.RasterStore;
import com.registration.scaleSpaceSIFT.ScaleSpaceSiftBackend;
import com.registration.scaleSpaceSIFT.SiftConfig;
import com.registration.warper.PerspectiveWarper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(RegistrationProperties.class)
public class RegistrationConfiguration {

    @Bean
    public RasterStore rasterStore() {
        return new GeoTiffRasterStore(new OpenCvRasterStore());
    }

    @Bean
    public FeatureBackend featureBackend(RegistrationProperties properties) {
        RegistrationProperties.Sift sift = properties.getSift();
        FeatureBackend backend = switch (properties.getFeatureBackend()) {
            case OPENCV_SIFT -> new OpenCvSiftBackend(sift.getFeatures(), sift.getOctaveLayers(),
                    sift.getContrastThreshold(), sift.getEdgeThreshold(), sift.getSigma(), sift.isPreciseUpscale());
            case SCALE_SPACE -> new ScaleSpaceSiftBackend(new SiftConfig(sift.getOctaves(), sift.getOctaveLayers(),
                    sift.getSigma(), sift.getContrastThreshold(), sift.getEdgeThreshold(), sift.isDoubleImage()));
        };
        log.info("Feature backend: {}", backend.name());
        return backend;
    }

    @Bean
    public ImageRegistration imageRegistration(RegistrationProperties properties, FeatureBackend featureBackend,
                                               RasterStore rasterStore) {
        RegistrationProperties.Ransac ransac = properties.getRansac();
        return new ImageRegistration(
                new GrayscaleNormalizer(properties.getLowPercentile(), properties.getHighPercentile()),
                new FeatureExtractor(featureBackend, properties.getMinKeypoints()),
                new FeatureMatcher(properties.getMatcher(), properties.getRatio(), properties.getMinMatches()),
                new TransformEstimator(new RansacParameters(ransac.getReprojectionThreshold(), ransac.getMaxIterations(),
                        ransac.getConfidence(), ransac.getMinInliers(), ransac.getSeed())),
                new PerspectiveWarper(properties.getInterpolation()),
                new GeoMetadataReconciler(properties.getGeoPolicy()),
                rasterStore);
    }

    @Bean
    public ManualAdjustment manualAdjustment(RasterStore rasterStore) {
        return new ManualAdjustment(rasterStore);
    }
}
