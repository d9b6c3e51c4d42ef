package com.registration.imageRegistration;

import com.registration.RANSAC_matching.FeatureMatcher;
import com.registration.RANSAC_matching.Match;
import com.registration.SIFT.Feature;
import com.registration.SIFT.FeatureExtractor;
import com.registration.exception.RegistrationException;
import com.registration.homography.HomographyFit;
import com.registration.homography.TransformEstimator;
import com.registration.imageOperator.GrayscaleNormalizer;
import com.registration.imageOperator.GrayscaleSurface;
import com.registration.raster.GeoMetadataReconciler;
import com.registration.raster.Raster;
import com.registration.raster.RasterStore;
import com.registration.warper.PerspectiveWarper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Aligns a source raster onto the pixel grid of a target raster.
 * <ol>
 *     <li>Both rasters are reduced to 8-bit grayscale with a percentile stretch.</li>
 *     <li>SIFT features are extracted from each.</li>
 *     <li>Features are matched with k=2 nearest neighbours and the ratio test.</li>
 *     <li>A homography source -> target is fitted with RANSAC.</li>
 *     <li>Every source band is warped into the target's size.</li>
 *     <li>The target's georeferencing is attached to the result.</li>
 * </ol>
 * Stages run one after the other on the calling thread. An instance holds no state between runs.
 */
@Slf4j
@Getter
public class ImageRegistration {
    private final GrayscaleNormalizer normalizer;
    private final FeatureExtractor extractor;
    private final FeatureMatcher matcher;
    private final TransformEstimator estimator;
    private final PerspectiveWarper warper;
    private final GeoMetadataReconciler reconciler;
    private final RasterStore store;

    public ImageRegistration(GrayscaleNormalizer normalizer, FeatureExtractor extractor, FeatureMatcher matcher,
                             TransformEstimator estimator, PerspectiveWarper warper,
                             GeoMetadataReconciler reconciler, RasterStore store) {
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.matcher = matcher;
        this.estimator = estimator;
        this.warper = warper;
        this.reconciler = reconciler;
        this.store = store;
    }

    public RegistrationResult register(Raster source, Raster target) throws RegistrationException {
        return register(source, target, RegistrationListener.NONE);
    }

    public RegistrationResult register(Raster source, Raster target, RegistrationListener listener)
            throws RegistrationException {
        long start = System.currentTimeMillis();

        // 1 + 2. Grayscale và đặc trưng SIFT
        listener.stageStarted(RegistrationStage.EXTRACTING_FEATURES);
        GrayscaleSurface sourceGray = normalizer.normalize(source);
        GrayscaleSurface targetGray = normalizer.normalize(target);
        List<Feature> sourceFeatures = extractor.extract(sourceGray, "source");
        listener.featuresFound("source", sourceFeatures.size());
        List<Feature> targetFeatures = extractor.extract(targetGray, "target");
        listener.featuresFound("target", targetFeatures.size());

        // 3. Ghép cặp
        listener.stageStarted(RegistrationStage.MATCHING_FEATURES);
        List<Match> matches = matcher.match(sourceFeatures, targetFeatures);
        listener.matchesFound(matches.size());

        // 4. RANSAC
        listener.stageStarted(RegistrationStage.COMPUTING_HOMOGRAPHY);
        HomographyFit fit = estimator.estimate(matches, sourceFeatures, targetFeatures);
        listener.homographyFound(fit.getHomography(), fit.getInliers().size(), matches.size());

        // 5 + 6. Warp vào lưới pixel của target, lấy georeference của target
        listener.stageStarted(RegistrationStage.WARPING_IMAGE);
        Raster warped = warper.warp(source, target.getWidth(), target.getHeight(), fit.getHomography());
        Raster output = reconciler.reconcile(warped, target, fit.getHomography());

        RegistrationResult result = new RegistrationResult(fit.getHomography(), fit.getInliers(), matches.size(),
                sourceFeatures.size(), targetFeatures.size(), output);
        log.debug("Registration took {} ms", System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Reads both rasters, registers them and writes the result. Nothing is written unless
     * registration succeeds.
     */
    public RegistrationResult registerFiles(Path sourcePath, Path targetPath, Path outputPath,
                                            RegistrationListener listener) throws RegistrationException {
        listener.stageStarted(RegistrationStage.READING_SOURCE);
        Raster source = store.read(sourcePath);
        listener.stageStarted(RegistrationStage.READING_TARGET);
        Raster target = store.read(targetPath);

        RegistrationResult result = register(source, target, listener);

        listener.stageStarted(RegistrationStage.WRITING_OUTPUT);
        store.write(outputPath, result.getOutput());
        listener.completed(result);
        return result;
    }
}
