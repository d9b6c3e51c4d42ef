package com.registration.imageRegistration;

import com.registration.RANSAC_matching.FeatureMatcher;
import com.registration.SIFT.Feature;
import com.registration.SIFT.FeatureBackend;
import com.registration.SIFT.FeatureExtractor;
import com.registration.SIFT.OpenCvSiftBackend;
import com.registration.SyntheticRasters;
import com.registration.exception.InsufficientFeaturesException;
import com.registration.exception.InsufficientMatchesException;
import com.registration.homography.HomographyMatrix;
import com.registration.homography.TransformEstimator;
import com.registration.imageOperator.GrayscaleNormalizer;
import com.registration.raster.GeoMetadataReconciler;
import com.registration.raster.GeoTransform;
import com.registration.raster.GeoTiffRasterStore;
import com.registration.raster.OpenCvRasterStore;
import com.registration.raster.Raster;
import com.registration.raster.RasterStore;
import com.registration.warper.PerspectiveWarper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageRegistrationTest {
    private static final String CHM_CRS = "PROJCS[\"VN-2000 / UTM zone 48N\"]";
    private static final GeoTransform CHM_GEO = new GeoTransform(580000.0, 0.1, 0.0, 1180000.0, 0.0, -0.1);
    private static final double[][] POSITIONS = {
            {5, 7}, {40, 9}, {12, 33}, {30, 28}, {45, 44}, {8, 20}, {22, 15}, {35, 38}, {18, 42}, {42, 22}};

    @Mock
    private FeatureBackend fakeBackend;

    @Mock
    private RasterStore fakeStore;

    @TempDir
    Path dir;

    private static ImageRegistration pipeline(FeatureBackend backend, RasterStore store) {
        return new ImageRegistration(new GrayscaleNormalizer(), new FeatureExtractor(backend), new FeatureMatcher(),
                new TransformEstimator(), new PerspectiveWarper(), new GeoMetadataReconciler(), store);
    }

    private static ImageRegistration siftPipeline(RasterStore store) {
        return pipeline(new OpenCvSiftBackend(), store);
    }

    /** Nguồn lệch (5, 3) pixel so với đích trên cùng một texture. */
    private static Raster[] translatedPair() {
        float[] big = SyntheticRasters.texture(140, 140, 42);
        Raster source = SyntheticRasters.singleBand(100, 100, SyntheticRasters.crop(big, 140, 25, 23, 100, 100));
        Raster target = SyntheticRasters.singleBand(100, 100, SyntheticRasters.crop(big, 140, 20, 20, 100, 100))
                .withGeoReference(CHM_GEO, CHM_CRS);
        return new Raster[]{source, target};
    }

    private static List<Feature> features(double dx, double dy) {
        List<Feature> features = new ArrayList<>();
        for (int i = 0; i < POSITIONS.length; i++) {
            features.add(SyntheticRasters.unitFeature(POSITIONS[i][0] + dx, POSITIONS[i][1] + dy, i, 16));
        }
        return features;
    }

    @Test
    void whenTargetIsTranslatedThenTranslationIsRecovered() throws Exception {
        Raster[] pair = translatedPair();

        RegistrationResult result = siftPipeline(fakeStore).register(pair[0], pair[1]);

        HomographyMatrix h = result.getHomography();
        assertThat(h.translationX()).isCloseTo(5.0, within(1.0));
        assertThat(h.translationY()).isCloseTo(3.0, within(1.0));
        assertThat(result.getInliers().size()).isGreaterThanOrEqualTo(4);
        assertThat(result.getMatchCount()).isGreaterThanOrEqualTo(10);

        Raster output = result.getOutput();
        assertThat(output.getWidth()).isEqualTo(100);
        assertThat(output.getHeight()).isEqualTo(100);
        double sum = 0;
        int n = 0;
        for (int row = 6; row < 96; row++) {
            for (int col = 8; col < 96; col++) {
                sum += Math.abs(output.get(0, row, col) - pair[1].get(0, row, col));
                n++;
            }
        }
        assertThat(sum / n).isLessThan(5.0);
        // Vùng không có dữ liệu nguồn
        assertThat(output.get(0, 0, 0)).isZero();
    }

    @Test
    void whenSourceEqualsTargetThenIdentity() throws Exception {
        Raster raster = SyntheticRasters.singleBand(100, 100, SyntheticRasters.texture(100, 100, 8));

        RegistrationResult result = siftPipeline(fakeStore).register(raster, raster);

        for (double[] corner : new double[][]{{0, 0}, {99, 0}, {0, 99}, {99, 99}}) {
            double[] p = result.getHomography().project(corner[0], corner[1]);
            assertThat(p[0]).isCloseTo(corner[0], within(0.5));
            assertThat(p[1]).isCloseTo(corner[1], within(0.5));
        }

        Raster output = result.getOutput();
        assertThat(output.getWidth()).isEqualTo(100);
        assertThat(output.getHeight()).isEqualTo(100);
        assertThat(output.getBandCount()).isEqualTo(1);
        double sum = 0;
        int n = 0;
        for (int row = 2; row < 98; row++) {
            for (int col = 2; col < 98; col++) {
                sum += Math.abs(output.get(0, row, col) - raster.get(0, row, col));
                n++;
            }
        }
        assertThat(sum / n).isLessThan(2.0);
    }

    @Test
    void outputTakesTargetGeoreferencingAndSourceBands() throws Exception {
        Raster[] pair = translatedPair();
        float[] red = pair[0].band(0);
        float[] nir = new float[red.length];
        for (int i = 0; i < red.length; i++) nir[i] = 2 * red[i];
        Raster source = new Raster(100, 100, new float[][]{red, nir}, new GeoTransform(1, 1, 0, 1, 0, -1), "LOCAL");

        Raster output = siftPipeline(fakeStore).register(source, pair[1]).getOutput();

        assertThat(output.getBandCount()).isEqualTo(2);
        assertThat(output.getGeoTransform()).isEqualTo(CHM_GEO);
        assertThat(output.getCrs()).isEqualTo(CHM_CRS);
    }

    @Test
    void whenFlatImagesThenInsufficientFeatures() {
        InsufficientFeaturesException e = catchThrowableOfType(
                () -> siftPipeline(fakeStore).register(SyntheticRasters.constant(64, 64, 3f),
                        SyntheticRasters.constant(64, 64, 3f)),
                InsufficientFeaturesException.class);

        assertThat(e).isNotNull();
        assertThat(e.getImage()).isEqualTo("source");
        assertThat(e.getFound()).isZero();
    }

    @Test
    void whenTenMatchesThenRegistrationProceeds() throws Exception {
        when(fakeBackend.detectAndDescribe(any())).thenReturn(features(0, 0), features(5, 3));

        RegistrationResult result = pipeline(fakeBackend, fakeStore)
                .register(SyntheticRasters.constant(60, 60, 1f), SyntheticRasters.constant(60, 60, 1f));

        assertThat(result.getMatchCount()).isEqualTo(10);
        assertThat(result.getInliers().size()).isEqualTo(10);
        assertThat(result.getHomography().translationX()).isCloseTo(5.0, within(1e-6));
        assertThat(result.getHomography().translationY()).isCloseTo(3.0, within(1e-6));
    }

    @Test
    void whenNineMatchesThenInsufficientMatches() {
        List<Feature> target = features(5, 3);
        target.add(SyntheticRasters.unitFeature(50, 50, 9, 16));
        when(fakeBackend.detectAndDescribe(any())).thenReturn(features(0, 0), target);

        InsufficientMatchesException e = catchThrowableOfType(
                () -> pipeline(fakeBackend, fakeStore)
                        .register(SyntheticRasters.constant(60, 60, 1f), SyntheticRasters.constant(60, 60, 1f)),
                InsufficientMatchesException.class);

        assertThat(e).isNotNull();
        assertThat(e.getFound()).isEqualTo(9);
    }

    @Test
    void stagesAreReportedInOrder() throws Exception {
        Raster source = SyntheticRasters.constant(60, 60, 1f);
        Raster target = SyntheticRasters.constant(60, 60, 2f);
        Path sourcePath = Paths.get("ortho.tif");
        Path targetPath = Paths.get("chm.tif");
        Path outputPath = Paths.get("registered.tif");
        when(fakeStore.read(sourcePath)).thenReturn(source);
        when(fakeStore.read(targetPath)).thenReturn(target);
        when(fakeBackend.detectAndDescribe(any())).thenReturn(features(0, 0), features(5, 3));
        RecordingListener listener = new RecordingListener();

        RegistrationResult result = pipeline(fakeBackend, fakeStore).registerFiles(sourcePath, targetPath, outputPath, listener);

        assertThat(listener.stages).containsExactly(
                RegistrationStage.READING_SOURCE,
                RegistrationStage.READING_TARGET,
                RegistrationStage.EXTRACTING_FEATURES,
                RegistrationStage.MATCHING_FEATURES,
                RegistrationStage.COMPUTING_HOMOGRAPHY,
                RegistrationStage.WARPING_IMAGE,
                RegistrationStage.WRITING_OUTPUT);
        assertThat(listener.matches).isEqualTo(10);
        assertThat(listener.completed).isSameAs(result);
        verify(fakeStore).write(eq(outputPath), any(Raster.class));
    }

    @Test
    void whenRegistrationFailsThenNothingIsWritten() throws Exception {
        when(fakeStore.read(any())).thenReturn(SyntheticRasters.constant(64, 64, 0f));

        assertThatThrownBy(() -> siftPipeline(fakeStore)
                .registerFiles(Paths.get("a.tif"), Paths.get("b.tif"), Paths.get("out.tif"), RegistrationListener.NONE))
                .isInstanceOf(InsufficientFeaturesException.class);
        verify(fakeStore, never()).write(any(), any());
    }

    @Test
    void registersFilesOnDisk() throws Exception {
        RasterStore store = new GeoTiffRasterStore(new OpenCvRasterStore());
        Raster[] pair = translatedPair();
        Path sourcePath = dir.resolve("ortho.tif");
        Path targetPath = dir.resolve("chm.tif");
        Path outputPath = dir.resolve("registered.tif");
        store.write(sourcePath, pair[0]);
        store.write(targetPath, pair[1]);

        siftPipeline(store).registerFiles(sourcePath, targetPath, outputPath, new LoggingRegistrationListener("test"));

        Raster written = store.read(outputPath);
        assertThat(written.getWidth()).isEqualTo(100);
        assertThat(written.getCrs()).isEqualTo(CHM_CRS);
        for (int i = 0; i < 6; i++) {
            assertThat(written.getGeoTransform().coefficients()[i]).isCloseTo(CHM_GEO.coefficients()[i], within(1e-6));
        }
    }

    @Test
    void whenFilesCannotBeRegisteredThenNoOutputFile() throws Exception {
        RasterStore store = new GeoTiffRasterStore(new OpenCvRasterStore());
        Path sourcePath = dir.resolve("flat.tif");
        Path targetPath = dir.resolve("chm.tif");
        Path outputPath = dir.resolve("registered.tif");
        store.write(sourcePath, SyntheticRasters.constant(50, 50, 7f));
        store.write(targetPath, translatedPair()[1]);

        assertThatThrownBy(() -> siftPipeline(store).registerFiles(sourcePath, targetPath, outputPath, RegistrationListener.NONE))
                .isInstanceOf(InsufficientFeaturesException.class);
        assertThat(outputPath).doesNotExist();
        assertThat(dir.resolve("registered.tfw")).doesNotExist();
    }

    private static class RecordingListener implements RegistrationListener {
        final List<RegistrationStage> stages = new ArrayList<>();
        int matches = -1;
        RegistrationResult completed;

        @Override
        public void stageStarted(RegistrationStage stage) {
            stages.add(stage);
        }

        @Override
        public void matchesFound(int count) {
            matches = count;
        }

        @Override
        public void completed(RegistrationResult result) {
            completed = result;
        }
    }
}
