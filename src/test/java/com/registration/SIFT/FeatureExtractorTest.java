package com.registration.SIFT;

import com.registration.SyntheticRasters;
import com.registration.exception.InsufficientFeaturesException;
import com.registration.imageOperator.GrayscaleSurface;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureExtractorTest {

    @Mock
    private FeatureBackend backend;

    private final GrayscaleSurface surface = new GrayscaleSurface(4, 4, new byte[16]);

    @Test
    void whenNineFeaturesThenInsufficientFeatures() {
        when(backend.detectAndDescribe(any())).thenReturn(features(9));
        when(backend.name()).thenReturn("fake");

        InsufficientFeaturesException e = catchThrowableOfType(
                () -> new FeatureExtractor(backend).extract(surface, "target"), InsufficientFeaturesException.class);

        assertThat(e).isNotNull();
        assertThat(e.getImage()).isEqualTo("target");
        assertThat(e.getFound()).isEqualTo(9);
        assertThat(e.getRequired()).isEqualTo(10);
        assertThat(e.kind()).isEqualTo("InsufficientFeatures");
    }

    @Test
    void whenTenFeaturesThenReturnedInBackendOrder() throws Exception {
        List<Feature> features = features(10);
        when(backend.detectAndDescribe(any())).thenReturn(features);
        when(backend.name()).thenReturn("fake");

        assertThat(new FeatureExtractor(backend).extract(surface, "source")).containsExactlyElementsOf(features);
    }

    @Test
    void whenThresholdConfiguredThenApplied() throws Exception {
        when(backend.detectAndDescribe(any())).thenReturn(features(3));
        when(backend.name()).thenReturn("fake");

        assertThat(new FeatureExtractor(backend, 3).extract(surface, "source")).hasSize(3);
    }

    private static List<Feature> features(int count) {
        List<Feature> features = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            features.add(SyntheticRasters.unitFeature(i, 2 * i, i, 16));
        }
        return features;
    }
}
