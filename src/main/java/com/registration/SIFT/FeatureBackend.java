package com.registration.SIFT;

import com.registration.imageOperator.GrayscaleSurface;

import java.util.List;

/**
 * Scale and rotation invariant keypoint detector plus descriptor.
 * <p>
 * Implementations must return the same list for the same surface, and the list order is the
 * index space that matches refer to.
 */
public interface FeatureBackend {

    List<Feature> detectAndDescribe(GrayscaleSurface surface);

    String name();
}
