package com.registration.SIFT;

import lombok.Getter;

/**
 * A keypoint and the descriptor computed for it.
 */
@Getter
public class Feature {
    private final Keypoint keypoint;
    private final float[] descriptor;

    public Feature(Keypoint keypoint, float[] descriptor) {
        if (keypoint == null || descriptor == null || descriptor.length == 0) {
            throw new IllegalArgumentException("Feature needs a keypoint and a non-empty descriptor");
        }
        this.keypoint = keypoint;
        this.descriptor = descriptor;
    }

    public float x() {
        return keypoint.x;
    }

    public float y() {
        return keypoint.y;
    }
}
