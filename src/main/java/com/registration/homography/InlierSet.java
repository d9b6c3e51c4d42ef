package com.registration.homography;

import java.util.Arrays;

/**
 * Indices, into the match list, of the matches a homography explains.
 */
public final class InlierSet {
    private final boolean[] mask;
    private final int[] indices;

    public InlierSet(boolean[] mask) {
        this.mask = mask.clone();
        int count = 0;
        for (boolean m : mask) if (m) count++;
        this.indices = new int[count];
        int k = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) indices[k++] = i;
        }
    }

    public int size() {
        return indices.length;
    }

    public boolean contains(int matchIndex) {
        return matchIndex >= 0 && matchIndex < mask.length && mask[matchIndex];
    }

    public int[] indices() {
        return indices.clone();
    }

    @Override
    public String toString() {
        return "InlierSet[" + indices.length + "/" + mask.length + "] " + Arrays.toString(indices);
    }
}
