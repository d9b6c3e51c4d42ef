package com.registration.SIFT;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Detected location in surface pixel coordinates. Size and angle only matter to the descriptor.
 */
@AllArgsConstructor
@Getter
public class Keypoint {
    public final float x, y;    // Tọa độ dưới pixel trên ảnh gốc
    public final float size;    // Đường kính vùng lân cận
    public final float angle;   // Hướng (degree 0-360)
    public final float response;
    public final int octave;

    public Keypoint(float x, float y) {
        this(x, y, 1f, 0f, 0f, 0);
    }

    @Override
    public String toString() {
        return String.format("Keypoint[(%.2f, %.2f), size=%.2f, angle=%.1f, octave=%d]", x, y, size, angle, octave);
    }
}
