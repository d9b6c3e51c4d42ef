package com.registration.scaleSpaceSIFT;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Parameters of the scale-space detector. Immutable; one instance per backend.
 */
@Getter
@AllArgsConstructor
public class SiftConfig {
    // Cấu hình cơ bản
    private final int numOctaves;
    private final int scalesPerOctave;
    private final double sigmaInit;
    private final double contrastThreshold;
    private final double edgeThreshold;
    private final boolean doubleImageSize;

    // Cấu hình Descriptor & Orientation
    public static final int DESCRIPTOR_HIST_WIDTH = 4; // Lưới 4x4
    public static final int DESCRIPTOR_HIST_BINS = 8;  // 8 hướng
    public static final int DESCRIPTOR_LENGTH = DESCRIPTOR_HIST_WIDTH * DESCRIPTOR_HIST_WIDTH * DESCRIPTOR_HIST_BINS;
    public static final int ORIENTATION_BINS = 36;
    public static final double ORI_SIGMA_FACTOR = 1.5;   // Hệ số bán kính lấy mẫu hướng
    public static final double DESCR_SCALE_FACTOR = 3.0; // Độ rộng 1 ô của lưới descriptor (x sigma)
    public static final double DESCR_MAG_THRESHOLD = 0.2;
    public static final double INITIAL_SIGMA = 0.5;      // Ảnh gốc coi như có sigma = 0.5 (Lowe)
    public static final int BORDER = 5;

    public static SiftConfig defaults() {
        return new SiftConfig(4, 3, 1.6, 0.04, 10.0, false);
    }

    // Ngưỡng contrast thực tế
    public double getScaledContrastThreshold() {
        return contrastThreshold / scalesPerOctave;
    }
}
