package com.registration.warper;

import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_NEAREST;

public enum Interpolation {
    LINEAR(INTER_LINEAR),
    NEAREST(INTER_NEAREST);

    private final int flag;

    Interpolation(int flag) {
        this.flag = flag;
    }

    public int flag() {
        return flag;
    }
}
