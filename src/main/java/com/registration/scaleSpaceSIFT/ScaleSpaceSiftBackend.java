package com.registration.scaleSpaceSIFT;

import com.registration.SIFT.Feature;
import com.registration.SIFT.FeatureBackend;
import com.registration.SIFT.Keypoint;
import com.registration.imageOperator.GrayscaleSurface;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;

/**
 * Feature backend built on the in-house {@link ScaleSpace} and {@link SiftDetector}.
 * Slower than OpenCV's SIFT but free of native detector code paths.
 */
public class ScaleSpaceSiftBackend implements FeatureBackend {
    private final SiftConfig config;

    public ScaleSpaceSiftBackend(SiftConfig config) {
        this.config = config;
    }

    public ScaleSpaceSiftBackend() {
        this(SiftConfig.defaults());
    }

    @Override
    public List<Feature> detectAndDescribe(GrayscaleSurface surface) {
        // 1. Tiền xử lý: Grayscale 8-bit -> Float [0, 1]
        Mat gray = surface.toMat();
        Mat floatGray = new Mat();
        gray.convertTo(floatGray, CV_32F, 1.0 / 255.0, 0.0);
        gray.release();

        // 2. Scale Space
        ScaleSpace scaleSpace = new ScaleSpace(config);
        List<MatVector> gaussianPyramid = scaleSpace.buildGaussianPyramid(floatGray);
        List<MatVector> dogPyramid = scaleSpace.buildDoGPyramid(gaussianPyramid);

        // 3. Detect, Interpolate, Orient, Describe
        List<SiftKeyPoint> keypoints = new SiftDetector(config).run(gaussianPyramid, dogPyramid);

        List<Feature> features = new ArrayList<>(keypoints.size());
        for (SiftKeyPoint kp : keypoints) {
            Keypoint keypoint = new Keypoint(kp.x, kp.y, kp.scale, kp.angle, kp.response, kp.octave);
            features.add(new Feature(keypoint, kp.descriptor));
        }

        floatGray.release();
        release(gaussianPyramid);
        release(dogPyramid);
        return features;
    }

    @Override
    public String name() {
        return "scale-space-sift";
    }

    private static void release(List<MatVector> pyramid) {
        for (MatVector octave : pyramid) {
            for (long i = 0; i < octave.size(); i++) {
                octave.get(i).release();
            }
            octave.close();
        }
        pyramid.clear();
    }
}
