package com.registration.SIFT;

import com.registration.imageOperator.GrayscaleSurface;
import lombok.Getter;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.SIFT;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;

/**
 * SIFT through the bytedeco OpenCV bindings.
 */
@Getter
public class OpenCvSiftBackend implements FeatureBackend {
    // Tham số SIFT: nfeatures, nOctaveLayers, contrastThreshold, edgeThreshold, sigma, enable_precise_upscale
    private final int nfeatures;
    private final int nOctaveLayers;
    private final double contrastThreshold;
    private final double edgeThreshold;
    private final double sigma;
    private final boolean enablePreciseUpscale;

    public OpenCvSiftBackend(int nfeatures, int nOctaveLayers, double contrastThreshold, double edgeThreshold,
                             double sigma, boolean enablePreciseUpscale) {
        this.nfeatures = nfeatures;
        this.nOctaveLayers = nOctaveLayers;
        this.contrastThreshold = contrastThreshold;
        this.edgeThreshold = edgeThreshold;
        this.sigma = sigma;
        this.enablePreciseUpscale = enablePreciseUpscale;
    }

    public OpenCvSiftBackend() {
        this(0, 3, 0.04, 10.0, 1.6, false);
    }

    @Override
    public List<Feature> detectAndDescribe(GrayscaleSurface surface) {
        Mat img = surface.toMat();
        Mat mask = new Mat();
        KeyPointVector keyPoints = new KeyPointVector();
        Mat descriptors = new Mat();

        SIFT sift = SIFT.create(nfeatures, nOctaveLayers, contrastThreshold, edgeThreshold, sigma, enablePreciseUpscale);
        try {
            sift.detectAndCompute(img, mask, keyPoints, descriptors);
            return toFeatures(keyPoints, descriptors);
        } finally {
            sift.close();
            descriptors.release();
            mask.release();
            img.release();
        }
    }

    @Override
    public String name() {
        return "opencv-sift";
    }

    private static List<Feature> toFeatures(KeyPointVector keyPoints, Mat descriptors) {
        int count = (int) keyPoints.size();
        List<Feature> features = new ArrayList<>(count);
        if (count == 0 || descriptors.empty()) {
            return features;
        }
        if (descriptors.type() != CV_32F) {
            throw new IllegalStateException("SIFT descriptors are expected as CV_32F, got type " + descriptors.type());
        }

        int dim = descriptors.cols();
        float[] buf = new float[count * dim];
        Mat continuous = descriptors.isContinuous() ? descriptors : descriptors.clone();
        new FloatPointer(continuous.data()).get(buf);

        for (int i = 0; i < count; i++) {
            KeyPoint kp = keyPoints.get(i);
            float[] desc = new float[dim];
            System.arraycopy(buf, i * dim, desc, 0, dim);
            Keypoint keypoint = new Keypoint(kp.pt().x(), kp.pt().y(), kp.size(), kp.angle(), kp.response(), kp.octave());
            features.add(new Feature(keypoint, desc));
        }
        return features;
    }
}
