package com.registration.scaleSpaceSIFT;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.BORDER_DEFAULT;
import static org.bytedeco.opencv.global.opencv_core.subtract;
import static org.bytedeco.opencv.global.opencv_imgproc.GaussianBlur;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_NEAREST;
import static org.bytedeco.opencv.global.opencv_imgproc.resize;

/**
 * Gaussian and difference-of-Gaussians pyramids over a CV_32F image in [0, 1].
 */
public class ScaleSpace {
    private final SiftConfig config;

    public ScaleSpace(SiftConfig config) {
        this.config = config;
    }

    /**
     * Octaves that still leave room for the detection border on the smallest level.
     */
    public int usableOctaves(int width, int height) {
        int minSide = Math.min(width, height) * (config.isDoubleImageSize() ? 2 : 1);
        int octaves = 0;
        while (octaves < config.getNumOctaves() && (minSide >> octaves) > 2 * SiftConfig.BORDER + 2) {
            octaves++;
        }
        return Math.max(octaves, 1);
    }

    public List<MatVector> buildGaussianPyramid(Mat baseImage) {
        List<MatVector> pyramid = new ArrayList<>();
        Mat currentImg = baseImage.clone();
        double assumedSigma = SiftConfig.INITIAL_SIGMA;

        if (config.isDoubleImageSize()) {
            Mat upscaled = new Mat();
            // Upscale x2 dùng nội suy Linear, sigma thực tế cũng nhân 2
            resize(currentImg, upscaled, new Size(), 2.0, 2.0, INTER_LINEAR);
            currentImg.release();
            currentImg = upscaled;
            assumedSigma *= 2;
        }

        // Làm mờ ảnh nền để đạt sigma ban đầu
        double sigma0 = config.getSigmaInit();
        double baseBlur = Math.sqrt(Math.max(sigma0 * sigma0 - assumedSigma * assumedSigma, 0.01));
        Mat base = new Mat();
        GaussianBlur(currentImg, base, new Size(0, 0), baseBlur, baseBlur, BORDER_DEFAULT);
        currentImg.release();
        currentImg = base;

        int scales = config.getScalesPerOctave();
        double k = Math.pow(2, 1.0 / scales);
        double[] sigmas = new double[scales + 3];

        sigmas[0] = sigma0;
        for (int i = 1; i < sigmas.length; i++) {
            double prevSigma = Math.pow(k, i - 1) * sigma0;
            double totalSigma = Math.pow(k, i) * sigma0;
            sigmas[i] = Math.sqrt(totalSigma * totalSigma - prevSigma * prevSigma);
        }

        int octaves = usableOctaves(baseImage.cols(), baseImage.rows());
        for (int o = 0; o < octaves; o++) {
            MatVector octave = new MatVector(sigmas.length);
            octave.put(0, currentImg);

            for (int i = 1; i < sigmas.length; i++) {
                Mat prev = octave.get(i - 1);
                Mat next = new Mat();
                GaussianBlur(prev, next, new Size(0, 0), sigmas[i], sigmas[i], BORDER_DEFAULT);
                octave.put(i, next);
            }
            pyramid.add(octave);

            if (o < octaves - 1) {
                // Layer có sigma = 2 * sigma0 làm nền cho octave tiếp theo
                Mat baseNext = octave.get(scales);
                Mat downsampled = new Mat();
                resize(baseNext, downsampled, new Size(baseNext.cols() / 2, baseNext.rows() / 2), 0, 0, INTER_NEAREST);
                currentImg = downsampled;
            }
        }
        return pyramid;
    }

    public List<MatVector> buildDoGPyramid(List<MatVector> gPyramid) {
        List<MatVector> dogPyramid = new ArrayList<>();
        for (MatVector octave : gPyramid) {
            long size = octave.size();
            MatVector dogOctave = new MatVector(size - 1);
            for (long i = 0; i < size - 1; i++) {
                Mat diff = new Mat();
                subtract(octave.get(i + 1), octave.get(i), diff);
                dogOctave.put(i, diff);
            }
            dogPyramid.add(dogOctave);
        }
        return dogPyramid;
    }
}
