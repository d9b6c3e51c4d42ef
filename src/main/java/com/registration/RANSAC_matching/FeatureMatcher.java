package com.registration.RANSAC_matching;

import com.registration.SIFT.Feature;
import com.registration.exception.InsufficientMatchesException;
import com.registration.imageOperator.ImageUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.DMatchVectorVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.BFMatcher;
import org.bytedeco.opencv.opencv_features2d.DescriptorMatcher;
import org.bytedeco.opencv.opencv_features2d.FlannBasedMatcher;
import org.bytedeco.opencv.opencv_flann.KDTreeIndexParams;
import org.bytedeco.opencv.opencv_flann.SearchParams;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

/**
 * k=2 nearest neighbour search followed by Lowe's ratio test.
 */
@Slf4j
@Getter
public class FeatureMatcher {
    public static final double DEFAULT_RATIO = 0.75;
    public static final int DEFAULT_MIN_MATCHES = 10;
    static final int FLANN_TREES = 5;
    static final int FLANN_CHECKS = 50;

    private final MatcherType type;
    private final double ratioThreshold;
    private final int minMatches;

    public FeatureMatcher() {
        this(MatcherType.BRUTE_FORCE, DEFAULT_RATIO, DEFAULT_MIN_MATCHES);
    }

    public FeatureMatcher(MatcherType type, double ratioThreshold, int minMatches) {
        if (ratioThreshold <= 0 || ratioThreshold > 1) {
            throw new IllegalArgumentException("Ratio threshold must be in (0, 1], got " + ratioThreshold);
        }
        this.type = type;
        this.ratioThreshold = ratioThreshold;
        this.minMatches = minMatches;
    }

    /**
     * @return at most one match per source feature, in source order
     * @throws InsufficientMatchesException if fewer than {@code minMatches} survive the ratio test
     */
    public List<Match> match(List<Feature> source, List<Feature> target) throws InsufficientMatchesException {
        List<Match> goodMatches = ratioTest(source, target);
        log.debug("{} of {} source features passed the ratio test ({})", goodMatches.size(), source.size(), ratioThreshold);

        if (goodMatches.size() < minMatches) {
            throw new InsufficientMatchesException(goodMatches.size(), minMatches, ratioThreshold);
        }
        return goodMatches;
    }

    /**
     * Ratio test without the minimum-count check.
     */
    public List<Match> ratioTest(List<Feature> source, List<Feature> target) {
        List<Match> goodMatches = new ArrayList<>();
        if (source.isEmpty() || target.size() < 2) {
            return goodMatches;
        }

        Mat desc1 = toDescriptorMat(source);
        Mat desc2 = toDescriptorMat(target);
        DMatchVectorVector knnMatches = new DMatchVectorVector();
        DescriptorMatcher matcher = createMatcher();
        try {
            matcher.knnMatch(desc1, desc2, knnMatches, 2);

            // Lowe's Ratio Test
            long size = knnMatches.size();
            for (long i = 0; i < size; i++) {
                DMatchVector matches = knnMatches.get(i);
                if (matches.size() < 2) continue;

                DMatch m = matches.get(0);
                DMatch n = matches.get(1);
                if (m.distance() < ratioThreshold * n.distance()) {
                    goodMatches.add(new Match(m.queryIdx(), m.trainIdx(), m.distance()));
                }
            }
        } finally {
            matcher.close();
            knnMatches.close();
            desc1.release();
            desc2.release();
        }
        return goodMatches;
    }

    DescriptorMatcher createMatcher() {
        if (type == MatcherType.FLANN) {
            // KD-tree forest of 5, 50 leaf checks per query
            return new FlannBasedMatcher(new KDTreeIndexParams(FLANN_TREES), new SearchParams(FLANN_CHECKS, 0f, true));
        }
        return new BFMatcher(NORM_L2, false);
    }

    static Mat toDescriptorMat(List<Feature> features) {
        int dim = features.get(0).getDescriptor().length;
        float[][] rows = new float[features.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = features.get(i).getDescriptor();
        }
        return ImageUtils.rowsToMat(rows, dim);
    }
}
