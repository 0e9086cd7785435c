package io.hearthwarrio.sightline.opencv;

import io.hearthwarrio.sightline.core.CorrelationPrimitive;
import io.hearthwarrio.sightline.core.GrayImage;
import io.hearthwarrio.sightline.core.MatchMethod;
import io.hearthwarrio.sightline.core.Peak;
import io.hearthwarrio.sightline.core.ScoreMap;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * {@link CorrelationPrimitive} backed by {@code Imgproc.matchTemplate} and {@code Core.minMaxLoc}.
 */
public class OpenCvCorrelationPrimitive implements CorrelationPrimitive {

    public OpenCvCorrelationPrimitive() {
        OpenCvLibrary.load();
    }

    @Override
    public ScoreMap correlate(GrayImage image, GrayImage template, MatchMethod method) {
        Mat result = match(image, template, method);
        try {
            float[] scores = new float[result.rows() * result.cols()];
            result.get(0, 0, scores);
            return new ScoreMap(result.cols(), result.rows(), scores);
        } finally {
            result.release();
        }
    }

    /**
     * Runs the maximum search natively instead of copying the score map to the heap.
     */
    @Override
    public Peak bestPeak(GrayImage image, GrayImage template, MatchMethod method) {
        Mat result = match(image, template, method);
        try {
            Core.MinMaxLocResult mm = Core.minMaxLoc(result);
            return new Peak(mm.maxVal, (int) mm.maxLoc.x, (int) mm.maxLoc.y);
        } finally {
            result.release();
        }
    }

    private static Mat match(GrayImage image, GrayImage template, MatchMethod method) {
        if (image.isSmallerThan(template)) {
            throw new IllegalArgumentException("Template " + template + " does not fit into " + image);
        }
        Mat src = Mats.toMat(image);
        Mat tpl = Mats.toMat(template);
        Mat result = new Mat();
        try {
            Imgproc.matchTemplate(src, tpl, result, toOpenCv(method));
            return result;
        } finally {
            src.release();
            tpl.release();
        }
    }

    static int toOpenCv(MatchMethod method) {
        switch (method) {
            case CCOEFF_NORMED:
                return Imgproc.TM_CCOEFF_NORMED;
            case CCORR_NORMED:
                return Imgproc.TM_CCORR_NORMED;
            case SQDIFF_NORMED:
                return Imgproc.TM_SQDIFF_NORMED;
            default:
                throw new IllegalArgumentException("Unsupported method: " + method);
        }
    }
}
