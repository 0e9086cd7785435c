package io.hearthwarrio.sightline.opencv;

import io.hearthwarrio.sightline.core.GrayImage;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Conversions between {@link GrayImage} and single-channel OpenCV matrices.
 */
final class Mats {

    private Mats() {
        // utility class
    }

    static Mat toMat(GrayImage image) {
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC1);
        mat.put(0, 0, image.toBytes());
        return mat;
    }

    /**
     * @param mat continuous or not, must be {@code CV_8UC1}
     */
    static GrayImage toGrayImage(Mat mat) {
        if (mat.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException("Expected an 8-bit single channel matrix, got " + CvType.typeToString(mat.type()));
        }
        byte[] data = new byte[mat.rows() * mat.cols()];
        mat.get(0, 0, data);
        return new GrayImage(mat.cols(), mat.rows(), data);
    }
}
