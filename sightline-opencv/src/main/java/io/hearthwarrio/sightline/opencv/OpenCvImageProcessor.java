package io.hearthwarrio.sightline.opencv;

import io.hearthwarrio.sightline.core.GrayImage;
import io.hearthwarrio.sightline.core.ImageProcessor;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.util.Objects;

/**
 * Decoding with {@code Imgcodecs.imdecode} and area-interpolated resizing with {@code Imgproc.resize}.
 */
public class OpenCvImageProcessor implements ImageProcessor {

    public OpenCvImageProcessor() {
        OpenCvLibrary.load();
    }

    @Override
    public GrayImage decodeGray(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded must not be null");
        if (encoded.length == 0) {
            throw new IllegalArgumentException("Cannot decode an empty buffer");
        }
        MatOfByte buffer = new MatOfByte(encoded);
        Mat decoded = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_GRAYSCALE);
        try {
            if (decoded.empty()) {
                throw new IllegalArgumentException("Bytes are not a decodable image (" + encoded.length + " bytes)");
            }
            return Mats.toGrayImage(decoded);
        } finally {
            buffer.release();
            decoded.release();
        }
    }

    @Override
    public GrayImage resizeToWidth(GrayImage image, int width) {
        Objects.requireNonNull(image, "image must not be null");
        int height = (int) (image.getHeight() * (width / (double) image.getWidth()));
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Cannot resize " + image + " to width " + width);
        }
        Mat src = Mats.toMat(image);
        Mat dst = new Mat();
        try {
            Imgproc.resize(src, dst, new Size(width, height), 0, 0, Imgproc.INTER_AREA);
            return Mats.toGrayImage(dst);
        } finally {
            src.release();
            dst.release();
        }
    }
}
