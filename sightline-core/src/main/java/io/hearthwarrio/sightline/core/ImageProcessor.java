package io.hearthwarrio.sightline.core;

/**
 * Raster operations the search needs besides correlation.
 */
public interface ImageProcessor {

    /**
     * Decodes an encoded raster (PNG, JPEG, ...) into grayscale.
     *
     * @param encoded encoded image bytes
     * @return decoded image
     * @throws IllegalArgumentException if the bytes are not a decodable image
     */
    GrayImage decodeGray(byte[] encoded);

    /**
     * Resizes to the given width, keeping the aspect ratio:
     * the new height is {@code (int) (image.height * (width / (double) image.width))}.
     */
    GrayImage resizeToWidth(GrayImage image, int width);
}
