package io.hearthwarrio.sightline.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Single-channel 8-bit raster, row-major.
 * <p>
 * Instances are immutable: pixel data is copied on the way in and on the way out,
 * and {@link #withFilledRect(int, int, int, int, int)} returns a new image.
 */
public final class GrayImage {

    private final int width;
    private final int height;
    private final byte[] pixels;

    public GrayImage(int width, int height, byte[] pixels) {
        this(Objects.requireNonNull(pixels, "pixels must not be null").clone(), width, height);
    }

    // takes ownership of the buffer
    private GrayImage(byte[] pixels, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
        if (pixels.length != width * height) {
            throw new IllegalArgumentException(
                    "Pixel buffer length " + pixels.length + " does not match " + width + "x" + height
            );
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Creates an image where every pixel has the same value.
     */
    public static GrayImage filled(int width, int height, int value) {
        byte[] data = new byte[width * height];
        Arrays.fill(data, (byte) clamp(value));
        return new GrayImage(data, width, height);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return pixel value in {@code [0, 255]}
     */
    public int get(int x, int y) {
        checkInside(x, y);
        return pixels[y * width + x] & 0xFF;
    }

    /**
     * @return a copy of the row-major pixel buffer
     */
    public byte[] toBytes() {
        return pixels.clone();
    }

    /**
     * Returns a copy of this image with the given rectangle painted in a single value.
     * <p>
     * The rectangle is clipped to the image; a rectangle fully outside yields an identical copy.
     */
    public GrayImage withFilledRect(int x, int y, int rectWidth, int rectHeight, int value) {
        byte[] data = pixels.clone();
        int x0 = Math.max(0, x);
        int y0 = Math.max(0, y);
        int x1 = Math.min(width, x + rectWidth);
        int y1 = Math.min(height, y + rectHeight);
        byte v = (byte) clamp(value);
        for (int row = y0; row < y1; row++) {
            int offset = row * width;
            for (int col = x0; col < x1; col++) {
                data[offset + col] = v;
            }
        }
        return new GrayImage(data, width, height);
    }

    /**
     * Returns a copy of this image with {@code patch} pasted at {@code (x, y)}, clipped to this image.
     */
    public GrayImage withPatch(int x, int y, GrayImage patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        byte[] data = pixels.clone();
        for (int row = 0; row < patch.height; row++) {
            int ty = y + row;
            if (ty < 0 || ty >= height) {
                continue;
            }
            for (int col = 0; col < patch.width; col++) {
                int tx = x + col;
                if (tx < 0 || tx >= width) {
                    continue;
                }
                data[ty * width + tx] = patch.pixels[row * patch.width + col];
            }
        }
        return new GrayImage(data, width, height);
    }

    /**
     * @return {@code true} if the template cannot fit inside this image in at least one axis
     */
    public boolean isSmallerThan(GrayImage template) {
        return height < template.height || width < template.width;
    }

    private void checkInside(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") is outside " + width + "x" + height);
        }
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GrayImage)) {
            return false;
        }
        GrayImage other = (GrayImage) o;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "GrayImage{" + width + "x" + height + '}';
    }
}
