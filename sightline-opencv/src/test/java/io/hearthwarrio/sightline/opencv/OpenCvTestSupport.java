package io.hearthwarrio.sightline.opencv;

import io.hearthwarrio.sightline.core.GrayImage;

import java.util.Random;

final class OpenCvTestSupport {

    private OpenCvTestSupport() {
        // utility class
    }

    /**
     * Platforms without a bundled native build skip OpenCV-backed tests instead of failing them.
     */
    static boolean openCvAvailable() {
        try {
            OpenCvLibrary.load();
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }

    static GrayImage noise(int width, int height, long seed) {
        Random random = new Random(seed);
        byte[] data = new byte[width * height];
        random.nextBytes(data);
        return new GrayImage(width, height, data);
    }

    static GrayImage white(int width, int height) {
        return GrayImage.filled(width, height, 255);
    }
}
