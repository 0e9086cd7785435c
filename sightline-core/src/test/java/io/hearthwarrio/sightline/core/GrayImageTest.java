package io.hearthwarrio.sightline.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GrayImageTest {

    @Test
    void filledRectIsClippedAndLeavesOriginalUntouched() {
        GrayImage white = GrayImage.filled(10, 10, 255);

        GrayImage covered = white.withFilledRect(8, 8, 5, 5, 0);

        assertEquals(0, covered.get(9, 9));
        assertEquals(0, covered.get(8, 8));
        assertEquals(255, covered.get(7, 7));
        assertEquals(255, white.get(9, 9));
    }

    @Test
    void patchIsPastedAtOffset() {
        GrayImage patch = GrayImage.filled(2, 2, 7);

        GrayImage image = GrayImage.filled(5, 5, 0).withPatch(3, 3, patch);

        assertEquals(7, image.get(3, 3));
        assertEquals(7, image.get(4, 4));
        assertEquals(0, image.get(2, 2));
    }

    @Test
    void bufferIsCopiedInAndOut() {
        byte[] data = new byte[]{1, 2, 3, 4};
        GrayImage image = new GrayImage(2, 2, data);

        data[0] = 9;
        image.toBytes()[1] = 9;

        assertEquals(1, image.get(0, 0));
        assertEquals(2, image.get(1, 0));
    }

    @Test
    void rejectsMismatchedBuffers() {
        assertThrows(IllegalArgumentException.class, () -> new GrayImage(3, 3, new byte[8]));
        assertThrows(IllegalArgumentException.class, () -> new GrayImage(0, 3, new byte[0]));
        assertThrows(IndexOutOfBoundsException.class, () -> GrayImage.filled(2, 2, 0).get(2, 0));
    }

    @Test
    void smallerThanChecksBothAxes() {
        GrayImage template = GrayImage.filled(10, 5, 0);

        assertTrue(GrayImage.filled(9, 20, 0).isSmallerThan(template));
        assertTrue(GrayImage.filled(20, 4, 0).isSmallerThan(template));
        assertFalse(GrayImage.filled(10, 5, 0).isSmallerThan(template));
    }

    @Test
    void scoreMapMaxPrefersFirstPositionOnTies() {
        ScoreMap map = new ScoreMap(3, 2, new float[]{0.1f, 0.9f, 0.2f, 0.9f, 0.3f, 0.4f});

        Peak peak = map.max();

        assertEquals(1, peak.getX());
        assertEquals(0, peak.getY());
        assertEquals(0.9f, (float) peak.getScore());
    }
}
