package io.hearthwarrio.sightline.opencv;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact.
 * <p>
 * Idempotent; every OpenCV-backed class calls {@link #load()} before touching native code.
 */
public final class OpenCvLibrary {

    private static boolean loaded = false;

    private OpenCvLibrary() {
        // utility class
    }

    /**
     * @throws IllegalStateException if the native library cannot be loaded on this platform
     */
    public static synchronized void load() {
        if (loaded) {
            return;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            throw new IllegalStateException("Failed to load OpenCV native library", e);
        }
        loaded = true;
    }
}
