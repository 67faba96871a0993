package io.ensightrpc.core.transport;

/**
 * Parameters of a scene rendering.
 *
 * @param width image width in pixels
 * @param height image height in pixels
 * @param aaPasses number of anti-aliasing passes
 * @param png true for a PNG stream, false for raw RGB bytes
 * @param highlighting whether selection highlighting is drawn
 */
public record RenderOptions(int width, int height, int aaPasses, boolean png, boolean highlighting) {
    public RenderOptions {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("image size must be positive: " + width + "x" + height);
        }
        if (aaPasses < 1) {
            throw new IllegalArgumentException("aaPasses must be >= 1: " + aaPasses);
        }
    }

    public static RenderOptions defaults() {
        return new RenderOptions(640, 480, 1, true, false);
    }

    public static RenderOptions png(int width, int height, int aaPasses) {
        return new RenderOptions(width, height, aaPasses, true, false);
    }
}
