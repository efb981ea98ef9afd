package br.edu.ifba.deduper.core;

/**
 * Pixel dimensions of an image or video frame.
 *
 * @param width width in pixels
 * @param height height in pixels
 */
public record PixelSize(int width, int height) {

    public PixelSize {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("dimensions cannot be negative");
        }
    }

    public long pixelCount() {
        return (long) width * height;
    }
}
