package br.edu.ifba.deduper.core;

/**
 * Media category of a scanned file.
 *
 * Files are only ever compared with files of the same media type.
 */
public enum MediaType {

    PHOTO,

    VIDEO,

    AUDIO,

    DOCUMENT;

    /**
     * Returns true if the upstream extractor is expected to supply a perceptual
     * hash for this media type. A missing hash is only penalized when one was expected.
     *
     * @return true for photos and videos
     */
    public boolean expectsPerceptualHash() {
        return this == PHOTO || this == VIDEO;
    }
}
