package com.eyelevel.codeconverter.model;

/**
 * The image an encoder produced for one value.
 *
 * @param bytes     The encoded image.
 * @param mimeType  Its MIME type, e.g. {@code image/png}.
 * @param extension The file extension without a dot, e.g. {@code png}.
 */
public record EncodedImage(byte[] bytes, String mimeType, String extension) {

    /**
     * Wraps encoder output in the extension and MIME type of the given format.
     */
    public static EncodedImage of(byte[] bytes, OutputFormat format) {
        return new EncodedImage(bytes, format.getMimeType(), format.getExtension());
    }
}
