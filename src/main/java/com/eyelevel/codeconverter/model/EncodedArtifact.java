package com.eyelevel.codeconverter.model;

/**
 * A generated image ready to be attached to its record.
 *
 * @param recordId The target record.
 * @param bytes    The image content.
 * @param fileName The attachment file name.
 * @param mimeType The attachment content type.
 */
public record EncodedArtifact(String recordId, byte[] bytes, String fileName, String mimeType) {

    public int size() {
        return bytes == null ? 0 : bytes.length;
    }
}
