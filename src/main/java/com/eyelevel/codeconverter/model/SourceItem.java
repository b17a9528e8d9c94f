package com.eyelevel.codeconverter.model;

/**
 * One record of the selected view, reduced to the value that will be encoded.
 *
 * @param recordId The record the generated image is attached to.
 * @param rawValue The cell value: a {@link String}, {@link Number}, {@link Boolean} or {@code null}.
 */
public record SourceItem(String recordId, Object rawValue) {

    /**
     * The value as text, or an empty string when the cell is empty.
     */
    public String textValue() {
        return rawValue == null ? "" : String.valueOf(rawValue);
    }

    /**
     * Whether the record carries something to encode once surrounding whitespace is removed.
     */
    public boolean hasContent() {
        return rawValue != null && !textValue().trim().isEmpty();
    }
}
