package com.eyelevel.codeconverter.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Image formats an encoder can produce, with the file extension and MIME type used for the attachment.
 */
@Getter
@RequiredArgsConstructor
public enum OutputFormat {
    PNG("png", "image/png"),
    SVG("svg", "image/svg+xml");

    private final String extension;
    private final String mimeType;
}
