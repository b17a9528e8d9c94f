package com.eyelevel.codeconverter.encoder.impl;

import com.eyelevel.codeconverter.exception.EncodeException;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed access to the styling options of a conversion. Numbers may arrive as any {@link Number} or as
 * numeric text; colours as {@code #RRGGBB} or {@code #RGB}.
 */
final class EncoderOptions {

    static final String WIDTH = "width";
    static final String HEIGHT = "height";
    static final String MARGIN = "margin";
    static final String LINE_COLOR = "lineColor";
    static final String BACKGROUND = "background";
    static final String ERROR_CORRECTION_LEVEL = "errorCorrectionLevel";

    private static final Pattern HEX_COLOR = Pattern.compile("#?([0-9a-fA-F]{3}|[0-9a-fA-F]{6})");

    private final Map<String, Object> options;

    EncoderOptions(final Map<String, Object> options) {
        this.options = options == null ? Map.of() : options;
    }

    /**
     * @throws EncodeException if the option is present but not a whole number within the bounds.
     */
    int intValue(final String name, final int defaultValue, final int min, final int max) {
        final Object raw = options.get(name);
        if (raw == null) {
            return defaultValue;
        }
        final int value;
        try {
            value = raw instanceof Number number ? number.intValue() : Integer.parseInt(raw.toString().trim());
        } catch (final NumberFormatException e) {
            throw new EncodeException("Option '" + name + "' must be a number but was '" + raw + "'", e);
        }
        if (value < min || value > max) {
            throw new EncodeException("Option '" + name + "' must be between " + min + " and " + max
                                      + " but was " + value);
        }
        return value;
    }

    String stringValue(final String name, final String defaultValue) {
        final Object raw = options.get(name);
        return raw == null ? defaultValue : raw.toString().trim();
    }

    /**
     * @return The colour as an opaque ARGB value.
     * @throws EncodeException if the option is not a hex colour.
     */
    int colorValue(final String name, final String defaultValue) {
        final String raw = stringValue(name, defaultValue);
        if (!HEX_COLOR.matcher(raw).matches()) {
            throw new EncodeException("Option '" + name + "' must be a hex colour such as #000000 but was '"
                                      + raw + "'");
        }
        String hex = raw.startsWith("#") ? raw.substring(1) : raw;
        if (hex.length() == 3) {
            hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
        }
        return 0xFF000000 | Integer.parseInt(hex, 16);
    }
}
