package com.eyelevel.codeconverter.encoder;

import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.model.CodeType;
import com.eyelevel.codeconverter.model.ConversionConfig;
import com.eyelevel.codeconverter.model.EncodedImage;

/**
 * Turns one text value into a barcode or QR code image. Implementations are contributed as beans and
 * picked up by {@link EncoderFactory}.
 *
 * <p>Encoding is called from a single thread per run, one value at a time, and must return the same
 * image for the same value and configuration.
 */
public interface Encoder {

    /**
     * Determines if this encoder produces the given kind of symbol.
     */
    boolean supports(CodeType codeType);

    /**
     * Encodes a value.
     *
     * @param value  The trimmed, non-empty text to encode.
     * @param config The run's configuration, unchanged.
     * @return The image in {@link ConversionConfig#outputFormat()}.
     * @throws EncodeException if the value cannot be represented in the configured format.
     */
    EncodedImage encode(String value, ConversionConfig config);
}
