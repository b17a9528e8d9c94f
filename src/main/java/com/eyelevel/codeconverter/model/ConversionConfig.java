package com.eyelevel.codeconverter.model;

import com.eyelevel.codeconverter.exception.InvalidConversionConfigException;
import lombok.Builder;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * The user's encoding choice for one run. Passed to the encoder untouched.
 *
 * @param codeType      Barcode or QR code.
 * @param barcodeFormat The symbology; required for barcodes, ignored for QR codes.
 * @param outputFormat  The image format of the generated attachment.
 * @param options       Encoder-specific styling (colours, sizes, margins, error correction level...).
 *                      Entries with a null key or value are dropped.
 */
@Builder
public record ConversionConfig(CodeType codeType, BarcodeFormat barcodeFormat, OutputFormat outputFormat,
                               Map<String, Object> options) {

    public ConversionConfig {
        options = options == null ? Map.of() : options.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    /**
     * Checks that the configuration names everything an encoder needs.
     *
     * @throws InvalidConversionConfigException if the code type or output format is missing, or a
     *                                          barcode is requested without a symbology.
     */
    public void validate() {
        if (codeType == null) {
            throw new InvalidConversionConfigException("A code type must be selected.");
        }
        if (outputFormat == null) {
            throw new InvalidConversionConfigException("An output format must be selected.");
        }
        if (codeType == CodeType.BARCODE && barcodeFormat == null) {
            throw new InvalidConversionConfigException("A barcode format must be selected for barcode conversion.");
        }
    }
}
