package com.eyelevel.codeconverter.encoder.impl;

import com.eyelevel.codeconverter.encoder.Encoder;
import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.model.BarcodeFormat;
import com.eyelevel.codeconverter.model.CodeType;
import com.eyelevel.codeconverter.model.ConversionConfig;
import com.eyelevel.codeconverter.model.EncodedImage;
import com.google.zxing.EncodeHintType;
import com.google.zxing.MultiFormatWriter;
import com.google.zxing.WriterException;
import com.google.zxing.common.BitMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Encodes values as one-dimensional barcodes with ZXing.
 *
 * <p>Options: {@code width} (pixels per narrow bar, default 2), {@code height} (bar height in pixels,
 * default 100), {@code margin} (quiet zone in pixels, default 10), {@code lineColor} and
 * {@code background}. EAN-5, EAN-2, the MSI variants and Pharmacode have no ZXing writer and are rejected.
 */
@Component
@Slf4j
public class BarcodeEncoder implements Encoder {

    private static final int DEFAULT_BAR_WIDTH = 2;
    private static final int DEFAULT_HEIGHT = 100;
    private static final int DEFAULT_MARGIN = 10;

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean supports(final CodeType codeType) {
        return codeType == CodeType.BARCODE;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public EncodedImage encode(final String value, final ConversionConfig config) {
        final BarcodeFormat format = config.barcodeFormat();
        if (format == null) {
            throw new EncodeException("A barcode format is required to encode a barcode.");
        }
        final EncoderOptions options = new EncoderOptions(config.options());
        final int barWidth = options.intValue(EncoderOptions.WIDTH, DEFAULT_BAR_WIDTH, 1, 50);
        final int height = options.intValue(EncoderOptions.HEIGHT, DEFAULT_HEIGHT, 1, 2000);
        final int margin = options.intValue(EncoderOptions.MARGIN, DEFAULT_MARGIN, 0, 1024);

        final com.google.zxing.BarcodeFormat zxingFormat = toZxingFormat(format);
        final String contents = format == BarcodeFormat.ITF14 ? itf14Contents(value) : value;
        final Map<EncodeHintType, Object> hints = hints(format);

        final BitMatrix matrix;
        try {
            final MultiFormatWriter writer = new MultiFormatWriter();
            final int naturalWidth = writer.encode(contents, zxingFormat, 0, height, hints).getWidth();
            matrix = writer.encode(contents, zxingFormat, naturalWidth * barWidth, height, hints);
        } catch (final WriterException | IllegalArgumentException e) {
            log.debug("{} encoding failed for value '{}': {}", format, value, e.getMessage());
            throw new EncodeException("Value '" + value + "' cannot be encoded as " + format + ": "
                                      + e.getMessage(), e);
        }

        return MatrixImageRenderer.render(matrix, margin,
                                          options.colorValue(EncoderOptions.LINE_COLOR, "#000000"),
                                          options.colorValue(EncoderOptions.BACKGROUND, "#FFFFFF"),
                                          config.outputFormat());
    }

    static com.google.zxing.BarcodeFormat toZxingFormat(final BarcodeFormat format) {
        return switch (format) {
            case CODE128, CODE128A, CODE128B, CODE128C -> com.google.zxing.BarcodeFormat.CODE_128;
            case EAN13 -> com.google.zxing.BarcodeFormat.EAN_13;
            case EAN8 -> com.google.zxing.BarcodeFormat.EAN_8;
            case UPC -> com.google.zxing.BarcodeFormat.UPC_A;
            case UPCE -> com.google.zxing.BarcodeFormat.UPC_E;
            case CODE39 -> com.google.zxing.BarcodeFormat.CODE_39;
            case ITF, ITF14 -> com.google.zxing.BarcodeFormat.ITF;
            case CODABAR -> com.google.zxing.BarcodeFormat.CODABAR;
            case EAN5, EAN2, MSI, MSI10, MSI11, MSI1010, MSI1110, PHARMACODE ->
                    throw new EncodeException("Barcode format " + format + " is not supported.");
        };
    }

    private static Map<EncodeHintType, Object> hints(final BarcodeFormat format) {
        final Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.MARGIN, 0);
        switch (format) {
            case CODE128A -> hints.put(EncodeHintType.FORCE_CODE_SET, "A");
            case CODE128B -> hints.put(EncodeHintType.FORCE_CODE_SET, "B");
            case CODE128C -> hints.put(EncodeHintType.FORCE_CODE_SET, "C");
            default -> {
            }
        }
        return hints;
    }

    /**
     * ITF-14 takes 13 digits and appends the GS1 check digit, or 14 digits whose last one must be that
     * check digit.
     */
    static String itf14Contents(final String value) {
        if (!value.matches("\\d{13,14}")) {
            throw new EncodeException("ITF-14 requires 13 or 14 digits but got '" + value + "'");
        }
        final String payload = value.substring(0, 13);
        final char check = gs1CheckDigit(payload);
        if (value.length() == 14 && value.charAt(13) != check) {
            throw new EncodeException("ITF-14 check digit of '" + value + "' should be " + check);
        }
        return payload + check;
    }

    private static char gs1CheckDigit(final String digits) {
        int sum = 0;
        for (int i = 0; i < digits.length(); i++) {
            final int digit = digits.charAt(i) - '0';
            sum += (digits.length() - i) % 2 == 1 ? digit * 3 : digit;
        }
        return (char) ('0' + (10 - sum % 10) % 10);
    }
}
