package com.eyelevel.codeconverter.encoder.impl;

import com.eyelevel.codeconverter.encoder.Encoder;
import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.model.CodeType;
import com.eyelevel.codeconverter.model.ConversionConfig;
import com.eyelevel.codeconverter.model.EncodedImage;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Encodes values as QR codes with ZXing.
 *
 * <p>Options: {@code width} (image side in pixels, default 256), {@code margin} (quiet zone in pixels,
 * default 10), {@code errorCorrectionLevel} ({@code L}, {@code M}, {@code Q} or {@code H}, default M),
 * {@code lineColor} and {@code background}.
 */
@Component
@Slf4j
public class QrCodeEncoder implements Encoder {

    private static final int DEFAULT_SIZE = 256;
    private static final int DEFAULT_MARGIN = 10;

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean supports(final CodeType codeType) {
        return codeType == CodeType.QR_CODE;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public EncodedImage encode(final String value, final ConversionConfig config) {
        final EncoderOptions options = new EncoderOptions(config.options());
        final int size = options.intValue(EncoderOptions.WIDTH, DEFAULT_SIZE, 21, 4096);
        final int margin = options.intValue(EncoderOptions.MARGIN, DEFAULT_MARGIN, 0, 1024);
        final ErrorCorrectionLevel level = errorCorrectionLevel(options);

        final BitMatrix matrix;
        try {
            matrix = new QRCodeWriter().encode(value, BarcodeFormat.QR_CODE, size, size, Map.of(
                    EncodeHintType.ERROR_CORRECTION, level,
                    EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name(),
                    EncodeHintType.MARGIN, 0));
        } catch (final WriterException | IllegalArgumentException e) {
            log.debug("QR encoding failed for a value of {} character(s): {}", value.length(), e.getMessage());
            throw new EncodeException("Value cannot be encoded as a QR code: " + e.getMessage(), e);
        }

        return MatrixImageRenderer.render(matrix, margin,
                                          options.colorValue(EncoderOptions.LINE_COLOR, "#000000"),
                                          options.colorValue(EncoderOptions.BACKGROUND, "#FFFFFF"),
                                          config.outputFormat());
    }

    private static ErrorCorrectionLevel errorCorrectionLevel(final EncoderOptions options) {
        final String level = options.stringValue(EncoderOptions.ERROR_CORRECTION_LEVEL, "M");
        try {
            return ErrorCorrectionLevel.valueOf(level.toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new EncodeException("Unknown error correction level '" + level + "', expected L, M, Q or H", e);
        }
    }
}
