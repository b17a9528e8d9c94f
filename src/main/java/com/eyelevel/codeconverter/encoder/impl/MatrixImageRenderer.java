package com.eyelevel.codeconverter.encoder.impl;

import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.model.EncodedImage;
import com.eyelevel.codeconverter.model.OutputFormat;
import com.google.zxing.client.j2se.MatrixToImageConfig;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes an encoded {@link BitMatrix} as a PNG or SVG image, surrounded by a quiet zone of background
 * colour.
 */
@Slf4j
final class MatrixImageRenderer {

    private MatrixImageRenderer() {
    }

    /**
     * @param matrix     The symbol, one bit per pixel, without a quiet zone.
     * @param margin     Quiet zone width in pixels on every side.
     * @param lineColor  Opaque ARGB colour of set bits.
     * @param background Opaque ARGB colour of unset bits and the quiet zone.
     */
    static EncodedImage render(final BitMatrix matrix, final int margin, final int lineColor, final int background,
                               final OutputFormat format) {
        final BitMatrix padded = pad(matrix, margin);
        final byte[] bytes = switch (format) {
            case PNG -> toPng(padded, lineColor, background);
            case SVG -> toSvg(padded, lineColor, background);
        };
        log.trace("Rendered {}x{} symbol as {} ({} bytes)", padded.getWidth(), padded.getHeight(), format,
                  bytes.length);
        return EncodedImage.of(bytes, format);
    }

    private static BitMatrix pad(final BitMatrix matrix, final int margin) {
        if (margin == 0) {
            return matrix;
        }
        final BitMatrix padded = new BitMatrix(matrix.getWidth() + 2 * margin, matrix.getHeight() + 2 * margin);
        for (int y = 0; y < matrix.getHeight(); y++) {
            for (int x = 0; x < matrix.getWidth(); x++) {
                if (matrix.get(x, y)) {
                    padded.set(x + margin, y + margin);
                }
            }
        }
        return padded;
    }

    private static byte[] toPng(final BitMatrix matrix, final int lineColor, final int background) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            MatrixToImageWriter.writeToStream(matrix, "PNG", out, new MatrixToImageConfig(lineColor, background));
        } catch (final IOException e) {
            throw new EncodeException("Failed to write PNG image: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    /**
     * One rectangle per horizontal run of set bits.
     */
    private static byte[] toSvg(final BitMatrix matrix, final int lineColor, final int background) {
        final int width = matrix.getWidth();
        final int height = matrix.getHeight();
        final StringBuilder svg = new StringBuilder(256)
                .append("<svg xmlns=\"http://www.w3.org/2000/svg\" version=\"1.1\" width=\"").append(width)
                .append("\" height=\"").append(height).append("\" viewBox=\"0 0 ").append(width).append(' ')
                .append(height).append("\" shape-rendering=\"crispEdges\">")
                .append("<rect width=\"100%\" height=\"100%\" fill=\"").append(hex(background)).append("\"/>")
                .append("<g fill=\"").append(hex(lineColor)).append("\">");
        for (int y = 0; y < height; y++) {
            int x = 0;
            while (x < width) {
                if (!matrix.get(x, y)) {
                    x++;
                    continue;
                }
                final int start = x;
                while (x < width && matrix.get(x, y)) {
                    x++;
                }
                svg.append("<rect x=\"").append(start).append("\" y=\"").append(y).append("\" width=\"")
                   .append(x - start).append("\" height=\"1\"/>");
            }
        }
        svg.append("</g></svg>");
        return svg.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String hex(final int argb) {
        return String.format("#%06X", argb & 0xFFFFFF);
    }
}
