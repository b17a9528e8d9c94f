package com.eyelevel.codeconverter.encoder.impl;

import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.model.BarcodeFormat;
import com.eyelevel.codeconverter.model.CodeType;
import com.eyelevel.codeconverter.model.ConversionConfig;
import com.eyelevel.codeconverter.model.EncodedImage;
import com.eyelevel.codeconverter.model.OutputFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BarcodeEncoderTest {

    private final BarcodeEncoder encoder = new BarcodeEncoder();

    private static ConversionConfig config(BarcodeFormat format, OutputFormat output, Map<String, Object> options) {
        return ConversionConfig.builder()
                .codeType(CodeType.BARCODE)
                .barcodeFormat(format)
                .outputFormat(output)
                .options(options)
                .build();
    }

    private static BufferedImage read(EncodedImage image) throws Exception {
        return ImageIO.read(new ByteArrayInputStream(image.bytes()));
    }

    private static Result decode(BufferedImage image) throws Exception {
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image)));
        return new MultiFormatReader().decode(bitmap, Map.of(DecodeHintType.TRY_HARDER, Boolean.TRUE));
    }

    @Test
    void testSupportsBarcodesOnly() {
        assertTrue(encoder.supports(CodeType.BARCODE));
        assertFalse(encoder.supports(CodeType.QR_CODE));
    }

    @Test
    void testEan13WithWrongDigitCountFailsWithEncodeException() {
        ConversionConfig config = config(BarcodeFormat.EAN13, OutputFormat.PNG, null);

        EncodeException error = assertThrows(EncodeException.class, () -> encoder.encode("12345", config));

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertTrue(error.getMessage().contains("EAN13"));
    }

    @Test
    void testEan13PngIsDecodableWithComputedCheckDigit() throws Exception {
        EncodedImage image = encoder.encode("590123412345", config(BarcodeFormat.EAN13, OutputFormat.PNG, null));

        assertEquals("image/png", image.mimeType());
        assertEquals("png", image.extension());
        BufferedImage png = read(image);
        assertEquals(95 * 2 + 2 * 10, png.getWidth());
        assertEquals(100 + 2 * 10, png.getHeight());
        assertEquals("5901234123457", decode(png).getText());
    }

    @Test
    void testColoursAndMarginAreApplied() throws Exception {
        EncodedImage image = encoder.encode("590123412345", config(BarcodeFormat.EAN13, OutputFormat.PNG, Map.of(
                "lineColor", "#F00", "background", "#00FF00", "margin", 4, "width", "1")));

        BufferedImage png = read(image);
        assertEquals(95 + 8, png.getWidth());
        assertEquals(0x00FF00, png.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(0xFF0000, png.getRGB(4, 50) & 0xFFFFFF);
    }

    @Test
    void testSvgOutputDrawsBarsOnBackground() {
        EncodedImage image = encoder.encode("590123412345", config(BarcodeFormat.EAN13, OutputFormat.SVG, null));

        String svg = new String(image.bytes(), StandardCharsets.UTF_8);
        assertEquals("image/svg+xml", image.mimeType());
        assertTrue(svg.startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\""));
        assertTrue(svg.contains("width=\"210\" height=\"120\""));
        assertTrue(svg.contains("fill=\"#FFFFFF\""));
        assertTrue(svg.contains("<g fill=\"#000000\"><rect x=\"10\" y=\"10\" width=\"2\" height=\"1\"/>"));
        assertTrue(svg.endsWith("</g></svg>"));
    }

    @Test
    void testCode128BIsDecodable() throws Exception {
        EncodedImage image = encoder.encode("Item-42", config(BarcodeFormat.CODE128B, OutputFormat.PNG, null));

        Result result = decode(read(image));

        assertEquals("Item-42", result.getText());
        assertEquals(com.google.zxing.BarcodeFormat.CODE_128, result.getBarcodeFormat());
    }

    @Test
    void testItf14CheckDigit() {
        assertEquals("12345678901231", BarcodeEncoder.itf14Contents("1234567890123"));
        assertEquals("12345678901231", BarcodeEncoder.itf14Contents("12345678901231"));
        assertThrows(EncodeException.class, () -> BarcodeEncoder.itf14Contents("12345678901230"));
        assertThrows(EncodeException.class, () -> BarcodeEncoder.itf14Contents("123456"));
    }

    @Test
    void testFormatsWithoutWriterAreRejected() {
        for (BarcodeFormat format : new BarcodeFormat[]{BarcodeFormat.EAN5, BarcodeFormat.MSI10,
                BarcodeFormat.PHARMACODE}) {
            EncodeException error = assertThrows(EncodeException.class,
                    () -> encoder.encode("12345", config(format, OutputFormat.PNG, null)));
            assertTrue(error.getMessage().contains("not supported"));
        }
    }

    @Test
    void testInvalidOptionsFailWithEncodeException() {
        assertThrows(EncodeException.class, () -> encoder.encode("590123412345",
                config(BarcodeFormat.EAN13, OutputFormat.PNG, Map.of("width", "wide"))));
        assertThrows(EncodeException.class, () -> encoder.encode("590123412345",
                config(BarcodeFormat.EAN13, OutputFormat.PNG, Map.of("lineColor", "red"))));
        assertThrows(EncodeException.class, () -> encoder.encode("590123412345",
                config(BarcodeFormat.EAN13, OutputFormat.PNG, Map.of("height", 0))));
    }

    @Test
    void testMissingBarcodeFormatFails() {
        assertThrows(EncodeException.class,
                () -> encoder.encode("abc", config(null, OutputFormat.PNG, null)));
    }
}
