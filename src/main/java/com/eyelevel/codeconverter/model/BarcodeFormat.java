package com.eyelevel.codeconverter.model;

/**
 * One-dimensional symbologies an encoder may be asked for when the code type is {@link CodeType#BARCODE}.
 * Whether a given value is valid for a symbology is decided by the encoder.
 */
public enum BarcodeFormat {
    CODE128,
    CODE128A,
    CODE128B,
    CODE128C,
    EAN13,
    EAN8,
    EAN5,
    EAN2,
    UPC,
    UPCE,
    CODE39,
    ITF,
    ITF14,
    MSI,
    MSI10,
    MSI11,
    MSI1010,
    MSI1110,
    PHARMACODE,
    CODABAR
}
