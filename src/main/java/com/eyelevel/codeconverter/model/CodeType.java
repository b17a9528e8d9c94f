package com.eyelevel.codeconverter.model;

/**
 * The family of symbol generated for each record.
 */
public enum CodeType {
    BARCODE,
    QR_CODE
}
