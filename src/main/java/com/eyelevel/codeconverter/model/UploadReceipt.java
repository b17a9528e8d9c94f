package com.eyelevel.codeconverter.model;

import java.time.Instant;

/**
 * Confirmation that an attachment was stored against a record.
 */
public record UploadReceipt(String recordId, String fileName, int statusCode, Instant uploadedAt) {
}
