package com.eyelevel.codeconverter.model;

/**
 * Why one record did not get its attachment.
 *
 * @param recordId The record.
 * @param value    The text that was to be encoded.
 * @param reason   A human-readable error message.
 * @param stage    Whether encoding or uploading failed.
 */
public record ItemFailure(String recordId, String value, String reason, FailureStage stage) {
}
