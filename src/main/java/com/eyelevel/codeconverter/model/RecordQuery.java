package com.eyelevel.codeconverter.model;

/**
 * Selects the records of a run and the field whose value is encoded.
 */
public record RecordQuery(String tableId, String viewId, String fieldId) {
}
