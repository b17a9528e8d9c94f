package com.eyelevel.codeconverter.dto.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * A record as returned by the table API, with fields keyed by field id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableRecord(String id, Map<String, Object> fields) {
}
