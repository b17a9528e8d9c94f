package com.eyelevel.codeconverter.dto.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One page of records from {@code GET /table/{tableId}/record}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordsResponse(List<TableRecord> records) {

    public List<TableRecord> recordsOrEmpty() {
        return records == null ? List.of() : records;
    }
}
