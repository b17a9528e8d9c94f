package com.eyelevel.codeconverter.source;

import com.eyelevel.codeconverter.model.RecordQuery;
import com.eyelevel.codeconverter.model.SourceItem;

import java.util.List;

/**
 * Reads the records a run converts.
 */
public interface RecordSource {

    /**
     * @return Every record of the query's view, in view order, with the value of the query's field.
     * @throws com.eyelevel.codeconverter.exception.RecordSourceException if the records cannot be read.
     */
    List<SourceItem> fetchRecords(RecordQuery query);
}
