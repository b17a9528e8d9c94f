package com.eyelevel.codeconverter.source;

import com.eyelevel.codeconverter.common.apiclient.table.TableApiClient;
import com.eyelevel.codeconverter.config.ConversionProperties;
import com.eyelevel.codeconverter.dto.table.RecordsResponse;
import com.eyelevel.codeconverter.dto.table.TableRecord;
import com.eyelevel.codeconverter.exception.RecordSourceException;
import com.eyelevel.codeconverter.model.RecordQuery;
import com.eyelevel.codeconverter.model.SourceItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads records page by page from the table API until a short page is returned. Records already read are
 * skipped, and a full page with no new record ends the read, since the API is then ignoring the offset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableRecordSource implements RecordSource {

    private final TableApiClient tableApiClient;
    private final ConversionProperties conversionProperties;

    @Override
    public List<SourceItem> fetchRecords(final RecordQuery query) {
        final int pageSize = conversionProperties.getRecords().getPageSize();
        final List<SourceItem> items = new ArrayList<>();
        final Set<String> seenIds = new HashSet<>();
        int skip = 0;

        try {
            while (true) {
                final RecordsResponse page = tableApiClient.getRecords(query.tableId(), query.viewId(), pageSize,
                                                                       skip);
                final List<TableRecord> records = page == null ? List.of() : page.recordsOrEmpty();
                int fresh = 0;
                for (final TableRecord record : records) {
                    if (record.id() == null || seenIds.add(record.id())) {
                        items.add(toSourceItem(record, query.fieldId()));
                        fresh++;
                    }
                }
                log.debug("Read {} record(s) of table {} at offset {}", records.size(), query.tableId(), skip);

                if (records.size() < pageSize) {
                    break;
                }
                if (fresh == 0) {
                    log.warn("Page at offset {} of table {} repeats records already read, stopping.", skip,
                             query.tableId());
                    break;
                }
                skip += records.size();
            }
        } catch (final RuntimeException e) {
            log.error("Failed to read records of table {} view {}: {}", query.tableId(), query.viewId(),
                      e.getMessage());
            throw new RecordSourceException("Failed to read records of table " + query.tableId() + ": "
                                            + e.getMessage(), e);
        }

        log.info("Read {} record(s) from table {} view {}", items.size(), query.tableId(), query.viewId());
        return items;
    }

    private static SourceItem toSourceItem(final TableRecord record, final String fieldId) {
        final Map<String, Object> fields = record.fields() == null ? Map.of() : record.fields();
        return new SourceItem(record.id(), renderValue(fields.get(fieldId)));
    }

    /**
     * Multi-value cells are joined with ", ". Objects such as linked records are rendered by their title.
     */
    static Object renderValue(final Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream()
                         .filter(Objects::nonNull)
                         .map(TableRecordSource::renderValue)
                         .map(String::valueOf)
                         .collect(Collectors.joining(", "));
        }
        if (value instanceof Map<?, ?> object) {
            final Object title = object.get("title");
            return title != null ? title : object.toString();
        }
        return value;
    }
}
