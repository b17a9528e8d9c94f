package com.eyelevel.codeconverter.service;

import com.eyelevel.codeconverter.exception.InvalidConversionConfigException;
import com.eyelevel.codeconverter.model.ConversionConfig;
import lombok.Builder;
import org.springframework.util.StringUtils;

/**
 * Everything a host needs to start a conversion.
 *
 * @param tableId           The table holding the records.
 * @param viewId            The view selecting and ordering the records; optional.
 * @param sourceFieldId     The field whose value is encoded.
 * @param attachmentFieldId The attachment field the images are added to.
 * @param config            How values are encoded.
 */
@Builder
public record ConversionRequest(String tableId, String viewId, String sourceFieldId, String attachmentFieldId,
                                ConversionConfig config) {

    /**
     * @throws InvalidConversionConfigException if the table, either field or the configuration is missing.
     */
    public void validate() {
        if (!StringUtils.hasText(tableId)) {
            throw new InvalidConversionConfigException("A table must be selected.");
        }
        if (!StringUtils.hasText(sourceFieldId)) {
            throw new InvalidConversionConfigException("A source field must be selected.");
        }
        if (!StringUtils.hasText(attachmentFieldId)) {
            throw new InvalidConversionConfigException("An attachment field must be selected.");
        }
        if (config == null) {
            throw new InvalidConversionConfigException("A conversion configuration must be provided.");
        }
        config.validate();
    }
}
