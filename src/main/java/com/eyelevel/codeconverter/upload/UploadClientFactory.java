package com.eyelevel.codeconverter.upload;

import com.eyelevel.codeconverter.common.apiclient.table.TableApiClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Creates {@link UploadClient}s bound to an attachment target.
 */
@Service
@RequiredArgsConstructor
public class UploadClientFactory {

    private final TableApiClient tableApiClient;

    public UploadClient forTarget(String tableId, String attachmentFieldId) {
        return new AttachmentUploadClient(tableApiClient, tableId, attachmentFieldId);
    }
}
