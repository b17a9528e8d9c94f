package com.eyelevel.codeconverter.upload;

import com.eyelevel.codeconverter.common.apiclient.table.TableApiClient;
import com.eyelevel.codeconverter.model.EncodedArtifact;
import com.eyelevel.codeconverter.model.UploadReceipt;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Uploads artifacts into one attachment field of one table.
 */
@Slf4j
@Getter
public class AttachmentUploadClient implements UploadClient {

    private final TableApiClient tableApiClient;
    private final String tableId;
    private final String attachmentFieldId;

    public AttachmentUploadClient(final TableApiClient tableApiClient, final String tableId,
                                  final String attachmentFieldId) {
        this.tableApiClient = Objects.requireNonNull(tableApiClient, "tableApiClient must not be null");
        this.tableId = Objects.requireNonNull(tableId, "tableId must not be null");
        this.attachmentFieldId = Objects.requireNonNull(attachmentFieldId, "attachmentFieldId must not be null");
    }

    @Override
    public CompletableFuture<UploadReceipt> upload(final EncodedArtifact artifact) {
        if (artifact == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("artifact must not be null"));
        }
        if (log.isDebugEnabled()) {
            log.debug("Uploading '{}' ({} bytes, sha256 {}) to record {} field {}", artifact.fileName(),
                      artifact.size(), DigestUtils.sha256Hex(artifact.bytes()), artifact.recordId(),
                      attachmentFieldId);
        }
        return tableApiClient.uploadAttachment(tableId, attachmentFieldId, artifact);
    }
}
