package com.eyelevel.codeconverter.common.apiclient.table;

import com.eyelevel.codeconverter.common.apiclient.ApiClient;
import com.eyelevel.codeconverter.common.apiclient.authentication.Authentication;
import com.eyelevel.codeconverter.common.apiclient.model.ApiRequest;
import com.eyelevel.codeconverter.common.apiclient.model.ApiResponse;
import com.eyelevel.codeconverter.common.apiclient.model.HeaderConfig;
import com.eyelevel.codeconverter.common.json.JsonParser;
import com.eyelevel.codeconverter.dto.table.RecordsResponse;
import com.eyelevel.codeconverter.exception.apiclient.ApiException;
import com.eyelevel.codeconverter.model.EncodedArtifact;
import com.eyelevel.codeconverter.model.UploadReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the table API: reads the records of a view and stores attachments against records.
 * Every request carries a freshly issued bearer token.
 */
@Slf4j
@Service("tableApiClient")
public class TableApiClient extends ApiClient {

    private final JsonParser jsonParser;
    private final String recordsEndpoint;
    private final String uploadAttachmentEndpoint;

    /**
     * @param webClient                The WebClient bound to the table API base URL.
     * @param authentication           Applies a fresh bearer token per request.
     * @param headerConfig             Headers sent with every request.
     * @param jsonParser               Parses response payloads.
     * @param recordsEndpoint          Path of the record listing, with a {@code {tableId}} placeholder.
     * @param uploadAttachmentEndpoint Path of the attachment upload, with {@code {tableId}},
     *                                 {@code {recordId}} and {@code {fieldId}} placeholders.
     */
    public TableApiClient(
            @Qualifier("tableWebClient") final WebClient webClient,
            @Qualifier("tableAuthentication") final Authentication authentication,
            @Qualifier("tableHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.table-client.endpoint.records}") final String recordsEndpoint,
            @Value("${app.table-client.endpoint.upload-attachment}") final String uploadAttachmentEndpoint
    ) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
        this.recordsEndpoint = recordsEndpoint;
        this.uploadAttachmentEndpoint = uploadAttachmentEndpoint;
    }

    /**
     * Reads one page of a view's records, with fields keyed by id.
     *
     * @param tableId The table.
     * @param viewId  The view whose filter and order apply; may be null for the table's default order.
     * @param take    Page size.
     * @param skip    Records to skip.
     * @return The page, possibly empty.
     * @throws ApiException if the API call fails.
     */
    public RecordsResponse getRecords(final String tableId, final String viewId, final int take, final int skip) {
        try {
            final ApiResponse apiResponse = call(prepareRecordsRequest(tableId, viewId, take, skip));
            return jsonParser.parseObject(apiResponse.getData(), RecordsResponse.class);
        } catch (final ApiException e) {
            log.warn("API error while reading records of table {} (view {}, skip {}).", tableId, viewId, skip, e);
            throw e;
        }
    }

    /**
     * Uploads an artifact as a new attachment of a record's attachment field.
     *
     * @param tableId The table of the record.
     * @param fieldId The attachment field.
     * @param artifact The image and the record it belongs to.
     * @return A future completing with the receipt, or exceptionally with an {@link ApiException}.
     */
    public CompletableFuture<UploadReceipt> uploadAttachment(final String tableId, final String fieldId,
                                                             final EncodedArtifact artifact) {
        final ApiRequest apiRequest = prepareUploadRequest(tableId, fieldId, artifact);
        return callAsync(apiRequest).thenApply(apiResponse -> {
            log.info("Stored attachment '{}' on record {} (status {}).", artifact.fileName(), artifact.recordId(),
                     apiResponse.getStatusCode());
            return new UploadReceipt(artifact.recordId(), artifact.fileName(), apiResponse.getStatusCode(),
                                     apiResponse.getTimestamp());
        });
    }

    private ApiRequest prepareRecordsRequest(final String tableId, final String viewId, final int take,
                                             final int skip) {
        final Map<String, Object> queryParams = new LinkedHashMap<>();
        if (viewId != null) {
            queryParams.put("viewId", viewId);
        }
        queryParams.put("fieldKeyType", "id");
        queryParams.put("take", take);
        queryParams.put("skip", skip);

        return ApiRequest.builder()
                .method(HttpMethod.GET)
                .path(recordsEndpoint)
                .pathVariables(Map.of("tableId", tableId))
                .queryParams(queryParams)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
    }

    private ApiRequest prepareUploadRequest(final String tableId, final String fieldId,
                                            final EncodedArtifact artifact) {
        final MultipartBodyBuilder multipart = new MultipartBodyBuilder();
        multipart.part("file", new ByteArrayResource(artifact.bytes()))
                 .filename(artifact.fileName())
                 .contentType(MediaType.parseMediaType(artifact.mimeType()));

        return ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(uploadAttachmentEndpoint)
                .pathVariables(Map.of("tableId", tableId, "recordId", artifact.recordId(), "fieldId", fieldId))
                .body(multipart.build())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
    }
}
