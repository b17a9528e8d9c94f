package com.eyelevel.codeconverter.common.apiclient.table;

import com.eyelevel.codeconverter.common.apiclient.model.HeaderConfig;
import com.eyelevel.codeconverter.common.json.jackson.JacksonJsonParser;
import com.eyelevel.codeconverter.dto.table.RecordsResponse;
import com.eyelevel.codeconverter.exception.apiclient.BadRequestException;
import com.eyelevel.codeconverter.exception.apiclient.InternalServerException;
import com.eyelevel.codeconverter.exception.apiclient.NotFoundException;
import com.eyelevel.codeconverter.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.codeconverter.model.EncodedArtifact;
import com.eyelevel.codeconverter.model.UploadReceipt;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TableApiClientTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private TableApiClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        WebClient webClient = WebClient.builder()
                .baseUrl("http://table.test/api")
                .exchangeFunction(recording)
                .build();
        return new TableApiClient(webClient,
                                  headers -> headers.put(HttpHeaders.AUTHORIZATION, "Bearer temp-token"),
                                  new HeaderConfig().with("X-Client-Name", "codeconverter-test"),
                                  new JacksonJsonParser(new ObjectMapper()),
                                  "/table/{tableId}/record",
                                  "/table/{tableId}/record/{recordId}/{fieldId}/uploadAttachment");
    }

    private static ExchangeFunction respond(HttpStatus status, String json) {
        return request -> Mono.just(ClientResponse.create(status)
                                                  .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                                  .body(json)
                                                  .build());
    }

    @Test
    void testGetRecordsSendsPagingQueryAndParsesRecords() {
        TableApiClient client = client(respond(HttpStatus.OK, """
                {"records":[
                  {"id":"rec1","fields":{"fldCode":"A-100","fldOther":1}},
                  {"id":"rec2","fields":{}}
                ],"extra":true}
                """));

        RecordsResponse response = client.getRecords("tbl1", "viw1", 100, 200);

        assertEquals(2, response.records().size());
        assertEquals("rec1", response.records().get(0).id());
        assertEquals("A-100", response.records().get(0).fields().get("fldCode"));

        ClientRequest request = requests.get(0);
        URI uri = request.url();
        assertEquals(HttpMethod.GET, request.method());
        assertEquals("/api/table/tbl1/record", uri.getPath());
        assertTrue(uri.getQuery().contains("viewId=viw1"));
        assertTrue(uri.getQuery().contains("fieldKeyType=id"));
        assertTrue(uri.getQuery().contains("take=100"));
        assertTrue(uri.getQuery().contains("skip=200"));
        assertEquals("Bearer temp-token", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("codeconverter-test", request.headers().getFirst("X-Client-Name"));
    }

    @Test
    void testGetRecordsWithoutViewOmitsViewParameter() {
        TableApiClient client = client(respond(HttpStatus.OK, "{\"records\":[]}"));

        RecordsResponse response = client.getRecords("tbl1", null, 1000, 0);

        assertTrue(response.recordsOrEmpty().isEmpty());
        assertFalse(requests.get(0).url().getQuery().contains("viewId"));
    }

    @Test
    void testErrorStatusesMapToApiExceptions() {
        assertThrows(ServiceUnavailableException.class,
                     () -> client(respond(HttpStatus.SERVICE_UNAVAILABLE, "")).getRecords("tbl1", "viw1", 10, 0));
        assertThrows(BadRequestException.class,
                     () -> client(respond(HttpStatus.BAD_REQUEST, "{\"message\":\"invalid view\"}"))
                             .getRecords("tbl1", "viw1", 10, 0));
        NotFoundException notFound = assertThrows(NotFoundException.class,
                () -> client(respond(HttpStatus.NOT_FOUND, "table not found")).getRecords("tbl9", null, 10, 0));
        assertEquals(404, notFound.getStatusCode());
        assertEquals("table not found", notFound.getMessage());
    }

    @Test
    void testConnectionFailureMapsToServiceUnavailable() {
        TableApiClient client = client(request -> Mono.error(new ConnectException("Connection refused")));

        assertThrows(ServiceUnavailableException.class, () -> client.getRecords("tbl1", "viw1", 10, 0));
    }

    @Test
    void testUploadAttachmentPostsMultipartToRecordField() throws Exception {
        TableApiClient client = client(respond(HttpStatus.OK, "{\"id\":\"rec1\"}"));
        EncodedArtifact artifact = new EncodedArtifact("rec1", new byte[]{1, 2, 3}, "code_rec1_1.png", "image/png");

        UploadReceipt receipt = client.uploadAttachment("tbl1", "fldAttachment", artifact).get(5, TimeUnit.SECONDS);

        assertEquals("rec1", receipt.recordId());
        assertEquals("code_rec1_1.png", receipt.fileName());
        assertEquals(200, receipt.statusCode());
        assertNotNull(receipt.uploadedAt());

        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/api/table/tbl1/record/rec1/fldAttachment/uploadAttachment", request.url().getPath());
        MediaType contentType = request.headers().getContentType();
        assertNotNull(contentType);
        assertTrue(MediaType.MULTIPART_FORM_DATA.isCompatibleWith(contentType));
    }

    @Test
    void testUploadFailureCompletesFutureExceptionally() {
        TableApiClient client = client(respond(HttpStatus.INTERNAL_SERVER_ERROR, "boom"));
        EncodedArtifact artifact = new EncodedArtifact("rec1", new byte[]{1}, "code_rec1_1.png", "image/png");

        CompletableFuture<UploadReceipt> result = client.uploadAttachment("tbl1", "fldAttachment", artifact);

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(InternalServerException.class, e.getCause());
    }

    @Test
    void testUploadRequestsFreshCredentialPerCall() throws Exception {
        List<String> tokens = new CopyOnWriteArrayList<>();
        WebClient webClient = WebClient.builder()
                .baseUrl("http://table.test/api")
                .exchangeFunction(request -> {
                    tokens.add(request.headers().getFirst(HttpHeaders.AUTHORIZATION));
                    return respond(HttpStatus.OK, "{}").exchange(request);
                })
                .build();
        int[] issued = {0};
        TableApiClient client = new TableApiClient(webClient,
                                                   headers -> headers.put(HttpHeaders.AUTHORIZATION,
                                                                          "Bearer token-" + (++issued[0])),
                                                   new HeaderConfig(),
                                                   new JacksonJsonParser(new ObjectMapper()),
                                                   "/table/{tableId}/record",
                                                   "/table/{tableId}/record/{recordId}/{fieldId}/uploadAttachment");
        EncodedArtifact artifact = new EncodedArtifact("rec1", new byte[]{1}, "code_rec1_1.png", "image/png");

        client.uploadAttachment("tbl1", "fld1", artifact).get(5, TimeUnit.SECONDS);
        client.uploadAttachment("tbl1", "fld1", artifact).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("Bearer token-1", "Bearer token-2"), tokens);
    }
}
