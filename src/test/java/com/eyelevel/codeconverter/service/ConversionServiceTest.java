package com.eyelevel.codeconverter.service;

import com.eyelevel.codeconverter.config.ConversionProperties;
import com.eyelevel.codeconverter.encoder.Encoder;
import com.eyelevel.codeconverter.encoder.EncoderFactory;
import com.eyelevel.codeconverter.exception.ConversionInProgressException;
import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.exception.InvalidConversionConfigException;
import com.eyelevel.codeconverter.exception.RecordSourceException;
import com.eyelevel.codeconverter.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.codeconverter.model.*;
import com.eyelevel.codeconverter.pipeline.ConversionListener;
import com.eyelevel.codeconverter.pipeline.ConversionPipeline;
import com.eyelevel.codeconverter.queue.RateLimitedWorkQueue;
import com.eyelevel.codeconverter.source.RecordSource;
import com.eyelevel.codeconverter.upload.UploadClient;
import com.eyelevel.codeconverter.upload.UploadClientFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConversionServiceTest {

    private static final ConversionConfig QR_SVG = ConversionConfig.builder()
            .codeType(CodeType.QR_CODE)
            .outputFormat(OutputFormat.SVG)
            .build();

    private RecordSource recordSource;
    private UploadClientFactory uploadClientFactory;
    private UploadClient uploadClient;
    private RateLimitedWorkQueue queue;
    private ThreadPoolTaskExecutor executor;
    private ConversionService conversionService;

    @BeforeEach
    void setUp() {
        recordSource = mock(RecordSource.class);
        uploadClientFactory = mock(UploadClientFactory.class);
        uploadClient = mock(UploadClient.class);
        when(uploadClientFactory.forTarget("tbl1", "fldAttachment")).thenReturn(uploadClient);

        ConversionProperties.Queue settings = new ConversionProperties.Queue();
        settings.setRequestIntervalMs(0);
        queue = new RateLimitedWorkQueue(settings, millis -> { }, List.of());

        executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("conversion-test-");
        executor.initialize();

        Encoder encoder = new Encoder() {
            @Override
            public boolean supports(CodeType codeType) {
                return codeType == CodeType.QR_CODE;
            }

            @Override
            public EncodedImage encode(String value, ConversionConfig config) {
                if (value.startsWith("!")) {
                    throw new EncodeException("Unsupported character in '" + value + "'");
                }
                return EncodedImage.of(value.getBytes(StandardCharsets.UTF_8), config.outputFormat());
            }
        };
        ConversionPipeline pipeline = new ConversionPipeline(new EncoderFactory(List.of(encoder)), queue);
        conversionService = new ConversionService(recordSource, pipeline, uploadClientFactory, executor);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
        executor.shutdown();
    }

    private static ConversionRequest request() {
        return ConversionRequest.builder()
                .tableId("tbl1")
                .viewId("viw1")
                .sourceFieldId("fldCode")
                .attachmentFieldId("fldAttachment")
                .config(QR_SVG)
                .build();
    }

    @Test
    void testReportSummarisesRun() throws Exception {
        when(recordSource.fetchRecords(new RecordQuery("tbl1", "viw1", "fldCode"))).thenReturn(List.of(
                new SourceItem("rec1", "A-100"),
                new SourceItem("rec2", null),
                new SourceItem("rec3", "!bad"),
                new SourceItem("rec4", 42)));
        when(uploadClient.upload(any())).thenReturn(
                CompletableFuture.completedFuture(new UploadReceipt("rec", "code.svg", 200, Instant.now())));

        ConversionReport report = conversionService.convert(request(), null).get(10, TimeUnit.SECONDS);

        assertEquals(3, report.totalItems());
        assertEquals(new ConversionStats(2, 1, 0), report.stats());
        assertEquals(1, report.failures().size());
        assertEquals("rec3", report.failures().get(0).recordId());
        assertEquals(FailureStage.ENCODE, report.failures().get(0).stage());
        assertFalse(report.finishedAt().isBefore(report.startedAt()));
        assertFalse(conversionService.isRunning());
        verify(uploadClient, times(2)).upload(any());
    }

    @Test
    void testReportCollectsUploadFailuresAndForwardsToListener() throws Exception {
        when(recordSource.fetchRecords(any())).thenReturn(List.of(new SourceItem("rec1", "A-100")));
        when(uploadClient.upload(any())).thenReturn(
                CompletableFuture.failedFuture(new ServiceUnavailableException("maintenance")));
        ConversionListener listener = mock(ConversionListener.class);

        ConversionReport report = conversionService.convert(request(), listener).get(10, TimeUnit.SECONDS);

        assertEquals(new ConversionStats(0, 1, 0), report.stats());
        assertEquals("maintenance", report.failures().get(0).reason());
        verify(uploadClient, times(4)).upload(any());
        verify(listener).onItemFailed(report.failures().get(0));
        verify(listener).onProgress(100.0);
    }

    @Test
    void testSourceFailureRejectsRun() {
        when(recordSource.fetchRecords(any())).thenThrow(
                new RecordSourceException("Failed to read records of table tbl1", new ServiceUnavailableException("down")));

        CompletableFuture<ConversionReport> result = conversionService.convert(request(), null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(10, TimeUnit.SECONDS));
        Throwable cause = e.getCause();
        while (!(cause instanceof RecordSourceException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        assertInstanceOf(RecordSourceException.class, cause);
        assertFalse(conversionService.isRunning());
        verifyNoInteractions(uploadClient);
    }

    @Test
    void testSecondRunIsRejectedWhileFirstIsRunning() throws Exception {
        CompletableFuture<UploadReceipt> pendingUpload = new CompletableFuture<>();
        when(recordSource.fetchRecords(any())).thenReturn(List.of(new SourceItem("rec1", "A-100")));
        when(uploadClient.upload(any())).thenReturn(pendingUpload);

        CompletableFuture<ConversionReport> first = conversionService.convert(request(), null);
        CompletableFuture<ConversionReport> second = conversionService.convert(request(), null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> second.get(1, TimeUnit.SECONDS));
        assertInstanceOf(ConversionInProgressException.class, e.getCause());

        pendingUpload.complete(new UploadReceipt("rec1", "code.svg", 200, Instant.now()));
        assertEquals(1, first.get(10, TimeUnit.SECONDS).stats().success());
        assertFalse(conversionService.isRunning());
    }

    @Test
    void testIncompleteRequestIsRejected() {
        ConversionRequest missingField = ConversionRequest.builder()
                .tableId("tbl1")
                .attachmentFieldId("fldAttachment")
                .config(QR_SVG)
                .build();

        CompletableFuture<ConversionReport> result = conversionService.convert(missingField, null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(1, TimeUnit.SECONDS));
        assertInstanceOf(InvalidConversionConfigException.class, e.getCause());
        assertFalse(conversionService.isRunning());
        verifyNoInteractions(recordSource);
    }

    @Test
    void testAbortWithoutRunIsNoop() {
        assertEquals(0, conversionService.abort());
    }
}
