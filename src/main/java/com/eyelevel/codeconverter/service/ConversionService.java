package com.eyelevel.codeconverter.service;

import com.eyelevel.codeconverter.exception.ConversionException;
import com.eyelevel.codeconverter.exception.ConversionInProgressException;
import com.eyelevel.codeconverter.exception.InvalidConversionConfigException;
import com.eyelevel.codeconverter.model.ConversionReport;
import com.eyelevel.codeconverter.model.ConversionStats;
import com.eyelevel.codeconverter.model.ItemFailure;
import com.eyelevel.codeconverter.model.RecordQuery;
import com.eyelevel.codeconverter.model.SourceItem;
import com.eyelevel.codeconverter.pipeline.ConversionListener;
import com.eyelevel.codeconverter.pipeline.ConversionPipeline;
import com.eyelevel.codeconverter.source.RecordSource;
import com.eyelevel.codeconverter.upload.UploadClient;
import com.eyelevel.codeconverter.upload.UploadClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for hosts: reads the records of a view, converts them and reports the outcome.
 *
 * <p>Only one conversion runs at a time. The upload queue is shared by the whole application, and
 * aborting cancels everything queued on it, so a second concurrent run is rejected with
 * {@link ConversionInProgressException}.
 */
@Slf4j
@Service
public class ConversionService {

    private final RecordSource recordSource;
    private final ConversionPipeline conversionPipeline;
    private final UploadClientFactory uploadClientFactory;
    private final AsyncTaskExecutor taskExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ConversionService(final RecordSource recordSource, final ConversionPipeline conversionPipeline,
                             final UploadClientFactory uploadClientFactory,
                             @Qualifier("applicationTaskExecutor") final AsyncTaskExecutor taskExecutor) {
        this.recordSource = recordSource;
        this.conversionPipeline = conversionPipeline;
        this.uploadClientFactory = uploadClientFactory;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Starts a conversion.
     *
     * @param request  What to convert and where to store the images.
     * @param listener Receives progress, statistics and failures; may be null.
     * @return A future completing with the report once every record has settled, or exceptionally with
     *         a {@link ConversionException} if the run could not start.
     */
    public CompletableFuture<ConversionReport> convert(final ConversionRequest request,
                                                       final ConversionListener listener) {
        try {
            if (request == null) {
                throw new InvalidConversionConfigException(
                        "A conversion request must be provided.");
            }
            request.validate();
        } catch (final ConversionException e) {
            log.warn("Rejecting conversion request: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        if (!running.compareAndSet(false, true)) {
            log.warn("Conversion requested for table {} while another one is running.", request.tableId());
            return CompletableFuture.failedFuture(new ConversionInProgressException());
        }

        final Instant startedAt = Instant.now();
        final List<ItemFailure> failures = Collections.synchronizedList(new ArrayList<>());
        final ConversionListener collecting = collectingFailures(listener, failures);
        final UploadClient uploader = uploadClientFactory.forTarget(request.tableId(), request.attachmentFieldId());
        final RecordQuery query = new RecordQuery(request.tableId(), request.viewId(), request.sourceFieldId());
        log.info("Conversion requested for table {} view {}: field {} into attachment field {}", request.tableId(),
                 request.viewId(), request.sourceFieldId(), request.attachmentFieldId());

        final CompletableFuture<ConversionReport> report;
        try {
            report = CompletableFuture.supplyAsync(() -> recordSource.fetchRecords(query), taskExecutor)
                    .thenCompose(records -> conversionPipeline.run(records, request.config(), uploader, collecting)
                            .thenApply(stats -> toReport(records, stats, failures, startedAt)));
        } catch (final RuntimeException e) {
            running.set(false);
            log.error("Could not schedule conversion for table {}", request.tableId(), e);
            return CompletableFuture.failedFuture(e);
        }

        return report.whenComplete((result, error) -> {
            running.set(false);
            if (error != null) {
                log.error("Conversion for table {} did not run: {}", request.tableId(), error.getMessage());
            }
        });
    }

    /**
     * Cancels the uploads of the current run that have not started yet.
     *
     * @return The number of cancelled uploads.
     */
    public int abort() {
        if (!running.get()) {
            log.info("Abort requested with no conversion running.");
            return 0;
        }
        return conversionPipeline.abort();
    }

    public boolean isRunning() {
        return running.get();
    }

    private static ConversionReport toReport(final List<SourceItem> records, final ConversionStats stats,
                                             final List<ItemFailure> failures, final Instant startedAt) {
        final int totalItems = (int) records.stream().filter(item -> item != null && item.hasContent()).count();
        final List<ItemFailure> snapshot;
        synchronized (failures) {
            snapshot = List.copyOf(failures);
        }
        final ConversionReport report = new ConversionReport(totalItems, stats, snapshot, startedAt, Instant.now());
        log.info("Conversion report: {} of {} record(s) stored, {} failed, took {} ms", stats.success(), totalItems,
                 stats.failed(), report.duration().toMillis());
        return report;
    }

    private static ConversionListener collectingFailures(final ConversionListener delegate,
                                                         final List<ItemFailure> failures) {
        final ConversionListener target = delegate == null ? ConversionListener.NONE : delegate;
        return new ConversionListener() {
            @Override
            public void onProgress(final double percent) {
                target.onProgress(percent);
            }

            @Override
            public void onStatsChange(final ConversionStats stats) {
                target.onStatsChange(stats);
            }

            @Override
            public void onItemFailed(final ItemFailure failure) {
                failures.add(failure);
                target.onItemFailed(failure);
            }
        };
    }
}
