package com.eyelevel.codeconverter.pipeline;

import com.eyelevel.codeconverter.encoder.Encoder;
import com.eyelevel.codeconverter.encoder.EncoderFactory;
import com.eyelevel.codeconverter.exception.ConversionException;
import com.eyelevel.codeconverter.exception.EncodeException;
import com.eyelevel.codeconverter.exception.InvalidConversionConfigException;
import com.eyelevel.codeconverter.model.ConversionConfig;
import com.eyelevel.codeconverter.model.ConversionStats;
import com.eyelevel.codeconverter.model.EncodedArtifact;
import com.eyelevel.codeconverter.model.EncodedImage;
import com.eyelevel.codeconverter.model.FailureStage;
import com.eyelevel.codeconverter.model.SourceItem;
import com.eyelevel.codeconverter.queue.QueueTask;
import com.eyelevel.codeconverter.queue.RateLimitedWorkQueue;
import com.eyelevel.codeconverter.upload.UploadClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Converts a batch of records into images and uploads each one through the shared work queue.
 *
 * <p>Records without a value are skipped. The rest are encoded one after another in input order and
 * their uploads handed to the {@link RateLimitedWorkQueue}, which retries transient failures. A record
 * that fails to encode or upload counts as failed and does not stop the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionPipeline {

    private static final String ABORTED_REASON = "Conversion aborted before the upload was submitted.";

    private final EncoderFactory encoderFactory;
    private final RateLimitedWorkQueue uploadWorkQueue;

    /**
     * Abort flags of the runs whose encode loop may still be submitting uploads.
     */
    private final Set<AtomicBoolean> activeRuns = ConcurrentHashMap.newKeySet();

    /**
     * Runs a conversion.
     *
     * @param records  The records to convert, in order.
     * @param config   How each value is encoded.
     * @param uploader Where each image is stored.
     * @param listener Receives progress, statistics and failures; may be null.
     * @return A future completing with the final statistics once every accepted record has settled. It
     *         fails only when the run cannot start: missing records, configuration or uploader, or an
     *         incomplete configuration.
     */
    public CompletableFuture<ConversionStats> run(final List<SourceItem> records, final ConversionConfig config,
                                                  final UploadClient uploader, final ConversionListener listener) {
        try {
            checkSetup(records, config, uploader);
        } catch (final ConversionException e) {
            log.warn("Rejecting conversion run: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        final List<SourceItem> accepted = records.stream()
                                                 .filter(Objects::nonNull)
                                                 .filter(SourceItem::hasContent)
                                                 .toList();
        final ConversionTracker tracker = new ConversionTracker(accepted.size(),
                                                                listener == null ? ConversionListener.NONE : listener);
        log.info("Starting conversion of {} record(s), {} skipped without a value. Code type {}, format {}",
                 accepted.size(), records.size() - accepted.size(), config.codeType(), config.outputFormat());

        if (accepted.isEmpty()) {
            tracker.completeEmpty();
            return tracker.completion();
        }

        final AtomicBoolean aborted = new AtomicBoolean(false);
        activeRuns.add(aborted);
        tracker.completion().whenComplete((stats, error) -> activeRuns.remove(aborted));

        final Optional<Encoder> encoder = encoderFactory.getEncoder(config.codeType());
        for (final SourceItem item : accepted) {
            tracker.accepted();
            final String value = item.textValue().trim();
            if (aborted.get()) {
                tracker.failed(item.recordId(), value, ABORTED_REASON, FailureStage.UPLOAD);
                continue;
            }

            final EncodedArtifact artifact;
            try {
                artifact = encode(encoder, item.recordId(), value, config);
            } catch (final RuntimeException e) {
                log.warn("Encoding record {} failed: {}", item.recordId(), e.getMessage());
                tracker.failed(item.recordId(), value, describe(e), FailureStage.ENCODE);
                continue;
            }
            if (aborted.get()) {
                tracker.failed(item.recordId(), value, ABORTED_REASON, FailureStage.UPLOAD);
                continue;
            }

            final String taskId = item.recordId() + "-" + UUID.randomUUID();
            uploadWorkQueue.submit(QueueTask.of(taskId, () -> uploader.upload(artifact)))
                           .whenComplete((receipt, error) -> {
                               if (error == null) {
                                   tracker.succeeded();
                               } else {
                                   tracker.failed(item.recordId(), value, describe(error), FailureStage.UPLOAD);
                               }
                           });
        }

        // An abort racing the last submissions may have missed them.
        if (aborted.get()) {
            uploadWorkQueue.cancelAll();
        }
        return tracker.completion();
    }

    /**
     * Cancels every upload that has not started yet and stops runs that are still encoding from
     * submitting more. The affected records settle as failed; uploads in progress finish normally.
     *
     * @return The number of cancelled uploads.
     */
    public int abort() {
        activeRuns.forEach(flag -> flag.set(true));
        final int cancelled = uploadWorkQueue.cancelAll();
        log.info("Conversion aborted, {} pending upload(s) cancelled.", cancelled);
        return cancelled;
    }

    private static void checkSetup(final List<SourceItem> records, final ConversionConfig config,
                                   final UploadClient uploader) {
        if (records == null) {
            throw new InvalidConversionConfigException("Records to convert must be provided.");
        }
        if (config == null) {
            throw new InvalidConversionConfigException("A conversion configuration must be provided.");
        }
        if (uploader == null) {
            throw new InvalidConversionConfigException("An upload target must be provided.");
        }
        config.validate();
    }

    private static EncodedArtifact encode(final Optional<Encoder> encoder, final String recordId, final String value,
                                          final ConversionConfig config) {
        final Encoder selected = encoder.orElseThrow(
                () -> new EncodeException("No encoder registered for code type " + config.codeType()));
        final EncodedImage image = selected.encode(value, config);
        if (image == null || image.bytes() == null || image.bytes().length == 0) {
            throw new EncodeException("Encoder produced no image for value '" + value + "'");
        }
        final String fileName = "code_" + recordId + "_" + System.currentTimeMillis() + "." + image.extension();
        return new EncodedArtifact(recordId, image.bytes(), fileName, image.mimeType());
    }

    private static String describe(final Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
