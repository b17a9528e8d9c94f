package com.eyelevel.codeconverter.upload;

import com.eyelevel.codeconverter.model.EncodedArtifact;
import com.eyelevel.codeconverter.model.UploadReceipt;

import java.util.concurrent.CompletableFuture;

/**
 * Stores a generated artifact against its record. One instance is bound to one attachment target.
 *
 * <p>Each call is a single attempt with its own credential; retrying is the caller's business.
 * Failures complete the future with an
 * {@link com.eyelevel.codeconverter.exception.apiclient.ApiException} whose status tells transient
 * errors from fatal ones. Uploading the same artifact twice adds it twice.
 */
public interface UploadClient {

    CompletableFuture<UploadReceipt> upload(EncodedArtifact artifact);
}
