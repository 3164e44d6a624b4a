package com.document.verification.rest;

import com.document.verification.api.AsyncVerifier;
import com.document.verification.api.VerificationEngine;
import com.document.verification.core.InvalidInputException;
import com.document.verification.core.model.VerificationReport;
import com.document.verification.rest.dto.BatchVerifyRequest;
import com.document.verification.rest.dto.BatchVerifyResponse;
import com.document.verification.rest.dto.ErrorResponse;
import com.document.verification.rest.dto.VerificationResponse;
import com.document.verification.rest.dto.VerifyRequest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * REST resource for document verification.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Verifying a single document</li>
 *   <li>Verifying documents in batch, with per-document errors</li>
 * </ul>
 */
@Path("/api/v1/verify")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Verification", description = "Compare OCR output against user-edited field values")
public class VerificationResource {
    private static final Logger log = LoggerFactory.getLogger(VerificationResource.class);

    private static final String VERIFY_PATH = "/api/v1/verify";
    private static final String BATCH_PATH = "/api/v1/verify/batch";
    private static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred. Check server logs for details.";

    private final VerificationEngine engine;
    private final AsyncVerifier asyncVerifier;

    @Inject
    public VerificationResource(VerificationEngine engine, AsyncVerifier asyncVerifier) {
        this.engine = engine;
        this.asyncVerifier = asyncVerifier;
    }

    /**
     * Verifies a single document.
     *
     * POST /api/v1/verify
     */
    @POST
    @Operation(summary = "Verify a document",
            description = "Scores every field of the OCR output against the user's values and returns the report.")
    @APIResponse(responseCode = "200", description = "Document verified")
    @APIResponse(responseCode = "400", description = "ocrData or userData missing from the request")
    public Response verify(VerifyRequest request) {
        try {
            if (request == null) {
                throw new IllegalArgumentException("Request body is required");
            }
            request.validate();

            VerificationReport report = engine.verify(request.ocrData(), request.userData());
            return Response.ok(VerificationResponse.from(report)).build();

        } catch (IllegalArgumentException | InvalidInputException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), VERIFY_PATH))
                    .build();
        } catch (Exception e) {
            log.error("verify.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR_MESSAGE, VERIFY_PATH))
                    .build();
        }
    }

    /**
     * Verifies documents in batch.
     *
     * POST /api/v1/verify/batch
     */
    @POST
    @Path("/batch")
    @Operation(summary = "Verify documents in batch",
            description = "Verifies each document concurrently. Invalid documents are reported in errors.")
    @APIResponse(responseCode = "200", description = "Batch verified (may contain per-document errors)")
    @APIResponse(responseCode = "400", description = "Empty batch or more documents than verification.async.max-batch-size")
    public Response batchVerify(BatchVerifyRequest request) {
        try {
            if (request == null) {
                throw new IllegalArgumentException("Request body is required");
            }

            List<VerifyRequest> documents = request.documents();
            int maxBatchSize = engine.getOptions().getMaxBatchSize();
            if (documents.size() > maxBatchSize) {
                throw new IllegalArgumentException(
                        "batch size " + documents.size() + " exceeds maximum of " + maxBatchSize);
            }

            List<CompletableFuture<VerificationReport>> futures = new ArrayList<>();
            List<ErrorResponse> errors = new ArrayList<>();

            for (int i = 0; i < documents.size(); i++) {
                VerifyRequest document = documents.get(i);
                try {
                    if (document == null) {
                        throw new IllegalArgumentException("document is required");
                    }
                    document.validate();
                    futures.add(asyncVerifier.verifyAsync(document.toVerificationRequest()));
                } catch (IllegalArgumentException e) {
                    futures.add(null);
                    errors.add(ErrorResponse.badRequest(e.getMessage(), BATCH_PATH, i));
                }
            }

            List<BatchVerifyResponse.BatchReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                CompletableFuture<VerificationReport> future = futures.get(i);
                if (future == null) {
                    continue;
                }
                try {
                    reports.add(new BatchVerifyResponse.BatchReport(i, VerificationResponse.from(future.join())));
                } catch (CompletionException e) {
                    errors.add(toBatchError(e.getCause(), i));
                }
            }

            return Response.ok(new BatchVerifyResponse(reports, errors)).build();

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), BATCH_PATH))
                    .build();
        } catch (Exception e) {
            log.error("batchVerify.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR_MESSAGE, BATCH_PATH))
                    .build();
        }
    }

    private ErrorResponse toBatchError(Throwable cause, int index) {
        if (cause instanceof InvalidInputException || cause instanceof IllegalArgumentException) {
            return ErrorResponse.badRequest(cause.getMessage(), BATCH_PATH, index);
        }
        if (cause instanceof TimeoutException) {
            log.warn("batchVerify.timeout index={}", index);
            return ErrorResponse.internalError("Verification timed out", BATCH_PATH, index);
        }
        log.error("batchVerify.itemFailed index={} error={}", index,
                cause != null ? cause.getMessage() : null, cause);
        return ErrorResponse.internalError(INTERNAL_ERROR_MESSAGE, BATCH_PATH, index);
    }
}
