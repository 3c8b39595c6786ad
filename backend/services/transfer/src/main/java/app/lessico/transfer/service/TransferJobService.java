package app.lessico.transfer.service;

import app.lessico.transfer.codec.MalformedBundleException;
import app.lessico.transfer.codec.ScopeMismatchException;
import app.lessico.transfer.config.TransferProps;
import app.lessico.transfer.controller.dto.TransferJobResponse;
import app.lessico.transfer.domain.TransferJobEntity;
import app.lessico.transfer.domain.TransferJobStatus;
import app.lessico.transfer.domain.TransferJobType;
import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.reconcile.BatchResult;
import app.lessico.transfer.reconcile.ScopeMismatchPolicy;
import app.lessico.transfer.repository.TransferJobRepository;
import app.lessico.transfer.security.CurrentUserProvider;
import app.lessico.transfer.store.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * HTTP-facing side of the transfer service: resolves the caller, validates uploads, records every
 * import and export in the job log and turns fatal engine failures into response statuses.
 */
@Service
public class TransferJobService {

    private static final Logger log = LoggerFactory.getLogger(TransferJobService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final TransferService transferService;
    private final TransferJobRepository jobRepository;
    private final CurrentUserProvider currentUserProvider;
    private final TransferProps props;
    private final ObjectMapper objectMapper;

    public TransferJobService(TransferService transferService,
                              TransferJobRepository jobRepository,
                              CurrentUserProvider currentUserProvider,
                              TransferProps props,
                              ObjectMapper objectMapper) {
        this.transferService = transferService;
        this.jobRepository = jobRepository;
        this.currentUserProvider = currentUserProvider;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    public TransferJobResponse importUpload(Jwt jwt, TransferScope scope, MultipartFile file, ScopeMismatchPolicy policy) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing file");
        }
        String tenantId = requireTenantId(jwt);
        if (!isJson(file.getOriginalFilename(), file.getContentType())) {
            throw new ResponseStatusException(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Only JSON bundles can be imported");
        }
        requireWithinLimit(file.getSize());

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Failed to read upload", ex);
        }
        return runImport(tenantId, scope, content, file.getOriginalFilename(), policy);
    }

    public TransferJobResponse importBody(Jwt jwt, TransferScope scope, byte[] content, ScopeMismatchPolicy policy) {
        String tenantId = requireTenantId(jwt);
        if (content == null || content.length == 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing bundle");
        }
        requireWithinLimit(content.length);
        return runImport(tenantId, scope, content, null, policy);
    }

    public ExportedBundle export(Jwt jwt, TransferScope scope) {
        String tenantId = requireTenantId(jwt);
        TransferJobEntity job = startJob(tenantId, TransferJobType.export_job, scope, null, null);

        ExportedBundle bundle;
        try {
            bundle = transferService.exportBundle(scope, tenantId);
        } catch (StoreUnavailableException ex) {
            log.error("Export failed: jobId={}, scope={}, tenantId={}", job.getJobId(), scope, tenantId, ex);
            failJob(job, ex);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", ex);
        } catch (RuntimeException ex) {
            log.error("Export failed unexpectedly: jobId={}, scope={}, tenantId={}", job.getJobId(), scope, tenantId, ex);
            failJob(job, ex);
            throw ex;
        }

        job.setSourceName(bundle.fileName());
        job.setSourceSizeBytes((long) bundle.content().length);
        job.setTotalItems(bundle.recordCount());
        job.setCommittedItems(bundle.recordCount());
        finishJob(job, TransferJobStatus.completed);
        return bundle;
    }

    @Transactional(readOnly = true)
    public TransferJobResponse getJob(Jwt jwt, UUID jobId) {
        String tenantId = requireTenantId(jwt);

        TransferJobEntity job = jobRepository.findByJobIdAndUserId(jobId, tenantId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Transfer job not found"));

        return toResponse(job);
    }

    private TransferJobResponse runImport(String tenantId,
                                          TransferScope scope,
                                          byte[] content,
                                          String sourceName,
                                          ScopeMismatchPolicy policy) {
        ScopeMismatchPolicy effectivePolicy = policy != null ? policy : props.scopeMismatchPolicy();
        TransferJobEntity job = startJob(tenantId, TransferJobType.import_job, scope, sourceName, (long) content.length);

        BatchResult result;
        try {
            result = transferService.importBundle(scope, content, tenantId, effectivePolicy);
        } catch (MalformedBundleException ex) {
            failJob(job, ex);
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (ScopeMismatchException ex) {
            log.warn("Import rejected, scope mismatch: jobId={}, requested={}, declared={}, tenantId={}",
                    job.getJobId(), ex.getRequested(), ex.getDeclaredExportType(), tenantId);
            failJob(job, ex);
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        } catch (StoreUnavailableException ex) {
            log.error("Import failed: jobId={}, scope={}, tenantId={}", job.getJobId(), scope, tenantId, ex);
            failJob(job, ex);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", ex);
        } catch (RuntimeException ex) {
            log.error("Import failed unexpectedly: jobId={}, scope={}, tenantId={}", job.getJobId(), scope, tenantId, ex);
            failJob(job, ex);
            throw ex;
        }

        job.setTotalItems(result.committed() + result.skipped() + result.failed());
        job.setCommittedItems(result.committed());
        job.setSkippedItems(result.skipped());
        job.setFailedItems(result.failed());
        job.setRemappedItems(result.remapped());
        job.setUnresolvedReferences(result.unresolvedReferences());
        job.setResult(objectMapper.valueToTree(result));
        if (!result.succeeded()) {
            job.setErrorMessage(truncate(result.errors().size() + " records failed"));
        }
        return toResponse(finishJob(job, statusOf(result)));
    }

    private TransferJobEntity startJob(String tenantId,
                                       TransferJobType type,
                                       TransferScope scope,
                                       String sourceName,
                                       Long sizeBytes) {
        TransferJobEntity job = new TransferJobEntity();
        job.setJobId(UUID.randomUUID());
        job.setJobType(type);
        job.setUserId(tenantId);
        job.setScope(scope);
        job.setStatus(TransferJobStatus.processing);
        job.setSourceName(normalizeOptional(sourceName));
        job.setSourceSizeBytes(sizeBytes);
        job.setCommittedItems(0);
        job.setSkippedItems(0);
        job.setFailedItems(0);
        job.setRemappedItems(0);
        job.setUnresolvedReferences(0);
        Instant now = Instant.now();
        job.setStartedAt(now);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return jobRepository.save(job);
    }

    private TransferJobEntity finishJob(TransferJobEntity job, TransferJobStatus status) {
        Instant now = Instant.now();
        job.setStatus(status);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
        TransferJobEntity saved = jobRepository.save(job);
        log.info("Transfer job finished: jobId={}, type={}, scope={}, status={}, committed={}",
                saved.getJobId(), saved.getJobType(), saved.getScope(), status, saved.getCommittedItems());
        return saved;
    }

    private void failJob(TransferJobEntity job, Exception ex) {
        job.setErrorMessage(truncate(ex.getMessage()));
        try {
            finishJob(job, TransferJobStatus.failed);
        } catch (RuntimeException saveError) {
            log.warn("Failed to record job failure: jobId={}", job.getJobId(), saveError);
        }
    }

    static TransferJobStatus statusOf(BatchResult result) {
        if (result.succeeded()) {
            return TransferJobStatus.completed;
        }
        return result.committed() > 0 ? TransferJobStatus.partial : TransferJobStatus.failed;
    }

    private String requireTenantId(Jwt jwt) {
        try {
            return currentUserProvider.requireTenantId(jwt);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, ex.getMessage());
        }
    }

    private void requireWithinLimit(long sizeBytes) {
        if (sizeBytes > props.maxBundleBytes()) {
            throw new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "Bundle exceeds " + props.maxBundleBytes() + " bytes");
        }
    }

    private boolean isJson(String fileName, String contentType) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".json")) {
            return true;
        }
        if (contentType == null) {
            return false;
        }
        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith("application/json") || normalized.contains("+json");
    }

    private String normalizeOptional(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    private TransferJobResponse toResponse(TransferJobEntity job) {
        return new TransferJobResponse(
                job.getJobId(),
                job.getJobType(),
                job.getScope(),
                job.getStatus(),
                job.getSourceName(),
                job.getSourceSizeBytes(),
                job.getTotalItems(),
                job.getCommittedItems(),
                job.getSkippedItems(),
                job.getFailedItems(),
                job.getRemappedItems(),
                job.getUnresolvedReferences(),
                job.getResult(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getErrorMessage()
        );
    }
}
