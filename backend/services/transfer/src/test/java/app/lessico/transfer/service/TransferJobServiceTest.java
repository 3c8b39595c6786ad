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
import app.lessico.transfer.reconcile.ErrorReason;
import app.lessico.transfer.reconcile.ScopeMismatchPolicy;
import app.lessico.transfer.repository.TransferJobRepository;
import app.lessico.transfer.security.CurrentUserProvider;
import app.lessico.transfer.store.StoreUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransferJobServiceTest {

    private static final byte[] BUNDLE = "{\"words\":[]}".getBytes(StandardCharsets.UTF_8);

    @Mock
    TransferService transferService;

    @Mock
    TransferJobRepository jobRepository;

    private TransferJobService jobService;

    @BeforeEach
    void setUp() {
        jobService = new TransferJobService(
                transferService,
                jobRepository,
                new CurrentUserProvider(),
                new TransferProps(ScopeMismatchPolicy.reject, 1024L, null),
                new ObjectMapper()
        );
        lenient().when(jobRepository.save(any(TransferJobEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void importRecordsCompletedJobWithCounts() {
        BatchResult result = new BatchResult(TransferScope.words, 2, 1, 0, 1, 0, 0, List.of(), List.of(), List.of());
        when(transferService.importBundle(TransferScope.words, BUNDLE, "tenant-b", ScopeMismatchPolicy.reject)).thenReturn(result);

        TransferJobResponse response = jobService.importBody(jwt("tenant-b"), TransferScope.words, BUNDLE, null);

        assertEquals(TransferJobType.import_job, response.jobType());
        assertEquals(TransferJobStatus.completed, response.status());
        assertEquals(3, response.totalItems());
        assertEquals(2, response.committedItems());
        assertEquals(1, response.remappedItems());
        assertEquals(2, response.result().path("committed").asInt());
        assertNotNull(response.completedAt());
        assertNull(response.errorMessage());
    }

    @Test
    void explicitPolicyOverridesConfiguredDefault() {
        BatchResult result = new BatchResult(TransferScope.words, 1, 0, 0, 0, 0, 0, List.of(), List.of(), List.of("mismatch"));
        when(transferService.importBundle(TransferScope.words, BUNDLE, "tenant-b", ScopeMismatchPolicy.warn)).thenReturn(result);

        TransferJobResponse response = jobService.importBody(jwt("tenant-b"), TransferScope.words, BUNDLE, ScopeMismatchPolicy.warn);

        assertEquals(TransferJobStatus.completed, response.status());
    }

    @Test
    void batchWithFailuresIsPartialOrFailed() {
        BatchResult.RecordError error = new BatchResult.RecordError("w2", ErrorReason.store_unavailable, "offline");
        BatchResult partial = new BatchResult(TransferScope.words, 1, 0, 1, 0, 0, 0, List.of(error), List.of(), List.of());
        BatchResult failed = new BatchResult(TransferScope.words, 0, 0, 1, 0, 0, 0, List.of(error), List.of(), List.of());

        assertEquals(TransferJobStatus.partial, TransferJobService.statusOf(partial));
        assertEquals(TransferJobStatus.failed, TransferJobService.statusOf(failed));
    }

    @Test
    void malformedBundleIsBadRequestAndJobFails() {
        when(transferService.importBundle(any(), any(), any(), any())).thenThrow(new MalformedBundleException("Bundle is not valid JSON"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> jobService.importBody(jwt("tenant-b"), TransferScope.words, BUNDLE, null));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        ArgumentCaptor<TransferJobEntity> saved = ArgumentCaptor.forClass(TransferJobEntity.class);
        verify(jobRepository, atLeastOnce()).save(saved.capture());
        TransferJobEntity last = saved.getAllValues().get(saved.getAllValues().size() - 1);
        assertEquals(TransferJobStatus.failed, last.getStatus());
        assertEquals("Bundle is not valid JSON", last.getErrorMessage());
    }

    @Test
    void storeOutageIsServiceUnavailableAndJobFails() {
        when(transferService.importBundle(any(), any(), any(), any())).thenThrow(new StoreUnavailableException(
                "Document store unavailable during query words",
                new CannotCreateTransactionException("Could not open JPA EntityManager for transaction")));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> jobService.importBody(jwt("tenant-b"), TransferScope.words, BUNDLE, null));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ex.getStatusCode());
        assertEquals(TransferJobStatus.failed, lastSavedJob().getStatus());
    }

    @Test
    void unexpectedFailureStillClosesTheJob() {
        when(transferService.importBundle(any(), any(), any(), any())).thenThrow(new IllegalStateException("index corrupted"));

        assertThrows(IllegalStateException.class,
                () -> jobService.importBody(jwt("tenant-b"), TransferScope.words, BUNDLE, null));

        TransferJobEntity last = lastSavedJob();
        assertEquals(TransferJobStatus.failed, last.getStatus());
        assertEquals("index corrupted", last.getErrorMessage());
        assertNotNull(last.getCompletedAt());
    }

    @Test
    void rejectedScopeMismatchIsConflict() {
        when(transferService.importBundle(any(), any(), any(), any()))
                .thenThrow(new ScopeMismatchException(TransferScope.words, "statistics_only"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> jobService.importBody(jwt("tenant-b"), TransferScope.words, BUNDLE, null));

        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
    }

    @Test
    void missingUserClaimIsUnauthorized() {
        Jwt anonymous = Jwt.withTokenValue("token").header("alg", "none").claim("sub", "someone").build();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> jobService.importBody(anonymous, TransferScope.words, BUNDLE, null));

        assertEquals(HttpStatus.UNAUTHORIZED, ex.getStatusCode());
        verifyNoInteractions(transferService);
    }

    @Test
    void uploadMustBeNonEmptyJsonWithinLimit() {
        MockMultipartFile empty = new MockMultipartFile("file", "words.json", "application/json", new byte[0]);
        MockMultipartFile csv = new MockMultipartFile("file", "words.csv", "text/csv", "a,b".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile huge = new MockMultipartFile("file", "words.json", "application/json", new byte[2048]);

        assertEquals(HttpStatus.BAD_REQUEST, assertThrows(ResponseStatusException.class,
                () -> jobService.importUpload(jwt("tenant-b"), TransferScope.words, empty, null)).getStatusCode());
        assertEquals(HttpStatus.UNSUPPORTED_MEDIA_TYPE, assertThrows(ResponseStatusException.class,
                () -> jobService.importUpload(jwt("tenant-b"), TransferScope.words, csv, null)).getStatusCode());
        assertEquals(HttpStatus.PAYLOAD_TOO_LARGE, assertThrows(ResponseStatusException.class,
                () -> jobService.importUpload(jwt("tenant-b"), TransferScope.words, huge, null)).getStatusCode());
        verifyNoInteractions(transferService);
    }

    @Test
    void uploadKeepsFileNameOnJob() {
        MockMultipartFile file = new MockMultipartFile("file", "words_2024-05-01.json", "application/octet-stream", BUNDLE);
        BatchResult result = new BatchResult(TransferScope.words, 0, 0, 0, 0, 0, 0, List.of(), List.of(), List.of());
        when(transferService.importBundle(eq(TransferScope.words), any(), eq("tenant-b"), eq(ScopeMismatchPolicy.reject))).thenReturn(result);

        TransferJobResponse response = jobService.importUpload(jwt("tenant-b"), TransferScope.words, file, null);

        assertEquals("words_2024-05-01.json", response.sourceName());
        assertEquals((long) BUNDLE.length, response.sourceSizeBytes());
    }

    @Test
    void exportIsLoggedAsJob() {
        ExportedBundle bundle = new ExportedBundle(TransferScope.statistics, "statistics_2024-05-01.json", 1, BUNDLE);
        when(transferService.exportBundle(TransferScope.statistics, "tenant-b")).thenReturn(bundle);

        ExportedBundle exported = jobService.export(jwt("tenant-b"), TransferScope.statistics);

        assertEquals(bundle, exported);
        ArgumentCaptor<TransferJobEntity> saved = ArgumentCaptor.forClass(TransferJobEntity.class);
        verify(jobRepository, atLeastOnce()).save(saved.capture());
        TransferJobEntity job = saved.getValue();
        assertEquals(TransferJobType.export_job, job.getJobType());
        assertEquals(TransferJobStatus.completed, job.getStatus());
        assertEquals(1, job.getTotalItems());
    }

    @Test
    void jobOfAnotherUserIsNotFound() {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.findByJobIdAndUserId(jobId, "tenant-b")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> jobService.getJob(jwt("tenant-b"), jobId));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        verify(jobRepository, never()).save(any());
    }

    private TransferJobEntity lastSavedJob() {
        ArgumentCaptor<TransferJobEntity> saved = ArgumentCaptor.forClass(TransferJobEntity.class);
        verify(jobRepository, atLeastOnce()).save(saved.capture());
        return saved.getAllValues().get(saved.getAllValues().size() - 1);
    }

    private Jwt jwt(String userId) {
        return Jwt.withTokenValue("token")
                .header("alg", "none")
                .claim("user_id", userId)
                .build();
    }
}
