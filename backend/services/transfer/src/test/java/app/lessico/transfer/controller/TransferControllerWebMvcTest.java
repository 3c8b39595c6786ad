package app.lessico.transfer.controller;

import app.lessico.transfer.config.SecurityConfig;
import app.lessico.transfer.controller.dto.TransferJobResponse;
import app.lessico.transfer.domain.TransferJobStatus;
import app.lessico.transfer.domain.TransferJobType;
import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.reconcile.ScopeMismatchPolicy;
import app.lessico.transfer.service.ExportedBundle;
import app.lessico.transfer.service.TransferJobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TransferController.class)
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class TransferControllerWebMvcTest {

    private static final String BUNDLE = "{\"words\":[{\"id\":\"w1\",\"english\":\"apple\",\"italian\":\"mela\"}],\"exportType\":\"words_only\"}";

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    TransferJobService jobService;

    @Test
    void importBody_returnsJobForAuthenticatedUser() throws Exception {
        when(jobService.importBody(any(Jwt.class), eq(TransferScope.words), any(byte[].class), eq(ScopeMismatchPolicy.warn)))
                .thenReturn(job(TransferJobType.import_job, TransferScope.words, TransferJobStatus.completed, 1));

        mockMvc.perform(post("/transfers/words/import")
                        .with(jwt().jwt(j -> j.claim("user_id", "tenant-b")))
                        .param("onScopeMismatch", "warn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BUNDLE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobType").value("import_job"))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.committedItems").value(1));
    }

    @Test
    void importFile_acceptsMultipartUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "test_history_2024-05-01.json",
                MediaType.APPLICATION_JSON_VALUE, "{\"testHistory\":[]}".getBytes(StandardCharsets.UTF_8));
        when(jobService.importUpload(any(Jwt.class), eq(TransferScope.history), any(MultipartFile.class), isNull()))
                .thenReturn(job(TransferJobType.import_job, TransferScope.history, TransferJobStatus.completed, 0));

        mockMvc.perform(multipart("/transfers/history/import")
                        .file(file)
                        .with(jwt().jwt(j -> j.claim("user_id", "tenant-b"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scope").value("history"));
    }

    @Test
    void import_mapsServiceStatus() throws Exception {
        when(jobService.importBody(any(Jwt.class), eq(TransferScope.words), any(byte[].class), isNull()))
                .thenThrow(new ResponseStatusException(HttpStatus.CONFLICT, "Bundle is not compatible"));

        mockMvc.perform(post("/transfers/words/import")
                        .with(jwt().jwt(j -> j.claim("user_id", "tenant-b")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BUNDLE))
                .andExpect(status().isConflict());
    }

    @Test
    void import_requiresAuthentication() throws Exception {
        mockMvc.perform(post("/transfers/words/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BUNDLE))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(jobService);
    }

    @Test
    void import_rejectsUnknownScope() throws Exception {
        mockMvc.perform(post("/transfers/flashcards/import")
                        .with(jwt().jwt(j -> j.claim("user_id", "tenant-b")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BUNDLE))
                .andExpect(status().isBadRequest());
    }

    @Test
    void export_returnsAttachment() throws Exception {
        byte[] body = "{\"statistics\":[],\"exportType\":\"statistics_only\"}".getBytes(StandardCharsets.UTF_8);
        when(jobService.export(any(Jwt.class), eq(TransferScope.statistics)))
                .thenReturn(new ExportedBundle(TransferScope.statistics, "statistics_2024-05-01.json", 0, body));

        mockMvc.perform(get("/transfers/statistics/export")
                        .with(jwt().jwt(j -> j.claim("user_id", "tenant-b"))))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"statistics_2024-05-01.json\""))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().bytes(body));
    }

    @Test
    void getJob_returnsOwnJob() throws Exception {
        TransferJobResponse job = job(TransferJobType.export_job, TransferScope.performance, TransferJobStatus.completed, 4);
        when(jobService.getJob(any(Jwt.class), eq(job.jobId()))).thenReturn(job);

        mockMvc.perform(get("/transfers/jobs/{jobId}", job.jobId())
                        .with(jwt().jwt(j -> j.claim("user_id", "tenant-b"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value(job.jobId().toString()))
                .andExpect(jsonPath("$.jobType").value("export_job"));
    }

    private TransferJobResponse job(TransferJobType type, TransferScope scope, TransferJobStatus status, int committed) {
        Instant now = Instant.now();
        return new TransferJobResponse(
                UUID.randomUUID(),
                type,
                scope,
                status,
                null,
                null,
                committed,
                committed,
                0,
                0,
                0,
                0,
                null,
                now,
                now,
                now,
                now,
                null
        );
    }
}
