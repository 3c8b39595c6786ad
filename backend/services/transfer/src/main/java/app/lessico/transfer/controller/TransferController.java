package app.lessico.transfer.controller;

import app.lessico.transfer.controller.dto.TransferJobResponse;
import app.lessico.transfer.domain.TransferScope;
import app.lessico.transfer.reconcile.ScopeMismatchPolicy;
import app.lessico.transfer.service.ExportedBundle;
import app.lessico.transfer.service.TransferJobService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@RestController
@RequestMapping("/transfers")
public class TransferController {

    private final TransferJobService jobService;

    public TransferController(TransferJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping(value = "/{scope}/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public TransferJobResponse importFile(@AuthenticationPrincipal Jwt jwt,
                                          @PathVariable TransferScope scope,
                                          @RequestParam(required = false) ScopeMismatchPolicy onScopeMismatch,
                                          @RequestPart("file") MultipartFile file) {
        return jobService.importUpload(jwt, scope, file, onScopeMismatch);
    }

    @PostMapping(value = "/{scope}/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TransferJobResponse importBody(@AuthenticationPrincipal Jwt jwt,
                                          @PathVariable TransferScope scope,
                                          @RequestParam(required = false) ScopeMismatchPolicy onScopeMismatch,
                                          @RequestBody byte[] bundle) {
        return jobService.importBody(jwt, scope, bundle, onScopeMismatch);
    }

    @GetMapping("/{scope}/export")
    public ResponseEntity<byte[]> export(@AuthenticationPrincipal Jwt jwt,
                                         @PathVariable TransferScope scope) {
        ExportedBundle bundle = jobService.export(jwt, scope);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(bundle.fileName()).build().toString())
                .body(bundle.content());
    }

    @GetMapping("/jobs/{jobId}")
    public TransferJobResponse getJob(@AuthenticationPrincipal Jwt jwt,
                                      @PathVariable UUID jobId) {
        return jobService.getJob(jwt, jobId);
    }
}
