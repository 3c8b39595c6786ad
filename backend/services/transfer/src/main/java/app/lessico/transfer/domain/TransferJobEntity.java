package app.lessico.transfer.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transfer_jobs", schema = "app_transfer")
public class TransferJobEntity {

    @Id
    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "job_type", columnDefinition = "transfer_job_type", nullable = false)
    private TransferJobType jobType;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "scope", columnDefinition = "transfer_scope", nullable = false)
    private TransferScope scope;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "status", columnDefinition = "transfer_status", nullable = false)
    private TransferJobStatus status;

    @Column(name = "source_name")
    private String sourceName;

    @Column(name = "source_size_bytes")
    private Long sourceSizeBytes;

    @Column(name = "total_items")
    private Integer totalItems;

    @Column(name = "committed_items")
    private Integer committedItems;

    @Column(name = "skipped_items")
    private Integer skippedItems;

    @Column(name = "failed_items")
    private Integer failedItems;

    @Column(name = "remapped_items")
    private Integer remappedItems;

    @Column(name = "unresolved_references")
    private Integer unresolvedReferences;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result", columnDefinition = "jsonb")
    private JsonNode result;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public TransferJobEntity() {
    }

    public UUID getJobId() {
        return jobId;
    }

    public void setJobId(UUID jobId) {
        this.jobId = jobId;
    }

    public TransferJobType getJobType() {
        return jobType;
    }

    public void setJobType(TransferJobType jobType) {
        this.jobType = jobType;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public TransferScope getScope() {
        return scope;
    }

    public void setScope(TransferScope scope) {
        this.scope = scope;
    }

    public TransferJobStatus getStatus() {
        return status;
    }

    public void setStatus(TransferJobStatus status) {
        this.status = status;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }

    public Long getSourceSizeBytes() {
        return sourceSizeBytes;
    }

    public void setSourceSizeBytes(Long sourceSizeBytes) {
        this.sourceSizeBytes = sourceSizeBytes;
    }

    public Integer getTotalItems() {
        return totalItems;
    }

    public void setTotalItems(Integer totalItems) {
        this.totalItems = totalItems;
    }

    public Integer getCommittedItems() {
        return committedItems;
    }

    public void setCommittedItems(Integer committedItems) {
        this.committedItems = committedItems;
    }

    public Integer getSkippedItems() {
        return skippedItems;
    }

    public void setSkippedItems(Integer skippedItems) {
        this.skippedItems = skippedItems;
    }

    public Integer getFailedItems() {
        return failedItems;
    }

    public void setFailedItems(Integer failedItems) {
        this.failedItems = failedItems;
    }

    public Integer getRemappedItems() {
        return remappedItems;
    }

    public void setRemappedItems(Integer remappedItems) {
        this.remappedItems = remappedItems;
    }

    public Integer getUnresolvedReferences() {
        return unresolvedReferences;
    }

    public void setUnresolvedReferences(Integer unresolvedReferences) {
        this.unresolvedReferences = unresolvedReferences;
    }

    public JsonNode getResult() {
        return result;
    }

    public void setResult(JsonNode result) {
        this.result = result;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
