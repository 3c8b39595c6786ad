package app.lessico.transfer.domain;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(name = "documents", schema = "app_transfer")
@IdClass(StoredDocumentId.class)
public class StoredDocumentEntity {

    @Id
    @Column(name = "collection", nullable = false)
    private String collection;

    @Id
    @Column(name = "document_id", nullable = false)
    private String documentId;

    @Column(name = "owner_id")
    private String ownerId;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "body", columnDefinition = "jsonb", nullable = false)
    private JsonNode body;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public StoredDocumentEntity() {
    }

    public StoredDocumentEntity(String collection,
                                String documentId,
                                String ownerId,
                                boolean deleted,
                                JsonNode body,
                                Instant createdAt,
                                Instant updatedAt) {
        this.collection = collection;
        this.documentId = documentId;
        this.ownerId = ownerId;
        this.deleted = deleted;
        this.body = body;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getCollection() {
        return collection;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    public JsonNode getBody() {
        return body;
    }

    public void setBody(JsonNode body) {
        this.body = body;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
