package app.lessico.transfer.domain;

import java.io.Serializable;
import java.util.Objects;

public class StoredDocumentId implements Serializable {
    private String collection;
    private String documentId;

    public StoredDocumentId() {
    }

    public StoredDocumentId(String collection, String documentId) {
        this.collection = collection;
        this.documentId = documentId;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        StoredDocumentId that = (StoredDocumentId) o;
        return Objects.equals(collection, that.collection) && Objects.equals(documentId, that.documentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, documentId);
    }
}
