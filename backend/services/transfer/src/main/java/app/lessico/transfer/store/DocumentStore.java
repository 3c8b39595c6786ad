package app.lessico.transfer.store;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Remote document store consumed by the transfer engine. Every method may throw
 * {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface DocumentStore {

    Optional<StoredDocument> find(RecordCollection collection, String id);

    List<StoredDocument> query(RecordCollection collection, DocumentQuery query);

    /**
     * Writes {@code body} at {@code id}, replacing any previous document in full.
     */
    void put(RecordCollection collection, String id, ObjectNode body);

    String allocateId(RecordCollection collection);
}
