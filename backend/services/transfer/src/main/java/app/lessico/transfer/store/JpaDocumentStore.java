package app.lessico.transfer.store;

import app.lessico.transfer.domain.StoredDocumentEntity;
import app.lessico.transfer.domain.StoredDocumentId;
import app.lessico.transfer.repository.StoredDocumentRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} backed by a single {@code jsonb} table. Owner and soft-delete flag are
 * denormalized into columns on every write so owner-scoped queries stay index-only.
 * <p>
 * Each call runs in its own transaction, begun and committed inside the exception translation so
 * that connection and commit failures surface as {@link StoreUnavailableException} too.
 */
@Component
public class JpaDocumentStore implements DocumentStore {

    private final StoredDocumentRepository repository;
    private final DocumentIdGenerator idGenerator;
    private final TransactionTemplate readTransaction;
    private final TransactionTemplate writeTransaction;

    public JpaDocumentStore(StoredDocumentRepository repository,
                            DocumentIdGenerator idGenerator,
                            PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
        this.writeTransaction = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<StoredDocument> find(RecordCollection collection, String id) {
        return translate("find " + collection.storeName() + "/" + id, readTransaction, () ->
                repository.findById(new StoredDocumentId(collection.storeName(), id))
                        .map(entity -> toDocument(collection, entity)));
    }

    @Override
    public List<StoredDocument> query(RecordCollection collection, DocumentQuery query) {
        return translate("query " + collection.storeName(), readTransaction, () -> {
            List<StoredDocumentEntity> entities = query.includeDeleted()
                    ? repository.findByCollectionAndOwnerIdOrderByCreatedAtAsc(collection.storeName(), query.ownerId())
                    : repository.findByCollectionAndOwnerIdAndDeletedFalseOrderByCreatedAtAsc(collection.storeName(), query.ownerId());
            return entities.stream()
                    .map(entity -> toDocument(collection, entity))
                    .toList();
        });
    }

    @Override
    public void put(RecordCollection collection, String id, ObjectNode body) {
        translate("put " + collection.storeName() + "/" + id, writeTransaction, () -> {
            Instant now = Instant.now();
            String ownerId = collection.ownerOf(body);
            boolean deleted = collection.isDeleted(body);
            StoredDocumentEntity entity = repository.findById(new StoredDocumentId(collection.storeName(), id))
                    .orElse(null);
            if (entity == null) {
                entity = new StoredDocumentEntity(collection.storeName(), id, ownerId, deleted, body.deepCopy(), now, now);
            } else {
                entity.setOwnerId(ownerId);
                entity.setDeleted(deleted);
                entity.setBody(body.deepCopy());
                entity.setUpdatedAt(now);
            }
            return repository.save(entity);
        });
    }

    @Override
    public String allocateId(RecordCollection collection) {
        return idGenerator.next();
    }

    private StoredDocument toDocument(RecordCollection collection, StoredDocumentEntity entity) {
        JsonNode body = entity.getBody();
        ObjectNode copy = body instanceof ObjectNode objectNode
                ? objectNode.deepCopy()
                : JsonNodeFactory.instance.objectNode();
        return new StoredDocument(collection, entity.getDocumentId(), entity.getOwnerId(), copy);
    }

    private <T> T translate(String operation, TransactionTemplate transaction, Supplier<T> action) {
        try {
            return transaction.execute(status -> action.get());
        } catch (DataAccessException | TransactionException ex) {
            throw new StoreUnavailableException("Document store unavailable during " + operation, ex);
        }
    }
}
