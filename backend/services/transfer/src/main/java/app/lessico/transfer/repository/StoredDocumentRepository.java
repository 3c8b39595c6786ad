package app.lessico.transfer.repository;

import app.lessico.transfer.domain.StoredDocumentEntity;
import app.lessico.transfer.domain.StoredDocumentId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoredDocumentRepository extends JpaRepository<StoredDocumentEntity, StoredDocumentId> {

    List<StoredDocumentEntity> findByCollectionAndOwnerIdOrderByCreatedAtAsc(String collection, String ownerId);

    List<StoredDocumentEntity> findByCollectionAndOwnerIdAndDeletedFalseOrderByCreatedAtAsc(String collection, String ownerId);
}
