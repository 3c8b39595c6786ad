package app.lessico.transfer.repository;

import app.lessico.transfer.domain.TransferJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransferJobRepository extends JpaRepository<TransferJobEntity, UUID> {
    Optional<TransferJobEntity> findByJobIdAndUserId(UUID jobId, String userId);
}
