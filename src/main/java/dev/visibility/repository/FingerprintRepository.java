package dev.visibility.repository;

import dev.visibility.entity.FingerprintEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FingerprintRepository extends JpaRepository<FingerprintEntity, Long> {

    List<FingerprintEntity> findByBusinessIdOrderByCreatedAtDesc(Long businessId);

    Optional<FingerprintEntity> findFirstByBusinessIdOrderByCreatedAtDesc(Long businessId);
}
