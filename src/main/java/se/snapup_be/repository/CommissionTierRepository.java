package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.snapup_be.pojo.CommissionTier;

import java.util.Optional;

public interface CommissionTierRepository extends JpaRepository<CommissionTier, Long> {
    Optional<CommissionTier> findFirstByOrderByCreatedAtDesc();
}
