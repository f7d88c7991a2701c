package com.flagship.credit_ledger.incident;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BillingIncidentRepository extends JpaRepository<BillingIncidentEntity, UUID> {

    List<BillingIncidentEntity> findByUserIdOrderByCreatedAtDesc(String userId);

    long countByStatus(String status);
}
