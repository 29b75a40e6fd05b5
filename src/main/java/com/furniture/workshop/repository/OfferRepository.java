package com.furniture.workshop.repository;

import com.furniture.workshop.model.Offer;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface OfferRepository extends JpaRepository<Offer, String> {
    List<Offer> findByTenantId(String tenantId);

    Optional<Offer> findByIdAndTenantId(String id, String tenantId);

    List<Offer> findByTenantIdAndProjectId(String tenantId, String projectId);
}
