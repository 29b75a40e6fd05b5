package com.furniture.workshop.repository;

import com.furniture.workshop.model.OfferExtra;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;

public interface OfferExtraRepository extends JpaRepository<OfferExtra, String> {
    List<OfferExtra> findByTenantId(String tenantId);

    List<OfferExtra> findByTenantIdAndOfferProductIdIn(String tenantId, Collection<String> offerProductIds);
}
