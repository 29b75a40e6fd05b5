package com.furniture.workshop.repository;

import com.furniture.workshop.model.OfferProduct;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface OfferProductRepository extends JpaRepository<OfferProduct, String> {
    List<OfferProduct> findByTenantId(String tenantId);

    List<OfferProduct> findByTenantIdAndOfferId(String tenantId, String offerId);
}
