package com.furniture.workshop.repository;

import com.furniture.workshop.model.MaterialStatus;
import com.furniture.workshop.model.ProductMaterial;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProductMaterialRepository extends JpaRepository<ProductMaterial, String> {
    List<ProductMaterial> findByTenantId(String tenantId);

    Optional<ProductMaterial> findByIdAndTenantId(String id, String tenantId);

    List<ProductMaterial> findByTenantIdAndProductId(String tenantId, String productId);

    List<ProductMaterial> findByTenantIdAndProductIdIn(String tenantId, Collection<String> productIds);

    List<ProductMaterial> findByTenantIdAndIdIn(String tenantId, Collection<String> ids);

    List<ProductMaterial> findByTenantIdAndStatusAndOrderIdIsNull(String tenantId, MaterialStatus status);
}
