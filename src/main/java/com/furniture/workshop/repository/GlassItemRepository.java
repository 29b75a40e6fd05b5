package com.furniture.workshop.repository;

import com.furniture.workshop.model.GlassItem;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface GlassItemRepository extends JpaRepository<GlassItem, String> {
    List<GlassItem> findByTenantId(String tenantId);

    List<GlassItem> findByTenantIdAndProductMaterialId(String tenantId, String productMaterialId);
}
