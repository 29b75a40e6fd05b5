package com.furniture.workshop.repository;

import com.furniture.workshop.model.AluDoorItem;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface AluDoorItemRepository extends JpaRepository<AluDoorItem, String> {
    List<AluDoorItem> findByTenantId(String tenantId);

    List<AluDoorItem> findByTenantIdAndProductMaterialId(String tenantId, String productMaterialId);
}
