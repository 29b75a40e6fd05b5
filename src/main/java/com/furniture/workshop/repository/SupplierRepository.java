package com.furniture.workshop.repository;

import com.furniture.workshop.model.Supplier;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface SupplierRepository extends JpaRepository<Supplier, String> {
    List<Supplier> findByTenantIdOrderByNameAsc(String tenantId);

    Optional<Supplier> findByIdAndTenantId(String id, String tenantId);
}
