package com.furniture.workshop.repository;

import com.furniture.workshop.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, String> {
    List<Product> findByTenantId(String tenantId);

    Optional<Product> findByIdAndTenantId(String id, String tenantId);

    List<Product> findByTenantIdAndProjectId(String tenantId, String projectId);

    List<Product> findByTenantIdAndIdIn(String tenantId, Collection<String> ids);
}
