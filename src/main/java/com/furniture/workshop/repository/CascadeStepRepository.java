package com.furniture.workshop.repository;

import com.furniture.workshop.model.CascadeStep;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface CascadeStepRepository extends JpaRepository<CascadeStep, Long> {
    List<CascadeStep> findByTenantIdAndCascadeKey(String tenantId, String cascadeKey);
}
