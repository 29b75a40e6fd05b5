package com.furniture.workshop.repository;

import com.furniture.workshop.model.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProjectRepository extends JpaRepository<Project, String> {
    List<Project> findByTenantId(String tenantId);

    Optional<Project> findByIdAndTenantId(String id, String tenantId);

    List<Project> findByTenantIdAndIdIn(String tenantId, Collection<String> ids);
}
