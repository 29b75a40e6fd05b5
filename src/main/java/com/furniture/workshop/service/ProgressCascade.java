package com.furniture.workshop.service;

import com.furniture.workshop.lifecycle.ProductLifecycle;
import com.furniture.workshop.lifecycle.ProjectLifecycle;
import com.furniture.workshop.model.Product;
import com.furniture.workshop.model.ProductMaterial;
import com.furniture.workshop.model.Project;
import com.furniture.workshop.repository.ProductMaterialRepository;
import com.furniture.workshop.repository.ProductRepository;
import com.furniture.workshop.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Propagates material and production progress up to products and projects.
 * Shared by the order, material and work order cascades.
 */
@Component
public class ProgressCascade {

    private static final Logger logger = LoggerFactory.getLogger(ProgressCascade.class);

    private final ProductRepository productRepository;
    private final ProductMaterialRepository materialRepository;
    private final ProjectRepository projectRepository;
    private final ProductLifecycle productLifecycle;
    private final ProjectLifecycle projectLifecycle;

    public ProgressCascade(ProductRepository productRepository, ProductMaterialRepository materialRepository,
            ProjectRepository projectRepository, ProductLifecycle productLifecycle,
            ProjectLifecycle projectLifecycle) {
        this.productRepository = productRepository;
        this.materialRepository = materialRepository;
        this.projectRepository = projectRepository;
        this.productLifecycle = productLifecycle;
        this.projectLifecycle = projectLifecycle;
    }

    /** Products WAITING become MATERIALS_ORDERED, their APPROVED projects IN_PRODUCTION. */
    public void materialsOrdered(String tenantId, Collection<String> productIds) {
        if (productIds.isEmpty())
            return;
        List<Product> products = productRepository.findByTenantIdAndIdIn(tenantId, productIds);
        for (Product product : products) {
            if (productLifecycle.onMaterialsOrdered(product)) {
                productRepository.save(product);
            }
        }
        Set<String> projectIds = products.stream().map(Product::getProjectId).collect(Collectors.toSet());
        for (Project project : projectRepository.findByTenantIdAndIdIn(tenantId, projectIds)) {
            if (projectLifecycle.onFulfillmentStarted(project, false)) {
                projectRepository.save(project);
                logger.info("Project {} moved to {} after materials were ordered", project.getId(),
                        project.getStatus());
            }
        }
    }

    /**
     * Re-evaluates readiness of the given products against their current
     * materials.
     *
     * @return ids of products promoted to MATERIALS_READY
     */
    public List<String> materialsReceived(String tenantId, Collection<String> productIds) {
        List<String> promoted = new ArrayList<>();
        if (productIds.isEmpty())
            return promoted;
        Map<String, List<ProductMaterial>> byProduct = materialRepository
                .findByTenantIdAndProductIdIn(tenantId, productIds).stream()
                .collect(Collectors.groupingBy(ProductMaterial::getProductId));
        for (Product product : productRepository.findByTenantIdAndIdIn(tenantId, productIds)) {
            List<ProductMaterial> materials = byProduct.getOrDefault(product.getId(), List.of());
            if (productLifecycle.onMaterialsChanged(product, materials)) {
                productRepository.save(product);
                promoted.add(product.getId());
            }
        }
        return promoted;
    }

    /** Re-derives a project's status from its products. */
    public boolean syncProject(String tenantId, String projectId) {
        if (projectId == null)
            return false;
        Project project = projectRepository.findByIdAndTenantId(projectId, tenantId).orElse(null);
        if (project == null) {
            logger.warn("Cannot sync missing project {} for tenant {}", projectId, tenantId);
            return false;
        }
        List<Product> products = productRepository.findByTenantIdAndProjectId(tenantId, projectId);
        if (projectLifecycle.sync(project, products)) {
            projectRepository.save(project);
            logger.info("Project {} synced to {}", projectId, project.getStatus());
            return true;
        }
        return false;
    }
}
