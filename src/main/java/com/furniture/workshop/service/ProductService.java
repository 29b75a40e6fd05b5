package com.furniture.workshop.service;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.model.Product;
import com.furniture.workshop.model.ProductMaterial;
import com.furniture.workshop.model.ProductStatus;
import com.furniture.workshop.repository.ProductMaterialRepository;
import com.furniture.workshop.repository.ProductRepository;
import com.furniture.workshop.repository.ProjectRepository;
import com.furniture.workshop.util.Messages;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class ProductService {

    private final ProductRepository productRepository;
    private final ProductMaterialRepository materialRepository;
    private final ProjectRepository projectRepository;
    private final ProductMaterialService materialService;
    private final OperationRunner runner;
    private final AuditService auditService;
    private final Messages messages;

    public ProductService(ProductRepository productRepository, ProductMaterialRepository materialRepository,
            ProjectRepository projectRepository, ProductMaterialService materialService, OperationRunner runner,
            AuditService auditService, Messages messages) {
        this.productRepository = productRepository;
        this.materialRepository = materialRepository;
        this.projectRepository = projectRepository;
        this.materialService = materialService;
        this.runner = runner;
        this.auditService = auditService;
        this.messages = messages;
    }

    public OperationResult<Product> createProduct(TenantContext ctx, String projectId, Product req) {
        return runner.run(ctx, "createProduct", () -> {
            String tenantId = ctx.tenantId();
            validate(req);
            projectRepository.findByIdAndTenantId(projectId, tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("project", projectId));

            Product product = new Product();
            product.setTenantId(tenantId);
            product.setProjectId(projectId);
            product.setStatus(ProductStatus.WAITING);
            product.setMaterialCost(BigDecimal.ZERO);
            copy(req, product);
            Product saved = productRepository.save(product);
            return OperationResult.ok(saved, messages.get("product.saved", saved.getName()));
        });
    }

    /** Updates descriptive fields only; status and cost are derived elsewhere. */
    public OperationResult<Product> updateProduct(TenantContext ctx, String productId, Product req) {
        return runner.run(ctx, "updateProduct", () -> {
            validate(req);
            Product product = findProduct(ctx.tenantId(), productId);
            copy(req, product);
            return OperationResult.ok(productRepository.save(product), messages.get("product.saved", product.getName()));
        });
    }

    private static void validate(Product req) {
        if (req == null || req.getName() == null || req.getName().isBlank())
            throw new WorkshopException("product.name-required");
        if (req.getQuantity() != null && req.getQuantity() <= 0)
            throw new WorkshopException("product.quantity-invalid");
    }

    private static void copy(Product from, Product to) {
        to.setName(from.getName().trim());
        to.setHeight(from.getHeight());
        to.setWidth(from.getWidth());
        to.setDepth(from.getDepth());
        to.setQuantity(from.getQuantity() != null ? from.getQuantity() : 1);
        to.setNotes(from.getNotes());
    }

    public OperationResult<Void> deleteProduct(TenantContext ctx, String productId) {
        return runner.run(ctx, "deleteProduct", () -> {
            String tenantId = ctx.tenantId();
            Product product = findProduct(tenantId, productId);
            deleteProducts(tenantId, List.of(product));
            auditService.log(ctx, "PRODUCT_DELETED", "Product: " + product.getName());
            return OperationResult.ok(null, messages.get("product.deleted", product.getName()));
        });
    }

    /**
     * Deletes products with their materials. Refused while any material still
     * waits on a purchase order; delivered materials go with the product.
     */
    void deleteProducts(String tenantId, List<Product> products) {
        if (products.isEmpty())
            return;
        List<ProductMaterial> materials = materialRepository.findByTenantIdAndProductIdIn(tenantId,
                products.stream().map(Product::getId).collect(Collectors.toList()));
        for (ProductMaterial m : materials) {
            if (materialService.isOnOpenOrder(m))
                throw new WorkshopException("product.delete.on-order", m.getMaterialName());
        }
        materialService.deleteMaterials(tenantId, materials);
        productRepository.deleteAll(products);
    }

    public OperationResult<Product> getProduct(TenantContext ctx, String productId) {
        return runner.run(ctx, "getProduct", () -> {
            Product product = findProduct(ctx.tenantId(), productId);
            product.setMaterials(materialRepository.findByTenantIdAndProductId(ctx.tenantId(), productId));
            return OperationResult.ok(product, "");
        });
    }

    private Product findProduct(String tenantId, String productId) {
        return productRepository.findByIdAndTenantId(productId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("product", productId));
    }
}
