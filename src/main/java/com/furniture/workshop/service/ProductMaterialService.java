package com.furniture.workshop.service;

import com.furniture.workshop.dto.AluDoorMaterialRequest;
import com.furniture.workshop.dto.GlassMaterialRequest;
import com.furniture.workshop.dto.MaterialRequest;
import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.lifecycle.MaterialEvent;
import com.furniture.workshop.lifecycle.MaterialLifecycle;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.AluDoorItemRepository;
import com.furniture.workshop.repository.GlassItemRepository;
import com.furniture.workshop.repository.ProductMaterialRepository;
import com.furniture.workshop.repository.ProductRepository;
import com.furniture.workshop.util.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Materials of a product, including glass and aluminium door materials that
 * are priced from their sub-items. Every change recalculates the product's
 * material cost.
 */
@Service
public class ProductMaterialService {

    private static final Logger logger = LoggerFactory.getLogger(ProductMaterialService.class);

    static final String GLASS_UNIT = "m2";
    static final String PIECE_UNIT = "kom";

    private static final BigDecimal MM2_PER_M2 = new BigDecimal("1000000");
    private static final BigDecimal EDGE_SURCHARGE = new BigDecimal("1.10");

    // Order-flow events only move through purchase orders
    private static final Set<MaterialEvent> ORDER_FLOW = Set.of(MaterialEvent.ORDER, MaterialEvent.GIVE_BACK);

    private final ProductMaterialRepository materialRepository;
    private final GlassItemRepository glassItemRepository;
    private final AluDoorItemRepository aluDoorItemRepository;
    private final ProductRepository productRepository;
    private final MaterialLifecycle materialLifecycle;
    private final AggregateRecalculator recalculator;
    private final ProgressCascade progressCascade;
    private final OperationRunner runner;
    private final Messages messages;
    private final Clock clock;

    public ProductMaterialService(ProductMaterialRepository materialRepository,
            GlassItemRepository glassItemRepository, AluDoorItemRepository aluDoorItemRepository,
            ProductRepository productRepository, MaterialLifecycle materialLifecycle,
            AggregateRecalculator recalculator, ProgressCascade progressCascade, OperationRunner runner,
            Messages messages, Clock clock) {
        this.materialRepository = materialRepository;
        this.glassItemRepository = glassItemRepository;
        this.aluDoorItemRepository = aluDoorItemRepository;
        this.productRepository = productRepository;
        this.materialLifecycle = materialLifecycle;
        this.recalculator = recalculator;
        this.progressCascade = progressCascade;
        this.runner = runner;
        this.messages = messages;
        this.clock = clock;
    }

    public OperationResult<ProductMaterial> addMaterial(TenantContext ctx, String productId, MaterialRequest req) {
        return runner.run(ctx, "addMaterial", () -> {
            String tenantId = ctx.tenantId();
            validate(req);
            Product product = findProduct(tenantId, productId);

            ProductMaterial m = new ProductMaterial();
            m.setTenantId(tenantId);
            m.setProductId(product.getId());
            m.setStatus(MaterialStatus.NOT_ORDERED);
            apply(m, req);
            ProductMaterial saved = materialRepository.save(m);

            recalculator.recalculateProductCost(tenantId, product.getId());
            return OperationResult.ok(saved, messages.get("material.saved", saved.getMaterialName()));
        });
    }

    public OperationResult<ProductMaterial> updateMaterial(TenantContext ctx, String materialId, MaterialRequest req) {
        return runner.run(ctx, "updateMaterial", () -> {
            String tenantId = ctx.tenantId();
            validate(req);
            ProductMaterial m = findMaterial(tenantId, materialId);
            requireNotOnOrder(m);
            apply(m, req);
            ProductMaterial saved = materialRepository.save(m);

            recalculator.recalculateProductCost(tenantId, m.getProductId());
            return OperationResult.ok(saved, messages.get("material.saved", saved.getMaterialName()));
        });
    }

    private static void validate(MaterialRequest req) {
        if (req == null || req.materialName() == null || req.materialName().isBlank())
            throw new WorkshopException("material.name-required");
        if (req.quantity() == null || req.quantity().signum() < 0)
            throw new WorkshopException("material.quantity-invalid");
        if (req.unitPrice() != null && req.unitPrice().signum() < 0)
            throw new WorkshopException("material.price-invalid");
    }

    private static void apply(ProductMaterial m, MaterialRequest req) {
        m.setMaterialId(req.materialId());
        m.setMaterialName(req.materialName().trim());
        m.setCategory(req.category());
        m.setQuantity(req.quantity());
        m.setUnit(req.unit());
        m.setUnitPrice(req.unitPrice() != null ? req.unitPrice() : BigDecimal.ZERO);
        m.setSupplier(req.supplier());
        m.setEssential(req.essential());
        m.recomputeTotal();
    }

    /** True while the material waits on a purchase order that has not delivered it. */
    boolean isOnOpenOrder(ProductMaterial m) {
        return m.getOrderId() != null && materialLifecycle.isOutstanding(m.getStatus());
    }

    // Materials waiting on an open order are edited through the order
    private void requireNotOnOrder(ProductMaterial m) {
        if (isOnOpenOrder(m))
            throw new WorkshopException("material.on-order", m.getMaterialName());
    }

    public OperationResult<Void> deleteMaterial(TenantContext ctx, String materialId) {
        return runner.run(ctx, "deleteMaterial", () -> {
            String tenantId = ctx.tenantId();
            ProductMaterial m = findMaterial(tenantId, materialId);
            requireNotOnOrder(m);
            deleteMaterials(tenantId, List.of(m));
            recalculator.recalculateProductCost(tenantId, m.getProductId());
            return OperationResult.ok(null, messages.get("material.deleted", m.getMaterialName()));
        });
    }

    /** Deletes materials together with their glass and door items. */
    void deleteMaterials(String tenantId, Collection<ProductMaterial> materials) {
        for (ProductMaterial m : materials) {
            glassItemRepository.deleteAll(glassItemRepository.findByTenantIdAndProductMaterialId(tenantId, m.getId()));
            aluDoorItemRepository
                    .deleteAll(aluDoorItemRepository.findByTenantIdAndProductMaterialId(tenantId, m.getId()));
        }
        materialRepository.deleteAll(materials);
    }

    /**
     * Creates or replaces a glass material. Each pane is priced by area, with
     * a surcharge for edge processing folded into the effective unit price.
     *
     * @param materialId existing material to replace, or {@code null} to create one
     */
    public OperationResult<ProductMaterial> saveGlass(TenantContext ctx, String productId, String materialId,
            GlassMaterialRequest req) {
        return runner.run(ctx, "saveGlassMaterial", () -> {
            String tenantId = ctx.tenantId();
            if (req == null || req.items() == null || req.items().isEmpty())
                throw new WorkshopException("material.glass.no-items");
            BigDecimal pricePerM2 = req.pricePerM2() != null ? req.pricePerM2() : BigDecimal.ZERO;

            List<GlassItem> items = new ArrayList<>();
            BigDecimal totalArea = BigDecimal.ZERO;
            BigDecimal totalPrice = BigDecimal.ZERO;
            for (GlassMaterialRequest.GlassItemRequest r : req.items()) {
                if (r.qty() <= 0 || r.width() <= 0 || r.height() <= 0)
                    throw new WorkshopException("material.glass.invalid-item");
                GlassItem item = new GlassItem();
                item.setTenantId(tenantId);
                item.setQty(r.qty());
                item.setWidth(r.width());
                item.setHeight(r.height());
                item.setEdgeProcessing(r.edgeProcessing());
                item.setNote(r.note());
                item.setAreaM2(glassArea(r.width(), r.height(), r.qty()));
                items.add(item);

                BigDecimal price = item.getAreaM2().multiply(pricePerM2);
                if (r.edgeProcessing())
                    price = price.multiply(EDGE_SURCHARGE);
                totalArea = totalArea.add(item.getAreaM2());
                totalPrice = totalPrice.add(price);
            }

            BigDecimal unitPrice = totalArea.signum() > 0
                    ? totalPrice.divide(totalArea, 4, RoundingMode.HALF_UP)
                    : pricePerM2;
            ProductMaterial m = prepare(tenantId, productId, materialId, req.materialName(), GLASS_UNIT,
                    req.supplier(), req.essential());
            m.setCategory("glass");
            m.setQuantity(totalArea);
            m.setUnitPrice(unitPrice);
            m.recomputeTotal();
            ProductMaterial saved = materialRepository.save(m);

            glassItemRepository.deleteAll(glassItemRepository.findByTenantIdAndProductMaterialId(tenantId, saved.getId()));
            items.forEach(i -> i.setProductMaterialId(saved.getId()));
            saved.setGlassItems(glassItemRepository.saveAll(items));

            recalculator.recalculateProductCost(tenantId, saved.getProductId());
            logger.debug("Glass material {} priced at {} for {} m2", saved.getId(), saved.getTotalPrice(), totalArea);
            return OperationResult.ok(saved, messages.get("material.saved", saved.getMaterialName()));
        });
    }

    /** Area in square metres of {@code qty} panes of the given size in millimetres. */
    static BigDecimal glassArea(int width, int height, int qty) {
        return BigDecimal.valueOf((long) width * height)
                .divide(MM2_PER_M2, 6, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(qty))
                .setScale(4, RoundingMode.HALF_UP);
    }

    /** Creates or replaces an aluminium door material priced per piece. */
    public OperationResult<ProductMaterial> saveAluDoor(TenantContext ctx, String productId, String materialId,
            AluDoorMaterialRequest req) {
        return runner.run(ctx, "saveAluDoorMaterial", () -> {
            String tenantId = ctx.tenantId();
            if (req == null || req.items() == null || req.items().isEmpty())
                throw new WorkshopException("material.alu.no-items");

            List<AluDoorItem> items = new ArrayList<>();
            int pieces = 0;
            BigDecimal totalPrice = BigDecimal.ZERO;
            for (AluDoorMaterialRequest.AluDoorItemRequest r : req.items()) {
                if (r.qty() <= 0)
                    throw new WorkshopException("material.alu.invalid-item");
                AluDoorItem item = new AluDoorItem();
                item.setTenantId(tenantId);
                item.setQty(r.qty());
                item.setWidth(r.width());
                item.setHeight(r.height());
                item.setFrameType(r.frameType());
                item.setGlassType(r.glassType());
                item.setFrameColor(r.frameColor());
                item.setHingeColor(r.hingeColor());
                item.setHingeType(r.hingeType());
                item.setHingeSide(r.hingeSide());
                item.setIntegratedHandle(r.integratedHandle());
                item.setNote(r.note());
                item.setAreaM2(r.width() > 0 && r.height() > 0 ? glassArea(r.width(), r.height(), r.qty())
                        : BigDecimal.ZERO);
                item.setUnitPrice(r.unitPrice() != null ? r.unitPrice() : BigDecimal.ZERO);
                item.setTotalPrice(item.getUnitPrice().multiply(BigDecimal.valueOf(r.qty()))
                        .setScale(4, RoundingMode.HALF_UP));
                items.add(item);
                pieces += r.qty();
                totalPrice = totalPrice.add(item.getTotalPrice());
            }

            ProductMaterial m = prepare(tenantId, productId, materialId, req.materialName(), PIECE_UNIT,
                    req.supplier(), req.essential());
            m.setCategory("alu-door");
            m.setQuantity(BigDecimal.valueOf(pieces));
            m.setUnitPrice(totalPrice.divide(BigDecimal.valueOf(pieces), 4, RoundingMode.HALF_UP));
            m.recomputeTotal();
            ProductMaterial saved = materialRepository.save(m);

            aluDoorItemRepository
                    .deleteAll(aluDoorItemRepository.findByTenantIdAndProductMaterialId(tenantId, saved.getId()));
            items.forEach(i -> i.setProductMaterialId(saved.getId()));
            saved.setAluDoorItems(aluDoorItemRepository.saveAll(items));

            recalculator.recalculateProductCost(tenantId, saved.getProductId());
            return OperationResult.ok(saved, messages.get("material.saved", saved.getMaterialName()));
        });
    }

    private ProductMaterial prepare(String tenantId, String productId, String materialId, String name, String unit,
            String supplier, boolean essential) {
        if (name == null || name.isBlank())
            throw new WorkshopException("material.name-required");
        ProductMaterial m;
        if (materialId != null) {
            m = findMaterial(tenantId, materialId);
            requireNotOnOrder(m);
        } else {
            Product product = findProduct(tenantId, productId);
            m = new ProductMaterial();
            m.setTenantId(tenantId);
            m.setProductId(product.getId());
            m.setStatus(MaterialStatus.NOT_ORDERED);
        }
        m.setMaterialName(name.trim());
        m.setUnit(unit);
        m.setSupplier(supplier);
        m.setEssential(essential);
        return m;
    }

    /**
     * Moves a material outside the order flow, e.g. into stock or into use,
     * then re-checks whether its product now has all materials.
     */
    public OperationResult<ProductMaterial> applyEvent(TenantContext ctx, String materialId, MaterialEvent event) {
        return runner.run(ctx, "applyMaterialEvent", () -> {
            String tenantId = ctx.tenantId();
            if (event == null)
                throw new WorkshopException("material.event-required");
            if (ORDER_FLOW.contains(event))
                throw new WorkshopException("material.event.order-flow", event);
            ProductMaterial m = findMaterial(tenantId, materialId);
            MaterialStatus before = m.getStatus();
            if (materialLifecycle.fire(m, event)) {
                if (m.getStatus() == MaterialStatus.RECEIVED)
                    m.setReceivedAt(LocalDateTime.now(clock));
                materialRepository.save(m);
                logger.info("Material {} moved {} -> {}", m.getId(), before, m.getStatus());
            }
            progressCascade.materialsReceived(tenantId, List.of(m.getProductId()));
            return OperationResult.ok(m, messages.get("material.status-changed", m.getMaterialName(), m.getStatus()));
        });
    }

    /** Materials not yet ordered and not reserved by a draft order. */
    public OperationResult<List<ProductMaterial>> findUnordered(TenantContext ctx) {
        return runner.run(ctx, "findUnorderedMaterials", () -> OperationResult.ok(
                materialRepository.findByTenantIdAndStatusAndOrderIdIsNull(ctx.tenantId(), MaterialStatus.NOT_ORDERED),
                ""));
    }

    public OperationResult<List<ProductMaterial>> listMaterials(TenantContext ctx, String productId) {
        return runner.run(ctx, "listMaterials", () -> {
            String tenantId = ctx.tenantId();
            List<ProductMaterial> materials = materialRepository.findByTenantIdAndProductId(tenantId, productId);
            for (ProductMaterial m : materials) {
                m.setGlassItems(glassItemRepository.findByTenantIdAndProductMaterialId(tenantId, m.getId()));
                m.setAluDoorItems(aluDoorItemRepository.findByTenantIdAndProductMaterialId(tenantId, m.getId()));
            }
            return OperationResult.ok(materials, "");
        });
    }

    private Product findProduct(String tenantId, String productId) {
        return productRepository.findByIdAndTenantId(productId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("product", productId));
    }

    private ProductMaterial findMaterial(String tenantId, String materialId) {
        return materialRepository.findByIdAndTenantId(materialId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("material", materialId));
    }
}
