package com.furniture.workshop.service;

import com.furniture.workshop.dto.*;
import com.furniture.workshop.lifecycle.MaterialEvent;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.GlassItemRepository;
import com.furniture.workshop.repository.ProductMaterialRepository;
import com.furniture.workshop.repository.ProductRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.UUID;

@SpringBootTest
public class ProductMaterialServiceTest {

    @Autowired
    private ProductMaterialService materialService;

    @Autowired
    private ProductService productService;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private PurchaseOrderService orderService;

    @Autowired
    private ProductMaterialRepository materialRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private GlassItemRepository glassItemRepository;

    @MockBean
    private AuditService auditService;

    private TenantContext ctx;
    private Product product;

    @BeforeEach
    void setUp() {
        ctx = new TenantContext("tenant-" + UUID.randomUUID(), "marko");
        Project req = new Project();
        req.setClientName("Matic");
        Project project = projectService.createProject(ctx, req).data();
        Product p = new Product();
        p.setName("Display cabinet");
        product = productService.createProduct(ctx, project.getId(), p).data();
    }

    private GlassMaterialRequest glass() {
        return new GlassMaterialRequest("Float 4mm", "Staklo d.o.o.", new BigDecimal("50"), false, List.of(
                new GlassMaterialRequest.GlassItemRequest(2, 1000, 500, false, null),
                new GlassMaterialRequest.GlassItemRequest(1, 600, 400, true, "polished")));
    }

    private ProductMaterial board() {
        return materialService.addMaterial(ctx, product.getId(), new MaterialRequest(null, "Iverica 18mm", "board",
                new BigDecimal("10"), "m2", new BigDecimal("100"), null, false)).data();
    }

    private BigDecimal productCost() {
        return productRepository.findById(product.getId()).orElseThrow().getMaterialCost();
    }

    @Test
    void glassArea_convertsMillimetres() {
        Assertions.assertEquals(0, new BigDecimal("1.0").compareTo(ProductMaterialService.glassArea(1000, 500, 2)));
        Assertions.assertEquals(0, new BigDecimal("0.24").compareTo(ProductMaterialService.glassArea(600, 400, 1)));
    }

    @Test
    void saveGlass_pricesByAreaWithEdgeSurcharge() {
        OperationResult<ProductMaterial> result = materialService.saveGlass(ctx, product.getId(), null, glass());

        Assertions.assertTrue(result.success(), result.message());
        ProductMaterial m = result.data();
        Assertions.assertEquals("m2", m.getUnit());
        Assertions.assertEquals(0, new BigDecimal("1.24").compareTo(m.getQuantity()));
        // 1.0 m2 * 50 + 0.24 m2 * 50 * 1.10
        Assertions.assertEquals(0, new BigDecimal("63.20")
                .compareTo(m.getTotalPrice().setScale(2, RoundingMode.HALF_UP)));
        Assertions.assertEquals(2, m.getGlassItems().size());
        Assertions.assertEquals(0, m.getTotalPrice().compareTo(productCost()));
    }

    @Test
    void saveGlass_replacesPanesOfExistingMaterial() {
        ProductMaterial m = materialService.saveGlass(ctx, product.getId(), null, glass()).data();

        OperationResult<ProductMaterial> result = materialService.saveGlass(ctx, product.getId(), m.getId(),
                new GlassMaterialRequest("Float 4mm", null, new BigDecimal("50"), false,
                        List.of(new GlassMaterialRequest.GlassItemRequest(1, 1000, 1000, false, null))));

        Assertions.assertTrue(result.success(), result.message());
        Assertions.assertEquals(1, glassItemRepository.findByTenantIdAndProductMaterialId(ctx.tenantId(), m.getId())
                .size());
        Assertions.assertEquals(0, new BigDecimal("50").compareTo(productCost()));
    }

    @Test
    void saveGlass_rejectsEmptyPane() {
        OperationResult<ProductMaterial> result = materialService.saveGlass(ctx, product.getId(), null,
                new GlassMaterialRequest("Float 4mm", null, BigDecimal.TEN, false,
                        List.of(new GlassMaterialRequest.GlassItemRequest(1, 0, 500, false, null))));

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(materialRepository.findByTenantIdAndProductId(ctx.tenantId(), product.getId())
                .isEmpty());
    }

    @Test
    void saveAluDoor_pricesPerPiece() {
        AluDoorMaterialRequest req = new AluDoorMaterialRequest("Alu door", null, true, List.of(
                new AluDoorMaterialRequest.AluDoorItemRequest(2, 400, 700, "slim", "satin", "black", "black",
                        "clip", "left", false, new BigDecimal("300"), null),
                new AluDoorMaterialRequest.AluDoorItemRequest(1, 600, 700, "slim", "clear", "black", "black",
                        "clip", "right", true, new BigDecimal("450"), null)));

        ProductMaterial m = materialService.saveAluDoor(ctx, product.getId(), null, req).data();

        Assertions.assertEquals("kom", m.getUnit());
        Assertions.assertEquals(0, new BigDecimal("3").compareTo(m.getQuantity()));
        Assertions.assertEquals(0, new BigDecimal("350").compareTo(m.getUnitPrice()));
        Assertions.assertEquals(0, new BigDecimal("1050").compareTo(m.getTotalPrice()));
        Assertions.assertTrue(m.isEssential());
    }

    @Test
    void productCost_followsEveryMaterialChange() {
        ProductMaterial b = board();
        materialService.saveGlass(ctx, product.getId(), null, glass());

        materialService.updateMaterial(ctx, b.getId(), new MaterialRequest(null, "Iverica 18mm", "board",
                new BigDecimal("4"), "m2", new BigDecimal("100"), null, false));
        BigDecimal expected = AggregateRecalculator.materialCost(
                materialRepository.findByTenantIdAndProductId(ctx.tenantId(), product.getId()));
        Assertions.assertEquals(0, expected.compareTo(productCost()));

        materialService.deleteMaterial(ctx, b.getId());
        expected = AggregateRecalculator.materialCost(
                materialRepository.findByTenantIdAndProductId(ctx.tenantId(), product.getId()));
        Assertions.assertEquals(0, expected.compareTo(productCost()));
        Assertions.assertEquals(1, materialService.listMaterials(ctx, product.getId()).data().size());
    }

    @Test
    void materialOnOrderCannotBeEditedOrDeleted() {
        ProductMaterial b = board();
        orderService.createOrder(ctx, new CreateOrderRequest(null, null, null, null, List.of(b.getId())));

        OperationResult<ProductMaterial> update = materialService.updateMaterial(ctx, b.getId(),
                new MaterialRequest(null, "Iverica 18mm", "board", new BigDecimal("4"), "m2", BigDecimal.TEN, null,
                        false));
        OperationResult<Void> delete = materialService.deleteMaterial(ctx, b.getId());
        OperationResult<Void> deleteProduct = productService.deleteProduct(ctx, product.getId());

        Assertions.assertFalse(update.success());
        Assertions.assertFalse(delete.success());
        Assertions.assertFalse(deleteProduct.success());
        Assertions.assertEquals(0, new BigDecimal("10").compareTo(
                materialRepository.findById(b.getId()).orElseThrow().getQuantity()));
    }

    @Test
    void applyEvent_refusesOrderFlowEvents() {
        ProductMaterial b = board();

        OperationResult<ProductMaterial> result = materialService.applyEvent(ctx, b.getId(), MaterialEvent.ORDER);

        Assertions.assertFalse(result.success());
        Assertions.assertEquals(MaterialStatus.NOT_ORDERED,
                materialRepository.findById(b.getId()).orElseThrow().getStatus());
    }

    @Test
    void applyEvent_stockThenUse() {
        ProductMaterial b = board();
        materialService.applyEvent(ctx, b.getId(), MaterialEvent.RECEIVE);
        materialService.applyEvent(ctx, b.getId(), MaterialEvent.STOCK);

        OperationResult<ProductMaterial> used = materialService.applyEvent(ctx, b.getId(), MaterialEvent.USE);
        OperationResult<ProductMaterial> back = materialService.applyEvent(ctx, b.getId(), MaterialEvent.STOCK);

        Assertions.assertTrue(used.success(), used.message());
        Assertions.assertEquals(MaterialStatus.IN_USE, used.data().getStatus());
        Assertions.assertFalse(back.success());
        Assertions.assertEquals(ProductStatus.MATERIALS_READY,
                productRepository.findById(product.getId()).orElseThrow().getStatus());
    }
}
