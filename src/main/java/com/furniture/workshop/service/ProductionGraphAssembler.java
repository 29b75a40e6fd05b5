package com.furniture.workshop.service;

import com.furniture.workshop.dto.ProductionGraph;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Rebuilds the production graph from the flat tenant collections. All
 * collections are fetched in parallel; children are attached through one
 * index per relationship. Any failed fetch yields {@link ProductionGraph#empty()}.
 */
@Service
public class ProductionGraphAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ProductionGraphAssembler.class);

    private final ProjectRepository projectRepository;
    private final ProductRepository productRepository;
    private final ProductMaterialRepository materialRepository;
    private final GlassItemRepository glassItemRepository;
    private final AluDoorItemRepository aluDoorItemRepository;
    private final OfferRepository offerRepository;
    private final OfferProductRepository offerProductRepository;
    private final OfferExtraRepository offerExtraRepository;
    private final PurchaseOrderRepository orderRepository;
    private final PurchaseOrderItemRepository orderItemRepository;
    private final WorkOrderRepository workOrderRepository;
    private final WorkOrderItemRepository workOrderItemRepository;
    private final SupplierRepository supplierRepository;
    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;
    private final WorkLogRepository workLogRepository;
    private final Executor executor;

    public ProductionGraphAssembler(ProjectRepository projectRepository, ProductRepository productRepository,
            ProductMaterialRepository materialRepository, GlassItemRepository glassItemRepository,
            AluDoorItemRepository aluDoorItemRepository, OfferRepository offerRepository,
            OfferProductRepository offerProductRepository, OfferExtraRepository offerExtraRepository,
            PurchaseOrderRepository orderRepository, PurchaseOrderItemRepository orderItemRepository,
            WorkOrderRepository workOrderRepository, WorkOrderItemRepository workOrderItemRepository,
            SupplierRepository supplierRepository, WorkerRepository workerRepository, TaskRepository taskRepository,
            WorkLogRepository workLogRepository, @Qualifier("graphFetchExecutor") Executor executor) {
        this.projectRepository = projectRepository;
        this.productRepository = productRepository;
        this.materialRepository = materialRepository;
        this.glassItemRepository = glassItemRepository;
        this.aluDoorItemRepository = aluDoorItemRepository;
        this.offerRepository = offerRepository;
        this.offerProductRepository = offerProductRepository;
        this.offerExtraRepository = offerExtraRepository;
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.workOrderRepository = workOrderRepository;
        this.workOrderItemRepository = workOrderItemRepository;
        this.supplierRepository = supplierRepository;
        this.workerRepository = workerRepository;
        this.taskRepository = taskRepository;
        this.workLogRepository = workLogRepository;
        this.executor = executor;
    }

    public ProductionGraph assemble(TenantContext ctx) {
        if (ctx == null || !ctx.hasTenant()) {
            logger.warn("Graph requested without tenant");
            return ProductionGraph.empty();
        }
        String tenantId = ctx.tenantId();
        long started = System.currentTimeMillis();
        try {
            var projects = fetch(() -> projectRepository.findByTenantId(tenantId));
            var products = fetch(() -> productRepository.findByTenantId(tenantId));
            var materials = fetch(() -> materialRepository.findByTenantId(tenantId));
            var glassItems = fetch(() -> glassItemRepository.findByTenantId(tenantId));
            var aluDoorItems = fetch(() -> aluDoorItemRepository.findByTenantId(tenantId));
            var offers = fetch(() -> offerRepository.findByTenantId(tenantId));
            var offerProducts = fetch(() -> offerProductRepository.findByTenantId(tenantId));
            var offerExtras = fetch(() -> offerExtraRepository.findByTenantId(tenantId));
            var orders = fetch(() -> orderRepository.findByTenantId(tenantId));
            var orderItems = fetch(() -> orderItemRepository.findByTenantId(tenantId));
            var workOrders = fetch(() -> workOrderRepository.findByTenantId(tenantId));
            var workOrderItems = fetch(() -> workOrderItemRepository.findByTenantId(tenantId));
            var suppliers = fetch(() -> supplierRepository.findByTenantIdOrderByNameAsc(tenantId));
            var workers = fetch(() -> workerRepository.findByTenantIdOrderByNameAsc(tenantId));
            var tasks = fetch(() -> taskRepository.findByTenantId(tenantId));
            var workLogs = fetch(() -> workLogRepository.findByTenantId(tenantId));

            CompletableFuture.allOf(projects, products, materials, glassItems, aluDoorItems, offers, offerProducts,
                    offerExtras, orders, orderItems, workOrders, workOrderItems, suppliers, workers, tasks, workLogs)
                    .join();

            Map<String, List<GlassItem>> glassByMaterial = index(glassItems.join(), GlassItem::getProductMaterialId);
            Map<String, List<AluDoorItem>> doorsByMaterial = index(aluDoorItems.join(),
                    AluDoorItem::getProductMaterialId);
            for (ProductMaterial m : materials.join()) {
                m.setGlassItems(children(glassByMaterial, m.getId()));
                m.setAluDoorItems(children(doorsByMaterial, m.getId()));
            }

            Map<String, List<ProductMaterial>> materialsByProduct = index(materials.join(),
                    ProductMaterial::getProductId);
            for (Product p : products.join()) {
                p.setMaterials(children(materialsByProduct, p.getId()));
            }

            Map<String, List<OfferExtra>> extrasByOfferProduct = index(offerExtras.join(),
                    OfferExtra::getOfferProductId);
            for (OfferProduct op : offerProducts.join()) {
                op.setExtras(children(extrasByOfferProduct, op.getId()));
            }
            Map<String, List<OfferProduct>> productsByOffer = index(offerProducts.join(), OfferProduct::getOfferId);
            for (Offer o : offers.join()) {
                o.setProducts(children(productsByOffer, o.getId()));
            }

            Map<String, List<Product>> productsByProject = index(products.join(), Product::getProjectId);
            Map<String, List<Offer>> offersByProject = index(offers.join(), Offer::getProjectId);
            for (Project p : projects.join()) {
                p.setProducts(children(productsByProject, p.getId()));
                p.setOffers(children(offersByProject, p.getId()));
            }

            Map<String, List<PurchaseOrderItem>> itemsByOrder = index(orderItems.join(),
                    PurchaseOrderItem::getOrderId);
            for (PurchaseOrder o : orders.join()) {
                o.setItems(children(itemsByOrder, o.getId()));
            }

            Map<String, List<WorkOrderItem>> itemsByWorkOrder = index(workOrderItems.join(),
                    WorkOrderItem::getWorkOrderId);
            for (WorkOrder w : workOrders.join()) {
                w.setItems(children(itemsByWorkOrder, w.getId()));
            }

            logger.debug("Assembled graph for tenant {} in {} ms", tenantId, System.currentTimeMillis() - started);
            return ProductionGraph.builder()
                    .loaded(true)
                    .projects(projects.join())
                    .orders(orders.join())
                    .workOrders(workOrders.join())
                    .suppliers(suppliers.join())
                    .workers(workers.join())
                    .tasks(tasks.join())
                    .workLogs(workLogs.join())
                    .build();
        } catch (RuntimeException e) {
            logger.error("Could not assemble production graph for tenant {}", tenantId, e);
            return ProductionGraph.empty();
        }
    }

    private <T> CompletableFuture<List<T>> fetch(Supplier<List<T>> query) {
        return CompletableFuture.supplyAsync(query, executor);
    }

    private static <T> Map<String, List<T>> index(List<T> rows, Function<T, String> parentId) {
        return rows.stream()
                .filter(r -> parentId.apply(r) != null)
                .collect(Collectors.groupingBy(parentId));
    }

    private static <T> List<T> children(Map<String, List<T>> index, String parentId) {
        List<T> found = index.get(parentId);
        return found != null ? found : new ArrayList<>();
    }
}
