package com.furniture.workshop.service;

import com.furniture.workshop.config.WorkshopProperties;
import com.furniture.workshop.dto.*;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.lifecycle.MaterialLifecycle;
import com.furniture.workshop.lifecycle.OrderEvent;
import com.furniture.workshop.lifecycle.OrderLifecycle;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.ProductMaterialRepository;
import com.furniture.workshop.repository.ProductRepository;
import com.furniture.workshop.repository.PurchaseOrderItemRepository;
import com.furniture.workshop.repository.PurchaseOrderRepository;
import com.furniture.workshop.util.Messages;
import com.furniture.workshop.util.NumberGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Purchase order cascades. Every write commits on its own; each step is
 * either idempotent through the lifecycle tables or journaled, so callers
 * recover from a failed run by repeating the same request.
 */
@Service
public class PurchaseOrderService {

    private static final Logger logger = LoggerFactory.getLogger(PurchaseOrderService.class);

    private final PurchaseOrderRepository orderRepository;
    private final PurchaseOrderItemRepository itemRepository;
    private final ProductMaterialRepository materialRepository;
    private final ProductRepository productRepository;
    private final MaterialLifecycle materialLifecycle;
    private final OrderLifecycle orderLifecycle;
    private final ProgressCascade progressCascade;
    private final AggregateRecalculator recalculator;
    private final CascadeJournal journal;
    private final OperationRunner runner;
    private final AuditService auditService;
    private final Messages messages;
    private final WorkshopProperties properties;
    private final Clock clock;

    public PurchaseOrderService(PurchaseOrderRepository orderRepository, PurchaseOrderItemRepository itemRepository,
            ProductMaterialRepository materialRepository, ProductRepository productRepository,
            MaterialLifecycle materialLifecycle, OrderLifecycle orderLifecycle, ProgressCascade progressCascade,
            AggregateRecalculator recalculator, CascadeJournal journal, OperationRunner runner,
            AuditService auditService, Messages messages, WorkshopProperties properties, Clock clock) {
        this.orderRepository = orderRepository;
        this.itemRepository = itemRepository;
        this.materialRepository = materialRepository;
        this.productRepository = productRepository;
        this.materialLifecycle = materialLifecycle;
        this.orderLifecycle = orderLifecycle;
        this.progressCascade = progressCascade;
        this.recalculator = recalculator;
        this.journal = journal;
        this.runner = runner;
        this.auditService = auditService;
        this.messages = messages;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates a draft order from selected unordered materials. Materials with
     * the same name and unit are merged into one line.
     */
    public OperationResult<PurchaseOrder> createOrder(TenantContext ctx, CreateOrderRequest req) {
        return runner.run(ctx, "createOrder", () -> {
            String tenantId = ctx.tenantId();
            if (req == null || req.materialIds() == null || req.materialIds().isEmpty())
                throw new WorkshopException("order.create.no-materials");

            List<String> requested = req.materialIds().stream().distinct().sorted().collect(Collectors.toList());
            UnitOfWork uow = journal.begin(ctx, "create-order", requested);
            String resumedOrderId = uow.recorded("order");
            List<ProductMaterial> materials = materialRepository.findByTenantIdAndIdIn(tenantId, requested).stream()
                    .filter(m -> m.getStatus() == MaterialStatus.NOT_ORDERED)
                    .filter(m -> m.getOrderId() == null || m.getOrderId().equals(resumedOrderId))
                    .sorted(Comparator.comparing(ProductMaterial::getId))
                    .collect(Collectors.toList());
            if (materials.isEmpty())
                throw new WorkshopException("order.create.no-materials");

            Map<String, Product> products = productRepository
                    .findByTenantIdAndIdIn(tenantId,
                            materials.stream().map(ProductMaterial::getProductId).collect(Collectors.toSet()))
                    .stream().collect(Collectors.toMap(Product::getId, Function.identity()));

            Map<String, List<ProductMaterial>> groups = materials.stream()
                    .collect(Collectors.groupingBy(PurchaseOrderService::groupKey, LinkedHashMap::new,
                            Collectors.toList()));
            Map<String, PurchaseOrderItem> lines = new LinkedHashMap<>();
            groups.forEach((key, group) -> {
                PurchaseOrderItem line = mergeLine(group, products);
                if (line.getQuantity().signum() > 0)
                    lines.put(key, line);
            });
            if (lines.isEmpty())
                throw new WorkshopException("order.create.empty");

            String orderId = uow.create("order", () -> {
                PurchaseOrder order = new PurchaseOrder();
                order.setTenantId(tenantId);
                order.setOrderNumber(NumberGenerator.next(NumberGenerator.ORDER_PREFIX, LocalDate.now(clock)));
                order.setSupplierId(req.supplierId());
                order.setSupplierName(req.supplierName());
                order.setExpectedDelivery(req.expectedDelivery());
                order.setNotes(req.notes());
                order.setStatus(OrderStatus.DRAFT);
                return orderRepository.save(order).getId();
            });

            lines.forEach((key, line) -> uow.step("item:" + key, () -> {
                line.setTenantId(tenantId);
                line.setOrderId(orderId);
                itemRepository.save(line);
            }));

            // Reserve the materials so they no longer show up as unordered
            Set<String> lineMaterialIds = lines.values().stream()
                    .flatMap(l -> l.getProductMaterialIds().stream()).collect(Collectors.toSet());
            for (ProductMaterial m : materials) {
                if (lineMaterialIds.contains(m.getId()) && !orderId.equals(m.getOrderId())) {
                    m.setOrderId(orderId);
                    materialRepository.save(m);
                }
            }

            recalculator.recalculateOrderTotal(tenantId, orderId);
            uow.complete();

            PurchaseOrder order = loadWithItems(tenantId, orderId);
            auditService.log(ctx, "ORDER_CREATED",
                    "Order: " + order.getOrderNumber() + ", Items: " + order.getItems().size());
            logger.info("Created order {} with {} item(s) for tenant {}", order.getOrderNumber(),
                    order.getItems().size(), tenantId);
            return OperationResult.ok(order, messages.get("order.created", order.getOrderNumber()));
        });
    }

    /**
     * Sends a draft order: items and materials become ORDERED, waiting products
     * MATERIALS_ORDERED and approved projects IN_PRODUCTION.
     */
    public OperationResult<PurchaseOrder> sendOrder(TenantContext ctx, String orderId) {
        return runner.run(ctx, "sendOrder", () -> {
            PurchaseOrder order = sendInternal(ctx, findOrder(ctx.tenantId(), orderId));
            return OperationResult.ok(order, messages.get("order.sent", order.getOrderNumber()));
        });
    }

    private PurchaseOrder sendInternal(TenantContext ctx, PurchaseOrder order) {
        String tenantId = ctx.tenantId();
        List<PurchaseOrderItem> items = itemRepository.findByTenantIdAndOrderId(tenantId, order.getId());
        if (items.isEmpty())
            throw new WorkshopException("order.send.no-items");
        OrderStatus next = orderLifecycle.fire(order.getStatus(), OrderEvent.SEND);

        Map<String, ProductMaterial> materials = materialsOf(tenantId, items);
        Set<String> productIds = new HashSet<>();
        for (PurchaseOrderItem item : items) {
            if (item.getStatus() == OrderItemStatus.PENDING) {
                item.setStatus(OrderItemStatus.ORDERED);
                itemRepository.save(item);
            }
            for (String materialId : item.getProductMaterialIds()) {
                ProductMaterial m = materials.get(materialId);
                if (m == null) {
                    logger.warn("Order item {} references missing material {}", item.getId(), materialId);
                    continue;
                }
                if (materialLifecycle.order(m, order.getId(), m.getQuantity()))
                    materialRepository.save(m);
                productIds.add(m.getProductId());
            }
        }
        progressCascade.materialsOrdered(tenantId, productIds);

        if (order.getStatus() != next) {
            order.setStatus(next);
            order.setSentAt(LocalDateTime.now(clock));
            orderRepository.save(order);
            auditService.log(ctx, "ORDER_SENT", "Order: " + order.getOrderNumber());
        }
        order.setItems(items);
        return order;
    }

    /**
     * Receives the selected items (all items when none are given). The order
     * becomes RECEIVED once every item is, and products whose materials are all
     * in hand move to MATERIALS_READY.
     */
    public OperationResult<ReceiveItemsResult> receiveItems(TenantContext ctx, String orderId, List<String> itemIds) {
        return runner.run(ctx, "receiveItems", () -> {
            PurchaseOrder order = findOrder(ctx.tenantId(), orderId);
            ReceiveItemsResult result = receiveInternal(ctx, order, itemIds);
            return OperationResult.ok(result, messages.get("order.items-received", result.receivedCount()));
        });
    }

    private ReceiveItemsResult receiveInternal(TenantContext ctx, PurchaseOrder order, List<String> itemIds) {
        String tenantId = ctx.tenantId();
        if (order.getStatus() == OrderStatus.DRAFT)
            throw new WorkshopException("order.receive.not-sent", order.getOrderNumber());

        List<PurchaseOrderItem> items = itemRepository.findByTenantIdAndOrderId(tenantId, order.getId());
        List<PurchaseOrderItem> selected = itemIds == null || itemIds.isEmpty()
                ? items
                : items.stream().filter(i -> itemIds.contains(i.getId())).collect(Collectors.toList());
        if (selected.isEmpty())
            throw new WorkshopException("order.receive.no-items");

        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, ProductMaterial> materials = materialsOf(tenantId, selected);
        Set<String> touchedProducts = new HashSet<>();
        int received = 0;
        for (PurchaseOrderItem item : selected) {
            if (item.getStatus() != OrderItemStatus.RECEIVED) {
                item.setStatus(OrderItemStatus.RECEIVED);
                item.setReceivedAt(now);
                item.setReceivedQuantity(item.getQuantity());
                itemRepository.save(item);
                received++;
            }
            for (String materialId : item.getProductMaterialIds()) {
                ProductMaterial m = materials.get(materialId);
                if (m == null)
                    continue;
                if (materialLifecycle.receive(m, now))
                    materialRepository.save(m);
                touchedProducts.add(m.getProductId());
            }
        }

        if (orderLifecycle.allReceived(items)) {
            OrderStatus next = orderLifecycle.fire(order.getStatus(), OrderEvent.RECEIVE_ALL);
            if (next != order.getStatus()) {
                order.setStatus(next);
                orderRepository.save(order);
                auditService.log(ctx, "ORDER_RECEIVED", "Order: " + order.getOrderNumber());
            }
        }

        List<String> promoted = progressCascade.materialsReceived(tenantId, touchedProducts);
        logger.info("Received {} item(s) of order {}, {} product(s) now have all materials", received,
                order.getOrderNumber(), promoted.size());
        return new ReceiveItemsResult(received, orderLifecycle.displayStatus(order.getStatus(), items), promoted);
    }

    /**
     * Generic status change. Moving back to DRAFT discards order progress and
     * therefore needs {@code confirmed}.
     */
    public OperationResult<PurchaseOrder> changeStatus(TenantContext ctx, String orderId, OrderStatus target,
            boolean confirmed) {
        return runner.run(ctx, "changeOrderStatus", () -> {
            if (target == null)
                throw new WorkshopException("order.status-required");
            PurchaseOrder order = findOrder(ctx.tenantId(), orderId);
            OrderEvent event = orderLifecycle.eventFor(order.getStatus(), target);
            // Validate against the table before any cascade runs
            orderLifecycle.fire(order.getStatus(), event);
            switch (event) {
                case SEND:
                    sendInternal(ctx, order);
                    break;
                case RECEIVE_ALL:
                    receiveInternal(ctx, order, null);
                    break;
                case REVERT_TO_DRAFT:
                    revertToDraft(ctx, order, confirmed);
                    break;
            }
            PurchaseOrder updated = loadWithItems(ctx.tenantId(), orderId);
            return OperationResult.ok(updated, messages.get("order.status-changed", updated.getOrderNumber(),
                    orderLifecycle.displayStatus(updated.getStatus(), updated.getItems())));
        });
    }

    private void revertToDraft(TenantContext ctx, PurchaseOrder order, boolean confirmed) {
        if (!confirmed)
            throw new WorkshopException("order.revert.confirm");
        String tenantId = ctx.tenantId();
        List<PurchaseOrderItem> items = itemRepository.findByTenantIdAndOrderId(tenantId, order.getId());
        Map<String, ProductMaterial> materials = materialsOf(tenantId, items);
        for (PurchaseOrderItem item : items) {
            if (item.getStatus() == OrderItemStatus.RECEIVED)
                continue;
            for (String materialId : item.getProductMaterialIds()) {
                ProductMaterial m = materials.get(materialId);
                if (m != null && materialLifecycle.revertToPending(m))
                    materialRepository.save(m);
            }
            if (item.getStatus() != OrderItemStatus.PENDING) {
                item.setStatus(OrderItemStatus.PENDING);
                itemRepository.save(item);
            }
        }
        OrderStatus next = orderLifecycle.fire(order.getStatus(), OrderEvent.REVERT_TO_DRAFT);
        if (next != order.getStatus()) {
            order.setStatus(next);
            order.setSentAt(null);
            orderRepository.save(order);
            auditService.log(ctx, "ORDER_REVERTED", "Order: " + order.getOrderNumber());
        }
    }

    /**
     * Edits quantities of non-received items. All values are validated before
     * anything is written. On a sent order the change is spread evenly over
     * the ordered quantity of the item's materials.
     */
    public OperationResult<PurchaseOrder> updateItemQuantities(TenantContext ctx, String orderId,
            Map<String, BigDecimal> quantities) {
        return runner.run(ctx, "updateItemQuantities", () -> {
            String tenantId = ctx.tenantId();
            if (quantities == null || quantities.isEmpty())
                throw new WorkshopException("order.quantities.empty");
            PurchaseOrder order = findOrder(tenantId, orderId);
            Map<String, PurchaseOrderItem> items = itemRepository.findByTenantIdAndOrderId(tenantId, orderId)
                    .stream().collect(Collectors.toMap(PurchaseOrderItem::getId, Function.identity()));

            BigDecimal max = properties.getMaxOrderQuantity();
            SortedMap<String, BigDecimal> requested = new TreeMap<>(quantities);
            for (Map.Entry<String, BigDecimal> e : requested.entrySet()) {
                PurchaseOrderItem item = items.get(e.getKey());
                if (item == null)
                    throw new ResourceNotFoundException("order item", e.getKey());
                if (item.getStatus() == OrderItemStatus.RECEIVED)
                    throw new WorkshopException("order.quantities.received", item.getMaterialName());
                BigDecimal q = e.getValue();
                if (q == null || q.signum() <= 0 || q.compareTo(max) > 0)
                    throw new WorkshopException("order.quantities.range", item.getMaterialName(), max);
            }

            UnitOfWork uow = journal.begin(ctx, "edit-quantities", orderId, requested);
            for (Map.Entry<String, BigDecimal> e : requested.entrySet()) {
                PurchaseOrderItem item = items.get(e.getKey());
                BigDecimal delta = e.getValue().subtract(item.getQuantity());
                List<String> materialIds = item.getProductMaterialIds();
                // Materials first: the item keeps its old quantity until they are all adjusted
                if (order.getStatus() == OrderStatus.SENT && delta.signum() != 0 && !materialIds.isEmpty()) {
                    BigDecimal share = delta.divide(BigDecimal.valueOf(materialIds.size()), 4, RoundingMode.HALF_UP);
                    for (String materialId : materialIds) {
                        uow.step("material:" + item.getId() + ":" + materialId,
                                () -> adjustOrderedQuantity(tenantId, materialId, share));
                    }
                }
                uow.step("item:" + item.getId(), () -> {
                    item.setQuantity(e.getValue());
                    itemRepository.save(item);
                });
            }
            recalculator.recalculateOrderTotal(tenantId, orderId);
            uow.complete();

            PurchaseOrder updated = loadWithItems(tenantId, orderId);
            auditService.log(ctx, "ORDER_QUANTITIES_UPDATED",
                    "Order: " + updated.getOrderNumber() + ", Items: " + requested.keySet());
            return OperationResult.ok(updated, messages.get("order.quantities.updated", requested.size()));
        });
    }

    private void adjustOrderedQuantity(String tenantId, String materialId, BigDecimal share) {
        ProductMaterial m = materialRepository.findByIdAndTenantId(materialId, tenantId).orElse(null);
        if (m == null) {
            logger.warn("Skipping ordered quantity change of missing material {}", materialId);
            return;
        }
        BigDecimal base = m.getOrderedQuantity() != null ? m.getOrderedQuantity() : m.getQuantity();
        m.setOrderedQuantity(base.add(share));
        materialRepository.save(m);
    }

    /**
     * Deletes the selected items. Received items are skipped and reported; when
     * nothing but received items was selected the call fails without changes.
     */
    public OperationResult<DeleteItemsResult> deleteItems(TenantContext ctx, String orderId, List<String> itemIds) {
        return runner.run(ctx, "deleteOrderItems", () -> {
            String tenantId = ctx.tenantId();
            if (itemIds == null || itemIds.isEmpty())
                throw new WorkshopException("order.items.none-selected");
            PurchaseOrder order = findOrder(tenantId, orderId);
            List<PurchaseOrderItem> selected = itemRepository.findByTenantIdAndOrderIdAndIdIn(tenantId, orderId,
                    itemIds);
            if (selected.isEmpty())
                throw new WorkshopException("order.items.none-selected");

            List<String> skipped = selected.stream()
                    .filter(i -> i.getStatus() == OrderItemStatus.RECEIVED)
                    .map(PurchaseOrderItem::getMaterialName)
                    .collect(Collectors.toList());
            List<PurchaseOrderItem> deletable = selected.stream()
                    .filter(i -> i.getStatus() != OrderItemStatus.RECEIVED)
                    .collect(Collectors.toList());
            if (deletable.isEmpty())
                throw new WorkshopException("order.items.all-received");

            Map<String, ProductMaterial> materials = materialsOf(tenantId, deletable);
            for (ProductMaterial m : materials.values()) {
                if (orderId.equals(m.getOrderId()) && materialLifecycle.giveBack(m))
                    materialRepository.save(m);
            }
            itemRepository.deleteAll(deletable);
            recalculator.recalculateOrderTotal(tenantId, orderId);

            boolean empty = itemRepository.findByTenantIdAndOrderId(tenantId, orderId).isEmpty();
            auditService.log(ctx, "ORDER_ITEMS_DELETED",
                    "Order: " + order.getOrderNumber() + ", Deleted: " + deletable.size() + ", Skipped: "
                            + skipped.size());
            String message = skipped.isEmpty()
                    ? messages.get("order.items.deleted", deletable.size())
                    : messages.get("order.items.deleted-skipped", deletable.size(), String.join(", ", skipped));
            return OperationResult.ok(new DeleteItemsResult(deletable.size(), skipped, empty), message);
        });
    }

    /**
     * Deletes an order with its items. Outstanding materials are either reset
     * to NOT_ORDERED or marked received, as chosen by the caller.
     */
    public OperationResult<Void> deleteOrder(TenantContext ctx, String orderId, MaterialDisposal disposal) {
        return runner.run(ctx, "deleteOrder", () -> {
            String tenantId = ctx.tenantId();
            if (disposal == null)
                throw new WorkshopException("order.delete.disposal-required");
            PurchaseOrder order = findOrder(tenantId, orderId);
            List<PurchaseOrderItem> items = itemRepository.findByTenantIdAndOrderId(tenantId, orderId);
            Map<String, ProductMaterial> materials = materialsOf(tenantId, items);

            LocalDateTime now = LocalDateTime.now(clock);
            Set<String> touchedProducts = new HashSet<>();
            for (ProductMaterial m : materials.values()) {
                if (!materialLifecycle.isOutstanding(m.getStatus())) {
                    if (orderId.equals(m.getOrderId())) {
                        m.setOrderId(null);
                        materialRepository.save(m);
                    }
                    continue;
                }
                if (disposal == MaterialDisposal.RESET) {
                    materialLifecycle.giveBack(m);
                } else {
                    materialLifecycle.receive(m, now);
                    m.setOrderId(null);
                    touchedProducts.add(m.getProductId());
                }
                materialRepository.save(m);
            }
            if (disposal == MaterialDisposal.MARK_RECEIVED)
                progressCascade.materialsReceived(tenantId, touchedProducts);

            itemRepository.deleteAll(items);
            orderRepository.delete(order);
            auditService.log(ctx, "ORDER_DELETED", "Order: " + order.getOrderNumber() + ", Materials: " + disposal);
            logger.info("Deleted order {} ({} materials, disposal {})", order.getOrderNumber(), materials.size(),
                    disposal);
            return OperationResult.ok(null, messages.get("order.deleted", order.getOrderNumber()));
        });
    }

    public OperationResult<OrderView> getOrder(TenantContext ctx, String orderId) {
        return runner.run(ctx, "getOrder", () -> {
            PurchaseOrder order = loadWithItems(ctx.tenantId(), orderId);
            return OperationResult.ok(new OrderView(order,
                    orderLifecycle.displayStatus(order.getStatus(), order.getItems())), "");
        });
    }

    public OperationResult<List<OrderView>> listOrders(TenantContext ctx) {
        return runner.run(ctx, "listOrders", () -> {
            Map<String, List<PurchaseOrderItem>> itemsByOrder = itemRepository.findByTenantId(ctx.tenantId())
                    .stream().collect(Collectors.groupingBy(PurchaseOrderItem::getOrderId));
            List<OrderView> views = orderRepository.findByTenantId(ctx.tenantId()).stream()
                    .sorted(Comparator.comparing(PurchaseOrder::getOrderDate).reversed())
                    .map(o -> {
                        o.setItems(itemsByOrder.getOrDefault(o.getId(), new ArrayList<>()));
                        return new OrderView(o, orderLifecycle.displayStatus(o.getStatus(), o.getItems()));
                    })
                    .collect(Collectors.toList());
            return OperationResult.ok(views, "");
        });
    }

    private PurchaseOrder findOrder(String tenantId, String orderId) {
        return orderRepository.findByIdAndTenantId(orderId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("order", orderId));
    }

    private PurchaseOrder loadWithItems(String tenantId, String orderId) {
        PurchaseOrder order = findOrder(tenantId, orderId);
        order.setItems(itemRepository.findByTenantIdAndOrderId(tenantId, orderId));
        return order;
    }

    private Map<String, ProductMaterial> materialsOf(String tenantId, List<PurchaseOrderItem> items) {
        Set<String> ids = items.stream().flatMap(i -> i.getProductMaterialIds().stream())
                .collect(Collectors.toSet());
        if (ids.isEmpty())
            return Map.of();
        return materialRepository.findByTenantIdAndIdIn(tenantId, ids).stream()
                .collect(Collectors.toMap(ProductMaterial::getId, Function.identity()));
    }

    static String groupKey(ProductMaterial m) {
        String name = m.getMaterialName() != null ? m.getMaterialName().trim().toLowerCase(Locale.ROOT) : "";
        String unit = m.getUnit() != null ? m.getUnit().trim().toLowerCase(Locale.ROOT) : "";
        return name + "|" + unit;
    }

    private static PurchaseOrderItem mergeLine(List<ProductMaterial> group, Map<String, Product> products) {
        ProductMaterial first = group.get(0);
        Product product = products.get(first.getProductId());

        PurchaseOrderItem line = new PurchaseOrderItem();
        line.setMaterialName(first.getMaterialName().trim());
        line.setUnit(first.getUnit());
        line.setProductId(first.getProductId());
        line.setProductName(product != null ? product.getName() : null);
        line.setProjectId(product != null ? product.getProjectId() : null);
        line.setStatus(OrderItemStatus.PENDING);
        line.setQuantity(group.stream().map(ProductMaterial::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add));
        line.setExpectedPrice(group.stream()
                .map(m -> m.getTotalPrice() != null ? m.getTotalPrice() : BigDecimal.ZERO)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        line.setProductMaterialIds(group.stream().map(ProductMaterial::getId).collect(Collectors.toList()));
        return line;
    }
}
