package com.furniture.workshop.service;

import com.furniture.workshop.dto.OfferRequest;
import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.IllegalTransitionException;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.lifecycle.ProjectLifecycle;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.OfferExtraRepository;
import com.furniture.workshop.repository.OfferProductRepository;
import com.furniture.workshop.repository.OfferRepository;
import com.furniture.workshop.repository.ProductRepository;
import com.furniture.workshop.repository.ProjectRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class OfferService {

    private static final Logger logger = LoggerFactory.getLogger(OfferService.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final OfferRepository offerRepository;
    private final OfferProductRepository offerProductRepository;
    private final OfferExtraRepository offerExtraRepository;
    private final ProjectRepository projectRepository;
    private final ProductRepository productRepository;
    private final ProjectLifecycle projectLifecycle;
    private final CascadeJournal journal;
    private final OperationRunner runner;
    private final AuditService auditService;
    private final Messages messages;
    private final Clock clock;

    public OfferService(OfferRepository offerRepository, OfferProductRepository offerProductRepository,
            OfferExtraRepository offerExtraRepository, ProjectRepository projectRepository,
            ProductRepository productRepository, ProjectLifecycle projectLifecycle, CascadeJournal journal,
            OperationRunner runner, AuditService auditService, Messages messages, Clock clock) {
        this.offerRepository = offerRepository;
        this.offerProductRepository = offerProductRepository;
        this.offerExtraRepository = offerExtraRepository;
        this.projectRepository = projectRepository;
        this.productRepository = productRepository;
        this.projectLifecycle = projectLifecycle;
        this.journal = journal;
        this.runner = runner;
        this.auditService = auditService;
        this.messages = messages;
        this.clock = clock;
    }

    /**
     * Creates a draft offer for a project. Selling price is the product's
     * material cost plus the margin percentage; only included products count
     * towards the subtotal.
     */
    public OperationResult<Offer> createOffer(TenantContext ctx, OfferRequest req) {
        return runner.run(ctx, "createOffer", () -> {
            String tenantId = ctx.tenantId();
            if (req == null || req.projectId() == null)
                throw new WorkshopException("offer.project-required");
            if (req.products() == null || req.products().isEmpty())
                throw new WorkshopException("offer.no-products");
            Project project = projectRepository.findByIdAndTenantId(req.projectId(), tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("project", req.projectId()));

            Map<String, Product> products = productRepository.findByTenantIdAndProjectId(tenantId, project.getId())
                    .stream().collect(Collectors.toMap(Product::getId, Function.identity()));

            List<OfferProduct> lines = new ArrayList<>();
            for (OfferRequest.OfferProductRequest p : req.products()) {
                Product product = products.get(p.productId());
                if (product == null)
                    throw new ResourceNotFoundException("product", p.productId());
                lines.add(price(product, p));
            }

            BigDecimal subtotal = subtotal(lines);
            BigDecimal transport = nz(req.transportCost());
            BigDecimal discount = req.onsiteAssembly() ? nz(req.onsiteDiscount()) : BigDecimal.ZERO;

            UnitOfWork uow = journal.begin(ctx, "create-offer", project.getId(), req.validUntil(),
                    lines.stream().map(OfferProduct::getProductId).collect(Collectors.toList()));
            String offerId = uow.create("offer", () -> {
                Offer offer = new Offer();
                offer.setTenantId(tenantId);
                offer.setProjectId(project.getId());
                offer.setOfferNumber(NumberGenerator.next(NumberGenerator.OFFER_PREFIX, LocalDate.now(clock)));
                offer.setValidUntil(req.validUntil());
                offer.setStatus(OfferStatus.DRAFT);
                offer.setTransportCost(transport);
                offer.setOnsiteAssembly(req.onsiteAssembly());
                offer.setOnsiteDiscount(nz(req.onsiteDiscount()));
                offer.setSubtotal(subtotal);
                offer.setTotal(subtotal.add(transport).subtract(discount));
                offer.setNotes(req.notes());
                return offerRepository.save(offer).getId();
            });

            for (OfferProduct line : lines) {
                uow.step("product:" + line.getProductId(), () -> {
                    line.setTenantId(tenantId);
                    line.setOfferId(offerId);
                    OfferProduct saved = offerProductRepository.save(line);
                    for (OfferExtra extra : line.getExtras()) {
                        extra.setTenantId(tenantId);
                        extra.setOfferProductId(saved.getId());
                    }
                    offerExtraRepository.saveAll(line.getExtras());
                });
            }
            uow.complete();

            Offer offer = loadWithProducts(tenantId, offerId);
            auditService.log(ctx, "OFFER_CREATED", "Offer: " + offer.getOfferNumber() + ", Total: " + offer.getTotal());
            return OperationResult.ok(offer, messages.get("offer.created", offer.getOfferNumber()));
        });
    }

    static OfferProduct price(Product product, OfferRequest.OfferProductRequest req) {
        int quantity = req.quantity() != null && req.quantity() > 0 ? req.quantity()
                : (product.getQuantity() != null ? product.getQuantity() : 1);
        BigDecimal cost = nz(product.getMaterialCost());
        BigDecimal margin = nz(req.margin());
        BigDecimal selling = cost.multiply(BigDecimal.ONE.add(margin.divide(HUNDRED, 6, RoundingMode.HALF_UP)))
                .setScale(4, RoundingMode.HALF_UP);

        OfferProduct line = new OfferProduct();
        line.setProductId(product.getId());
        line.setProductName(product.getName());
        line.setQuantity(quantity);
        line.setIncluded(req.included());
        line.setMaterialCost(cost);
        line.setMargin(margin);
        line.setSellingPrice(selling);

        BigDecimal extrasTotal = BigDecimal.ZERO;
        if (req.extras() != null) {
            for (OfferRequest.OfferExtraRequest e : req.extras()) {
                if (e.name() == null || e.name().isBlank())
                    continue;
                OfferExtra extra = new OfferExtra();
                extra.setName(e.name());
                extra.setQuantity(nz(e.quantity()));
                extra.setUnit(e.unit());
                extra.setUnitPrice(nz(e.unitPrice()));
                extra.setTotal(extra.getQuantity().multiply(extra.getUnitPrice()).setScale(4, RoundingMode.HALF_UP));
                extrasTotal = extrasTotal.add(extra.getTotal());
                line.getExtras().add(extra);
            }
        }
        line.setTotalPrice(selling.multiply(BigDecimal.valueOf(quantity)).add(extrasTotal));
        return line;
    }

    static BigDecimal subtotal(List<OfferProduct> lines) {
        return lines.stream()
                .filter(OfferProduct::isIncluded)
                .map(OfferProduct::getTotalPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Changes an offer's status and carries the change to its project. The
     * sibling snapshot is taken before the offer is saved so the closed check
     * sees the in-flight status exactly once.
     */
    public OperationResult<Offer> changeStatus(TenantContext ctx, String offerId, OfferStatus target) {
        return runner.run(ctx, "changeOfferStatus", () -> {
            String tenantId = ctx.tenantId();
            if (target == null)
                throw new WorkshopException("offer.status-required");
            Offer offer = findOffer(tenantId, offerId);
            OfferStatus current = offer.getStatus();
            if (!current.canTransitionTo(target))
                throw new IllegalTransitionException("offer", current, target);

            List<Offer> siblings = offerRepository.findByTenantIdAndProjectId(tenantId, offer.getProjectId());
            Project project = projectRepository.findByIdAndTenantId(offer.getProjectId(), tenantId).orElse(null);

            if (current != target) {
                offer.setStatus(target);
                if (target == OfferStatus.ACCEPTED)
                    offer.setAcceptedAt(LocalDateTime.now(clock));
                offerRepository.save(offer);
            }

            if (target == OfferStatus.ACCEPTED) {
                for (Offer sibling : siblings) {
                    if (!sibling.getId().equals(offerId) && sibling.getStatus().isOpen()) {
                        sibling.setStatus(OfferStatus.SUPERSEDED);
                        offerRepository.save(sibling);
                        logger.info("Offer {} superseded by {}", sibling.getOfferNumber(), offer.getOfferNumber());
                    }
                }
            }

            if (project != null && projectChanged(project, siblings, offerId, target)) {
                projectRepository.save(project);
                logger.info("Project {} moved to {} after offer {} became {}", project.getId(), project.getStatus(),
                        offer.getOfferNumber(), target);
            }

            auditService.log(ctx, "OFFER_STATUS_CHANGED",
                    "Offer: " + offer.getOfferNumber() + ", " + current + " -> " + target);
            return OperationResult.ok(offer, messages.get("offer.status-changed", offer.getOfferNumber(), target));
        });
    }

    private boolean projectChanged(Project project, List<Offer> siblings, String offerId, OfferStatus target) {
        switch (target) {
            case SENT:
                return projectLifecycle.onOfferSent(project);
            case ACCEPTED:
                return projectLifecycle.onOfferAccepted(project);
            case REJECTED:
            case EXPIRED:
                return projectLifecycle.onOfferClosed(project, siblings, offerId, target);
            default:
                return false;
        }
    }

    public OperationResult<Void> deleteOffer(TenantContext ctx, String offerId) {
        return runner.run(ctx, "deleteOffer", () -> {
            String tenantId = ctx.tenantId();
            Offer offer = findOffer(tenantId, offerId);
            deleteChildren(tenantId, offerId);
            offerRepository.delete(offer);
            auditService.log(ctx, "OFFER_DELETED", "Offer: " + offer.getOfferNumber());
            return OperationResult.ok(null, messages.get("offer.deleted", offer.getOfferNumber()));
        });
    }

    /** Removes products and extras of an offer; shared with project deletion. */
    void deleteChildren(String tenantId, String offerId) {
        List<OfferProduct> lines = offerProductRepository.findByTenantIdAndOfferId(tenantId, offerId);
        if (lines.isEmpty())
            return;
        offerExtraRepository.deleteAll(offerExtraRepository.findByTenantIdAndOfferProductIdIn(tenantId,
                lines.stream().map(OfferProduct::getId).collect(Collectors.toList())));
        offerProductRepository.deleteAll(lines);
    }

    public OperationResult<Offer> getOffer(TenantContext ctx, String offerId) {
        return runner.run(ctx, "getOffer", () -> OperationResult.ok(loadWithProducts(ctx.tenantId(), offerId), ""));
    }

    private Offer findOffer(String tenantId, String offerId) {
        return offerRepository.findByIdAndTenantId(offerId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("offer", offerId));
    }

    private Offer loadWithProducts(String tenantId, String offerId) {
        Offer offer = findOffer(tenantId, offerId);
        List<OfferProduct> lines = offerProductRepository.findByTenantIdAndOfferId(tenantId, offerId);
        if (!lines.isEmpty()) {
            Map<String, List<OfferExtra>> extras = offerExtraRepository
                    .findByTenantIdAndOfferProductIdIn(tenantId,
                            lines.stream().map(OfferProduct::getId).collect(Collectors.toList()))
                    .stream().collect(Collectors.groupingBy(OfferExtra::getOfferProductId));
            lines.forEach(l -> l.setExtras(new ArrayList<>(extras.getOrDefault(l.getId(), List.of()))));
        }
        offer.setProducts(lines);
        return offer;
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
