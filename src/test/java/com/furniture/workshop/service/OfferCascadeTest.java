package com.furniture.workshop.service;

import com.furniture.workshop.dto.MaterialRequest;
import com.furniture.workshop.dto.OfferRequest;
import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.OfferProductRepository;
import com.furniture.workshop.repository.OfferRepository;
import com.furniture.workshop.repository.ProjectRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@SpringBootTest
public class OfferCascadeTest {

    @Autowired
    private OfferService offerService;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private ProductService productService;

    @Autowired
    private ProductMaterialService materialService;

    @Autowired
    private OfferRepository offerRepository;

    @Autowired
    private OfferProductRepository offerProductRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @MockBean
    private AuditService auditService;

    private TenantContext ctx;
    private Project project;
    private Product product;

    @BeforeEach
    void setUp() {
        ctx = new TenantContext("tenant-" + UUID.randomUUID(), "marko");
        Project req = new Project();
        req.setClientName("Kovac");
        project = projectService.createProject(ctx, req).data();

        Product p = new Product();
        p.setName("Wardrobe");
        product = productService.createProduct(ctx, project.getId(), p).data();
        materialService.addMaterial(ctx, product.getId(), new MaterialRequest(null, "Iverica 18mm", "board",
                new BigDecimal("10"), "m2", new BigDecimal("100"), null, false));
    }

    private Offer createOffer() {
        OfferRequest req = new OfferRequest(project.getId(), null, new BigDecimal("50"), true, new BigDecimal("100"),
                null, List.of(new OfferRequest.OfferProductRequest(product.getId(), 1, new BigDecimal("20"), true,
                        List.of(new OfferRequest.OfferExtraRequest("Handles", new BigDecimal("4"), "kom",
                                new BigDecimal("5"))))));
        OperationResult<Offer> result = offerService.createOffer(ctx, req);
        Assertions.assertTrue(result.success(), result.message());
        return result.data();
    }

    private ProjectStatus projectStatus() {
        return projectRepository.findById(project.getId()).orElseThrow().getStatus();
    }

    private OfferStatus offerStatus(Offer offer) {
        return offerRepository.findById(offer.getId()).orElseThrow().getStatus();
    }

    @Test
    void createOffer_pricesFromMaterialCost() {
        Offer offer = createOffer();

        // 1000 material cost + 20 % = 1200, extras 20, transport 50, onsite discount 100
        Assertions.assertEquals(OfferStatus.DRAFT, offer.getStatus());
        Assertions.assertEquals(0, new BigDecimal("1220").compareTo(offer.getSubtotal()));
        Assertions.assertEquals(0, new BigDecimal("1170").compareTo(offer.getTotal()));
        Assertions.assertEquals(1, offer.getProducts().size());
        Assertions.assertEquals(1, offer.getProducts().get(0).getExtras().size());
    }

    @Test
    void createOffer_rejectsProductOfAnotherProject() {
        Project otherReq = new Project();
        otherReq.setClientName("Babic");
        Project other = projectService.createProject(ctx, otherReq).data();

        OperationResult<Offer> result = offerService.createOffer(ctx, new OfferRequest(other.getId(), null, null,
                false, null, null, List.of(new OfferRequest.OfferProductRequest(product.getId(), 1, null, true,
                        null))));

        Assertions.assertFalse(result.success());
        Assertions.assertTrue(offerRepository.findByTenantIdAndProjectId(ctx.tenantId(), other.getId()).isEmpty());
    }

    @Test
    void sendingOfferMovesDraftProjectToOffered() {
        Offer offer = createOffer();

        OperationResult<Offer> result = offerService.changeStatus(ctx, offer.getId(), OfferStatus.SENT);

        Assertions.assertTrue(result.success(), result.message());
        Assertions.assertEquals(ProjectStatus.OFFERED, projectStatus());
    }

    @Test
    void closingLastOpenOfferCancelsProject() {
        Offer first = createOffer();
        Offer second = createOffer();
        offerService.changeStatus(ctx, first.getId(), OfferStatus.SENT);
        offerService.changeStatus(ctx, second.getId(), OfferStatus.SENT);

        offerService.changeStatus(ctx, first.getId(), OfferStatus.REJECTED);
        Assertions.assertEquals(ProjectStatus.OFFERED, projectStatus());

        OperationResult<Offer> result = offerService.changeStatus(ctx, second.getId(), OfferStatus.EXPIRED);
        Assertions.assertTrue(result.success(), result.message());
        Assertions.assertEquals(ProjectStatus.CANCELLED, projectStatus());
    }

    @Test
    void rejectingOfferKeepsApprovedProject() {
        projectService.changeStatus(ctx, project.getId(), ProjectStatus.APPROVED);
        Offer offer = createOffer();

        OperationResult<Offer> result = offerService.changeStatus(ctx, offer.getId(), OfferStatus.REJECTED);

        Assertions.assertTrue(result.success(), result.message());
        Assertions.assertEquals(OfferStatus.REJECTED, offerStatus(offer));
        Assertions.assertEquals(ProjectStatus.APPROVED, projectStatus());
    }

    @Test
    void acceptingOfferSupersedesSiblingsAndApprovesProject() {
        Offer accepted = createOffer();
        Offer sibling = createOffer();
        offerService.changeStatus(ctx, sibling.getId(), OfferStatus.SENT);

        OperationResult<Offer> result = offerService.changeStatus(ctx, accepted.getId(), OfferStatus.ACCEPTED);

        Assertions.assertTrue(result.success(), result.message());
        Assertions.assertNotNull(result.data().getAcceptedAt());
        Assertions.assertEquals(OfferStatus.SUPERSEDED, offerStatus(sibling));
        Assertions.assertEquals(ProjectStatus.APPROVED, projectStatus());
    }

    @Test
    void acceptedOfferCannotReturnToDraft() {
        Offer offer = createOffer();
        offerService.changeStatus(ctx, offer.getId(), OfferStatus.ACCEPTED);

        OperationResult<Offer> result = offerService.changeStatus(ctx, offer.getId(), OfferStatus.DRAFT);

        Assertions.assertFalse(result.success());
        Assertions.assertEquals(OfferStatus.ACCEPTED, offerStatus(offer));
    }

    @Test
    void deleteProject_removesOffersAndProducts() {
        Offer offer = createOffer();

        OperationResult<Void> result = projectService.deleteProject(ctx, project.getId());

        Assertions.assertTrue(result.success(), result.message());
        Assertions.assertTrue(offerRepository.findById(offer.getId()).isEmpty());
        Assertions.assertTrue(offerProductRepository.findByTenantIdAndOfferId(ctx.tenantId(), offer.getId()).isEmpty());
        Assertions.assertTrue(projectRepository.findById(project.getId()).isEmpty());
    }
}
