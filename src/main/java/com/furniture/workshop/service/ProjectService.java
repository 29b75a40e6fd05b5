package com.furniture.workshop.service;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.lifecycle.ProjectLifecycle;
import com.furniture.workshop.model.Offer;
import com.furniture.workshop.model.Project;
import com.furniture.workshop.model.ProjectStatus;
import com.furniture.workshop.repository.OfferRepository;
import com.furniture.workshop.repository.ProductRepository;
import com.furniture.workshop.repository.ProjectRepository;
import com.furniture.workshop.util.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ProjectService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final ProductRepository productRepository;
    private final OfferRepository offerRepository;
    private final ProductService productService;
    private final OfferService offerService;
    private final ProjectLifecycle projectLifecycle;
    private final OperationRunner runner;
    private final AuditService auditService;
    private final Messages messages;

    public ProjectService(ProjectRepository projectRepository, ProductRepository productRepository,
            OfferRepository offerRepository, ProductService productService, OfferService offerService,
            ProjectLifecycle projectLifecycle, OperationRunner runner, AuditService auditService,
            Messages messages) {
        this.projectRepository = projectRepository;
        this.productRepository = productRepository;
        this.offerRepository = offerRepository;
        this.productService = productService;
        this.offerService = offerService;
        this.projectLifecycle = projectLifecycle;
        this.runner = runner;
        this.auditService = auditService;
        this.messages = messages;
    }

    public OperationResult<Project> createProject(TenantContext ctx, Project req) {
        return runner.run(ctx, "createProject", () -> {
            validate(req);
            Project project = new Project();
            project.setTenantId(ctx.tenantId());
            project.setStatus(ProjectStatus.DRAFT);
            copy(req, project);
            Project saved = projectRepository.save(project);
            auditService.log(ctx, "PROJECT_CREATED", "Project: " + saved.getClientName());
            return OperationResult.ok(saved, messages.get("project.saved", saved.getClientName()));
        });
    }

    public OperationResult<Project> updateProject(TenantContext ctx, String projectId, Project req) {
        return runner.run(ctx, "updateProject", () -> {
            validate(req);
            Project project = findProject(ctx.tenantId(), projectId);
            copy(req, project);
            return OperationResult.ok(projectRepository.save(project),
                    messages.get("project.saved", project.getClientName()));
        });
    }

    private static void validate(Project req) {
        if (req == null || req.getClientName() == null || req.getClientName().isBlank())
            throw new WorkshopException("project.client-required");
    }

    private static void copy(Project from, Project to) {
        to.setClientName(from.getClientName().trim());
        to.setClientPhone(from.getClientPhone());
        to.setClientEmail(from.getClientEmail());
        to.setAddress(from.getAddress());
        to.setNotes(from.getNotes());
        to.setProductionMode(from.getProductionMode());
        to.setDeadline(from.getDeadline());
    }

    public OperationResult<Project> changeStatus(TenantContext ctx, String projectId, ProjectStatus target) {
        return runner.run(ctx, "changeProjectStatus", () -> {
            if (target == null)
                throw new WorkshopException("project.status-required");
            Project project = findProject(ctx.tenantId(), projectId);
            ProjectStatus before = project.getStatus();
            if (projectLifecycle.changeStatus(project, target)) {
                projectRepository.save(project);
                auditService.log(ctx, "PROJECT_STATUS_CHANGED",
                        "Project: " + project.getClientName() + ", " + before + " -> " + target);
            }
            return OperationResult.ok(project, messages.get("project.status-changed", project.getClientName(), target));
        });
    }

    /** Deletes the project with its products, materials and offers. */
    public OperationResult<Void> deleteProject(TenantContext ctx, String projectId) {
        return runner.run(ctx, "deleteProject", () -> {
            String tenantId = ctx.tenantId();
            Project project = findProject(tenantId, projectId);

            productService.deleteProducts(tenantId, productRepository.findByTenantIdAndProjectId(tenantId, projectId));
            List<Offer> offers = offerRepository.findByTenantIdAndProjectId(tenantId, projectId);
            offers.forEach(o -> offerService.deleteChildren(tenantId, o.getId()));
            offerRepository.deleteAll(offers);
            projectRepository.delete(project);

            logger.info("Deleted project {} with {} offer(s) for tenant {}", projectId, offers.size(), tenantId);
            auditService.log(ctx, "PROJECT_DELETED", "Project: " + project.getClientName());
            return OperationResult.ok(null, messages.get("project.deleted", project.getClientName()));
        });
    }

    public OperationResult<Project> getProject(TenantContext ctx, String projectId) {
        return runner.run(ctx, "getProject", () -> {
            String tenantId = ctx.tenantId();
            Project project = findProject(tenantId, projectId);
            project.setProducts(productRepository.findByTenantIdAndProjectId(tenantId, projectId));
            project.setOffers(offerRepository.findByTenantIdAndProjectId(tenantId, projectId));
            return OperationResult.ok(project, "");
        });
    }

    public OperationResult<List<Project>> listProjects(TenantContext ctx) {
        return runner.run(ctx, "listProjects",
                () -> OperationResult.ok(projectRepository.findByTenantId(ctx.tenantId()), ""));
    }

    private Project findProject(String tenantId, String projectId) {
        return projectRepository.findByIdAndTenantId(projectId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("project", projectId));
    }
}
