package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

/** Journal entry for one applied step of a multi-write cascade. */
@Entity
@Table(name = "cascade_steps")
@Data
public class CascadeStep {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false, length = 512)
    private String cascadeKey;

    @Column(nullable = false)
    private String stepName;

    private String resultRef; // e.g. id of a record created by the step

    private LocalDateTime appliedAt;

    @PrePersist
    protected void onCreate() {
        if (appliedAt == null)
            appliedAt = LocalDateTime.now();
    }
}
