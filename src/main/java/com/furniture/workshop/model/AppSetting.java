package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "app_settings")
@Data
public class AppSetting {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String settingKey;

    @Column(nullable = false)
    private String settingValue;

    public AppSetting() {
    }

    public AppSetting(String tenantId, String key, String value) {
        this.tenantId = tenantId;
        this.settingKey = key;
        this.settingValue = value;
    }
}
