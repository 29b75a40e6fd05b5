package com.furniture.workshop.service;

import com.furniture.workshop.config.WorkshopProperties;
import com.furniture.workshop.model.AppSetting;
import com.furniture.workshop.model.ProductionStep;
import com.furniture.workshop.repository.AppSettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Tenant-level key/value settings with defaults from application properties. */
@Service
public class SettingsService {

    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    public static final String KEY_PRODUCTION_STEPS = "production_steps";

    private final AppSettingRepository appSettingRepository;
    private final WorkshopProperties properties;

    public SettingsService(AppSettingRepository appSettingRepository, WorkshopProperties properties) {
        this.appSettingRepository = appSettingRepository;
        this.properties = properties;
    }

    public Optional<String> getSetting(String tenantId, String key) {
        return appSettingRepository.findByTenantIdAndSettingKey(tenantId, key)
                .map(AppSetting::getSettingValue);
    }

    /**
     * Production steps used for new work orders, e.g. {@code CUTTING,EDGING}.
     * Unknown names are skipped; an empty result falls back to the defaults.
     */
    public List<ProductionStep> getProductionSteps(String tenantId) {
        List<ProductionStep> steps = getSetting(tenantId, KEY_PRODUCTION_STEPS)
                .map(val -> {
                    List<ProductionStep> parsed = new ArrayList<>();
                    for (String part : val.split(",")) {
                        String name = part.trim().toUpperCase(Locale.ROOT);
                        if (name.isEmpty())
                            continue;
                        try {
                            parsed.add(ProductionStep.valueOf(name));
                        } catch (IllegalArgumentException e) {
                            logger.warn("Ignoring unknown production step '{}' for tenant {}", name, tenantId);
                        }
                    }
                    return parsed;
                })
                .orElse(List.of());
        return steps.isEmpty() ? new ArrayList<>(properties.getDefaultProductionSteps()) : steps;
    }

    public void updateSetting(String tenantId, String key, String value) {
        Optional<AppSetting> existing = appSettingRepository.findByTenantIdAndSettingKey(tenantId, key);
        if (existing.isPresent()) {
            AppSetting setting = existing.get();
            setting.setSettingValue(value != null ? value : "");
            appSettingRepository.save(setting);
        } else {
            appSettingRepository.save(new AppSetting(tenantId, key, value != null ? value : ""));
        }
    }
}
