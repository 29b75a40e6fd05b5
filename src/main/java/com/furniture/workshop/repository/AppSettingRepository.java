package com.furniture.workshop.repository;

import com.furniture.workshop.model.AppSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;

public interface AppSettingRepository extends JpaRepository<AppSetting, Long> {
    Optional<AppSetting> findByTenantIdAndSettingKey(String tenantId, String settingKey);
}
