package com.github.crucibleplatform.orchestrator.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * @author crucible-platform
 */
public interface SettingsRepository extends JpaRepository<SettingsEntity, Long> {

    SettingsEntity findBySettingsKey(String key);

}
