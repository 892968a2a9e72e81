package com.github.crucibleplatform.orchestrator.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author crucible-platform
 */
@Entity
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SettingsEntity {

    @Id
    @GeneratedValue
    private Long id;

    @Column(unique = true)
    private String settingsKey;

    private String settingsValue;

}
