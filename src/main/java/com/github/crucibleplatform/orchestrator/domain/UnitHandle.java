package com.github.crucibleplatform.orchestrator.domain;

/**
 * @author crucible-platform
 */
public record UnitHandle(String evaluationId, String unitName, String provider) {

    public String reference() {
        return provider + "://" + unitName;
    }

    public String outputReference() {
        return reference() + "/logs";
    }

}
