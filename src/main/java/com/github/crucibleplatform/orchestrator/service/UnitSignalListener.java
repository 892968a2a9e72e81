package com.github.crucibleplatform.orchestrator.service;

import com.github.crucibleplatform.orchestrator.domain.UnitHandle;
import com.github.crucibleplatform.orchestrator.domain.UnitSignal;

/**
 * @author crucible-platform
 */
@FunctionalInterface
public interface UnitSignalListener {

    void onSignal(UnitHandle handle, UnitSignal signal);

}
