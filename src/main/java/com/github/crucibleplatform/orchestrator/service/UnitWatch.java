package com.github.crucibleplatform.orchestrator.service;

/**
 * Running observation of a unit. Closing it stops signal delivery.
 *
 * @author crucible-platform
 */
public interface UnitWatch extends AutoCloseable {

    @Override
    void close();

}
