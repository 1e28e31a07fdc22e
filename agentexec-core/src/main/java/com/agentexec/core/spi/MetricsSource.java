package com.agentexec.core.spi;

import com.agentexec.core.model.ResourceSnapshot;

/**
 * Supplies current host resource pressure. May throw if the host cannot be queried.
 */
@FunctionalInterface
public interface MetricsSource {

    ResourceSnapshot sample();
}
