package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.ResourceId;

import java.util.Set;

/**
 * External verification SPI (e.g. type-check, lint).
 *
 * <p>An ordered list of hooks is supplied per deployment. The result aggregator runs
 * them sequentially after a conflict-free merge; the first failing hook fails the task
 * and its diagnostics are attached to the task's terminal record.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface VerificationHook {

    /**
     * Hook name used in diagnostics.
     *
     * @return non-blank name
     */
    String name();

    /**
     * Verifies the merged resources of a task.
     *
     * @param resources the task's resource set
     * @return verification result
     */
    VerificationResult run(Set<ResourceId> resources);
}
