package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.ResourceId;

/**
 * Resource storage SPI (e.g. file system or version-control adapter).
 *
 * <p>Worker sessions read resource content through {@link #read(ResourceId)};
 * the result aggregator writes merged outputs through {@link #write(ResourceId, String)}
 * once a task has been merged without conflicts.</p>
 *
 * <p>Calls may block on I/O. Implementations must be thread-safe because sessions
 * read concurrently.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResourceProvider {

    /**
     * Reads the current content of a resource.
     *
     * @param resourceId the resource
     * @return content (never null; empty for an empty resource)
     * @throws IllegalArgumentException if resourceId is null
     * @throws IllegalStateException if the resource does not exist
     */
    String read(ResourceId resourceId);

    /**
     * Writes new content for a resource.
     *
     * @param resourceId the resource
     * @param content new content
     * @throws IllegalArgumentException if resourceId or content is null
     */
    void write(ResourceId resourceId, String content);
}
