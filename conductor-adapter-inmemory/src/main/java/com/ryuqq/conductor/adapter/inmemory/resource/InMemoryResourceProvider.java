package com.ryuqq.conductor.adapter.inmemory.resource;

import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.spi.ResourceProvider;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ResourceProvider} SPI.
 *
 * <p>Holds resource content in a {@link ConcurrentHashMap} and keeps a log of every
 * write so tests can assert that nothing was written for a failed task.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryResourceProvider provider = new InMemoryResourceProvider();
 * provider.put(ResourceId.of("src/a.java"), "class A {}");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResourceProvider implements ResourceProvider {

    private final ConcurrentHashMap<ResourceId, String> contents = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<ResourceId> writeLog = new CopyOnWriteArrayList<>();

    @Override
    public String read(ResourceId resourceId) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        String content = contents.get(resourceId);
        if (content == null) {
            throw new IllegalStateException("Resource not found: " + resourceId);
        }
        return content;
    }

    @Override
    public void write(ResourceId resourceId, String content) {
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        contents.put(resourceId, content);
        writeLog.add(resourceId);
    }

    /**
     * Seeds a resource without recording a write.
     */
    public void put(ResourceId resourceId, String content) {
        contents.put(resourceId, content);
    }

    /**
     * Seeds several resources with the same content.
     */
    public void putAll(List<ResourceId> resourceIds, String content) {
        for (ResourceId resourceId : resourceIds) {
            put(resourceId, content);
        }
    }

    /**
     * Current content of a resource, or null if absent.
     */
    public String contentOf(ResourceId resourceId) {
        return contents.get(resourceId);
    }

    /**
     * Resources written through {@link #write(ResourceId, String)}, in write order.
     */
    public List<ResourceId> writes() {
        return List.copyOf(writeLog);
    }

    /**
     * Snapshot of all content.
     */
    public Map<ResourceId, String> snapshot() {
        return Map.copyOf(contents);
    }

    /**
     * Removes all content and the write log (for tests).
     */
    public void clear() {
        contents.clear();
        writeLog.clear();
    }
}
