package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.spi.ProcessedResource;
import com.ryuqq.conductor.core.spi.ResourceProcessor;
import com.ryuqq.conductor.core.spi.WorkingContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link ResourceProcessor} for contract tests.
 *
 * <p>Per resource, a test can script the consumed units, the output, facts, crashes and
 * a pause point. Every call is recorded so tests can check ordering, overlap and
 * concurrency.</p>
 *
 * <p><strong>Defaults:</strong> output = {@code content + OUTPUT_SUFFIX}, 1 unit, no facts.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * processor.units(ResourceId.of("a/big.java"), 900)
 *          .crashTimes(ResourceId.of("a/flaky.java"), 1)
 *          .delayMs(20);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedResourceProcessor implements ResourceProcessor {

    public static final String OUTPUT_SUFFIX = " // processed";

    private final Map<ResourceId, Long> units = new ConcurrentHashMap<>();
    private final Map<ResourceId, String> outputs = new ConcurrentHashMap<>();
    private final Map<ResourceId, Map<String, String>> facts = new ConcurrentHashMap<>();
    private final Map<ResourceId, AtomicInteger> crashesLeft = new ConcurrentHashMap<>();
    private final Map<ResourceId, Pause> pauses = new ConcurrentHashMap<>();
    private volatile long defaultUnits = 1;
    private volatile long delayMs;

    private final List<ResourceId> calls = new ArrayList<>();
    private final Set<ResourceId> inFlight = new HashSet<>();
    private final Set<ResourceId> overlapped = new LinkedHashSet<>();
    private final Map<ResourceId, Map<String, String>> seenFacts = new HashMap<>();
    private int maxConcurrent;

    @Override
    public ProcessedResource process(ResourceId resourceId, String content, WorkingContext context) {
        enter(resourceId, context);
        try {
            Pause pause = pauses.get(resourceId);
            if (pause != null) {
                pause.entered.countDown();
                awaitRelease(pause.release);
            }
            if (delayMs > 0) {
                sleep(delayMs);
            }
            AtomicInteger crashes = crashesLeft.get(resourceId);
            if (crashes != null && crashes.getAndUpdate(left -> Math.max(0, left - 1)) > 0) {
                throw new IllegalStateException("Scripted crash on " + resourceId);
            }
            String output = outputs.getOrDefault(resourceId, content + OUTPUT_SUFFIX);
            return new ProcessedResource(output, units.getOrDefault(resourceId, defaultUnits),
                facts.getOrDefault(resourceId, Map.of()));
        } finally {
            exit(resourceId);
        }
    }

    // ========== Script ==========

    public ScriptedResourceProcessor units(ResourceId resourceId, long consumed) {
        units.put(resourceId, consumed);
        return this;
    }

    public ScriptedResourceProcessor defaultUnits(long consumed) {
        this.defaultUnits = consumed;
        return this;
    }

    public ScriptedResourceProcessor output(ResourceId resourceId, String output) {
        outputs.put(resourceId, output);
        return this;
    }

    public ScriptedResourceProcessor fact(ResourceId resourceId, String key, String value) {
        facts.computeIfAbsent(resourceId, id -> new ConcurrentHashMap<>()).put(key, value);
        return this;
    }

    /**
     * The next {@code times} calls for the resource throw.
     */
    public ScriptedResourceProcessor crashTimes(ResourceId resourceId, int times) {
        crashesLeft.put(resourceId, new AtomicInteger(times));
        return this;
    }

    public ScriptedResourceProcessor delayMs(long delay) {
        this.delayMs = delay;
        return this;
    }

    /**
     * Blocks processing of the resource until {@code release} is counted down;
     * {@code entered} is counted down when processing starts.
     */
    public ScriptedResourceProcessor pauseOn(ResourceId resourceId, CountDownLatch entered, CountDownLatch release) {
        pauses.put(resourceId, new Pause(entered, release));
        return this;
    }

    // ========== Observations ==========

    /**
     * Every call in start order (a resource appears again when it is retried).
     */
    public synchronized List<ResourceId> calls() {
        return List.copyOf(calls);
    }

    public synchronized int callCount(ResourceId resourceId) {
        int count = 0;
        for (ResourceId call : calls) {
            if (call.equals(resourceId)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Highest number of resources processed at the same time.
     */
    public synchronized int maxConcurrent() {
        return maxConcurrent;
    }

    /**
     * Whether processing of the resource overlapped with any other call.
     */
    public synchronized boolean overlapped(ResourceId resourceId) {
        return overlapped.contains(resourceId);
    }

    /**
     * Facts visible in the working context when the resource was last processed.
     */
    public synchronized Map<String, String> factsSeenBy(ResourceId resourceId) {
        return seenFacts.getOrDefault(resourceId, Map.of());
    }

    private synchronized void enter(ResourceId resourceId, WorkingContext context) {
        calls.add(resourceId);
        seenFacts.put(resourceId, Map.copyOf(context.facts()));
        if (!inFlight.isEmpty()) {
            overlapped.add(resourceId);
            overlapped.addAll(inFlight);
        }
        inFlight.add(resourceId);
        maxConcurrent = Math.max(maxConcurrent, inFlight.size());
    }

    private synchronized void exit(ResourceId resourceId) {
        inFlight.remove(resourceId);
    }

    private static void awaitRelease(CountDownLatch release) {
        try {
            if (!release.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Pause was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while paused", e);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing", e);
        }
    }

    private record Pause(CountDownLatch entered, CountDownLatch release) {
    }
}
