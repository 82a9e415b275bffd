package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.core.model.ResourceId;
import com.ryuqq.conductor.core.spi.VerificationHook;
import com.ryuqq.conductor.core.spi.VerificationResult;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link VerificationHook} with a fixed verdict that records its invocations.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FakeVerificationHook implements VerificationHook {

    private final String name;
    private final VerificationResult verdict;
    private final CopyOnWriteArrayList<Set<ResourceId>> runs = new CopyOnWriteArrayList<>();

    private FakeVerificationHook(String name, VerificationResult verdict) {
        this.name = name;
        this.verdict = verdict;
    }

    public static FakeVerificationHook passing(String name) {
        return new FakeVerificationHook(name, VerificationResult.passed());
    }

    public static FakeVerificationHook failing(String name, String diagnostics) {
        return new FakeVerificationHook(name, VerificationResult.failed(diagnostics));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public VerificationResult run(Set<ResourceId> resources) {
        runs.add(Set.copyOf(resources));
        return verdict;
    }

    public List<Set<ResourceId>> runs() {
        return List.copyOf(runs);
    }

    public boolean wasRun() {
        return !runs.isEmpty();
    }
}
