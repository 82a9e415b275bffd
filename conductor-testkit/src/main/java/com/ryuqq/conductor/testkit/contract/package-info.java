/**
 * Contract test support.
 *
 * <p>{@link com.ryuqq.conductor.testkit.contract.AbstractContractTest} wires a
 * {@link com.ryuqq.conductor.adapter.runner.DispatchScheduler} to in-memory SPIs and a
 * {@link com.ryuqq.conductor.testkit.contract.ScriptedResourceProcessor}. Adapter
 * implementers can extend it to run the orchestration contract against their own SPIs.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.conductor.testkit.contract;
