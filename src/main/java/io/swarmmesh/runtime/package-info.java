/**
 * Runtime orchestration package.
 *
 * <p>{@link io.swarmmesh.runtime.SwarmRuntime} owns every per-node component and advances them
 * from a single step function. {@link io.swarmmesh.runtime.InMemoryNetwork} joins runtimes into a
 * process-local cluster, and {@link io.swarmmesh.runtime.SwarmScheduler} drives a runtime from the
 * wall clock.
 */
package io.swarmmesh.runtime;
