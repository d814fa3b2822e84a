/**
 * SwarmMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.swarmmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.swarmmesh.cli.SwarmMeshCommand} maps commands to scenario runs and journal checks.</li>
 *   <li>{@code io.swarmmesh.runtime.SwarmRuntime} wires routing, gossip, consensus and task distribution for one node.</li>
 *   <li>{@code io.swarmmesh.distribution.TaskDistributionEngine} owns the task lifecycle.</li>
 * </ul>
 */
package io.swarmmesh;
