package io.swarmmesh.event;

import com.fasterxml.jackson.databind.JsonNode;
import io.swarmmesh.distribution.DistributionMetrics;
import io.swarmmesh.model.CancellationReason;
import io.swarmmesh.model.ConsensusResult;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.model.MessageType;
import io.swarmmesh.model.ProposalType;
import io.swarmmesh.model.TaskAssignment;
import io.swarmmesh.model.TaskComplexity;
import io.swarmmesh.model.TaskPriority;
import io.swarmmesh.model.VoteDecision;

import java.util.List;

public final class SwarmEvents {
    private SwarmEvents() {
    }

    public record NodeRegistered(String nodeId, String peerId, String address, int port) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.NODE_REGISTERED;
        }
    }

    public record NodeConnected(String nodeId, String peerId) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.NODE_CONNECTED;
        }
    }

    public record NodeDisconnected(String nodeId, String peerId) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.NODE_DISCONNECTED;
        }
    }

    public record AgentRegistered(String nodeId, String agentId, List<String> capabilities, int maxLoad) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.AGENT_REGISTERED;
        }
    }

    public record MessageSent(String nodeId, String messageId, MessageType messageType, MessagePriority priority,
                              List<String> recipients) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.MESSAGE_SENT;
        }
    }

    public record MessageReceived(String nodeId, String messageId, MessageType messageType, String sender) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.MESSAGE_RECEIVED;
        }
    }

    public record MessageFailed(String nodeId, String messageId, MessageType messageType, String error,
                                List<String> unreachable) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.MESSAGE_FAILED;
        }
    }

    public record TaskSubmitted(String nodeId, String taskId, TaskPriority priority, TaskComplexity complexity,
                                List<String> subtaskIds) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.TASK_SUBMITTED;
        }
    }

    public record TaskAssigned(String nodeId, String taskId, String agentId, TaskAssignment assignment) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.TASK_ASSIGNED;
        }
    }

    public record TaskProgress(String nodeId, String taskId, String agentId, double progress, String note) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.TASK_PROGRESS;
        }
    }

    public record TaskCompleted(String nodeId, String taskId, String agentId, JsonNode result) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.TASK_COMPLETED;
        }
    }

    public record TaskFailed(String nodeId, String taskId, String agentId, String error, boolean permanent,
                             int retriesLeft) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.TASK_FAILED;
        }
    }

    public record TaskCancelled(String nodeId, String taskId, CancellationReason reason) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.TASK_CANCELLED;
        }
    }

    public record TaskReassigned(String nodeId, String taskId, String previousAgentId, CancellationReason reason) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.TASK_REASSIGNED;
        }
    }

    public record ConsensusInitiated(String nodeId, String proposalId, ProposalType proposalType,
                                     List<String> participants) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.CONSENSUS_INITIATED;
        }
    }

    public record ConsensusReached(String nodeId, String proposalId, ConsensusResult result, int acceptVotes,
                                   int totalVotes, JsonNode value) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.CONSENSUS_REACHED;
        }
    }

    public record VoteCast(String nodeId, String proposalId, String voter, VoteDecision decision) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.VOTE_CAST;
        }
    }

    public record GossipStarted(String nodeId, String gossipKey, long version) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.GOSSIP_STARTED;
        }
    }

    public record MetricsUpdated(String nodeId, DistributionMetrics metrics) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.METRICS_UPDATED;
        }
    }

    public record Shutdown(String nodeId, long atMs) implements SwarmEvent {
        @Override
        public SwarmEventType type() {
            return SwarmEventType.SHUTDOWN;
        }
    }
}
