package io.swarmmesh.observability;

import io.swarmmesh.distribution.DistributionMetrics;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.runtime.CommunicationMetrics;

import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(CommunicationMetrics comms, DistributionMetrics tasks) {
        return format(comms, tasks, null);
    }

    public static String format(CommunicationMetrics comms, DistributionMetrics tasks, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "swarmmesh_nodes", "Known peers grouped by derived status", "status", "online", comms.onlineNodes());
        appendGauge(sb, "swarmmesh_nodes", "Known peers grouped by derived status", "status", "degraded", comms.degradedNodes());
        appendGauge(sb, "swarmmesh_nodes", "Known peers grouped by derived status", "status", "offline", comms.offlineNodes());
        for (MessagePriority priority : MessagePriority.values()) {
            appendGauge(sb, "swarmmesh_message_queue_depth", "Outbound messages waiting per priority", "priority",
                    priority.wire(), comms.queueDepths().getOrDefault(priority, 0));
        }
        appendGauge(sb, "swarmmesh_message_history_size", "Messages retained in send history", null, null, comms.historySize());
        appendGauge(sb, "swarmmesh_messages_sent_total", "Messages forwarded to peers", null, null, comms.messagesSent());
        appendGauge(sb, "swarmmesh_messages_received_total", "Messages accepted from peers", null, null, comms.messagesReceived());
        appendGauge(sb, "swarmmesh_bytes_transferred_total", "Payload bytes exchanged with peers", null, null, comms.bytesTransferred());
        appendGauge(sb, "swarmmesh_message_errors_total", "Delivery and decode errors", null, null, comms.errors());
        appendGauge(sb, "swarmmesh_gossip_states", "Gossip keys held locally", null, null, comms.gossipStates());
        appendGauge(sb, "swarmmesh_consensus_active", "Unresolved consensus proposals", null, null, comms.activeConsensus());
        appendRatio(sb, "swarmmesh_network_health", "Fraction of peers not offline", null, null, comms.networkHealth());

        appendGauge(sb, "swarmmesh_tasks", "Tasks grouped by state", "state", "queued", tasks.queuedTasks());
        appendGauge(sb, "swarmmesh_tasks", "Tasks grouped by state", "state", "running", tasks.runningTasks());
        appendGauge(sb, "swarmmesh_tasks", "Tasks grouped by state", "state", "completed", tasks.completedTasks());
        appendGauge(sb, "swarmmesh_tasks", "Tasks grouped by state", "state", "failed", tasks.failedTasks());
        appendGauge(sb, "swarmmesh_tasks", "Tasks grouped by state", "state", "cancelled", tasks.cancelledTasks());
        appendGauge(sb, "swarmmesh_tasks_submitted_total", "Tasks and subtasks accepted", null, null, tasks.totalTasks());
        appendGauge(sb, "swarmmesh_task_retries_total", "Failed attempts that were requeued", null, null, tasks.retriedAttempts());
        appendRatio(sb, "swarmmesh_task_wait_ms", "Average queue wait before assignment", null, null, tasks.averageWaitTimeMs());
        appendRatio(sb, "swarmmesh_task_execution_ms", "Average assignment-to-completion time", null, null, tasks.averageExecutionTimeMs());
        appendRatio(sb, "swarmmesh_task_throughput_per_minute", "Completions in the last minute", null, null, tasks.throughputPerMinute());
        appendRatio(sb, "swarmmesh_task_success_rate", "Completed over completed plus failed", null, null, tasks.successRate());
        appendRatio(sb, "swarmmesh_load_balance_score", "One minus the stddev of agent utilization", null, null, tasks.loadBalance());
        appendRatio(sb, "swarmmesh_resource_efficiency", "Total agent load over total capacity", null, null, tasks.resourceEfficiency());
        appendMapRatio(sb, "swarmmesh_agent_utilization", "Current load over max load per agent", "agent", tasks.agentUtilization());

        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        String escapedNs = escapeLabel(normalizedNamespace);
        StringBuilder withNamespace = new StringBuilder(base.length() * 2);
        for (String line : base.split("\\r?\\n")) {
            if (line.isBlank() || line.startsWith("#")) {
                withNamespace.append(line).append('\n');
                continue;
            }
            int sep = line.lastIndexOf(' ');
            String sample = line.substring(0, sep);
            String value = line.substring(sep + 1);
            int brace = sample.indexOf('{');
            if (brace >= 0 && sample.endsWith("}")) {
                sample = sample.substring(0, brace + 1) + "namespace=\"" + escapedNs + "\"," + sample.substring(brace + 1);
            } else {
                sample = sample + "{namespace=\"" + escapedNs + "\"}";
            }
            withNamespace.append(sample).append(' ').append(value).append('\n');
        }
        return withNamespace.toString();
    }

    private static void appendMapRatio(StringBuilder sb, String metric, String help, String label, Map<String, Double> values) {
        header(sb, metric, help);
        for (Map.Entry<String, Double> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(decimal(e.getValue())).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, label, labelValue, Long.toString(value));
    }

    private static void appendRatio(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendSample(sb, metric, help, label, labelValue, decimal(value));
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String label, String labelValue, String value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            header(sb, metric, help);
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void header(StringBuilder sb, String metric, String help) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
