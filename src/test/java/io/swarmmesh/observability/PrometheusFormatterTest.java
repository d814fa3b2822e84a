package io.swarmmesh.observability;

import io.swarmmesh.distribution.DistributionMetrics;
import io.swarmmesh.model.MessagePriority;
import io.swarmmesh.runtime.CommunicationMetrics;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void formatsGaugesWithSingleHeaderPerMetric() {
        String text = PrometheusFormatter.format(comms(), tasks());

        Assertions.assertTrue(text.contains("swarmmesh_nodes{status=\"online\"} 3\n"));
        Assertions.assertTrue(text.contains("swarmmesh_nodes{status=\"offline\"} 1\n"));
        Assertions.assertTrue(text.contains("swarmmesh_message_queue_depth{priority=\"high\"} 4\n"));
        Assertions.assertTrue(text.contains("swarmmesh_message_queue_depth{priority=\"low\"} 0\n"));
        Assertions.assertTrue(text.contains("swarmmesh_network_health 0.7500\n"));
        Assertions.assertTrue(text.contains("swarmmesh_tasks{state=\"completed\"} 8\n"));
        Assertions.assertTrue(text.contains("swarmmesh_task_success_rate 0.8000\n"));
        Assertions.assertTrue(text.contains("swarmmesh_agent_utilization{agent=\"worker-1\"} 0.5000\n"));
        Assertions.assertEquals(1, occurrences(text, "# HELP swarmmesh_nodes "));
        Assertions.assertEquals(1, occurrences(text, "# TYPE swarmmesh_tasks gauge"));
    }

    @Test
    void namespaceLabelIsInjectedIntoEverySample() {
        String text = PrometheusFormatter.format(comms(), tasks(), " prod ");

        Assertions.assertTrue(text.contains("swarmmesh_nodes{namespace=\"prod\",status=\"online\"} 3\n"));
        Assertions.assertTrue(text.contains("swarmmesh_network_health{namespace=\"prod\"} 0.7500\n"));
        Assertions.assertTrue(text.contains("# HELP swarmmesh_network_health "));
        for (String line : text.split("\n")) {
            if (!line.isBlank() && !line.startsWith("#")) {
                Assertions.assertTrue(line.contains("namespace=\"prod\""), line);
            }
        }
        Assertions.assertEquals(PrometheusFormatter.format(comms(), tasks()),
                PrometheusFormatter.format(comms(), tasks(), "  "));
    }

    private static CommunicationMetrics comms() {
        return new CommunicationMetrics(
                "hub", 4, 3, 0, 1, 4,
                Map.of(MessagePriority.HIGH, 4),
                12, 2, 1, 40L, 38L, 4_096L, 1L, 0.75);
    }

    private static DistributionMetrics tasks() {
        return new DistributionMetrics(
                11L, 1, 0, 8L, 2L, 0L, 2L,
                120.0, 900.0, 8.0, 0.8, 0.9, 0.25,
                Map.of("worker-1", 0.5));
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
