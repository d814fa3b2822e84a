package io.swarmmesh.cli;

import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.distribution.TaskView;
import io.swarmmesh.model.ConsensusResult;
import io.swarmmesh.model.TaskStatus;
import io.swarmmesh.observability.EventJournal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

final class ScenarioRunnerTest {

    @Test
    void twoNodeScenarioCompletesTasksAndConverges() throws Exception {
        ScenarioFile scenario = ScenarioFile.load(scenarioPath());
        ScenarioRunner runner = new ScenarioRunner(SwarmSettings.defaults(), scenario, null);
        try {
            ScenarioRunner.ScenarioReport report = runner.simulate(200, 100L);

            Assertions.assertEquals("hub", report.coordinator());
            Assertions.assertEquals(20_000L, report.elapsedMs());
            Map<String, TaskView> tasks = report.tasks().stream()
                    .collect(Collectors.toMap(TaskView::id, t -> t));
            Assertions.assertEquals(TaskStatus.COMPLETED, tasks.get("report").status());
            Assertions.assertEquals(TaskStatus.COMPLETED, tasks.get("essay").status());
            // Only worker-1 writes, and its first attempt fails once.
            Assertions.assertEquals("worker-1", tasks.get("essay").agentId());
            Assertions.assertEquals(1L, report.distribution().retriedAttempts());
            Assertions.assertEquals(2L, report.distribution().completedTasks());

            Long hubVersion = report.gossipVersions().get("hub").get("config");
            Assertions.assertNotNull(hubVersion);
            Assertions.assertEquals(hubVersion, report.gossipVersions().get("worker-1").get("config"));

            Assertions.assertFalse(report.consensus().isEmpty());
            Assertions.assertEquals(ConsensusResult.ACCEPTED, report.consensus().get(0).result());
            Assertions.assertNull(report.journalHash());
        } finally {
            runner.shutdown();
        }
    }

    @Test
    void journalRecordsCoordinatorEvents() throws Exception {
        Path root = Files.createTempDirectory("swarmmesh-scenario-");
        ScenarioRunner runner = null;
        try {
            EventJournal journal = new EventJournal(root.resolve("events.log"), "scenario-secret");
            runner = new ScenarioRunner(SwarmSettings.defaults(), ScenarioFile.load(scenarioPath()), journal);
            ScenarioRunner.ScenarioReport report = runner.simulate(50, 100L);

            Assertions.assertEquals(journal.currentHash(), report.journalHash());
            EventJournal.VerifyOutcome outcome = journal.verify();
            Assertions.assertTrue(outcome.valid(), outcome.reason());
            Assertions.assertTrue(outcome.entries() > 0);
            Assertions.assertFalse(report.events().isEmpty());
        } finally {
            if (runner != null) {
                runner.shutdown();
            }
            deleteRecursively(root);
        }
    }

    @Test
    void unknownCoordinatorIsRejected() {
        ScenarioFile scenario = new ScenarioFile(List.of("a"), "b", null, null, null, null, null, null);
        ScenarioRunner runner = new ScenarioRunner(SwarmSettings.defaults(), scenario, null);
        Assertions.assertThrows(IllegalArgumentException.class, () -> runner.start(0L));
        Assertions.assertThrows(IllegalStateException.class, () -> runner.step(100L));
    }

    static Path scenarioPath() throws Exception {
        return Path.of(ScenarioRunnerTest.class.getResource("/scenarios/two-node.json").toURI());
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
