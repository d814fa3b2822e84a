package io.swarmmesh.cli;

import io.swarmmesh.config.SwarmMeshConfig;
import io.swarmmesh.config.SwarmSettings;
import io.swarmmesh.observability.EventJournal;
import io.swarmmesh.observability.PrometheusFormatter;
import io.swarmmesh.runtime.SwarmScheduler;
import io.swarmmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(
        name = "swarmmesh",
        mixinStandardHelpOptions = true,
        description = "SwarmMesh coordination runtime CLI",
        subcommands = {
                SwarmMeshCommand.SimulateCommand.class,
                SwarmMeshCommand.RunCommand.class,
                SwarmMeshCommand.SettingsCommand.class,
                SwarmMeshCommand.JournalVerifyCommand.class,
                SwarmMeshCommand.MetricsCommand.class
        }
)
public final class SwarmMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: simulate | run | settings | journal-verify | metrics");
    }

    SwarmMeshConfig config() {
        return SwarmMeshConfig.fromRoot(root);
    }

    SwarmSettings settings() {
        return SwarmSettings.load(config());
    }

    EventJournal journal(SwarmSettings settings) {
        return new EventJournal(config().journalFile(), settings.journalSigningSecret());
    }

    @Command(name = "simulate", description = "Run a scenario on an in-memory cluster in simulated time")
    static final class SimulateCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--scenario"}, required = true, description = "Scenario JSON file")
        Path scenario;

        @Option(names = {"--ticks"}, defaultValue = "600", description = "Number of simulation steps")
        int ticks;

        @Option(names = {"--tick-ms"}, defaultValue = "100", description = "Simulated milliseconds per step")
        long tickMs;

        @Option(names = {"--no-journal"}, description = "Do not append events to the journal")
        boolean noJournal;

        @Override
        public Integer call() {
            SwarmSettings settings = parent.settings();
            ScenarioRunner runner = new ScenarioRunner(settings, ScenarioFile.load(scenario),
                    noJournal ? null : parent.journal(settings));
            ScenarioRunner.ScenarioReport report = runner.simulate(Math.max(1, ticks), Math.max(1L, tickMs));
            runner.shutdown();
            System.out.println(Jsons.toJson(report));
            return 0;
        }
    }

    @Command(name = "run", description = "Run a scenario on an in-memory cluster against the wall clock")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--scenario"}, required = true, description = "Scenario JSON file")
        Path scenario;

        @Option(names = {"--duration-ms"}, defaultValue = "10000", description = "How long to run")
        long durationMs;

        @Option(names = {"--no-journal"}, description = "Do not append events to the journal")
        boolean noJournal;

        @Override
        public Integer call() throws Exception {
            SwarmSettings settings = parent.settings();
            ScenarioRunner runner = new ScenarioRunner(settings, ScenarioFile.load(scenario),
                    noJournal ? null : parent.journal(settings));
            SwarmScheduler scheduler = new SwarmScheduler(runner::step, settings.messageTickMs());
            runner.start(System.currentTimeMillis());
            scheduler.start();
            try {
                Thread.sleep(Math.max(0L, durationMs));
                ScenarioRunner.ScenarioReport report = scheduler.submit(() -> {
                    ScenarioRunner.ScenarioReport out = runner.report();
                    runner.shutdown();
                    return out;
                }).get(5, TimeUnit.SECONDS);
                System.out.println(Jsons.toJson(report));
            } finally {
                scheduler.stop(5_000L);
            }
            return 0;
        }
    }

    @Command(name = "settings", description = "Print the resolved settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.settings().toView()));
            return 0;
        }
    }

    @Command(name = "journal-verify", description = "Verify the event journal hash chain")
    static final class JournalVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Override
        public Integer call() {
            SwarmSettings settings = parent.settings();
            EventJournal.VerifyOutcome out = EventJournal.verify(parent.config().journalFile(),
                    settings.journalSigningSecret());
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }

    @Command(name = "metrics", description = "Simulate a scenario and print Prometheus metrics of the coordinator")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        SwarmMeshCommand parent;

        @Option(names = {"--scenario"}, required = true, description = "Scenario JSON file")
        Path scenario;

        @Option(names = {"--ticks"}, defaultValue = "600", description = "Number of simulation steps")
        int ticks;

        @Option(names = {"--tick-ms"}, defaultValue = "100", description = "Simulated milliseconds per step")
        long tickMs;

        @Option(names = {"--namespace"}, description = "Optional namespace label added to every sample")
        String namespace;

        @Override
        public Integer call() {
            ScenarioRunner runner = new ScenarioRunner(parent.settings(), ScenarioFile.load(scenario), null);
            ScenarioRunner.ScenarioReport report = runner.simulate(Math.max(1, ticks), Math.max(1L, tickMs));
            runner.shutdown();
            System.out.print(PrometheusFormatter.format(report.communication(), report.distribution(), namespace));
            return 0;
        }
    }
}
