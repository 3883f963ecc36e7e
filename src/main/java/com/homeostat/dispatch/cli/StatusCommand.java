package com.homeostat.dispatch.cli;

import com.homeostat.core.mode.ConstraintSet;
import com.homeostat.core.mode.ModeController;
import com.homeostat.core.mode.ModeSnapshot;
import com.homeostat.core.mode.ModeTransition;
import com.homeostat.core.sensor.MetricSampler;
import com.homeostat.core.sensor.MetricWindowCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * CLI command: homeostat status
 * <p>
 * Shows the active mode with its constraints, the latest metric sample and recent
 * transitions. {@code --export-window} writes the sampler's rolling window as JSON.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show operating mode and metrics")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--export-window", "-e"}, description = "Write the metric window as JSON to this file")
    private Path exportWindow;

    @Option(names = {"--history", "-n"}, description = "Transitions to show (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int historyLimit;

    private final ModeController modeController;
    private final MetricSampler sampler;
    private final MetricWindowCodec codec;

    public StatusCommand(ModeController modeController, MetricSampler sampler, MetricWindowCodec codec) {
        this.modeController = modeController;
        this.sampler = sampler;
        this.codec = codec;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        ModeSnapshot snapshot = modeController.current();
        ConsoleOutput.mode(snapshot.mode(), "since " + snapshot.since() + " (cause: " + snapshot.cause()
                + ", version " + snapshot.version() + ")");
        modeController.pendingApproval().ifPresent(id ->
                ConsoleOutput.info("Transition awaiting approval " + id));

        ConstraintSet c = snapshot.constraints();
        System.out.println();
        System.out.println("CONSTRAINTS:");
        System.out.printf("  %-20s %s%n", "Categories", String.join(", ", new TreeSet<>(c.allowedCategories())));
        System.out.printf("  %-20s %s%n", "Needs approval", orNone(new TreeSet<>(c.approvalCategories())));
        System.out.printf("  %-20s %s%n", "Model roles", String.join(", ", new TreeSet<>(c.allowedModelRoles())));
        System.out.printf("  %-20s %d%n", "Max tasks", c.concurrencyCeiling());
        System.out.printf("  %-20s %s%n", "Step timeout", c.stepTimeout());

        System.out.println();
        sampler.latest().ifPresentOrElse(sample -> {
            System.out.println("LATEST SAMPLE (" + sample.timestamp() + "):");
            sample.readings().forEach((metric, value) ->
                    System.out.printf("  %-20s %s%n", metric, ConsoleOutput.format(value)));
        }, () -> ConsoleOutput.info("No metric samples yet"));

        List<ModeTransition> history = modeController.history();
        if (!history.isEmpty()) {
            System.out.println();
            System.out.println("TRANSITIONS:");
            history.stream()
                    .skip(Math.max(0, history.size() - historyLimit))
                    .forEach(ConsoleOutput::transition);
        }

        if (exportWindow != null) {
            try {
                Files.writeString(exportWindow, codec.toJson(sampler.snapshot()), StandardCharsets.UTF_8);
                System.out.println();
                ConsoleOutput.success("Metric window written to " + exportWindow);
            } catch (IOException | UncheckedIOException e) {
                ConsoleOutput.error("Could not write metric window: " + e.getMessage());
            }
        }
    }

    private static String orNone(Collection<String> values) {
        return values.isEmpty() ? "none" : String.join(", ", values);
    }
}
