package com.homeostat.dispatch.cli;

import com.homeostat.core.policy.GovernancePolicy;
import com.homeostat.core.policy.ModePolicy;
import com.homeostat.core.policy.ToolPolicy;
import com.homeostat.core.policy.TransitionRule;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Collection;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * CLI command: homeostat policy
 * <p>
 * Prints the loaded governance policy: modes, transition rules and tools.
 */
@Command(name = "policy", mixinStandardHelpOptions = true, description = "Show the loaded governance policy")
@Component
public class PolicyCommand implements Runnable {

    private final GovernancePolicy policy;

    public PolicyCommand(GovernancePolicy policy) {
        this.policy = policy;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        System.out.println("MODES:");
        for (ModePolicy mode : policy.modes().values()) {
            ConsoleOutput.mode(mode.mode(), mode.description() == null ? "" : mode.description());
            System.out.printf("    max tasks %d, step timeout %s, categories [%s], approval [%s], reachable [%s]%n",
                    mode.maxConcurrentTasks(), mode.stepTimeout(),
                    sorted(mode.allowedCategories()), sorted(mode.approvalCategories()),
                    mode.reachableModes().stream().map(Enum::name).sorted().collect(Collectors.joining(", ")));
        }

        System.out.println();
        System.out.println("RULES:");
        for (TransitionRule rule : policy.rules()) {
            String conditions = rule.conditions().stream()
                    .map(Object::toString)
                    .collect(Collectors.joining(" " + rule.combinator() + " "));
            System.out.printf("  %-28s %s -> %s when %s%s%n", rule.name(), rule.source(), rule.target(),
                    conditions, rule.requiresApproval() ? " (approval)" : "");
        }

        System.out.println();
        System.out.println("TOOLS:");
        for (ToolPolicy tool : new TreeMap<>(policy.tools()).values()) {
            System.out.printf("  %-26s %-14s%s%n", tool.name(), tool.category(),
                    tool.forbiddenInModes().isEmpty() ? ""
                            : " forbidden in " + tool.forbiddenInModes().stream()
                            .map(Enum::name).sorted().collect(Collectors.joining(", ")));
        }
    }

    private static String sorted(Collection<String> values) {
        return String.join(", ", new TreeSet<>(values));
    }
}
