package com.homeostat.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Homeostat.
 * Routes to subcommands: run, status, health, policy, serve.
 */
@Command(
        name = "homeostat",
        mixinStandardHelpOptions = true,
        version = "Homeostat 0.1.0",
        description = "Governed task execution with a feedback-controlled operating mode",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                PolicyCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HomeostatCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
