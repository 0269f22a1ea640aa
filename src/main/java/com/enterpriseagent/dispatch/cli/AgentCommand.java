package com.enterpriseagent.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: run, dispatch.
 */
@Command(
        name = "agent",
        mixinStandardHelpOptions = true,
        version = "Enterprise Agent 0.1.0",
        description = "Budget-aware agentic task orchestration",
        subcommands = {
                RunCommand.class,
                DispatchCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
