package com.shipyard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: serve, ports, health.
 */
@Command(
        name = "shipyard",
        mixinStandardHelpOptions = true,
        version = "Shipyard 0.1.0",
        description = "Project event streaming, tool permissions and dev-server previews",
        subcommands = {
                ServeCommand.class,
                PortsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShipyardCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
