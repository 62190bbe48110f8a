package com.shipyard.dispatch.cli;

import com.shipyard.preview.InvalidPortRangeException;
import com.shipyard.preview.PortAllocator;
import com.shipyard.preview.PortRange;
import com.shipyard.preview.PortRangeExhaustedException;
import com.shipyard.preview.SocketPortProbe;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: shipyard ports [--start N] [--end N] [--verbose]
 * <p>
 * Resolves the preview port range the same way the server does and prints the first port
 * a dev server could bind. Exit code 1 for an invalid range, 2 when the range is exhausted.
 */
@Command(name = "ports", mixinStandardHelpOptions = true,
        description = "Find the first free preview port")
@Component
public class PortsCommand implements Callable<Integer> {

    @Option(names = "--start", description = "First port to scan")
    String start;

    @Option(names = "--end", description = "Last port to scan")
    String end;

    @Option(names = {"-v", "--verbose"}, description = "Show per-address bind results for the chosen port")
    boolean verbose;

    private final PortAllocator portAllocator;
    private final SocketPortProbe socketPortProbe;

    public PortsCommand(PortAllocator portAllocator,
                        @Autowired(required = false) SocketPortProbe socketPortProbe) {
        this.portAllocator = portAllocator;
        this.socketPortProbe = socketPortProbe;
    }

    @Override
    public Integer call() {
        PortRange range;
        try {
            range = portAllocator.resolveRange(start, end);
        } catch (InvalidPortRangeException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Scanning " + range + " (" + range.size() + " ports)");
        try {
            int port = portAllocator.allocate(range, Set.of());
            ConsoleOutput.success("Port " + port + " is available");
            if (verbose && socketPortProbe != null) {
                ConsoleOutput.probeResult(socketPortProbe.probe(port));
            }
            return 0;
        } catch (PortRangeExhaustedException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
