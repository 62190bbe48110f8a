package com.shipyard.dispatch.cli;

import com.shipyard.preview.SocketPortProbe;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Shipyard CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SHIPYARD v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHIPYARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void probeResult(SocketPortProbe.ProbeResult result) {
        for (SocketPortProbe.BindTarget target : SocketPortProbe.BindTarget.values()) {
            String outcome = result.succeeded(target) ? "@|fg(green) bound|@" : "@|fg(red) failed|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + String.format("%-14s", target.host() + ":" + result.port()) + " " + outcome));
        }
    }
}
