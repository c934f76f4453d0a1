package com.helmsman.dispatch.cli;

import com.helmsman.core.model.PriorityLevel;
import com.helmsman.core.model.ProcessingResult;
import picocli.CommandLine;

import java.util.Map;
import java.util.Set;

/**
 * ANSI-colored terminal output utilities for the Helmsman CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) HELMSMAN v1.0.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HELMSMAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void result(ProcessingResult r) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Document|@ " + r.id()));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Classification: @|bold " + r.classification().label() + "|@"
                + String.format(" (confidence %.2f)", r.confidence())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Priority: " + priority(r.priority())));
        r.documentTypeOpt().ifPresent(t -> System.out.println("  Type: " + t.label()));
        r.vesselIdOpt().ifPresent(v -> System.out.println("  Vessel: " + v));
        System.out.println();
        System.out.println("Summary: " + r.summary());
        System.out.println("Details: " + r.details());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) Risk:|@ " + r.riskAssessment()));

        if (!r.keywords().isEmpty()) {
            System.out.println("Keywords: " + String.join(", ", r.keywords()));
        }
        entities(r.entities());

        if (!r.recommendedActions().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Recommended actions|@"));
            int n = 1;
            for (String action : r.recommendedActions()) {
                System.out.printf("  %d. %s%n", n++, action);
            }
        }
        System.out.println(RULE);
    }

    private static void entities(Map<String, Set<String>> entities) {
        for (var entry : entities.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                System.out.println("  " + entry.getKey() + ": " + String.join(", ", entry.getValue()));
            }
        }
    }

    private static String priority(PriorityLevel level) {
        String color;
        if (level.isAtLeast(PriorityLevel.HIGH)) {
            color = level == PriorityLevel.CRITICAL ? "fg(red),bold" : "fg(red)";
        } else {
            color = level.isAtLeast(PriorityLevel.MEDIUM) ? "fg(yellow)" : "fg(green)";
        }
        return "@|" + color + " " + level.label() + "|@";
    }
}
