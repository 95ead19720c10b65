package com.teamlens.dispatch.cli;

import picocli.CommandLine;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * ANSI-colored terminal output utilities for the Teamlens CLI.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) TEAMLENS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TEAMLENS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void task(String id, String status, String subject, String owner) {
        String color = switch (status) {
            case "completed" -> "fg(green)";
            case "in_progress" -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    #" + id + " @|" + color + " " + status + "|@ " + truncate(subject, 50) +
                (owner != null ? " @|fg(blue) (" + owner + ")|@" : "")));
    }

    public static void message(String from, String to, String type, String text) {
        String tag = "plain_text".equals(type) ? "" : " @|fg(magenta) [" + type + "]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|fg(blue) " + from + "|@ -> " + to + tag + ": " + truncate(text, 60)));
    }

    public static String formatTime(long epochMillis) {
        return TIME_FORMAT.format(Instant.ofEpochMilli(epochMillis));
    }

    public static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String oneLine = s.replace('\n', ' ');
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max - 3) + "...";
    }
}
