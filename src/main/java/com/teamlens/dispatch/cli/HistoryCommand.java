package com.teamlens.dispatch.cli;

import com.teamlens.core.persistence.SessionStore;
import com.teamlens.core.persistence.SessionSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: teamlens history
 * <p>
 * Lists recorded sessions, newest first:
 * ID | Team | Started | Members | Messages | Tasks | Description (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recorded team sessions")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final SessionStore sessionStore;

    public HistoryCommand(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<SessionSummary> sessions = sessionStore.listSessions();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions recorded.");
            return;
        }

        List<SessionSummary> display = sessions.size() > limit ? sessions.subList(0, limit) : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-6s %-20s %-20s %-8s %-9s %-6s %s%n",
                "ID", "TEAM", "STARTED", "MEMBERS", "MESSAGES", "TASKS", "DESCRIPTION");
        System.out.println("  " + "-".repeat(96));

        for (SessionSummary s : display) {
            System.out.printf("  %-6d %-20s %-20s %-8d %-9d %-6d %s%n",
                    s.id(),
                    ConsoleOutput.truncate(s.teamName(), 20),
                    ConsoleOutput.formatTime(s.createdAt()),
                    s.memberCount(),
                    s.messageCount(),
                    s.taskCount(),
                    ConsoleOutput.truncate(s.description(), 30) + (s.endedAt() != null ? "" : " (open)"));
        }
    }
}
