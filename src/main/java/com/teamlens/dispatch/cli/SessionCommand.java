package com.teamlens.dispatch.cli;

import com.teamlens.core.model.Member;
import com.teamlens.core.model.TeamTask;
import com.teamlens.core.persistence.SessionDetail;
import com.teamlens.core.persistence.SessionMessage;
import com.teamlens.core.persistence.SessionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: teamlens session &lt;id&gt;
 * <p>
 * Prints one recorded session: its members, visible tasks and messages.
 */
@Command(name = "session", mixinStandardHelpOptions = true, description = "Show one recorded session")
@Component
public class SessionCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private long sessionId;

    private final SessionStore sessionStore;

    public SessionCommand(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var detailOpt = sessionStore.findSession(sessionId);
        if (detailOpt.isEmpty()) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return 1;
        }
        SessionDetail detail = detailOpt.get();
        var s = detail.session();

        System.out.println();
        System.out.println("SESSION " + s.id() + " - " + s.teamName());
        System.out.println("──────────────────────────────────");
        System.out.println("  Description: " + (s.description() != null ? s.description() : "-"));
        System.out.println("  Created:     " + ConsoleOutput.formatTime(s.createdAt()));
        System.out.println("  Ended:       " + (s.endedAt() != null ? ConsoleOutput.formatTime(s.endedAt()) : "-"));

        System.out.println();
        System.out.println("  MEMBERS (" + detail.members().size() + "):");
        for (Member m : detail.members()) {
            System.out.printf("    %-20s %-16s %s%n", m.name(), nullToDash(m.agentType()), nullToDash(m.model()));
        }

        System.out.println();
        System.out.println("  TASKS (" + detail.tasks().size() + "):");
        for (TeamTask t : detail.tasks()) {
            ConsoleOutput.task(t.id(), t.status().wireName(), t.subject(), t.owner());
        }

        System.out.println();
        System.out.println("  MESSAGES (" + detail.messages().size() + "):");
        for (SessionMessage m : detail.messages()) {
            ConsoleOutput.message(m.from(), m.recipient(), m.messageType().wireName(), m.text());
        }
        return 0;
    }

    private static String nullToDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }
}
