package com.teamlens.core.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamlens.core.events.EventBus;
import com.teamlens.core.events.TeamChange;
import com.teamlens.core.logging.MdcContext;
import com.teamlens.core.metrics.TeamlensMetrics;
import com.teamlens.core.model.InboxMessage;
import com.teamlens.core.model.Team;
import com.teamlens.core.model.TeamConfig;
import com.teamlens.core.model.TeamTask;
import com.teamlens.core.model.TeamView;
import com.teamlens.core.model.TeamsSnapshot;
import com.teamlens.core.watch.FileChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the canonical in-memory model of every team.
 * <p>
 * Changes are merged strictly one at a time, in arrival order, on a single worker thread.
 * The whole model is held in one immutable {@link State} that is swapped after each merge,
 * so {@link #snapshot()} can be called from any thread and always sees either the state
 * before a merge or after it. A file that cannot be read or parsed leaves the previous
 * value in place.
 */
@Service
public class StateAggregator {

    private static final Logger log = LoggerFactory.getLogger(StateAggregator.class);

    private final TeamFileParser parser;
    private final EventBus eventBus;
    private final TeamlensMetrics metrics;

    private volatile State state = new State(Map.of(), null);

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "state-aggregator");
        t.setDaemon(true);
        return t;
    });

    public StateAggregator(ObjectMapper objectMapper, EventBus eventBus, TeamlensMetrics metrics) {
        this.parser = new TeamFileParser(objectMapper);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Queues a change for merging. Never blocks the caller.
     */
    public void submit(FileChange change) {
        try {
            worker.execute(() -> apply(change));
        } catch (RejectedExecutionException e) {
            log.debug("Aggregator stopped, dropping {} change for {}", change.kind().wireName(), change.path());
        }
    }

    /**
     * Reads the changed file, merges it and publishes the resulting {@link TeamChange}.
     * Runs on the worker thread; also callable directly when ordering is guaranteed by the caller.
     *
     * @return the published change, or empty when the file was ignored or could not be parsed
     */
    Optional<TeamChange> apply(FileChange change) {
        if (!change.isRelevant()) {
            return Optional.empty();
        }
        MdcContext.setTeam(change.teamName());
        try {
            Optional<TeamChange> merged = switch (change.kind()) {
                case TEAM_CONFIG -> mergeConfig(change);
                case INBOX -> mergeInbox(change);
                case TASK -> mergeTask(change);
                case IGNORED -> Optional.empty();
            };
            merged.ifPresent(c -> {
                metrics.recordChangeApplied(c.kind().wireName());
                eventBus.publish(c);
            });
            return merged;
        } catch (TeamFileParser.ParseException e) {
            String reason = e.isMissing() ? "missing" : "malformed";
            metrics.recordParseFailure(change.kind().wireName(), reason);
            if (e.isMissing()) {
                log.debug("Keeping previous {} for team {}: {}", change.kind().wireName(), change.teamName(), e.getMessage());
            } else {
                log.warn("Keeping previous {} for team {}: {}", change.kind().wireName(), change.teamName(), e.getMessage());
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Unexpected failure merging {}", change.path(), e);
            return Optional.empty();
        } finally {
            MdcContext.clear();
        }
    }

    private Optional<TeamChange> mergeConfig(FileChange change) throws TeamFileParser.ParseException {
        TeamConfig config = parser.parseConfig(change.path());
        Team previous = currentTeam(change.teamName());
        Team team;
        if (isNewRun(previous, config)) {
            log.info("Team {} recreated (createdAt {} -> {}), dropping inboxes and tasks of the previous run",
                    previous.name(), previous.config().createdAt(), config.createdAt());
            team = Team.empty(previous.name()).withConfig(config);
        } else {
            team = previous.withConfig(config);
        }
        commit(team, true);
        log.info("Team {} config loaded ({} members)", team.name(), config.members().size());
        return Optional.of(TeamChange.config(team));
    }

    private Optional<TeamChange> mergeInbox(FileChange change) throws TeamFileParser.ParseException {
        MdcContext.setAgent(change.teamName(), change.agentName());
        List<InboxMessage> messages = parser.parseInbox(change.path());
        Team team = currentTeam(change.teamName()).withInbox(change.agentName(), messages);
        commit(team, false);
        log.debug("Inbox {} of team {} now has {} messages", change.agentName(), team.name(), messages.size());
        return Optional.of(TeamChange.inbox(team, change.agentName()));
    }

    private Optional<TeamChange> mergeTask(FileChange change) throws TeamFileParser.ParseException {
        MdcContext.setTask(change.teamName(), change.taskId());
        TeamTask task = parser.parseTask(change.path(), change.taskId());
        Team team = currentTeam(change.teamName()).withTask(change.taskId(), task);
        commit(team, false);
        log.debug("Task {} of team {} is {}", change.taskId(), team.name(), task.status().wireName());
        return Optional.of(TeamChange.task(team, change.taskId()));
    }

    private static boolean isNewRun(Team previous, TeamConfig config) {
        return previous.config() != null && !Objects.equals(previous.config().createdAt(), config.createdAt());
    }

    private Team currentTeam(String name) {
        Team existing = state.teams().get(name);
        return existing != null ? existing : Team.empty(name);
    }

    private void commit(Team team, boolean markActive) {
        State current = state;
        var teams = new LinkedHashMap<>(current.teams());
        teams.put(team.name(), team);
        state = new State(Map.copyOf(teams), markActive ? team.name() : current.activeTeam());
    }

    /**
     * Full current state of every team, with deleted and internal tasks removed.
     */
    public TeamsSnapshot snapshot() {
        State current = state;
        var views = new TreeMap<String, TeamView>();
        current.teams().values().forEach(team -> views.put(team.name(), TeamView.of(team)));
        return new TeamsSnapshot(views, current.activeTeam());
    }

    public Optional<Team> team(String name) {
        return Optional.ofNullable(state.teams().get(name));
    }

    public String activeTeam() {
        return state.activeTeam();
    }

    /**
     * Stops accepting changes and waits for queued merges to finish.
     */
    public void shutdown(Duration timeout) {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Aggregator did not drain within {}; abandoning queued changes", timeout);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("State aggregator stopped");
    }

    private record State(Map<String, Team> teams, String activeTeam) {}
}
