package com.teamlens.dispatch.api;

import com.teamlens.core.model.TeamView;
import com.teamlens.core.model.TeamsSnapshot;
import com.teamlens.core.state.StateAggregator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Current in-memory state of every observed team.
 */
@RestController
@RequestMapping("/api/v1/teams")
public class TeamController {

    private final StateAggregator aggregator;

    public TeamController(StateAggregator aggregator) {
        this.aggregator = aggregator;
    }

    /**
     * GET /api/v1/teams: the same snapshot a newly connected observer receives.
     */
    @GetMapping
    public TeamsSnapshot snapshot() {
        return aggregator.snapshot();
    }

    /**
     * GET /api/v1/teams/{name}: one team, with deleted and internal tasks removed.
     */
    @GetMapping("/{name}")
    public ResponseEntity<?> team(@PathVariable String name) {
        return aggregator.team(name)
                .<ResponseEntity<?>>map(team -> ResponseEntity.ok(TeamView.of(team)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Unknown team: " + name)));
    }
}
