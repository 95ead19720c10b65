package com.teamlens.core.health;

import com.teamlens.core.watch.TeamFileWatcher;
import com.teamlens.dispatch.ws.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.LinkedHashMap;

/**
 * Checks the file watcher, the session database and the observer hub.
 * Every collaborator is optional so the CLI context can start without them.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TeamFileWatcher watcher;
    private final DataSource dataSource;
    private final BroadcastHub hub;

    public HealthCheckService(
            @Autowired(required = false) TeamFileWatcher watcher,
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) BroadcastHub hub) {
        this.watcher = watcher;
        this.dataSource = dataSource;
        this.hub = hub;
    }

    public HealthReport check() {
        boolean watching = watcher != null && watcher.isRunning();
        Integer directories = watching ? watcher.watchedDirectoryCount() : null;
        int observers = hub != null ? hub.observerCount() : 0;

        var components = new LinkedHashMap<String, ComponentHealth>();
        components.put("watcher", watching
                ? ComponentHealth.up("Watching " + directories + " team director" + (directories == 1 ? "y" : "ies"))
                : ComponentHealth.down("File watcher not running"));
        components.put("database", checkDatabase());
        // No observers is a normal state, so this component never reports DOWN.
        components.put("observers", ComponentHealth.up(observers + " observer(s) connected"));
        return HealthReport.of(observers, directories, components);
    }

    private ComponentHealth checkDatabase() {
        if (dataSource == null) {
            return ComponentHealth.down("No DataSource configured");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return ComponentHealth.up("Session database reachable");
            }
            return ComponentHealth.down("Session database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return ComponentHealth.down("Database error: " + e.getMessage());
        }
    }
}
