package com.teamlens.core.watch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "teamlens.watch")
public class WatchProperties {

    private Path teamsRoot = Path.of(System.getProperty("user.home"), ".claude", "teams");
    private Path tasksRoot = Path.of(System.getProperty("user.home"), ".claude", "tasks");
    private long debounceMillis = 100;
    private String configFileName = "config.json";
    private String inboxDirName = "inboxes";

    public Path getTeamsRoot() {
        return teamsRoot;
    }

    public void setTeamsRoot(Path teamsRoot) {
        this.teamsRoot = teamsRoot;
    }

    public Path getTasksRoot() {
        return tasksRoot;
    }

    public void setTasksRoot(Path tasksRoot) {
        this.tasksRoot = tasksRoot;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public void setDebounceMillis(long debounceMillis) {
        this.debounceMillis = debounceMillis;
    }

    public String getConfigFileName() {
        return configFileName;
    }

    public void setConfigFileName(String configFileName) {
        this.configFileName = configFileName;
    }

    public String getInboxDirName() {
        return inboxDirName;
    }

    public void setInboxDirName(String inboxDirName) {
        this.inboxDirName = inboxDirName;
    }

    public PathClassifier classifier() {
        return new PathClassifier(teamsRoot, tasksRoot, configFileName, inboxDirName);
    }
}
