package com.teamlens.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "teamlens.storage")
public class StorageProperties {

    private Path path = Path.of(System.getProperty("user.home"), ".teamlens", "sessions.db");
    private int busyTimeoutMillis = 5000;

    public Path getPath() {
        return path;
    }

    public void setPath(Path path) {
        this.path = path;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }
}
