package com.teamlens.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} for the embedded SQLite session database.
 * <p>
 * The database file lives outside the watched tree. Its parent directory is created on
 * startup; failing to create it, or to create the schema, aborts startup.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public DataSource sessionDataSource(StorageProperties properties) {
        Path dbFile = properties.getPath().toAbsolutePath().normalize();
        try {
            Path parent = dbFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Session storage location is not writable: " + dbFile, e);
        }
        log.info("Using session database {}", dbFile);
        return createDataSource(dbFile, properties.getBusyTimeoutMillis());
    }

    @Bean
    public SessionStore sessionStore(DataSource sessionDataSource, ObjectMapper objectMapper) {
        var store = new SessionStore(sessionDataSource, objectMapper);
        store.createTables();
        return store;
    }

    /**
     * SQLite data source with WAL journaling, foreign keys and IMMEDIATE transactions, so a
     * multi-row batch takes the write lock up front and concurrent writers wait on the busy
     * timeout instead of failing.
     */
    public static SQLiteDataSource createDataSource(Path dbFile, int busyTimeoutMillis) {
        var config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMillis);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        var dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbFile);
        return dataSource;
    }
}
