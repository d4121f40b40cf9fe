package com.jobprogress.app;

import com.jobprogress.core.ProgressBackend;
import com.jobprogress.core.ProgressStore;
import com.jobprogress.core.StoreAccessException;
import com.jobprogress.db.Database;
import com.jobprogress.db.JdbcProgressBackend;
import com.jobprogress.redis.RedisProgressBackend;

import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires a {@link ProgressStore} to the backend named in a
 * {@link ProgressConfig}. The returned store owns its connections; close it when done.
 */
public final class ProgressStores {
    private static final Logger logger = Logger.getLogger(ProgressStores.class.getName());

    private ProgressStores() {
    }

    /**
     * Open a store using {@link ProgressConfig#load()}.
     *
     * @return an open store
     */
    public static ProgressStore open() {
        return open(ProgressConfig.load());
    }

    /**
     * Open a store for the given settings.
     *
     * @param config resolved settings
     * @return an open store
     * @throws StoreAccessException if the database cannot be initialized
     */
    public static ProgressStore open(ProgressConfig config) {
        logger.info("Opening progress store: " + config);
        ProgressBackend backend = openBackend(config);
        return new ProgressStore(backend, config.getTopic(), config.isDeleteWhenDone(), config.getPageSize());
    }

    private static ProgressBackend openBackend(ProgressConfig config) {
        switch (config.getBackend()) {
            case REDIS:
                return RedisProgressBackend.connect(config.getRedisHost(), config.getRedisPort(), config.getRedisDb());
            case JDBC:
                Database database = new Database(
                        config.getJdbcUrl(), config.getJdbcUser(), config.getJdbcPassword(), config.getPoolSize());
                try {
                    database.initialize();
                } catch (SQLException e) {
                    logger.log(Level.SEVERE, "Failed to initialize database", e);
                    database.close();
                    throw new StoreAccessException("Database initialization failed", e);
                }
                return new JdbcProgressBackend(database);
            default:
                throw new IllegalArgumentException("Unsupported backend: " + config.getBackend());
        }
    }
}
