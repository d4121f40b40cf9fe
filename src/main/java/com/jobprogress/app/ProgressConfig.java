package com.jobprogress.app;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Construction-time settings for a progress store.
 *
 * <p>Values come from three places, later ones winning:</p>
 * <ol>
 *   <li>built-in defaults (see the {@code DEFAULT_*} constants)</li>
 *   <li>{@code progress.properties} on the classpath</li>
 *   <li>JVM system properties with the same keys</li>
 * </ol>
 *
 * <p>The topic falls back to the {@code WorkTopic} environment variable when no property
 * sets it. It is only recorded on jobs for correlation and never published to.</p>
 */
public final class ProgressConfig {
    private static final Logger logger = Logger.getLogger(ProgressConfig.class.getName());

    public static final String PROPERTIES_RESOURCE = "progress.properties";
    public static final String TOPIC_ENV = "WorkTopic";

    public static final String DEFAULT_REDIS_HOST = "localhost";
    public static final int DEFAULT_REDIS_PORT = 6379;
    public static final int DEFAULT_REDIS_DB = 0;
    public static final String DEFAULT_JDBC_URL = "jdbc:h2:./progress;AUTO_SERVER=TRUE";
    public static final String DEFAULT_JDBC_USER = "sa";
    public static final int DEFAULT_POOL_SIZE = 10;
    public static final int DEFAULT_PAGE_SIZE = 100;

    /** Which store the jobs live in. */
    public enum Backend {
        JDBC,
        REDIS
    }

    private final Backend backend;
    private final String redisHost;
    private final int redisPort;
    private final int redisDb;
    private final String jdbcUrl;
    private final String jdbcUser;
    private final String jdbcPassword;
    private final int poolSize;
    private final String topic;
    private final boolean deleteWhenDone;
    private final int pageSize;

    private ProgressConfig(Builder builder) {
        this.backend = builder.backend;
        this.redisHost = builder.redisHost;
        this.redisPort = builder.redisPort;
        this.redisDb = builder.redisDb;
        this.jdbcUrl = builder.jdbcUrl;
        this.jdbcUser = builder.jdbcUser;
        this.jdbcPassword = builder.jdbcPassword;
        this.poolSize = builder.poolSize;
        this.topic = builder.topic;
        this.deleteWhenDone = builder.deleteWhenDone;
        this.pageSize = builder.pageSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load settings from {@code progress.properties} and system properties.
     *
     * @return the resolved configuration
     */
    public static ProgressConfig load() {
        Properties properties = new Properties();
        try (InputStream in = ProgressConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.fine("Loaded " + PROPERTIES_RESOURCE + " from classpath");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
        properties.putAll(System.getProperties());
        return fromProperties(properties);
    }

    /**
     * Build settings from explicit properties. Missing keys keep their defaults.
     *
     * @param properties source properties
     * @return the resolved configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ProgressConfig fromProperties(Properties properties) {
        Builder builder = builder();

        String backend = properties.getProperty("progress.backend");
        if (backend != null) {
            builder.backend(Backend.valueOf(backend.trim().toUpperCase(Locale.ROOT)));
        }
        builder.redisHost(properties.getProperty("progress.redis.host", DEFAULT_REDIS_HOST));
        builder.redisPort(intProperty(properties, "progress.redis.port", DEFAULT_REDIS_PORT));
        builder.redisDb(intProperty(properties, "progress.redis.db", DEFAULT_REDIS_DB));
        builder.jdbcUrl(properties.getProperty("progress.jdbc.url", DEFAULT_JDBC_URL));
        builder.jdbcUser(properties.getProperty("progress.jdbc.user", DEFAULT_JDBC_USER));
        builder.jdbcPassword(properties.getProperty("progress.jdbc.password", ""));
        builder.poolSize(intProperty(properties, "progress.jdbc.pool-size", DEFAULT_POOL_SIZE));
        builder.pageSize(intProperty(properties, "progress.page-size", DEFAULT_PAGE_SIZE));
        builder.deleteWhenDone(Boolean.parseBoolean(properties.getProperty("progress.delete-when-done", "false").trim()));

        String topic = properties.getProperty("progress.topic");
        if (topic != null) {
            builder.topic(topic);
        }
        return builder.build();
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public Backend getBackend() { return backend; }

    public String getRedisHost() { return redisHost; }

    public int getRedisPort() { return redisPort; }

    public int getRedisDb() { return redisDb; }

    public String getJdbcUrl() { return jdbcUrl; }

    public String getJdbcUser() { return jdbcUser; }

    public String getJdbcPassword() { return jdbcPassword; }

    public int getPoolSize() { return poolSize; }

    public String getTopic() { return topic; }

    public boolean isDeleteWhenDone() { return deleteWhenDone; }

    public int getPageSize() { return pageSize; }

    @Override
    public String toString() {
        return "ProgressConfig{backend=" + backend + ", redis=" + redisHost + ":" + redisPort + "/" + redisDb
                + ", jdbcUrl='" + jdbcUrl + "', topic='" + topic + "', deleteWhenDone=" + deleteWhenDone + "}";
    }

    /** Builder with every option at its default; the topic defaults to {@code $WorkTopic}. */
    public static final class Builder {
        private Backend backend = Backend.JDBC;
        private String redisHost = DEFAULT_REDIS_HOST;
        private int redisPort = DEFAULT_REDIS_PORT;
        private int redisDb = DEFAULT_REDIS_DB;
        private String jdbcUrl = DEFAULT_JDBC_URL;
        private String jdbcUser = DEFAULT_JDBC_USER;
        private String jdbcPassword = "";
        private int poolSize = DEFAULT_POOL_SIZE;
        private String topic = System.getenv(TOPIC_ENV);
        private boolean deleteWhenDone = false;
        private int pageSize = DEFAULT_PAGE_SIZE;

        private Builder() {
        }

        public Builder backend(Backend backend) { this.backend = backend; return this; }

        public Builder redisHost(String redisHost) { this.redisHost = redisHost; return this; }

        public Builder redisPort(int redisPort) { this.redisPort = redisPort; return this; }

        public Builder redisDb(int redisDb) { this.redisDb = redisDb; return this; }

        public Builder jdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; return this; }

        public Builder jdbcUser(String jdbcUser) { this.jdbcUser = jdbcUser; return this; }

        public Builder jdbcPassword(String jdbcPassword) { this.jdbcPassword = jdbcPassword; return this; }

        public Builder poolSize(int poolSize) { this.poolSize = poolSize; return this; }

        public Builder topic(String topic) { this.topic = topic; return this; }

        public Builder deleteWhenDone(boolean deleteWhenDone) { this.deleteWhenDone = deleteWhenDone; return this; }

        public Builder pageSize(int pageSize) { this.pageSize = pageSize; return this; }

        public ProgressConfig build() {
            if (backend == null) {
                throw new IllegalArgumentException("backend must be set");
            }
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
            }
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
            }
            return new ProgressConfig(this);
        }
    }
}
