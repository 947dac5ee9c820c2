package com.paylens.service.storage.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "paylens.analytics")
public class AnalyticsProperties {

    /** sqlx, clickhouse, combined_ckh or combined_sqlx. */
    private String source = "sqlx";

    private final Clickhouse clickhouse = new Clickhouse();
    private final Query query = new Query();

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Clickhouse getClickhouse() {
        return clickhouse;
    }

    public Query getQuery() {
        return query;
    }

    public static class Clickhouse {
        private String url = "http://localhost:8123";
        private String username = "default";
        private String password = "";
        private String database = "default";
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Query {
        /** Threads running metric queries, shared by all requests. */
        private int workers = 8;

        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }
}
