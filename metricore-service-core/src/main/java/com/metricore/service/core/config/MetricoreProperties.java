package com.metricore.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "metricore")
public class MetricoreProperties {
    private Query query = new Query();
    private Ingest ingest = new Ingest();

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public static class Query {
        /** Applied when the caller supplies no timeout. */
        private Duration defaultTimeout = Duration.ofSeconds(30);
        /** Upper bound for caller supplied timeouts. */
        private Duration maxTimeout = Duration.ofMinutes(5);
        private int workers = 4;

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public Duration getMaxTimeout() {
            return maxTimeout;
        }

        public void setMaxTimeout(Duration maxTimeout) {
            this.maxTimeout = maxTimeout;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    public static class Ingest {
        /** Source identity stamped into auto-primary tags when an insert names no source. */
        private String defaultSource = "local";

        public String getDefaultSource() {
            return defaultSource;
        }

        public void setDefaultSource(String defaultSource) {
            this.defaultSource = defaultSource;
        }
    }
}
