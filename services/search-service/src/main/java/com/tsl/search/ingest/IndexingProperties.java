package com.tsl.search.ingest;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "indexing")
public class IndexingProperties {
    private int concurrency = 5;
    private int writeMaxAttempts = 3;
    private long writeBackoffMs = 50;
    private Snapshot snapshot = new Snapshot();

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getWriteMaxAttempts() {
        return writeMaxAttempts;
    }

    public void setWriteMaxAttempts(int writeMaxAttempts) {
        this.writeMaxAttempts = writeMaxAttempts;
    }

    public long getWriteBackoffMs() {
        return writeBackoffMs;
    }

    public void setWriteBackoffMs(long writeBackoffMs) {
        this.writeBackoffMs = writeBackoffMs;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public static class Snapshot {
        private String path = "data/index-snapshot.jsonl";
        private boolean loadOnStartup = false;
        private boolean saveOnShutdown = false;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isLoadOnStartup() {
            return loadOnStartup;
        }

        public void setLoadOnStartup(boolean loadOnStartup) {
            this.loadOnStartup = loadOnStartup;
        }

        public boolean isSaveOnShutdown() {
            return saveOnShutdown;
        }

        public void setSaveOnShutdown(boolean saveOnShutdown) {
            this.saveOnShutdown = saveOnShutdown;
        }
    }
}
