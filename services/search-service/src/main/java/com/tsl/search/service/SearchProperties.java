package com.tsl.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private int rrfK = 60;
    private int defaultLimit = 10;
    private int maxLimit = 100;
    private int candidateTopK = 50;
    private int stageTimeoutMs = 500;
    private Rewrite rewrite = new Rewrite();
    private Bm25 bm25 = new Bm25();
    private Execution execution = new Execution();

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        if (rrfK < 1) {
            throw new IllegalArgumentException("search.rrf-k must be >= 1: " + rrfK);
        }
        this.rrfK = rrfK;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getCandidateTopK() {
        return candidateTopK;
    }

    public void setCandidateTopK(int candidateTopK) {
        this.candidateTopK = candidateTopK;
    }

    public int getStageTimeoutMs() {
        return stageTimeoutMs;
    }

    public void setStageTimeoutMs(int stageTimeoutMs) {
        this.stageTimeoutMs = stageTimeoutMs;
    }

    public Rewrite getRewrite() {
        return rewrite;
    }

    public void setRewrite(Rewrite rewrite) {
        this.rewrite = rewrite;
    }

    public Bm25 getBm25() {
        return bm25;
    }

    public void setBm25(Bm25 bm25) {
        this.bm25 = bm25;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public static class Rewrite {
        private int timeoutMs = 1500;
        private int maxAttempts = 2;
        private long backoffMs = 100;

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBackoffMs() {
            return backoffMs;
        }

        public void setBackoffMs(long backoffMs) {
            this.backoffMs = backoffMs;
        }
    }

    public static class Bm25 {
        private double k1 = 1.2;
        private double b = 0.75;

        public double getK1() {
            return k1;
        }

        public void setK1(double k1) {
            this.k1 = k1;
        }

        public double getB() {
            return b;
        }

        public void setB(double b) {
            this.b = b;
        }
    }

    public static class Execution {
        private int poolSize = 8;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
