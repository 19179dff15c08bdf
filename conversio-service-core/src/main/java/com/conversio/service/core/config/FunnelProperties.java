package com.conversio.service.core.config;

import java.time.DayOfWeek;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "conversio.funnel")
public class FunnelProperties {
    private String defaultWindow = "14 day";
    private Duration defaultDateRange = Duration.ofDays(7);
    private Engine engine = new Engine();
    private Breakdown breakdown = new Breakdown();
    private Trends trends = new Trends();
    private Actors actors = new Actors();

    public String getDefaultWindow() {
        return defaultWindow;
    }

    public void setDefaultWindow(String defaultWindow) {
        this.defaultWindow = defaultWindow;
    }

    public Duration getDefaultDateRange() {
        return defaultDateRange;
    }

    public void setDefaultDateRange(Duration defaultDateRange) {
        this.defaultDateRange = defaultDateRange;
    }

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public Breakdown getBreakdown() {
        return breakdown;
    }

    public void setBreakdown(Breakdown breakdown) {
        this.breakdown = breakdown;
    }

    public Trends getTrends() {
        return trends;
    }

    public void setTrends(Trends trends) {
        this.trends = trends;
    }

    public Actors getActors() {
        return actors;
    }

    public void setActors(Actors actors) {
        this.actors = actors;
    }

    public static class Engine {
        private int workers = 4;
        private int batchSize = 500;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Breakdown {
        private int limit = 25;
        private Memo memo = new Memo();

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Memo getMemo() {
            return memo;
        }

        public void setMemo(Memo memo) {
            this.memo = memo;
        }
    }

    public static class Memo {
        private int cacheSize = 1000;
        private Duration ttl = Duration.ofMinutes(5);

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Trends {
        private DayOfWeek weekStart = DayOfWeek.SUNDAY;

        public DayOfWeek getWeekStart() {
            return weekStart;
        }

        public void setWeekStart(DayOfWeek weekStart) {
            this.weekStart = weekStart;
        }
    }

    public static class Actors {
        private int defaultLimit = 100;
        private int stepSampleSize = 0;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        /** Actor ids attached to each step result; 0 disables. */
        public int getStepSampleSize() {
            return stepSampleSize;
        }

        public void setStepSampleSize(int stepSampleSize) {
            this.stepSampleSize = stepSampleSize;
        }
    }
}
