package com.postq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "postq")
public class PostQProperties {

    private final Database database = new Database();
    private final Scheduler scheduler = new Scheduler();
    private final Delivery delivery = new Delivery();
    private final Defaults defaults = new Defaults();

    public Database getDatabase() {
        return database;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public static class Database {
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long pollIntervalInSeconds = 5;
        private int batchSize = 25;
        private int jobConcurrency = Math.max(2, Runtime.getRuntime().availableProcessors());
        private String leaseDuration = "10m";
        private String shutdownGracePeriod = "30s";
        private int maxConsecutiveStoreFailures = 10;
        private String deleteDeliveriesAfter = "30d";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getJobConcurrency() {
            return jobConcurrency;
        }

        public void setJobConcurrency(int jobConcurrency) {
            this.jobConcurrency = jobConcurrency;
        }

        public String getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(String leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public String getShutdownGracePeriod() {
            return shutdownGracePeriod;
        }

        public void setShutdownGracePeriod(String shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
        }

        public int getMaxConsecutiveStoreFailures() {
            return maxConsecutiveStoreFailures;
        }

        public void setMaxConsecutiveStoreFailures(int maxConsecutiveStoreFailures) {
            this.maxConsecutiveStoreFailures = maxConsecutiveStoreFailures;
        }

        public String getDeleteDeliveriesAfter() {
            return deleteDeliveriesAfter;
        }

        public void setDeleteDeliveriesAfter(String deleteDeliveriesAfter) {
            this.deleteDeliveriesAfter = deleteDeliveriesAfter;
        }
    }

    public static class Delivery {
        private int concurrency = 4;
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double backoffMultiplier = 2.0;
        private long minDelayBetweenSendsMs = 350;
        private int maxImagesPerMessage = 10;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getMinDelayBetweenSendsMs() {
            return minDelayBetweenSendsMs;
        }

        public void setMinDelayBetweenSendsMs(long minDelayBetweenSendsMs) {
            this.minDelayBetweenSendsMs = minDelayBetweenSendsMs;
        }

        public int getMaxImagesPerMessage() {
            return maxImagesPerMessage;
        }

        public void setMaxImagesPerMessage(int maxImagesPerMessage) {
            this.maxImagesPerMessage = maxImagesPerMessage;
        }
    }

    public static class Defaults {
        private String timeZone = "America/Los_Angeles";

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }
    }
}
