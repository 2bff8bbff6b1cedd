package com.bulksubmit.recipient.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recipient")
public class RecipientProperties {
    private static final String DEFAULT_USER_AGENT = "bulk-submit-recipient/0.1";
    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private String baseUrl = DEFAULT_BASE_URL;
    private String storageDir = "jobs";
    private String userAgent;
    private int connectTimeoutSeconds = 10;
    private int requestTimeoutSeconds = 60;
    private int downloadConcurrency = 8;
    private double pendingSubmissionLifetimeHours = 48;
    private double completedSubmissionLifetimeHours = 48;
    private int sweepIntervalMinutes = 15;

    public String getBaseUrl() {
        return normalizeBaseUrl(baseUrl);
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
    }

    public String getStorageDir() {
        return storageDir == null || storageDir.isBlank() ? "jobs" : storageDir.trim();
    }

    public void setStorageDir(String storageDir) {
        this.storageDir = storageDir;
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getConnectTimeoutSeconds() {
        return Math.max(1, connectTimeoutSeconds);
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getDownloadConcurrency() {
        return Math.max(1, downloadConcurrency);
    }

    public void setDownloadConcurrency(int downloadConcurrency) {
        this.downloadConcurrency = Math.max(1, downloadConcurrency);
    }

    public double getPendingSubmissionLifetimeHours() {
        return pendingSubmissionLifetimeHours;
    }

    public void setPendingSubmissionLifetimeHours(double pendingSubmissionLifetimeHours) {
        this.pendingSubmissionLifetimeHours = pendingSubmissionLifetimeHours;
    }

    public double getCompletedSubmissionLifetimeHours() {
        return completedSubmissionLifetimeHours;
    }

    public void setCompletedSubmissionLifetimeHours(double completedSubmissionLifetimeHours) {
        this.completedSubmissionLifetimeHours = completedSubmissionLifetimeHours;
    }

    public int getSweepIntervalMinutes() {
        return Math.max(1, sweepIntervalMinutes);
    }

    public void setSweepIntervalMinutes(int sweepIntervalMinutes) {
        this.sweepIntervalMinutes = Math.max(1, sweepIntervalMinutes);
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static String normalizeBaseUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        String value = candidate.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
