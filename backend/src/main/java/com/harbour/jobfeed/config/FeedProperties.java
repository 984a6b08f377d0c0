package com.harbour.jobfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "feed")
public class FeedProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String seenUrlsFile = "processed_urls.txt";
    private List<String> allowedDomains = new ArrayList<>(List.of("fresheropenings.com", "freshersrecruitment.co.in"));
    private Http http = new Http();
    private Purge purge = new Purge();
    private Retention retention = new Retention();
    private Schedule schedule = new Schedule();
    private Notify notify = new Notify();
    private Channel channel = new Channel();
    private Cli cli = new Cli();

    public String getSeenUrlsFile() {
        return seenUrlsFile == null || seenUrlsFile.isBlank() ? "processed_urls.txt" : seenUrlsFile.trim();
    }

    public void setSeenUrlsFile(String seenUrlsFile) {
        this.seenUrlsFile = seenUrlsFile;
    }

    public List<String> getAllowedDomains() {
        return allowedDomains == null ? List.of() : allowedDomains;
    }

    public void setAllowedDomains(List<String> allowedDomains) {
        this.allowedDomains = allowedDomains;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Purge getPurge() {
        return purge;
    }

    public void setPurge(Purge purge) {
        this.purge = purge;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Notify getNotify() {
        return notify;
    }

    public void setNotify(Notify notify) {
        this.notify = notify;
    }

    public Channel getChannel() {
        return channel;
    }

    public void setChannel(Channel channel) {
        this.channel = channel;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Http {
        private int requestTimeoutSeconds = 25;
        private int perHostDelayMs = 500;
        private List<String> userAgents = new ArrayList<>(List.of(
            DEFAULT_USER_AGENT,
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:122.0) Gecko/20100101 Firefox/122.0"
        ));

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }

        public List<String> getUserAgents() {
            List<String> cleaned = new ArrayList<>();
            if (userAgents != null) {
                for (String agent : userAgents) {
                    if (agent != null && !agent.isBlank()) {
                        cleaned.add(agent.trim());
                    }
                }
            }
            return cleaned.isEmpty() ? List.of(DEFAULT_USER_AGENT) : cleaned;
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents;
        }
    }

    public static class Purge {
        private int recentGraceDays = 2;
        private int scanBatchSize = 500;

        public int getRecentGraceDays() {
            return Math.max(0, recentGraceDays);
        }

        public void setRecentGraceDays(int recentGraceDays) {
            this.recentGraceDays = Math.max(0, recentGraceDays);
        }

        public int getScanBatchSize() {
            return Math.max(1, scanBatchSize);
        }

        public void setScanBatchSize(int scanBatchSize) {
            this.scanBatchSize = Math.max(1, scanBatchSize);
        }
    }

    public static class Retention {
        private Duration maxAge = Duration.ofDays(90);

        public Duration getMaxAge() {
            if (maxAge == null || maxAge.isNegative() || maxAge.toDays() < 1) {
                return Duration.ofDays(1);
            }
            return maxAge;
        }

        public void setMaxAge(Duration maxAge) {
            this.maxAge = maxAge;
        }
    }

    public static class Schedule {
        private boolean enabled;
        private int initialDelaySeconds = 60;
        private int purgeIntervalMinutes = 1440;
        private int retentionIntervalMinutes = 1440;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getInitialDelaySeconds() {
            return Math.max(0, initialDelaySeconds);
        }

        public void setInitialDelaySeconds(int initialDelaySeconds) {
            this.initialDelaySeconds = Math.max(0, initialDelaySeconds);
        }

        public int getPurgeIntervalMinutes() {
            return Math.max(1, purgeIntervalMinutes);
        }

        public void setPurgeIntervalMinutes(int purgeIntervalMinutes) {
            this.purgeIntervalMinutes = Math.max(1, purgeIntervalMinutes);
        }

        public int getRetentionIntervalMinutes() {
            return Math.max(1, retentionIntervalMinutes);
        }

        public void setRetentionIntervalMinutes(int retentionIntervalMinutes) {
            this.retentionIntervalMinutes = Math.max(1, retentionIntervalMinutes);
        }
    }

    public static class Notify {
        private boolean enabled;
        private String apiUrl = "https://onesignal.com/api/v1/notifications";
        private String appId;
        private String restApiKey;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getAppId() {
            return appId;
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public String getRestApiKey() {
            return restApiKey;
        }

        public void setRestApiKey(String restApiKey) {
            this.restApiKey = restApiKey;
        }

        public boolean isConfigured() {
            return apiUrl != null && !apiUrl.isBlank()
                && appId != null && !appId.isBlank()
                && restApiKey != null && !restApiKey.isBlank();
        }
    }

    public static class Channel {
        private String messagesFile = "channel_messages.txt";

        public String getMessagesFile() {
            return messagesFile;
        }

        public void setMessagesFile(String messagesFile) {
            this.messagesFile = messagesFile;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean retentionBeforeAdmission = true;
        private boolean admit = true;
        private boolean purge;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isRetentionBeforeAdmission() {
            return retentionBeforeAdmission;
        }

        public void setRetentionBeforeAdmission(boolean retentionBeforeAdmission) {
            this.retentionBeforeAdmission = retentionBeforeAdmission;
        }

        public boolean isAdmit() {
            return admit;
        }

        public void setAdmit(boolean admit) {
            this.admit = admit;
        }

        public boolean isPurge() {
            return purge;
        }

        public void setPurge(boolean purge) {
            this.purge = purge;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
