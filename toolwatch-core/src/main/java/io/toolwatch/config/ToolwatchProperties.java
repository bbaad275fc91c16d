package io.toolwatch.config;

import io.toolwatch.core.AlertChannel;
import io.toolwatch.core.ProcessingPriority;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration for the monitor and the alert pipeline.
 */
@ConfigurationProperties(prefix = "toolwatch")
public class ToolwatchProperties {
    private boolean enabled = true;
    private boolean ensureIndexesOnStartup = false;
    private final Monitor monitor = new Monitor();
    private final Alerts alerts = new Alerts();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public static class Monitor {
        private int maxWorkers = 4;
        private int maxConcurrentJobs = 2;
        private Duration tickInterval = Duration.ofSeconds(30);
        private Duration errorBackoff = Duration.ofSeconds(60);
        private String discoverEvery = "5 minutes"; // interval or cron
        private String discoveryTimezone;
        private int maxCompletedJobs = 100;
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);
        private Duration resumeDelay = Duration.ofMinutes(5);
        private Map<ProcessingPriority, Integer> batchSizes = new EnumMap<>(ProcessingPriority.class);
        private Map<ProcessingPriority, Duration> rateLimits = new EnumMap<>(ProcessingPriority.class);

        public Monitor() {
            batchSizes.put(ProcessingPriority.URGENT, 1);
            batchSizes.put(ProcessingPriority.HIGH, 5);
            batchSizes.put(ProcessingPriority.NORMAL, 10);
            batchSizes.put(ProcessingPriority.LOW, 20);
            batchSizes.put(ProcessingPriority.MAINTENANCE, 50);

            rateLimits.put(ProcessingPriority.URGENT, Duration.ZERO);
            rateLimits.put(ProcessingPriority.HIGH, Duration.ofSeconds(1));
            rateLimits.put(ProcessingPriority.NORMAL, Duration.ofSeconds(2));
            rateLimits.put(ProcessingPriority.LOW, Duration.ofSeconds(5));
            rateLimits.put(ProcessingPriority.MAINTENANCE, Duration.ofSeconds(10));
        }

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public int getMaxConcurrentJobs() {
            return maxConcurrentJobs;
        }

        public void setMaxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }

        public String getDiscoverEvery() {
            return discoverEvery;
        }

        public void setDiscoverEvery(String discoverEvery) {
            this.discoverEvery = discoverEvery;
        }

        public String getDiscoveryTimezone() {
            return discoveryTimezone;
        }

        public void setDiscoveryTimezone(String discoveryTimezone) {
            this.discoveryTimezone = discoveryTimezone;
        }

        public int getMaxCompletedJobs() {
            return maxCompletedJobs;
        }

        public void setMaxCompletedJobs(int maxCompletedJobs) {
            this.maxCompletedJobs = maxCompletedJobs;
        }

        public Duration getShutdownGracePeriod() {
            return shutdownGracePeriod;
        }

        public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
            this.shutdownGracePeriod = shutdownGracePeriod;
        }

        public Duration getResumeDelay() {
            return resumeDelay;
        }

        public void setResumeDelay(Duration resumeDelay) {
            this.resumeDelay = resumeDelay;
        }

        public Map<ProcessingPriority, Integer> getBatchSizes() {
            return batchSizes;
        }

        public void setBatchSizes(Map<ProcessingPriority, Integer> batchSizes) {
            this.batchSizes = batchSizes;
        }

        public Map<ProcessingPriority, Duration> getRateLimits() {
            return rateLimits;
        }

        public void setRateLimits(Map<ProcessingPriority, Duration> rateLimits) {
            this.rateLimits = rateLimits;
        }

        /**
         * Chunk size for scheduled discovery of the given tier; at least 1.
         */
        public int batchSizeFor(ProcessingPriority priority) {
            Integer size = batchSizes.get(priority);
            return size == null ? 10 : Math.max(1, size);
        }

        /**
         * Delay before each tool of a job with the given priority.
         */
        public Duration rateLimitFor(ProcessingPriority priority) {
            Duration d = rateLimits.get(priority);
            return d == null ? Duration.ofSeconds(2) : d;
        }
    }

    public static class Alerts {
        private boolean useDefaultRules = true;
        private List<AlertRuleDefinition> rules = new ArrayList<>();
        private final SeverityBands severityBands = new SeverityBands();
        private final Email email = new Email();
        private final Slack slack = new Slack();
        private final Webhook webhook = new Webhook();
        private final Integration integration = new Integration();

        public boolean isUseDefaultRules() {
            return useDefaultRules;
        }

        public void setUseDefaultRules(boolean useDefaultRules) {
            this.useDefaultRules = useDefaultRules;
        }

        public List<AlertRuleDefinition> getRules() {
            return rules;
        }

        public void setRules(List<AlertRuleDefinition> rules) {
            this.rules = rules;
        }

        public SeverityBands getSeverityBands() {
            return severityBands;
        }

        public Email getEmail() {
            return email;
        }

        public Slack getSlack() {
            return slack;
        }

        public Webhook getWebhook() {
            return webhook;
        }

        public Integration getIntegration() {
            return integration;
        }
    }

    /**
     * Minimum impact score for each severity band.
     */
    public static class SeverityBands {
        private int critical = 4;
        private int high = 3;
        private int medium = 2;
        private int low = 1;

        public int getCritical() {
            return critical;
        }

        public void setCritical(int critical) {
            this.critical = critical;
        }

        public int getHigh() {
            return high;
        }

        public void setHigh(int high) {
            this.high = high;
        }

        public int getMedium() {
            return medium;
        }

        public void setMedium(int medium) {
            this.medium = medium;
        }

        public int getLow() {
            return low;
        }

        public void setLow(int low) {
            this.low = low;
        }
    }

    public static class Email {
        private boolean enabled = false;
        private String smtpHost;
        private int smtpPort = 587;
        private String username;
        private String password;
        private String from;
        private List<String> to = new ArrayList<>();
        private boolean useTls = true;
        private boolean useSsl = false;
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSmtpHost() {
            return smtpHost;
        }

        public void setSmtpHost(String smtpHost) {
            this.smtpHost = smtpHost;
        }

        public int getSmtpPort() {
            return smtpPort;
        }

        public void setSmtpPort(int smtpPort) {
            this.smtpPort = smtpPort;
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

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public List<String> getTo() {
            return to;
        }

        public void setTo(List<String> to) {
            this.to = to;
        }

        public boolean isUseTls() {
            return useTls;
        }

        public void setUseTls(boolean useTls) {
            this.useTls = useTls;
        }

        public boolean isUseSsl() {
            return useSsl;
        }

        public void setUseSsl(boolean useSsl) {
            this.useSsl = useSsl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isConfigured() {
            return enabled && smtpHost != null && !smtpHost.isBlank() && to != null && !to.isEmpty();
        }
    }

    public static class Slack {
        private String webhookUrl;
        private String channel;
        private String username = "toolwatch";
        private Duration timeout = Duration.ofSeconds(10);

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isConfigured() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }

    public static class Webhook {
        private List<String> urls = new ArrayList<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout = Duration.ofSeconds(10);

        public List<String> getUrls() {
            return urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isConfigured() {
            return urls != null && !urls.isEmpty();
        }
    }

    public static class Integration {
        private boolean realTimeAlerts = true;
        private boolean batchAlerts = true;
        private int batchAlertThreshold = 5;
        private Duration debounceWindow = Duration.ofMinutes(5);
        private Duration flushEvery = Duration.ofSeconds(60);
        private Duration digestPeriod = Duration.ofHours(24);
        private List<AlertChannel> summaryChannels =
                new ArrayList<>(List.of(AlertChannel.EMAIL, AlertChannel.SLACK, AlertChannel.DATABASE));
        private List<AlertChannel> digestChannels = new ArrayList<>(List.of(AlertChannel.EMAIL, AlertChannel.SLACK));

        public boolean isRealTimeAlerts() {
            return realTimeAlerts;
        }

        public void setRealTimeAlerts(boolean realTimeAlerts) {
            this.realTimeAlerts = realTimeAlerts;
        }

        public boolean isBatchAlerts() {
            return batchAlerts;
        }

        public void setBatchAlerts(boolean batchAlerts) {
            this.batchAlerts = batchAlerts;
        }

        public int getBatchAlertThreshold() {
            return batchAlertThreshold;
        }

        public void setBatchAlertThreshold(int batchAlertThreshold) {
            this.batchAlertThreshold = batchAlertThreshold;
        }

        public Duration getDebounceWindow() {
            return debounceWindow;
        }

        public void setDebounceWindow(Duration debounceWindow) {
            this.debounceWindow = debounceWindow;
        }

        public Duration getFlushEvery() {
            return flushEvery;
        }

        public void setFlushEvery(Duration flushEvery) {
            this.flushEvery = flushEvery;
        }

        public Duration getDigestPeriod() {
            return digestPeriod;
        }

        public void setDigestPeriod(Duration digestPeriod) {
            this.digestPeriod = digestPeriod;
        }

        /**
         * Channels for batch summaries and manually triggered alerts.
         */
        public List<AlertChannel> getSummaryChannels() {
            return summaryChannels;
        }

        public void setSummaryChannels(List<AlertChannel> summaryChannels) {
            this.summaryChannels = summaryChannels;
        }

        public List<AlertChannel> getDigestChannels() {
            return digestChannels;
        }

        public void setDigestChannels(List<AlertChannel> digestChannels) {
            this.digestChannels = digestChannels;
        }
    }
}
