package com.agonyforge.perpscanner.config;

import com.agonyforge.perpscanner.exception.ConfigurationException;
import com.agonyforge.perpscanner.service.model.Venue;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static com.agonyforge.perpscanner.config.ScannerConfiguration.requirePositive;

/**
 * This class contains any configuration from application.yaml that users can set to change the behavior of a
 * single venue.
 */
public class VenueConfiguration {
    private Venue venue;
    private Boolean active = true;
    private String restUri;
    private String depthUri;
    private String wsUri;
    private Boolean pushEnabled = true;
    private Map<String, String> headers = new HashMap<>();
    private Duration requestTimeout = Duration.ofSeconds(5);
    private Duration pushConnectTimeout = Duration.ofSeconds(15);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Integer batchSize = 5;
    private Duration batchDelay = Duration.ofMillis(100);
    private Duration reconnectBaseDelay = Duration.ofSeconds(3);
    private Duration reconnectMaxDelay = Duration.ofSeconds(30);
    private Integer reconnectMaxAttempts = 5;
    private Duration pushRetryInterval = Duration.ofSeconds(60);
    private Duration keepAliveAfter = Duration.ofSeconds(30);
    private Duration keepAliveTimeout = Duration.ofSeconds(10);

    void validate() {
        if (venue == null) {
            throw new ConfigurationException("Venue configuration without a venue name");
        }

        if (restUri == null || restUri.isBlank()) {
            throw new ConfigurationException("No rest-uri configured for " + venue);
        }

        if (venue == Venue.VEST && (depthUri == null || depthUri.isBlank())) {
            throw new ConfigurationException("No depth-uri configured for " + venue);
        }

        if (isPushEnabled() && venue != Venue.EXTENDED && (wsUri == null || wsUri.isBlank())) {
            throw new ConfigurationException("Push is enabled but no ws-uri is configured for " + venue);
        }

        if (batchSize == null || batchSize <= 0) {
            throw new ConfigurationException("batch-size must be positive for " + venue);
        }

        if (reconnectMaxAttempts == null || reconnectMaxAttempts <= 0) {
            throw new ConfigurationException("reconnect-max-attempts must be positive for " + venue);
        }

        requirePositive(venue + " request-timeout", requestTimeout);
        requirePositive(venue + " push-connect-timeout", pushConnectTimeout);
        requirePositive(venue + " poll-interval", pollInterval);
        requirePositive(venue + " reconnect-base-delay", reconnectBaseDelay);
        requirePositive(venue + " reconnect-max-delay", reconnectMaxDelay);
        requirePositive(venue + " push-retry-interval", pushRetryInterval);
        requirePositive(venue + " keep-alive-after", keepAliveAfter);
        requirePositive(venue + " keep-alive-timeout", keepAliveTimeout);

        if (reconnectBaseDelay.compareTo(reconnectMaxDelay) > 0) {
            throw new ConfigurationException("reconnect-base-delay exceeds reconnect-max-delay for " + venue);
        }
    }

    public Venue getVenue() {
        return venue;
    }

    public void setVenue(Venue venue) {
        this.venue = venue;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public String getRestUri() {
        return restUri;
    }

    public void setRestUri(String restUri) {
        this.restUri = restUri;
    }

    public String getDepthUri() {
        return depthUri;
    }

    public void setDepthUri(String depthUri) {
        this.depthUri = depthUri;
    }

    public String getWsUri() {
        return wsUri;
    }

    public void setWsUri(String wsUri) {
        this.wsUri = wsUri;
    }

    public boolean isPushEnabled() {
        return pushEnabled != null && pushEnabled;
    }

    public void setPushEnabled(Boolean pushEnabled) {
        this.pushEnabled = pushEnabled;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getPushConnectTimeout() {
        return pushConnectTimeout;
    }

    public void setPushConnectTimeout(Duration pushConnectTimeout) {
        this.pushConnectTimeout = pushConnectTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getBatchDelay() {
        return batchDelay;
    }

    public void setBatchDelay(Duration batchDelay) {
        this.batchDelay = batchDelay;
    }

    public Duration getReconnectBaseDelay() {
        return reconnectBaseDelay;
    }

    public void setReconnectBaseDelay(Duration reconnectBaseDelay) {
        this.reconnectBaseDelay = reconnectBaseDelay;
    }

    public Duration getReconnectMaxDelay() {
        return reconnectMaxDelay;
    }

    public void setReconnectMaxDelay(Duration reconnectMaxDelay) {
        this.reconnectMaxDelay = reconnectMaxDelay;
    }

    public Integer getReconnectMaxAttempts() {
        return reconnectMaxAttempts;
    }

    public void setReconnectMaxAttempts(Integer reconnectMaxAttempts) {
        this.reconnectMaxAttempts = reconnectMaxAttempts;
    }

    public Duration getPushRetryInterval() {
        return pushRetryInterval;
    }

    public void setPushRetryInterval(Duration pushRetryInterval) {
        this.pushRetryInterval = pushRetryInterval;
    }

    public Duration getKeepAliveAfter() {
        return keepAliveAfter;
    }

    public void setKeepAliveAfter(Duration keepAliveAfter) {
        this.keepAliveAfter = keepAliveAfter;
    }

    public Duration getKeepAliveTimeout() {
        return keepAliveTimeout;
    }

    public void setKeepAliveTimeout(Duration keepAliveTimeout) {
        this.keepAliveTimeout = keepAliveTimeout;
    }

    @Override
    public String toString() {
        return venue + " " + restUri;
    }
}
