/**
 * Rating store configuration properties
 * Connection, pool and retry settings for the Goodreads rating dataset (app.rating-store.*)
 *
 * @author William Callahan
 */

package com.williamcallahan.shelf_scan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.rating-store")
public class RatingStoreProperties {

    private String url;
    private String username;
    private String password;
    private String table = "goodreads_books";
    private String readingListTable = "reading_list";
    private int maxPoolSize = 10;
    private Duration acquireTimeout = Duration.ofSeconds(5);
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private double backoffMultiplier = 2.0;
    private Duration maxBackoff = Duration.ofSeconds(3);
    private boolean recoveryProbeEnabled = true;

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getTable() { return table; }
    public void setTable(String table) { this.table = table; }

    public String getReadingListTable() { return readingListTable; }
    public void setReadingListTable(String readingListTable) { this.readingListTable = readingListTable; }

    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

    public Duration getAcquireTimeout() { return acquireTimeout; }
    public void setAcquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

    public boolean isRecoveryProbeEnabled() { return recoveryProbeEnabled; }
    public void setRecoveryProbeEnabled(boolean recoveryProbeEnabled) { this.recoveryProbeEnabled = recoveryProbeEnabled; }
}
