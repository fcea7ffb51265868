/**
 * Resolution configuration properties
 * Centralizes app.resolution.* settings: cache lifetimes, timeouts, batch limits and affiliate tags
 *
 * @author William Callahan
 */

package com.williamcallahan.shelf_scan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.resolution")
public class ResolutionProperties {

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Timeout timeout = new Timeout();

    @NestedConfigurationProperty
    private Batch batch = new Batch();

    @NestedConfigurationProperty
    private Affiliate affiliate = new Affiliate();

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Timeout getTimeout() { return timeout; }
    public void setTimeout(Timeout timeout) { this.timeout = timeout; }

    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }

    public Affiliate getAffiliate() { return affiliate; }
    public void setAffiliate(Affiliate affiliate) { this.affiliate = affiliate; }

    public static class Cache {
        private Duration bookTtl = Duration.ofDays(30);
        // Community ratings move slower than bibliographic fields
        private Duration ratingTtl = Duration.ofDays(90);

        public Duration getBookTtl() { return bookTtl; }
        public void setBookTtl(Duration bookTtl) { this.bookTtl = bookTtl; }

        public Duration getRatingTtl() { return ratingTtl; }
        public void setRatingTtl(Duration ratingTtl) { this.ratingTtl = ratingTtl; }
    }

    public static class Timeout {
        private Duration provider = Duration.ofSeconds(8);
        private Duration cache = Duration.ofSeconds(2);
        private Duration batch = Duration.ofSeconds(60);

        public Duration getProvider() { return provider; }
        public void setProvider(Duration provider) { this.provider = provider; }

        public Duration getCache() { return cache; }
        public void setCache(Duration cache) { this.cache = cache; }

        public Duration getBatch() { return batch; }
        public void setBatch(Duration batch) { this.batch = batch; }
    }

    public static class Batch {
        private int concurrency = 4;
        private int maxCandidates = 50;

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public int getMaxCandidates() { return maxCandidates; }
        public void setMaxCandidates(int maxCandidates) { this.maxCandidates = maxCandidates; }
    }

    public static class Affiliate {
        private String amazonTag = "shelfscan-20";

        public String getAmazonTag() { return amazonTag; }
        public void setAmazonTag(String amazonTag) { this.amazonTag = amazonTag; }
    }
}
