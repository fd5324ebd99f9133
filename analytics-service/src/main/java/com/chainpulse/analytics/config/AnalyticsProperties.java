package com.chainpulse.analytics.config;

import com.chainpulse.analytics.normalize.SupportedChain;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /**
     * Chains the service accepts. Targets on any other chain are dropped during normalization.
     */
    @NotEmpty
    private Set<SupportedChain> supportedChains = EnumSet.allOf(SupportedChain.class);

    @Valid
    private Normalization normalization = new Normalization();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Coalescing coalescing = new Coalescing();

    @Valid
    private FanOut fanOut = new FanOut();

    @Getter
    @Setter
    public static class Normalization {

        /**
         * Timestamps are floored to multiples of this many seconds.
         */
        @Min(1)
        private long bucketSeconds = 1800;
    }

    @Getter
    @Setter
    public static class Cache {

        /**
         * Lifetime of a cached partition result (seconds).
         */
        @Min(1)
        private long ttlSeconds = 86400;
    }

    @Getter
    @Setter
    public static class Coalescing {

        /**
         * Max computations running against the warehouse at once.
         */
        @Min(1)
        private int workerConcurrency = 20;

        /**
         * Attempts per computation, first one included.
         */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration retryWait = Duration.ofMillis(200);

        /**
         * How long a caller waits for a shared computation before giving up.
         */
        @NotNull
        private Duration waitTimeout = Duration.ofSeconds(60);

        /**
         * Time given to queued and running computations on shutdown.
         */
        @NotNull
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class FanOut {

        /**
         * Threads resolving chain partitions (fingerprint and result store lookup) in parallel.
         */
        @Min(1)
        private int lookupConcurrency = 8;
    }
}
