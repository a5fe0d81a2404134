package io.antecedent.ownership.spring;

import io.antecedent.ownership.retry.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties that drive the release ownership auto-configuration.
 */
@Validated
@ConfigurationProperties(prefix = "antecedent.ownership")
public class ReleaseOwnershipProperties {

    private boolean enabled = true;
    @Valid
    private final RetryProperties retry = new RetryProperties();
    private final KubernetesProperties kubernetes = new KubernetesProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public KubernetesProperties getKubernetes() {
        return kubernetes;
    }

    /**
     * Backoff applied to live resource reads while verifying ownership.
     */
    public static class RetryProperties {
        @NotNull
        private Duration initialInterval = RetryPolicy.DEFAULT.initialInterval();
        @DecimalMin("1.0")
        private double factor = RetryPolicy.DEFAULT.factor();
        @DecimalMin("0.0")
        private double jitter = RetryPolicy.DEFAULT.jitter();
        @Min(1)
        private int maxAttempts = RetryPolicy.DEFAULT.maxAttempts();
        @NotNull
        private Duration maxElapsed = RetryPolicy.DEFAULT.maxElapsed();

        public Duration getInitialInterval() {
            return initialInterval;
        }

        public void setInitialInterval(Duration initialInterval) {
            this.initialInterval = requireNonNegative(initialInterval,
                "antecedent.ownership.retry.initial-interval");
        }

        public double getFactor() {
            return factor;
        }

        public void setFactor(double factor) {
            this.factor = factor;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getMaxElapsed() {
            return maxElapsed;
        }

        public void setMaxElapsed(Duration maxElapsed) {
            this.maxElapsed = requireNonNegative(maxElapsed, "antecedent.ownership.retry.max-elapsed");
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(initialInterval, factor, jitter, maxAttempts, maxElapsed);
        }
    }

    /**
     * Overrides applied on top of the auto-detected Kubernetes client configuration.
     */
    public static class KubernetesProperties {
        private String context;
        private String masterUrl;

        public String getContext() {
            return context;
        }

        public void setContext(String context) {
            this.context = blankToNull(context);
        }

        public String getMasterUrl() {
            return masterUrl;
        }

        public void setMasterUrl(String masterUrl) {
            this.masterUrl = blankToNull(masterUrl);
        }
    }

    private static Duration requireNonNegative(Duration value, String property) {
        Objects.requireNonNull(value, property);
        if (value.isNegative()) {
            throw new IllegalArgumentException(property + " must not be negative, but was " + value);
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
