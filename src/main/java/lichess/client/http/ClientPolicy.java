package lichess.client.http;

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Properties;

/**
 * Retry, timeout and routing settings of a client. Built once and never changed; build a new client to change it.
 */
public final class ClientPolicy {

    /**
     * Marks a timeout as unbounded. Streaming calls use it by default; the caller ends the stream instead.
     */
    public static final Duration INFINITE = ChronoUnit.FOREVER.getDuration();

    public static final URI DEFAULT_BASE_ADDRESS = URI.create("https://lichess.org");
    public static final URI DEFAULT_EXPLORER_ADDRESS = URI.create("https://explorer.lichess.ovh");
    public static final URI DEFAULT_TABLEBASE_ADDRESS = URI.create("https://tablebase.lichess.ovh");

    /**
     * Wait used after a 429 that carries no Retry-After header.
     */
    public static final Duration DEFAULT_RATE_LIMIT_FALLBACK = Duration.ofSeconds(60);

    static final String PROPERTY_PREFIX = "lichess.client.";

    private static final ClientPolicy DEFAULTS = builder().build();

    private final boolean autoRetryOnRateLimit;
    private final int maxRateLimitRetries;
    private final boolean unlimitedRateLimitRetries;
    private final Duration rateLimitFallbackDelay;
    private final boolean enableTransientRetry;
    private final int maxTransientRetries;
    private final Duration transientRetryBaseDelay;
    private final Duration transientRetryMaxDelay;
    private final Duration defaultTimeout;
    private final Duration streamingTimeout;
    private final URI baseAddress;
    private final URI explorerAddress;
    private final URI tablebaseAddress;

    private ClientPolicy(Builder builder) {
        this.autoRetryOnRateLimit = builder.autoRetryOnRateLimit;
        this.maxRateLimitRetries = builder.maxRateLimitRetries;
        this.unlimitedRateLimitRetries = builder.unlimitedRateLimitRetries;
        this.rateLimitFallbackDelay = builder.rateLimitFallbackDelay;
        this.enableTransientRetry = builder.enableTransientRetry;
        this.maxTransientRetries = builder.maxTransientRetries;
        this.transientRetryBaseDelay = builder.transientRetryBaseDelay;
        this.transientRetryMaxDelay = builder.transientRetryMaxDelay;
        this.defaultTimeout = builder.defaultTimeout;
        this.streamingTimeout = builder.streamingTimeout;
        this.baseAddress = builder.baseAddress;
        this.explorerAddress = builder.explorerAddress;
        this.tablebaseAddress = builder.tablebaseAddress;
    }

    public static ClientPolicy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a policy from {@code lichess.client.*} keys, e.g. {@code lichess.client.maxTransientRetries=5}.
     * Durations are ISO-8601 ({@code PT2S}) or plain milliseconds; {@code infinite} is accepted for
     * {@code streamingTimeout}. Missing keys keep their defaults.
     */
    public static ClientPolicy fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = property(properties, "autoRetryOnRateLimit")) != null) {
            builder.autoRetryOnRateLimit(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "maxRateLimitRetries")) != null) {
            builder.maxRateLimitRetries(parseInt("maxRateLimitRetries", value));
        }
        if ((value = property(properties, "unlimitedRateLimitRetries")) != null) {
            builder.unlimitedRateLimitRetries(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "rateLimitFallbackDelay")) != null) {
            builder.rateLimitFallbackDelay(parseDuration("rateLimitFallbackDelay", value));
        }
        if ((value = property(properties, "enableTransientRetry")) != null) {
            builder.enableTransientRetry(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "maxTransientRetries")) != null) {
            builder.maxTransientRetries(parseInt("maxTransientRetries", value));
        }
        if ((value = property(properties, "transientRetryBaseDelay")) != null) {
            builder.transientRetryBaseDelay(parseDuration("transientRetryBaseDelay", value));
        }
        if ((value = property(properties, "transientRetryMaxDelay")) != null) {
            builder.transientRetryMaxDelay(parseDuration("transientRetryMaxDelay", value));
        }
        if ((value = property(properties, "defaultTimeout")) != null) {
            builder.defaultTimeout(parseDuration("defaultTimeout", value));
        }
        if ((value = property(properties, "streamingTimeout")) != null) {
            builder.streamingTimeout(parseDuration("streamingTimeout", value));
        }
        if ((value = property(properties, "baseAddress")) != null) {
            builder.baseAddress(URI.create(value));
        }
        if ((value = property(properties, "explorerAddress")) != null) {
            builder.explorerAddress(URI.create(value));
        }
        if ((value = property(properties, "tablebaseAddress")) != null) {
            builder.tablebaseAddress(URI.create(value));
        }
        return builder.build();
    }

    public boolean isAutoRetryOnRateLimit() {
        return autoRetryOnRateLimit;
    }

    public int getMaxRateLimitRetries() {
        return maxRateLimitRetries;
    }

    public boolean isUnlimitedRateLimitRetries() {
        return unlimitedRateLimitRetries;
    }

    public Duration getRateLimitFallbackDelay() {
        return rateLimitFallbackDelay;
    }

    public boolean isEnableTransientRetry() {
        return enableTransientRetry;
    }

    public int getMaxTransientRetries() {
        return maxTransientRetries;
    }

    public Duration getTransientRetryBaseDelay() {
        return transientRetryBaseDelay;
    }

    public Duration getTransientRetryMaxDelay() {
        return transientRetryMaxDelay;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public Duration getStreamingTimeout() {
        return streamingTimeout;
    }

    public URI getBaseAddress() {
        return baseAddress;
    }

    public URI getExplorerAddress() {
        return explorerAddress;
    }

    public URI getTablebaseAddress() {
        return tablebaseAddress;
    }

    public URI addressOf(Host host) {
        switch (host) {
        case OPENING_EXPLORER:
            return explorerAddress;
        case TABLEBASE:
            return tablebaseAddress;
        default:
            return baseAddress;
        }
    }

    /**
     * Resolves a path such as {@code api/account} or {@code /api/account} against the host's base address.
     */
    public URI resolve(Host host, String path) {
        URI base = addressOf(host);
        String prefix = base.toString().endsWith("/") ? base.toString() : base + "/";
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return URI.create(prefix + relative);
    }

    public static boolean isInfinite(Duration timeout) {
        return timeout == null || INFINITE.equals(timeout);
    }

    @Override
    public String toString() {
        return "ClientPolicy{autoRetryOnRateLimit=" + autoRetryOnRateLimit
                + ", maxRateLimitRetries=" + maxRateLimitRetries
                + ", unlimitedRateLimitRetries=" + unlimitedRateLimitRetries
                + ", rateLimitFallbackDelay=" + rateLimitFallbackDelay
                + ", enableTransientRetry=" + enableTransientRetry
                + ", maxTransientRetries=" + maxTransientRetries
                + ", transientRetryBaseDelay=" + transientRetryBaseDelay
                + ", transientRetryMaxDelay=" + transientRetryMaxDelay
                + ", defaultTimeout=" + defaultTimeout
                + ", streamingTimeout=" + (isInfinite(streamingTimeout) ? "infinite" : streamingTimeout)
                + ", baseAddress=" + baseAddress
                + ", explorerAddress=" + explorerAddress
                + ", tablebaseAddress=" + tablebaseAddress + "}";
    }

    private static String property(Properties properties, String name) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PROPERTY_PREFIX + name + " is not a number: " + value, e);
        }
    }

    private static Duration parseDuration(String name, String value) {
        if ("infinite".equalsIgnoreCase(value)) {
            return INFINITE;
        }
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException(PROPERTY_PREFIX + name + " is not a duration: " + value, e);
        }
    }

    public static final class Builder {
        private boolean autoRetryOnRateLimit = true;
        private int maxRateLimitRetries = 3;
        private boolean unlimitedRateLimitRetries = false;
        private Duration rateLimitFallbackDelay = DEFAULT_RATE_LIMIT_FALLBACK;
        private boolean enableTransientRetry = true;
        private int maxTransientRetries = 3;
        private Duration transientRetryBaseDelay = Duration.ofSeconds(1);
        private Duration transientRetryMaxDelay = Duration.ofSeconds(30);
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Duration streamingTimeout = INFINITE;
        private URI baseAddress = DEFAULT_BASE_ADDRESS;
        private URI explorerAddress = DEFAULT_EXPLORER_ADDRESS;
        private URI tablebaseAddress = DEFAULT_TABLEBASE_ADDRESS;

        private Builder() {
        }

        /** Wait and retry when rate limited (default true). When false a 429 fails the call at once. */
        public Builder autoRetryOnRateLimit(boolean autoRetryOnRateLimit) {
            this.autoRetryOnRateLimit = autoRetryOnRateLimit;
            return this;
        }

        /** Retries after 429 responses per call (default 3). */
        public Builder maxRateLimitRetries(int maxRateLimitRetries) {
            this.maxRateLimitRetries = maxRateLimitRetries;
            return this;
        }

        /** Ignore {@link #maxRateLimitRetries(int)} and keep waiting until the call succeeds or is cancelled. */
        public Builder unlimitedRateLimitRetries(boolean unlimitedRateLimitRetries) {
            this.unlimitedRateLimitRetries = unlimitedRateLimitRetries;
            return this;
        }

        public Builder rateLimitFallbackDelay(Duration rateLimitFallbackDelay) {
            this.rateLimitFallbackDelay = rateLimitFallbackDelay;
            return this;
        }

        /** Retry DNS, connection and timeout failures (default true). */
        public Builder enableTransientRetry(boolean enableTransientRetry) {
            this.enableTransientRetry = enableTransientRetry;
            return this;
        }

        public Builder maxTransientRetries(int maxTransientRetries) {
            this.maxTransientRetries = maxTransientRetries;
            return this;
        }

        public Builder transientRetryBaseDelay(Duration transientRetryBaseDelay) {
            this.transientRetryBaseDelay = transientRetryBaseDelay;
            return this;
        }

        public Builder transientRetryMaxDelay(Duration transientRetryMaxDelay) {
            this.transientRetryMaxDelay = transientRetryMaxDelay;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        /** Timeout for streaming calls, or {@link ClientPolicy#INFINITE} (the default). */
        public Builder streamingTimeout(Duration streamingTimeout) {
            this.streamingTimeout = streamingTimeout;
            return this;
        }

        public Builder baseAddress(URI baseAddress) {
            this.baseAddress = baseAddress;
            return this;
        }

        public Builder explorerAddress(URI explorerAddress) {
            this.explorerAddress = explorerAddress;
            return this;
        }

        public Builder tablebaseAddress(URI tablebaseAddress) {
            this.tablebaseAddress = tablebaseAddress;
            return this;
        }

        public ClientPolicy build() {
            if (maxRateLimitRetries < 0) {
                throw new IllegalArgumentException("maxRateLimitRetries must be >= 0");
            }
            if (maxTransientRetries < 0) {
                throw new IllegalArgumentException("maxTransientRetries must be >= 0");
            }
            requirePositive("rateLimitFallbackDelay", rateLimitFallbackDelay);
            requirePositive("transientRetryBaseDelay", transientRetryBaseDelay);
            requirePositive("transientRetryMaxDelay", transientRetryMaxDelay);
            requirePositive("defaultTimeout", defaultTimeout);
            requirePositive("streamingTimeout", streamingTimeout);
            if (transientRetryBaseDelay.compareTo(transientRetryMaxDelay) > 0) {
                throw new IllegalArgumentException("transientRetryBaseDelay must not exceed transientRetryMaxDelay");
            }
            Objects.requireNonNull(baseAddress, "baseAddress");
            Objects.requireNonNull(explorerAddress, "explorerAddress");
            Objects.requireNonNull(tablebaseAddress, "tablebaseAddress");
            return new ClientPolicy(this);
        }

        private static void requirePositive(String name, Duration value) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, was " + value);
            }
        }
    }
}
