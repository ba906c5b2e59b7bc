package com.pianola.pool;

import com.pianola.mailbox.config.MailboxConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration of the worker pool and the requests sent to it.
 */
public class PoolConfig {

    public static final String POOL_SIZE_PROPERTY = "pianola.pool.size";
    public static final String ASK_TIMEOUT_PROPERTY = "pianola.ask.timeout.ms";
    public static final String MAILBOX_CAPACITY_PROPERTY = "pianola.mailbox.capacity";
    public static final String SIMULATED_WORK_PROPERTY = "pianola.note.simulated-work.micros";

    public static final int DEFAULT_POOL_SIZE = 8;
    public static final Duration DEFAULT_ASK_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SIMULATED_WORK = Duration.ofNanos(100_000);

    private int poolSize = DEFAULT_POOL_SIZE;
    private Duration askTimeout = DEFAULT_ASK_TIMEOUT;
    private Duration simulatedWork = DEFAULT_SIMULATED_WORK;
    private MailboxConfig mailboxConfig = new MailboxConfig();

    public PoolConfig() {
        // Use defaults
    }

    /**
     * Reads overrides from the JVM system properties; unset properties keep their defaults.
     *
     * @throws IllegalArgumentException if a property is set to an invalid value
     */
    public static PoolConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads overrides from the given properties; unset properties keep their defaults.
     *
     * @throws IllegalArgumentException if a property is set to an invalid value
     */
    public static PoolConfig fromProperties(Properties properties) {
        PoolConfig config = new PoolConfig();
        String poolSize = properties.getProperty(POOL_SIZE_PROPERTY);
        if (poolSize != null) {
            config.setPoolSize(parseInt(POOL_SIZE_PROPERTY, poolSize));
        }
        String askTimeout = properties.getProperty(ASK_TIMEOUT_PROPERTY);
        if (askTimeout != null) {
            config.setAskTimeout(Duration.ofMillis(parse(ASK_TIMEOUT_PROPERTY, askTimeout)));
        }
        String capacity = properties.getProperty(MAILBOX_CAPACITY_PROPERTY);
        if (capacity != null) {
            config.getMailboxConfig().setMaxCapacity(parseInt(MAILBOX_CAPACITY_PROPERTY, capacity));
        }
        String simulatedWork = properties.getProperty(SIMULATED_WORK_PROPERTY);
        if (simulatedWork != null) {
            config.setSimulatedWork(Duration.ofNanos(parse(SIMULATED_WORK_PROPERTY, simulatedWork) * 1_000));
        }
        return config;
    }

    private static int parseInt(String property, String value) {
        long parsed = parse(property, value);
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid value for " + property + ": " + value);
        }
        return (int) parsed;
    }

    private static long parse(String property, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + property + ": " + value, e);
        }
    }

    public int getPoolSize() {
        return poolSize;
    }

    /**
     * Sets the number of workers. Validated by {@link ActorPoolManager#initialize(int)}.
     */
    public PoolConfig setPoolSize(int poolSize) {
        this.poolSize = poolSize;
        return this;
    }

    public Duration getAskTimeout() {
        return askTimeout;
    }

    public PoolConfig setAskTimeout(Duration askTimeout) {
        Objects.requireNonNull(askTimeout, "askTimeout");
        if (askTimeout.isNegative() || askTimeout.isZero()) {
            throw new IllegalArgumentException("askTimeout must be positive: " + askTimeout);
        }
        this.askTimeout = askTimeout;
        return this;
    }

    public Duration getSimulatedWork() {
        return simulatedWork;
    }

    public PoolConfig setSimulatedWork(Duration simulatedWork) {
        Objects.requireNonNull(simulatedWork, "simulatedWork");
        if (simulatedWork.isNegative()) {
            throw new IllegalArgumentException("simulatedWork must not be negative: " + simulatedWork);
        }
        this.simulatedWork = simulatedWork;
        return this;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    public PoolConfig setMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = Objects.requireNonNull(mailboxConfig, "mailboxConfig");
        return this;
    }

    @Override
    public String toString() {
        return "PoolConfig{poolSize=" + poolSize
                + ", askTimeout=" + askTimeout
                + ", simulatedWork=" + simulatedWork
                + ", mailbox=" + mailboxConfig + '}';
    }
}
