package com.pianola.pool;

import com.pianola.mailbox.config.MailboxConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PoolConfigTest {

    @Test
    void emptyPropertiesKeepDefaults() {
        PoolConfig config = PoolConfig.fromProperties(new Properties());

        assertEquals(PoolConfig.DEFAULT_POOL_SIZE, config.getPoolSize());
        assertEquals(PoolConfig.DEFAULT_ASK_TIMEOUT, config.getAskTimeout());
        assertEquals(PoolConfig.DEFAULT_SIMULATED_WORK, config.getSimulatedWork());
        assertEquals(MailboxConfig.DEFAULT_MAX_CAPACITY, config.getMailboxConfig().getMaxCapacity());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(PoolConfig.POOL_SIZE_PROPERTY, "4");
        properties.setProperty(PoolConfig.ASK_TIMEOUT_PROPERTY, " 250 ");
        properties.setProperty(PoolConfig.MAILBOX_CAPACITY_PROPERTY, "64");
        properties.setProperty(PoolConfig.SIMULATED_WORK_PROPERTY, "0");

        PoolConfig config = PoolConfig.fromProperties(properties);

        assertEquals(4, config.getPoolSize());
        assertEquals(Duration.ofMillis(250), config.getAskTimeout());
        assertEquals(64, config.getMailboxConfig().getMaxCapacity());
        assertEquals(Duration.ZERO, config.getSimulatedWork());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty(PoolConfig.POOL_SIZE_PROPERTY, "2");
        try {
            assertEquals(2, PoolConfig.fromSystemProperties().getPoolSize());
        } finally {
            System.clearProperty(PoolConfig.POOL_SIZE_PROPERTY);
        }
    }

    @Test
    void nonNumericValueIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(PoolConfig.POOL_SIZE_PROPERTY, "eight");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> PoolConfig.fromProperties(properties));
        assertTrue(error.getMessage().contains(PoolConfig.POOL_SIZE_PROPERTY));
        assertInstanceOf(NumberFormatException.class, error.getCause());
    }

    @Test
    void valuesOutsideIntRangeAreRejected() {
        Properties poolSize = new Properties();
        poolSize.setProperty(PoolConfig.POOL_SIZE_PROPERTY, "4294967297");
        Properties capacity = new Properties();
        capacity.setProperty(PoolConfig.MAILBOX_CAPACITY_PROPERTY, "4294967360");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> PoolConfig.fromProperties(poolSize));
        assertTrue(error.getMessage().contains(PoolConfig.POOL_SIZE_PROPERTY));
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.fromProperties(capacity));
    }

    @Test
    void nonPositiveAskTimeoutIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(PoolConfig.ASK_TIMEOUT_PROPERTY, "0");

        assertThrows(IllegalArgumentException.class, () -> PoolConfig.fromProperties(properties));
        assertThrows(IllegalArgumentException.class, () -> new PoolConfig().setAskTimeout(Duration.ofMillis(-1)));
    }

    @Test
    void poolSizeIsOnlyValidatedAtInitialize() {
        PoolConfig config = new PoolConfig().setPoolSize(0);

        assertEquals(0, config.getPoolSize());
        assertTrue(config.toString().contains("poolSize=0"));
    }
}
