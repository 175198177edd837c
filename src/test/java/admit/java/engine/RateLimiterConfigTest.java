package admit.java.engine;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterConfigTest {

    @Test
    void factories_setAlgorithmType() {
        assertEquals(AlgorithmType.FIXED_WINDOW,
            RateLimiterConfig.fixedWindow(3, Duration.ofSeconds(1)).algorithmType());
        assertEquals(AlgorithmType.TOKEN_BUCKET,
            RateLimiterConfig.tokenBucket(2, Duration.ofMillis(100)).algorithmType());
        assertEquals(AlgorithmType.SLIDING_WINDOW_LOG,
            RateLimiterConfig.slidingWindowLog(2, Duration.ofSeconds(1)).algorithmType());
    }

    @Test
    void invalidValues_failFast() {
        assertThrows(IllegalArgumentException.class,
            () -> RateLimiterConfig.fixedWindow(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> RateLimiterConfig.tokenBucket(1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> RateLimiterConfig.slidingWindowLog(1, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> new RateLimiterConfig(null, 1, Duration.ofSeconds(1)));
    }

    @Test
    void fromProperties_readsPrefixedKeys() {
        Properties props = new Properties();
        props.setProperty("login.algorithm", "sliding-window-log");
        props.setProperty("login.limit", " 5 ");
        props.setProperty("login.period", "PT1M");

        RateLimiterConfig config = RateLimiterConfig.fromProperties(props, "login");

        assertEquals(RateLimiterConfig.slidingWindowLog(5, Duration.ofMinutes(1)), config);
    }

    @Test
    void fromProperties_loadsClasspathFile() throws Exception {
        Properties props = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/limiters.properties")) {
            assertNotNull(in, "limiters.properties should be on the test classpath");
            props.load(in);
        }

        assertEquals(RateLimiterConfig.tokenBucket(2, Duration.ofMillis(100)),
            RateLimiterConfig.fromProperties(props, "api"));
        assertEquals(RateLimiterConfig.fixedWindow(3, Duration.ofDays(1)),
            RateLimiterConfig.fromProperties(props, "password"));
    }

    @Test
    void fromProperties_rejectsMissingOrMalformedValues() {
        Properties props = new Properties();
        props.setProperty("x.algorithm", "TOKEN_BUCKET");
        props.setProperty("x.limit", "10");

        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
            () -> RateLimiterConfig.fromProperties(props, "x"));
        assertTrue(missing.getMessage().contains("x.period"));

        props.setProperty("x.period", "one second");
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.fromProperties(props, "x"));

        props.setProperty("x.period", "PT1S");
        props.setProperty("x.limit", "ten");
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.fromProperties(props, "x"));

        props.setProperty("x.limit", "10");
        props.setProperty("x.algorithm", "leaky_bucket");
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.fromProperties(props, "x"));

        props.setProperty("x.algorithm", "TOKEN_BUCKET");
        props.setProperty("x.limit", "0");
        assertThrows(IllegalArgumentException.class, () -> RateLimiterConfig.fromProperties(props, "x"));
    }
}
