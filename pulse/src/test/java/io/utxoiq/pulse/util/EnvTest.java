package io.utxoiq.pulse.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "PULSE_ENV_TEST_VALUE";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void testSystemPropertyFallback() {
        assertEquals("fallback", Env.get(KEY, "fallback"));

        System.setProperty(KEY, "from-property");
        assertEquals("from-property", Env.get(KEY, "fallback"));
    }

    @Test
    void testMalformedNumbersUseDefault() {
        System.setProperty(KEY, "twelve");
        assertEquals(7, Env.getInt(KEY, 7));
        assertEquals(7L, Env.getLong(KEY, 7L));
        assertEquals(1.5, Env.getDouble(KEY, 1.5));
        assertFalse(Env.getBool(KEY, false));
    }

    @Test
    void testDurationFormats() {
        System.setProperty(KEY, "250");
        assertEquals(Duration.ofMillis(250), Env.getDuration(KEY, Duration.ZERO));

        System.setProperty(KEY, "pt30s");
        assertEquals(Duration.ofSeconds(30), Env.getDuration(KEY, Duration.ZERO));

        System.setProperty(KEY, "soon");
        assertEquals(Duration.ZERO, Env.getDuration(KEY, Duration.ZERO));
    }
}
