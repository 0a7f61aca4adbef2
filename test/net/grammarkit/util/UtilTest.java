package net.grammarkit.util;

import java.util.logging.Level;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilTest {

    @Test
    public void truthValues() {
        assertTrue(Util.isTrue("true"));
        assertTrue(Util.isTrue("YES"));
        assertTrue(Util.isTrue("1"));
        assertTrue(Util.isTrue("on"));
        assertFalse(Util.isTrue("0"));
        assertFalse(Util.isTrue(null));
    }

    @Test
    public void logLevels() {
        assertEquals(Level.FINE, Logging.parseLevel("fine", Level.INFO));
        assertEquals(Level.INFO, Logging.parseLevel(null, Level.INFO));
        assertEquals(Level.INFO, Logging.parseLevel("loud", Level.INFO));
    }

}
