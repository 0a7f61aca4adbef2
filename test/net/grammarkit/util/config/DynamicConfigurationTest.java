package net.grammarkit.util.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DynamicConfigurationTest {

    @Test
    public void explicitValuesTakePrecedence() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(new Configuration() {
            public String get(String key) {
                return "source:" + key;
            }
        });
        config.put("a.b", "explicit");
        assertEquals("explicit", config.get("a.b"));
        assertEquals("source:c", config.get("c"));
    }

    @Test
    public void sourcesAreConsultedInOrder() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(new Configuration() {
            public String get(String key) {
                return null;
            }
        });
        config.addSource(new Configuration() {
            public String get(String key) {
                return "second";
            }
        });
        assertEquals("second", config.get("x"));
    }

    @Test
    public void lookupsAreCached() {
        final int[] calls = new int[1];
        DynamicConfiguration config = new DynamicConfiguration();
        config.addSource(new Configuration() {
            public String get(String key) {
                calls[0]++;
                return null;
            }
        });
        assertNull(config.get("missing"));
        assertNull(config.get("missing"));
        assertEquals(1, calls[0]);
    }

    @Test
    public void systemPropertiesAreASource() {
        String key = "grammarkit.test.dynamicConfiguration";
        System.setProperty(key, "on");
        try {
            assertEquals("on", DynamicConfiguration.makeDefault().get(key));
        } finally {
            System.clearProperty(key);
        }
        assertNull(new DynamicConfiguration().get(key));
    }

    @Test
    public void environmentNames() {
        assertEquals("GRAMMARKIT_LOG_LEVEL",
            DynamicConfiguration.envName("grammarkit.log.level"));
    }

}
