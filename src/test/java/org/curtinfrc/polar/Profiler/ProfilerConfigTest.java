package org.curtinfrc.polar.Profiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ProfilerConfigTest {
  private final Map<String, String> saved = new HashMap<>();

  private void setProp(String key, String value) {
    if (!saved.containsKey(key)) {
      saved.put(key, System.getProperty(key));
    }
    System.setProperty(key, value);
  }

  @AfterEach
  void restoreProperties() {
    for (Map.Entry<String, String> e : saved.entrySet()) {
      if (e.getValue() == null) {
        System.clearProperty(e.getKey());
      } else {
        System.setProperty(e.getKey(), e.getValue());
      }
    }
    saved.clear();
  }

  @Test
  void disabledUsesDefaults() {
    ProfilerConfig cfg = ProfilerConfig.disabled();

    assertFalse(cfg.enabled);
    assertEquals(5000, cfg.summaryPeriodMs);
    assertEquals(40, cfg.topSections);
  }

  @Test
  void valuesAreClamped() {
    ProfilerConfig cfg = new ProfilerConfig(true, 10, 0, -5, 99999);

    assertEquals(250, cfg.summaryPeriodMs);
    assertEquals(1, cfg.topSections);
    assertEquals(0, cfg.topCounters);
    assertEquals(2000, cfg.topGauges);
  }

  @Test
  void readsSystemProperties() {
    setProp("polar.profiler.enabled", " Yes ");
    setProp("polar.profiler.summaryMs", "1500");
    setProp("polar.profiler.topSections", "12");
    setProp("polar.profiler.topCounters", "not a number");

    ProfilerConfig cfg = ProfilerConfig.fromSystemProperties(false);

    assertTrue(cfg.enabled);
    assertEquals(1500, cfg.summaryPeriodMs);
    assertEquals(12, cfg.topSections);
    assertEquals(40, cfg.topCounters);
  }

  @Test
  void unrecognisedBooleanFallsBackToDefault() {
    setProp("polar.profiler.test.flag", "maybe");

    assertTrue(ProfilerConfig.boolProp("polar.profiler.test.flag", true));
    assertFalse(ProfilerConfig.boolProp("polar.profiler.test.flag", false));

    setProp("polar.profiler.test.flag", "off");
    assertFalse(ProfilerConfig.boolProp("polar.profiler.test.flag", true));
  }
}
