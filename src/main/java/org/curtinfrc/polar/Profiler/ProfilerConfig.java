/*
 * Copyright (C) 2026 Paul Hodges
 *
 * This file is part of PolarDynamics.
 *
 * PolarDynamics is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PolarDynamics is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PolarDynamics. If not, see https://www.gnu.org/licenses/.
 */

package org.curtinfrc.polar.Profiler;

import java.util.Locale;
import java.util.Set;

/**
 * Profiler settings, normally read from {@code polar.profiler.*} system properties.
 *
 * <p>The profiler is off unless {@code polar.profiler.enabled} is set.
 */
public final class ProfilerConfig {
  public static final String PROPERTY_PREFIX = "polar.profiler.";

  private static final Set<String> TRUE_WORDS = Set.of("1", "true", "yes", "y", "on");
  private static final Set<String> FALSE_WORDS = Set.of("0", "false", "no", "n", "off");

  public final boolean enabled;
  public final int summaryPeriodMs;
  public final int topSections;
  public final int topCounters;
  public final int topGauges;

  public ProfilerConfig(
      boolean enabled, int summaryPeriodMs, int topSections, int topCounters, int topGauges) {
    this.enabled = enabled;
    this.summaryPeriodMs = Math.max(250, summaryPeriodMs);
    this.topSections = clamp(topSections, 1, 2000);
    this.topCounters = clamp(topCounters, 0, 2000);
    this.topGauges = clamp(topGauges, 0, 2000);
  }

  public static ProfilerConfig disabled() {
    return new ProfilerConfig(false, 5000, 40, 40, 40);
  }

  /**
   * Reads {@code polar.profiler.enabled}, {@code summaryMs}, {@code topSections}, {@code
   * topCounters} and {@code topGauges}. Unparseable values fall back to the defaults.
   */
  public static ProfilerConfig fromSystemProperties(boolean defaultEnabled) {
    return new ProfilerConfig(
        boolProp(PROPERTY_PREFIX + "enabled", defaultEnabled),
        intProp(PROPERTY_PREFIX + "summaryMs", 5000),
        intProp(PROPERTY_PREFIX + "topSections", 40),
        intProp(PROPERTY_PREFIX + "topCounters", 40),
        intProp(PROPERTY_PREFIX + "topGauges", 40));
  }

  private static int clamp(int v, int lo, int hi) {
    return Math.max(lo, Math.min(hi, v));
  }

  static boolean boolProp(String key, boolean def) {
    String raw = System.getProperty(key);
    if (raw == null) return def;
    String word = raw.trim().toLowerCase(Locale.ROOT);
    if (TRUE_WORDS.contains(word)) return true;
    if (FALSE_WORDS.contains(word)) return false;
    return def;
  }

  static int intProp(String key, int def) {
    String raw = System.getProperty(key);
    if (raw == null) return def;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      return def;
    }
  }
}
