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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.curtinfrc.polar.PolarLog;

/**
 * Opt-in wall-clock profiler for loaders and integration loops.
 *
 * <p>Usage: {@code try (Profiler.Section s = Profiler.section("name")) { ... }}. When the profiler
 * is disabled every call returns immediately and sections are a shared no-op.
 */
public final class Profiler {
  /** A timed region. Closing it records the elapsed time. */
  public interface Section extends AutoCloseable {
    @Override
    void close();
  }

  private static final Section NOOP = () -> {};

  private static volatile Profiler INSTANCE;

  private final ProfilerConfig cfg;
  private final ConcurrentHashMap<String, ProfilerStats> stats = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();
  private final ScheduledExecutorService ses;

  Profiler(ProfilerConfig cfg, boolean periodicSummaries) {
    this.cfg = cfg;
    if (!cfg.enabled || !periodicSummaries) {
      this.ses = null;
      return;
    }

    ThreadFactory tf =
        r -> {
          Thread t = new Thread(r, "PolarProfilerSummary");
          t.setDaemon(true);
          return t;
        };
    this.ses = Executors.newSingleThreadScheduledExecutor(tf);
    this.ses.scheduleAtFixedRate(
        () -> {
          try {
            logSummary("periodic");
          } catch (RuntimeException e) {
            PolarLog.error("Profiler summary failed", e);
          }
        },
        cfg.summaryPeriodMs,
        cfg.summaryPeriodMs,
        TimeUnit.MILLISECONDS);

    Runtime.getRuntime()
        .addShutdownHook(new Thread(() -> logSummary("shutdown"), "PolarProfilerShutdown"));
  }

  public static boolean enabled() {
    Profiler p = INSTANCE;
    return p != null && p.cfg.enabled;
  }

  public static void ensureInit() {
    if (INSTANCE != null) return;
    synchronized (Profiler.class) {
      if (INSTANCE != null) return;
      ProfilerConfig cfg = ProfilerConfig.fromSystemProperties(false);
      INSTANCE = new Profiler(cfg.enabled ? cfg : ProfilerConfig.disabled(), true);
      if (cfg.enabled) {
        PolarLog.log("Profiler enabled, summary every " + cfg.summaryPeriodMs + " ms");
      }
    }
  }

  public static Section section(String name) {
    ensureInit();
    Profiler p = INSTANCE;
    if (!p.cfg.enabled) return NOOP;
    return p.open(name);
  }

  public static void counterAdd(String name, long delta) {
    ensureInit();
    Profiler p = INSTANCE;
    if (!p.cfg.enabled) return;
    p.addCounter(name, delta);
  }

  public static void gaugeSet(String name, long value) {
    ensureInit();
    Profiler p = INSTANCE;
    if (!p.cfg.enabled) return;
    p.setGauge(name, value);
  }

  public static void dumpNow(String reason) {
    ensureInit();
    Profiler p = INSTANCE;
    if (!p.cfg.enabled) return;
    p.logSummary(reason == null ? "manual" : reason);
  }

  public static void shutdown() {
    Profiler p = INSTANCE;
    if (p == null) return;
    if (p.cfg.enabled) {
      p.logSummary("shutdown");
    }
    if (p.ses != null) {
      p.ses.shutdownNow();
    }
  }

  Section open(String name) {
    long start = System.nanoTime();
    return () -> record(name, System.nanoTime() - start);
  }

  void addCounter(String name, long delta) {
    counters.computeIfAbsent(name, k -> new AtomicLong(0L)).addAndGet(delta);
  }

  void setGauge(String name, long value) {
    gauges.computeIfAbsent(name, k -> new AtomicLong(0L)).set(value);
  }

  void record(String name, long durNs) {
    stats.computeIfAbsent(name, ProfilerStats::new).record(durNs);
  }

  private void logSummary(String reason) {
    String summary = summaryText(reason);
    if (!summary.isEmpty()) {
      PolarLog.log(summary);
    }
  }

  /** Formats and resets the current window. Empty when nothing was recorded. */
  String summaryText(String reason) {
    List<ProfilerStats.Snapshot> snaps = new ArrayList<>(stats.size());
    for (Map.Entry<String, ProfilerStats> e : stats.entrySet()) {
      ProfilerStats.Snapshot s = e.getValue().snapshotAndResetWindow();
      if (s.count() > 0) snaps.add(s);
    }
    if (snaps.isEmpty() && counters.isEmpty() && gauges.isEmpty()) return "";
    snaps.sort(Comparator.comparingLong(ProfilerStats.Snapshot::totalNs).reversed());

    List<Map.Entry<String, AtomicLong>> ctr = new ArrayList<>(counters.entrySet());
    ctr.sort(
        Comparator.comparingLong((Map.Entry<String, AtomicLong> e) -> e.getValue().get())
            .reversed());

    List<Map.Entry<String, AtomicLong>> ggs = new ArrayList<>(gauges.entrySet());
    ggs.sort(Map.Entry.comparingByKey());

    StringBuilder b = new StringBuilder(1024);
    b.append("profiler summary (").append(reason).append(')');
    int lim = Math.min(cfg.topSections, snaps.size());
    for (int i = 0; i < lim; i++) {
      ProfilerStats.Snapshot s = snaps.get(i);
      b.append(
          String.format(
              Locale.ROOT,
              "%n  %s count=%d mean=%.1fus min=%.1fus max=%.1fus",
              s.name(),
              s.count(),
              s.meanMicros(),
              s.minNs() / 1000.0,
              s.maxNs() / 1000.0));
    }
    int clim = Math.min(cfg.topCounters, ctr.size());
    for (int i = 0; i < clim; i++) {
      var e = ctr.get(i);
      b.append(String.format(Locale.ROOT, "%n  counter %s=%d", e.getKey(), e.getValue().get()));
    }
    int glim = Math.min(cfg.topGauges, ggs.size());
    for (int i = 0; i < glim; i++) {
      var e = ggs.get(i);
      b.append(String.format(Locale.ROOT, "%n  gauge %s=%d", e.getKey(), e.getValue().get()));
    }
    return b.toString();
  }
}
