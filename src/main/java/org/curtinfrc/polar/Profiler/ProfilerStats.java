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

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/** Timing window for one named section. Reset each time a summary is taken. */
final class ProfilerStats {
  final String name;

  private final LongAdder count = new LongAdder();
  private final LongAdder totalNs = new LongAdder();
  private final AtomicLong minNs = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong maxNs = new AtomicLong(Long.MIN_VALUE);

  ProfilerStats(String name) {
    this.name = name;
  }

  void record(long durNs) {
    if (durNs <= 0) return;
    count.increment();
    totalNs.add(durNs);
    minNs.accumulateAndGet(durNs, Math::min);
    maxNs.accumulateAndGet(durNs, Math::max);
  }

  Snapshot snapshotAndResetWindow() {
    long c = count.sumThenReset();
    long t = totalNs.sumThenReset();
    long mn = minNs.getAndSet(Long.MAX_VALUE);
    long mx = maxNs.getAndSet(Long.MIN_VALUE);
    if (mn == Long.MAX_VALUE) mn = 0L;
    if (mx == Long.MIN_VALUE) mx = 0L;
    return new Snapshot(name, c, t, mn, mx);
  }

  record Snapshot(String name, long count, long totalNs, long minNs, long maxNs) {
    double meanMicros() {
      return count == 0 ? 0.0 : totalNs / (double) count / 1000.0;
    }
  }
}
