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

package org.curtinfrc.polar.Composite;

import java.util.Objects;
import org.curtinfrc.polar.Profiler.Profiler;
import org.curtinfrc.polar.Vehicles.VehicleDefinition;

/**
 * Holds the current {@link CompositeFrame} for one vehicle and rebuilds it only when deployment or
 * pilot swing has moved past tolerance. Not thread-safe; one tracker per simulation loop.
 */
public final class CompositeFrameTracker {
  private final VehicleDefinition vehicle;
  private final double rho;
  private CompositeFrame frame;
  private long rebuilds;

  public CompositeFrameTracker(VehicleDefinition vehicle, double rho) {
    this.vehicle = Objects.requireNonNull(vehicle, "vehicle");
    this.rho = rho;
  }

  /**
   * Returns a frame for the given inputs, reusing the previous one when it is still close enough.
   *
   * @param deploy canopy deployment fraction
   * @param pilotPitch pilot swing, radians
   * @return current frame
   */
  public CompositeFrame frameFor(double deploy, double pilotPitch) {
    if (frame == null || frame.needsRebuild(deploy, pilotPitch)) {
      frame = CompositeFrame.build(vehicle, deploy, pilotPitch, rho);
      rebuilds++;
      Profiler.counterAdd("CompositeFrame.rebuilds", 1);
    }
    return frame;
  }

  public long rebuildCount() {
    return rebuilds;
  }

  public VehicleDefinition vehicle() {
    return vehicle;
  }
}
