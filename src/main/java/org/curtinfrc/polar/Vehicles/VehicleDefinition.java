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

package org.curtinfrc.polar.Vehicles;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.curtinfrc.polar.Aero.AeroSegment;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Mass.CanopyGeometry;
import org.curtinfrc.polar.Mass.MassSegment;
import org.curtinfrc.polar.Pendulum.PendulumModel;
import org.curtinfrc.polar.Pendulum.PilotPendulum;
import org.curtinfrc.polar.Pendulum.RiserPivot;

/**
 * Geometry, mass layout and aerodynamic segments of one vehicle.
 *
 * <p>A canopy vehicle has pilot segments and a riser pivot. Its pilot can swing about the pivot and
 * its canopy segments shrink while the canopy inflates. Any other vehicle is a single rigid body
 * described by {@code bodySegments}.
 */
public record VehicleDefinition(
    String name,
    double referenceLength,
    double totalMass,
    List<MassSegment> bodySegments,
    List<MassSegment> pilotSegments,
    List<MassSegment> canopyStructureSegments,
    List<MassSegment> canopyAirSegments,
    RiserPivot pivot,
    double planformArea,
    double chord,
    List<AeroSegment> aeroSegments) {

  /** Forward shift of the canopy mass, per unit of undeployed fraction, in normalized units. */
  public static final double DEPLOY_CHORD_OFFSET = 0.15;

  private static final double FULL_DEPLOY_TOLERANCE = 0.001;

  public VehicleDefinition {
    Objects.requireNonNull(name, "name");
    bodySegments = List.copyOf(bodySegments);
    pilotSegments = List.copyOf(pilotSegments);
    canopyStructureSegments = List.copyOf(canopyStructureSegments);
    canopyAirSegments = List.copyOf(canopyAirSegments);
    aeroSegments = List.copyOf(aeroSegments);
    if (!pilotSegments.isEmpty() && pivot == null) {
      throw new IllegalArgumentException("pilot segments need a riser pivot: " + name);
    }
  }

  public boolean hasSuspendedPilot() {
    return !pilotSegments.isEmpty();
  }

  public CanopyGeometry canopyGeometry() {
    return CanopyGeometry.fromPlanform(planformArea, chord);
  }

  /** Swing model of the suspended pilot, or {@code null} for a rigid vehicle. */
  public PendulumModel pendulumModel() {
    if (!hasSuspendedPilot()) return null;
    return PendulumModel.of(pilotSegments, pivot, referenceLength, totalMass);
  }

  /**
   * Mass segments with the pilot swung by {@code pilotPitch} about the pivot and the canopy at the
   * given deployment.
   *
   * <p>Canopy segments have their span (y) scaled by {@code 0.1 + 0.9 d} and move forward by {@code
   * 0.15 (1 - d)}. Weight segments are body, pilot and canopy structure; inertia segments add the
   * trapped canopy air. A rigid vehicle ignores both arguments.
   *
   * @param pilotPitch pilot swing, radians
   * @param deploy canopy deployment fraction, clamped to {@code [0, 1]}
   * @return weight and inertia segments
   */
  public MassAssembly massAssembly(double pilotPitch, double deploy) {
    if (!hasSuspendedPilot()) {
      return new MassAssembly(bodySegments, bodySegments);
    }
    double d = Math.max(0.0, Math.min(1.0, deploy));
    List<MassSegment> pilot =
        PilotPendulum.rotatePilotSegments(pilotSegments, pivot.x(), pivot.z(), pilotPitch);
    List<MassSegment> structure = scaleForDeploy(canopyStructureSegments, d);
    List<MassSegment> air = scaleForDeploy(canopyAirSegments, d);

    List<MassSegment> weight = new ArrayList<>(bodySegments);
    weight.addAll(pilot);
    weight.addAll(structure);
    List<MassSegment> inertia = new ArrayList<>(weight);
    inertia.addAll(air);
    return new MassAssembly(weight, inertia);
  }

  private static List<MassSegment> scaleForDeploy(List<MassSegment> segments, double deploy) {
    if (Math.abs(deploy - 1.0) < FULL_DEPLOY_TOLERANCE) return segments;
    double spanScale = 0.1 + 0.9 * deploy;
    double chordOffset = DEPLOY_CHORD_OFFSET * (1.0 - deploy);
    List<MassSegment> out = new ArrayList<>(segments.size());
    for (MassSegment seg : segments) {
      Vec3 p = seg.normalizedPosition();
      out.add(seg.withPosition(new Vec3(p.x() + chordOffset, p.y() * spanScale, p.z())));
    }
    return out;
  }
}
