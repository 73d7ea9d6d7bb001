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

package org.curtinfrc.polar.Pendulum;

import java.util.List;
import java.util.Objects;
import org.curtinfrc.polar.Mass.MassSegment;

/**
 * A suspended pilot ready to be stepped: the untrimmed pilot segments, the pivot and the parameters
 * derived from them.
 */
public final class PendulumModel {
  private final List<MassSegment> pilotSegments;
  private final RiserPivot pivot;
  private final double referenceHeight;
  private final double totalWeight;
  private final PilotPendulumParams params;

  private PendulumModel(
      List<MassSegment> pilotSegments,
      RiserPivot pivot,
      double referenceHeight,
      double totalWeight) {
    this.pilotSegments = List.copyOf(pilotSegments);
    this.pivot = pivot;
    this.referenceHeight = referenceHeight;
    this.totalWeight = totalWeight;
    this.params =
        PilotPendulum.computePilotPendulumParams(
            this.pilotSegments, pivot.x(), pivot.z(), referenceHeight, totalWeight);
  }

  public static PendulumModel of(
      List<MassSegment> pilotSegments,
      RiserPivot pivot,
      double referenceHeight,
      double totalWeight) {
    Objects.requireNonNull(pilotSegments, "pilotSegments");
    Objects.requireNonNull(pivot, "pivot");
    return new PendulumModel(pilotSegments, pivot, referenceHeight, totalWeight);
  }

  public PilotPendulumParams params() {
    return params;
  }

  public RiserPivot pivot() {
    return pivot;
  }

  public List<MassSegment> pilotSegments() {
    return pilotSegments;
  }

  /** Swing damping at the given rate and density, N m. */
  public double dampingTorque(double swingRate, double rho) {
    return PilotPendulum.pilotSwingDampingTorque(
        pilotSegments, pivot.x(), pivot.z(), swingRate, rho, referenceHeight, totalWeight);
  }

  /**
   * Swing acceleration including quadratic damping.
   *
   * @param state current swing
   * @param aeroTorque additional aerodynamic torque about the pivot, N m
   * @param parentPitchAccel canopy pitch acceleration, rad/s^2
   * @param rho air density, kg/m^3
   * @return swing acceleration, rad/s^2
   */
  public double acceleration(
      PendulumState state, double aeroTorque, double parentPitchAccel, double rho) {
    double damping = dampingTorque(state.swingRate(), rho);
    return PilotPendulum.pilotPendulumEOM(params, state, aeroTorque + damping, parentPitchAccel);
  }

  public PendulumState step(
      PendulumState state, double aeroTorque, double parentPitchAccel, double rho, double dt) {
    return state.advance(acceleration(state, aeroTorque, parentPitchAccel, rho), dt);
  }

  /** Pilot segments swung to the current angle about the pivot. */
  public List<MassSegment> swungSegments(PendulumState state) {
    return PilotPendulum.rotatePilotSegments(
        pilotSegments, pivot.x(), pivot.z(), state.swingAngle());
  }
}
