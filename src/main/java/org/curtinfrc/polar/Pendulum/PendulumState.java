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

/**
 * Pilot swing relative to the canopy.
 *
 * @param swingAngle pilot pitch minus canopy pitch, radians
 * @param swingRate rate of change of {@code swingAngle}, rad/s
 */
public record PendulumState(double swingAngle, double swingRate) {
  public static final PendulumState AT_REST = new PendulumState(0.0, 0.0);

  /** Semi-implicit Euler step: the rate is updated first and the new rate moves the angle. */
  public PendulumState advance(double swingAcceleration, double dt) {
    double rate = swingRate + swingAcceleration * dt;
    return new PendulumState(swingAngle + rate * dt, rate);
  }
}
