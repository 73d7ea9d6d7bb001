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

package org.curtinfrc.polar.Aero;

import org.curtinfrc.polar.Geometry.Vec3;

/**
 * One aerodynamic subdivision of a vehicle, such as a canopy cell or a pilot body part.
 *
 * <p>The coefficient lookup belongs to the implementation. Callers only supply local flow angles.
 */
public interface AeroSegment {
  String name();

  /** Aerodynamic center in NED body axes, normalized by the reference height. */
  Vec3 position();

  /** Reference area, m^2. */
  double area();

  /** Reference chord, m. */
  double chord();

  /**
   * Static pitch of the segment chord line relative to body x, radians. Zero for a chord along body
   * x, {@code pi/2} for an upright pilot.
   */
  default double pitchOffset() {
    return 0.0;
  }

  /**
   * Coefficients at the local flow angles.
   *
   * @param alpha local angle of attack, radians
   * @param beta local sideslip, radians
   * @return coefficients
   */
  AeroCoefficients coefficients(double alpha, double beta);
}
