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

package org.curtinfrc.polar.Frames;

import org.curtinfrc.polar.Geometry.Vec3;

/**
 * Aerodynamic direction vectors in NED body axes for a given angle of attack and sideslip.
 *
 * <p>{@code windDir} points where the air comes from (parallel to the direction of travel), so drag
 * acts along {@code -windDir}. {@code liftDir} is perpendicular to the wind in the plane containing
 * body "up" {@code (0, 0, -1)}, and {@code sideDir = windDir x liftDir}.
 */
public record WindFrame(Vec3 windDir, Vec3 liftDir, Vec3 sideDir) {
  private static final Vec3 DEGENERATE_LIFT = new Vec3(-1.0, 0.0, 0.0);

  /**
   * Builds the wind frame.
   *
   * @param alpha angle of attack in radians, positive nose up
   * @param beta sideslip in radians, positive with wind from the right
   * @return orthonormal wind frame
   */
  public static WindFrame fromAngles(double alpha, double beta) {
    double ca = Math.cos(alpha);
    double sa = Math.sin(alpha);
    double cb = Math.cos(beta);
    double sb = Math.sin(beta);

    Vec3 wind = new Vec3(cb * ca, sb * ca, sa);
    // wind x up, with up = (0, 0, -1)
    Vec3 temp = new Vec3(-sb * ca, cb * ca, 0.0);
    Vec3 lift = temp.cross(wind);
    double len = lift.norm();
    lift = len > 1e-10 ? lift.times(1.0 / len) : DEGENERATE_LIFT;
    return new WindFrame(wind, lift, wind.cross(lift));
  }
}
