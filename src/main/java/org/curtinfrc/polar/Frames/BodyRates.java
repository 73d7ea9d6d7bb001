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

/** Body-axis angular rates in rad/s: roll rate p, pitch rate q, yaw rate r. */
public record BodyRates(double p, double q, double r) {
  public static final BodyRates ZERO = new BodyRates(0.0, 0.0, 0.0);

  public Vec3 toVec3() {
    return new Vec3(p, q, r);
  }
}
