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

package org.curtinfrc.polar.Geometry;

/**
 * Three-component vector. The frame (NED body, NED inertial, wind, render) is given by the caller,
 * never by the type.
 */
public record Vec3(double x, double y, double z) {
  public static final Vec3 ZERO = new Vec3(0.0, 0.0, 0.0);
  public static final Vec3 UNIT_X = new Vec3(1.0, 0.0, 0.0);
  public static final Vec3 UNIT_Y = new Vec3(0.0, 1.0, 0.0);
  public static final Vec3 UNIT_Z = new Vec3(0.0, 0.0, 1.0);

  public Vec3 plus(Vec3 o) {
    return new Vec3(x + o.x, y + o.y, z + o.z);
  }

  public Vec3 minus(Vec3 o) {
    return new Vec3(x - o.x, y - o.y, z - o.z);
  }

  public Vec3 times(double s) {
    return new Vec3(x * s, y * s, z * s);
  }

  public double dot(Vec3 o) {
    return x * o.x + y * o.y + z * o.z;
  }

  public Vec3 cross(Vec3 o) {
    return new Vec3(y * o.z - z * o.y, z * o.x - x * o.z, x * o.y - y * o.x);
  }

  public double norm() {
    return Math.sqrt(x * x + y * y + z * z);
  }

  /** Returns the unit vector, or {@link #ZERO} when the length is below {@code 1e-12}. */
  public Vec3 normalized() {
    double n = norm();
    if (n < 1e-12) return ZERO;
    return new Vec3(x / n, y / n, z / n);
  }

  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
  }
}
