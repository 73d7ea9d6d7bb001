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

package org.curtinfrc.polar.Mass;

import org.curtinfrc.polar.Geometry.Mat3;

/**
 * Symmetric inertia tensor in kg m^2.
 *
 * <p>The products of inertia are stored with the tensor sign already applied ({@code ixy = -sum m x
 * y}), so {@link #toMatrix()} is the tensor as used in {@code I * omega}.
 */
public record InertiaComponents(
    double ixx, double iyy, double izz, double ixy, double ixz, double iyz) {
  public static final InertiaComponents ZERO = new InertiaComponents(0, 0, 0, 0, 0, 0);

  public static InertiaComponents diagonal(double ixx, double iyy, double izz) {
    return new InertiaComponents(ixx, iyy, izz, 0.0, 0.0, 0.0);
  }

  public Mat3 toMatrix() {
    return new Mat3(ixx, ixy, ixz, ixy, iyy, iyz, ixz, iyz, izz);
  }

  /** Adds a diagonal contribution, leaving the products untouched. */
  public InertiaComponents plusDiagonal(double dxx, double dyy, double dzz) {
    return new InertiaComponents(ixx + dxx, iyy + dyy, izz + dzz, ixy, ixz, iyz);
  }
}
