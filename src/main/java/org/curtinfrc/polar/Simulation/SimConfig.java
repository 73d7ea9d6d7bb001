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

package org.curtinfrc.polar.Simulation;

import java.util.List;
import java.util.Objects;
import org.curtinfrc.polar.Aero.AeroSegment;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Mass.AxisMass;
import org.curtinfrc.polar.Mass.InertiaComponents;

/**
 * Everything the derivative model needs that stays constant between configuration changes.
 *
 * @param segments aerodynamic segments
 * @param cg system CG, m
 * @param inertia inertia tensor about the CG
 * @param mass physical mass for gravity, kg
 * @param massPerAxis per-axis mass for the translational equations, or {@code null} to use {@code
 *     mass} on every axis
 * @param referenceHeight height that scales normalized segment positions, m
 * @param rho air density, kg/m^3
 */
public record SimConfig(
    List<AeroSegment> segments,
    Vec3 cg,
    InertiaComponents inertia,
    double mass,
    AxisMass massPerAxis,
    double referenceHeight,
    double rho) {
  public SimConfig {
    segments = List.copyOf(segments);
    Objects.requireNonNull(cg, "cg");
    Objects.requireNonNull(inertia, "inertia");
  }
}
