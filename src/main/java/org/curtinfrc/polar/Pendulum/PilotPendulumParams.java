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
 * Mass properties of a suspended pilot about the riser pivot.
 *
 * @param pilotMass pilot mass, kg
 * @param iyRiser pitch inertia about the pivot, kg m^2
 * @param riserToCg distance from the pivot to the pilot CG, m
 * @param cgOffsetX pilot CG x offset from the pivot, m
 * @param cgOffsetZ pilot CG z offset from the pivot, m
 */
public record PilotPendulumParams(
    double pilotMass, double iyRiser, double riserToCg, double cgOffsetX, double cgOffsetZ) {
  public static final PilotPendulumParams NONE = new PilotPendulumParams(0, 0, 0, 0, 0);
}
