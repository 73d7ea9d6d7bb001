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

/**
 * Dimensionless coefficients of one segment at one flow condition.
 *
 * @param cl lift coefficient
 * @param cd drag coefficient
 * @param cy side force coefficient
 * @param cm pitching moment coefficient about the quarter chord
 * @param cp center of pressure as a chord fraction from the leading edge
 */
public record AeroCoefficients(double cl, double cd, double cy, double cm, double cp) {
  public static final double QUARTER_CHORD = 0.25;

  public static AeroCoefficients of(double cl, double cd, double cy) {
    return new AeroCoefficients(cl, cd, cy, 0.0, QUARTER_CHORD);
  }
}
