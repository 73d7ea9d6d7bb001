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
 * Force magnitudes of one segment along the wind frame.
 *
 * @param lift force along the lift direction, N
 * @param drag force opposing the wind direction, N
 * @param side force along the side direction, N
 * @param moment intrinsic pitching moment about the segment quarter chord, N m
 * @param cp center of pressure as a chord fraction from the leading edge
 */
public record SegmentForceResult(double lift, double drag, double side, double moment, double cp) {
  /** Lift, drag and side only. The force acts at the segment position with no intrinsic moment. */
  public static SegmentForceResult of(double lift, double drag, double side) {
    return new SegmentForceResult(lift, drag, side, 0.0, AeroCoefficients.QUARTER_CHORD);
  }
}
