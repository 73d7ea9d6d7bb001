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

/**
 * 3-2-1 Euler attitude (yaw, then pitch, then roll) in radians.
 *
 * <p>{@code theta = +-pi/2} is the gimbal singularity of this parameterization. Nothing here guards
 * it; {@link FrameMath#eulerRates} loses conditioning as it is approached.
 */
public record Attitude(double phi, double theta, double psi) {
  public static final Attitude LEVEL = new Attitude(0.0, 0.0, 0.0);

  public static Attitude ofDegrees(double phiDeg, double thetaDeg, double psiDeg) {
    return new Attitude(
        Math.toRadians(phiDeg), Math.toRadians(thetaDeg), Math.toRadians(psiDeg));
  }
}
