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

/** Time derivative of every {@link SimState} element. */
public record SimDerivatives(
    double xDot,
    double yDot,
    double zDot,
    double uDot,
    double vDot,
    double wDot,
    double phiDot,
    double thetaDot,
    double psiDot,
    double pDot,
    double qDot,
    double rDot) {

  /** Weighted Runge-Kutta average {@code (k1 + 2 k2 + 2 k3 + k4) / 6}. */
  static SimDerivatives rk4Average(
      SimDerivatives k1, SimDerivatives k2, SimDerivatives k3, SimDerivatives k4) {
    return new SimDerivatives(
        avg(k1.xDot, k2.xDot, k3.xDot, k4.xDot),
        avg(k1.yDot, k2.yDot, k3.yDot, k4.yDot),
        avg(k1.zDot, k2.zDot, k3.zDot, k4.zDot),
        avg(k1.uDot, k2.uDot, k3.uDot, k4.uDot),
        avg(k1.vDot, k2.vDot, k3.vDot, k4.vDot),
        avg(k1.wDot, k2.wDot, k3.wDot, k4.wDot),
        avg(k1.phiDot, k2.phiDot, k3.phiDot, k4.phiDot),
        avg(k1.thetaDot, k2.thetaDot, k3.thetaDot, k4.thetaDot),
        avg(k1.psiDot, k2.psiDot, k3.psiDot, k4.psiDot),
        avg(k1.pDot, k2.pDot, k3.pDot, k4.pDot),
        avg(k1.qDot, k2.qDot, k3.qDot, k4.qDot),
        avg(k1.rDot, k2.rDot, k3.rDot, k4.rDot));
  }

  private static double avg(double a, double b, double c, double d) {
    return (a + 2.0 * b + 2.0 * c + d) / 6.0;
  }
}
