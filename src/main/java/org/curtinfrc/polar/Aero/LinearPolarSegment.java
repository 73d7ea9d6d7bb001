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

import java.util.Objects;
import org.curtinfrc.polar.Geometry.Vec3;

/**
 * Segment with a linear lift curve and a parabolic drag polar, clamped at the stall angle.
 *
 * <pre>
 * CL = cl0 + clAlpha * alpha            (alpha clamped to +-alphaStall)
 * CD = cd0 + k * CL^2
 * CY = cyBeta * beta
 * CM = cm0
 * </pre>
 */
public record LinearPolarSegment(
    String name,
    Vec3 position,
    double area,
    double chord,
    double pitchOffset,
    double cl0,
    double clAlpha,
    double alphaStall,
    double cd0,
    double k,
    double cyBeta,
    double cm0,
    double cp)
    implements AeroSegment {

  public LinearPolarSegment {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(position, "position");
    if (!(area >= 0.0)) {
      throw new IllegalArgumentException("area must be non-negative: " + name);
    }
    if (!(chord > 0.0)) {
      throw new IllegalArgumentException("chord must be positive: " + name);
    }
  }

  /** Pure drag body: no lift, no side force, center of pressure at the quarter chord. */
  public static LinearPolarSegment dragOnly(
      String name, Vec3 position, double area, double chord, double cd) {
    return new LinearPolarSegment(
        name, position, area, chord, 0.0, 0.0, 0.0, Math.PI, cd, 0.0, 0.0, 0.0, 0.25);
  }

  @Override
  public AeroCoefficients coefficients(double alpha, double beta) {
    double limit = Math.abs(alphaStall);
    double a = Math.max(-limit, Math.min(limit, alpha));
    double cl = cl0 + clAlpha * a;
    return new AeroCoefficients(cl, cd0 + k * cl * cl, cyBeta * beta, cm0, cp);
  }
}
