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

import java.util.Objects;
import org.curtinfrc.polar.Geometry.Vec3;

/**
 * Point mass expressed as a fraction of the system mass at a position normalized by a reference
 * length (the pilot height for every bundled vehicle).
 *
 * <p>Mass ratios across a segment list are not required to sum to one.
 */
public record MassSegment(String name, double massRatio, Vec3 normalizedPosition) {
  public MassSegment {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(normalizedPosition, "normalizedPosition");
  }

  public static MassSegment of(String name, double massRatio, double x, double y, double z) {
    return new MassSegment(name, massRatio, new Vec3(x, y, z));
  }

  public MassSegment withPosition(Vec3 position) {
    return new MassSegment(name, massRatio, position);
  }
}
