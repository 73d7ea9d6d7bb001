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

package org.curtinfrc.polar.Vehicles;

import java.util.List;
import org.curtinfrc.polar.Mass.MassSegment;

/**
 * Mass segments of a vehicle in one configuration.
 *
 * @param weightSegments segments that carry weight, used for the CG
 * @param inertiaSegments segments that resist rotation, including trapped air
 */
public record MassAssembly(List<MassSegment> weightSegments, List<MassSegment> inertiaSegments) {
  public MassAssembly {
    weightSegments = List.copyOf(weightSegments);
    inertiaSegments = List.copyOf(inertiaSegments);
  }
}
