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

import org.curtinfrc.polar.Geometry.Vec3;

/**
 * Per-segment breakdown from {@link AeroAggregator#evaluateAeroForcesDetailed}.
 *
 * @param name segment name
 * @param forces force magnitudes at the local flow condition
 * @param localVelocity body velocity plus the rotational contribution, m/s
 * @param localAirspeed magnitude of {@code localVelocity}
 * @param localAlpha local angle of attack, radians
 * @param localBeta local sideslip, radians
 * @param positionMeters segment position in metres
 */
public record SegmentAeroResult(
    String name,
    SegmentForceResult forces,
    Vec3 localVelocity,
    double localAirspeed,
    double localAlpha,
    double localBeta,
    Vec3 positionMeters) {}
