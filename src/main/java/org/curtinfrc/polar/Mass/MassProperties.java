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

import java.util.ArrayList;
import java.util.List;
import org.curtinfrc.polar.Geometry.Vec3;

/**
 * Center of gravity and inertia tensor of a set of {@link MassSegment}s.
 *
 * <p>Segment {@code i} carries {@code m_i = massRatio_i * totalMass} at {@code normalizedPosition_i
 * * referenceLength}. Segments are point masses; there is no self-inertia term.
 */
public final class MassProperties {
  private MassProperties() {}

  /**
   * Mass-weighted average position in metres.
   *
   * @param segments mass segments
   * @param referenceLength length that scales normalized positions, metres
   * @param totalMass system mass that scales mass ratios, kg
   * @return center of gravity, or the zero vector when the segments carry no mass
   */
  public static Vec3 computeCenterOfMass(
      List<MassSegment> segments, double referenceLength, double totalMass) {
    double mSum = 0.0;
    double cx = 0.0;
    double cy = 0.0;
    double cz = 0.0;
    for (MassSegment seg : segments) {
      double m = seg.massRatio() * totalMass;
      Vec3 p = seg.normalizedPosition();
      mSum += m;
      cx += m * p.x() * referenceLength;
      cy += m * p.y() * referenceLength;
      cz += m * p.z() * referenceLength;
    }
    if (mSum == 0.0) return Vec3.ZERO;
    return new Vec3(cx / mSum, cy / mSum, cz / mSum);
  }

  /**
   * Point-mass inertia tensor about the coordinate origin of the segment positions.
   *
   * @param segments mass segments
   * @param referenceLength length that scales normalized positions, metres
   * @param totalMass system mass that scales mass ratios, kg
   * @return inertia components, {@link InertiaComponents#ZERO} for an empty list
   */
  public static InertiaComponents computeInertia(
      List<MassSegment> segments, double referenceLength, double totalMass) {
    return computeInertia(segments, referenceLength, totalMass, Vec3.ZERO);
  }

  /**
   * Point-mass inertia tensor about {@code about}, given in metres in the same frame as the scaled
   * segment positions. Passing the center of gravity gives the tensor about the CG.
   */
  public static InertiaComponents computeInertia(
      List<MassSegment> segments, double referenceLength, double totalMass, Vec3 about) {
    if (segments.isEmpty()) return InertiaComponents.ZERO;
    double ixx = 0.0;
    double iyy = 0.0;
    double izz = 0.0;
    double ixy = 0.0;
    double ixz = 0.0;
    double iyz = 0.0;
    for (MassSegment seg : segments) {
      double m = seg.massRatio() * totalMass;
      Vec3 p = seg.normalizedPosition();
      double x = p.x() * referenceLength - about.x();
      double y = p.y() * referenceLength - about.y();
      double z = p.z() * referenceLength - about.z();
      ixx += m * (y * y + z * z);
      iyy += m * (x * x + z * z);
      izz += m * (x * x + y * y);
      ixy -= m * x * y;
      ixz -= m * x * z;
      iyz -= m * y * z;
    }
    return new InertiaComponents(ixx, iyy, izz, ixy, ixz, iyz);
  }

  /** Total mass in kg, {@code sum(massRatio) * totalMass}. */
  public static double totalSegmentMass(List<MassSegment> segments, double totalMass) {
    double ratio = 0.0;
    for (MassSegment seg : segments) {
      ratio += seg.massRatio();
    }
    return ratio * totalMass;
  }

  /** Segments resolved to kilograms and metres, in input order. */
  public static List<PhysicalMass> physicalPositions(
      List<MassSegment> segments, double referenceLength, double totalMass) {
    List<PhysicalMass> out = new ArrayList<>(segments.size());
    for (MassSegment seg : segments) {
      out.add(
          new PhysicalMass(
              seg.name(),
              seg.massRatio() * totalMass,
              seg.normalizedPosition().times(referenceLength)));
    }
    return out;
  }
}
