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

import java.util.ArrayList;
import java.util.List;
import org.curtinfrc.polar.Frames.BodyRates;
import org.curtinfrc.polar.Frames.WindFrame;
import org.curtinfrc.polar.Geometry.Vec3;

/**
 * Sums per-segment aerodynamic forces into one force and one moment about the system CG.
 *
 * <p>Each segment contributes {@code F = lift * liftDir - drag * windDir + side * sideDir} acting
 * at its center of pressure, plus its intrinsic pitching moment on the body y axis.
 */
public final class AeroAggregator {
  private static final double MIN_AIRSPEED = 1e-6;

  private AeroAggregator() {}

  /**
   * Force magnitudes for one segment.
   *
   * @param segment segment
   * @param alpha local angle of attack, radians
   * @param beta local sideslip, radians
   * @param rho air density, kg/m^3
   * @param airspeed local airspeed, m/s
   * @return lift, drag, side force and intrinsic moment
   */
  public static SegmentForceResult computeSegmentForce(
      AeroSegment segment, double alpha, double beta, double rho, double airspeed) {
    double q = 0.5 * rho * airspeed * airspeed;
    double qs = q * segment.area();
    AeroCoefficients c = segment.coefficients(alpha, beta);
    return new SegmentForceResult(
        qs * c.cl(), qs * c.cd(), qs * c.cy(), qs * segment.chord() * c.cm(), c.cp());
  }

  /**
   * Sums segment forces that share one wind frame.
   *
   * @param segments segments, in the same order as {@code segmentForces}
   * @param segmentForces force magnitudes per segment
   * @param cg system CG in metres
   * @param referenceHeight height that scales normalized segment positions, m
   * @param windDir unit vector the air comes from
   * @param liftDir unit lift direction
   * @param sideDir unit side force direction
   * @return force and moment about {@code cg}; zero for no segments
   * @throws IllegalArgumentException if the two lists differ in size
   */
  public static SystemForceMoment sumAllSegments(
      List<? extends AeroSegment> segments,
      List<SegmentForceResult> segmentForces,
      Vec3 cg,
      double referenceHeight,
      Vec3 windDir,
      Vec3 liftDir,
      Vec3 sideDir) {
    if (segments.size() != segmentForces.size()) {
      throw new IllegalArgumentException(
          "segments and segmentForces differ in size: "
              + segments.size()
              + " vs "
              + segmentForces.size());
    }
    Accumulator acc = new Accumulator();
    for (int i = 0; i < segments.size(); i++) {
      AeroSegment seg = segments.get(i);
      SegmentForceResult f = segmentForces.get(i);
      Vec3 force = forceVector(f, windDir, liftDir, sideDir);
      acc.add(force, centerOfPressure(seg, f.cp(), referenceHeight).minus(cg), f.moment());
    }
    return acc.result();
  }

  public static SystemForceMoment sumAllSegments(
      List<? extends AeroSegment> segments,
      List<SegmentForceResult> segmentForces,
      Vec3 cg,
      double referenceHeight,
      WindFrame wind) {
    return sumAllSegments(
        segments,
        segmentForces,
        cg,
        referenceHeight,
        wind.windDir(),
        wind.liftDir(),
        wind.sideDir());
  }

  /**
   * Evaluates every segment at its own local flow, including the velocity induced by body rotation.
   *
   * <p>The local velocity of segment i is {@code V + omega x r_i}, with {@code r_i} measured from
   * the CG. Each segment gets its own flow angles and airspeed, which is where rotational damping
   * comes from. With zero rates every segment sees the CG flow.
   *
   * @param segments segments
   * @param cg system CG in metres
   * @param referenceHeight height that scales normalized segment positions, m
   * @param bodyVelocity CG velocity (u, v, w), m/s
   * @param rates body rates
   * @param rho air density, kg/m^3
   * @return totals and per-segment results
   */
  public static DetailedAeroResult evaluateAeroForcesDetailed(
      List<? extends AeroSegment> segments,
      Vec3 cg,
      double referenceHeight,
      Vec3 bodyVelocity,
      BodyRates rates,
      double rho) {
    Accumulator acc = new Accumulator();
    List<SegmentAeroResult> perSegment = new ArrayList<>(segments.size());
    Vec3 omega = rates.toVec3();

    for (AeroSegment seg : segments) {
      Vec3 positionMeters = seg.position().times(referenceHeight);
      Vec3 local = bodyVelocity.plus(omega.cross(positionMeters.minus(cg)));
      double airspeed = local.norm();
      double alpha = 0.0;
      double beta = 0.0;
      if (airspeed > MIN_AIRSPEED) {
        alpha = Math.atan2(local.z(), local.x());
        beta = Math.asin(Math.max(-1.0, Math.min(1.0, local.y() / airspeed)));
      }

      SegmentForceResult f = computeSegmentForce(seg, alpha, beta, rho, airspeed);
      WindFrame wind = WindFrame.fromAngles(alpha, beta);
      Vec3 force = forceVector(f, wind.windDir(), wind.liftDir(), wind.sideDir());
      acc.add(force, centerOfPressure(seg, f.cp(), referenceHeight).minus(cg), f.moment());

      perSegment.add(
          new SegmentAeroResult(seg.name(), f, local, airspeed, alpha, beta, positionMeters));
    }
    return new DetailedAeroResult(acc.result(), List.copyOf(perSegment));
  }

  public static SystemForceMoment evaluateAeroForces(
      List<? extends AeroSegment> segments,
      Vec3 cg,
      double referenceHeight,
      Vec3 bodyVelocity,
      BodyRates rates,
      double rho) {
    return evaluateAeroForcesDetailed(segments, cg, referenceHeight, bodyVelocity, rates, rho)
        .system();
  }

  /**
   * Center of pressure in metres. A CP aft of the quarter chord moves toward the trailing edge,
   * which lies along {@code -x} rotated by the segment pitch offset.
   */
  static Vec3 centerOfPressure(AeroSegment seg, double cp, double referenceHeight) {
    Vec3 p = seg.position();
    double offset = -(cp - AeroCoefficients.QUARTER_CHORD) * seg.chord() / referenceHeight;
    double pitch = -seg.pitchOffset();
    double offX = offset * Math.cos(pitch);
    double offZ = offset * Math.sin(pitch);
    return new Vec3(
        (p.x() + offX) * referenceHeight,
        p.y() * referenceHeight,
        (p.z() + offZ) * referenceHeight);
  }

  private static Vec3 forceVector(SegmentForceResult f, Vec3 windDir, Vec3 liftDir, Vec3 sideDir) {
    return liftDir.times(f.lift()).minus(windDir.times(f.drag())).plus(sideDir.times(f.side()));
  }

  private static final class Accumulator {
    private double fx;
    private double fy;
    private double fz;
    private double mx;
    private double my;
    private double mz;

    void add(Vec3 force, Vec3 arm, double pitchingMoment) {
      fx += force.x();
      fy += force.y();
      fz += force.z();
      mx += arm.y() * force.z() - arm.z() * force.y();
      my += arm.z() * force.x() - arm.x() * force.z() + pitchingMoment;
      mz += arm.x() * force.y() - arm.y() * force.x();
    }

    SystemForceMoment result() {
      return new SystemForceMoment(new Vec3(fx, fy, fz), new Vec3(mx, my, mz));
    }
  }
}
