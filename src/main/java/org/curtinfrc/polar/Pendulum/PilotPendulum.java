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

package org.curtinfrc.polar.Pendulum;

import java.util.ArrayList;
import java.util.List;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Mass.MassSegment;
import org.curtinfrc.polar.Motion.RigidBodyEOM;

/**
 * Single degree of freedom pitch pendulum for a pilot hanging below a canopy.
 *
 * <p>Positions are normalized by the reference height and measured in the body x-z plane. The swing
 * angle is pilot pitch minus canopy pitch.
 */
public final class PilotPendulum {
  public static final double DEFAULT_REFERENCE_HEIGHT = 1.875;
  public static final double DEFAULT_TOTAL_WEIGHT = 77.5;
  public static final double DEFAULT_AIR_DENSITY = 1.225;
  public static final double DEFAULT_PILOT_AREA = 0.55;
  public static final double DEFAULT_PILOT_CD = 1.0;

  private static final double MIN_INERTIA = 1e-10;
  private static final double MIN_RATE = 1e-10;

  private PilotPendulum() {}

  public static PilotPendulumParams computePilotPendulumParams(
      List<MassSegment> pilotSegments, double pivotX, double pivotZ) {
    return computePilotPendulumParams(
        pilotSegments, pivotX, pivotZ, DEFAULT_REFERENCE_HEIGHT, DEFAULT_TOTAL_WEIGHT);
  }

  /**
   * Pilot mass, inertia about the pivot and CG offset.
   *
   * @param pilotSegments pilot-only mass segments
   * @param pivotX normalized pivot x
   * @param pivotZ normalized pivot z
   * @param referenceHeight height that scales normalized positions, m
   * @param totalWeight system mass that scales mass ratios, kg
   * @return pendulum parameters; all zero for an empty list
   */
  public static PilotPendulumParams computePilotPendulumParams(
      List<MassSegment> pilotSegments,
      double pivotX,
      double pivotZ,
      double referenceHeight,
      double totalWeight) {
    double pilotMass = 0.0;
    double iy = 0.0;
    double cgX = 0.0;
    double cgZ = 0.0;
    for (MassSegment seg : pilotSegments) {
      double m = seg.massRatio() * totalWeight;
      double dx = (seg.normalizedPosition().x() - pivotX) * referenceHeight;
      double dz = (seg.normalizedPosition().z() - pivotZ) * referenceHeight;
      iy += m * (dx * dx + dz * dz);
      pilotMass += m;
      cgX += m * dx;
      cgZ += m * dz;
    }
    if (pilotMass > 0.0) {
      cgX /= pilotMass;
      cgZ /= pilotMass;
    } else {
      cgX = 0.0;
      cgZ = 0.0;
    }
    return new PilotPendulumParams(pilotMass, iy, Math.hypot(cgX, cgZ), cgX, cgZ);
  }

  public static double pilotPendulumEOM(
      PilotPendulumParams params,
      double swingAngle,
      double swingRate,
      double aeroTorque,
      double parentPitchAccel) {
    return pilotPendulumEOM(
        params, swingAngle, swingRate, aeroTorque, parentPitchAccel, RigidBodyEOM.STANDARD_GRAVITY);
  }

  public static double pilotPendulumEOM(
      PilotPendulumParams params, PendulumState state, double aeroTorque, double parentPitchAccel) {
    return pilotPendulumEOM(
        params, state.swingAngle(), state.swingRate(), aeroTorque, parentPitchAccel);
  }

  /**
   * Swing angular acceleration about the pivot.
   *
   * <pre>
   * tau_g = -m g l sin(swingAngle)
   * tau_c = -Iy parentPitchAccel
   * accel = (tau_g + tau_c + aeroTorque) / Iy
   * </pre>
   *
   * <p>The swing rate does not appear directly; rate-dependent torque arrives through {@code
   * aeroTorque}, typically from {@link #pilotSwingDampingTorque}. {@link
   * PendulumModel#acceleration} adds that damping before calling here.
   *
   * @param params pendulum parameters
   * @param swingAngle pilot pitch minus canopy pitch, radians
   * @param swingRate swing rate, rad/s; reserved and not read, no damping is applied from it
   * @param aeroTorque aerodynamic torque about the pivot, N m
   * @param parentPitchAccel canopy pitch acceleration, rad/s^2
   * @param g gravitational acceleration, m/s^2
   * @return swing acceleration, exactly zero for a massless or inertia-free pilot
   */
  public static double pilotPendulumEOM(
      PilotPendulumParams params,
      double swingAngle,
      double swingRate,
      double aeroTorque,
      double parentPitchAccel,
      double g) {
    double iy = params.iyRiser();
    if (iy < MIN_INERTIA || params.pilotMass() <= 0.0) return 0.0;
    double tauGravity = -params.pilotMass() * g * params.riserToCg() * Math.sin(swingAngle);
    double tauCanopy = -iy * parentPitchAccel;
    return (tauGravity + tauCanopy + aeroTorque) / iy;
  }

  public static double pilotSwingDampingTorque(
      List<MassSegment> pilotSegments, double pivotX, double pivotZ, double swingRate) {
    return pilotSwingDampingTorque(
        pilotSegments,
        pivotX,
        pivotZ,
        swingRate,
        DEFAULT_AIR_DENSITY,
        DEFAULT_REFERENCE_HEIGHT,
        DEFAULT_TOTAL_WEIGHT);
  }

  public static double pilotSwingDampingTorque(
      List<MassSegment> pilotSegments,
      double pivotX,
      double pivotZ,
      double swingRate,
      double rho,
      double referenceHeight,
      double totalWeight) {
    return pilotSwingDampingTorque(
        pilotSegments,
        pivotX,
        pivotZ,
        swingRate,
        rho,
        referenceHeight,
        totalWeight,
        DEFAULT_PILOT_AREA,
        DEFAULT_PILOT_CD);
  }

  /**
   * Quadratic drag torque opposing the swing.
   *
   * <p>Each segment moves tangentially at {@code swingRate * r} and is given a share of {@code
   * pilotArea} proportional to its mass ratio. {@code totalWeight} is accepted for symmetry with
   * {@link #computePilotPendulumParams}; the area split uses ratios only.
   *
   * @return torque about the pivot in N m, sign opposite {@code swingRate}, zero at zero rate
   */
  public static double pilotSwingDampingTorque(
      List<MassSegment> pilotSegments,
      double pivotX,
      double pivotZ,
      double swingRate,
      double rho,
      double referenceHeight,
      double totalWeight,
      double pilotArea,
      double cd) {
    if (Math.abs(swingRate) < MIN_RATE) return 0.0;

    double totalRatio = 0.0;
    for (MassSegment seg : pilotSegments) {
      totalRatio += seg.massRatio();
    }
    if (totalRatio <= 0.0) return 0.0;

    double torque = 0.0;
    for (MassSegment seg : pilotSegments) {
      double dx = (seg.normalizedPosition().x() - pivotX) * referenceHeight;
      double dz = (seg.normalizedPosition().z() - pivotZ) * referenceHeight;
      double r = Math.sqrt(dx * dx + dz * dz);
      double vTan = swingRate * r;
      double area = pilotArea * (seg.massRatio() / totalRatio);
      double drag = -0.5 * rho * cd * area * vTan * Math.abs(vTan);
      torque += drag * r;
    }
    return torque;
  }

  /**
   * Rotates pilot segments about the pivot in the x-z plane. {@code y} is unchanged.
   *
   * @param pilotSegments pilot-only segments
   * @param pivotX normalized pivot x
   * @param pivotZ normalized pivot z
   * @param pitch rotation in radians
   * @return rotated copies, the input list itself when the pitch is zero
   */
  public static List<MassSegment> rotatePilotSegments(
      List<MassSegment> pilotSegments, double pivotX, double pivotZ, double pitch) {
    if (pitch == 0.0) return pilotSegments;
    double c = Math.cos(pitch);
    double s = Math.sin(pitch);
    List<MassSegment> out = new ArrayList<>(pilotSegments.size());
    for (MassSegment seg : pilotSegments) {
      Vec3 p = seg.normalizedPosition();
      double dx = p.x() - pivotX;
      double dz = p.z() - pivotZ;
      out.add(
          seg.withPosition(new Vec3(dx * c - dz * s + pivotX, p.y(), dx * s + dz * c + pivotZ)));
    }
    return out;
  }
}
