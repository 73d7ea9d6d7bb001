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

package org.curtinfrc.polar.Motion;

import org.curtinfrc.polar.Frames.BodyRates;
import org.curtinfrc.polar.Geometry.Mat3;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Mass.AxisMass;
import org.curtinfrc.polar.Mass.InertiaComponents;

/**
 * Newton-Euler equations of motion in NED body axes.
 *
 * <p>These evaluate instantaneous derivatives for one state snapshot and never integrate. A
 * non-positive mass or a singular inertia tensor yields zero acceleration on the affected axes.
 */
public final class RigidBodyEOM {
  public static final double STANDARD_GRAVITY = 9.80665;

  private static final double SINGULAR_DET = 1e-12;
  private static final double SINGULAR_RELATIVE = 1e-9;

  private RigidBodyEOM() {}

  /**
   * Gravity resolved into body axes.
   *
   * @param phi roll, radians
   * @param theta pitch, radians
   * @param g gravitational acceleration, m/s^2
   * @return {@code (-g sin theta, g sin phi cos theta, g cos phi cos theta)}
   */
  public static Vec3 gravityBody(double phi, double theta, double g) {
    double ct = Math.cos(theta);
    return new Vec3(-g * Math.sin(theta), g * Math.sin(phi) * ct, g * Math.cos(phi) * ct);
  }

  public static Vec3 gravityBody(double phi, double theta) {
    return gravityBody(phi, theta, STANDARD_GRAVITY);
  }

  /**
   * Body-frame Newton's second law with the rotating-frame terms.
   *
   * <pre>
   * uDot = Fx/m - (q w - r v)
   * vDot = Fy/m - (r u - p w)
   * wDot = Fz/m - (p v - q u)
   * </pre>
   *
   * @param force total force in body axes, N
   * @param mass mass, kg
   * @param velocity body velocity (u, v, w), m/s
   * @param rates body rates
   * @return linear acceleration, zero when {@code mass <= 0}
   */
  public static TranslationalAcceleration translationalEOM(
      Vec3 force, double mass, Vec3 velocity, BodyRates rates) {
    if (!(mass > 0.0)) return TranslationalAcceleration.ZERO;
    double u = velocity.x();
    double v = velocity.y();
    double w = velocity.z();
    double p = rates.p();
    double q = rates.q();
    double r = rates.r();
    return new TranslationalAcceleration(
        force.x() / mass - (q * w - r * v),
        force.y() / mass - (r * u - p * w),
        force.z() / mass - (p * v - q * u));
  }

  /**
   * Translational equations with a different mass on each axis (Kirchhoff form, used with added
   * mass).
   *
   * <pre>
   * mx uDot = Fx + my r v - mz q w
   * my vDot = Fy + mz p w - mx r u
   * mz wDot = Fz + mx q u - my p v
   * </pre>
   *
   * <p>Reduces to {@link #translationalEOM} when the three masses are equal. An axis with a
   * non-positive mass gets zero acceleration.
   */
  public static TranslationalAcceleration translationalEOMAnisotropic(
      Vec3 force, AxisMass massPerAxis, Vec3 velocity, BodyRates rates) {
    double u = velocity.x();
    double v = velocity.y();
    double w = velocity.z();
    double p = rates.p();
    double q = rates.q();
    double r = rates.r();
    double mx = massPerAxis.x();
    double my = massPerAxis.y();
    double mz = massPerAxis.z();
    double uDot = mx > 0.0 ? (force.x() + my * r * v - mz * q * w) / mx : 0.0;
    double vDot = my > 0.0 ? (force.y() + mz * p * w - mx * r * u) / my : 0.0;
    double wDot = mz > 0.0 ? (force.z() + mx * q * u - my * p * v) / mz : 0.0;
    return new TranslationalAcceleration(uDot, vDot, wDot);
  }

  /**
   * Euler's rotational equations with the full inertia tensor: solves {@code I omegaDot = M - omega
   * x (I omega)}.
   *
   * @param moment moment about the CG in body axes, N m
   * @param inertia inertia tensor about the CG
   * @param rates body rates
   * <p>A singular tensor (point masses on one line, or no inertia about some axis) is solved with
   * its pseudo-inverse: axes with no inertia get zero acceleration and the rest keep {@code M/I}.
   *
   * @return angular acceleration, zero for an all-zero tensor
   */
  public static AngularAcceleration rotationalEOM(
      Vec3 moment, InertiaComponents inertia, BodyRates rates) {
    Mat3 tensor = inertia.toMatrix();
    Mat3 inverse = tensor.inverseOrNull(SINGULAR_DET);
    if (inverse == null) {
      double scale =
          Math.max(
              Math.abs(inertia.ixx()), Math.max(Math.abs(inertia.iyy()), Math.abs(inertia.izz())));
      if (!(scale > 0.0)) return AngularAcceleration.ZERO;
      inverse = tensor.pseudoInverseSymmetric(Math.max(SINGULAR_DET, scale * SINGULAR_RELATIVE));
    }

    Vec3 omega = rates.toVec3();
    Vec3 gyroscopic = omega.cross(tensor.apply(omega));
    Vec3 acc = inverse.apply(moment.minus(gyroscopic));
    return new AngularAcceleration(acc.x(), acc.y(), acc.z());
  }
}
