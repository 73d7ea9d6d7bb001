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

import org.curtinfrc.polar.Geometry.Mat3;
import org.curtinfrc.polar.Geometry.Quat;
import org.curtinfrc.polar.Geometry.Vec3;

/**
 * NED frame algebra for a 3-2-1 Euler attitude.
 *
 * <p>Two frames are in play. The physics frame is North-East-Down, body x forward, y right, z down.
 * The render frame is Y-up: {@code render = (-ned.y, -ned.z, ned.x)}, a proper rotation. Every
 * angle argument is in radians.
 *
 * <p>All methods are total; the {@code theta = +-pi/2} singularity in {@link #eulerRates} is not
 * special-cased.
 */
public final class FrameMath {
  private static final Vec3 RENDER_X = new Vec3(1.0, 0.0, 0.0);
  private static final Vec3 RENDER_Y = new Vec3(0.0, 1.0, 0.0);

  // Rows map NED components onto render components.
  private static final Mat3 NED_TO_RENDER = new Mat3(0, -1, 0, 0, 0, -1, 1, 0, 0);

  private FrameMath() {}

  public static Vec3 nedToRender(Vec3 ned) {
    return new Vec3(-ned.y(), -ned.z(), ned.x());
  }

  public static Vec3 renderToNed(Vec3 render) {
    return new Vec3(render.z(), -render.x(), -render.y());
  }

  /**
   * Body-to-inertial direction cosine matrix, the transpose of {@code Rx(phi) Ry(theta) Rz(psi)}.
   *
   * <p>Column j holds the inertial NED components of body axis j.
   *
   * @param phi roll
   * @param theta pitch
   * @param psi yaw
   * @return orthonormal DCM, identity at zero attitude
   */
  public static Mat3 dcmBodyToInertial(double phi, double theta, double psi) {
    double cp = Math.cos(phi);
    double sp = Math.sin(phi);
    double ct = Math.cos(theta);
    double st = Math.sin(theta);
    double cy = Math.cos(psi);
    double sy = Math.sin(psi);
    return new Mat3(
        ct * cy,
        sp * st * cy - cp * sy,
        cp * st * cy + sp * sy,
        ct * sy,
        sp * st * sy + cp * cy,
        cp * st * sy - sp * cy,
        -st,
        sp * ct,
        cp * ct);
  }

  public static Mat3 dcmBodyToInertial(Attitude attitude) {
    return dcmBodyToInertial(attitude.phi(), attitude.theta(), attitude.psi());
  }

  /**
   * Wind-to-body direction cosine matrix. Identity at {@code alpha = beta = 0}.
   *
   * @param alpha angle of attack
   * @param beta sideslip
   * @return orthonormal DCM
   */
  public static Mat3 dcmWindToBody(double alpha, double beta) {
    double ca = Math.cos(alpha);
    double sa = Math.sin(alpha);
    double cb = Math.cos(beta);
    double sb = Math.sin(beta);
    return new Mat3(ca * cb, sa, -ca * sb, -sa * cb, ca, sa * sb, sb, 0.0, cb);
  }

  /**
   * Body-to-inertial orientation expressed in the Y-up render frame.
   *
   * <p>The quaternion is extracted from {@link #dcmBodyToInertial} after conjugating it into render
   * axes, never composed from per-axis quaternions, so two attitudes with the same DCM produce the
   * same rotation (up to the sign of the quaternion).
   *
   * @param phi roll
   * @param theta pitch
   * @param psi yaw
   * @return unit quaternion rotating render-frame body vectors into the render-frame world
   */
  public static Quat bodyToInertialQuat(double phi, double theta, double psi) {
    Mat3 dcm = dcmBodyToInertial(phi, theta, psi);
    Mat3 render = NED_TO_RENDER.times(dcm).times(NED_TO_RENDER.transpose());
    return Quat.fromRotationMatrix(render);
  }

  /** Same rotation as {@link #bodyToInertialQuat} but expressed in NED axes. */
  public static Quat bodyToInertialQuatNed(double phi, double theta, double psi) {
    return Quat.fromRotationMatrix(dcmBodyToInertial(phi, theta, psi));
  }

  /**
   * Unit vector pointing where the relative wind comes from, in render-frame body axes.
   *
   * <p>At zero incidence the wind comes from straight ahead, {@code (0, 0, 1)}. Positive alpha
   * tilts it down, positive beta tilts it toward render +x.
   *
   * @param alpha angle of attack
   * @param beta sideslip
   * @return unit wind direction
   */
  public static Vec3 windDirectionBody(double alpha, double beta) {
    double ca = Math.cos(alpha);
    return new Vec3(Math.sin(beta) * ca, -Math.sin(alpha), Math.cos(beta) * ca).normalized();
  }

  /**
   * Kinematic Euler-angle rates from body rates.
   *
   * @param p roll rate
   * @param q pitch rate
   * @param r yaw rate
   * @param phi roll
   * @param theta pitch
   * @return Euler rates
   */
  public static EulerRates eulerRates(double p, double q, double r, double phi, double theta) {
    double sp = Math.sin(phi);
    double cp = Math.cos(phi);
    double ct = Math.cos(theta);
    double tt = Math.tan(theta);
    return new EulerRates(
        p + (sp * q + cp * r) * tt, cp * q - sp * r, (sp * q + cp * r) / ct);
  }

  public static EulerRates eulerRates(BodyRates rates, Attitude attitude) {
    return eulerRates(rates.p(), rates.q(), rates.r(), attitude.phi(), attitude.theta());
  }

  /**
   * Inverse of {@link #eulerRates}. Exact away from {@code theta = +-pi/2}.
   *
   * @param phiDot roll angle rate
   * @param thetaDot pitch angle rate
   * @param psiDot yaw angle rate
   * @param phi roll
   * @param theta pitch
   * @return body rates
   */
  public static BodyRates eulerRatesToBodyRates(
      double phiDot, double thetaDot, double psiDot, double phi, double theta) {
    double sp = Math.sin(phi);
    double cp = Math.cos(phi);
    double st = Math.sin(theta);
    double ct = Math.cos(theta);
    return new BodyRates(
        phiDot - psiDot * st, thetaDot * cp + psiDot * sp * ct, -thetaDot * sp + psiDot * cp * ct);
  }

  /**
   * Body orientation from a wind-axis attitude plus incidence angles, in the render frame.
   *
   * <p>{@code q_body = q_wind * R(-alpha about render x) * R(beta about render y)}. Equals the wind
   * attitude's own quaternion when both incidence angles are zero.
   *
   * @param windPhi wind-axis bank
   * @param windTheta wind-axis flight path angle
   * @param windPsi wind-axis heading
   * @param alpha angle of attack
   * @param beta sideslip
   * @return body orientation quaternion in the render frame
   */
  public static Quat bodyQuatFromWindAttitude(
      double windPhi, double windTheta, double windPsi, double alpha, double beta) {
    Quat qWind = bodyToInertialQuat(windPhi, windTheta, windPsi);
    Quat qAlpha = Quat.fromAxisAngle(RENDER_X, -alpha);
    Quat qBeta = Quat.fromAxisAngle(RENDER_Y, beta);
    return qWind.multiply(qAlpha).multiply(qBeta);
  }

  /**
   * Body velocity rotated into the inertial NED frame.
   *
   * @param u forward velocity
   * @param v rightward velocity
   * @param w downward velocity
   * @param phi roll
   * @param theta pitch
   * @param psi yaw
   * @return inertial velocity (north, east, down)
   */
  public static Vec3 bodyToInertialVelocity(
      double u, double v, double w, double phi, double theta, double psi) {
    return dcmBodyToInertial(phi, theta, psi).apply(new Vec3(u, v, w));
  }
}
