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

package org.curtinfrc.polar.Geometry;

/** Unit quaternion {@code w + xi + yj + zk} describing a rotation. */
public record Quat(double w, double x, double y, double z) {
  public static final Quat IDENTITY = new Quat(1.0, 0.0, 0.0, 0.0);

  /**
   * Rotation of {@code angle} radians about {@code axis}. The axis is normalized here.
   *
   * @param axis rotation axis
   * @param angle rotation angle in radians, right handed
   * @return rotation quaternion
   */
  public static Quat fromAxisAngle(Vec3 axis, double angle) {
    Vec3 a = axis.normalized();
    double half = 0.5 * angle;
    double s = Math.sin(half);
    return new Quat(Math.cos(half), a.x() * s, a.y() * s, a.z() * s);
  }

  /**
   * Extracts the quaternion of a pure rotation matrix. Branches on the largest diagonal term so the
   * square root argument stays well away from zero for any attitude.
   *
   * @param m rotation matrix, active convention ({@code v' = m v})
   * @return equivalent unit quaternion
   */
  public static Quat fromRotationMatrix(Mat3 m) {
    double trace = m.m00() + m.m11() + m.m22();
    if (trace > 0.0) {
      double s = 0.5 / Math.sqrt(trace + 1.0);
      return new Quat(
          0.25 / s, (m.m21() - m.m12()) * s, (m.m02() - m.m20()) * s, (m.m10() - m.m01()) * s);
    }
    if (m.m00() > m.m11() && m.m00() > m.m22()) {
      double s = 2.0 * Math.sqrt(1.0 + m.m00() - m.m11() - m.m22());
      return new Quat(
          (m.m21() - m.m12()) / s, 0.25 * s, (m.m01() + m.m10()) / s, (m.m02() + m.m20()) / s);
    }
    if (m.m11() > m.m22()) {
      double s = 2.0 * Math.sqrt(1.0 + m.m11() - m.m00() - m.m22());
      return new Quat(
          (m.m02() - m.m20()) / s, (m.m01() + m.m10()) / s, 0.25 * s, (m.m12() + m.m21()) / s);
    }
    double s = 2.0 * Math.sqrt(1.0 + m.m22() - m.m00() - m.m11());
    return new Quat(
        (m.m10() - m.m01()) / s, (m.m02() + m.m20()) / s, (m.m12() + m.m21()) / s, 0.25 * s);
  }

  /** Hamilton product {@code this * o}: applies {@code o} first, then {@code this}. */
  public Quat multiply(Quat o) {
    return new Quat(
        w * o.w - x * o.x - y * o.y - z * o.z,
        w * o.x + x * o.w + y * o.z - z * o.y,
        w * o.y - x * o.z + y * o.w + z * o.x,
        w * o.z + x * o.y - y * o.x + z * o.w);
  }

  public Quat conjugate() {
    return new Quat(w, -x, -y, -z);
  }

  public double norm() {
    return Math.sqrt(w * w + x * x + y * y + z * z);
  }

  public Quat normalized() {
    double n = norm();
    if (n < 1e-12) return IDENTITY;
    return new Quat(w / n, x / n, y / n, z / n);
  }

  public Vec3 rotate(Vec3 v) {
    return toRotationMatrix().apply(v);
  }

  public Mat3 toRotationMatrix() {
    double xx = x * x;
    double yy = y * y;
    double zz = z * z;
    double xy = x * y;
    double xz = x * z;
    double yz = y * z;
    double wx = w * x;
    double wy = w * y;
    double wz = w * z;
    return new Mat3(
        1 - 2 * (yy + zz),
        2 * (xy - wz),
        2 * (xz + wy),
        2 * (xy + wz),
        1 - 2 * (xx + zz),
        2 * (yz - wx),
        2 * (xz - wy),
        2 * (yz + wx),
        1 - 2 * (xx + yy));
  }

  /**
   * Whether both quaternions describe the same rotation. {@code q} and {@code -q} count as equal.
   *
   * @param o other quaternion
   * @param tolerance absolute tolerance on {@code 1 - |dot|}
   * @return true if the rotations match
   */
  public boolean sameRotation(Quat o, double tolerance) {
    double dot = w * o.w + x * o.x + y * o.y + z * o.z;
    return 1.0 - Math.abs(dot) <= tolerance;
  }
}
