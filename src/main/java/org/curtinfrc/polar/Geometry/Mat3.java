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

/**
 * Row-major 3x3 matrix. Only the operations the frame and inertia code need are exposed.
 *
 * <p>{@code mRC} is the element at row R, column C (zero based).
 */
public record Mat3(
    double m00,
    double m01,
    double m02,
    double m10,
    double m11,
    double m12,
    double m20,
    double m21,
    double m22) {

  public static final Mat3 IDENTITY = new Mat3(1, 0, 0, 0, 1, 0, 0, 0, 1);
  public static final Mat3 ZERO = new Mat3(0, 0, 0, 0, 0, 0, 0, 0, 0);

  /** Rotation of the coordinate frame about x, {@code [[1,0,0],[0,c,s],[0,-s,c]]}. */
  public static Mat3 frameRotationX(double angle) {
    double c = Math.cos(angle);
    double s = Math.sin(angle);
    return new Mat3(1, 0, 0, 0, c, s, 0, -s, c);
  }

  /** Rotation of the coordinate frame about y, {@code [[c,0,-s],[0,1,0],[s,0,c]]}. */
  public static Mat3 frameRotationY(double angle) {
    double c = Math.cos(angle);
    double s = Math.sin(angle);
    return new Mat3(c, 0, -s, 0, 1, 0, s, 0, c);
  }

  /** Rotation of the coordinate frame about z, {@code [[c,s,0],[-s,c,0],[0,0,1]]}. */
  public static Mat3 frameRotationZ(double angle) {
    double c = Math.cos(angle);
    double s = Math.sin(angle);
    return new Mat3(c, s, 0, -s, c, 0, 0, 0, 1);
  }

  public static Mat3 diagonal(double a, double b, double c) {
    return new Mat3(a, 0, 0, 0, b, 0, 0, 0, c);
  }

  public Mat3 times(Mat3 o) {
    return new Mat3(
        m00 * o.m00 + m01 * o.m10 + m02 * o.m20,
        m00 * o.m01 + m01 * o.m11 + m02 * o.m21,
        m00 * o.m02 + m01 * o.m12 + m02 * o.m22,
        m10 * o.m00 + m11 * o.m10 + m12 * o.m20,
        m10 * o.m01 + m11 * o.m11 + m12 * o.m21,
        m10 * o.m02 + m11 * o.m12 + m12 * o.m22,
        m20 * o.m00 + m21 * o.m10 + m22 * o.m20,
        m20 * o.m01 + m21 * o.m11 + m22 * o.m21,
        m20 * o.m02 + m21 * o.m12 + m22 * o.m22);
  }

  public Vec3 apply(Vec3 v) {
    return new Vec3(
        m00 * v.x() + m01 * v.y() + m02 * v.z(),
        m10 * v.x() + m11 * v.y() + m12 * v.z(),
        m20 * v.x() + m21 * v.y() + m22 * v.z());
  }

  public Mat3 transpose() {
    return new Mat3(m00, m10, m20, m01, m11, m21, m02, m12, m22);
  }

  public double determinant() {
    return m00 * (m11 * m22 - m12 * m21)
        - m01 * (m10 * m22 - m12 * m20)
        + m02 * (m10 * m21 - m11 * m20);
  }

  /**
   * Returns the inverse, or {@code null} when {@code |det|} is at or below {@code epsilon}.
   *
   * @param epsilon singularity threshold on the determinant
   * @return inverse matrix, or {@code null} for a singular matrix
   */
  public Mat3 inverseOrNull(double epsilon) {
    double det = determinant();
    if (!(Math.abs(det) > epsilon)) return null;
    double inv = 1.0 / det;
    return new Mat3(
        (m11 * m22 - m12 * m21) * inv,
        (m02 * m21 - m01 * m22) * inv,
        (m01 * m12 - m02 * m11) * inv,
        (m12 * m20 - m10 * m22) * inv,
        (m00 * m22 - m02 * m20) * inv,
        (m02 * m10 - m00 * m12) * inv,
        (m10 * m21 - m11 * m20) * inv,
        (m01 * m20 - m00 * m21) * inv,
        (m00 * m11 - m01 * m10) * inv);
  }

  /**
   * Moore-Penrose pseudo-inverse of a symmetric matrix, from a cyclic Jacobi eigen decomposition.
   * Eigenvalues with magnitude at or below {@code tolerance} are treated as zero, so the null space
   * maps to zero. Only the upper triangle is read.
   */
  public Mat3 pseudoInverseSymmetric(double tolerance) {
    double[][] a = {{m00, m01, m02}, {m01, m11, m12}, {m02, m12, m22}};
    double[][] v = {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}};
    for (int sweep = 0; sweep < 50; sweep++) {
      double off = a[0][1] * a[0][1] + a[0][2] * a[0][2] + a[1][2] * a[1][2];
      if (off == 0.0) break;
      for (int p = 0; p < 2; p++) {
        for (int q = p + 1; q < 3; q++) {
          if (a[p][q] == 0.0) continue;
          double theta = (a[q][q] - a[p][p]) / (2.0 * a[p][q]);
          double t =
              (theta >= 0.0 ? 1.0 : -1.0) / (Math.abs(theta) + Math.sqrt(theta * theta + 1.0));
          double c = 1.0 / Math.sqrt(t * t + 1.0);
          double s = t * c;
          for (int k = 0; k < 3; k++) {
            double akp = a[k][p];
            double akq = a[k][q];
            a[k][p] = c * akp - s * akq;
            a[k][q] = s * akp + c * akq;
          }
          for (int k = 0; k < 3; k++) {
            double apk = a[p][k];
            double aqk = a[q][k];
            a[p][k] = c * apk - s * aqk;
            a[q][k] = s * apk + c * aqk;
          }
          a[p][q] = 0.0;
          a[q][p] = 0.0;
          for (int k = 0; k < 3; k++) {
            double vkp = v[k][p];
            double vkq = v[k][q];
            v[k][p] = c * vkp - s * vkq;
            v[k][q] = s * vkp + c * vkq;
          }
        }
      }
    }

    double[][] out = new double[3][3];
    for (int i = 0; i < 3; i++) {
      double lambda = a[i][i];
      if (!(Math.abs(lambda) > tolerance)) continue;
      for (int r = 0; r < 3; r++) {
        for (int c = 0; c < 3; c++) {
          out[r][c] += v[r][i] * v[c][i] / lambda;
        }
      }
    }
    return new Mat3(
        out[0][0], out[0][1], out[0][2],
        out[1][0], out[1][1], out[1][2],
        out[2][0], out[2][1], out[2][2]);
  }

  /** Column-major copy, the layout used by typical rendering engines. */
  public double[] toColumnMajor() {
    return new double[] {m00, m10, m20, m01, m11, m21, m02, m12, m22};
  }

  public double get(int row, int col) {
    switch (row * 3 + col) {
      case 0:
        return m00;
      case 1:
        return m01;
      case 2:
        return m02;
      case 3:
        return m10;
      case 4:
        return m11;
      case 5:
        return m12;
      case 6:
        return m20;
      case 7:
        return m21;
      case 8:
        return m22;
      default:
        throw new IndexOutOfBoundsException("row=" + row + " col=" + col);
    }
  }
}
