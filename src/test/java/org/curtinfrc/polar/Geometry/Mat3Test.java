package org.curtinfrc.polar.Geometry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class Mat3Test {
  private static final double EPS = 1e-12;

  @Test
  void inverseTimesMatrixIsIdentity() {
    Mat3 m = new Mat3(4, 1, -2, 1, 5, 0.5, -2, 0.5, 6);
    Mat3 product = m.inverseOrNull(1e-12).times(m);

    for (int r = 0; r < 3; r++) {
      for (int c = 0; c < 3; c++) {
        assertEquals(r == c ? 1.0 : 0.0, product.get(r, c), EPS);
      }
    }
  }

  @Test
  void singularMatrixHasNoInverse() {
    Mat3 m = new Mat3(1, 2, 3, 2, 4, 6, 0, 1, 1);

    assertEquals(0.0, m.determinant(), EPS);
    assertNull(m.inverseOrNull(1e-12));
  }

  @Test
  void pseudoInverseMatchesInverseWhenRegular() {
    Mat3 m = new Mat3(4, 1, -2, 1, 5, 0.5, -2, 0.5, 6);
    Mat3 inverse = m.inverseOrNull(1e-12);
    Mat3 pseudo = m.pseudoInverseSymmetric(1e-12);

    for (int r = 0; r < 3; r++) {
      for (int c = 0; c < 3; c++) {
        assertEquals(inverse.get(r, c), pseudo.get(r, c), 1e-9);
      }
    }
  }

  @Test
  void pseudoInverseOfRankTwoTensorReproducesIt() {
    Mat3 m = new Mat3(10, -10, 0, -10, 10, 0, 0, 0, 20);
    Mat3 roundTrip = m.times(m.pseudoInverseSymmetric(1e-9)).times(m);

    for (int r = 0; r < 3; r++) {
      for (int c = 0; c < 3; c++) {
        assertEquals(m.get(r, c), roundTrip.get(r, c), 1e-9);
      }
    }
    assertEquals(0.05, m.pseudoInverseSymmetric(1e-9).get(2, 2), 1e-12);
  }

  @Test
  void columnMajorListsColumnsFirst() {
    Mat3 m = new Mat3(1, 2, 3, 4, 5, 6, 7, 8, 9);

    assertArrayEquals(new double[] {1, 4, 7, 2, 5, 8, 3, 6, 9}, m.toColumnMajor(), EPS);
  }

  @Test
  void frameRotationsAreTransposesOfEachOther() {
    Mat3 forward = Mat3.frameRotationY(0.4);
    Mat3 back = Mat3.frameRotationY(-0.4);

    assertArrayEquals(forward.transpose().toColumnMajor(), back.toColumnMajor(), EPS);
  }
}
