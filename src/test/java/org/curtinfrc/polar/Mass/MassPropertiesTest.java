package org.curtinfrc.polar.Mass;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;
import org.curtinfrc.polar.Geometry.Vec3;
import org.junit.jupiter.api.Test;

class MassPropertiesTest {
  private static final double EPS = 1e-12;

  @Test
  void emptySegmentsGiveZeroCgAndInertia() {
    assertEquals(Vec3.ZERO, MassProperties.computeCenterOfMass(List.of(), 1.875, 77.5));
    assertSame(InertiaComponents.ZERO, MassProperties.computeInertia(List.of(), 1.875, 77.5));
  }

  @Test
  void zeroTotalMassGivesZeroCg() {
    List<MassSegment> segs = List.of(MassSegment.of("a", 0.5, 1, 2, 3));

    assertEquals(Vec3.ZERO, MassProperties.computeCenterOfMass(segs, 2.0, 0.0));
  }

  @Test
  void cgIsMassWeightedAverageInMetres() {
    List<MassSegment> segs =
        List.of(
            MassSegment.of("front", 0.75, 1.0, 0.0, 0.0),
            MassSegment.of("back", 0.25, -1.0, 0.0, 0.4));

    Vec3 cg = MassProperties.computeCenterOfMass(segs, 2.0, 80.0);

    assertEquals(1.0, cg.x(), EPS);
    assertEquals(0.0, cg.y(), EPS);
    assertEquals(0.2, cg.z(), EPS);
  }

  @Test
  void pointMassInertiaIncludesNegatedProducts() {
    // 10 kg at (1, 2, 3) m
    List<MassSegment> segs = List.of(MassSegment.of("p", 1.0, 0.5, 1.0, 1.5));

    InertiaComponents i = MassProperties.computeInertia(segs, 2.0, 10.0);

    assertEquals(10.0 * (4 + 9), i.ixx(), EPS);
    assertEquals(10.0 * (1 + 9), i.iyy(), EPS);
    assertEquals(10.0 * (1 + 4), i.izz(), EPS);
    assertEquals(-10.0 * 1 * 2, i.ixy(), EPS);
    assertEquals(-10.0 * 1 * 3, i.ixz(), EPS);
    assertEquals(-10.0 * 2 * 3, i.iyz(), EPS);
  }

  @Test
  void tensorMatrixIsSymmetric() {
    InertiaComponents i = new InertiaComponents(1, 2, 3, -0.1, -0.2, -0.3);

    assertEquals(i.toMatrix().get(0, 2), i.toMatrix().get(2, 0), EPS);
    assertEquals(-0.2, i.toMatrix().get(0, 2), EPS);
    assertEquals(-0.3, i.toMatrix().get(1, 2), EPS);
  }

  @Test
  void inertiaAboutOriginObeysParallelAxisTheorem() {
    List<MassSegment> segs =
        List.of(
            MassSegment.of("a", 0.3, 0.2, 0.1, -0.4),
            MassSegment.of("b", 0.5, -0.1, -0.3, 0.2),
            MassSegment.of("c", 0.2, 0.4, 0.0, 0.1));
    double h = 1.875;
    double m = 77.5;
    Vec3 cg = MassProperties.computeCenterOfMass(segs, h, m);

    InertiaComponents origin = MassProperties.computeInertia(segs, h, m);
    InertiaComponents aboutCg = MassProperties.computeInertia(segs, h, m, cg);

    assertEquals(aboutCg.ixx() + m * (cg.y() * cg.y() + cg.z() * cg.z()), origin.ixx(), 1e-9);
    assertEquals(aboutCg.iyy() + m * (cg.x() * cg.x() + cg.z() * cg.z()), origin.iyy(), 1e-9);
    assertEquals(aboutCg.izz() + m * (cg.x() * cg.x() + cg.y() * cg.y()), origin.izz(), 1e-9);
    assertEquals(aboutCg.ixz() - m * cg.x() * cg.z(), origin.ixz(), 1e-9);
  }

  @Test
  void physicalPositionsScaleBothMassAndLength() {
    List<MassSegment> segs = List.of(MassSegment.of("head", 0.14, 0.2, 0.0, -0.1));

    List<PhysicalMass> out = MassProperties.physicalPositions(segs, 2.0, 100.0);

    assertEquals(1, out.size());
    assertEquals("head", out.get(0).name());
    assertEquals(14.0, out.get(0).mass(), EPS);
    assertEquals(0.4, out.get(0).position().x(), EPS);
    assertEquals(-0.2, out.get(0).position().z(), EPS);
  }

  @Test
  void totalSegmentMassSumsRatios() {
    List<MassSegment> segs =
        List.of(MassSegment.of("a", 0.2, 0, 0, 0), MassSegment.of("b", 0.3, 0, 0, 0));

    assertEquals(50.0, MassProperties.totalSegmentMass(segs, 100.0), EPS);
  }
}
