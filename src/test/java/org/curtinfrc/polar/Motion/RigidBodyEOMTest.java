package org.curtinfrc.polar.Motion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.curtinfrc.polar.Frames.BodyRates;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Mass.AxisMass;
import org.curtinfrc.polar.Mass.InertiaComponents;
import org.curtinfrc.polar.Mass.MassProperties;
import org.curtinfrc.polar.Mass.MassSegment;
import org.junit.jupiter.api.Test;

class RigidBodyEOMTest {
  private static final double G = RigidBodyEOM.STANDARD_GRAVITY;
  private static final double EPS = 1e-9;

  private static final InertiaComponents DIAG = InertiaComponents.diagonal(100, 200, 300);

  @Test
  void gravityPointsDownWhenLevel() {
    Vec3 g = RigidBodyEOM.gravityBody(0, 0);

    assertEquals(0.0, g.x(), EPS);
    assertEquals(0.0, g.y(), EPS);
    assertEquals(G, g.z(), EPS);
  }

  @Test
  void gravityFollowsPitchAndRoll() {
    Vec3 noseUp = RigidBodyEOM.gravityBody(0, Math.PI / 2);
    Vec3 noseDown = RigidBodyEOM.gravityBody(0, -Math.PI / 2);
    Vec3 rightWingDown = RigidBodyEOM.gravityBody(Math.PI / 2, 0);
    Vec3 inverted = RigidBodyEOM.gravityBody(Math.PI, 0);

    assertEquals(-G, noseUp.x(), EPS);
    assertEquals(0.0, noseUp.z(), EPS);
    assertEquals(G, noseDown.x(), EPS);
    assertEquals(G, rightWingDown.y(), EPS);
    assertEquals(0.0, rightWingDown.z(), EPS);
    assertEquals(0.0, inverted.x(), EPS);
    assertEquals(0.0, inverted.y(), EPS);
    assertEquals(-G, inverted.z(), EPS);
  }

  @Test
  void gravityMagnitudeIsPreserved() {
    Vec3 g = RigidBodyEOM.gravityBody(0.7, -0.4, 3.7);

    assertEquals(3.7, g.norm(), EPS);
  }

  @Test
  void forceAlongXAccelerates() {
    TranslationalAcceleration a =
        RigidBodyEOM.translationalEOM(new Vec3(775, 0, 0), 77.5, Vec3.ZERO, BodyRates.ZERO);

    assertEquals(10.0, a.uDot(), EPS);
    assertEquals(0.0, a.vDot(), EPS);
    assertEquals(0.0, a.wDot(), EPS);
  }

  @Test
  void yawRateWithForwardSpeedGivesSidewaysAcceleration() {
    TranslationalAcceleration a =
        RigidBodyEOM.translationalEOM(
            Vec3.ZERO, 77.5, new Vec3(10, 0, 0), new BodyRates(0, 0, 1));

    assertEquals(0.0, a.uDot(), EPS);
    assertEquals(-10.0, a.vDot(), EPS);
    assertEquals(0.0, a.wDot(), EPS);
  }

  @Test
  void nonPositiveMassGivesZeroAcceleration() {
    Vec3 f = new Vec3(100, 0, 0);

    assertSame(
        TranslationalAcceleration.ZERO,
        RigidBodyEOM.translationalEOM(f, 0.0, Vec3.ZERO, BodyRates.ZERO));
    assertSame(
        TranslationalAcceleration.ZERO,
        RigidBodyEOM.translationalEOM(f, -1.0, Vec3.ZERO, BodyRates.ZERO));
  }

  @Test
  void anisotropicFormMatchesIsotropicWithEqualMasses() {
    Vec3 f = new Vec3(120, -40, 700);
    Vec3 vel = new Vec3(12, 1.5, 4);
    BodyRates rates = new BodyRates(0.2, -0.3, 0.5);

    TranslationalAcceleration iso = RigidBodyEOM.translationalEOM(f, 77.5, vel, rates);
    TranslationalAcceleration aniso =
        RigidBodyEOM.translationalEOMAnisotropic(f, AxisMass.isotropic(77.5), vel, rates);

    assertEquals(iso.uDot(), aniso.uDot(), EPS);
    assertEquals(iso.vDot(), aniso.vDot(), EPS);
    assertEquals(iso.wDot(), aniso.wDot(), EPS);
  }

  @Test
  void anisotropicZeroMassAxisIsZero() {
    TranslationalAcceleration a =
        RigidBodyEOM.translationalEOMAnisotropic(
            new Vec3(10, 10, 10), new AxisMass(0, 5, 10), Vec3.ZERO, BodyRates.ZERO);

    assertEquals(0.0, a.uDot(), 0.0);
    assertEquals(2.0, a.vDot(), EPS);
    assertEquals(1.0, a.wDot(), EPS);
  }

  @Test
  void heavierNormalAxisSlowsPlunge() {
    Vec3 f = new Vec3(0, 0, 100);
    TranslationalAcceleration light =
        RigidBodyEOM.translationalEOMAnisotropic(
            f, AxisMass.isotropic(80), Vec3.ZERO, BodyRates.ZERO);
    TranslationalAcceleration heavy =
        RigidBodyEOM.translationalEOMAnisotropic(
            f, new AxisMass(80, 80, 110), Vec3.ZERO, BodyRates.ZERO);

    assertTrue(heavy.wDot() < light.wDot());
  }

  @Test
  void pitchMomentOnDiagonalTensor() {
    AngularAcceleration a =
        RigidBodyEOM.rotationalEOM(new Vec3(0, 1000, 0), DIAG, BodyRates.ZERO);

    assertEquals(0.0, a.pDot(), EPS);
    assertEquals(5.0, a.qDot(), EPS);
    assertEquals(0.0, a.rDot(), EPS);
  }

  @Test
  void productOfInertiaCouplesRollIntoYaw() {
    InertiaComponents inertia = new InertiaComponents(100, 200, 300, 0, -50, 0);
    Vec3 moment = new Vec3(1000, 0, 0);

    AngularAcceleration a = RigidBodyEOM.rotationalEOM(moment, inertia, BodyRates.ZERO);

    assertTrue(a.pDot() > 0.0);
    assertNotEquals(0.0, a.rDot(), 1e-6);
    Vec3 back = inertia.toMatrix().apply(new Vec3(a.pDot(), a.qDot(), a.rDot()));
    assertEquals(moment.x(), back.x(), 1e-6);
    assertEquals(moment.y(), back.y(), 1e-6);
    assertEquals(moment.z(), back.z(), 1e-6);
  }

  @Test
  void gyroscopicCouplingWithoutMoment() {
    AngularAcceleration a =
        RigidBodyEOM.rotationalEOM(Vec3.ZERO, DIAG, new BodyRates(1, 0, 1));

    assertEquals(0.0, a.pDot(), EPS);
    assertEquals(1.0, a.qDot(), EPS);
    assertEquals(0.0, a.rDot(), EPS);
  }

  @Test
  void zeroTensorGivesZero() {
    assertSame(
        AngularAcceleration.ZERO,
        RigidBodyEOM.rotationalEOM(
            new Vec3(1, 2, 3), InertiaComponents.ZERO, new BodyRates(1, 1, 1)));
  }

  @Test
  void axisWithoutInertiaGetsZeroWhileOthersKeepMomentOverInertia() {
    AngularAcceleration a =
        RigidBodyEOM.rotationalEOM(
            new Vec3(1, 2, 3), InertiaComponents.diagonal(1, 0, 1), BodyRates.ZERO);

    assertEquals(1.0, a.pDot(), EPS);
    assertEquals(0.0, a.qDot(), EPS);
    assertEquals(3.0, a.rDot(), EPS);
  }

  @Test
  void collinearPointMassesStillPitchAndYaw() {
    List<MassSegment> dumbbell =
        List.of(MassSegment.of("left", 0.5, -1, 0, 0), MassSegment.of("right", 0.5, 1, 0, 0));
    InertiaComponents inertia = MassProperties.computeInertia(dumbbell, 1.0, 20.0);
    assertEquals(0.0, inertia.ixx(), EPS);
    assertEquals(20.0, inertia.iyy(), EPS);

    AngularAcceleration a =
        RigidBodyEOM.rotationalEOM(new Vec3(50, 100, -40), inertia, BodyRates.ZERO);

    assertEquals(0.0, a.pDot(), EPS);
    assertEquals(5.0, a.qDot(), EPS);
    assertEquals(-2.0, a.rDot(), EPS);
  }

  @Test
  void obliqueLineOfMassIgnoresMomentAlongTheLine() {
    // 10 kg at (1, 1, 0): zero inertia along (1, 1, 0), 20 across it and about z.
    InertiaComponents inertia = new InertiaComponents(10, 10, 20, -10, 0, 0);

    AngularAcceleration across =
        RigidBodyEOM.rotationalEOM(new Vec3(100, -100, 60), inertia, BodyRates.ZERO);
    AngularAcceleration along =
        RigidBodyEOM.rotationalEOM(new Vec3(100, 100, 0), inertia, BodyRates.ZERO);

    assertEquals(5.0, across.pDot(), 1e-9);
    assertEquals(-5.0, across.qDot(), 1e-9);
    assertEquals(3.0, across.rDot(), 1e-9);
    assertEquals(0.0, along.pDot(), 1e-9);
    assertEquals(0.0, along.qDot(), 1e-9);
    assertEquals(0.0, along.rDot(), 1e-9);
  }
}
