package org.curtinfrc.polar.Frames;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.curtinfrc.polar.Geometry.Vec3;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class WindFrameTest {
  private static final double EPS = 1e-12;

  @Test
  void zeroIncidenceAlignsWithBodyAxes() {
    WindFrame f = WindFrame.fromAngles(0, 0);

    assertEquals(1.0, f.windDir().x(), EPS);
    assertEquals(-1.0, f.liftDir().z(), EPS);
    assertEquals(1.0, f.sideDir().y(), EPS);
  }

  @ParameterizedTest
  @CsvSource({"0.1, 0.0", "0.3, -0.2", "-0.4, 0.5", "1.2, 0.3"})
  void directionsAreOrthonormal(double alpha, double beta) {
    WindFrame f = WindFrame.fromAngles(alpha, beta);

    assertEquals(1.0, f.windDir().norm(), EPS);
    assertEquals(1.0, f.liftDir().norm(), EPS);
    assertEquals(1.0, f.sideDir().norm(), EPS);
    assertEquals(0.0, f.windDir().dot(f.liftDir()), EPS);
    assertEquals(0.0, f.windDir().dot(f.sideDir()), EPS);
    assertEquals(0.0, f.liftDir().dot(f.sideDir()), EPS);
  }

  @Test
  void positiveAlphaTiltsLiftForward() {
    double alpha = 0.2;
    WindFrame f = WindFrame.fromAngles(alpha, 0);

    assertEquals(Math.sin(alpha), f.liftDir().x(), EPS);
    assertEquals(-Math.cos(alpha), f.liftDir().z(), EPS);
    assertEquals(Math.sin(alpha), f.windDir().z(), EPS);
  }

  @Test
  void verticalWindFallsBackToAftLift() {
    WindFrame f = WindFrame.fromAngles(Math.PI / 2, 0);

    assertEquals(-1.0, f.liftDir().x(), EPS);
    assertEquals(0.0, f.liftDir().y(), EPS);
    assertEquals(0.0, f.liftDir().z(), EPS);
    Vec3 expectedSide = f.windDir().cross(new Vec3(-1, 0, 0));
    assertEquals(expectedSide.y(), f.sideDir().y(), EPS);
  }
}
