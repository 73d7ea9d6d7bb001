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

package org.curtinfrc.polar.Mass;

/**
 * Flat-plate added-mass estimates for a ram-air canopy.
 *
 * <p>A canopy displaces a volume of air comparable to its own mass, and that air has to be
 * accelerated along with it. The normal axis is modelled as a cylinder of diameter chord and length
 * span. The spanwise axis uses one of diameter span and length chord. The chordwise axis sees a
 * plate whose thickness is ten percent of the chord.
 */
public final class ApparentMass {
  private static final double PI_4 = Math.PI / 4.0;
  private static final double THICKNESS_RATIO = 0.10;

  private ApparentMass() {}

  /**
   * Added mass per axis.
   *
   * @param geom canopy planform
   * @param rho air density, kg/m^3
   * @return added mass in kg, {@code x} chordwise, {@code y} spanwise, {@code z} normal
   */
  public static AxisMass computeApparentMass(CanopyGeometry geom, double rho) {
    double span = geom.span();
    double chord = geom.chord();
    double t = THICKNESS_RATIO * chord;
    return new AxisMass(
        PI_4 * rho * t * t * span,
        PI_4 * rho * span * span * chord,
        PI_4 * rho * chord * chord * span);
  }

  /**
   * Added rotational inertia about the body axes. Only the diagonal is modelled.
   *
   * @param geom canopy planform
   * @param rho air density, kg/m^3
   * @return diagonal added inertia, kg m^2
   */
  public static InertiaComponents computeApparentInertia(CanopyGeometry geom, double rho) {
    double span = geom.span();
    double chord = geom.chord();
    double t = THICKNESS_RATIO * chord;
    double ixx = PI_4 * rho * chord * chord * span * span * span / 12.0;
    double iyy = PI_4 * rho * span * chord * chord * chord / 12.0;
    double izz = PI_4 * rho * t * t * span * span * span / 12.0;
    return InertiaComponents.diagonal(ixx, iyy, izz);
  }

  public static ApparentMassResult compute(CanopyGeometry geom, double rho) {
    return new ApparentMassResult(
        computeApparentMass(geom, rho), computeApparentInertia(geom, rho));
  }

  /**
   * Added mass of a partially inflated canopy.
   *
   * <p>Span scales by {@code 0.1 + 0.9 d} and chord by {@code 0.2 + 0.8 d}, with {@code d}
   * clamped to {@code [0, 1]}.
   *
   * @param fullGeom fully inflated planform
   * @param deploy deployment fraction
   * @param rho air density, kg/m^3
   * @return added mass and inertia at this deployment
   */
  public static ApparentMassResult atDeploy(CanopyGeometry fullGeom, double deploy, double rho) {
    double d = Math.max(0.0, Math.min(1.0, deploy));
    double span = fullGeom.span() * (0.1 + 0.9 * d);
    double chord = fullGeom.chord() * (0.2 + 0.8 * d);
    return compute(new CanopyGeometry(span, chord, span * chord), rho);
  }

  public static AxisMass effectiveMass(double physicalMass, AxisMass apparent) {
    return new AxisMass(
        physicalMass + apparent.x(), physicalMass + apparent.y(), physicalMass + apparent.z());
  }

  /** Physical tensor plus the added diagonal. Products of inertia are left as they were. */
  public static InertiaComponents effectiveInertia(
      InertiaComponents physical, InertiaComponents apparent) {
    return physical.plusDiagonal(apparent.ixx(), apparent.iyy(), apparent.izz());
  }
}
