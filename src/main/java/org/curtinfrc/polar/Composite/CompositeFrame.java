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

package org.curtinfrc.polar.Composite;

import java.util.List;
import java.util.Objects;
import org.curtinfrc.polar.Aero.AeroSegment;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Mass.ApparentMass;
import org.curtinfrc.polar.Mass.ApparentMassResult;
import org.curtinfrc.polar.Mass.AxisMass;
import org.curtinfrc.polar.Mass.CanopyGeometry;
import org.curtinfrc.polar.Mass.InertiaComponents;
import org.curtinfrc.polar.Mass.MassProperties;
import org.curtinfrc.polar.Mass.MassSegment;
import org.curtinfrc.polar.Profiler.Profiler;
import org.curtinfrc.polar.Simulation.SimConfig;
import org.curtinfrc.polar.Vehicles.MassAssembly;
import org.curtinfrc.polar.Vehicles.VehicleDefinition;

/**
 * Mass-derived snapshot of a vehicle at one deployment and one pilot swing angle.
 *
 * <p>Building a frame computes the CG, the inertia tensor about the CG and the added mass. It is
 * meant to be rebuilt only when {@link #needsRebuild} says so, not on every integration step.
 *
 * <p>Deployment and pilot swing only apply to a vehicle with a suspended pilot. A rigid vehicle is
 * always built at deploy 1 and zero swing, takes the added mass of its full planform and never
 * needs a rebuild.
 *
 * @param aeroSegments aerodynamic segments
 * @param weightSegments segments used for the CG
 * @param inertiaSegments segments used for the inertia tensor, including trapped air
 * @param cg system CG, m
 * @param inertia physical inertia about the CG
 * @param totalMass physical mass, kg
 * @param canopyGeometry fully inflated planform
 * @param apparentMass added mass at this deployment
 * @param effectiveMass physical plus added mass per axis
 * @param effectiveInertia physical inertia plus the added diagonal
 * @param referenceHeight height that scales normalized positions, m
 * @param rho air density used for the added mass, kg/m^3
 * @param deploy deployment fraction this frame was built at
 * @param pilotPitch pilot swing this frame was built at, radians
 * @param suspendedPilot whether deploy and swing affect this vehicle
 */
public record CompositeFrame(
    List<AeroSegment> aeroSegments,
    List<MassSegment> weightSegments,
    List<MassSegment> inertiaSegments,
    Vec3 cg,
    InertiaComponents inertia,
    double totalMass,
    CanopyGeometry canopyGeometry,
    ApparentMassResult apparentMass,
    AxisMass effectiveMass,
    InertiaComponents effectiveInertia,
    double referenceHeight,
    double rho,
    double deploy,
    double pilotPitch,
    boolean suspendedPilot) {

  public static final double DEFAULT_DEPLOY_TOLERANCE = 0.001;
  public static final double DEFAULT_PITCH_TOLERANCE = Math.toRadians(0.01);

  private static final double FULLY_DEPLOYED = 0.999;
  private static final ApparentMassResult NO_APPARENT_MASS =
      new ApparentMassResult(new AxisMass(0, 0, 0), InertiaComponents.ZERO);

  public CompositeFrame {
    aeroSegments = List.copyOf(aeroSegments);
    weightSegments = List.copyOf(weightSegments);
    inertiaSegments = List.copyOf(inertiaSegments);
  }

  /**
   * Assembles a frame.
   *
   * @param vehicle vehicle definition
   * @param deploy canopy deployment fraction, 1 for a fully inflated canopy
   * @param pilotPitch pilot swing about the riser pivot, radians
   * @param rho air density, kg/m^3
   * @return frame snapshot
   */
  public static CompositeFrame build(
      VehicleDefinition vehicle, double deploy, double pilotPitch, double rho) {
    Objects.requireNonNull(vehicle, "vehicle");
    boolean suspended = vehicle.hasSuspendedPilot();
    double d = suspended ? deploy : 1.0;
    double pitch = suspended ? pilotPitch : 0.0;
    try (Profiler.Section s = Profiler.section("CompositeFrame.build")) {
      double h = vehicle.referenceLength();
      double m = vehicle.totalMass();
      MassAssembly masses = vehicle.massAssembly(pitch, d);

      Vec3 cg = MassProperties.computeCenterOfMass(masses.weightSegments(), h, m);
      InertiaComponents inertia =
          MassProperties.computeInertia(masses.inertiaSegments(), h, m, cg);

      CanopyGeometry geometry = vehicle.canopyGeometry();
      ApparentMassResult apparent;
      if (!(geometry.area() > 0.0) || !(geometry.chord() > 0.0)) {
        apparent = NO_APPARENT_MASS;
      } else if (d < FULLY_DEPLOYED) {
        apparent = ApparentMass.atDeploy(geometry, d, rho);
      } else {
        apparent = ApparentMass.compute(geometry, rho);
      }

      return new CompositeFrame(
          vehicle.aeroSegments(),
          masses.weightSegments(),
          masses.inertiaSegments(),
          cg,
          inertia,
          m,
          geometry,
          apparent,
          ApparentMass.effectiveMass(m, apparent.mass()),
          ApparentMass.effectiveInertia(inertia, apparent.inertia()),
          h,
          rho,
          d,
          pitch,
          suspended);
    }
  }

  public boolean needsRebuild(double newDeploy, double newPilotPitch) {
    return needsRebuild(
        newDeploy, newPilotPitch, DEFAULT_DEPLOY_TOLERANCE, DEFAULT_PITCH_TOLERANCE);
  }

  /**
   * True when either input moved past its tolerance since this frame was built. Always false for a
   * rigid vehicle.
   */
  public boolean needsRebuild(
      double newDeploy, double newPilotPitch, double deployTolerance, double pitchTolerance) {
    if (!suspendedPilot) return false;
    return Math.abs(deploy - newDeploy) > deployTolerance
        || Math.abs(pilotPitch - newPilotPitch) > pitchTolerance;
  }

  /**
   * Configuration for the derivative model.
   *
   * @param useApparentMass true to use effective mass and inertia, false for physical only
   * @return simulation configuration
   */
  public SimConfig toSimConfig(boolean useApparentMass) {
    return new SimConfig(
        aeroSegments,
        cg,
        useApparentMass ? effectiveInertia : inertia,
        totalMass,
        useApparentMass ? effectiveMass : null,
        referenceHeight,
        rho);
  }

  public SimConfig toSimConfig() {
    return toSimConfig(true);
  }
}
