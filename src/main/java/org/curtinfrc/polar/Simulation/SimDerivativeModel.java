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

package org.curtinfrc.polar.Simulation;

import org.curtinfrc.polar.Aero.AeroAggregator;
import org.curtinfrc.polar.Aero.SystemForceMoment;
import org.curtinfrc.polar.Frames.BodyRates;
import org.curtinfrc.polar.Frames.EulerRates;
import org.curtinfrc.polar.Frames.FrameMath;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Motion.AngularAcceleration;
import org.curtinfrc.polar.Motion.RigidBodyEOM;
import org.curtinfrc.polar.Motion.TranslationalAcceleration;

/** The right-hand side {@code f(state)} of the rigid-body equations. */
public final class SimDerivativeModel {
  private SimDerivativeModel() {}

  /**
   * Evaluates all twelve derivatives: aerodynamic load with rotational flow, weight, translational
   * and rotational dynamics, then the two kinematic relations.
   *
   * @param state current state
   * @param config configuration snapshot
   * @return state derivatives
   */
  public static SimDerivatives computeDerivatives(SimState state, SimConfig config) {
    Vec3 velocity = state.bodyVelocity();
    BodyRates rates = state.rates();

    SystemForceMoment aero =
        AeroAggregator.evaluateAeroForces(
            config.segments(),
            config.cg(),
            config.referenceHeight(),
            velocity,
            rates,
            config.rho());

    Vec3 weight = RigidBodyEOM.gravityBody(state.phi(), state.theta()).times(config.mass());
    Vec3 force = aero.force().plus(weight);

    TranslationalAcceleration lin =
        config.massPerAxis() != null
            ? RigidBodyEOM.translationalEOMAnisotropic(force, config.massPerAxis(), velocity, rates)
            : RigidBodyEOM.translationalEOM(force, config.mass(), velocity, rates);
    AngularAcceleration ang = RigidBodyEOM.rotationalEOM(aero.moment(), config.inertia(), rates);

    EulerRates euler =
        FrameMath.eulerRates(state.p(), state.q(), state.r(), state.phi(), state.theta());
    Vec3 inertialVelocity =
        FrameMath.bodyToInertialVelocity(
            state.u(), state.v(), state.w(), state.phi(), state.theta(), state.psi());

    return new SimDerivatives(
        inertialVelocity.x(),
        inertialVelocity.y(),
        inertialVelocity.z(),
        lin.uDot(),
        lin.vDot(),
        lin.wDot(),
        euler.phiDot(),
        euler.thetaDot(),
        euler.psiDot(),
        ang.pDot(),
        ang.qDot(),
        ang.rDot());
  }
}
