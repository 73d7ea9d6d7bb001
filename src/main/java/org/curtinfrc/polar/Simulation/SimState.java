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

import org.curtinfrc.polar.Frames.Attitude;
import org.curtinfrc.polar.Frames.BodyRates;
import org.curtinfrc.polar.Geometry.Vec3;

/**
 * Twelve-element rigid-body state.
 *
 * @param x north position, m
 * @param y east position, m
 * @param z down position, m
 * @param u body forward velocity, m/s
 * @param v body right velocity, m/s
 * @param w body down velocity, m/s
 * @param phi roll, rad
 * @param theta pitch, rad
 * @param psi yaw, rad
 * @param p roll rate, rad/s
 * @param q pitch rate, rad/s
 * @param r yaw rate, rad/s
 */
public record SimState(
    double x,
    double y,
    double z,
    double u,
    double v,
    double w,
    double phi,
    double theta,
    double psi,
    double p,
    double q,
    double r) {

  public static SimState of(Vec3 position, Vec3 bodyVelocity, Attitude attitude, BodyRates rates) {
    return new SimState(
        position.x(),
        position.y(),
        position.z(),
        bodyVelocity.x(),
        bodyVelocity.y(),
        bodyVelocity.z(),
        attitude.phi(),
        attitude.theta(),
        attitude.psi(),
        rates.p(),
        rates.q(),
        rates.r());
  }

  public Vec3 position() {
    return new Vec3(x, y, z);
  }

  public Vec3 bodyVelocity() {
    return new Vec3(u, v, w);
  }

  public Attitude attitude() {
    return new Attitude(phi, theta, psi);
  }

  public BodyRates rates() {
    return new BodyRates(p, q, r);
  }

  /** {@code this + dt * d}, element by element. */
  public SimState plus(SimDerivatives d, double dt) {
    return new SimState(
        x + d.xDot() * dt,
        y + d.yDot() * dt,
        z + d.zDot() * dt,
        u + d.uDot() * dt,
        v + d.vDot() * dt,
        w + d.wDot() * dt,
        phi + d.phiDot() * dt,
        theta + d.thetaDot() * dt,
        psi + d.psiDot() * dt,
        p + d.pDot() * dt,
        q + d.qDot() * dt,
        r + d.rDot() * dt);
  }
}
