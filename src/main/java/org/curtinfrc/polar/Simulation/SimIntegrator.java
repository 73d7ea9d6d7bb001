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

import java.util.ArrayList;
import java.util.List;
import org.curtinfrc.polar.Profiler.Profiler;

/**
 * Fixed-step integrators over {@link SimDerivativeModel}. Step-size selection and stability are the
 * caller's concern.
 */
public final class SimIntegrator {
  private SimIntegrator() {}

  /** {@code state + dt * deriv}. */
  public static SimState forwardEuler(SimState state, SimDerivatives deriv, double dt) {
    return state.plus(deriv, dt);
  }

  /**
   * One classical fourth-order Runge-Kutta step. Costs four derivative evaluations.
   *
   * @param state current state
   * @param config configuration snapshot
   * @param dt step, s
   * @return state after {@code dt}
   */
  public static SimState rk4Step(SimState state, SimConfig config, double dt) {
    try (Profiler.Section s = Profiler.section("SimIntegrator.rk4Step")) {
      SimDerivatives k1 = SimDerivativeModel.computeDerivatives(state, config);
      SimDerivatives k2 =
          SimDerivativeModel.computeDerivatives(forwardEuler(state, k1, dt / 2), config);
      SimDerivatives k3 =
          SimDerivativeModel.computeDerivatives(forwardEuler(state, k2, dt / 2), config);
      SimDerivatives k4 =
          SimDerivativeModel.computeDerivatives(forwardEuler(state, k3, dt), config);
      return forwardEuler(state, SimDerivatives.rk4Average(k1, k2, k3, k4), dt);
    }
  }

  /**
   * Runs {@code steps} forward Euler steps and returns the final state.
   *
   * @throws IllegalArgumentException if {@code steps} is negative or {@code dt} is not positive
   */
  public static SimState simulate(SimState state, SimConfig config, double dt, int steps) {
    checkStep(dt, steps);
    try (Profiler.Section s = Profiler.section("SimIntegrator.simulate")) {
      SimState current = state;
      for (int i = 0; i < steps; i++) {
        current = forwardEuler(current, SimDerivativeModel.computeDerivatives(current, config), dt);
      }
      Profiler.counterAdd("SimIntegrator.steps", steps);
      return current;
    }
  }

  /**
   * Runs {@code steps} RK4 steps and returns every state, starting with {@code state} itself.
   *
   * @throws IllegalArgumentException if {@code steps} is negative or {@code dt} is not positive
   */
  public static List<SimState> trajectory(SimState state, SimConfig config, double dt, int steps) {
    checkStep(dt, steps);
    List<SimState> out = new ArrayList<>(steps + 1);
    out.add(state);
    SimState current = state;
    for (int i = 0; i < steps; i++) {
      current = rk4Step(current, config, dt);
      out.add(current);
    }
    Profiler.counterAdd("SimIntegrator.steps", steps);
    return out;
  }

  private static void checkStep(double dt, int steps) {
    if (steps < 0) {
      throw new IllegalArgumentException("steps must be non-negative: " + steps);
    }
    if (!(dt > 0.0)) {
      throw new IllegalArgumentException("dt must be positive: " + dt);
    }
  }
}
