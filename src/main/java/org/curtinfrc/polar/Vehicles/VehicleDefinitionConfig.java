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

package org.curtinfrc.polar.Vehicles;

import java.util.List;

/** File layout of a vehicle definition, shared by the YAML and JSON readers. */
public final class VehicleDefinitionConfig {
  public String name;
  public double reference_length_m;
  public double total_mass_kg;
  public Double planform_area_m2;
  public Double chord_m;
  public Pivot pivot;
  public List<Segment> mass_segments;
  public List<Segment> pilot_segments;
  public List<Segment> canopy_structure_segments;
  public List<Segment> canopy_air_segments;
  public List<AeroSegmentConfig> aero_segments;

  public static final class Pivot {
    public double x;
    public double z;
  }

  public static final class Segment {
    public String name;
    public double mass_ratio;
    public double x;
    public double y;
    public double z;
  }

  public static final class AeroSegmentConfig {
    public String name;
    public double x;
    public double y;
    public double z;
    public double area_m2;
    public double chord_m;
    public double pitch_offset_deg;
    public double cl0;
    public double cl_alpha_per_rad;
    public double alpha_stall_deg = 90.0;
    public double cd0;
    public double k;
    public double cy_beta_per_rad;
    public double cm0;
    public double cp = 0.25;
  }
}
