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

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import org.curtinfrc.polar.Aero.AeroSegment;
import org.curtinfrc.polar.Aero.LinearPolarSegment;
import org.curtinfrc.polar.Geometry.Vec3;
import org.curtinfrc.polar.Mass.MassSegment;
import org.curtinfrc.polar.Pendulum.RiserPivot;
import org.curtinfrc.polar.PolarLog;
import org.curtinfrc.polar.Profiler.Profiler;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Loads {@link VehicleDefinition}s from YAML or JSON.
 *
 * <p>An id resolves to {@code <id>.yaml}, {@code <id>.yml} or {@code <id>.json}, first in the
 * directory named by the {@code polar.vehicles.dir} system property and then on the classpath under
 * {@code vehicles/}. Definitions loaded by id are cached for the life of the process.
 */
public final class VehicleLoader {
  public static final String VEHICLES_DIR_PROPERTY = "polar.vehicles.dir";

  private static final String CLASSPATH_DIR = "vehicles/";
  private static final String[] EXTENSIONS = {".yaml", ".yml", ".json"};
  private static final ConcurrentHashMap<String, VehicleDefinition> VEHICLE_CACHE =
      new ConcurrentHashMap<>();
  private static final ObjectMapper JSON = new ObjectMapper();

  private VehicleLoader() {}

  public static VehicleDefinition load(String id) {
    try (Profiler.Section s = Profiler.section("VehicleLoader.load")) {
      if (id == null || id.isEmpty()) {
        throw new IllegalArgumentException("id must be non-empty");
      }
      VehicleDefinition def = VEHICLE_CACHE.computeIfAbsent(id, VehicleLoader::loadInternal);
      Profiler.gaugeSet("VehicleLoader.cached", VEHICLE_CACHE.size());
      return def;
    }
  }

  /** Reads a definition from an explicit file. Not cached. */
  public static VehicleDefinition loadFrom(Path path) {
    try (Profiler.Section s = Profiler.section("VehicleLoader.loadFrom")) {
      if (!Files.isRegularFile(path)) {
        PolarLog.error("Vehicle definition not found: " + path);
        throw new IllegalStateException("Missing vehicle definition: " + path);
      }
      try (InputStream in = Files.newInputStream(path)) {
        return parse(in, path.getFileName().toString(), path.toString());
      } catch (IOException ex) {
        PolarLog.error("Failed to read vehicle definition: " + path, ex);
        throw new IllegalStateException(
            "Failed to read vehicle definition: " + path + " - " + ex.getMessage(), ex);
      }
    }
  }

  static void clearCache() {
    VEHICLE_CACHE.clear();
  }

  private static VehicleDefinition loadInternal(String id) {
    String dir = System.getProperty(VEHICLES_DIR_PROPERTY);
    if (dir != null && !dir.isBlank()) {
      for (String fileName : candidateNames(id)) {
        Path path = Path.of(dir).resolve(fileName);
        if (Files.isRegularFile(path)) {
          return loadFrom(path);
        }
      }
    }

    ClassLoader cl = VehicleLoader.class.getClassLoader();
    for (String fileName : candidateNames(id)) {
      String resource = CLASSPATH_DIR + fileName;
      try (InputStream in = cl.getResourceAsStream(resource)) {
        if (in == null) {
          continue;
        }
        return parse(in, fileName, "classpath:" + resource);
      } catch (IOException ex) {
        PolarLog.error("Failed to read vehicle definition: " + resource, ex);
        throw new IllegalStateException(
            "Failed to read vehicle definition: " + resource + " - " + ex.getMessage(), ex);
      }
    }
    PolarLog.error("Vehicle definition not found: " + id);
    throw new IllegalStateException("Missing vehicle definition: " + id);
  }

  private static List<String> candidateNames(String id) {
    for (String ext : EXTENSIONS) {
      if (id.endsWith(ext)) return List.of(id);
    }
    List<String> names = new ArrayList<>(EXTENSIONS.length);
    for (String ext : EXTENSIONS) {
      names.add(id + ext);
    }
    return names;
  }

  private static VehicleDefinition parse(InputStream in, String fileName, String source)
      throws IOException {
    VehicleDefinitionConfig cfg;
    try {
      if (fileName.endsWith(".json")) {
        cfg = JSON.readValue(in, VehicleDefinitionConfig.class);
      } else {
        Yaml yaml = new Yaml(new Constructor(VehicleDefinitionConfig.class, new LoaderOptions()));
        cfg = yaml.load(in);
      }
    } catch (RuntimeException ex) {
      PolarLog.error("Failed to parse vehicle definition: " + source, ex);
      throw new IllegalStateException(
          "Failed to parse vehicle definition: " + source + " - " + ex.getMessage(), ex);
    }
    if (cfg == null) {
      PolarLog.error("Vehicle definition empty: " + source);
      throw new IllegalStateException("Vehicle definition empty: " + source);
    }
    VehicleDefinition def = toDefinition(cfg, fileName, source);
    if (def.aeroSegments().isEmpty()) {
      PolarLog.warn("Vehicle " + def.name() + " has no aero segments: " + source);
    }
    PolarLog.log(
        "Loaded vehicle " + def.name() + " from " + source + " (" + def.aeroSegments().size()
            + " aero segments)");
    return def;
  }

  static VehicleDefinition toDefinition(
      VehicleDefinitionConfig cfg, String fileName, String source) {
    if (cfg.reference_length_m <= 0.0 || cfg.total_mass_kg <= 0.0) {
      PolarLog.error("Invalid vehicle reference values: " + source);
      throw new IllegalStateException("Invalid vehicle definition: " + source);
    }
    List<MassSegment> body = toSegments(cfg.mass_segments, source);
    List<MassSegment> pilot = toSegments(cfg.pilot_segments, source);
    if (body.isEmpty() && pilot.isEmpty()) {
      PolarLog.error("Vehicle definition has no mass segments: " + source);
      throw new IllegalStateException("Vehicle definition has no mass segments: " + source);
    }
    RiserPivot pivot = cfg.pivot == null ? null : new RiserPivot(cfg.pivot.x, cfg.pivot.z);
    if (!pilot.isEmpty() && pivot == null) {
      PolarLog.error("Vehicle definition has pilot segments but no pivot: " + source);
      throw new IllegalStateException("Vehicle definition missing pivot: " + source);
    }

    double chord = cfg.chord_m != null && cfg.chord_m > 0.0 ? cfg.chord_m : 0.0;
    double area = cfg.planform_area_m2 != null && cfg.planform_area_m2 > 0.0
        ? cfg.planform_area_m2
        : 0.0;
    String baseName = fileName.replaceFirst("\\.(ya?ml|json)$", "");
    String name = cfg.name != null && !cfg.name.isEmpty() ? cfg.name : baseName;

    try {
      return new VehicleDefinition(
          name,
          cfg.reference_length_m,
          cfg.total_mass_kg,
          body,
          pilot,
          toSegments(cfg.canopy_structure_segments, source),
          toSegments(cfg.canopy_air_segments, source),
          pivot,
          area,
          chord,
          toAeroSegments(cfg.aero_segments));
    } catch (IllegalArgumentException ex) {
      PolarLog.error("Invalid vehicle definition: " + source + " - " + ex.getMessage());
      throw new IllegalStateException(
          "Invalid vehicle definition: " + source + " - " + ex.getMessage(), ex);
    }
  }

  private static List<MassSegment> toSegments(
      List<VehicleDefinitionConfig.Segment> raw, String source) {
    if (raw == null) return List.of();
    List<MassSegment> out = new ArrayList<>(raw.size());
    for (VehicleDefinitionConfig.Segment s : raw) {
      if (s.name == null || s.mass_ratio < 0.0) {
        PolarLog.error("Invalid mass segment in " + source + ": " + s.name);
        throw new IllegalStateException("Invalid mass segment in " + source + ": " + s.name);
      }
      out.add(MassSegment.of(s.name, s.mass_ratio, s.x, s.y, s.z));
    }
    return out;
  }

  private static List<AeroSegment> toAeroSegments(
      List<VehicleDefinitionConfig.AeroSegmentConfig> raw) {
    if (raw == null) return List.of();
    List<AeroSegment> out = new ArrayList<>(raw.size());
    for (VehicleDefinitionConfig.AeroSegmentConfig a : raw) {
      out.add(
          new LinearPolarSegment(
              a.name,
              new Vec3(a.x, a.y, a.z),
              a.area_m2,
              a.chord_m,
              Math.toRadians(a.pitch_offset_deg),
              a.cl0,
              a.cl_alpha_per_rad,
              Math.toRadians(a.alpha_stall_deg),
              a.cd0,
              a.k,
              a.cy_beta_per_rad,
              a.cm0,
              a.cp));
    }
    return out;
  }
}
