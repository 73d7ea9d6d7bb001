package org.curtinfrc.polar.Vehicles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.curtinfrc.polar.Aero.AeroSegment;
import org.curtinfrc.polar.Mass.MassSegment;
import org.curtinfrc.polar.Pendulum.PendulumModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VehicleLoaderTest {
  private static final double EPS = 1e-9;

  @TempDir Path tmp;

  @BeforeEach
  void resetCache() {
    VehicleLoader.clearCache();
  }

  @AfterEach
  void clearDirProperty() {
    System.clearProperty(VehicleLoader.VEHICLES_DIR_PROPERTY);
    VehicleLoader.clearCache();
  }

  private static double ratioSum(List<MassSegment> segments) {
    double sum = 0.0;
    for (MassSegment s : segments) {
      sum += s.massRatio();
    }
    return sum;
  }

  @Test
  void loadsCanopyFromYaml() {
    VehicleDefinition ibex = VehicleLoader.load("ibex-ul");

    assertEquals("Ibex UL", ibex.name());
    assertEquals(1.875, ibex.referenceLength(), 0.0);
    assertEquals(77.5, ibex.totalMass(), 0.0);
    assertTrue(ibex.hasSuspendedPilot());
    assertEquals(14, ibex.pilotSegments().size());
    assertEquals(7, ibex.canopyStructureSegments().size());
    assertEquals(7, ibex.canopyAirSegments().size());
    assertEquals(8, ibex.aeroSegments().size());
    assertEquals(1.0, ratioSum(ibex.pilotSegments()), EPS);
    assertEquals(0.2955, ibex.pivot().x(), 0.0);
    assertEquals(20.439 / 2.5, ibex.canopyGeometry().span(), EPS);
  }

  @Test
  void yamlAeroSegmentsConvertDegrees() {
    List<AeroSegment> aero = VehicleLoader.load("ibex-ul").aeroSegments();
    AeroSegment pilot = aero.get(aero.size() - 1);

    assertEquals("pilot_body", pilot.name());
    assertEquals(Math.PI / 2, pilot.pitchOffset(), EPS);
    assertEquals(0.25, pilot.coefficients(0.3, 0.0).cp(), 0.0);
    assertEquals(0.35, aero.get(0).coefficients(0.0, 0.0).cl(), EPS);
    assertEquals(
        aero.get(0).coefficients(Math.toRadians(25), 0).cl(),
        aero.get(0).coefficients(Math.toRadians(35), 0).cl(),
        0.0);
  }

  @Test
  void loadsWingsuitFromJson() {
    VehicleDefinition aura = VehicleLoader.load("aura-five");

    assertEquals("Aura 5", aura.name());
    assertFalse(aura.hasSuspendedPilot());
    assertNull(aura.pendulumModel());
    assertEquals(14, aura.bodySegments().size());
    assertEquals(1.0, ratioSum(aura.bodySegments()), EPS);
    assertEquals(3, aura.aeroSegments().size());
    assertEquals("right_arm_wing", aura.aeroSegments().get(1).name());
  }

  @Test
  void explicitExtensionIsAccepted() {
    assertEquals("Aura 5", VehicleLoader.load("aura-five.json").name());
  }

  @Test
  void canopyMassAssemblySplitsWeightAndInertia() {
    VehicleDefinition ibex = VehicleLoader.load("ibex-ul");

    MassAssembly deployed = ibex.massAssembly(0.0, 1.0);
    MassAssembly packed = ibex.massAssembly(0.0, 0.0);

    assertEquals(21, deployed.weightSegments().size());
    assertEquals(28, deployed.inertiaSegments().size());
    MassSegment r3 = ibex.canopyStructureSegments().get(5);
    MassSegment packedR3 = packed.weightSegments().get(14 + 5);
    assertEquals(r3.name(), packedR3.name());
    assertEquals(r3.normalizedPosition().y() * 0.1, packedR3.normalizedPosition().y(), EPS);
    assertEquals(r3.normalizedPosition().x() + 0.15, packedR3.normalizedPosition().x(), EPS);
    assertEquals(r3.normalizedPosition().z(), packedR3.normalizedPosition().z(), 0.0);
  }

  @Test
  void rigidMassAssemblyIgnoresArguments() {
    VehicleDefinition aura = VehicleLoader.load("aura-five");

    MassAssembly m = aura.massAssembly(0.5, 0.2);

    assertSame(aura.bodySegments(), m.weightSegments());
    assertSame(aura.bodySegments(), m.inertiaSegments());
  }

  @Test
  void canopyPendulumUsesPilotSegmentsOnly() {
    PendulumModel model = VehicleLoader.load("ibex-ul").pendulumModel();

    assertNotNull(model);
    assertEquals(77.5, model.params().pilotMass(), 1e-9);
    assertTrue(model.params().iyRiser() > 0.0);
    assertTrue(model.params().cgOffsetZ() > 0.0, "pilot hangs below the pivot");
  }

  @Test
  void loadByIdIsCached() {
    VehicleDefinition first = VehicleLoader.load("test-box");

    assertSame(first, VehicleLoader.load("test-box"));
    VehicleLoader.clearCache();
    assertNotSame(first, VehicleLoader.load("test-box"));
  }

  @Test
  void missingNameFallsBackToFileName() {
    VehicleDefinition box = VehicleLoader.load("test-box");

    assertEquals("test-box", box.name());
    assertEquals(2, box.bodySegments().size());
    assertEquals(0.0, box.planformArea(), 0.0);
    assertEquals(0.25, box.aeroSegments().get(0).coefficients(0, 0).cp(), 0.0);
  }

  @Test
  void emptyIdIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> VehicleLoader.load(""));
    assertThrows(IllegalArgumentException.class, () -> VehicleLoader.load(null));
  }

  @Test
  void unknownIdFails() {
    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> VehicleLoader.load("no-such-vehicle"));

    assertTrue(ex.getMessage().contains("no-such-vehicle"));
  }

  @Test
  void invalidReferenceValuesFail() {
    assertThrows(IllegalStateException.class, () -> VehicleLoader.load("test-no-mass"));
  }

  @Test
  void malformedYamlFails() {
    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> VehicleLoader.load("test-malformed"));

    assertTrue(ex.getMessage().startsWith("Failed to parse vehicle definition"));
  }

  @Test
  void emptyFileFails(@TempDir Path dir) throws IOException {
    Path empty = Files.writeString(dir.resolve("empty.yaml"), "", StandardCharsets.UTF_8);

    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> VehicleLoader.loadFrom(empty));

    assertTrue(ex.getMessage().contains("empty"));
  }

  @Test
  void loadFromMissingPathFails() {
    assertThrows(
        IllegalStateException.class, () -> VehicleLoader.loadFrom(tmp.resolve("absent.yaml")));
  }

  @Test
  void directoryPropertyTakesPrecedence() throws IOException {
    Files.writeString(
        tmp.resolve("test-box.yaml"),
        String.join(
            "\n",
            "name: Override Box",
            "reference_length_m: 1.0",
            "total_mass_kg: 10.0",
            "mass_segments:",
            "  - {name: only, mass_ratio: 1.0, x: 0.0, y: 0.0, z: 0.0}",
            ""),
        StandardCharsets.UTF_8);
    System.setProperty(VehicleLoader.VEHICLES_DIR_PROPERTY, tmp.toString());

    VehicleDefinition box = VehicleLoader.load("test-box");

    assertEquals("Override Box", box.name());
    assertEquals(1, box.bodySegments().size());
  }

  @Test
  void pilotWithoutPivotIsInvalid() {
    VehicleDefinitionConfig cfg = new VehicleDefinitionConfig();
    cfg.reference_length_m = 1.875;
    cfg.total_mass_kg = 77.5;
    VehicleDefinitionConfig.Segment torso = new VehicleDefinitionConfig.Segment();
    torso.name = "torso";
    torso.mass_ratio = 1.0;
    cfg.pilot_segments = List.of(torso);

    assertThrows(
        IllegalStateException.class, () -> VehicleLoader.toDefinition(cfg, "x.yaml", "test"));
  }

  @Test
  void negativeMassRatioIsInvalid() {
    VehicleDefinitionConfig cfg = new VehicleDefinitionConfig();
    cfg.reference_length_m = 1.875;
    cfg.total_mass_kg = 77.5;
    VehicleDefinitionConfig.Segment bad = new VehicleDefinitionConfig.Segment();
    bad.name = "bad";
    bad.mass_ratio = -0.1;
    cfg.mass_segments = List.of(bad);

    assertThrows(
        IllegalStateException.class, () -> VehicleLoader.toDefinition(cfg, "x.yaml", "test"));
  }

  @Test
  void invalidAeroGeometryIsReportedAsInvalidDefinition() {
    VehicleDefinitionConfig cfg = new VehicleDefinitionConfig();
    cfg.reference_length_m = 1.8;
    cfg.total_mass_kg = 80.0;
    VehicleDefinitionConfig.Segment body = new VehicleDefinitionConfig.Segment();
    body.name = "body";
    body.mass_ratio = 1.0;
    cfg.mass_segments = List.of(body);
    VehicleDefinitionConfig.AeroSegmentConfig wing =
        new VehicleDefinitionConfig.AeroSegmentConfig();
    wing.name = "wing";
    wing.area_m2 = 1.0;
    wing.chord_m = 0.0;
    cfg.aero_segments = List.of(wing);

    IllegalStateException ex =
        assertThrows(
            IllegalStateException.class, () -> VehicleLoader.toDefinition(cfg, "x.yaml", "test"));

    assertTrue(ex.getCause() instanceof IllegalArgumentException);
  }
}
