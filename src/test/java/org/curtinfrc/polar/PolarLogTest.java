package org.curtinfrc.polar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PolarLogTest {
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private PrintStream originalOut;
  private PrintStream originalErr;

  @BeforeEach
  void capture() {
    originalOut = System.out;
    originalErr = System.err;
    System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    PolarLog.setLogType(PolarLog.LogType.kSYSOUT);
  }

  @AfterEach
  void restore() {
    System.setOut(originalOut);
    System.setErr(originalErr);
    PolarLog.setLogType(PolarLog.LogType.kSLF4J);
    PolarLog.setEnabled(true);
  }

  @Test
  void consoleModeWritesMessages() {
    assertEquals(PolarLog.LogType.kSYSOUT, PolarLog.getLogType());
    assertTrue(PolarLog.isEnabled());

    PolarLog.log("loaded");
    PolarLog.warn("no aero");

    assertEquals("loaded", out.toString(StandardCharsets.UTF_8).trim());
    assertEquals("WARN no aero", err.toString(StandardCharsets.UTF_8).trim());
  }

  @Test
  void disablingSuppressesInfoAndWarnButNotErrors() {
    PolarLog.setEnabled(false);

    PolarLog.log("hidden");
    PolarLog.warn("hidden");
    PolarLog.error("shown");

    assertEquals("", out.toString(StandardCharsets.UTF_8));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("ERROR shown"));
    assertFalse(err.toString(StandardCharsets.UTF_8).contains("hidden"));
  }

  @Test
  void explicitTypeOverridesDefault() {
    PolarLog.setLogType(PolarLog.LogType.kSLF4J);

    PolarLog.log("direct", PolarLog.LogType.kSYSOUT);

    assertEquals("direct", out.toString(StandardCharsets.UTF_8).trim());
  }
}
