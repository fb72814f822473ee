package exm.ksc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.ksc.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void reset() {
    Settings.set(Settings.DUMP_TOKENS, "false");
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertFalse(Settings.getBoolean(Settings.DUMP_CFG));
    assertTrue(Settings.getKeys().contains(Settings.LOG_TRACE));
  }

  @Test
  public void testKeys() {
    assertEquals("[ksc.dump.ast, ksc.dump.cfg, ksc.dump.tokens, " +
                 "ksc.log.file, ksc.log.trace, ksc.parser.debug]",
                 Settings.getKeys().toString());
  }

  @Test
  public void testOverride() throws InvalidOptionException {
    Settings.set(Settings.DUMP_TOKENS, "TRUE");
    assertTrue(Settings.getBoolean(Settings.DUMP_TOKENS));
  }

  @Test
  public void testInvalidBoolean() throws InvalidOptionException {
    Settings.set(Settings.DUMP_TOKENS, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.DUMP_TOKENS);
  }

  @Test
  public void testUnknownKey() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean("ksc.no.such.option");
  }
}
