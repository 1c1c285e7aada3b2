/* 
 * Copyright (C) 2026 by LA7ECA, Øyvind Hanssen (ohanssen@acm.org)
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 */
 
package no.polaric.aprsis.aprs;

import static org.junit.jupiter.api.Assertions.*;

import no.polaric.aprsis.channel.LoginException;
import org.junit.jupiter.api.Test;


class PasscodeTest {

  @Test
  void computesKnownPasscodes() {
    assertEquals(13023, Passcode.compute("N0CALL"));
    assertEquals(19367, Passcode.compute("LA7ECA"));
    assertEquals(25988, Passcode.compute("W1AW"));
  }

  @Test
  void ignoresSsidAndCase() {
    assertEquals(Passcode.compute("LA7ECA"), Passcode.compute("la7eca-2"));
  }

  @Test
  void verifiesPasscodeOrReadOnlySentinel() {
    assertTrue(Passcode.verify("N0CALL", 13023));
    assertTrue(Passcode.verify("N0CALL", Passcode.READONLY));
    assertFalse(Passcode.verify("N0CALL", 12345));
  }

  @Test
  void checkThrowsAuthFailed() {
    LoginException e = assertThrows(LoginException.class, () -> Passcode.check("N0CALL", 1));
    assertEquals(LoginException.Reason.AUTH_FAILED, e.getReason());
    assertDoesNotThrow(() -> Passcode.check("N0CALL", 13023));
  }
}
