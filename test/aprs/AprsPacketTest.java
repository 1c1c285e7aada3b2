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

import java.util.List;
import org.junit.jupiter.api.Test;


class AprsPacketTest {

  @Test
  void parsesHeaderPathAndPayload() throws Exception {
    AprsPacket p = AprsPacket.fromString("la7eca-9>APRS,WIDE1-1*,WIDE2-1,qAR,LD9ABC:!6300.00N/01000.00E>test\r\n");
    assertEquals(new StationId("LA7ECA", 9), p.from);
    assertEquals("APRS", p.to.toString());
    assertEquals(4, p.via.size());
    assertEquals(PathElement.Kind.HOP, p.via.get(0).kind());
    assertTrue(p.via.get(0).used());
    assertEquals(PathElement.Kind.QCONSTRUCT, p.via.get(2).kind());
    assertEquals(PathElement.Kind.SERVER, p.via.get(3).kind());
    assertEquals("!6300.00N/01000.00E>test", p.report);
    assertEquals('!', p.type());
  }

  @Test
  void serializesNormalizedForm() throws Exception {
    AprsPacket p = AprsPacket.fromString("n0call-0>aprs,tcpip*:>status");
    assertEquals("N0CALL>APRS,TCPIP*:>status", p.toString());
  }

  @Test
  void roundTripIsIdentity() throws Exception {
    String[] lines = {
      "N0CALL>APRS:>hello",
      "LA1ABC-15>APZ123,WIDE2-2,qAC,SRV1,SRV2-3::LA7ECA   :hi there{12",
      "W1AW>BEACON,RELAY*,WIDE:T#005,199,000,255,073,123,01101001"
    };
    for (String x : lines) {
      AprsPacket p = AprsPacket.fromString(x);
      assertEquals(x, p.toString());
      assertEquals(p, AprsPacket.fromString(p.toString()));
    }
  }

  @Test
  void receiptTimeIsNotPartOfEquality() throws Exception {
    AprsPacket a = AprsPacket.fromString("N0CALL>APRS:>x");
    AprsPacket b = new AprsPacket(a.from, a.to, a.via, a.report, new java.util.Date(0));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test
  void rejectsMissingHeaderOrPayload() {
    assertThrows(MalformedPacketException.class, () -> AprsPacket.fromString("N0CALL APRS hello"));
    assertThrows(MalformedPacketException.class, () -> AprsPacket.fromString("N0CALL>APRS:"));
    assertThrows(MalformedPacketException.class, () -> AprsPacket.fromString(""));
  }

  @Test
  void rejectsInvalidCallsigns() {
    assertThrows(InvalidCallsignException.class, () -> AprsPacket.fromString("TOOLONGCALL>APRS:>x"));
    assertThrows(InvalidCallsignException.class, () -> AprsPacket.fromString("N0CALL-16>APRS:>x"));
    assertThrows(InvalidCallsignException.class, () -> AprsPacket.fromString("N0CALL>APRS,qAC,BAD_ID:>x"));
  }

  @Test
  void rejectsTooLongPathAndLine() {
    assertThrows(PathTooLongException.class,
        () -> AprsPacket.fromString("N0CALL>APRS,A,B,C,D:>x", 3));
    String longLine = "N0CALL>APRS:>" + "x".repeat(AprsPacket.MAX_LINE);
    assertThrows(MalformedPacketException.class, () -> AprsPacket.fromString(longLine));
  }

  @Test
  void fingerprintIgnoresPath() throws Exception {
    AprsPacket a = AprsPacket.fromString("N0CALL>APRS,WIDE1-1:>x");
    AprsPacket b = AprsPacket.fromString("N0CALL>APRS,qAS,SRV1:>x");
    assertEquals(a.fingerprint(), b.fingerprint());
    assertNotEquals(a, b);
  }

  @Test
  void withViaKeepsTheRest() throws Exception {
    AprsPacket a = AprsPacket.fromString("N0CALL>APRS,WIDE1-1:>x");
    AprsPacket b = a.withVia(List.of());
    assertEquals("N0CALL>APRS:>x", b.toString());
    assertSame(a.time, b.time);
  }

  @Test
  void messageAddressee() throws Exception {
    assertEquals("LA7ECA", AprsPacket.fromString("N0CALL>APRS::LA7ECA   :hello").msgTo());
    assertNull(AprsPacket.fromString("N0CALL>APRS:>status").msgTo());
  }

  @Test
  void objectAndItemName() throws Exception {
    assertEquals("LEADER", AprsPacket.fromString("N0CALL>APRS:;LEADER   *092345z4903.50N/07201.75W>").objectName());
    assertEquals("AID #2", AprsPacket.fromString("N0CALL>APRS:)AID #2!4903.50N/07201.75WA").objectName());
    assertNull(AprsPacket.fromString("N0CALL>APRS:;SHORT").objectName());
    assertNull(AprsPacket.fromString("N0CALL>APRS:)NOEND").objectName());
    assertNull(AprsPacket.fromString("N0CALL>APRS::LA7ECA   :hi").objectName());
  }
}
