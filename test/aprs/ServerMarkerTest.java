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


class ServerMarkerTest {

  private static AprsPacket packet(String line) throws Exception {
    return AprsPacket.fromString(line);
  }

  @Test
  void validatesServerIds() {
    assertTrue(ServerMarker.isServerId("T2NORWAY"));
    assertTrue(ServerMarker.isServerId("SRV1-10"));
    assertFalse(ServerMarker.isServerId("TOOLONGNAME"));
    assertEquals("SRVA", ServerMarker.serverId(" srva "));
    assertThrows(IllegalArgumentException.class, () -> ServerMarker.serverId("bad id"));
  }

  @Test
  void markAddsQConstructOnlyWhenMissing() throws Exception {
    AprsPacket p = packet("N0CALL>APRS,WIDE1-1:>x");
    AprsPacket m = ServerMarker.mark(p, "SRVA", ServerMarker.QAC, 12);
    assertEquals("N0CALL>APRS,WIDE1-1,qAC,SRVA:>x", m.toString());

    AprsPacket m2 = ServerMarker.mark(m, "SRVB", ServerMarker.QAS, 12);
    assertEquals("N0CALL>APRS,WIDE1-1,qAC,SRVA,SRVB:>x", m2.toString());
    assertEquals(List.of("SRVA", "SRVB"), ServerMarker.servers(m2));
  }

  @Test
  void markFailsWhenPathWouldBeTooLong() throws Exception {
    AprsPacket p = packet("N0CALL>APRS,A,B:>x");
    assertNull(ServerMarker.mark(p, "SRVA", ServerMarker.QAS, 3));
    assertNotNull(ServerMarker.mark(p, "SRVA", ServerMarker.QAS, 4));
  }

  @Test
  void ownMarkerIsAlwaysALoop() throws Exception {
    AprsPacket p = packet("N0CALL>APRS,qAC,SRVA,SRVB:>x");
    assertTrue(ServerMarker.isLoop(p, "SRVA", null));
    assertTrue(ServerMarker.isLoop(p, "SRVA", "SRVB"));
  }

  @Test
  void peerTrailingStampIsNotALoop() throws Exception {
    AprsPacket p = packet("N0CALL>APRS,qAC,SRVX,SRVP:>x");
    assertFalse(ServerMarker.isLoop(p, "SRVA", "SRVP"));
    assertFalse(ServerMarker.isLoop(p, "SRVA", null));
  }

  @Test
  void packetRelayedBackByPeerIsALoop() throws Exception {
    AprsPacket p = packet("N0CALL>APRS,qAC,SRVP,SRVX,SRVP:>x");
    assertTrue(ServerMarker.isLoop(p, "SRVA", "SRVP"));
  }

  @Test
  void hopsBeforeQConstructAreNotMarkers() throws Exception {
    AprsPacket p = packet("N0CALL>APRS,SRVA,WIDE1-1:>x");
    assertFalse(ServerMarker.hasMarker(p, "SRVA"));
    assertFalse(ServerMarker.isLoop(p, "SRVA", null));
    assertNull(ServerMarker.getQcode(p));
  }

  @Test
  void qcodeAndEntryServer() throws Exception {
    String[] qc = ServerMarker.getQcode(packet("N0CALL>APRS,qAR,LD9ABC:>x"));
    assertArrayEquals(new String[] {"qAR", "LD9ABC"}, qc);
  }
}
