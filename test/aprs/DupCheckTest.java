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

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;


class DupCheckTest {
  private AtomicLong clock;
  private DupCheck dup;

  @BeforeEach
  void setUp() {
    clock = new AtomicLong(1_000_000);
    dup = new DupCheck(30_000, 3, clock::get);
  }

  private static AprsPacket packet(String line) throws Exception {
    return AprsPacket.fromString(line);
  }

  @Test
  void secondCopyIsDuplicate() throws Exception {
    assertFalse(dup.checkPacket(packet("N0CALL>APRS:>a")));
    assertTrue(dup.checkPacket(packet("N0CALL>APRS,qAS,SRV1:>a")));
    assertEquals(1, dup.size());
  }

  @Test
  void checkIsIdempotentWithinWindow() throws Exception {
    AprsPacket p = packet("N0CALL>APRS:>a");
    dup.checkPacket(p);
    for (int i = 0; i < 5; i++) {
      clock.addAndGet(1_000);
      assertTrue(dup.checkPacket(p));
    }
    assertEquals(1, dup.size());
  }

  @Test
  void entriesExpireAfterTtl() throws Exception {
    AprsPacket p = packet("N0CALL>APRS:>a");
    dup.checkPacket(p);
    clock.addAndGet(29_999);
    assertTrue(dup.contains(p.fingerprint()));
    clock.addAndGet(1);
    assertFalse(dup.contains(p.fingerprint()));
    assertFalse(dup.checkPacket(p));
  }

  @Test
  void duplicatesDoNotRefreshFirstSeen() throws Exception {
    AprsPacket p = packet("N0CALL>APRS:>a");
    dup.checkPacket(p);
    clock.addAndGet(20_000);
    assertTrue(dup.checkPacket(p));
    clock.addAndGet(10_000);
    assertFalse(dup.checkPacket(p));
  }

  @Test
  void sweepRemovesExpired() throws Exception {
    dup.checkPacket(packet("N0CALL>APRS:>a"));
    clock.addAndGet(10_000);
    dup.checkPacket(packet("N0CALL>APRS:>b"));
    clock.addAndGet(25_000);
    assertEquals(1, dup.removeOldEntries());
    assertEquals(1, dup.size());
  }

  @Test
  void eldestIsEvictedWhenFull() throws Exception {
    AprsPacket first = packet("N0CALL>APRS:>1");
    dup.checkPacket(first);
    dup.checkPacket(packet("N0CALL>APRS:>2"));
    dup.checkPacket(packet("N0CALL>APRS:>3"));
    dup.checkPacket(packet("N0CALL>APRS:>4"));
    assertEquals(3, dup.size());
    assertEquals(1, dup.nEvicted());
    assertFalse(dup.contains(first.fingerprint()));
  }
}
