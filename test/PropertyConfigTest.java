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
 
package no.polaric.aprsis;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;


class PropertyConfigTest {

  @Test
  void typedProperties() {
    Properties p = new Properties();
    p.setProperty("a.int", " 42 ");
    p.setProperty("a.bool", "yes");
    PropertyConfig conf = new PropertyConfig(p);
    assertEquals(42, conf.getIntProperty("a.int", 0));
    assertEquals(7, conf.getIntProperty("missing", 7));
    assertTrue(conf.getBoolProperty("a.bool", false));
    assertFalse(conf.getBoolProperty("missing", false));
    assertEquals("x", conf.getProperty("missing", "x"));
  }

  @Test
  void mycallIsNormalized() {
    assertEquals("SRVA-1", TestConfig.create("srva-1").getMycall());
    assertThrows(IllegalArgumentException.class, () -> TestConfig.create("not valid").getMycall());
  }

  @Test
  void peerTable() {
    Properties p = TestConfig.defaults("SRVA");
    p.setProperty("s2s.peers", "one, two, bad");
    p.setProperty("s2s.peer.one.host", "one.example.org");
    p.setProperty("s2s.peer.one.passcode", "1");
    p.setProperty("s2s.peer.one.name", "srv1");
    p.setProperty("s2s.peer.two.host", "two.example.org");
    p.setProperty("s2s.peer.two.port", "10152");
    p.setProperty("s2s.peer.two.passcode", "2");
    p.setProperty("s2s.peer.two.receiveonly", "true");
    p.setProperty("s2s.peer.bad.passcode", "3");

    List<PeerConfig> peers = TestConfig.create(p).getPeers();
    assertEquals(2, peers.size());
    assertEquals(new PeerConfig("one", "one.example.org", 14579, 1, "SRV1", false, false), peers.get(0));
    assertEquals("two.example.org:10152", peers.get(1).displayName());
    assertTrue(peers.get(1).receiveOnly());
  }
}
