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
 
package no.polaric.aprsis.channel;

import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import no.polaric.aprsis.PropertyConfig;
import no.polaric.aprsis.TestConfig;
import no.polaric.aprsis.aprs.AprsPacket;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;


class UplinkTest {
  private ServerSocket upstream;
  private PropertyConfig conf;
  private Router router;
  private Uplink uplink;

  @BeforeEach
  void setUp() throws Exception {
    upstream = new ServerSocket(0, 5, InetAddress.getLoopbackAddress());
    upstream.setSoTimeout(5000);
    Properties p = TestConfig.defaults("SRVA");
    p.setProperty("uplink.host", "127.0.0.1");
    p.setProperty("uplink.port", "" + upstream.getLocalPort());
    p.setProperty("uplink.pass", "12345");
    p.setProperty("uplink.filter", "p/LA");
    conf = TestConfig.create(p);
    router = new Router(conf);
    uplink = new Uplink(conf, router);
  }

  @AfterEach
  void tearDown() throws Exception {
    uplink.deActivate();
    router.stop();
    upstream.close();
  }

  @Test
  void logsInAndRelaysBothWays() throws Exception {
    StubSession local = StubSession.client(conf, router, "LA1AAA");
    router.register(local);
    assertTrue(Uplink.isConfigured(conf));
    uplink.activate();

    try (Socket s = upstream.accept()) {
      s.setSoTimeout(5000);
      BufferedReader in = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
      Writer out = new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8);
      assertEquals("user SRVA pass 12345 vers Polaric-APRSIS 1.0 filter p/LA", in.readLine());
      out.write("# logresp SRVA verified, server T2TEST\r\n");
      out.flush();
      assertTrue(LineClient.await(() -> !router.getSessions(Session.Kind.UPLINK).isEmpty(), 5000));
      assertTrue(uplink.getSession().isVerified());

      out.write("LA7ECA>APRS,qAR,LD9ABC:>from uplink\r\n");
      out.flush();
      assertTrue(LineClient.await(() -> !local.lines.isEmpty(), 5000));
      assertEquals("LA7ECA>APRS,qAR,LD9ABC:>from uplink", local.lines.get(0));

      router.dispatch(AprsPacket.fromString("LA1AAA>APRS,TCPIP*:>to uplink"), local);
      String line;
      do {
        line = in.readLine();
      } while (line != null && line.startsWith("#"));
      assertEquals("LA1AAA>APRS,TCPIP*:>to uplink", line);
    }
  }

  @Test
  void silentUplinkIsRedialled() throws Exception {
    uplink.deActivate();
    router.stop();
    Properties p = (Properties) conf.config().clone();
    p.setProperty("s2s.idletimeout", "1");
    conf = TestConfig.create(p);
    router = new Router(conf);
    uplink = new Uplink(conf, router);
    uplink.activate();

    try (Socket s = upstream.accept()) {
      BufferedReader in = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
      Writer out = new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8);
      in.readLine();
      out.write("# logresp SRVA verified, server T2TEST\r\n");
      out.flush();
      try (Socket s2 = upstream.accept()) {
        assertEquals("No traffic from uplink", uplink.getLastError());
        assertTrue(router.getSessions(Session.Kind.UPLINK).isEmpty());
      }
    }
  }

  @Test
  void uplinkPacketsAreNotSentToPeers() throws Exception {
    StubSession peer = StubSession.peer(conf, router, "SRVP");
    router.register(peer);
    uplink.activate();

    try (Socket s = upstream.accept()) {
      BufferedReader in = new BufferedReader(new InputStreamReader(s.getInputStream(), StandardCharsets.UTF_8));
      Writer out = new OutputStreamWriter(s.getOutputStream(), StandardCharsets.UTF_8);
      in.readLine();
      out.write("# logresp SRVA verified, server T2TEST\r\nLA7ECA>APRS:>x\r\n");
      out.flush();
      assertTrue(LineClient.await(() -> router.nReceived() == 1, 5000));
      assertTrue(peer.lines.isEmpty());
    }
  }
}
