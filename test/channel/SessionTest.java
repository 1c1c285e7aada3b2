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
import no.polaric.aprsis.PropertyConfig;
import no.polaric.aprsis.TestConfig;
import no.polaric.aprsis.aprs.AprsPacket;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;


class SessionTest {
  private PropertyConfig conf;
  private Router router;
  private ServerSocket server;
  private Socket remote;
  private LineSession session;

  /* Session on a socket that does nothing by itself */
  static class LineSession extends Session {
    LineSession(PropertyConfig conf, Router router, Socket conn) { super(conf, router, conn); }
    @Override public Kind kind() { return Kind.CLIENT; }
    @Override public String getName() { return "TEST"; }
    @Override protected String heartbeat() { return null; }
    @Override protected long heartbeatInterval() { return 0; }
    @Override public void run() {}
  }

  @BeforeEach
  void setUp() throws Exception {
    conf = TestConfig.create("SRVA");
    router = new Router(conf);
    server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    remote = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
    session = new LineSession(conf, router, server.accept());
    session.open();
  }

  @AfterEach
  void tearDown() throws Exception {
    session.close();
    remote.close();
    server.close();
    router.stop();
  }

  /* Write from another thread, the data may not fit in the socket buffers */
  private Thread write(String data) {
    Thread t = new Thread(() -> {
      try {
        Writer w = new OutputStreamWriter(remote.getOutputStream(), StandardCharsets.UTF_8);
        w.write(data);
        w.flush();
      }
      catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    });
    t.start();
    return t;
  }

  @Test
  void lineEndings() throws Exception {
    write("one\r\ntwo\nthree\rfour\r\n\r\nlast").join();
    remote.shutdownOutput();
    assertEquals("one", session.readLine(5000));
    assertEquals("two", session.readLine(5000));
    assertEquals("three", session.readLine(5000));
    assertEquals("four", session.readLine(5000));
    assertEquals("", session.readLine(5000));
    assertEquals("last", session.readLine(5000));
    assertNull(session.readLine(5000));
  }

  @Test
  void longLineIsCut() throws Exception {
    Thread t = write("X".repeat(1_000_000) + "\r\nLA1AAA>APRS:>ok\r\n");
    String line = session.readLine(5000);
    assertEquals(AprsPacket.MAX_LINE + 1, line.length());
    assertThrows(Exception.class, () -> AprsPacket.fromString(line));
    assertEquals("LA1AAA>APRS:>ok", session.readLine(5000));
    t.join();
  }

  @Test
  void partialLineSurvivesTimeout() throws Exception {
    write("LA1AAA>AP").join();
    assertThrows(SocketTimeoutException.class, () -> session.readLine(200));
    write("RS:>x\r\n").join();
    assertEquals("LA1AAA>APRS:>x", session.readLine(5000));
  }
}
