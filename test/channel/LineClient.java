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

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.function.BooleanSupplier;


/**
 * Line based test client for the client and S2S ports. 
 */
class LineClient implements AutoCloseable {
  private final Socket sock;
  private final BufferedReader in;
  private final Writer out;

  LineClient(int port) throws IOException {
    sock = new Socket(InetAddress.getLoopbackAddress(), port);
    sock.setSoTimeout(5000);
    in = new BufferedReader(new InputStreamReader(sock.getInputStream(), StandardCharsets.UTF_8));
    out = new OutputStreamWriter(sock.getOutputStream(), StandardCharsets.UTF_8);
  }

  void send(String line) throws IOException {
    out.write(line + "\r\n");
    out.flush();
  }

  String readLine() throws IOException {
    return in.readLine();
  }

  /** Next line that is not a comment. */
  String readPacket() throws IOException {
    String line;
    do {
      line = in.readLine();
    } while (line != null && line.startsWith("#"));
    return line;
  }

  /** Next line starting with the prefix. Other lines are skipped. */
  String readUntil(String prefix) throws IOException {
    String line;
    do {
      line = in.readLine();
    } while (line != null && !line.startsWith(prefix));
    return line;
  }

  /** Read until the server closes the connection. */
  boolean closedByServer() throws IOException {
    try {
      while (in.readLine() != null)
        ;
      return true;
    } catch (SocketException e) {
      return true;
    }
  }

  String login(String call, int pass, String filter) throws IOException {
    send("user " + call + " pass " + pass + " vers TestClient 1.0"
        + (filter == null ? "" : " filter " + filter));
    return readUntil("# logresp");
  }

  @Override public void close() throws IOException {
    sock.close();
  }

  static boolean await(BooleanSupplier cond, long millis) throws InterruptedException {
    long deadline = System.currentTimeMillis() + millis;
    while (System.currentTimeMillis() < deadline) {
      if (cond.getAsBoolean())
        return true;
      Thread.sleep(20);
    }
    return cond.getAsBoolean();
  }
}
