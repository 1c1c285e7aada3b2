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
import no.polaric.aprsis.*;
import java.io.*;
import java.net.*;


/**
 * Keeps a connection to an upstream APRS-IS server (uplink.host). 
 */
public class Uplink extends Reconnector 
{
    private final Router _router;
    private final String _host;
    private final int _port;
    private volatile UplinkSession _session;
    private volatile String _lastError;
    
    
    public Uplink(ServerConfig conf, Router router) {
        super(conf, "uplink", PeerManager.newBackoff(conf));
        _router = router;
        _host = conf.getProperty("uplink.host", "");
        _port = conf.getIntProperty("uplink.port", 14580);
    }
    
    
    public static boolean isConfigured(ServerConfig conf) 
        { return !conf.getProperty("uplink.host", "").isBlank(); }
    
    
    public UplinkSession getSession() 
        { return _session; }
        
    public String getLastError() 
        { return _lastError; }
    
    
    @Override protected long connect() throws IOException {
        Socket sock = new Socket();
        try {
            sock.connect(new InetSocketAddress(_host, _port), 
                _conf.getIntProperty("s2s.handshaketimeout", 10) * 1000);
        }
        catch (IOException e) {
            sock.close();
            throw new PeerLinkException(PeerLinkException.Reason.CONNECT_FAILED, 
                "Cannot connect to "+_host+":"+_port+": "+e.getMessage(), e);
        }
        UplinkSession s = new UplinkSession(_conf, _router, sock);
        try {
            s.login();
        }
        catch (IOException e) {
            s.close(e);
            throw e;
        }
        _session = s;
        _conf.log().info("Uplink", "Connected to "+_host+":"+_port);
        long t0 = System.currentTimeMillis();
        s.run();
        _session = null;
        if (s.getCloseCause() != null)
            _lastError = s.getCloseCause().getMessage();
        return System.currentTimeMillis() - t0;
    }
    
    
    @Override protected void failed(IOException e) {
        _lastError = e.getMessage();
        _conf.log().warn("Uplink", "Uplink "+_host+": "+e.getMessage());
    }
    
    
    @Override public synchronized void deActivate() {
        super.deActivate();
        UplinkSession s = _session;
        if (s != null)
            s.close();
    }
}
