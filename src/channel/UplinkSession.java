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
import no.polaric.aprsis.aprs.*;
import java.io.*;
import java.net.*;


/**
 * Client connection to an upstream APRS-IS server. Packets from the uplink go to 
 * local clients. Packets from verified local clients are sent to the uplink. 
 */
public class UplinkSession extends Session 
{
    private final String _user;
    private volatile boolean _verified;
    
    
    public UplinkSession(ServerConfig conf, Router router, Socket conn) {
        super(conf, router, conn);
        _user = conf.getProperty("uplink.user", conf.getMycall()).toUpperCase();
    }
    
    
    @Override public Kind kind() 
        { return Kind.UPLINK; }
        
    @Override public String getName() 
        { return _user; }
        
    @Override public boolean isVerified() 
        { return _verified; }
    
    /* Full feeds are not passed on to the S2S mesh */
    @Override public boolean canReachPeers() 
        { return false; }
    
    @Override protected String heartbeat() 
        { return "# "+_conf.getSoftware()+" "+_conf.getVersion(); }
    
    @Override protected long heartbeatInterval() 
        { return _conf.getIntProperty("client.heartbeat", 20) * 1000L; }
    
    
    
    /**
     * Log in to the server. 
     */
    public void login() throws IOException {
        open();
        _lstate = LoginState.AWAITING_LOGIN;
        String filter = _conf.getProperty("uplink.filter", "");
        writeLine("user "+_user+" pass "+_conf.getIntProperty("uplink.pass", Passcode.READONLY)
            + " vers "+_conf.getSoftware()+" "+_conf.getVersion()
            + (filter.isBlank() ? "" : " filter "+filter));
            
        int timeout = _conf.getIntProperty("client.logintimeout", 30) * 1000;
        try {
            while (true) {
                String line = readLine(timeout);
                if (line == null)
                    throw new PeerLinkException(PeerLinkException.Reason.CONNECT_FAILED, 
                        "Connection closed during login");
                if (!line.startsWith("# logresp"))
                    continue;
                String[] x = line.substring(9).trim().split("[\\s,]+");
                if (x.length < 2 || !x[1].equals("verified") && !x[1].equals("unverified"))
                    throw new PeerLinkException(PeerLinkException.Reason.REJECTED, "Login failed: "+line);
                _verified = x[1].equals("verified");
                break;
            }
        }
        catch (SocketTimeoutException e) {
            throw new PeerLinkException(PeerLinkException.Reason.HANDSHAKE_TIMEOUT, "Login timeout");
        }
        if (!_verified)
            log.warn("UplinkSession", "Uplink login "+_user+" is not verified. Packets will not be accepted by the server");
    }
    
    
    
    /**
     * Register with the router and run until the connection ends. 
     */
    public void runLink() throws IOException {
        _lstate = LoginState.AUTHENTICATED;
        _router.register(this);
        startWriter();
        int idle = _conf.getIntProperty("s2s.idletimeout", 60) * 1000;
        while (!isClosed()) {
            String line;
            try {
                line = readLine(idle);
            }
            catch (SocketTimeoutException e) {
                throw new PeerLinkException(PeerLinkException.Reason.PEER_IDLE, "No traffic from uplink");
            }
            if (line == null)
                break;
            if (line.isEmpty() || line.charAt(0) == '#')
                continue;
            handlePacketLine(line);
        }
    }
    
    
    /**
     * Run the link after login, until it ends. Errors are logged and end the session, 
     * see getCloseCause(). The Uplink connector calls this in its own thread.
     */
    public void run() {
        try {
            runLink();
        }
        catch (IOException e) {
            if (!isClosed()) {
                log.info("UplinkSession", "Uplink ("+_ipaddr+"): "+e.getMessage());
                close(e);
            }
        }
        finally {
            close();
        }
    }
}
