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
 * Server to server link. 
 * An outbound link is set up by the PeerManager's connector for the peer, which 
 * also runs it. An inbound link runs in its own thread (see run()). 
 */
public class PeerSession extends Session 
{
    private final PeerManager _mgr;
    private final boolean _inbound;
    private volatile PeerDescriptor _peer;
    private volatile String _serverId;
    private String _software;
    
    
    /**
     * @param peer The configured peer. Null for inbound links, where the peer is 
     *    found from the login. 
     */
    public PeerSession(ServerConfig conf, Router router, PeerManager mgr, Socket conn, PeerDescriptor peer) 
    {
        super(conf, router, conn);
        _mgr = mgr;
        _peer = peer;
        _inbound = (peer == null);
    }
    
    
    @Override public Kind kind() 
        { return Kind.PEER; }
    
    @Override public String getName() {
        String id = _serverId;
        if (id != null)
            return id;
        var pd = _peer;
        return (pd == null ? "(s2s)" : pd.getId());
    }
    
    @Override public String getServerId() 
        { return _serverId; }
    
    @Override public boolean isVerified() 
        { return _lstate == LoginState.AUTHENTICATED; }
        
    @Override public String getSoftware() 
        { return _software; }
    
    /* Nothing is sent to receive-only peers */
    @Override public boolean wants(AprsPacket p) {
        var pd = _peer;
        return pd != null && !pd.getConfig().receiveOnly();
    }
    
    @Override protected String heartbeat() 
        { return "# keepalive"; }
    
    @Override protected long heartbeatInterval() 
        { return _conf.getIntProperty("s2s.heartbeat", 20) * 1000L; }
    
    
    public boolean isInbound() 
        { return _inbound; }
        
    public PeerDescriptor getPeer() 
        { return _peer; }
    
    
    
    private String readHandshakeLine() throws IOException {
        int timeout = _conf.getIntProperty("s2s.handshaketimeout", 10) * 1000;
        try {
            String line;
            do {
                line = readLine(timeout);
                if (line == null)
                    throw new PeerLinkException(PeerLinkException.Reason.CONNECT_FAILED, 
                        "Connection closed during handshake");
                line = line.trim();
            } while (line.isEmpty());
            return line;
        }
        catch (SocketTimeoutException e) {
            throw new PeerLinkException(PeerLinkException.Reason.HANDSHAKE_TIMEOUT, 
                "No login within "+(timeout/1000)+" seconds");
        }
    }
    
    
    
    /* Send reject line and fail */
    private void reject(String reason) throws PeerLinkException {
        try {
            writeLine(S2sLogin.reject(reason));
        }
        catch (IOException e) {
            log.debug("PeerSession", "Cannot send reject to "+_ipaddr+": "+e.getMessage());
        }
        throw new PeerLinkException(PeerLinkException.Reason.REJECTED, reason);
    }
    
    
    
    /**
     * Outbound handshake. Send login and wait for the reply.
     */
    public void handshakeOutbound() throws IOException {
        open();
        _lstate = LoginState.AWAITING_LOGIN;
        var cfg = _peer.getConfig();
        writeLine(new S2sLogin(_router.getMycall(), cfg.passcode(), 
            _conf.getSoftware(), _conf.getVersion()).toString());
        
        String id = S2sLogin.parseReply(readHandshakeLine());
        if (cfg.name() != null && !cfg.name().equals(id))
            throw new PeerLinkException(PeerLinkException.Reason.REJECTED, 
                "Peer identifies as "+id+", expected "+cfg.name());
        if (id.equals(_router.getMycall()))
            throw new PeerLinkException(PeerLinkException.Reason.REJECTED, "Connected to myself");
        _serverId = id;
    }
    
    
    
    /**
     * Inbound handshake. Read login, find the configured peer and check the passcode. 
     */
    public void handshakeInbound() throws IOException {
        open();
        _lstate = LoginState.AWAITING_LOGIN;
        S2sLogin login;
        try {
            login = S2sLogin.parse(readHandshakeLine());
        }
        catch (LoginException e) {
            reject("invalid login");
            return;
        }
        PeerDescriptor pd = _mgr.lookup(login.serverId(), _conn.getInetAddress());
        if (pd == null) 
            reject("unknown peer "+login.serverId());
        else if (login.passcode() != pd.getConfig().passcode())
            reject("invalid passcode");
        else if (login.serverId().equals(_router.getMycall()))
            reject("same server id");
        
        _peer = pd;
        _serverId = login.serverId();
        _software = login.software()+" "+login.version();
        if (!_mgr.attachInbound(pd, this))
            reject("link already established");
    }
    
    
    
    /**
     * Register with the router and run the link until it ends. 
     */
    public void runLink(boolean sendLogresp) throws IOException {
        _lstate = LoginState.AUTHENTICATED;
        try {
            _router.register(this);
        }
        catch (LoginException e) {
            throw new PeerLinkException(PeerLinkException.Reason.REJECTED, e.getMessage());
        }
        if (sendLogresp)
            writeLine(S2sLogin.logresp(_router.getMycall()));
        log.info("PeerSession", "S2S link established with "+_serverId+" ("+_ipaddr+ (_inbound ? ", inbound)" : ", outbound)"));
        startWriter();
        
        int idle = _conf.getIntProperty("s2s.idletimeout", 60) * 1000;
        while (!isClosed()) {
            String line;
            try {
                line = readLine(idle);
            }
            catch (SocketTimeoutException e) {
                throw new PeerLinkException(PeerLinkException.Reason.PEER_IDLE, 
                    "No traffic from "+_serverId+" for "+(idle/1000)+" seconds");
            }
            if (line == null)
                break;
            if (line.isEmpty() || line.charAt(0) == '#')
                continue;
            handlePacketLine(line);
        }
    }
    
    
    
    @Override public void close(Exception cause) {
        boolean wasOpen = !isClosed();
        super.close(cause);
        var pd = _peer;
        if (wasOpen && pd != null)
            _mgr.detach(pd, this, cause);
    }
    
    
    
    /* Inbound link thread */
    public void run() {
        try {
            log.info("PeerSession", "Incoming S2S connection from: "+_ipaddr);
            handshakeInbound();
            runLink(true);
        }
        catch (IOException e) {
            if (!isClosed()) {
                log.info("PeerSession", "S2S link ("+_ipaddr+"): "+e.getMessage());
                close(e);
            }
        }
        finally {
            close();
            log.info("PeerSession", "S2S connection closed: "+this);
        }
    }
}
