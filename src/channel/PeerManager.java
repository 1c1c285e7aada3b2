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
import java.util.*;


/**
 * Manages the S2S peer mesh. Keeps a connector for each configured peer that 
 * dials the peer and reconnects with backoff, and accepts inbound links on the 
 * S2S port. Only one link per peer is used at a time. An inbound link for a peer 
 * that is already connected is rejected, and an outbound link that is set up while 
 * an inbound link is up, is closed. 
 */
public class PeerManager 
{
    private final ServerConfig _conf;
    private final Router _router;
    private final Logfile log;
    private final Map<String, PeerDescriptor> _peers = new LinkedHashMap<String, PeerDescriptor>();
    private final List<Connector> _connectors = new ArrayList<Connector>();
    private Listener _listener;
    private Reconnector.Sleeper _sleeper; 
    
    
    
    /**
     * Connector for one peer. 
     */
    public class Connector extends Reconnector 
    {
        private final PeerDescriptor _peer;
        
        public Connector(PeerDescriptor pd) {
            super(PeerManager.this._conf, pd.getId(), newBackoff(PeerManager.this._conf));
            _peer = pd;
        }
        
        public PeerDescriptor getPeer() 
            { return _peer; }
        
        
        @Override protected boolean canConnect() 
            { return !_peer.hasLiveSession(); }
        
        
        @Override protected long connect() throws IOException {
            var cfg = _peer.getConfig();
            int timeout = _conf.getIntProperty("s2s.handshaketimeout", 10) * 1000;
            setAttemptState(_peer, PeerDescriptor.State.CONNECTING);
            Socket sock = new Socket();
            try {
                sock.connect(new InetSocketAddress(cfg.host(), cfg.port()), timeout);
            }
            catch (IOException e) {
                sock.close();
                throw new PeerLinkException(PeerLinkException.Reason.CONNECT_FAILED, 
                    "Cannot connect to "+cfg.host()+":"+cfg.port()+": "+e.getMessage(), e);
            }
            
            setAttemptState(_peer, PeerDescriptor.State.HANDSHAKING);
            PeerSession s = new PeerSession(_conf, _router, PeerManager.this, sock, _peer);
            try {
                s.handshakeOutbound();
            }
            catch (IOException e) {
                s.close(e);
                throw e;
            }
            if (!attachOutbound(_peer, s)) {
                log.info("PeerManager", "Inbound link from "+_peer+" is already up - closing outbound link");
                s.close();
                return 0;
            }
            
            long t0 = System.currentTimeMillis();
            try {
                s.runLink(false);
            }
            catch (IOException e) {
                if (!s.isClosed()) {
                    log.info("PeerManager", "S2S link to "+_peer+": "+e.getMessage());
                    s.close(e);
                }
            }
            finally {
                s.close();
            }
            return System.currentTimeMillis() - t0;
        }
        
        
        @Override protected void failed(IOException e) 
            { connectFailed(_peer, e); }
        
        
        @Override protected void waiting(long delay) {
            if (setBackoff(_peer, System.currentTimeMillis() + delay))
                log.debug("PeerManager", "Peer "+_peer+": reconnect in "+delay+" ms");
        }
    }
    
    
    
    public static Backoff newBackoff(ServerConfig conf) {
        return new Backoff(
            conf.getIntProperty("s2s.backoff.min", 1) * 1000L, 
            conf.getIntProperty("s2s.backoff.max", 60) * 1000L, 
            conf.getIntProperty("s2s.backoff.stable", 60) * 1000L );
    }
    
    
    
    public PeerManager(ServerConfig conf, Router router) {
        _conf = conf;
        _router = router;
        log = conf.log();
        for (PeerConfig pc : conf.getPeers())
            _peers.put(pc.id(), new PeerDescriptor(pc));
        router.setPeerManager(this);
    }
    
    
    /** Replace the sleep of the connectors. Must be called before activate(). */
    public void setSleeper(Reconnector.Sleeper s) 
        { _sleeper = s; }
    
    
    
    /**
     * Open the S2S port and start connecting to peers. 
     * @throws IOException if the S2S port cannot be bound. 
     */
    public void activate() throws IOException {
        _listener = new Listener(_conf, "s2s", _conf.getIntProperty("s2s.port", 14579), this::acceptInbound);
        _listener.activate();
        for (PeerDescriptor pd : _peers.values()) {
            if (pd.getConfig().passive())
                continue;
            Connector c = new Connector(pd);
            if (_sleeper != null)
                c.setSleeper(_sleeper);
            _connectors.add(c);
            c.activate();
        }
        log.info("PeerManager", "S2S started: "+_peers.size()+" peers configured, "
            + _connectors.size()+" to connect to");
    }
    
    
    public void deActivate() {
        for (Connector c : _connectors)
            c.deActivate();
        if (_listener != null)
            _listener.deActivate();
        for (PeerDescriptor pd : _peers.values()) {
            PeerSession s = pd.getSession();
            if (s != null)
                s.close();
        }
    }
    
    
    /** Local S2S port. */
    public int getPort() 
        { return (_listener == null ? -1 : _listener.getPort()); }
    
    
    public Collection<PeerDescriptor> getPeers() 
        { return Collections.unmodifiableCollection(_peers.values()); }
    
    
    public PeerDescriptor getPeer(String id) 
        { return _peers.get(id); }
    
    
    public List<Connector> getConnectors() 
        { return Collections.unmodifiableList(_connectors); }
    
    
    public List<PeerDescriptor.Info> getPeerInfo() {
        List<PeerDescriptor.Info> res = new ArrayList<PeerDescriptor.Info>();
        for (PeerDescriptor pd : _peers.values())
            res.add(pd.getInfo());
        return res;
    }
    
    
    
    /**
     * Handle incoming S2S connection. The handshake is done in the session's own thread.
     */
    public void acceptInbound(Socket conn) {
        PeerSession s = new PeerSession(_conf, _router, this, conn, null);
        s.start();
    }
    
    
    
    /**
     * Find the configured peer for an inbound login. A peer is found by its 
     * configured server identity, or else by the address of its host. 
     */
    public PeerDescriptor lookup(String serverId, InetAddress addr) {
        for (PeerDescriptor pd : _peers.values())
            if (serverId.equals(pd.getConfig().name()))
                return pd;
        for (PeerDescriptor pd : _peers.values()) {
            if (pd.getConfig().name() != null)
                continue;
            try {
                for (InetAddress a : InetAddress.getAllByName(pd.getConfig().host()))
                    if (a.equals(addr))
                        return pd;
            }
            catch (UnknownHostException e) {
                log.debug("PeerManager", "Cannot resolve "+pd.getConfig().host()+": "+e.getMessage());
            }
        }
        return null;
    }
    
    
    
    /**
     * Attach an inbound link to a peer. 
     * @return false if the peer already has a link. 
     */
    synchronized boolean attachInbound(PeerDescriptor pd, PeerSession s) {
        if (pd.hasLiveSession())
            return false;
        pd.setServerId(s.getServerId());
        pd.attach(s, true);
        return true;
    }
    
    
    /**
     * Attach an outbound link to a peer. 
     * @return false if the peer already has a link (inbound). 
     */
    synchronized boolean attachOutbound(PeerDescriptor pd, PeerSession s) {
        if (pd.hasLiveSession())
            return false;
        pd.setServerId(s.getServerId());
        pd.attach(s, false);
        return true;
    }
    
    
    /**
     * Set the state of a connection attempt. A peer with a live link keeps 
     * its state. 
     */
    synchronized void setAttemptState(PeerDescriptor pd, PeerDescriptor.State st) {
        if (!pd.hasLiveSession())
            pd.setState(st);
    }
    
    
    /**
     * A connection attempt failed. If a link to the peer is up (set up from the 
     * other side meanwhile), the failure is logged only. 
     */
    synchronized void connectFailed(PeerDescriptor pd, IOException e) {
        if (pd.hasLiveSession()) {
            log.debug("PeerManager", "Outbound link to "+pd+" not used, link is up: "+e.getMessage());
            return;
        }
        boolean connerr = (e instanceof PeerLinkException pe 
            && pe.getReason() == PeerLinkException.Reason.CONNECT_FAILED);
        pd.setError(e.getMessage(), connerr);
        pd.setState(PeerDescriptor.State.DISCONNECTED);
        log.warn("PeerManager", "Peer "+pd+": "+e.getMessage());
    }
    
    
    /**
     * Peer is waiting for reconnect until the given time. 
     * @return false if a link to the peer is up, and the state is not changed. 
     */
    synchronized boolean setBackoff(PeerDescriptor pd, long until) {
        if (pd.hasLiveSession())
            return false;
        pd.setBackoff(until);
        return true;
    }
    
    
    /**
     * Link to a peer has ended. 
     */
    synchronized void detach(PeerDescriptor pd, PeerSession s, Exception cause) {
        if (!pd.detach(s))
            return;
        if (cause != null)
            pd.setError(cause.getMessage(), false);
        log.info("PeerManager", "S2S link with "+pd+" closed"
            + (cause == null ? "" : ": "+cause.getMessage()));
    }
}
