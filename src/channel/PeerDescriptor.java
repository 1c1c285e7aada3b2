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
import java.util.*;


/**
 * A configured S2S peer and the state of the link to it. 
 * State changes are made by the PeerManager only. 
 */
public class PeerDescriptor 
{
    public enum State { DISCONNECTED, CONNECTING, HANDSHAKING, CONNECTED, BACKOFF }
    
    public static record Info 
       ( String id, String name, String host, int port, boolean receiveOnly, State state, 
         Date backoffUntil, boolean inbound, long rxpackets, long txpackets, long rxbytes, long txbytes, 
         int connectErrors, String lastError, Date lastConnect )
    {}
    
    
    private final PeerConfig _cfg;
    private State _state = State.DISCONNECTED;
    private Date _until;
    private PeerSession _session;
    private boolean _inbound;
    private String _serverId;
    private int _connectErrors;
    private String _lastError;
    private Date _lastConnect;
    private long _rxpackets, _txpackets, _rxbytes, _txbytes;
    
    
    public PeerDescriptor(PeerConfig cfg) {
        _cfg = cfg;
        _serverId = cfg.name();
    }
    
    
    public PeerConfig getConfig() 
        { return _cfg; }
        
    public String getId() 
        { return _cfg.id(); }
    
    public synchronized State getState() 
        { return _state; }
    
    /** Server identity. Configured or learned at login. Null if not known. */
    public synchronized String getServerId() 
        { return _serverId; }
    
    public synchronized PeerSession getSession() 
        { return _session; }
    
    /** Return true if there is a link to the peer that is not closed. */
    public synchronized boolean hasLiveSession() 
        { return _session != null && !_session.isClosed(); }
    
    public synchronized boolean isInbound() 
        { return _inbound; }
    
    public synchronized String getLastError() 
        { return _lastError; }
    
    public synchronized int nConnectErrors() 
        { return _connectErrors; }
    
    
    
    synchronized void setState(State s) {
        _state = s;
        if (s != State.BACKOFF)
            _until = null;
    }
    
    synchronized void setBackoff(long until) {
        _state = State.BACKOFF;
        _until = new Date(until);
    }
    
    synchronized void setServerId(String id) 
        { _serverId = id; }
    
    synchronized void setError(String err, boolean connectError) {
        _lastError = err;
        if (connectError)
            _connectErrors++;
    }
    
    
    synchronized void attach(PeerSession s, boolean inbound) {
        _session = s;
        _inbound = inbound;
        _state = State.CONNECTED;
        _until = null;
        _lastConnect = new Date();
    }
    
    
    /* Detach session, keep its counters. Return false if it was not attached */
    synchronized boolean detach(PeerSession s) {
        if (_session != s)
            return false;
        Session.Info i = s.getInfo();
        _rxpackets += i.rxpackets();
        _txpackets += i.txpackets();
        _rxbytes += i.rxbytes();
        _txbytes += i.txbytes();
        _session = null;
        _state = State.DISCONNECTED;
        return true;
    }
    
    
    public synchronized Info getInfo() {
        long rxp = _rxpackets, txp = _txpackets, rxb = _rxbytes, txb = _txbytes;
        if (_session != null) {
            Session.Info i = _session.getInfo();
            rxp += i.rxpackets();
            txp += i.txpackets();
            rxb += i.rxbytes();
            txb += i.txbytes();
        }
        return new Info(_cfg.id(), (_serverId == null ? _cfg.displayName() : _serverId), 
            _cfg.host(), _cfg.port(), _cfg.receiveOnly(), _state, _until, _inbound && _session != null, 
            rxp, txp, rxb, txb, _connectErrors, _lastError, _lastConnect);
    }
    
    
    public String toString() {
        return _cfg.id()+" ("+_cfg.host()+":"+_cfg.port()+")";
    }
}
