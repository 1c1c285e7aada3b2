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
import no.polaric.aprsis.util.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.LongSupplier;
import com.fasterxml.jackson.annotation.*;


/**
 * Router. Hub that every session hands its packets to. 
 * 
 * A packet is checked for loops and duplicates, and then sent to every other 
 * registered session that wants it. Dispatch is serialized under one lock, so 
 * that two copies of the same packet arriving at the same time are never both 
 * delivered. 
 */
public class Router
{
    private final ServerConfig _conf;
    private final Logfile log;
    private final String _mycall;
    private final int _maxPath;
    private final Object _lock = new Object();
    private final Map<Long, Session> _sessions = new ConcurrentHashMap<Long, Session>();
    private final DupCheck _dup;
    private final RateCounter _rate;
    private final Date _started = new Date();
    private ScheduledExecutorService _sweeper;
    private PeerManager _peers;
    
    private long _received, _delivered, _duplicates, _loops, _filtered, _toolong;
    
    
    @JsonPropertyOrder({"server", "software", "started", "clients", "peers", "dedupSize", "packetsPerSec"})
    public static record Status
       ( String server, String software, Date started, int clients, int peers, int dedupSize, 
         double packetsPerSec, long received, long delivered, long duplicates, long loops, 
         long filtered, long tooLong, List<Session.Info> clientInfo, List<PeerDescriptor.Info> peerInfo )
    {}
    
    
    
    public Router(ServerConfig conf, LongSupplier clock) {
        _conf = conf;
        log = conf.log();
        _mycall = conf.getMycall();
        _maxPath = conf.getIntProperty("router.maxpath", AprsPacket.DEFAULT_MAX_PATH);
        _dup = new DupCheck(
            conf.getIntProperty("router.dupttl", 30) * 1000L, 
            conf.getIntProperty("router.dupmax", DupCheck.DEFAULT_MAXSIZE), 
            clock );
        _rate = new RateCounter(10, clock);
    }
    
    
    public Router(ServerConfig conf) 
        { this(conf, System::currentTimeMillis); }
    
    
    
    /**
     * Start periodic removal of expired dedup entries. 
     */
    public void start() {
        long period = _conf.getIntProperty("router.sweep", 10);
        _sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dedup-sweep");
            t.setDaemon(true);
            return t;
        });
        _sweeper.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.SECONDS);
        log.info("Router", "Router started. Server id: "+_mycall);
    }
    
    
    public void stop() {
        if (_sweeper != null)
            _sweeper.shutdownNow();
        for (Session s : _sessions.values())
            s.close();
    }
    
    
    public int sweep() {
        synchronized (_lock) {
            int n = _dup.removeOldEntries();
            if (n > 0)
                log.debug("Router", "Removed "+n+" expired dedup entries");
            return n;
        }
    }
    
    
    public void setPeerManager(PeerManager pm) 
        { _peers = pm; }
    
    public String getMycall() 
        { return _mycall; }
        
    public int getMaxPath() 
        { return _maxPath; }
    
    
    
    /**
     * Register an authenticated session. A verified client login is rejected if the 
     * same callsign already has a verified login. 
     */
    public void register(Session s) throws LoginException {
        synchronized (_lock) {
            if (s.kind() == Session.Kind.CLIENT && s.isVerified() && hasLogin(s.getName()))
                throw new LoginException(LoginException.Reason.DUPLICATE, 
                    "Userid '"+s.getName()+"' already logged in");
            _sessions.put(s.getId(), s);
        }
        log.debug("Router", "Registered "+s.kind()+" session: "+s);
    }
    
    
    public void unregister(Session s) {
        synchronized (_lock) {
            if (_sessions.remove(s.getId()) != null)
                log.debug("Router", "Unregistered "+s.kind()+" session: "+s);
        }
    }
    
    
    /**
     * Return true if there is a verified client login with the given callsign.
     */
    public boolean hasLogin(String call) {
        for (Session s : _sessions.values())
            if (s.kind() == Session.Kind.CLIENT && s.isVerified() && s.getName().equals(call))
                return true;
        return false;
    }
    
    
    public List<Session> getSessions(Session.Kind kind) {
        List<Session> res = new ArrayList<Session>();
        for (Session s : _sessions.values())
            if (s.kind() == kind)
                res.add(s);
        res.sort(Comparator.comparingLong(Session::getId));
        return res;
    }
    
    
    public List<Session.Info> getClientInfo() {
        return getSessions(Session.Kind.CLIENT).stream().map(Session::getInfo).toList();
    }
    
    
    
    /**
     * Process a packet from a session (or from this server if origin is null). 
     * @return number of sessions the packet was queued for. 
     */
    public int dispatch(AprsPacket p, Session origin) 
    {
        synchronized (_lock) {
            _received++;
            _rate.inc();
            String fromPeer = (origin != null && origin.kind() == Session.Kind.PEER 
                ? origin.getServerId() : null);
            
            if (ServerMarker.isLoop(p, _mycall, fromPeer)) {
                _loops++;
                log.debug("Router", "Loop detected, dropped: "+p);
                return 0;
            }
            if (_dup.checkPacket(p)) {
                _duplicates++;
                return 0;
            }
            
            boolean toPeers = (origin == null || origin.canReachPeers());
            boolean toUplink = (origin != null && origin.kind() == Session.Kind.CLIENT && origin.isVerified());
            String qcode = (origin != null && origin.kind() == Session.Kind.CLIENT 
                ? ServerMarker.QAC : ServerMarker.QAS);
            String line = p.toString();
            String peerline = null;
            boolean marked = false; 
            int n = 0;
            
            for (Session s : _sessions.values()) {
                if (s == origin || s.isClosed())
                    continue;
                switch (s.kind()) {
                    case CLIENT -> {
                        if (!s.wants(p))
                            _filtered++;
                        else if (s.enqueue(line))
                            n++;
                    }
                    case PEER -> {
                        if (!toPeers || !s.wants(p) || ServerMarker.hasMarker(p, s.getServerId()))
                            continue;
                        if (!marked) {
                            AprsPacket mp = ServerMarker.mark(p, _mycall, qcode, _maxPath);
                            peerline = (mp == null ? null : mp.toString());
                            marked = true;
                            if (mp == null) {
                                _toolong++;
                                log.debug("Router", "Path too long for peers, not forwarded: "+p);
                            }
                        }
                        if (peerline != null && s.enqueue(peerline))
                            n++;
                    }
                    case UPLINK -> {
                        if (toUplink && s.wants(p) && s.enqueue(line))
                            n++;
                    }
                }
            }
            _delivered += n;
            return n;
        }
    }
    
    
    
    public Status getStatus() {
        List<PeerDescriptor.Info> pinfo = (_peers == null ? List.of() : _peers.getPeerInfo());
        int npeers = (int) pinfo.stream().filter(x -> x.state() == PeerDescriptor.State.CONNECTED).count();
        synchronized (_lock) {
            return new Status(_mycall, _conf.getSoftware()+" "+_conf.getVersion(), _started, 
                getSessions(Session.Kind.CLIENT).size(), npeers, _dup.size(), _rate.rate(), 
                _received, _delivered, _duplicates, _loops, _filtered, _toolong, getClientInfo(), pinfo);
        }
    }
    
    
    public long nReceived() 
        { synchronized(_lock) { return _received; } }
        
    public long nDuplicates() 
        { synchronized(_lock) { return _duplicates; } }
        
    public long nLoops() 
        { synchronized(_lock) { return _loops; } }
    
    public int dedupSize() 
        { return _dup.size(); }
}
