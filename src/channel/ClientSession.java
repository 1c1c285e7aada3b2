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
import java.util.*;
import java.util.regex.*;


/** 
 * APRS-IS client session. 
 * Typically igate or end-user. 
 */
public class ClientSession extends Session 
{
    private String  _userid = "NOCALL";
    private String  _software;
    private boolean _verified = false;
    private boolean _readonlyLocal;
    private volatile AprsFilter.Combined _filter;
    
    
    public ClientSession(ServerConfig conf, Router router, Socket conn) 
    {
        super(conf, router, conn);
        _readonlyLocal = conf.getBoolProperty("client.readonly.local", false);
    }
    
    
    @Override public Kind kind() 
        { return Kind.CLIENT; }
    
    @Override public String getName() 
        { return _userid; }
        
    @Override public boolean isVerified() 
        { return _verified; }
        
    @Override public String getSoftware() 
        { return _software; }
        
    @Override public String getFilter() 
        { var f = _filter; return (f == null ? null : f.getSpec()); }
    
    
    @Override public boolean wants(AprsPacket p) {
        var f = _filter;
        return f != null && f.test(p);
    }
    
    
    /* Packets from read-only clients are kept local */
    @Override public boolean canReachPeers() 
        { return _verified; }
    
    
    @Override protected String heartbeat() 
        { return "# "+_conf.getSoftware()+" "+_conf.getVersion()+" "+_router.getMycall(); }
    
    @Override protected long heartbeatInterval() 
        { return _conf.getIntProperty("client.heartbeat", 20) * 1000L; }
        
        
        
    /**
     * Set the filter from a filter expression. 
     */
    public void setFilter(String spec) {
        _filter = AprsFilter.createFilter(spec, log);
        log.debug("ClientSession", "Filter for "+_userid+": "+_filter);
    }
    
    
    
    /**
     * Return true if call matches a comma separated list of callsign patterns 
     * (with wildcards). 
     */
    protected static boolean matchList(String list, String call) {
        if (list == null || list.isBlank())
            return false;
        for (String x : list.split(",")) {
            String pat = x.trim().toUpperCase();
            if (pat.isEmpty())
                continue;
            String rx = Pattern.quote(pat).replace("*", "\\E.*\\Q").replace("?", "\\E.\\Q");
            if (call.matches(rx))
                return true;
        }
        return false;
    }
    
    
    
    /**
     * Check a callsign against the allow and deny lists. 
     */
    protected void checkAccess(String call) throws LoginException {
        String allow = _conf.getProperty("client.allow", "");
        String deny = _conf.getProperty("client.deny", "");
        if (matchList(deny, call) || (!allow.isBlank() && !matchList(allow, call)))
            throw new LoginException(LoginException.Reason.DENIED, "Access denied for "+call);
    }
    
    
    
    /**
     * User login with passcode and filter command. 
     * Comment lines and empty lines are ignored while waiting for the login line. 
     */
    protected void getLogin() throws IOException {
        long timeout = _conf.getIntProperty("client.logintimeout", 30) * 1000L;
        long deadline = System.currentTimeMillis() + timeout;
        _lstate = LoginState.AWAITING_LOGIN;
        
        String line;
        while (true) {
            long left = deadline - System.currentTimeMillis();
            if (left <= 0)
                throw new LoginException(LoginException.Reason.TIMEOUT, "Login timeout");
            try {
                line = readLine((int) left);
            }
            catch (SocketTimeoutException e) {
                throw new LoginException(LoginException.Reason.TIMEOUT, "Login timeout");
            }
            if (line == null)
                throw new EOFException("Connection closed before login");
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) 
                continue;
            break;
        }
        
        LoginLine login = LoginLine.parse(line);
        _userid = login.user();
        _software = login.softwareString();
        checkAccess(_userid);
        if (!login.isReadOnly()) {
            Passcode.check(_userid, login.pass());
            _verified = true;
        }
        String filt = login.filter();
        setFilter(filt != null && !filt.isEmpty() ? filt : _conf.getProperty("client.defaultfilt", "*"));
        
        _lstate = LoginState.AUTHENTICATED;
        _router.register(this);
        writeLine("# logresp "+_userid+ (_verified ? " verified" : " unverified" ) 
            + ", server " + _router.getMycall());
        log.info("ClientSession", "User "+_userid+" logged in from "+_ipaddr
            + (_verified ? " (verified)" : " (unverified)")
            + (_software == null ? "" : ", software: "+_software));
    }
    
    
    
    /**
     * Server commands from client. 
     */
    protected void processCommand(String cmd) throws IOException {
        String[] x = cmd.trim().split("\\s+", 2);
        if (x[0].equalsIgnoreCase("filter")) {
            if (x.length > 1) {
                setFilter(x[1]);
                enqueue("# filter "+getFilter()+" is active");
            }
            else
                enqueue("# filter "+getFilter());
        }
        else if (x[0].equalsIgnoreCase("stats")) {
            enqueue("# stats rx="+_rxpackets+" tx="+_txpackets+" dropped="+_dropped
               + " clients="+_router.getSessions(Kind.CLIENT).size()+" server "+_router.getMycall());
        }
        /* Other comments are ignored */
    }
    
    
    
    /**
     * Process incoming line. 
     */
    protected void processLine(String line) throws IOException {
        if (line.isEmpty())
            return;
        if (line.charAt(0) == '#') {
            processCommand(line.substring(1));
            return;
        }
        if (!_verified && !_readonlyLocal) {
            log.debug("ClientSession", "Packet from unverified client "+_userid+" dropped");
            return;
        }
        handlePacketLine(line);
    }
    
    
    
    /* Main thread. Get incoming packets and commands from connected client. */
    public void run() {
        try {
            log.info("ClientSession", "Incoming connection from: "+_ipaddr);
            open();
            _conn.setKeepAlive(true);
            writeLine("# "+_conf.getSoftware()+" "+_conf.getVersion());
            getLogin();
            startWriter();
            
            int idle = _conf.getIntProperty("client.idletimeout", 0) * 1000;
            while (!isClosed()) {
                String inp;
                try {
                    inp = readLine(idle);
                }
                catch (SocketTimeoutException e) {
                    log.info("ClientSession", "Idle timeout: "+this);
                    break;
                }
                if (inp == null)
                    break;
                processLine(inp);
            }
        }
        catch (LoginException e) {
            log.info("ClientSession", "Login failed ("+_ipaddr+"): "+e.getMessage());
            try {
                writeLine("# "+e.getMessage());
            }
            catch (IOException ex) {
                log.debug("ClientSession", "Cannot send diagnostic to "+_ipaddr+": "+ex.getMessage());
            }
            close(e);
        }
        catch (IOException ex) {
            if (!isClosed())
                log.info("ClientSession", "Connection ("+_ipaddr+"): "+ex.getMessage());
        }
        finally {
            close();
            log.info("ClientSession", "Connection closed: "+this);
        }
    }
}
