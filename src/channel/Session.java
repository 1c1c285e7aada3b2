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
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;


/**
 * A connection to a client, a peer server or an uplink server. 
 * 
 * The session owns its socket and a bounded outbound queue which is drained by a 
 * writer thread. Packets are put on the queue by the router. If the queue is full the 
 * session is disconnected (slow consumer). When the queue is idle for a while, a 
 * heartbeat line is written. 
 *
 * Closing a session removes it from the router before the socket is closed. 
 * close() can be called any number of times from any thread.
 */
public abstract class Session implements Runnable 
{
    public enum Kind { CLIENT, PEER, UPLINK }
    
    public enum LoginState { UNAUTHENTICATED, AWAITING_LOGIN, AUTHENTICATED, CLOSED }
    
    
    public static record Info 
       ( long id, Kind kind, String name, String addr, String software, LoginState state, 
         boolean verified, String filter, Date created, 
         long rxpackets, long txpackets, long rxbytes, long txbytes, long dropped )
    {}
    
    
    private static final AtomicLong _nextId = new AtomicLong(1);
    
    protected final ServerConfig _conf;
    protected final Router       _router;
    protected final Logfile      log;
    protected final Socket       _conn;
    protected final String       _ipaddr;
    protected final Date         _created = new Date();
    protected BufferedReader     _reader;
    protected volatile LoginState _lstate = LoginState.UNAUTHENTICATED;
    protected volatile long      _rxpackets, _txpackets, _rxbytes, _txbytes, _dropped;
    
    private final long _id;
    private final BlockingQueue<String> _queue;
    private final AtomicBoolean _closed = new AtomicBoolean(false);
    private final Object _wlock = new Object();
    private final int _maxBad;
    private int _bad;
    private Writer _writer;
    private volatile Thread _wthread;
    private volatile Exception _closeCause;
    private final StringBuilder _line = new StringBuilder();  // Partial input line
    private boolean _skipLF;
    
    
    
    protected Session(ServerConfig conf, Router router, Socket conn) 
    {
        _conf = conf;
        _router = router;
        _conn = conn;
        log = conf.log();
        _id = _nextId.getAndIncrement();
        _ipaddr = (conn == null || conn.getInetAddress() == null 
            ? "-" : conn.getInetAddress().getHostAddress());
        _queue = new ArrayBlockingQueue<String>(conf.getIntProperty("session.queuesize", 500));
        _maxBad = conf.getIntProperty("session.maxbadpackets", 50);
    }
    
    
    public abstract Kind kind(); 
    
    /** Callsign or server identity. */
    public abstract String getName(); 
    
    /** Heartbeat line to be written when outbound queue is idle. Null if none. */
    protected abstract String heartbeat();
    
    /** Heartbeat interval in milliseconds. 0 means no heartbeat. */
    protected abstract long heartbeatInterval();
    
    
    
    /** Return true if this session wants to receive the packet (filter). */
    public boolean wants(AprsPacket p) 
        { return true; }
        
    /** Return true if packets originating from this session may be sent to peers. */
    public boolean canReachPeers() 
        { return true; }
        
    /** Identity of remote server, if any. */
    public String getServerId() 
        { return null; }
        
    public boolean isVerified() 
        { return false; }
        
    public String getSoftware() 
        { return null; }
        
    public String getFilter() 
        { return null; }
    
    
    public final long getId() 
        { return _id; }
        
    public LoginState getLoginState() 
        { return _lstate; }
        
    public boolean isClosed() 
        { return _closed.get(); }
        
    public Exception getCloseCause() 
        { return _closeCause; }
        
    public int queueSize()
        { return _queue.size(); }
    
    public String getAddr() 
        { return _ipaddr; }
    
        
    public Info getInfo() {
        return new Info(_id, kind(), getName(), _ipaddr, getSoftware(), _lstate, 
           isVerified(), getFilter(), _created, _rxpackets, _txpackets, _rxbytes, _txbytes, _dropped);
    }
    
    
    protected String tag() 
        { return getClass().getSimpleName(); }
    
    
    
    /**
     * Start the reader thread. 
     */
    public void start() {
        Thread t = new Thread(this, kind().toString().toLowerCase()+"-"+_id);
        t.setDaemon(true);
        t.start();
    }
    
    
    
    /**
     * Set up reader and writer on the socket. 
     */
    protected void open() throws IOException {
        _reader = new BufferedReader(
            new InputStreamReader(_conn.getInputStream(), StandardCharsets.UTF_8));
        _writer = new BufferedWriter(
            new OutputStreamWriter(_conn.getOutputStream(), StandardCharsets.UTF_8));
    }
    
    
    
    /**
     * Write a line to the connection, bypassing the queue. 
     */
    protected void writeLine(String line) throws IOException {
        synchronized (_wlock) {
            _writer.write(line);
            _writer.write("\r\n");
            _writer.flush();
        }
    }
    
    
    
    /**
     * Read a line, waiting at most the given time. A line ends with CR, LF or CR LF. 
     * At most MAX_LINE+1 characters of a line are kept, the rest is skipped. The 
     * codec rejects such lines as too long. 
     * @return the line or null if end of stream. 
     */
    protected String readLine(int timeout) throws IOException {
        _conn.setSoTimeout(timeout);
        while (true) {
            int c = _reader.read();
            if (c == -1) {
                if (_line.length() == 0)
                    return null;
                break;
            }
            if (_skipLF) {
                _skipLF = false;
                if (c == '\n')
                    continue;
            }
            if (c == '\r') {
                _skipLF = true;
                break;
            }
            if (c == '\n')
                break;
            if (_line.length() <= AprsPacket.MAX_LINE)
                _line.append((char) c);
        }
        String res = _line.toString();
        _line.setLength(0);
        return res;
    }
    
    
    
    /**
     * Start writer thread. To be called when the session is authenticated. 
     */
    protected void startWriter() {
        Thread t = new Thread(this::writeLoop, "writer-"+_id);
        t.setDaemon(true);
        _wthread = t; 
        t.start();
    }
    
    
    
    /**
     * Put a line on the outbound queue. If the queue is full the session is closed. 
     * @return true if queued. 
     */
    public boolean enqueue(String line) {
        if (isClosed())
            return false;
        if (_queue.offer(line))
            return true;
        _dropped++;
        var e = new QueueOverflowException("Outbound queue full ("+_queue.size()+" lines)");
        log.warn(tag(), "Slow consumer "+this+": "+e.getMessage()+" - disconnecting");
        close(e);
        return false;
    }
    
    
    
    private void writeLoop() {
        try {
            while (!isClosed()) {
                long hb = heartbeatInterval();
                String line = (hb > 0 ? _queue.poll(hb, TimeUnit.MILLISECONDS) : _queue.take());
                if (isClosed())
                    break;
                if (line == null) {
                    String hbline = heartbeat();
                    if (hbline != null)
                        writeLine(hbline);
                    continue;
                }
                writeLine(line);
                _txpackets++;
                _txbytes += line.length() + 2;
            }
        }
        catch (InterruptedException e) {
            /* Interrupted by close() */
            Thread.currentThread().interrupt();
        }
        catch (IOException e) {
            if (!isClosed()) {
                log.info(tag(), "Write failed "+this+": "+e.getMessage());
                close(e);
            }
        }
    }
    
    
    
    /**
     * Parse a packet line and hand it to the router. Invalid packets are dropped. 
     * Too many invalid packets in a row closes the session. 
     */
    protected void handlePacketLine(String line) {
        _rxpackets++;
        _rxbytes += line.length() + 2;
        try {
            AprsPacket p = AprsPacket.fromString(line, _router.getMaxPath());
            _bad = 0;
            _router.dispatch(p, this);
        }
        catch (PacketException e) {
            _bad++;
            log.debug(tag(), "Dropped line from "+this+": "+e.getMessage());
            if (_bad > _maxBad) {
                log.warn(tag(), "Too many invalid packets from "+this+" - disconnecting");
                close();
            }
        }
    }
    
    
    
    public void close() 
        { close(null); }
    
    
    /**
     * Close the session. Unregister from router first, then close the socket. 
     */
    public void close(Exception cause) {
        if (!_closed.compareAndSet(false, true))
            return;
        if (cause != null)
            _closeCause = cause;
        _lstate = LoginState.CLOSED;
        _router.unregister(this);
        _queue.clear();
        try {
            if (_conn != null)
                _conn.close();
        }
        catch (IOException e) {
            log.debug(tag(), "Error when closing "+this+": "+e.getMessage());
        }
        Thread wt = _wthread;
        if (wt != null)
            wt.interrupt();
    }
    
    
    public String toString() {
        return getName()+"@"+_ipaddr;
    }
}
