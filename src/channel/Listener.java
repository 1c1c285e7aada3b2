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
 * Listens to a TCP port and hands each incoming connection to a handler. 
 * Used both for the client ports and the S2S port. 
 */
public class Listener implements Runnable 
{
    /** Called for each accepted connection, on the listener thread. */
    public interface Handler {
        void accept(Socket conn) throws IOException;
    }
    
    
    private final ServerConfig _conf;
    private final String _name;
    private final int _portnr;
    private final Handler _handler;
    private ServerSocket _server;
    private Thread _serverthread;
    private volatile boolean _running;
    
    
    public Listener(ServerConfig conf, String name, int port, Handler h) {
        _conf = conf;
        _name = name;
        _portnr = port;
        _handler = h;
    }
    
    
    
    /**
     * Bind the port and start accepting connections. 
     * @throws IOException if the port cannot be bound. 
     */
    public synchronized void activate() throws IOException {
        _server = new ServerSocket(_portnr);
        _running = true;
        _serverthread = new Thread(this, "listener-"+_name);
        _serverthread.setDaemon(true);
        _serverthread.start();
        _conf.log().info("Listener", "Listening on port "+getPort()+" ("+_name+")");
    }
    
    
    
    /** Stop accepting connections. */
    public synchronized void deActivate() {
        if (!_running)
            return;
        _running = false;
        try {
            _server.close();
        }
        catch (IOException e) {
            _conf.log().warn("Listener", "Error when closing port "+_portnr+": "+e.getMessage());
        }
    }
    
    
    /** Local port. Useful if configured port is 0. */
    public int getPort() 
        { return (_server == null ? _portnr : _server.getLocalPort()); }
    
    
    public boolean isRunning() 
        { return _running; }
    
    
    
    public void run() {
        while (_running) {
            try {
                Socket conn = _server.accept(); 
                _handler.accept(conn);
            }
            catch (IOException ex) {
                if (_running)
                    _conf.log().warn("Listener", "Accept failed ("+_name+"): "+ex.getMessage());
            }
        }
        _conf.log().info("Listener", "Closed port "+_portnr+" ("+_name+")");
    }
}
