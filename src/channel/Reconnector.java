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


/**
 * Keeps an outbound connection up. Connects, runs the link until it ends and 
 * then waits according to a Backoff policy before connecting again. 
 */
public abstract class Reconnector implements Runnable
{
    /** Sleep hook. Tests can replace it to record the delays. */
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
    
    
    protected final ServerConfig _conf;
    protected final String _name;
    protected final Backoff _backoff;
    private Sleeper _sleeper = Thread::sleep;
    private Thread _thread;
    private volatile boolean _running;
    
    
    protected Reconnector(ServerConfig conf, String name, Backoff backoff) {
        _conf = conf;
        _name = name;
        _backoff = backoff;
    }
    
    
    /**
     * Connect and run the link until it ends. 
     * @return Time (ms) the link was up. 0 if it never came up. 
     * @throws IOException if the link could not be established. 
     */
    protected abstract long connect() throws IOException;
    
    
    /** Return false if no attempt should be made now. */
    protected boolean canConnect() 
        { return true; }
    
    /** Called when a connection attempt fails. */
    protected void failed(IOException e) 
        {}
    
    /** Called before waiting for the given time. */
    protected void waiting(long delay) 
        {}
    
    
    public void setSleeper(Sleeper s) 
        { _sleeper = s; }
        
    public Backoff getBackoff() 
        { return _backoff; }
        
    public boolean isRunning() 
        { return _running; }
    
    
    
    public synchronized void activate() {
        _running = true;
        _thread = new Thread(this, "connect-"+_name);
        _thread.setDaemon(true);
        _thread.start();
    }
    
    
    public synchronized void deActivate() {
        _running = false;
        if (_thread != null)
            _thread.interrupt();
    }
    
    
    
    /**
     * Main thread - connect, and reconnect when the link is lost or cannot be established.
     */
    public void run()
    {
        try {
            while (_running) {
                if (!canConnect()) {
                    _sleeper.sleep(_backoff.getMin());
                    continue;
                }
                try {
                    _backoff.connected(connect());
                }
                catch (IOException e) {
                    failed(e);
                }
                if (!_running)
                    break;
                long delay = _backoff.nextDelay();
                waiting(delay);
                _sleeper.sleep(delay);
            }
        }
        catch (InterruptedException e) {
            _conf.log().debug("Reconnector", "Interrupted: "+_name);
            Thread.currentThread().interrupt();
        }
        _running = false;
    }
}
