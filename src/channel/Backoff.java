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


/**
 * Reconnect delay. Starts at the minimum, doubles for each failure up to the 
 * maximum, and is reset after a link has been up for at least the stable period. 
 */
public class Backoff 
{
    private final long _min, _max, _stable;
    private long _next;
    
    
    /**
     * @param min Initial delay (ms). 
     * @param max Max delay (ms). 
     * @param stable A link that has been up this long (ms) resets the delay. 
     */
    public Backoff(long min, long max, long stable) {
        if (min <= 0 || max < min)
            throw new IllegalArgumentException("Invalid backoff interval: "+min+"-"+max);
        _min = min;
        _max = max;
        _stable = stable;
        _next = min;
    }
    
    
    /** Get the delay to use now and double the next one. */
    public synchronized long nextDelay() {
        long d = _next;
        _next = Math.min(_next * 2, _max);
        return d;
    }
    
    
    /** Report that a link was up for the given time (ms). */
    public synchronized void connected(long duration) {
        if (duration >= _stable)
            _next = _min;
    }
    
    
    public synchronized void reset() 
        { _next = _min; }
    
    public synchronized long peek() 
        { return _next; }
    
    public long getMin() 
        { return _min; }
        
    public long getMax() 
        { return _max; }
}
