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
 
package no.polaric.aprsis.util;
import java.util.function.LongSupplier;


/**
 * Event rate over a sliding time window, with one second resolution. 
 */
public class RateCounter 
{
    private final long[] _buckets;
    private final LongSupplier _clock;
    private long _last;  // Second of last update
    
    
    public RateCounter(int windowSecs, LongSupplier clock) {
        _buckets = new long[windowSecs];
        _clock = clock;
        _last = clock.getAsLong() / 1000;
    }
    
    
    public RateCounter(int windowSecs) 
        { this(windowSecs, System::currentTimeMillis); }
    
    
    
    /* Clear buckets that have fallen out of the window since last update */
    private void advance() {
        long now = _clock.getAsLong() / 1000;
        long n = Math.min(now - _last, _buckets.length);
        for (long i = 1; i <= n; i++)
            _buckets[(int) ((_last + i) % _buckets.length)] = 0;
        if (now > _last)
            _last = now;
    }
    
    
    public synchronized void add(long n) {
        advance();
        _buckets[(int) (_last % _buckets.length)] += n;
    }
    
    
    public void inc() 
        { add(1); }
    
    
    /** Total number of events in the window. */
    public synchronized long count() {
        advance();
        long sum = 0;
        for (long x : _buckets)
            sum += x;
        return sum;
    }
    
    
    /** Events per second, averaged over the window. */
    public double rate() 
        { return (double) count() / _buckets.length; }
}
