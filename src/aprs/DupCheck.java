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
 
package no.polaric.aprsis.aprs;
import java.util.*;
import java.util.function.LongSupplier;



/**
 * Duplicate checking. 
 * Remembers the fingerprints of packets seen within a time window (TTL). Entries 
 * are kept in insertion order, which is also the order of first-seen time, so expired 
 * entries are always at the head. The number of entries is bounded; if full, the 
 * eldest entry is evicted. 
 */
public class DupCheck 
{
     public static final long DEFAULT_TTL = 1000 * 30; /* 30 seconds */
     public static final int DEFAULT_MAXSIZE = 75000;
     
     private final long _ttl;
     private final int _maxSize;
     private final LongSupplier _clock;
     private final LinkedHashMap<Fingerprint, Long> _realtime;
     private long _evicted;
     
     
     public DupCheck(long ttl, int maxSize, LongSupplier clock) {
         _ttl = ttl;
         _maxSize = maxSize;
         _clock = clock;
         _realtime = new LinkedHashMap<Fingerprint, Long>() {
             protected boolean removeEldestEntry(Map.Entry<Fingerprint, Long> e) { 
                 if (size() > _maxSize) {
                     _evicted++;
                     return true;
                 }
                 return false;
             }
         };
     }
     
     
     public DupCheck(long ttl, int maxSize) 
        { this(ttl, maxSize, System::currentTimeMillis); }
        
        
     public DupCheck() 
        { this(DEFAULT_TTL, DEFAULT_MAXSIZE); }
        
     
     
     /**
      * Remove entries older than the TTL. 
      * @return number of entries removed. 
      */
     public synchronized int removeOldEntries()
     {
          Iterator<Long> it = _realtime.values().iterator();
          long now = _clock.getAsLong();
          int n = 0;
          while (it.hasNext()) {
              long x = it.next();
              if (now >= x + _ttl) {
                 it.remove();
                 n++;
              }
              else
                 break;
          }
          return n;
     } 
     
     
     
     /**
      * Returns true if packet is a duplicate. If not, it is registered as seen. 
      */
     public synchronized boolean checkPacket(AprsPacket p) 
        { return checkFingerprint(p.fingerprint()); }
     
     
     
     /**
      * Returns true if fingerprint is seen within the TTL. If not, it is registered 
      * with the current time. The first-seen time is not refreshed by duplicates. 
      */
     public synchronized boolean checkFingerprint(Fingerprint fp)
     {
         removeOldEntries();
         if (_realtime.containsKey(fp))
             return true; 
         _realtime.put(fp, _clock.getAsLong());
         return false;
     } 
     
     
     public synchronized boolean contains(Fingerprint fp) {
         Long t = _realtime.get(fp);
         return t != null && _clock.getAsLong() < t + _ttl;
     }
     
     
     public synchronized int size() 
        { return _realtime.size(); }
        
     public synchronized long nEvicted() 
        { return _evicted; }
     
     public long getTtl() 
        { return _ttl; }
}
