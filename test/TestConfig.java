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
 
package no.polaric.aprsis;
import java.util.*;


/**
 * Configuration for tests. Ports are 0 (any free port) and timeouts are short. 
 */
public class TestConfig 
{
    public static Properties defaults(String mycall) {
        Properties p = new Properties();
        p.setProperty("default.mycall", mycall);
        p.setProperty("aprsis.log.level", "1");
        p.setProperty("client.ports", "0");
        p.setProperty("client.logintimeout", "2");
        p.setProperty("s2s.port", "0");
        p.setProperty("s2s.handshaketimeout", "2");
        p.setProperty("s2s.backoff.min", "1");
        p.setProperty("s2s.backoff.max", "60");
        return p;
    }
    
    
    public static PropertyConfig create(String mycall) 
        { return new PropertyConfig(defaults(mycall)); }
    
    
    public static PropertyConfig create(Properties p) 
        { return new PropertyConfig(p); }
}
