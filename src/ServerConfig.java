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
 * Server config interface. 
 */
public interface ServerConfig
{
    /** Get software name. */
    public String getSoftware();
    
    /** Get software version. */
    public String getVersion();
    
    /** Identity of this server. Used in logins and as marker in packet paths. */
    public String getMycall();
    
    /** Configured S2S peers. */
    public List<PeerConfig> getPeers();
    
    public Properties config();
    
    public Logfile log();
    
    public String getProperty(String pname, String dvalue);
    
    public int getIntProperty(String pname, int dvalue);
    
    public boolean getBoolProperty(String pname, boolean dvalue);
}
