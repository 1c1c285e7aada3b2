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
import no.polaric.aprsis.aprs.*;
import java.util.*;
import java.io.*;



/**
 * Server configuration from a properties file. 
 *
 * S2S peers are given as a list of keys, each with a set of properties: 
 * <pre>
 *   s2s.peers = peer1, peer2
 *   s2s.peer.peer1.host = peer1.example.net
 *   s2s.peer.peer1.port = 14579
 *   s2s.peer.peer1.passcode = 12345
 *   s2s.peer.peer1.name = T2PEER1
 *   s2s.peer.peer1.receiveonly = false
 * </pre>
 */
public class PropertyConfig implements ServerConfig
{
    public static final String SOFTWARE = "Polaric-APRSIS";
    public static final String VERSION = "1.0";
    
    private final Properties _config; 
    private final Logfile _log;
    private String _mycall;
    private List<PeerConfig> _peers; 
    
    
    public PropertyConfig(Properties props) {
        _config = props;
        _log = new Logfile(this);
    }
    
    
    /**
     * Load configuration from file. 
     */
    public static PropertyConfig load(String file) throws IOException {
        Properties props = new Properties();
        try (FileInputStream fin = new FileInputStream(file)) {
            props.load(fin);
        }
        return new PropertyConfig(props);
    }
    
    
    public String getSoftware()
        { return SOFTWARE; }
        
    public String getVersion()
        { return VERSION; }
    
    public Properties config()
        { return _config; }
        
    public Logfile log()
        { return _log; }
        
        
    public String getProperty(String pname, String dvalue)
     { String x = _config.getProperty(pname, dvalue); 
       return (x == null ? x : x.trim()); }
   
    public boolean getBoolProperty(String pname, boolean dvalue)
     { return _config.getProperty(pname, (dvalue  ? "true" : "false"))
                 .trim().matches("TRUE|true|YES|yes"); } 
                 
    public int getIntProperty(String pname, int dvalue)
     {  return Integer.parseInt(_config.getProperty(pname, ""+dvalue).trim()); }
     
     
     
    /**
     * Identity of this server (default.mycall). 
     * @throws IllegalArgumentException if it is not a valid server identity.
     */
    public synchronized String getMycall() {
        if (_mycall == null)
            _mycall = ServerMarker.serverId(getProperty("default.mycall", "NOCALL"));
        return _mycall;
    }
    
    
    
    /**
     * Get the peer table. Built once. Invalid entries are logged and skipped. 
     */
    public synchronized List<PeerConfig> getPeers() {
        if (_peers != null)
            return _peers;
        List<PeerConfig> peers = new ArrayList<PeerConfig>();
        String plist = getProperty("s2s.peers", "");
        for (String id : plist.split(",(\\s)*")) {
            if (id.trim().length() == 0)
                continue;
            String pfx = "s2s.peer."+id.trim();
            try {
                String host = getProperty(pfx+".host", "");
                if (host.length() == 0)
                    throw new IllegalArgumentException("host is missing");
                String name = getProperty(pfx+".name", null);
                if (name != null)
                    name = ServerMarker.serverId(name);
                peers.add(new PeerConfig(id.trim(), host, 
                    getIntProperty(pfx+".port", 14579),
                    Integer.parseInt(getProperty(pfx+".passcode", "")),
                    name,
                    getBoolProperty(pfx+".receiveonly", false),
                    getBoolProperty(pfx+".passive", false)));
            }
            catch (IllegalArgumentException e) {
                _log.warn("Config", "Invalid config for peer '"+id+"': "+e.getMessage()+" - ignored");
            }
        }
        _peers = Collections.unmodifiableList(peers);
        return _peers;
    }
}
