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
import java.util.regex.*;


/**
 * Server markers in the path. All insertion and detection of server identities 
 * is done here, both by the router and the peer sessions. 
 *
 * The marker format follows the APRS-IS q-construct convention: A q-construct 
 * (qA + one letter) is followed by the identities of the servers the packet has 
 * passed through, in order. Digipeater hops always come before the q-construct, so 
 * a server identity is never mistaken for a digipeater. 
 * See https://www.aprs-is.net/q.aspx
 */
public final class ServerMarker 
{
    public static final String QAC = "qAC";  // From verified client connection
    public static final String QAS = "qAS";  // From server, no q-construct present
    
    private static final Pattern _qpat = Pattern.compile("qA[A-Za-z]");
    private static final Pattern _srvpat = Pattern.compile("[A-Z0-9]{1,9}(-[0-9]{1,2})?");
    
    
    private ServerMarker() {}
    
    
    public static boolean isQConstruct(String x) 
        { return x != null && _qpat.matcher(x).matches(); }
    
    
    public static boolean isServerId(String x) 
        { return x != null && _srvpat.matcher(x).matches(); }
    
        
    
    /**
     * Normalize and validate a server identity (e.g. from config or a login line). 
     * @throws IllegalArgumentException if not a valid identity. 
     */
    public static String serverId(String x) {
        String id = (x == null ? "" : x.trim().toUpperCase());
        if (!isServerId(id))
            throw new IllegalArgumentException("Invalid server identity: '"+x+"'");
        return id;
    }
    
    
    
    /**
     * Get Q-code and the entry server/igate. Null if there is no q-construct.  
     */
    public static String[] getQcode(AprsPacket p) {
        for (int i=0; i<p.via.size(); i++)
            if (p.via.get(i).kind() == PathElement.Kind.QCONSTRUCT) {
                String[] ret = new String[2];
                ret[0] = p.via.get(i).ident();
                if (i+1 < p.via.size())
                    ret[1] = p.via.get(i+1).ident();
                return ret;
            }
        return null;
    }
    
    
    
    /**
     * Server identities found in the path, in order. 
     */
    public static List<String> servers(AprsPacket p) {
        List<String> res = new ArrayList<String>();
        for (PathElement e : p.via)
            if (e.kind() == PathElement.Kind.SERVER)
                res.add(e.ident());
        return res;
    }
    
    
    
    /**
     * Return true if the packet carries the marker of the given server. 
     */
    public static boolean hasMarker(AprsPacket p, String serverId) {
        if (serverId == null)
            return false;
        for (PathElement e : p.via)
            if (e.kind() == PathElement.Kind.SERVER && e.ident().equals(serverId))
                return true;
        return false;
    }
    
    
    
    /**
     * Loop detection. A packet is a loop if it already carries the marker of this 
     * server, or if it came from peer P and P's marker is found anywhere but in 
     * the last position (P's own relay stamp). 
     * @param p The packet.
     * @param mycall Identity of this server.
     * @param fromPeer Identity of the peer the packet came from. Null if not from a peer. 
     */
    public static boolean isLoop(AprsPacket p, String mycall, String fromPeer) {
        List<String> srv = servers(p);
        if (srv.contains(mycall))
            return true;
        if (fromPeer == null)
            return false;
        int n = srv.size();
        if (n > 0 && srv.get(n-1).equals(fromPeer))
            n--;
        return srv.subList(0, n).contains(fromPeer);
    }
    
    
    
    /**
     * Append the marker of this server to the path. If there is no q-construct 
     * already, the given one is added first. 
     * @param p The packet.
     * @param mycall Identity of this server.
     * @param qcode q-construct to use if none is present.
     * @param maxPath Max number of path elements. 
     * @return Marked copy of the packet or null if the path would get too long. 
     */
    public static AprsPacket mark(AprsPacket p, String mycall, String qcode, int maxPath) {
        List<PathElement> via = new ArrayList<PathElement>(p.via);
        if (getQcode(p) == null)
            via.add(PathElement.qconstruct(qcode));
        via.add(PathElement.server(mycall));
        if (via.size() > maxPath)
            return null;
        return p.withVia(via);
    }
}
