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
 *  APRS packet in TNC2 text format: SOURCE>DEST,PATH:PAYLOAD. 
 *  Instances are immutable. The payload (report) is not interpreted. 
 */ 
public class AprsPacket {

    /* APRS-IS lines are at most 512 bytes including CR LF */
    public static final int MAX_LINE = 510;
    public static final int DEFAULT_MAX_PATH = 12;
    
    private static final Pattern _ppat = Pattern.compile
       ("([^>:,]+)>([^>:,]+)((?:,[^>:,]*)*):(.*)", Pattern.DOTALL);
       
       
    /* Receipt time is assigned locally. It is not part of the wire format 
     * and not part of equality. 
     */
    public final Date time; 
    public final StationId from, to;
    public final List<PathElement> via; 
    public final String report;
    
    
    
    public AprsPacket(StationId from, StationId to, List<PathElement> via, String report, Date time) 
    {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        this.via = List.copyOf(via);
        this.report = Objects.requireNonNull(report);
        this.time = time;
    }
    
    
    public AprsPacket(StationId from, StationId to, List<PathElement> via, String report) 
       { this(from, to, via, report, new Date()); }
    
    
    
    /**
     * Return a copy of this packet with another path. 
     */
    public AprsPacket withVia(List<PathElement> v) 
       { return new AprsPacket(from, to, v, report, time); }
    
    
    
    /**
     * Convert text string to packet structure. 
     */
    public static AprsPacket fromString(String packet) throws PacketException 
       { return fromString(packet, DEFAULT_MAX_PATH); }
    
    
     
    /**
     * Convert text string to packet structure. 
     * Trailing CR/LF is removed, and callsigns are converted to upper case. 
     * @param packet Text line. 
     * @param maxPath Max number of path elements.  
     */
    public static AprsPacket fromString(String packet, int maxPath) throws PacketException
    {
        if (packet == null)
            throw new MalformedPacketException("Empty line");
        int end = packet.length();
        while (end > 0 && (packet.charAt(end-1) == '\n' || packet.charAt(end-1) == '\r'))
            end--;
        packet = packet.substring(0, end);
        
        if (packet.length() > MAX_LINE)
            throw new MalformedPacketException("Line too long: "+packet.length());
        Matcher m = _ppat.matcher(packet);
        if (!m.matches())
            throw new MalformedPacketException("Cannot parse header");
        if (m.group(4).isEmpty())
            throw new MalformedPacketException("Empty payload");
            
        StationId from = StationId.parse(m.group(1));
        StationId to = StationId.parse(m.group(2));
        
        List<PathElement> via = new ArrayList<PathElement>();
        String path = m.group(3);
        if (path.length() > 0) {
            /* Skip first comma in path */
            String[] elems = path.substring(1).split(",", -1);
            if (elems.length > maxPath)
                throw new PathTooLongException(elems.length, maxPath);
            boolean afterQ = false; 
            for (String e : elems) {
                PathElement pe = parseElement(e, afterQ);
                if (pe.kind() == PathElement.Kind.QCONSTRUCT)
                    afterQ = true;
                via.add(pe);
            }
        }
        return new AprsPacket(from, to, via, m.group(4));
    }
    
    
    
    private static PathElement parseElement(String e, boolean afterQ) throws PacketException
    {
        if (e.isEmpty())
            throw new MalformedPacketException("Empty path element");
        if (ServerMarker.isQConstruct(e))
            return PathElement.qconstruct(e);
        if (afterQ) {
            String id = e.toUpperCase();
            if (!ServerMarker.isServerId(id))
                throw new InvalidCallsignException(e);
            return PathElement.server(id);
        }
        boolean used = e.endsWith("*");
        String call = (used ? e.substring(0, e.length()-1) : e);
        return PathElement.hop(StationId.parse(call), used);
    }

    
    
    /**
     * Get the APRS data type identifier (first character of the report). 
     */
    public char type() {
        return report.charAt(0);
    }
    
    
    
    /**
     * Addressee of a message packet. Null if this is not a message. 
     */
    public String msgTo() {
        if (type() != ':' || report.length() < 10)
            return null;
        String to = report.substring(1,10).trim();
        if (to.length() > 0 && to.charAt(to.length()-1) == ':')
            to = to.substring(0, to.length()-1);
        return to;
    }
    
    
    
    /**
     * Name of object or item. Object names are the fixed 9 characters after ';'. 
     * Item names are 3-9 characters after ')', ended by '!' or '_'. 
     * @return the name or null if this is not an object or item report. 
     */
    public String objectName() {
        if (type() == ';')
            return (report.length() < 10 ? null : report.substring(1,10).trim());
        if (type() != ')')
            return null;
        String msg = report.substring(1);
        int i = msg.indexOf('!');
        if (i == -1 || i > 9)
            i = msg.indexOf('_');
        if (i < 1 || i > 9)
            return null;
        return msg.substring(0, i).trim();
    }
    
    
    
    public Fingerprint fingerprint() {
        return Fingerprint.of(this);
    }
    
    
    
    @Override public boolean equals(Object o) {
        if (this == o) 
            return true;
        if (!(o instanceof AprsPacket p))
            return false;
        return from.equals(p.from) && to.equals(p.to) 
            && via.equals(p.via) && report.equals(p.report);
    }
    
    
    @Override public int hashCode() {
        return Objects.hash(from, to, via, report);
    }
    
    
    
    public String toString() {  
        StringBuilder sb = new StringBuilder();
        sb.append(from).append('>').append(to);
        for (PathElement e : via)
            sb.append(',').append(e);
        return sb.append(':').append(report).toString();
    }
}
