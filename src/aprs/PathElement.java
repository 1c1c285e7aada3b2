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


/**
 * Element of the path (via) part of a packet. 
 *  HOP        - digipeater or alias, optionally with the "used" flag ('*'). 
 *  QCONSTRUCT - q-construct inserted by APRS-IS servers, e.g. qAC. 
 *  SERVER     - identity of a server or igate. Any element following a q-construct. 
 */
public record PathElement(String ident, boolean used, Kind kind) 
{
    public enum Kind { HOP, QCONSTRUCT, SERVER }
    
    
    public static PathElement hop(StationId id, boolean used) 
        { return new PathElement(id.toString(), used, Kind.HOP); }
        
    public static PathElement qconstruct(String q) 
        { return new PathElement(q, false, Kind.QCONSTRUCT); }
        
    public static PathElement server(String id) 
        { return new PathElement(id, false, Kind.SERVER); }
        
        
    public boolean isMarker() 
        { return kind != Kind.HOP; }
    
    
    @Override public String toString() {
        return (used ? ident+"*" : ident);
    }
}
