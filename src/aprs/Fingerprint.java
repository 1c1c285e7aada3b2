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
 * Identity of a packet for duplicate detection. Source, destination and report. 
 * The path is not part of it since the same packet may arrive along different paths. 
 */
public record Fingerprint(StationId from, StationId to, String report) 
{
    public static Fingerprint of(AprsPacket p) {
        return new Fingerprint(p.from, p.to, p.report);
    }
}
