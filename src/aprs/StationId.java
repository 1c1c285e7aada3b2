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
import java.util.regex.*;


/**
 * Station identifier. A callsign (1-6 letters/digits) with an optional SSID (0-15). 
 * Case is normalized to upper case and SSID 0 is written without suffix. 
 */
public record StationId(String call, int ssid) 
{
    private static final Pattern _idpat = Pattern.compile("([A-Z0-9]{1,6})(?:-([0-9]{1,2}))?");
    
    
    public StationId {
        if (call == null || !call.matches("[A-Z0-9]{1,6}"))
            throw new IllegalArgumentException("Invalid callsign: "+call);
        if (ssid < 0 || ssid > 15)
            throw new IllegalArgumentException("Invalid SSID: "+ssid);
    }
    
    
    /**
     * Parse a station identifier. 
     */
    public static StationId parse(String id) throws InvalidCallsignException 
    {
        if (id == null)
            throw new InvalidCallsignException("");
        Matcher m = _idpat.matcher(id.toUpperCase());
        if (!m.matches())
            throw new InvalidCallsignException(id);
        int ssid = (m.group(2) == null ? 0 : Integer.parseInt(m.group(2)));
        if (ssid > 15)
            throw new InvalidCallsignException(id);
        return new StationId(m.group(1), ssid);
    }
    
    
    public static boolean isValid(String id) {
        try {
            parse(id);
            return true;
        }
        catch (InvalidCallsignException e) {
            return false;
        }
    }
    
    
    @Override public String toString() {
        return (ssid == 0 ? call : call+"-"+ssid);
    }
}
