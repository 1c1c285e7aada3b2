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
import no.polaric.aprsis.channel.LoginException;


/**
 * APRS-IS passcode. 
 * A passcode is a simple 15 bit hash of the callsign (without the SSID) 
 * given as a decimal number. -1 means that no verification is requested 
 * and gives receive-only access. 
 */
public final class Passcode 
{
    public static final int READONLY = -1;
    
    
    private Passcode() {}
    
    
    /**
     * Compute the passcode for a callsign. 
     */
    public static int compute(String call) {
        String c = call.toUpperCase().split("-")[0];
        int hash = 0x73e2; 
        int len = c.length(); 
        c += "\0";

        // hash callsign two bytes at a time 
        for (int i=0; i<len; i+= 2) { 
            hash ^= c.charAt(i) << 8; 
            hash ^= c.charAt(i+1); 
        } 
        return hash & 0x7fff; 
    }
    
    
    /**
     * Return true if passcode is the read-only sentinel or matches the callsign. 
     */
    public static boolean verify(String call, int pass) {
        return pass == READONLY || pass == compute(call);
    }
    
    
    /**
     * Like verify but throws an exception if verification fails. 
     */
    public static void check(String call, int pass) throws LoginException {
        if (!verify(call, pass))
            throw new LoginException(LoginException.Reason.AUTH_FAILED, 
                "Invalid passcode for "+call.toUpperCase());
    }
}
