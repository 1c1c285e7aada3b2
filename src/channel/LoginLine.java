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
 
package no.polaric.aprsis.channel;
import no.polaric.aprsis.aprs.*;
import java.util.regex.*;


/**
 * Client login line. 
 * Format:  user mycall[-ss] pass passcode[ vers softwarename softwarevers][ filter filterspec] 
 * See http://www.aprs-is.net/connecting.aspx
 *
 * If pass is missing, the login is treated as read-only (-1). 
 */
public record LoginLine(String user, int pass, String software, String version, String filter) 
{
    private static final Pattern _filtpat = Pattern.compile("\\s(filter|FILTER)(\\s+|$)");
    
    
    /**
     * Parse a login line. 
     * @throws LoginException with reason INVALID if the line cannot be parsed. 
     */
    public static LoginLine parse(String line) throws LoginException 
    {
        if (line == null)
            throw new LoginException(LoginException.Reason.INVALID, "Empty login line");
            
        /* Get filter command if it exists */
        String filter = null;
        Matcher m = _filtpat.matcher(line);
        if (m.find()) {
            filter = line.substring(m.end()).trim();
            line = line.substring(0, m.start());
        }
        String[] x = line.trim().split("\\s+");
        if (x.length < 2 || !x[0].equalsIgnoreCase("user"))
            throw new LoginException(LoginException.Reason.INVALID, "Invalid login string");
            
        String user;
        try {
            user = StationId.parse(x[1]).toString();
        }
        catch (InvalidCallsignException e) {
            throw new LoginException(LoginException.Reason.INVALID, "Invalid callsign: "+x[1]);
        }
        
        int pass = Passcode.READONLY;
        String software = null, version = null;
        int i = 2;
        while (i < x.length) {
            String kw = x[i].toLowerCase();
            if (kw.equals("pass") && i+1 < x.length) {
                try {
                    pass = Integer.parseInt(x[i+1]);
                }
                catch (NumberFormatException e) {
                    throw new LoginException(LoginException.Reason.INVALID, "Invalid passcode: "+x[i+1]);
                }
                i += 2;
            }
            else if (kw.equals("vers") && i+2 < x.length) {
                software = x[i+1];
                version = x[i+2];
                i += 3;
            }
            else if (kw.equals("vers") && i+1 < x.length) {
                software = x[i+1];
                i += 2;
            }
            else
                /* Unknown server commands (e.g. UDP port) are ignored */
                i++;
        }
        return new LoginLine(user, pass, software, version, filter);
    }
    
    
    public boolean isReadOnly() 
        { return pass == Passcode.READONLY; }
        
    
    public String softwareString() {
        if (software == null)
            return null;
        return (version == null ? software : software+" "+version);
    }
    
    
    public String toString() {
        return "user "+user+" pass "+pass
            + (software == null ? "" : " vers "+softwareString())
            + (filter == null ? "" : " filter "+filter);
    }
}
