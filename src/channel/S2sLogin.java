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


/**
 * Server to server login line. Both sides of a S2S link use the same grammar.
 * Format: # s2s login serverid passcode software version
 *
 * The acceptor replies with '# s2s logresp serverid verified' where serverid is 
 * its own identity, or with '# s2s reject reason'. 
 */
public record S2sLogin(String serverId, int passcode, String software, String version) 
{
    public static final String LOGIN   = "# s2s login ";
    public static final String LOGRESP = "# s2s logresp ";
    public static final String REJECT  = "# s2s reject ";
    
    
    /**
     * Parse a login line. 
     * @throws LoginException with reason INVALID if it is not a valid login line. 
     */
    public static S2sLogin parse(String line) throws LoginException {
        if (line == null || !line.startsWith(LOGIN))
            throw new LoginException(LoginException.Reason.INVALID, "Expected s2s login");
        String[] x = line.substring(LOGIN.length()).trim().split("\\s+");
        if (x.length < 4)
            throw new LoginException(LoginException.Reason.INVALID, "Invalid s2s login, too few arguments");
        try {
            return new S2sLogin(ServerMarker.serverId(x[0]), Integer.parseInt(x[1]), x[2], x[3]);
        }
        catch (IllegalArgumentException e) {
            throw new LoginException(LoginException.Reason.INVALID, "Invalid s2s login: "+e.getMessage());
        }
    }
    
    
    
    /**
     * Parse the reply to a login. 
     * @return Server identity of the acceptor. 
     * @throws PeerLinkException with reason REJECTED if the login was rejected or 
     *   the reply cannot be understood. 
     */
    public static String parseReply(String line) throws PeerLinkException {
        if (line != null && line.startsWith(REJECT))
            throw new PeerLinkException(PeerLinkException.Reason.REJECTED, 
                "Rejected by peer: "+line.substring(REJECT.length()).trim());
        if (line == null || !line.startsWith(LOGRESP))
            throw new PeerLinkException(PeerLinkException.Reason.REJECTED, "Unexpected reply: "+line);
        String[] x = line.substring(LOGRESP.length()).trim().split("\\s+");
        if (x.length < 2 || !x[1].equals("verified") || !ServerMarker.isServerId(x[0]))
            throw new PeerLinkException(PeerLinkException.Reason.REJECTED, "Unexpected reply: "+line);
        return x[0];
    }
    
    
    public static String logresp(String serverId) 
        { return LOGRESP + serverId + " verified"; }
    
    public static String reject(String reason) 
        { return REJECT + reason; }
    
    
    public String toString() {
        return LOGIN + serverId+" "+passcode+" "+software+" "+version;
    }
}
