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



/**
 * Configuration of a S2S peer. The passcode is a secret shared with the peer. 
 * @param id Key in the config. 
 * @param host Host name or address. 
 * @param port Port number of the peer's S2S port. 
 * @param passcode Shared passcode. 
 * @param name Server identity of the peer. Optional, may be null. 
 * @param receiveOnly If true, packets are received from the peer but never sent to it.
 * @param passive If true, this server does not connect to the peer but waits for the peer to connect.
 */
public record PeerConfig(String id, String host, int port, int passcode, String name, boolean receiveOnly, boolean passive) 
{
    public String displayName() {
        return (name != null ? name : host+":"+port);
    }
}
