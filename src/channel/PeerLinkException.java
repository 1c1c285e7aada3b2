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
import java.io.IOException;


/**
 * Problem with a S2S link. Always recoverable: The peer manager retries with backoff. 
 */
public class PeerLinkException extends IOException 
{
    public enum Reason { CONNECT_FAILED, HANDSHAKE_TIMEOUT, PEER_IDLE, REJECTED }
    
    private final Reason _reason;
    
    public PeerLinkException(Reason r, String msg) {
        super(msg);
        _reason = r;
    }
    
    public PeerLinkException(Reason r, String msg, Throwable cause) {
        super(msg, cause);
        _reason = r;
    }
    
    public Reason getReason() 
        { return _reason; }
}
