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
 
package no.polaric.aprsis.api;
import no.polaric.aprsis.*;
import no.polaric.aprsis.channel.*;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import java.text.*;
import java.util.*;



/**
 * Implement REST API for status info. Read only.  
 */
public class StatusApi {

    private final ServerConfig _conf;
    private final Router _router;
    private final PeerManager _peers;
    private Javalin a;
    
    /* Jackson JSON mapper */ 
    protected final static ObjectMapper mapper = new ObjectMapper()
        .setDateFormat(new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ssZ"))
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    
    
    public StatusApi(ServerConfig conf, Router router, PeerManager peers) {
        _conf = conf;
        _router = router;
        _peers = peers;
    }
    
    
    public static String toJson(Object obj) throws JsonProcessingException
        { return mapper.writeValueAsString(obj); }
    
    
    /** 
     * Return an error status message to client. 
     */
    public void ERROR(Context ctx, int status, String msg)
      { ctx.status(status); ctx.result(msg); }
      
      
      
    /**
     * Local port of the web server. 
     */
    public int getPort() 
        { return (a == null ? -1 : a.port()); }
    
    
    
    /** 
     * Set up the webservices and start the web server. 
     */
    public void start(int port) {
        a = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinJackson(mapper, false));
        });
    
        /******************************************
         * A simple ping service. Just return OK. 
         ******************************************/
        a.get("/system/ping", (ctx) -> {
            ctx.result("Ok");
        });
        
        
        /******************************************
         * Status of the server: counters, clients and peers. 
         ******************************************/
        a.get("/status.json", (ctx) -> {
            ctx.json(_router.getStatus());
        });
        
        
        /******************************************
         * Connected clients. 
         ******************************************/
        a.get("/clients.json", (ctx) -> {
            ctx.json(_router.getClientInfo());
        });
        
        
        /******************************************
         * S2S peers. 
         ******************************************/
        a.get("/peers.json", (ctx) -> {
            if (_peers == null) {
                ctx.json(List.of());
                return;
            }
            ctx.json(_peers.getPeerInfo());
        });
        
        
        /******************************************
         * One S2S peer.
         ******************************************/
        a.get("/peers/{id}", (ctx) -> {
            var pd = (_peers == null ? null : _peers.getPeer(ctx.pathParam("id")));
            if (pd == null) {
                ERROR(ctx, 404, "Unknown peer: "+ctx.pathParam("id"));
                return;
            }
            ctx.json(pd.getInfo());
        });
        
        a.start(port);
        _conf.log().info("StatusApi", "Status API on port "+a.port());
    }
    
    
    public void stop() {
        if (a != null)
            a.stop();
    }
}
