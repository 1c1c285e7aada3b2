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
import no.polaric.aprsis.channel.*;
import no.polaric.aprsis.api.*;
import java.util.*;
import java.io.*;



/**
 * Startup of the APRS-IS server. 
 * Usage: Main config-file
 */
public class Main
{
   private ServerConfig _conf;
   private Logfile log;
   private Router _router;
   private PeerManager _peers;
   private Uplink _uplink;
   private StatusApi _api;
   private final List<Listener> _listeners = new ArrayList<Listener>();
   
   
   public Main(ServerConfig conf) {
       _conf = conf;
       log = conf.log();
   }
   
   
   public Router getRouter() 
      { return _router; }
      
   public PeerManager getPeerManager() 
      { return _peers; }
      
   public List<Listener> getListeners() 
      { return _listeners; }
      
   public StatusApi getStatusApi()
      { return _api; }
    
    
    
   /**
    * Start the services. 
    * @throws IOException if a configured port cannot be bound.
    */
   public void start() throws IOException
   {
        log.info("Main", "Starting "+_conf.getSoftware()+" "+_conf.getVersion()+", server id: "+_conf.getMycall());
        _router = new Router(_conf);
        _router.start();
        
        /* Client ports */
        String ports = _conf.getProperty("client.ports", "14580");
        for (String p : ports.split(",(\\s)*")) {
            if (p.isBlank())
                continue;
            var l = new Listener(_conf, "client-"+p.trim(), Integer.parseInt(p.trim()), 
                conn -> new ClientSession(_conf, _router, conn).start() );
            l.activate();
            _listeners.add(l);
        }
        
        /* S2S peers */
        _peers = new PeerManager(_conf, _router);
        _peers.activate();
        
        /* Uplink */
        if (Uplink.isConfigured(_conf)) {
            log.info("Main", "Activate uplink: "+_conf.getProperty("uplink.host", ""));
            _uplink = new Uplink(_conf, _router);
            _uplink.activate();
        }
        
        /* Status API */
        if (_conf.getBoolProperty("httpserver.on", false)) {
            _api = new StatusApi(_conf, _router, _peers);
            _api.start(_conf.getIntProperty("httpserver.port", 14501));
        }
   }
   
   
   
   public void stop() 
   {
        log.info("Main", "Shutting down");
        for (Listener l : _listeners)
            l.deActivate();
        if (_uplink != null)
            _uplink.deActivate();
        if (_peers != null)
            _peers.deActivate();
        if (_router != null)
            _router.stop();
        if (_api != null)
            _api.stop();
   }
    
    
    
   public static void main(String[] args)
   {
        if (args.length < 1) {
           System.out.println("Usage: Main <config-file>");
           System.exit(2);
        }
        System.out.println();
        System.out.println("*************************************************");
        System.out.println("***   Polaric APRS-IS server startup          ***");
        System.out.println("*************************************************");
        System.out.println();
        
        ServerConfig conf;
        try {
            conf = PropertyConfig.load(args[0]);
            conf.getMycall();
        }
        catch (IOException | IllegalArgumentException e) {
            System.err.println("*** ERROR: Couldn't read config: "+e.getMessage());
            System.exit(1);
            return;
        }
        
        Main server = new Main(conf);
        try {
            server.start();
        }
        catch (IOException e) {
            conf.log().error("Main", "Cannot start server: "+e.getMessage());
            server.stop();
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
   }
}
