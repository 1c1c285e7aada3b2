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
import java.util.*;
import java.util.concurrent.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;



/**
 * Log. Messages are tagged with the name of the component that logs them. 
 * Output goes through SLF4J, one logger per tag, below the base name of this log. 
 */
public class Logfile
{
    public enum Level {
       DEBUG, INFO, WARNING, ERROR, NONE
    }

    private boolean _log = false;
    private Level _level = Level.NONE;
    private String _name; 
    private final Map<String, Logger> _loggers = new ConcurrentHashMap<String, Logger>();
    
        
        
    private void init(ServerConfig conf, String configname) 
    {     
       _name = configname;
       _log = conf.getBoolProperty(configname + ".log.on", true);
       int lv = conf.getIntProperty(configname + ".log.level", 1);
       if (lv > 4 || lv < 0) lv=4;
       _level = Level.values()[lv];
    } 
    
    
    public Logfile(ServerConfig conf)
       { init(conf, "aprsis"); }
    
    
    public Logfile(ServerConfig conf, String configname) 
       { init(conf, configname); }


   public void error(String cls, String text)
      { log(Level.ERROR, cls, text);}
      
   
   public void warn(String cls, String text)
      { log(Level.WARNING, cls, text);}    
   
   
   public void info(String cls, String text)
      { log(Level.INFO, cls, text);}
      
      
   public void debug(String cls, String text)
      { log(Level.DEBUG, cls, text);}
      
      
   public void log(String cls, String text)
      { log(Level.NONE, cls, text);}
   
   
   public boolean isDebug() 
      { return _log && _level == Level.DEBUG; }
      
      
   public void log(Level lvl, String cls, String text)
   {
      if (!_log || lvl.ordinal() < _level.ordinal())
         return;
      Logger logger = _loggers.computeIfAbsent(
          (cls == null ? _name : _name+"."+cls), LoggerFactory::getLogger);
      switch (lvl) {
         case ERROR   -> logger.error(text);
         case WARNING -> logger.warn(text);
         case DEBUG   -> logger.debug(text);
         default      -> logger.info(text);
      }
   }
}
