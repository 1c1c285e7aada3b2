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
import no.polaric.aprsis.*;
import no.polaric.aprsis.aprs.*;
import java.util.*;
import java.util.regex.Pattern;


/**
 * APRS-IS client filters.
 * See https://www.aprs-is.net/javAPRSFilter.aspx. 
 *
 * These filters are supported. Filters that need the position or symbol of 
 * the packet (a, r, m, f, s) are not, since positions are not decoded. 
 *  t - type
 *  p - prefix 
 *  d - digipeater (with wildcards)
 *  b - budlist (with wildcards) 
 *  u - unproto (with wildcards) 
 *  e - entry (with wildcards)
 *  g - group message (with wildcards)
 *  o - object or item name (with wildcards)
 *  os - object name, not items (with wildcards)
 *  q - Q construct (with wildcards)
 *  * - matches all
 *
 * Filters separated by just a space is a disjunction. For example 'a b' means 'a OR b'.
 * If the filter starts with '-' it is an exception. If any such filters is true, it means the whole filter is false. 
 * If the filter starts with '&amp;' it is a conjunction with the filter it immediately follows.
 *    For example 'p/LA &amp;t/m' means '(p/LA AND t/m)'. 'p/LA &amp;t/m b/N0CALL' means '(p/LA AND t/m) OR b/N0CALL'.
 * Conjunctions can also be used with exceptions. 
 *    For example -t/w &amp;p/LA means NOT(t/w AND p/LA)
 */

 
public abstract class AprsFilter {

    public abstract boolean test(AprsPacket p);
    
    
    /**
     * Convert wildcard pattern (* and ?) to regex pattern.
     * Used during filter initialization only, not during packet processing.
     */
    protected static String wildcardToRegex(String wildcard) {
        return Pattern.quote(wildcard)
            .replace("*", "\\E.*\\Q").replace("?", "\\E.\\Q");
    }
    
    
    protected static Pattern[] compile(String[] parms, String suffix) {
        Pattern[] patterns = new Pattern[parms.length - 1]; 
        for (int i = 1; i< parms.length; i++)
            patterns[i-1] = Pattern.compile(wildcardToRegex(parms[i].toUpperCase()) + suffix);
        return patterns;
    }
    
    
    protected static boolean matchAny(Pattern[] patterns, String x) {
        if (x == null)
            return false;
        for (Pattern pat : patterns)
            if (pat.matcher(x).matches())
                return true;
        return false;
    }
    
    
    
    public static class All extends AprsFilter {
        @Override public boolean test(AprsPacket p) 
            { return true; }
        public String toString() {return "All";}
    }
    
    
    public static class Nothing extends AprsFilter {
        @Override public boolean test(AprsPacket p) 
            { return false; }
        public String toString() {return "Nothing";}
    }
    
    
    
    /**
     * t - type - poimqstunw
     */
    public static class Type extends AprsFilter {
        protected String types;
         
        public Type(String[] parms) {
            types = (parms.length > 1 ? parms[1] : "");
        }
        
        @Override public boolean test(AprsPacket p) 
            { return types.indexOf(toFType(p)) != -1; }
        
        public String toString() {return "Type";}
    }
    
    
    
    /**
     * p - prefix
     */
    public static class Prefix extends AprsFilter {
        private String[] _prefixes;
                
        public Prefix(String[] parms) {
            _prefixes = Arrays.copyOfRange(parms, 1, parms.length);
            for (int i=0; i<_prefixes.length; i++)
                _prefixes[i] = _prefixes[i].toUpperCase();
        }
        
        @Override public boolean test(AprsPacket p) {
            String from = p.from.toString();
            for (String pre : _prefixes)
                if (from.startsWith(pre))
                    return true;
            return false;
        }
        
        public String toString() {return "Prefix";}
    }

    
    
    /**
     * b - budlist with wildcards
     */
    public static class Budlist extends AprsFilter {
        private Pattern[] _patterns;
        
        public Budlist(String[] parms) 
            { _patterns = compile(parms, ""); }
        
        @Override public boolean test(AprsPacket p) 
            { return matchAny(_patterns, p.from.toString()); }
        
        public String toString() {return "Budlist";}
    }
    
    
        
    /**
     * u - unproto with wildcards
     */
    public static class Unproto extends AprsFilter {
        private Pattern[] _patterns;
        
        public Unproto(String[] parms) 
            { _patterns = compile(parms, ""); }
        
        @Override public boolean test(AprsPacket p) 
            { return matchAny(_patterns, p.to.toString()); }
        
        public String toString() {return "Unproto";}
    }
    
    
    
    /**
     * d - digipeater with wildcards. Matches the digipeaters that the packet 
     * has passed, i.e. up to and including the last one marked as used. 
     */
    public static class Digi extends AprsFilter {
        private Pattern[] _patterns;
        
        public Digi(String[] parms) 
            { _patterns = compile(parms, ""); }
         
        @Override public boolean test(AprsPacket p) {
            int i;
            for (i=p.via.size(); i>0; i--) {
                PathElement e = p.via.get(i-1);
                if (e.kind() == PathElement.Kind.HOP && e.used())
                    break;
            }
            for (int j=0; j<i; j++) {
                PathElement e = p.via.get(j);
                if (e.kind() == PathElement.Kind.HOP && matchAny(_patterns, e.ident()))
                    return true;
            }
            return false;
        }
        
        public String toString() {return "Digi";}
    }
    
    
        
    /**
     * e - entry calls with wildcards
     */
    public static class Entry extends AprsFilter {
        private Pattern[] _patterns;
        
        public Entry(String[] parms) 
            { _patterns = compile(parms, ""); }
        
        @Override public boolean test(AprsPacket p) {
            String[] qc = ServerMarker.getQcode(p);
            return qc != null && matchAny(_patterns, qc[1]);
        }
        
        public String toString() {return "Entry";}
    }
    
    
    
    /**
     * g - group message filter with wildcards
     */
    public static class GroupMsg extends AprsFilter {
        private Pattern[] _patterns;
        
        public GroupMsg(String[] parms) 
            { _patterns = compile(parms, ""); }
        
        @Override public boolean test(AprsPacket p) 
            { return matchAny(_patterns, p.msgTo()); }
        
        public String toString() {return "GroupMsg";}
    }
    
    
    
    /**
     * o - object or item name with wildcards. Names are compared in upper case.
     */
    public static class ObjectName extends AprsFilter {
        private Pattern[] _patterns;
        
        public ObjectName(String[] parms) 
            { _patterns = compile(parms, ""); }
        
        @Override public boolean test(AprsPacket p) {
            String name = p.objectName();
            return name != null && matchAny(_patterns, name.toUpperCase());
        }
        
        public String toString() {return "Object";}
    }
    
    
    
    /**
     * os - strict object (not items) with wildcards
     */
    public static class StrictObject extends ObjectName {
        
        public StrictObject(String[] parms) 
            { super(parms); }
        
        @Override public boolean test(AprsPacket p) 
            { return p.type() == ';' && super.test(p); }
        
        public String toString() {return "StrictObject";}
    }
    
    
    
    /**
     * q - Q construct filter. Parameter is a list of q-construct letters, 
     * e.g. q/CX matches qAC and qAX. 
     */
    public static class QConstruct extends AprsFilter {
        private String _letters;
        
        public QConstruct(String[] parms) 
            { _letters = (parms.length > 1 ? parms[1] : ""); }
        
        @Override public boolean test(AprsPacket p) {
            String[] qc = ServerMarker.getQcode(p);
            return qc != null && _letters.indexOf(qc[0].charAt(2)) != -1;
        }
        
        public String toString() {return "QConstruct";}
    }
    
    
    
    /**
     * Combined filter. List of filters. 
     */
    public static class Combined extends AprsFilter {
        private final List<List<AprsFilter>> _flist = new ArrayList<>(), _xlist = new ArrayList<>();
        private final String _spec;
        private final Logfile _log;
        
        
        public Combined(String spec, Logfile log) {
            _spec = spec.trim();
            _log = log;
            parse(_spec);
        }

        
        private void parse(String fspec) {
            List<AprsFilter> f = null; 
             
            /* For each part of the filter spec */
            for (String fstr : fspec.split(" ")) {
                if (fstr.length() == 0)
                    continue;
                String[] ff = fstr.split("/");
                String cmd = ff[0];
                boolean exception = false;
                boolean conj = false; 
                
                if (cmd.startsWith("-")) {  // Negation (exception)
                    exception = true;
                    cmd = cmd.substring(1);
                }
                if (cmd.startsWith("&")) {  // Part of conjunction
                    cmd = cmd.substring(1);
                    conj = (f != null);
                }
                AprsFilter x = switch (cmd) {
                    case "*" -> new All();
                    case "p" -> new Prefix(ff);
                    case "b" -> new Budlist(ff);
                    case "u" -> new Unproto(ff);
                    case "d" -> new Digi(ff);
                    case "t" -> new Type(ff);
                    case "e" -> new Entry(ff);
                    case "g" -> new GroupMsg(ff);
                    case "o" -> new ObjectName(ff);
                    case "os" -> new StrictObject(ff);
                    case "q" -> new QConstruct(ff);
                    default -> null;
                }; 
                if (x == null) {
                    if (_log != null)
                        _log.warn("AprsFilter", "Invalid filter: "+fstr);
                    x = new Nothing();
                }
                
                if (conj) { // filter is part of a conjunction
                    f.add(x);
                    continue;
                }
                f = new ArrayList<AprsFilter>();
                f.add(x);
                if (exception)
                    _xlist.add(f);
                else
                    _flist.add(f);
            }
        }
        
        
        /** 
         * Go through rules and test.
         * Exception rules override any other rule regardless of order.
         * Expressions are on a disjunctive normal form, so each part is a conjunction.
         */
        @Override public boolean test(AprsPacket p) {
            for (List<AprsFilter> f: _xlist)
                if (ctest(f, p)) return false;
            for (List<AprsFilter> f: _flist)
                if (ctest(f, p)) return true;
            return false; 
        }
        
        
        private boolean ctest(List<AprsFilter> conj, AprsPacket p) {
            for (AprsFilter f : conj)
                if (!f.test(p)) return false;
            return true;
        }
        
        
        /** The filter expression as given by the client. */
        public String getSpec() 
            { return _spec; }
        
        
        public String toString() {
            String res = "[ " + _toString(_flist);
            if (_xlist.size() > 0)
                res += "EXCEPT " + _toString(_xlist);
            return res + "]";
        }
        
        
        private String _toString(List<List<AprsFilter>> list) {
            StringBuilder res = new StringBuilder();
            for (List<AprsFilter> x: list) {
                if (x.size() > 1) 
                    res.append("(").append(String.join(" & ", x.stream().map(Object::toString).toList())).append(")");
                else
                    res.append(x.get(0));
                res.append(" ");
            }
            return res.toString();
        }
    }

    
    
    public static char toFType(AprsPacket p) {
        return switch (p.type()) {
            case '!', '=','@', '/', '\'', '`'  -> 'p';
            case ';' -> 'o';
            case ')' -> 'i';
            case ':' -> 'm';
            case '?' -> 'q'; 
            case '>' -> 's';
            case 'T' -> 't';
            case '_', '#', '*' -> 'w';
            case '{' -> 'u';
            default -> 'X';
        };
    }
    
    
    /**
     * Create a filter from a filter expression. 
     * @param log Invalid parts are reported here. May be null.
     */
    public static Combined createFilter(String fspec, Logfile log) {
        return new Combined(fspec == null ? "" : fspec, log);
    }
}
