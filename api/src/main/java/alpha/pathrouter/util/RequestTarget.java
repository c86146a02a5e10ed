package alpha.pathrouter.util;

import alpha.pathrouter.route.Router;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static alpha.pathrouter.util.PercentDecoder.decode;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The request-target of a request-line, split into path, query and
 * fragment.<p>
 * 
 * This class sits between the server and the {@link Router}. The router
 * expects a percent-decoded path with no query or fragment, which is exactly
 * what {@link #path()} returns:
 * 
 * <pre>{@code
 *   RequestTarget rt = RequestTarget.parse("/user/John%20Doe?tab=info#top");
 *   router.find(method, rt.path()); // "/user/John Doe"
 *   rt.queryFirst("tab");           // Optional["info"]
 *   rt.fragment();                  // Optional["top"]
 * }</pre>
 * 
 * The path is not normalized. Clustered forward slashes are left in place and
 * so is a trailing slash; dot-segments are not resolved.<p>
 * 
 * See sections "3.3 Path", "3.4 Query" and "3.5 Fragment" respectively in
 * <a href="https://tools.ietf.org/html/rfc3986#section-3.3">RFC 3986</a>.<p>
 * 
 * The implementation is immutable.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class RequestTarget
{
    /**
     * Parse the given input.<p>
     * 
     * The fragment is everything after the first '#'. The path is everything
     * before the first '?' that precedes the fragment, or before the '#' if
     * there is no such '?'. The query is everything in between.
     * 
     * @param raw request target as read from the request-line
     * 
     * @return a complex type of the input
     * 
     * @throws NullPointerException if {@code raw} is {@code null}
     */
    public static RequestTarget parse(String raw) {
        int f = raw.indexOf('#'),
            q = raw.indexOf('?');
        if (f != -1 && q > f) {
            // '?' is part of the fragment
            q = -1;
        }
        
        final String path;
        if (q != -1) {
            path = raw.substring(0, q);
        } else if (f != -1) {
            path = raw.substring(0, f);
        } else {
            path = raw;
        }
        
        final String query;
        if (q == -1) {
            query = "";
        } else if (f != -1) {
            query = raw.substring(q + 1, f);
        } else {
            query = raw.substring(q + 1);
        }
        
        final String fragment = f == -1 ? null : raw.substring(f + 1);
        
        return new RequestTarget(raw, path, query, fragment);
    }
    
    private final String raw, rawPath, rawQuery, fragment;
    private final Map<String, List<String>> query;
    
    private RequestTarget(String raw, String rawPath, String rawQuery, String fragment) {
        this.raw      = requireNonNull(raw);
        this.rawPath  = rawPath;
        this.rawQuery = rawQuery;
        this.fragment = fragment;
        this.query    = parseQuery(rawQuery);
    }
    
    /**
     * Returns the request-target as given to {@link #parse(String)}.
     * 
     * @return the raw request-target
     */
    public String raw() {
        return raw;
    }
    
    /**
     * Returns the path, not percent-decoded.
     * 
     * @return the path (never {@code null}, may be empty)
     */
    public String rawPath() {
        return rawPath;
    }
    
    /**
     * Returns the percent-decoded path.
     * 
     * @return the path (never {@code null}, may be empty)
     */
    public String path() {
        return decode(rawPath);
    }
    
    /**
     * Returns the query, not percent-decoded.
     * 
     * @return the query (never {@code null}, may be empty)
     */
    public String rawQuery() {
        return rawQuery;
    }
    
    /**
     * Returns the fragment.<p>
     * 
     * The optional is empty if the request-target has no '#'. The optional
     * holds the empty string if the '#' is the last character.
     * 
     * @return the fragment
     */
    public Optional<String> fragment() {
        return Optional.ofNullable(fragment);
    }
    
    /**
     * Returns all percent-decoded query parameters.<p>
     * 
     * A parameter with no '=' has the empty string as value. Text following
     * a second '=' of the same parameter is dropped, e.g. "a=1=2" gives
     * {@code a} the value "1". A parameter repeated in the query has all its
     * values listed in encounter order.<p>
     * 
     * The map iterates parameter names in encounter order. The map and its
     * lists are unmodifiable.
     * 
     * @return query parameters (never {@code null})
     */
    public Map<String, List<String>> queryMap() {
        return query;
    }
    
    /**
     * Returns all percent-decoded values of the given query parameter.
     * 
     * @param name of parameter
     * 
     * @return values (never {@code null}, may be empty)
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public List<String> queryList(String name) {
        requireNonNull(name);
        return query.getOrDefault(name, List.of());
    }
    
    /**
     * Returns the first percent-decoded value of the given query parameter.
     * 
     * @param name of parameter
     * 
     * @return the first value, if present
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Optional<String> queryFirst(String name) {
        return queryList(name).stream().findFirst();
    }
    
    private static Map<String, List<String>> parseQuery(String q) {
        if (q.isEmpty()) {
            return Map.of();
        }
        
        final var m = new LinkedHashMap<String, List<String>>();
        for (String p : q.split("&")) {
            if (p.isEmpty()) {
                continue;
            }
            String[] parts = p.split("=", -1);
            // note: value may be the empty string!
            String k = decode(parts[0]),
                   v = parts.length == 1 ? "" : decode(parts[1]);
            m.computeIfAbsent(k, key -> new ArrayList<>(1)).add(v);
        }
        m.entrySet().forEach(e ->
            e.setValue(unmodifiableList(e.getValue())));
        
        return unmodifiableMap(m);
    }
    
    @Override
    public String toString() {
        return raw;
    }
}
