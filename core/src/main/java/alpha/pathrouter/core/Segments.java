package alpha.pathrouter.core;

import java.util.ArrayList;
import java.util.List;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableList;

/**
 * Util class for segments.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Segments
{
    static final char COLON_CH = ':';     // prefix of variable segments
    
    static final String ASTERISK_STR = "*", // wildcard segment
                        SLASH_STR    = "/";
    
    private Segments() {
        // Empty
    }
    
    /**
     * Split the given path into segments.<p>
     * 
     * The empty string and "/" produce no segments. Otherwise one leading
     * and one trailing forward slash is removed, and the remainder is split
     * around each forward slash. Empty segments are kept, i.e. "a//b" becomes
     * ["a", "", "b"] and "//" becomes [""].<p>
     * 
     * The returned list is unmodifiable and implements RandomAccess.
     * 
     * @param path to split
     * 
     * @return the segments (never {@code null})
     * 
     * @throws NullPointerException if {@code path} is {@code null}
     */
    static List<String> split(String path) {
        if (path.isEmpty() || path.equals(SLASH_STR)) {
            return List.of();
        }
        int beg = path.charAt(0) == '/' ? 1 : 0,
            end = path.length();
        if (end > beg && path.charAt(end - 1) == '/') {
            --end;
        }
        // -1 keeps trailing empty strings
        return unmodifiableList(asList(path.substring(beg, end).split(SLASH_STR, -1)));
    }
    
    /**
     * Join the given segments into a normalized pattern.<p>
     * 
     * The result always starts with a forward slash, e.g. [] becomes "/" and
     * ["a", ":b"] becomes "/a/:b". If the last segment is empty, a trailing
     * slash is added so that {@link #split(String)} gives the segments back,
     * e.g. [""] becomes "//".
     * 
     * @param segments to join
     * 
     * @return a pattern
     */
    static String join(List<String> segments) {
        final String s = SLASH_STR + String.join(SLASH_STR, segments);
        if (!segments.isEmpty() && segments.get(segments.size() - 1).isEmpty()) {
            return s + SLASH_STR;
        }
        return s;
    }
    
    /**
     * Concatenate two lists.<p>
     * 
     * The returned list is unmodifiable.
     * 
     * @param first list
     * @param second list
     * @param <E> element type
     * 
     * @return a new list with all elements
     */
    static <E> List<E> concat(List<E> first, List<E> second) {
        if (second.isEmpty()) {
            return first;
        }
        if (first.isEmpty()) {
            return second;
        }
        List<E> l = new ArrayList<>(first.size() + second.size());
        l.addAll(first);
        l.addAll(second);
        return unmodifiableList(l);
    }
    
    static boolean isWildcard(String segment) {
        return segment.equals(ASTERISK_STR);
    }
    
    static boolean isVariable(String segment) {
        return !segment.isEmpty() && segment.charAt(0) == COLON_CH;
    }
    
    /**
     * Returns the name of a variable segment, e.g. ":id" gives "id".
     * 
     * @param segment variable segment
     * 
     * @return the name (may be empty)
     */
    static String variableName(String segment) {
        assert isVariable(segment);
        return segment.substring(1);
    }
}
