package alpha.pathrouter.core;

import alpha.pathrouter.route.Route;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * Searches a route tree for the item of a method and path.<p>
 * 
 * At each node, the next path segment is first matched against the literal
 * child of the same text, then the variable child and finally the wildcard
 * child. A branch that can not match the remainder of the path is abandoned
 * and the next kind is tried. A wildcard consumes at least one segment and
 * tries the shortest consumption first.<p>
 * 
 * Literal segments are matched by exact text. The empty segment of a doubled
 * slash never matches a variable.<p>
 * 
 * An instance is used for one search only and is not thread-safe. The tree is
 * only read.
 * 
 * @param <T> type of handler
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Matcher<T>
{
    /**
     * Find the item of the given method and path.
     * 
     * @param root of tree
     * @param method HTTP method
     * @param path request path (percent-decoded)
     * @param <T> type of handler
     * 
     * @return a match, or {@code null} if none was found
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static <T> DefaultMatch<T> find(Node<T> root, String method, String path) {
        return new Matcher<T>(method, Segments.split(path)).search(root);
    }
    
    private final String method;
    private final List<String> segments;
    // Values of variable segments, in the order consumed
    private final List<String> captured;
    
    private Matcher(String method, List<String> segments) {
        this.method   = method;
        this.segments = segments;
        this.captured = new ArrayList<>();
    }
    
    private DefaultMatch<T> search(Node<T> root) {
        Node.Item<T> i = search(root, 0);
        if (i == null) {
            return null;
        }
        var r = new Route<>(method, i.pattern(), i.handler());
        return new DefaultMatch<>(r, bind(i.variableNames(), captured));
    }
    
    /**
     * Search the given node for the item of the remaining segments.<p>
     * 
     * If the search fails, the captured values are restored to what they were
     * when the call was made.
     * 
     * @param n node
     * @param pos index of first remaining segment
     * 
     * @return the item, or {@code null} if not found
     */
    private Node.Item<T> search(Node<T> n, int pos) {
        if (pos == segments.size()) {
            return n.item(method);
        }
        
        final String s = segments.get(pos);
        Node.Item<T> i;
        
        Node<T> c = n.staticChild(s);
        if (c != null && (i = search(c, pos + 1)) != null) {
            return i;
        }
        
        c = n.variableChild();
        if (c != null && !s.isEmpty()) {
            captured.add(s);
            if ((i = search(c, pos + 1)) != null) {
                return i;
            }
            captured.remove(captured.size() - 1);
        }
        
        c = n.wildcardChild();
        if (c != null) {
            // Consume [pos, next), one segment at the very least
            for (int next = pos + 1; next <= segments.size(); ++next) {
                if ((i = search(c, next)) != null) {
                    return i;
                }
            }
        }
        
        return null;
    }
    
    /**
     * Pair each name with the value at the same position.<p>
     * 
     * Surplus names or values are ignored. If a name is repeated, the last
     * value wins.
     * 
     * @param names variable names
     * @param values captured values
     * 
     * @return an unmodifiable map that iterates names in declaration order
     */
    private static Map<String, String> bind(List<String> names, List<String> values) {
        final int n = Math.min(names.size(), values.size());
        if (n == 0) {
            return Map.of();
        }
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < n; ++i) {
            m.put(names.get(i), values.get(i));
        }
        return unmodifiableMap(m);
    }
}
