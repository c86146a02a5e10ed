package alpha.pathrouter.route;

import java.util.Map;
import java.util.Optional;

/**
 * Finds the handler registered for a request method and path.<p>
 * 
 * A router is what the request-processing code of a server talks to, once per
 * request. The only outcome besides a {@link Match} is that no route was
 * found, which is not an error but the ordinary negative result; the caller
 * would typically respond {@code 404 (Not Found)}.<p>
 * 
 * A router obtained from {@link RouteTree#freeze()} is immutable and can be
 * shared by any number of threads. A {@link RouteTree} is itself a router,
 * but one that is still open for registration.
 * 
 * @param <T> type of handler
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Router<T>
{
    /**
     * Finds the handler registered for the given method and path.<p>
     * 
     * The path must already be percent-decoded. One leading and one trailing
     * forward slash are ignored. Every other forward slash separates segments
     * and so "a//b" has an empty segment in the middle. An empty segment is
     * never captured by a variable. It is matched by the empty literal segment
     * of a pattern that has the same doubled slash, or by a wildcard.<p>
     * 
     * Literal segments take precedence over a variable, which in turn takes
     * precedence over a wildcard. If the branch picked for a segment fails to
     * match the remainder of the path, the next kind in precedence order is
     * tried. A wildcard tries to consume as few segments as possible.
     * 
     * @param method HTTP method
     * @param path request path
     * 
     * @return the match, or an empty optional if no route was found
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    Optional<Match<T>> find(String method, String path);
    
    /**
     * The result of a successful lookup.
     * 
     * @param <T> type of handler
     */
    interface Match<T> {
        /**
         * Returns the route that matched.<p>
         * 
         * The route's pattern is normalized; it starts with a forward slash
         * and has no trailing slash, unless it is the root "/" or its last
         * segment is empty, e.g. "//" or "/a//". The pattern of
         * a route merged into a tree using
         * {@link RouteTree#insertSubtree(String, RouteTree)} includes the
         * prefix.
         * 
         * @return the route that matched
         */
        Route<T> route();
        
        /**
         * Returns the handler of the matched route.
         * 
         * @implSpec
         * The default implementation is equivalent to:
         * <pre>
         *     return route().handler();
         * </pre>
         * 
         * @return the handler
         */
        default T handler() {
            return route().handler();
        }
        
        /**
         * Returns the values of the route's variable segments.<p>
         * 
         * The map iterates the names in the order they were declared by the
         * pattern, from root to leaf. The map is unmodifiable.
         * 
         * @return the variables (never {@code null})
         */
        Map<String, String> variables();
        
        /**
         * Returns the value of the named variable segment.
         * 
         * @implSpec
         * The default implementation is equivalent to:
         * <pre>
         *     return variables().get(name);
         * </pre>
         * 
         * @param name of variable
         * 
         * @return the value, or {@code null} if the route declared no such
         *         variable
         */
        default String variable(String name) {
            return variables().get(name);
        }
    }
}
