package alpha.pathrouter.route;

import static alpha.pathrouter.HttpConstants.Method.DELETE;
import static alpha.pathrouter.HttpConstants.Method.GET;
import static alpha.pathrouter.HttpConstants.Method.HEAD;
import static alpha.pathrouter.HttpConstants.Method.POST;
import static alpha.pathrouter.HttpConstants.Method.PUT;

/**
 * Static factories of {@link Route}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Routes
{
    private Routes() {
        // Empty
    }
    
    /**
     * Creates a route.
     * 
     * @param method  HTTP method
     * @param pattern path pattern
     * @param handler handler of the route
     * @param <T> type of handler
     * 
     * @return a route
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static <T> Route<T> route(String method, String pattern, T handler) {
        return new Route<>(method, pattern, handler);
    }
    
    /**
     * Creates a {@code GET} route.
     * 
     * @param pattern path pattern
     * @param handler handler of the route
     * @param <T> type of handler
     * 
     * @return a route
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static <T> Route<T> get(String pattern, T handler) {
        return route(GET, pattern, handler);
    }
    
    /**
     * Creates a {@code HEAD} route.
     * 
     * @param pattern path pattern
     * @param handler handler of the route
     * @param <T> type of handler
     * 
     * @return a route
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static <T> Route<T> head(String pattern, T handler) {
        return route(HEAD, pattern, handler);
    }
    
    /**
     * Creates a {@code POST} route.
     * 
     * @param pattern path pattern
     * @param handler handler of the route
     * @param <T> type of handler
     * 
     * @return a route
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static <T> Route<T> post(String pattern, T handler) {
        return route(POST, pattern, handler);
    }
    
    /**
     * Creates a {@code PUT} route.
     * 
     * @param pattern path pattern
     * @param handler handler of the route
     * @param <T> type of handler
     * 
     * @return a route
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static <T> Route<T> put(String pattern, T handler) {
        return route(PUT, pattern, handler);
    }
    
    /**
     * Creates a {@code DELETE} route.
     * 
     * @param pattern path pattern
     * @param handler handler of the route
     * @param <T> type of handler
     * 
     * @return a route
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static <T> Route<T> delete(String pattern, T handler) {
        return route(DELETE, pattern, handler);
    }
}
