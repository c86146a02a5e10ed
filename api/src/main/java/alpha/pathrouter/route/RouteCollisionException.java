package alpha.pathrouter.route;

import alpha.pathrouter.Config;

import java.io.Serial;

/**
 * Thrown by {@link RouteTree} when an attempt is made to register a route
 * whose method and hierarchical position is already occupied, and
 * {@link Config#rejectDuplicateRoutes()} is {@code true}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Route
 */
public class RouteCollisionException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RouteCollisionException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteCollisionException(String message) {
        super(message);
    }
}
