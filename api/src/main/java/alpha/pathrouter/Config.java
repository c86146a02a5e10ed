package alpha.pathrouter;

import alpha.pathrouter.route.RouteCollisionException;
import alpha.pathrouter.route.RouteTree;

/**
 * Route tree configuration.<p>
 * 
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance. The static method {@link #configuration()} is
 * a shortcut for {@code Config.DEFAULT.toBuilder()}:
 * 
 * <pre>{@code
 *   RouteTree<Handler> tree = RouteTree.create(configuration()
 *           .rejectDuplicateRoutes(true)
 *           .build());
 * }</pre>
 * 
 * The implementation is immutable.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * The configuration used by {@link RouteTree#create()}.<p>
     * 
     * This instance contains the following values:<p>
     * 
     * Reject duplicate routes = false<br>
     * Trim patterns = true
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns a builder initialized with the values of {@link #DEFAULT}.
     * 
     * @return a builder
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Returns whether a route registered for a method and a hierarchical
     * position that already has a handler for the same method is rejected.<p>
     * 
     * If {@code false}, the last registration wins and the replaced handler
     * is logged on level {@code DEBUG}. If {@code true}, the registration
     * fails with a {@link RouteCollisionException} and the tree keeps the
     * handler it had.<p>
     * 
     * Two patterns occupy the same position if they have the same number of
     * segments and the same kind of segment at each position, with equal text
     * for literal segments. The names of variable segments have no effect, so
     * "/user/:id" and "/user/:name" collide.<p>
     * 
     * The {@link #DEFAULT} configuration returns {@code false}.
     * 
     * @return whether to reject duplicated routes
     */
    boolean rejectDuplicateRoutes();
    
    /**
     * Returns whether leading and trailing whitespace is removed from a route
     * pattern before it is registered.<p>
     * 
     * Request paths given to the lookup are never trimmed.<p>
     * 
     * The {@link #DEFAULT} configuration returns {@code true}.
     * 
     * @return whether to trim route patterns
     */
    boolean trimPatterns();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The implementation is immutable; each setter returns a new builder.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#rejectDuplicateRoutes()
         */
        Builder rejectDuplicateRoutes(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#trimPatterns()
         */
        Builder trimPatterns(boolean newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
