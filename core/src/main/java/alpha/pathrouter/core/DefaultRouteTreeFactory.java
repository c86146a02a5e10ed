package alpha.pathrouter.core;

import alpha.pathrouter.Config;
import alpha.pathrouter.route.RouteTree;
import alpha.pathrouter.route.RouteTreeFactory;

/**
 * Default {@code RouteTreeFactory}.<p>
 * 
 * This class is specified in the provider configuration file
 * {@code META-INF/services/alpha.pathrouter.route.RouteTreeFactory}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class DefaultRouteTreeFactory implements RouteTreeFactory
{
    /**
     * Constructs this object.
     */
    public DefaultRouteTreeFactory() {
        // Empty
    }
    
    @Override
    public <T> RouteTree<T> create(Config config) {
        return new DefaultRouteTree<>(config);
    }
}
