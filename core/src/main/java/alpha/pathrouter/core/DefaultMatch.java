package alpha.pathrouter.core;

import alpha.pathrouter.route.Route;
import alpha.pathrouter.route.Router;

import java.util.Map;

/**
 * Default implementation of {@link Router.Match}.
 * 
 * @param route the route that matched
 * @param variables values of variable segments
 * @param <T> type of handler
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
record DefaultMatch<T>(Route<T> route, Map<String, String> variables)
        implements Router.Match<T>
{
    @Override
    public String toString() {
        return DefaultMatch.class.getSimpleName() + "{" +
                "route=" + route +
                ", variables=" + variables + '}';
    }
}
