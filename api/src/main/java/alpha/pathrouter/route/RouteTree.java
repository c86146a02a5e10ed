package alpha.pathrouter.route;

import alpha.pathrouter.Config;

import java.util.List;
import java.util.ServiceLoader;

import static java.util.Objects.requireNonNull;

/**
 * A tree of routes, keyed by the segments of their patterns.<p>
 *
 * The tree is built once, using any mix of {@link #insert(String, String,
 * Object) single-route insertion}, {@link #of(Iterable) bulk construction}
 * and {@link #insertSubtree(String, RouteTree) merge-insertion} of another
 * tree. Then it is used for lookups, see {@link Router#find(String, String)}.
 *
 * <pre>{@code
 *   RouteTree<Handler> api = RouteTree.of(
 *           get("/user/:id", showUser),
 *           post("/user/:id", saveUser));
 *
 *   Router<Handler> router = RouteTree.<Handler>create()
 *           .insert(GET, "/", showWelcome)
 *           .insert(GET, "/*", showError)
 *           .insertSubtree("/api/:version", api)
 *           .freeze();
 *
 *   // Gives showUser with variables {version=v2, id=123}
 *   router.find(GET, "/api/v2/user/123");
 * }</pre>
 *
 * Each node of the tree may hold one handler per HTTP method, any number of
 * literal children, one variable child and one wildcard child. The names of
 * variable segments are not part of the tree structure, only of the
 * registration, and so "/user/:id" and "/user/:name" occupy the same
 * position. Registering a route at an occupied position replaces the existing
 * handler for that method, unless {@link Config#rejectDuplicateRoutes()} is
 * enabled.<p>
 *
 * The implementation is not thread-safe. A tree that has been safely
 * published and is no longer modified may be queried concurrently, but the
 * idiomatic approach is to {@link #freeze()} the tree once it has been built
 * and hand the immutable router to the request-processing threads.
 *
 * @param <T> type of handler
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 *
 * @see Route
 */
public interface RouteTree<T> extends Router<T>
{
    /**
     * Creates an empty tree using the {@link Config#DEFAULT default}
     * configuration.
     *
     * @param <T> type of handler
     *
     * @return a new empty tree
     */
    static <T> RouteTree<T> create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates an empty tree.
     *
     * @param config tree configuration
     * @param <T> type of handler
     *
     * @return a new empty tree
     *
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    static <T> RouteTree<T> create(Config config) {
        requireNonNull(config);
        var loader = ServiceLoader.load(RouteTreeFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config);
    }
    
    /**
     * Creates a tree from the given routes.<p>
     *
     * The routes are inserted in array order.
     *
     * @param routes to insert
     * @param <T> type of handler
     *
     * @return a new tree
     *
     * @throws NullPointerException
     *             if {@code routes} or an element thereof is {@code null}
     */
    @SafeVarargs
    static <T> RouteTree<T> of(Route<? extends T>... routes) {
        return of(List.of(routes));
    }
    
    /**
     * Creates a tree from the given routes.<p>
     *
     * The routes are inserted in iteration order. For a route that has the
     * same method and position as a previously inserted route, the later
     * route wins.
     *
     * @param routes to insert
     * @param <T> type of handler
     *
     * @return a new tree
     *
     * @throws NullPointerException
     *             if {@code routes} or an element thereof is {@code null}
     */
    static <T> RouteTree<T> of(Iterable<? extends Route<? extends T>> routes) {
        return of(Config.DEFAULT, routes);
    }
    
    /**
     * Creates a tree from the given routes.<p>
     *
     * The routes are inserted in iteration order.
     *
     * @param config tree configuration
     * @param routes to insert
     * @param <T> type of handler
     *
     * @return a new tree
     *
     * @throws NullPointerException
     *             if any argument or route is {@code null}
     * @throws RouteCollisionException
     *             if {@code config} rejects duplicated routes and two routes
     *             have the same method and position
     */
    static <T> RouteTree<T> of(
            Config config, Iterable<? extends Route<? extends T>> routes) {
        RouteTree<T> tree = create(config);
        return tree.insertAll(routes);
    }
    
    /**
     * Registers a handler.
     *
     * @param method  HTTP method
     * @param pattern path pattern (see {@link Route})
     * @param handler to register
     *
     * @return this tree for chaining/fluency
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RouteCollisionException
     *             if {@link Config#rejectDuplicateRoutes()} is enabled and
     *             a handler is already registered for the method and position
     */
    RouteTree<T> insert(String method, String pattern, T handler);
    
    /**
     * Registers a route.
     *
     * @implSpec
     * The default implementation is equivalent to:
     * <pre>
     *     return insert(route.method(), route.pattern(), route.handler());
     * </pre>
     *
     * @param route to register
     *
     * @return this tree for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code route} is {@code null}
     * @throws RouteCollisionException
     *             if {@link Config#rejectDuplicateRoutes()} is enabled and
     *             a handler is already registered for the method and position
     */
    default RouteTree<T> insert(Route<? extends T> route) {
        return insert(route.method(), route.pattern(), route.handler());
    }
    
    /**
     * Registers all given routes in iteration order.
     *
     * @param routes to register
     *
     * @return this tree for chaining/fluency
     *
     * @throws NullPointerException
     *             if {@code routes} or an element thereof is {@code null}
     * @throws RouteCollisionException
     *             if {@link Config#rejectDuplicateRoutes()} is enabled and
     *             a route collides (routes preceding it remain registered)
     */
    default RouteTree<T> insertAll(Iterable<? extends Route<? extends T>> routes) {
        for (Route<? extends T> r : routes) {
            insert(r);
        }
        return this;
    }
    
    /**
     * Copies all routes of another tree into this tree, below the given
     * prefix.<p>
     *
     * The prefix is a pattern like any other. Variable names declared by the
     * prefix precede the names declared by each merged route. For example,
     * merging a tree that has "/:b/:c/test" at prefix ":a" yields a route that
     * matches "/x/y/z/test" with the variables {@code a=x, b=y, c=z}.<p>
     *
     * The literal, variable and wildcard structure of the other tree is
     * preserved. Handlers of the other tree that land on an occupied method
     * and position replace the handler of this tree (subject to
     * {@link Config#rejectDuplicateRoutes()}).<p>
     *
     * The other tree is copied, not linked, and so changes made to it
     * afterwards have no effect on this tree. A tree may be merged into
     * itself.
     *
     * @param prefix where to put the other tree's root
     * @param other tree to copy
     *
     * @return this tree for chaining/fluency
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code other} was not created by this library
     * @throws RouteCollisionException
     *             if {@link Config#rejectDuplicateRoutes()} is enabled and
     *             a merged handler collides (the handlers merged before it
     *             remain registered)
     */
    RouteTree<T> insertSubtree(String prefix, RouteTree<T> other);
    
    /**
     * Returns an immutable snapshot of this tree.<p>
     *
     * The returned router is a deep copy. Subsequent modifications of this
     * tree are not reflected by the snapshot. The snapshot is safe to share
     * among threads without synchronization.
     *
     * @return an immutable router
     */
    Router<T> freeze();
    
    /**
     * Returns the configuration of this tree.
     *
     * @return the configuration of this tree (never {@code null})
     */
    Config config();
}
