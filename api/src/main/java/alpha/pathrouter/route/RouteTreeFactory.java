package alpha.pathrouter.route;

import alpha.pathrouter.Config;

/**
 * Factory of {@code RouteTree}.<p>
 * 
 * The library does not support custom implementations of the API, and
 * application code should have no use of this type. It is only public because
 * it is a requirement by Java's service-provider mechanism.
 */
@FunctionalInterface
public interface RouteTreeFactory {
    /**
     * Creates a new empty {@code RouteTree}.<p>
     * 
     * This method should only be used by the static method
     * {@link RouteTree#create(Config) RouteTree.create()}.
     * 
     * @param config of tree
     * @param <T> type of handler
     * 
     * @return a new {@code RouteTree}
     * 
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    <T> RouteTree<T> create(Config config);
}
