package alpha.pathrouter.core;

import alpha.pathrouter.Config;
import alpha.pathrouter.route.RouteCollisionException;
import alpha.pathrouter.route.RouteTree;
import alpha.pathrouter.route.Router;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import static alpha.pathrouter.core.Segments.concat;
import static alpha.pathrouter.core.Segments.isVariable;
import static alpha.pathrouter.core.Segments.join;
import static alpha.pathrouter.core.Segments.split;
import static alpha.pathrouter.core.Segments.variableName;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static java.text.MessageFormat.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link RouteTree}.
 * 
 * @param <T> type of handler
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultRouteTree<T> implements RouteTree<T>
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouteTree.class.getPackageName());
    
    /*
     * Implementation note:
     * 
     * Handlers are stored in the tree as node items, keyed by method. Literal
     * segment values are keyed as-is, variable segments all go to the one
     * variable child and wildcards to the one wildcard child. User provided
     * variable names are not part of the tree structure, they are irrelevant,
     * it is the route's hierarchical position in the tree that is relevant.
     * The names are stored with the item and only used when constructing the
     * Match object. I.e., route "/user/:id/file/*" will be stored as:
     * 
     *   root -> "user" -> variable -> "file" -> wildcard -> {GET -> item}
     */
    
    private final Config config;
    private final Node<T> root;
    
    DefaultRouteTree(Config config) {
        this.config = requireNonNull(config);
        this.root = new Node<>();
    }
    
    @Override
    public RouteTree<T> insert(String method, String pattern, T handler) {
        requireNonNull(method);
        requireNonNull(handler);
        final List<String> segments = split(prepare(pattern));
        descend(root, segments, 0, List.of(), (target, names) ->
                put(target, method, new Node.Item<>(handler, names, segments)));
        LOG.log(TRACE, () -> "Inserted " + method + " \"" + join(segments) + "\"");
        return this;
    }
    
    @Override
    public RouteTree<T> insertSubtree(String prefix, RouteTree<T> other) {
        requireNonNull(other);
        if (!(other instanceof DefaultRouteTree<T> that)) {
            throw new IllegalArgumentException(
                    "Unsupported implementation: " + other.getClass().getName());
        }
        final List<String> segments = split(prepare(prefix));
        // Copy first, the other tree may be this tree
        final Node<T> source = that.root.copy(false);
        descend(root, segments, 0, List.of(), (target, names) ->
                merge(target, source, names, segments));
        LOG.log(DEBUG, () -> "Merged subtree at \"" + join(segments) + "\"");
        return this;
    }
    
    @Override
    public Optional<Match<T>> find(String method, String path) {
        requireNonNull(method);
        requireNonNull(path);
        Optional<Match<T>> m = Optional.ofNullable(Matcher.find(root, method, path));
        LOG.log(TRACE, () -> "Lookup of " + method + " \"" + path + "\" gave " + m);
        return m;
    }
    
    @Override
    public Router<T> freeze() {
        return new FrozenRouter<>(root.copy(true));
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    private String prepare(String pattern) {
        return config.trimPatterns() ? pattern.strip() : requireNonNull(pattern);
    }
    
    @FunctionalInterface
    private interface Destination<T> {
        void accept(Node<T> target, List<String> variableNames);
    }
    
    /**
     * Walk the tree along the given pattern segments, creating nodes as
     * needed, then pass the final node and the accumulated variable names to
     * the destination.
     * 
     * @param n current node
     * @param segments pattern segments
     * @param pos index of next segment
     * @param names variable names accumulated so far
     * @param dest receiver of final node
     */
    private static <T> void descend(
            Node<T> n, List<String> segments, int pos,
            List<String> names, Destination<T> dest)
    {
        if (pos == segments.size()) {
            dest.accept(n, names);
            return;
        }
        final String s = segments.get(pos);
        descend(n.nextOrCreate(s), segments, pos + 1,
                isVariable(s) ? concat(names, List.of(variableName(s))) : names,
                dest);
    }
    
    /**
     * Recursively copy all items and children of a source node into a
     * target node.
     * 
     * @param target node to receive
     * @param source node to copy
     * @param names variable names of the prefix
     * @param prefix pattern segments of the target node
     */
    private void merge(
            Node<T> target, Node<T> source,
            List<String> names, List<String> prefix)
    {
        source.forEachItem((method, i) -> {
            put(target, method, new Node.Item<>(
                    i.handler(),
                    concat(names, i.variableNames()),
                    concat(prefix, i.segments())));
        });
        
        source.forEachStaticChild((s, c) ->
                merge(target.staticOrCreate(s), c, names, prefix));
        
        if (source.variableChild() != null) {
            merge(target.variableOrCreate(), source.variableChild(), names, prefix);
        }
        
        if (source.wildcardChild() != null) {
            merge(target.wildcardOrCreate(), source.wildcardChild(), names, prefix);
        }
    }
    
    private void put(Node<T> target, String method, Node.Item<T> newGuy) {
        final Node.Item<T> oldGuy = target.item(method);
        if (oldGuy != null) {
            if (config.rejectDuplicateRoutes()) {
                throw new RouteCollisionException(format(
                        "Route \"{0} {1}\" is equivalent to an already added route \"{0} {2}\".",
                        method, newGuy.pattern(), oldGuy.pattern()));
            }
            LOG.log(DEBUG, () -> format(
                    "Route \"{0} {1}\" replaced route \"{0} {2}\".",
                    method, newGuy.pattern(), oldGuy.pattern()));
        }
        target.setItem(method, newGuy);
    }
    
    /**
     * Flatten the tree and dump all items; designed for tests only.<p>
     * 
     * The key is the method and the normalized pattern separated by a space,
     * e.g. "GET /user/:id". For a route inserted using
     * {@link #insertSubtree(String, RouteTree)}, the variable names of the
     * pattern are those given by the merged item's own list of names.
     * 
     * @return a sorted map of all registered handlers
     */
    Map<String, T> dump() {
        SortedMap<String, T> m = new TreeMap<>();
        dump(root, 0, m);
        return Collections.unmodifiableMap(m);
    }
    
    private static <T> void dump(Node<T> n, int depth, Map<String, T> sink) {
        if (n == null) {
            return;
        }
        n.forEachItem((method, i) -> {
            assert i.segments().size() == depth;
            sink.put(method + " " + i.pattern(), i.handler());
        });
        n.forEachStaticChild((s, c) -> dump(c, depth + 1, sink));
        dump(n.variableChild(), depth + 1, sink);
        dump(n.wildcardChild(), depth + 1, sink);
    }
}
