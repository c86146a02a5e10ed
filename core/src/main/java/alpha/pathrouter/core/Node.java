package alpha.pathrouter.core;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

import static alpha.pathrouter.core.Segments.isVariable;
import static alpha.pathrouter.core.Segments.isWildcard;

/**
 * A node of the route tree.<p>
 * 
 * No node in the tree store its key. Instead, the node's position defines the
 * key which is effectively split into segments and distributed across the
 * branch. All descendants of a node share a common key prefix and the root is
 * the only node associated with the empty key.<p>
 * 
 * A node holds zero or more items, at most one per HTTP method, and three
 * kinds of children: literal children keyed by the segment text, at most one
 * variable child and at most one wildcard child. The name of a variable is
 * not part of the structure; it is stored by the item.<p>
 * 
 * Each child is owned by one parent only; there are no shared nodes and no
 * links back up the tree. A node is either mutable or frozen, see
 * {@link #copy(boolean)}. Mutating methods invoked on a frozen node throw
 * {@link UnsupportedOperationException}.
 * 
 * @param <T> type of handler
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Node<T>
{
    /**
     * A handler with the ordered names of the variables declared by the
     * pattern, root to leaf, and the segments of the pattern.
     * 
     * @param handler handler
     * @param variableNames names of variables
     * @param segments segments of the pattern
     * @param <T> type of handler
     */
    record Item<T>(T handler, List<String> variableNames, List<String> segments) {
        Item {
            assert handler != null;
            assert variableNames != null;
            assert segments != null;
        }
        
        /**
         * Returns the normalized pattern.
         * 
         * @return the normalized pattern
         */
        String pattern() {
            return Segments.join(segments);
        }
    }
    
    private final Map<String, Item<T>> items;
    // Literal children
    private final Map<String, Node<T>> statics;
    private final boolean frozen;
    private Node<T> variable,
                    wildcard;
    
    Node() {
        items   = new HashMap<>();
        statics = new HashMap<>();
        frozen  = false;
    }
    
    private Node(Node<T> source, boolean freeze) {
        Map<String, Node<T>> kids = new HashMap<>();
        source.statics.forEach((k, n) -> kids.put(k, n.copy(freeze)));
        if (freeze) {
            items   = Map.copyOf(source.items);
            statics = Map.copyOf(kids);
        } else {
            items   = new HashMap<>(source.items);
            statics = kids;
        }
        variable = source.variable == null ? null : source.variable.copy(freeze);
        wildcard = source.wildcard == null ? null : source.wildcard.copy(freeze);
        frozen   = freeze;
    }
    
    /**
     * Returns a deep copy of this node.<p>
     * 
     * Items are immutable and shared with the copy. The handlers are never
     * copied.
     * 
     * @param freeze {@code true} if the copy must be unmodifiable
     * 
     * @return a deep copy of this node
     */
    Node<T> copy(boolean freeze) {
        return new Node<>(this, freeze);
    }
    
    /**
     * Returns the item of the given method.
     * 
     * @param method HTTP method
     * 
     * @return the item, or {@code null} if not present
     */
    Item<T> item(String method) {
        return items.get(method);
    }
    
    /**
     * Sets the item of the given method.
     * 
     * @param method HTTP method
     * @param item to set
     * 
     * @return the previous item, or {@code null} if there was none
     */
    Item<T> setItem(String method, Item<T> item) {
        requireMutable();
        return items.put(method, item);
    }
    
    void forEachItem(BiConsumer<String, Item<T>> action) {
        items.forEach(action);
    }
    
    Node<T> staticChild(String segment) {
        return statics.get(segment);
    }
    
    void forEachStaticChild(BiConsumer<String, Node<T>> action) {
        statics.forEach(action);
    }
    
    Node<T> variableChild() {
        return variable;
    }
    
    Node<T> wildcardChild() {
        return wildcard;
    }
    
    /**
     * Traverse the tree to the child node that represents the given pattern
     * segment, creating the child if it does not exist.<p>
     * 
     * "*" goes to the wildcard child, a segment that starts with ':' goes to
     * the variable child, and everything else to the literal child keyed by
     * the segment.
     * 
     * @param segment of a pattern
     * 
     * @return the child node (never {@code null})
     */
    Node<T> nextOrCreate(String segment) {
        if (isWildcard(segment)) {
            return wildcardOrCreate();
        }
        if (isVariable(segment)) {
            return variableOrCreate();
        }
        return staticOrCreate(segment);
    }
    
    Node<T> staticOrCreate(String segment) {
        requireMutable();
        return statics.computeIfAbsent(segment, keyIgnored -> new Node<>());
    }
    
    Node<T> variableOrCreate() {
        requireMutable();
        var v = variable;
        return v != null ? v : (variable = new Node<>());
    }
    
    Node<T> wildcardOrCreate() {
        requireMutable();
        var w = wildcard;
        return w != null ? w : (wildcard = new Node<>());
    }
    
    private void requireMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("Node is frozen.");
        }
    }
}
