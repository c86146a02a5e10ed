package alpha.pathrouter.core;

import alpha.pathrouter.route.Router;

import java.util.Optional;

import static java.lang.System.Logger.Level.TRACE;
import static java.util.Objects.requireNonNull;

/**
 * An immutable router.<p>
 * 
 * Created by {@link DefaultRouteTree#freeze()} from a frozen copy of the
 * tree. All state is reachable from a final field and so an instance may be
 * shared freely among threads.
 * 
 * @param <T> type of handler
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class FrozenRouter<T> implements Router<T>
{
    private static final System.Logger LOG
            = System.getLogger(FrozenRouter.class.getPackageName());
    
    private final Node<T> root;
    
    FrozenRouter(Node<T> root) {
        this.root = root;
    }
    
    @Override
    public Optional<Match<T>> find(String method, String path) {
        requireNonNull(method);
        requireNonNull(path);
        Optional<Match<T>> m = Optional.ofNullable(Matcher.find(root, method, path));
        LOG.log(TRACE, () -> "Lookup of " + method + " \"" + path + "\" gave " + m);
        return m;
    }
}
