package alpha.pathrouter.route;

import static java.util.Objects.requireNonNull;

/**
 * A handler registered for an HTTP method and a path pattern.<p>
 * 
 * The pattern consists of segments separated by a forward slash. A segment
 * that starts with a colon is a <i>variable</i>; it matches exactly one
 * non-empty segment of the request path and the text following the colon is
 * the name by which the matched text can be retrieved from the
 * {@link Router.Match#variables() match}. A segment that is a single asterisk
 * is a <i>wildcard</i>; it matches one or more segments of the request path.
 * Any other segment is <i>literal</i> and matches only identical text.<p>
 * 
 * One leading and one trailing forward slash are optional and have no effect.
 * The empty pattern and "/" both denote the root.
 * 
 * <pre>
 *   Route registered: /user/:id
 *   
 *   Request path:
 *   /user/123            match, id = 123
 *   /user/foo            match, id = foo
 *   /user                no match (missing segment value)
 *   /user/foo/profile    no match (unknown segment "profile")
 *   
 *   Route registered: /src/*
 *   
 *   /src/a               match
 *   /src/a/b/c           match
 *   /src                 no match (wildcard requires at least one segment)
 * </pre>
 * 
 * A pattern is accepted as given; no validation takes place. For example, the
 * segment ":" declares a variable whose name is the empty string.<p>
 * 
 * The handler type is chosen by the application. It could be a functional
 * interface that receives the request, or anything else.
 * 
 * @param method  HTTP method, compared case-sensitively
 * @param pattern path pattern
 * @param handler handler of the route
 * @param <T> type of handler
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Routes
 */
public record Route<T>(String method, String pattern, T handler)
{
    /**
     * Constructs this object.
     * 
     * @param method  HTTP method
     * @param pattern path pattern
     * @param handler handler of the route
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public Route {
        requireNonNull(method);
        requireNonNull(pattern);
        requireNonNull(handler);
    }
    
    @Override
    public String toString() {
        return method + " " + pattern;
    }
}
