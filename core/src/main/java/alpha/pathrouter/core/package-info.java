/**
 * Default implementation of the route tree.<p>
 * 
 * The tree is a hierarchy of {@link alpha.pathrouter.core.Node nodes}, built
 * by {@link alpha.pathrouter.core.DefaultRouteTree} and searched by
 * {@link alpha.pathrouter.core.Matcher}. Application code should only depend
 * on the API, see {@link alpha.pathrouter.route.RouteTree}.
 */
package alpha.pathrouter.core;
