package alpha.pathrouter.core;

import alpha.pathrouter.route.RouteCollisionException;
import alpha.pathrouter.route.RouteTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static alpha.pathrouter.Config.configuration;
import static alpha.pathrouter.HttpConstants.Method.GET;
import static alpha.pathrouter.HttpConstants.Method.POST;
import static alpha.pathrouter.route.Routes.get;
import static alpha.pathrouter.route.Routes.post;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Small tests of the static factories of {@link RouteTree}, which locate
 * {@link DefaultRouteTreeFactory} as a service provider.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class DefaultRouteTreeFactoryTest
{
    @Test
    void create() {
        RouteTree<String> t = RouteTree.create();
        assertThat(t).isExactlyInstanceOf(DefaultRouteTree.class);
        assertThat(t.config().rejectDuplicateRoutes()).isFalse();
    }
    
    @Test
    void create_withConfig() {
        var c = configuration().rejectDuplicateRoutes(true).build();
        assertThat(RouteTree.create(c).config()).isSameAs(c);
    }
    
    @Test
    void of_varargs() {
        RouteTree<String> t = RouteTree.of(
                get("/user/:id", "show"),
                post("/user/:id", "save"));
        assertThat(t.find(GET, "/user/1").orElseThrow().handler()).isEqualTo("show");
        assertThat(t.find(POST, "/user/1").orElseThrow().handler()).isEqualTo("save");
    }
    
    @Test
    void of_iterable_laterRouteWins() {
        RouteTree<String> t = RouteTree.of(List.of(
                get("/a/:x", "first"),
                get("/a/:y", "second")));
        var m = t.find(GET, "/a/1").orElseThrow();
        assertThat(m.handler()).isEqualTo("second");
        assertThat(m.variables()).containsExactly(entry("y", "1"));
    }
    
    @Test
    void insertAll_partialOnCollision() {
        var t = RouteTree.<String>create(
                configuration().rejectDuplicateRoutes(true).build());
        assertThatThrownBy(() -> t.insertAll(List.of(
                    get("/a", "a"),
                    get("/a", "again"),
                    get("/b", "b"))))
                .isExactlyInstanceOf(RouteCollisionException.class);
        assertThat(t.find(GET, "/a").orElseThrow().handler()).isEqualTo("a");
        assertThat(t.find(GET, "/b")).isEmpty();
    }
    
    @Test
    void of_npe() {
        assertThatThrownBy(() -> RouteTree.of(get("/", "h"), null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
