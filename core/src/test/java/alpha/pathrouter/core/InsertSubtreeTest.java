package alpha.pathrouter.core;

import alpha.pathrouter.Config;
import alpha.pathrouter.route.RouteCollisionException;
import alpha.pathrouter.route.RouteTree;
import alpha.pathrouter.route.Router.Match;
import alpha.pathrouter.testutil.LogRecorder;
import org.junit.jupiter.api.Test;

import static alpha.pathrouter.Config.configuration;
import static alpha.pathrouter.HttpConstants.Method.GET;
import static alpha.pathrouter.HttpConstants.Method.POST;
import static java.lang.System.Logger.Level.DEBUG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.mock;

/**
 * Small tests of {@link DefaultRouteTree#insertSubtree(String, RouteTree)}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class InsertSubtreeTest
{
    private final DefaultRouteTree<String>
            testee = new DefaultRouteTree<>(Config.DEFAULT),
            other  = new DefaultRouteTree<>(Config.DEFAULT);
    
    @Test
    void merge_routers() {
        testee.insert(GET, "/path/to/test1", "test1");
        other.insert(GET, "/test2", "test2")
             .insert(GET, "/test3", "test3");
        
        testee.insertSubtree("/path/to", other);
        
        assertHandler(GET, "/path/to/test1", "test1");
        assertHandler(GET, "/path/to/test2", "test2");
        assertHandler(GET, "/path/to/test3", "test3");
        assertNoMatch("/test2");
    }
    
    @Test
    void merge_routers_variables() {
        testee.insert(GET, ":a/:b/:c", "abc");
        other.insert(GET, ":b/:c/test", "bc");
        
        testee.insertSubtree(":a", other);
        
        Match<String> m = testee.find(GET, "/path/to/test1").orElseThrow();
        assertThat(m.handler()).isEqualTo("abc");
        assertThat(m.variables()).containsExactly(
                entry("a", "path"), entry("b", "to"), entry("c", "test1"));
        
        m = testee.find(GET, "/path/to/test1/test").orElseThrow();
        assertThat(m.handler()).isEqualTo("bc");
        assertThat(m.variables()).containsExactly(
                entry("a", "path"), entry("b", "to"), entry("c", "test1"));
        assertThat(m.route().pattern()).isEqualTo("/:a/:b/:c/test");
    }
    
    @Test
    void merge_routers_wildcard() {
        other.insert(GET, "*", "any")
             .insert(GET, "/", "index");
        
        testee.insertSubtree("/static", other);
        
        assertHandler(GET, "/static/a", "any");
        assertHandler(GET, "/static/a/b/c", "any");
        assertHandler(GET, "/static", "index");
        assertNoMatch("/a");
    }
    
    @Test
    void merge_routers_wildcardThenLiteral() {
        testee.insert(GET, "path/to", "test2");
        other.insert(GET, "*/test1", "test1");
        
        testee.insertSubtree("path", other);
        
        assertHandler(GET, "path/to/test1", "test1");
        assertHandler(GET, "path/to/same/test1", "test1");
        assertHandler(GET, "path/to/the/same/test1", "test1");
        assertHandler(GET, "path/to", "test2");
        assertNoMatch("path");
        assertNoMatch("path/test1");
    }
    
    @Test
    void merge_atRoot() {
        other.insert(GET, "/a", "a")
             .insert(POST, "/", "root");
        testee.insertSubtree("/", other);
        assertHandler(GET, "/a", "a");
        assertHandler(POST, "/", "root");
    }
    
    @Test
    void merge_emptyTree() {
        testee.insert(GET, "/a", "a");
        testee.insertSubtree("/b", other);
        assertThat(testee.dump()).containsExactly(entry("GET /a", "a"));
    }
    
    @Test
    void merge_otherUnaffected_andLaterChangesNotReflected() {
        other.insert(GET, "/a", "a");
        testee.insertSubtree("/x", other);
        other.insert(GET, "/b", "b");
        testee.insert(GET, "/x/c", "c");
        
        assertHandler(GET, "/x/a", "a");
        assertNoMatch("/x/b");
        assertThat(other.dump()).containsExactly(
                entry("GET /a", "a"), entry("GET /b", "b"));
    }
    
    @Test
    void merge_self() {
        testee.insert(GET, "/a", "a");
        testee.insertSubtree("/b", testee);
        assertHandler(GET, "/a", "a");
        assertHandler(GET, "/b/a", "a");
        assertNoMatch("/b/b/a");
    }
    
    @Test
    void merge_replacesAndLogs() {
        var log = LogRecorder.startRecording();
        try {
            testee.insert(GET, "/api/:id", "old");
            other.insert(GET, "/:key", "new");
            testee.insertSubtree("/api", other);
            
            var m = testee.find(GET, "/api/1").orElseThrow();
            assertThat(m.handler()).isEqualTo("new");
            assertThat(m.variables()).containsExactly(entry("key", "1"));
            
            log.assertRemove(DEBUG, "Route \"GET /api/:key\" replaced route \"GET /api/:id\".")
               .assertRemove(DEBUG, "Merged subtree at \"/api\"")
               .assertNoProblem();
        } finally {
            log.stopRecording();
        }
    }
    
    @Test
    void merge_rejected() {
        var strict = new DefaultRouteTree<String>(
                configuration().rejectDuplicateRoutes(true).build());
        strict.insert(GET, "/api/x", "old");
        other.insert(GET, "/x", "new");
        assertThatThrownBy(() -> strict.insertSubtree("/api", other))
                .isExactlyInstanceOf(RouteCollisionException.class)
                .hasMessage("Route \"GET /api/x\" is equivalent to an already added route \"GET /api/x\".");
        assertThat(strict.find(GET, "/api/x").orElseThrow().handler())
                .isEqualTo("old");
    }
    
    @Test
    void foreignImplementation() {
        @SuppressWarnings("unchecked")
        RouteTree<String> foreign = mock(RouteTree.class);
        assertThatThrownBy(() -> testee.insertSubtree("/", foreign))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unsupported implementation: ");
    }
    
    @Test
    void npe() {
        assertThatThrownBy(() -> testee.insertSubtree(null, other))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> testee.insertSubtree("/", null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    private void assertHandler(String method, String path, String expected) {
        assertThat(testee.find(method, path))
                .as(method + " " + path)
                .map(Match::handler)
                .contains(expected);
    }
    
    private void assertNoMatch(String path) {
        assertThat(testee.find(GET, path))
                .as(path)
                .isEmpty();
    }
}
