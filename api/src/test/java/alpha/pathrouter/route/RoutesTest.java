package alpha.pathrouter.route;

import org.junit.jupiter.api.Test;

import static alpha.pathrouter.HttpConstants.Method.DELETE;
import static alpha.pathrouter.HttpConstants.Method.GET;
import static alpha.pathrouter.HttpConstants.Method.HEAD;
import static alpha.pathrouter.HttpConstants.Method.PATCH;
import static alpha.pathrouter.HttpConstants.Method.POST;
import static alpha.pathrouter.HttpConstants.Method.PUT;
import static alpha.pathrouter.route.Routes.delete;
import static alpha.pathrouter.route.Routes.get;
import static alpha.pathrouter.route.Routes.head;
import static alpha.pathrouter.route.Routes.post;
import static alpha.pathrouter.route.Routes.put;
import static alpha.pathrouter.route.Routes.route;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Routes} and {@link Route}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class RoutesTest
{
    @Test
    void methodShortcuts() {
        assertThat(get("/a", "h").method()).isEqualTo(GET);
        assertThat(head("/a", "h").method()).isEqualTo(HEAD);
        assertThat(post("/a", "h").method()).isEqualTo(POST);
        assertThat(put("/a", "h").method()).isEqualTo(PUT);
        assertThat(delete("/a", "h").method()).isEqualTo(DELETE);
    }
    
    @Test
    void route_keepsComponentsAsGiven() {
        var r = route(PATCH, " /x/:y ", 123);
        assertThat(r.method()).isEqualTo(PATCH);
        // Trimming is the tree's business
        assertThat(r.pattern()).isEqualTo(" /x/:y ");
        assertThat(r.handler()).isEqualTo(123);
    }
    
    @Test
    void toString_methodAndPattern() {
        assertThat(get("/user/:id", "h")).hasToString("GET /user/:id");
    }
    
    @Test
    void equality() {
        assertThat(get("/a", "h")).isEqualTo(route(GET, "/a", "h"));
        assertThat(get("/a", "h")).isNotEqualTo(post("/a", "h"));
    }
    
    @Test
    void nullArguments() {
        assertThatThrownBy(() -> route(null, "/", "h"))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> get(null, "h"))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> get("/", null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
