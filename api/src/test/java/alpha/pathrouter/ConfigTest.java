package alpha.pathrouter;

import org.junit.jupiter.api.Test;

import static alpha.pathrouter.Config.DEFAULT;
import static alpha.pathrouter.Config.configuration;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class ConfigTest {
    @Test
    void defaults() {
        assertThat(DEFAULT.rejectDuplicateRoutes()).isFalse();
        assertThat(DEFAULT.trimPatterns()).isTrue();
    }
    
    @Test
    void parentStateUnaffected() {
        final var mod = DEFAULT.toBuilder().rejectDuplicateRoutes(true).build();
        
        // Default not modified
        assertThat(DEFAULT.rejectDuplicateRoutes()).isFalse();
        // Mod is
        assertThat(mod.rejectDuplicateRoutes()).isTrue();
        assertThat(mod.trimPatterns()).isTrue();
    }
    
    @Test
    void lastModificationWins() {
        var c = configuration()
                .trimPatterns(false)
                .rejectDuplicateRoutes(true)
                .trimPatterns(true)
                .build();
        assertThat(c.trimPatterns()).isTrue();
        assertThat(c.rejectDuplicateRoutes()).isTrue();
    }
    
    @Test
    void toBuilder_usesInstanceAsTemplate() {
        var first = configuration().trimPatterns(false).build();
        var second = first.toBuilder().rejectDuplicateRoutes(true).build();
        assertThat(second.trimPatterns()).isFalse();
        assertThat(second.rejectDuplicateRoutes()).isTrue();
        // First is unaffected
        assertThat(first.rejectDuplicateRoutes()).isFalse();
    }
    
    @Test
    void builderIsReusable() {
        var b = configuration().rejectDuplicateRoutes(true);
        assertThat(b.build().rejectDuplicateRoutes())
                .isEqualTo(b.build().rejectDuplicateRoutes())
                .isTrue();
    }
}
