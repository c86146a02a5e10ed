package alpha.pathrouter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final boolean rejectDuplicateRoutes,
                          trimPatterns;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder               = b;
        rejectDuplicateRoutes = s.rejectDuplicateRoutes;
        trimPatterns          = s.trimPatterns;
    }
    
    @Override
    public boolean rejectDuplicateRoutes() {
        return rejectDuplicateRoutes;
    }
    
    @Override
    public boolean trimPatterns() {
        return trimPatterns;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "rejectDuplicateRoutes=" + rejectDuplicateRoutes +
                ", trimPatterns=" + trimPatterns + '}';
    }
    
    /**
     * Builders are backwards-linked in a chain and the only real state they
     * each store is a modifying action, which is replayed against a mutable
     * state container when the configuration is built.
     */
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            boolean rejectDuplicateRoutes = false,
                    trimPatterns          = true;
        }
        
        private final DefaultBuilder prev;
        private final Consumer<MutableState> modifier;
        
        private DefaultBuilder() {
            prev = null;
            modifier = null;
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            this.prev = requireNonNull(prev);
            this.modifier = requireNonNull(modifier);
        }
        
        @Override
        public Builder rejectDuplicateRoutes(boolean newVal) {
            return new DefaultBuilder(this, s -> s.rejectDuplicateRoutes = newVal);
        }
        
        @Override
        public Builder trimPatterns(boolean newVal) {
            return new DefaultBuilder(this, s -> s.trimPatterns = newVal);
        }
        
        @Override
        public Config build() {
            Deque<Consumer<MutableState>> mods = new ArrayDeque<>();
            for (var b = this; b.modifier != null; b = b.prev) {
                mods.addFirst(b.modifier);
            }
            MutableState s = new MutableState();
            mods.forEach(m -> m.accept(s));
            return new DefaultConfig(this, s);
        }
    }
}
