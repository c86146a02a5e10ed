package alpha.pathrouter.testutil;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Handler;
import java.util.logging.Logger;

import static alpha.pathrouter.testutil.LogRecords.toJUL;
import static java.lang.System.Logger.Level;

/**
 * Logging utilities.<p>
 * 
 * The library logs using {@link System.Logger}, which by default is backed by
 * {@code java.util.logging}. This class operates on the JUL loggers of the
 * library's packages.<p>
 * 
 * A JUL logger is only weakly referenced by the log manager, and a level set
 * on a logger that has been garbage collected is lost. This class therefore
 * keeps a strong reference to each logger it has configured.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging {
    private Logging() {
        // Empty
    }
    
    private static final Map<String, Logger> KEEP = new ConcurrentHashMap<>();
    
    /**
     * Set logging level for the package of a given component.<p>
     * 
     * Loggers of sub-packages inherit the level, unless they have a level of
     * their own.
     * 
     * @param component to extract package from
     * @param level to set
     * 
     * @return the level previously set, or {@code null} if none was set
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static java.util.logging.Level setLevel(Class<?> component, Level level) {
        final java.util.logging.Level impl = toJUL(level);
        Logger l = logger(component);
        var old = l.getLevel();
        l.setLevel(impl);
        return old;
    }
    
    /**
     * Restore a level previously returned by {@link #setLevel(Class, Level)}.
     * 
     * @param component to extract package from
     * @param level to restore (may be {@code null})
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void restoreLevel(Class<?> component, java.util.logging.Level level) {
        logger(component).setLevel(level);
    }
    
    /**
     * Add handler to the logger of the package that the component belongs to.
     * 
     * @param component to extract package from
     * @param handler to add
     * 
     * @throws NullPointerException
     *             if {@code component} is {@code null}
     *             (should also be the case for {@code handler})
     */
    public static void addHandler(Class<?> component, Handler handler) {
        logger(component).addHandler(handler);
    }
    
    /**
     * Remove handler from the logger of the package that the component belongs to.
     * 
     * This method returns silently if the given handler is not found or
     * {@code null}.
     * 
     * @param component to extract package from
     * @param handler to remove (may be {@code null})
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        logger(component).removeHandler(handler);
    }
    
    private static Logger logger(Class<?> component) {
        return KEEP.computeIfAbsent(component.getPackageName(), Logger::getLogger);
    }
}
