package alpha.pathrouter;

import alpha.pathrouter.route.RouteTree;

/**
 * Namespace of constants related to the HTTP protocol.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * HTTP methods are included on the first line of a request and indicates
     * the desired action to be performed on a server-side resource.<p>
     * 
     * The method is a case-sensitive string and can be anything. The
     * {@link RouteTree} compares methods using {@link String#equals(Object)},
     * which means that a route registered for "get" will not be found using
     * "GET". The constants declared in this class are the methods registered
     * in the <a href="https://www.iana.org/assignments/http-methods">IANA
     * method registry</a> which are in common use.
     */
    public static final class Method {
        private Method() {
            // Private
        }
        
        /**
         * Used to retrieve a server resource.<p>
         * 
         * Safe? Yes. Idempotent? Yes. Response cacheable? Yes.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.1">RFC 7231 §4.3.1</a>
         */
        public static final String GET = "GET";
        
        /**
         * Same as {@link #GET}, except the response must exclude the message
         * body.<p>
         * 
         * Safe? Yes. Idempotent? Yes. Response cacheable? Yes.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.2">RFC 7231 §4.3.2</a>
         */
        public static final String HEAD = "HEAD";
        
        /**
         * Submits data to a target processor on the server.<p>
         * 
         * Safe? No. Idempotent? No. Response cacheable? Yes.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.3">RFC 7231 §4.3.3</a>
         */
        public static final String POST = "POST";
        
        /**
         * Creates or replaces the target resource.<p>
         * 
         * Safe? No. Idempotent? Yes. Response cacheable? No.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.4">RFC 7231 §4.3.4</a>
         */
        public static final String PUT = "PUT";
        
        /**
         * Removes the target resource.<p>
         * 
         * Safe? No. Idempotent? Yes. Response cacheable? No.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.5">RFC 7231 §4.3.5</a>
         */
        public static final String DELETE = "DELETE";
        
        /**
         * Requests a tunnel to the destination origin server.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.6">RFC 7231 §4.3.6</a>
         */
        public static final String CONNECT = "CONNECT";
        
        /**
         * Requests information about the communication options available for
         * the target resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.7">RFC 7231 §4.3.7</a>
         */
        public static final String OPTIONS = "OPTIONS";
        
        /**
         * Requests a loop-back of the request message.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.8">RFC 7231 §4.3.8</a>
         */
        public static final String TRACE = "TRACE";
        
        /**
         * Applies partial modifications to the target resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc5789#section-2">RFC 5789 §2</a>
         */
        public static final String PATCH = "PATCH";
    }
}
