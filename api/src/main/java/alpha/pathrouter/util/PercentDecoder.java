package alpha.pathrouter.util;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Util for percent-decoding.<p>
 * 
 * Escape sequences are decoded as UTF-8. Unlike
 * {@link java.net.URLDecoder#decode(String, java.nio.charset.Charset)}, the plus
 * character is kept as-is; it is only a space in the form content type, not
 * in a request-target.<p>
 * 
 * A string with a malformed escape sequence, e.g. "%" or "%zz", or with
 * escaped bytes that are not valid UTF-8, e.g. "%FF", is returned as-is.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see RequestTarget
 */
public final class PercentDecoder
{
    private static final System.Logger LOG
            = System.getLogger(PercentDecoder.class.getPackageName());
    
    private PercentDecoder() {
        // Empty
    }
    
    /**
     * Percent-decode the given string.
     * 
     * @param str string to decode (non-null)
     * @return a decoded string
     * @throws NullPointerException if {@code str} is {@code null}
     */
    public static String decode(String str) {
        if (str.indexOf('%') == -1) {
            // Nothing to decode
            return str;
        }
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(str.length());
        int i = 0;
        while (i < str.length()) {
            final int pct = str.indexOf('%', i);
            if (pct == -1) {
                bytes.writeBytes(str.substring(i).getBytes(UTF_8));
                break;
            }
            bytes.writeBytes(str.substring(i, pct).getBytes(UTF_8));
            final int hi = pct + 2 < str.length() ? Character.digit(str.charAt(pct + 1), 16) : -1,
                      lo = hi == -1 ? -1 : Character.digit(str.charAt(pct + 2), 16);
            if (lo == -1) {
                LOG.log(DEBUG, () -> "Malformed escape sequence, leaving as-is: " + str);
                return str;
            }
            bytes.write((hi << 4) | lo);
            i = pct + 3;
        }
        try {
            return UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes.toByteArray()))
                    .toString();
        } catch (CharacterCodingException e) {
            LOG.log(DEBUG, () -> "Escaped bytes are not UTF-8, leaving as-is: " + str);
            return str;
        }
    }
}
