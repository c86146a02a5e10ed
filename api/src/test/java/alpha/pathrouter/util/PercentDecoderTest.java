package alpha.pathrouter.util;

import org.junit.jupiter.api.Test;

import static alpha.pathrouter.util.PercentDecoder.decode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link PercentDecoder}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class PercentDecoderTest
{
    @Test
    void nothingToDecode() {
        assertThat(decode("")).isEmpty();
        assertThat(decode("/a/b")).isEqualTo("/a/b");
    }
    
    @Test
    void space() {
        assertThat(decode("John%20Doe")).isEqualTo("John Doe");
    }
    
    @Test
    void utf8() {
        assertThat(decode("%C3%A5%C3%A4%C3%B6")).isEqualTo("åäö");
    }
    
    @Test
    void plusIsKept() {
        assertThat(decode("a+b")).isEqualTo("a+b");
        assertThat(decode("a+%20+b")).isEqualTo("a+ +b");
        assertThat(decode("+%2B+")).isEqualTo("+++");
    }
    
    @Test
    void malformed_returnedAsIs() {
        assertThat(decode("%")).isEqualTo("%");
        assertThat(decode("100%zz")).isEqualTo("100%zz");
        assertThat(decode("%2")).isEqualTo("%2");
    }
    
    @Test
    void invalidUtf8_returnedAsIs() {
        assertThat(decode("%FF")).isEqualTo("%FF");
        assertThat(decode("/a%FFb")).isEqualTo("/a%FFb");
        // Truncated two-byte sequence
        assertThat(decode("%C3")).isEqualTo("%C3");
    }
    
    @Test
    void literalNonAscii_keptAlongsideEscapes() {
        assertThat(decode("å%20ö")).isEqualTo("å ö");
    }
    
    @Test
    void npe() {
        assertThatThrownBy(() -> decode((String) null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
