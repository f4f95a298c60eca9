package jsonwriter;

import java.io.IOException;

/**
 * Escapes text into the body of a JSON string literal.
 *
 * <p> Only code units below {@code 0x80} ever need escaping. Every unit at or above {@code 0x80}, surrogates
 * included, is copied through untouched, so a surrogate pair is never split and unescaped runs can be appended
 * as ranges of the input.
 *
 * @since 0.1.0
 */
final class StringEscaper {

    private static final char UNICODE = 'u';
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /**
     * Replacement per code unit: {@code 0} for none, {@link #UNICODE} for <code>&#92;u00XX</code>, otherwise the
     * letter following the backslash.
     */
    private static final char[] REPLACEMENTS = replacements();

    private StringEscaper() {
        throw new UnsupportedOperationException();
    }

    static void writeQuoted(Appendable out, CharSequence s) throws IOException {
        out.append('"');
        writeEscaped(out, s);
        out.append('"');
    }

    static void writeEscaped(Appendable out, CharSequence s) throws IOException {
        int flushed = 0;
        int len = s.length();
        for (int i = 0; i < len; i++) {
            char c = s.charAt(i);
            if (c >= REPLACEMENTS.length) continue;
            char replacement = REPLACEMENTS[c];
            if (replacement == 0) continue;

            if (flushed < i) out.append(s, flushed, i);
            if (replacement == UNICODE) {
                out.append('\\').append('u').append('0').append('0');
                out.append(HEX[c >> 4]).append(HEX[c & 0xF]);
            } else {
                out.append('\\').append(replacement);
            }
            flushed = i + 1;
        }
        if (flushed < len) out.append(s, flushed, len);
    }

    private static char[] replacements() {
        // 0x80..0xFF stay 0: they are never escaped
        var table = new char[256];
        table['"'] = '"';
        table['\\'] = '\\';
        table['/'] = '/';
        for (char c = 0; c < 0x20; c++) table[c] = UNICODE;
        table['\b'] = 'b';
        table['\f'] = 'f';
        table['\n'] = 'n';
        table['\r'] = 'r';
        table['\t'] = 't';
        return table;
    }
}
