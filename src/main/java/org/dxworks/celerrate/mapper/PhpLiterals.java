package org.dxworks.celerrate.mapper;

import java.math.BigInteger;

/**
 * Value decoding for PHP scalar literals.
 */
final class PhpLiterals {

    private PhpLiterals() {
    }

    /**
     * Integer value of a literal, or its double value when it overflows, as PHP does.
     */
    static Number parseInteger(String text) {
        String digits = text.replace("_", "").toLowerCase();
        int radix = 10;
        if (digits.startsWith("0x")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.startsWith("0b")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.startsWith("0o")) {
            radix = 8;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            radix = 8;
            digits = digits.substring(1);
        }
        BigInteger value = new BigInteger(digits, radix);
        if (value.bitLength() > 63) {
            return value.doubleValue();
        }
        return value.longValue();
    }

    static boolean isExplicitOctal(String text) {
        return text.length() > 1 && text.charAt(0) == '0' && (text.charAt(1) == 'o' || text.charAt(1) == 'O');
    }

    static double parseFloat(String text) {
        return Double.parseDouble(text.replace("_", ""));
    }

    /**
     * Body of a single-quoted string: only {@code \\} and {@code \'} are escapes.
     */
    static String decodeSingleQuoted(String body) {
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(i + 1);
                if (next == '\\' || next == '\'') {
                    out.append(next);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Text of a double-quoted or heredoc chunk. Unrecognized escapes are kept as written.
     */
    static String decodeDoubleQuoted(String body) {
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            switch (next) {
                case 'n': out.append('\n'); i += 2; break;
                case 't': out.append('\t'); i += 2; break;
                case 'r': out.append('\r'); i += 2; break;
                case 'v': out.append('\u000B'); i += 2; break;
                case 'e': out.append('\u001B'); i += 2; break;
                case 'f': out.append('\f'); i += 2; break;
                case '\\': out.append('\\'); i += 2; break;
                case '$': out.append('$'); i += 2; break;
                case '"': out.append('"'); i += 2; break;
                case 'x': {
                    int end = scan(body, i + 2, 2, 16);
                    if (end == i + 2) {
                        out.append("\\x");
                    } else {
                        out.append((char) Integer.parseInt(body.substring(i + 2, end), 16));
                    }
                    i = end == i + 2 ? i + 2 : end;
                    break;
                }
                case 'u': {
                    int close = body.indexOf('}', i + 2);
                    if (i + 2 < body.length() && body.charAt(i + 2) == '{' && close > i + 3
                            && close - (i + 3) <= 6 && scan(body, i + 3, 6, 16) == close
                            && Integer.parseInt(body.substring(i + 3, close), 16) <= Character.MAX_CODE_POINT) {
                        out.appendCodePoint(Integer.parseInt(body.substring(i + 3, close), 16));
                        i = close + 1;
                    } else {
                        out.append("\\u");
                        i += 2;
                    }
                    break;
                }
                default: {
                    int end = scan(body, i + 1, 3, 8);
                    if (end > i + 1) {
                        out.append((char) (Integer.parseInt(body.substring(i + 1, end), 8) & 0xFF));
                        i = end;
                    } else {
                        out.append('\\').append(next);
                        i += 2;
                    }
                }
            }
        }
        return out.toString();
    }

    private static int scan(String s, int from, int max, int radix) {
        int end = from;
        while (end < s.length() && end - from < max && Character.digit(s.charAt(end), radix) >= 0) {
            end++;
        }
        return end;
    }
}
