package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.ConstantNode;
import org.pyonjava.frontend.astnode.SourceSpan;
import org.pyonjava.lexer.LexerToken;

import java.math.BigInteger;

/**
 * The NumberParser class converts NUMBER tokens into constants.
 * <p>
 * Supported forms:
 * <pre>
 * 42  1_000  0x2A  0o52  0b101010     integers, of any size
 * 1.5  .5  1.  1e10  1.5E-3           floats
 * 3j  1.5J  1e3j                      imaginary numbers
 * </pre>
 */
public class NumberParser {

    /**
     * Parses a numeric literal into a ConstantNode of kind INT, FLOAT or COMPLEX.
     *
     * @param parser The parser, used for error reporting.
     * @param token  The NUMBER token.
     * @return The constant.
     * @throws ParseException if the literal is malformed, such as {@code 0x} or {@code 1__0}.
     */
    public static ConstantNode parseNumber(Parser parser, LexerToken token) {
        SourceSpan span = new SourceSpan(token.line, token.column, token.endLine, token.endColumn);
        String text = token.text;
        if (text.contains("__") || text.endsWith("_")) {
            throw invalid(parser, token);
        }
        String digits = text.replace("_", "");
        try {
            char last = Character.toLowerCase(digits.charAt(digits.length() - 1));
            if (last == 'j') {
                return ConstantNode.ofComplex(Double.parseDouble(digits.substring(0, digits.length() - 1)), span);
            }
            if (digits.length() > 2 && digits.charAt(0) == '0') {
                switch (Character.toLowerCase(digits.charAt(1))) {
                    case 'x':
                        return ConstantNode.ofInt(new BigInteger(digits.substring(2), 16), span);
                    case 'o':
                        return ConstantNode.ofInt(new BigInteger(digits.substring(2), 8), span);
                    case 'b':
                        return ConstantNode.ofInt(new BigInteger(digits.substring(2), 2), span);
                    default:
                        break;
                }
            }
            if (digits.indexOf('.') >= 0 || digits.indexOf('e') >= 0 || digits.indexOf('E') >= 0) {
                return ConstantNode.ofFloat(Double.parseDouble(digits), span);
            }
            return ConstantNode.ofInt(new BigInteger(digits), span);
        } catch (NumberFormatException e) {
            throw invalid(parser, token);
        }
    }

    private static ParseException invalid(Parser parser, LexerToken token) {
        return parser.error(ParseException.Kind.UNEXPECTED_TOKEN, token, "Invalid number literal '" + token.text + "'");
    }
}
