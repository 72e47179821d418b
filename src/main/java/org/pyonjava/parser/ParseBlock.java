package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.ModuleNode;
import org.pyonjava.frontend.astnode.StatementNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.peek;

/**
 * Parses statement sequences: the module, and the indented suite after a compound
 * statement header.
 */
public class ParseBlock {

    /**
     * Parses statements until the end of input.
     */
    public static ModuleNode parseModule(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        List<StatementNode> body = new ArrayList<>();
        while (true) {
            LexerToken token = peek(parser);
            if (token.type == LexerTokenType.ENDMARKER) {
                break;
            }
            if (token.type == LexerTokenType.NEWLINE) {
                TokenUtils.consume(parser);
                continue;
            }
            if (token.type == LexerTokenType.INDENT || token.type == LexerTokenType.DEDENT) {
                throw parser.unexpected();
            }
            ParseStatement.parseStatement(parser, body);
        }
        return new ModuleNode(body, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses the suite of a compound statement, after its ':'.
     * <p>
     * The suite is either an indented block {@code NEWLINE INDENT statement+ DEDENT}
     * or simple statements on the same line: {@code if x: pass}.
     *
     * @return The statements of the suite, never empty.
     * @throws ParseException if the indented block is missing.
     */
    public static List<StatementNode> parseBlock(Parser parser) {
        List<StatementNode> statements = new ArrayList<>();
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.ENDMARKER) {
            throw expectedBlock(parser, token);
        }
        if (token.type != LexerTokenType.NEWLINE) {
            ParseStatement.parseSimpleStatements(parser, statements);
            return statements;
        }

        TokenUtils.consume(parser);
        token = peek(parser);
        if (token.type != LexerTokenType.INDENT) {
            throw expectedBlock(parser, token);
        }
        TokenUtils.consume(parser);
        while (true) {
            LexerTokenType type = peek(parser).type;
            if (type == LexerTokenType.DEDENT || type == LexerTokenType.ENDMARKER) {
                break;
            }
            if (type == LexerTokenType.INDENT) {
                throw parser.unexpected();
            }
            ParseStatement.parseStatement(parser, statements);
        }
        TokenUtils.consumeIf(parser, LexerTokenType.DEDENT);
        return statements;
    }

    private static ParseException expectedBlock(Parser parser, LexerToken token) {
        return parser.error(ParseException.Kind.EXPECTED_TOKEN, token,
                "Expected an indented block but got " + TokenUtils.describe(token));
    }
}
