package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.ArgumentsNode;
import org.pyonjava.frontend.astnode.ClassDefNode;
import org.pyonjava.frontend.astnode.ExceptHandlerNode;
import org.pyonjava.frontend.astnode.ExprContext;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.ForNode;
import org.pyonjava.frontend.astnode.FunctionDefNode;
import org.pyonjava.frontend.astnode.IfNode;
import org.pyonjava.frontend.astnode.KeywordNode;
import org.pyonjava.frontend.astnode.MatchCaseNode;
import org.pyonjava.frontend.astnode.MatchNode;
import org.pyonjava.frontend.astnode.PatternNode;
import org.pyonjava.frontend.astnode.Precedence;
import org.pyonjava.frontend.astnode.StatementNode;
import org.pyonjava.frontend.astnode.TryNode;
import org.pyonjava.frontend.astnode.TupleNode;
import org.pyonjava.frontend.astnode.TypeParamNode;
import org.pyonjava.frontend.astnode.WhileNode;
import org.pyonjava.frontend.astnode.WithItemNode;
import org.pyonjava.frontend.astnode.WithNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;
import org.pyonjava.runtime.ErrorMessageUtil;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.consume;
import static org.pyonjava.parser.TokenUtils.peek;

/**
 * The StatementParser class parses compound statements: those that own a suite
 * ({@code if}, {@code while}, {@code for}, {@code try}, {@code with}, {@code def},
 * {@code class}, {@code match}) and their {@code async} and decorated forms.
 */
public class StatementParser {

    /**
     * Consumes the ':' that ends a compound statement header.
     * <p>
     * When it is missing, the error points just after the last token of the header and
     * suggests the header line with the ':' inserted there.
     *
     * @throws ParseException if the next token is not ':'
     */
    static void consumeColon(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.COLON) {
            consume(parser);
            return;
        }
        LexerToken previous = TokenUtils.previous(parser);
        ErrorMessageUtil errorUtil = parser.ctx.errorUtil;
        String sourceLine = errorUtil.getSourceLine(previous.endLine);
        String suggestion = sourceLine == null ? null : ErrorMessageUtil.insertAt(sourceLine, previous.endColumn, ":");
        throw new ParseException(ParseException.Kind.EXPECTED_TOKEN, previous.endLine, previous.endColumn,
                "Expected ':' but got " + TokenUtils.describe(token), errorUtil, suggestion);
    }

    public static StatementNode parseIf(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        // 'elif' continues the chain as a nested if in the else branch
        if (!TokenUtils.consumeIf(parser, LexerTokenType.ELIF)) {
            consume(parser, LexerTokenType.IF);
        }
        ExpressionNode test = parser.parseNamedExpressionTest();
        consumeColon(parser);
        List<StatementNode> body = ParseBlock.parseBlock(parser);

        List<StatementNode> orElse = List.of();
        if (peek(parser).type == LexerTokenType.ELIF) {
            orElse = List.of(parseIf(parser));
        } else if (peek(parser).type == LexerTokenType.ELSE) {
            orElse = parseElse(parser);
        }
        return new IfNode(test, body, orElse, TokenUtils.spanFrom(parser, start));
    }

    private static List<StatementNode> parseElse(Parser parser) {
        consume(parser, LexerTokenType.ELSE);
        consumeColon(parser);
        return ParseBlock.parseBlock(parser);
    }

    private static List<StatementNode> parseOptionalElse(Parser parser) {
        return peek(parser).type == LexerTokenType.ELSE ? parseElse(parser) : List.of();
    }

    public static StatementNode parseWhile(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.WHILE);
        ExpressionNode test = parser.parseNamedExpressionTest();
        consumeColon(parser);
        List<StatementNode> body = ParseBlock.parseBlock(parser);
        List<StatementNode> orElse = parseOptionalElse(parser);
        return new WhileNode(test, body, orElse, TokenUtils.spanFrom(parser, start));
    }

    public static StatementNode parseFor(Parser parser) {
        return parseFor(parser, false, TokenUtils.startIndex(parser));
    }

    private static StatementNode parseFor(Parser parser, boolean isAsync, int start) {
        consume(parser, LexerTokenType.FOR);
        ExpressionNode target = ListParser.parseTargetList(parser);
        consume(parser, LexerTokenType.IN);
        ExpressionNode iter = parser.parseStarExpressions();
        consumeColon(parser);
        List<StatementNode> body = ParseBlock.parseBlock(parser);
        List<StatementNode> orElse = parseOptionalElse(parser);
        return new ForNode(target, iter, body, orElse, isAsync, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses {@code async def}, {@code async for} or {@code async with}.
     */
    public static StatementNode parseAsync(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.ASYNC);
        switch (peek(parser).type) {
            case DEF:
                return parseFunctionDef(parser, List.of(), start, true);
            case FOR:
                return parseFor(parser, true, start);
            case WITH:
                return parseWith(parser, true, start);
            default:
                throw parser.error(ParseException.Kind.EXPECTED_TOKEN, peek(parser),
                        "Expected 'def', 'for' or 'with' after 'async' but got " + TokenUtils.describe(peek(parser)));
        }
    }

    public static StatementNode parseTry(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.TRY);
        consumeColon(parser);
        List<StatementNode> body = ParseBlock.parseBlock(parser);

        List<ExceptHandlerNode> handlers = new ArrayList<>();
        Boolean isStar = null;
        while (peek(parser).type == LexerTokenType.EXCEPT) {
            int handlerStart = TokenUtils.startIndex(parser);
            LexerToken exceptToken = consume(parser);
            boolean star = TokenUtils.consumeIf(parser, LexerTokenType.STAR);
            if (isStar != null && isStar != star) {
                throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, exceptToken,
                        "Cannot have both 'except' and 'except*' on the same 'try'");
            }
            isStar = star;
            ExpressionNode type = null;
            String name = null;
            if (star || ParserTables.canStartExpression(peek(parser))) {
                type = parser.parseTest();
                if (TokenUtils.consumeIf(parser, LexerTokenType.AS)) {
                    name = TokenUtils.consumeName(parser);
                }
            }
            consumeColon(parser);
            List<StatementNode> handlerBody = ParseBlock.parseBlock(parser);
            handlers.add(new ExceptHandlerNode(type, name, handlerBody, TokenUtils.spanFrom(parser, handlerStart)));
        }

        List<StatementNode> orElse = handlers.isEmpty() ? List.of() : parseOptionalElse(parser);
        List<StatementNode> finalBody = List.of();
        if (TokenUtils.consumeIf(parser, LexerTokenType.FINALLY)) {
            consumeColon(parser);
            finalBody = ParseBlock.parseBlock(parser);
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw parser.error(ParseException.Kind.EXPECTED_TOKEN, peek(parser),
                    "Expected 'except' or 'finally' block but got " + TokenUtils.describe(peek(parser)));
        }
        return new TryNode(body, handlers, orElse, finalBody, Boolean.TRUE.equals(isStar),
                TokenUtils.spanFrom(parser, start));
    }

    public static StatementNode parseWith(Parser parser) {
        return parseWith(parser, false, TokenUtils.startIndex(parser));
    }

    private static StatementNode parseWith(Parser parser, boolean isAsync, int start) {
        consume(parser, LexerTokenType.WITH);
        List<WithItemNode> items = new ArrayList<>();
        if (isParenthesizedWithItems(parser)) {
            consume(parser, LexerTokenType.LPAR);
            while (!TokenUtils.consumeIf(parser, LexerTokenType.RPAR)) {
                items.add(parseWithItem(parser));
                if (peek(parser).type != LexerTokenType.RPAR) {
                    consume(parser, LexerTokenType.COMMA);
                }
            }
        } else {
            do {
                items.add(parseWithItem(parser));
            } while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA));
        }
        consumeColon(parser);
        List<StatementNode> body = ParseBlock.parseBlock(parser);
        return new WithNode(items, body, isAsync, TokenUtils.spanFrom(parser, start));
    }

    // with (a as b, c): the '(' belongs to the statement when its ')' is followed by ':'
    private static boolean isParenthesizedWithItems(Parser parser) {
        if (peek(parser).type != LexerTokenType.LPAR) {
            return false;
        }
        int depth = 0;
        for (int offset = 0; ; offset++) {
            LexerToken token = TokenUtils.peek(parser, offset);
            switch (token.type) {
                case LPAR, LSQB, LBRACE -> depth++;
                case RPAR, RSQB, RBRACE -> {
                    depth--;
                    if (depth == 0) {
                        return TokenUtils.peek(parser, offset + 1).type == LexerTokenType.COLON;
                    }
                }
                case NEWLINE, ENDMARKER -> {
                    return false;
                }
                default -> {
                }
            }
        }
    }

    private static WithItemNode parseWithItem(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        ExpressionNode contextExpr = parser.parseTest();
        ExpressionNode optionalVars = null;
        if (TokenUtils.consumeIf(parser, LexerTokenType.AS)) {
            ExpressionNode target = parser.parseExpression(Precedence.BIT_OR - 1);
            optionalVars = ParserNodeUtils.toTarget(parser, target, ExprContext.STORE);
        }
        return new WithItemNode(contextExpr, optionalVars, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses {@code @decorator NEWLINE} lines and the definition they apply to.
     */
    public static StatementNode parseDecorated(Parser parser) {
        List<ExpressionNode> decorators = new ArrayList<>();
        while (TokenUtils.consumeIf(parser, LexerTokenType.AT)) {
            decorators.add(parser.parseNamedExpressionTest());
            consume(parser, LexerTokenType.NEWLINE);
        }
        int start = TokenUtils.startIndex(parser);
        switch (peek(parser).type) {
            case DEF:
                return parseFunctionDef(parser, decorators, start, false);
            case CLASS:
                return parseClassDef(parser, decorators, start);
            case ASYNC:
                if (TokenUtils.peek(parser, 1).type == LexerTokenType.DEF) {
                    consume(parser);
                    return parseFunctionDef(parser, decorators, start, true);
                }
                break;
            default:
                break;
        }
        throw parser.error(ParseException.Kind.EXPECTED_TOKEN, peek(parser),
                "Expected 'def' or 'class' after decorator but got " + TokenUtils.describe(peek(parser)));
    }

    public static StatementNode parseFunctionDef(Parser parser, List<ExpressionNode> decorators, int start) {
        return parseFunctionDef(parser, decorators, start, false);
    }

    private static StatementNode parseFunctionDef(Parser parser, List<ExpressionNode> decorators, int start,
                                                  boolean isAsync) {
        consume(parser, LexerTokenType.DEF);
        String name = TokenUtils.consumeName(parser);
        List<TypeParamNode> typeParams = SignatureParser.parseTypeParams(parser);
        consume(parser, LexerTokenType.LPAR);
        ArgumentsNode args = SignatureParser.parseParameters(parser, LexerTokenType.RPAR, true);
        consume(parser, LexerTokenType.RPAR);
        ExpressionNode returns = null;
        if (TokenUtils.consumeIf(parser, LexerTokenType.RARROW)) {
            returns = parser.parseTest();
        }
        consumeColon(parser);
        parser.ctx.logDebug("parseFunctionDef " + name + (isAsync ? " (async)" : ""));
        List<StatementNode> body = ParseBlock.parseBlock(parser);
        return new FunctionDefNode(name, args, body, decorators, returns, typeParams, isAsync,
                TokenUtils.spanFrom(parser, start));
    }

    public static StatementNode parseClassDef(Parser parser, List<ExpressionNode> decorators, int start) {
        consume(parser, LexerTokenType.CLASS);
        String name = TokenUtils.consumeName(parser);
        List<TypeParamNode> typeParams = SignatureParser.parseTypeParams(parser);
        List<ExpressionNode> bases = List.of();
        List<KeywordNode> keywords = List.of();
        if (peek(parser).type == LexerTokenType.LPAR) {
            ListParser.CallArguments arguments = ListParser.parseCallArguments(parser);
            bases = arguments.args;
            keywords = arguments.keywords;
        }
        consumeColon(parser);
        parser.ctx.logDebug("parseClassDef " + name);
        List<StatementNode> body = ParseBlock.parseBlock(parser);
        return new ClassDefNode(name, bases, keywords, body, decorators, typeParams, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses {@code match subject: NEWLINE INDENT case+ DEDENT}.
     */
    public static StatementNode parseMatch(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.MATCH);
        int subjectStart = TokenUtils.startIndex(parser);
        ExpressionNode subject = parser.parseStarNamedExpression();
        if (peek(parser).type == LexerTokenType.COMMA) {
            List<ExpressionNode> elements = new ArrayList<>();
            elements.add(subject);
            while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA)) {
                if (peek(parser).type == LexerTokenType.COLON) {
                    break;
                }
                elements.add(parser.parseStarNamedExpression());
            }
            subject = new TupleNode(elements, ExprContext.LOAD, TokenUtils.spanFrom(parser, subjectStart));
        }
        consumeColon(parser);
        consume(parser, LexerTokenType.NEWLINE);
        consume(parser, LexerTokenType.INDENT);

        List<MatchCaseNode> cases = new ArrayList<>();
        while (peek(parser).type == LexerTokenType.CASE) {
            int caseStart = TokenUtils.startIndex(parser);
            consume(parser);
            PatternNode pattern = PatternParser.parseCasePattern(parser);
            ExpressionNode guard = null;
            if (TokenUtils.consumeIf(parser, LexerTokenType.IF)) {
                guard = parser.parseNamedExpressionTest();
            }
            consumeColon(parser);
            List<StatementNode> body = ParseBlock.parseBlock(parser);
            cases.add(new MatchCaseNode(pattern, guard, body, TokenUtils.spanFrom(parser, caseStart)));
        }
        if (peek(parser).type != LexerTokenType.DEDENT && peek(parser).type != LexerTokenType.ENDMARKER) {
            throw parser.error(ParseException.Kind.EXPECTED_TOKEN, peek(parser),
                    "Expected 'case' but got " + TokenUtils.describe(peek(parser)));
        }
        TokenUtils.consumeIf(parser, LexerTokenType.DEDENT);
        return new MatchNode(subject, cases, TokenUtils.spanFrom(parser, start));
    }
}
