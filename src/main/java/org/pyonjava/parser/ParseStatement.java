package org.pyonjava.parser;

import org.pyonjava.frontend.astnode.AliasNode;
import org.pyonjava.frontend.astnode.AnnAssignNode;
import org.pyonjava.frontend.astnode.AssertNode;
import org.pyonjava.frontend.astnode.AssignNode;
import org.pyonjava.frontend.astnode.AugAssignNode;
import org.pyonjava.frontend.astnode.BinaryOperator;
import org.pyonjava.frontend.astnode.BreakNode;
import org.pyonjava.frontend.astnode.ContinueNode;
import org.pyonjava.frontend.astnode.DeleteNode;
import org.pyonjava.frontend.astnode.ExprContext;
import org.pyonjava.frontend.astnode.ExprStmtNode;
import org.pyonjava.frontend.astnode.ExpressionNode;
import org.pyonjava.frontend.astnode.GlobalNode;
import org.pyonjava.frontend.astnode.ImportFromNode;
import org.pyonjava.frontend.astnode.ImportNode;
import org.pyonjava.frontend.astnode.NameNode;
import org.pyonjava.frontend.astnode.NonlocalNode;
import org.pyonjava.frontend.astnode.PassNode;
import org.pyonjava.frontend.astnode.Precedence;
import org.pyonjava.frontend.astnode.RaiseNode;
import org.pyonjava.frontend.astnode.ReturnNode;
import org.pyonjava.frontend.astnode.StatementNode;
import org.pyonjava.frontend.astnode.TypeAliasNode;
import org.pyonjava.frontend.astnode.TypeParamNode;
import org.pyonjava.lexer.LexerToken;
import org.pyonjava.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.pyonjava.parser.TokenUtils.consume;
import static org.pyonjava.parser.TokenUtils.peek;

/**
 * The ParseStatement class dispatches on the first token of a statement.
 * Compound statements are delegated to {@link StatementParser}; simple statements,
 * which may share a line separated by ';', are parsed here.
 */
public class ParseStatement {

    /**
     * Parses one statement line (or one compound statement) and appends the result.
     *
     * @param parser     The parser instance.
     * @param statements Receives the statements; a simple statement line may add several.
     */
    public static void parseStatement(Parser parser, List<StatementNode> statements) {
        LexerToken token = peek(parser);
        parser.ctx.logDebug("parseStatement: " + token);

        switch (token.type) {
            case AT:
                statements.add(StatementParser.parseDecorated(parser));
                return;
            case DEF:
                statements.add(StatementParser.parseFunctionDef(parser, List.of(), TokenUtils.startIndex(parser)));
                return;
            case CLASS:
                statements.add(StatementParser.parseClassDef(parser, List.of(), TokenUtils.startIndex(parser)));
                return;
            case IF:
                statements.add(StatementParser.parseIf(parser));
                return;
            case WHILE:
                statements.add(StatementParser.parseWhile(parser));
                return;
            case FOR:
                statements.add(StatementParser.parseFor(parser));
                return;
            case TRY:
                statements.add(StatementParser.parseTry(parser));
                return;
            case WITH:
                statements.add(StatementParser.parseWith(parser));
                return;
            case ASYNC:
                statements.add(StatementParser.parseAsync(parser));
                return;
            case MATCH:
                if (isMatchStatement(parser)) {
                    statements.add(StatementParser.parseMatch(parser));
                    return;
                }
                parser.ctx.logDebug("soft keyword 'match' used as a name");
                break;
            default:
                break;
        }
        parseSimpleStatements(parser, statements);
    }

    /**
     * Parses {@code simple_stmt (';' simple_stmt)* [';']} and the end of the line.
     */
    public static void parseSimpleStatements(Parser parser, List<StatementNode> statements) {
        while (true) {
            statements.add(parseSimpleStatement(parser));
            if (!TokenUtils.consumeIf(parser, LexerTokenType.SEMI)
                    || ParserTables.STATEMENT_END.contains(peek(parser).type)) {
                break;
            }
        }
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.NEWLINE) {
            consume(parser);
        } else if (token.type != LexerTokenType.ENDMARKER && token.type != LexerTokenType.DEDENT) {
            throw parser.unexpected();
        }
    }

    private static StatementNode parseSimpleStatement(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        LexerToken token = peek(parser);

        switch (token.type) {
            case PASS:
                consume(parser);
                return new PassNode(TokenUtils.spanFrom(parser, start));
            case BREAK:
                consume(parser);
                return new BreakNode(TokenUtils.spanFrom(parser, start));
            case CONTINUE:
                consume(parser);
                return new ContinueNode(TokenUtils.spanFrom(parser, start));
            case RETURN:
                consume(parser);
                ExpressionNode returned = atStatementEnd(parser) ? null : parser.parseStarExpressions();
                return new ReturnNode(returned, TokenUtils.spanFrom(parser, start));
            case RAISE:
                return parseRaise(parser);
            case GLOBAL:
                consume(parser);
                return new GlobalNode(parseNames(parser), TokenUtils.spanFrom(parser, start));
            case NONLOCAL:
                consume(parser);
                return new NonlocalNode(parseNames(parser), TokenUtils.spanFrom(parser, start));
            case DEL:
                return parseDelete(parser);
            case ASSERT:
                consume(parser);
                ExpressionNode test = parser.parseTest();
                ExpressionNode msg = TokenUtils.consumeIf(parser, LexerTokenType.COMMA) ? parser.parseTest() : null;
                return new AssertNode(test, msg, TokenUtils.spanFrom(parser, start));
            case IMPORT:
                return parseImport(parser);
            case FROM:
                return parseImportFrom(parser);
            case TYPE:
                if (isTypeAlias(parser)) {
                    return parseTypeAlias(parser);
                }
                parser.ctx.logDebug("soft keyword 'type' used as a name");
                return parseExpressionStatement(parser);
            default:
                return parseExpressionStatement(parser);
        }
    }

    private static boolean atStatementEnd(Parser parser) {
        return ParserTables.STATEMENT_END.contains(peek(parser).type);
    }

    /**
     * A line starting with 'match' is a match statement when its header ends with ':'
     * and the next line opens a block starting with 'case'.
     */
    static boolean isMatchStatement(Parser parser) {
        for (int offset = 1; ; offset++) {
            LexerToken token = TokenUtils.peek(parser, offset);
            if (token.type == LexerTokenType.ENDMARKER) {
                return false;
            }
            if (token.type == LexerTokenType.NEWLINE) {
                return offset > 1
                        && TokenUtils.peek(parser, offset - 1).type == LexerTokenType.COLON
                        && TokenUtils.peek(parser, offset + 1).type == LexerTokenType.INDENT
                        && TokenUtils.peek(parser, offset + 2).type == LexerTokenType.CASE;
            }
        }
    }

    /**
     * 'type' starts a type alias when followed by a name and then '=' or '['.
     */
    static boolean isTypeAlias(Parser parser) {
        if (!TokenUtils.peek(parser, 1).isName()) {
            return false;
        }
        LexerTokenType next = TokenUtils.peek(parser, 2).type;
        return next == LexerTokenType.EQUAL || next == LexerTokenType.LSQB;
    }

    private static StatementNode parseTypeAlias(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.TYPE);
        int nameStart = TokenUtils.startIndex(parser);
        String name = TokenUtils.consumeName(parser);
        NameNode target = new NameNode(name, ExprContext.STORE, TokenUtils.spanFrom(parser, nameStart));
        List<TypeParamNode> typeParams = SignatureParser.parseTypeParams(parser);
        consume(parser, LexerTokenType.EQUAL);
        ExpressionNode value = parser.parseTest();
        return new TypeAliasNode(target, typeParams, value, TokenUtils.spanFrom(parser, start));
    }

    private static StatementNode parseRaise(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.RAISE);
        ExpressionNode exc = null;
        ExpressionNode cause = null;
        if (!atStatementEnd(parser)) {
            exc = parser.parseTest();
            if (TokenUtils.consumeIf(parser, LexerTokenType.FROM)) {
                cause = parser.parseTest();
            }
        }
        return new RaiseNode(exc, cause, TokenUtils.spanFrom(parser, start));
    }

    private static List<String> parseNames(Parser parser) {
        List<String> names = new ArrayList<>();
        do {
            names.add(TokenUtils.consumeName(parser));
        } while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA));
        return names;
    }

    private static StatementNode parseDelete(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.DEL);
        List<ExpressionNode> targets = new ArrayList<>();
        do {
            if (atStatementEnd(parser)) {
                break;
            }
            ExpressionNode target = parser.parseExpression(Precedence.BIT_OR - 1);
            targets.add(ParserNodeUtils.toTarget(parser, target, ExprContext.DEL));
        } while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA));
        if (targets.isEmpty()) {
            throw parser.unexpected();
        }
        return new DeleteNode(targets, TokenUtils.spanFrom(parser, start));
    }

    private static StatementNode parseImport(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.IMPORT);
        List<AliasNode> names = new ArrayList<>();
        do {
            int aliasStart = TokenUtils.startIndex(parser);
            String name = parseDottedName(parser);
            String asname = TokenUtils.consumeIf(parser, LexerTokenType.AS) ? TokenUtils.consumeName(parser) : null;
            names.add(new AliasNode(name, asname, TokenUtils.spanFrom(parser, aliasStart)));
        } while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA));
        return new ImportNode(names, TokenUtils.spanFrom(parser, start));
    }

    /**
     * Parses {@code from [.]* [module] import (names | '(' names ')' | '*')}.
     * An ellipsis token counts as three dots.
     */
    private static StatementNode parseImportFrom(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        consume(parser, LexerTokenType.FROM);
        int level = 0;
        while (true) {
            if (TokenUtils.consumeIf(parser, LexerTokenType.DOT)) {
                level++;
            } else if (TokenUtils.consumeIf(parser, LexerTokenType.ELLIPSIS)) {
                level += 3;
            } else {
                break;
            }
        }
        String module = null;
        if (peek(parser).type != LexerTokenType.IMPORT || level == 0) {
            module = parseDottedName(parser);
        }
        consume(parser, LexerTokenType.IMPORT);

        List<AliasNode> names = new ArrayList<>();
        if (peek(parser).type == LexerTokenType.STAR) {
            int aliasStart = TokenUtils.startIndex(parser);
            consume(parser);
            names.add(new AliasNode("*", null, TokenUtils.spanFrom(parser, aliasStart)));
        } else {
            boolean parenthesized = TokenUtils.consumeIf(parser, LexerTokenType.LPAR);
            do {
                if (parenthesized && peek(parser).type == LexerTokenType.RPAR) {
                    break;
                }
                int aliasStart = TokenUtils.startIndex(parser);
                String name = TokenUtils.consumeName(parser);
                String asname = TokenUtils.consumeIf(parser, LexerTokenType.AS) ? TokenUtils.consumeName(parser) : null;
                names.add(new AliasNode(name, asname, TokenUtils.spanFrom(parser, aliasStart)));
            } while (TokenUtils.consumeIf(parser, LexerTokenType.COMMA));
            if (parenthesized) {
                consume(parser, LexerTokenType.RPAR);
            }
            if (names.isEmpty()) {
                throw parser.unexpected();
            }
        }
        return new ImportFromNode(module, names, level, TokenUtils.spanFrom(parser, start));
    }

    private static String parseDottedName(Parser parser) {
        StringBuilder name = new StringBuilder(TokenUtils.consumeName(parser));
        while (TokenUtils.consumeIf(parser, LexerTokenType.DOT)) {
            name.append('.').append(TokenUtils.consumeName(parser));
        }
        return name.toString();
    }

    /**
     * Parses an expression statement, which may turn out to be an assignment:
     * <pre>
     * x: int = 1        annotated assignment
     * x += 1            augmented assignment
     * a = b = 1, 2      assignment with two targets
     * f(x)              expression
     * </pre>
     */
    static StatementNode parseExpressionStatement(Parser parser) {
        int start = TokenUtils.startIndex(parser);
        boolean startsWithParenthesis = peek(parser).type == LexerTokenType.LPAR;
        ExpressionNode first = parseAssignmentValue(parser);
        LexerToken token = peek(parser);

        if (token.type == LexerTokenType.COLON) {
            consume(parser);
            ExpressionNode target = ParserNodeUtils.toSingleTarget(parser, first, "Invalid target for type annotation");
            ExpressionNode annotation = parser.parseTest();
            ExpressionNode value = null;
            if (TokenUtils.consumeIf(parser, LexerTokenType.EQUAL)) {
                value = parseAssignmentValue(parser);
            }
            boolean simple = target instanceof NameNode && !startsWithParenthesis;
            return new AnnAssignNode(target, annotation, value, simple, TokenUtils.spanFrom(parser, start));
        }

        BinaryOperator augmented = ParserTables.AUGMENTED_ASSIGN.get(token.type);
        if (augmented != null) {
            consume(parser);
            ExpressionNode target = ParserNodeUtils.toSingleTarget(parser, first, "Invalid augmented assignment target");
            ExpressionNode value = parseAssignmentValue(parser);
            return new AugAssignNode(target, augmented, value, TokenUtils.spanFrom(parser, start));
        }

        if (token.type == LexerTokenType.EQUAL) {
            List<ExpressionNode> targets = new ArrayList<>();
            ExpressionNode value = first;
            while (TokenUtils.consumeIf(parser, LexerTokenType.EQUAL)) {
                targets.add(ParserNodeUtils.toTarget(parser, value, ExprContext.STORE));
                value = parseAssignmentValue(parser);
            }
            return new AssignNode(targets, value, TokenUtils.spanFrom(parser, start));
        }

        return new ExprStmtNode(first, TokenUtils.spanFrom(parser, start));
    }

    // The right-hand side of '=' may be a bare yield
    private static ExpressionNode parseAssignmentValue(Parser parser) {
        if (peek(parser).type == LexerTokenType.YIELD) {
            return ParsePrimary.parseYield(parser);
        }
        ExpressionNode value = parser.parseStarExpressions();
        if (peek(parser).type == LexerTokenType.COLONEQUAL) {
            throw parser.error(ParseException.Kind.UNEXPECTED_TOKEN, peek(parser),
                    "Assignment expression must be parenthesized here");
        }
        return value;
    }
}
