package org.pyonjava.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Enumeration of the token types produced by the {@link Lexer}.
 * <p>
 * Keywords and operators carry their fixed source text, which is used to build the
 * lookup tables of the lexer. Token types whose text varies (names, literals,
 * comments) and the structural tokens have no fixed text.
 */
public enum LexerTokenType {
    // Variable text
    NAME,
    NUMBER,
    STRING,
    FSTRING,
    COMMENT,

    // Structure
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER,
    ERRORTOKEN,

    // Keywords
    FALSE("False", true),
    NONE("None", true),
    TRUE("True", true),
    AND("and", true),
    AS("as", true),
    ASSERT("assert", true),
    ASYNC("async", true),
    AWAIT("await", true),
    BREAK("break", true),
    CLASS("class", true),
    CONTINUE("continue", true),
    DEF("def", true),
    DEL("del", true),
    ELIF("elif", true),
    ELSE("else", true),
    EXCEPT("except", true),
    FINALLY("finally", true),
    FOR("for", true),
    FROM("from", true),
    GLOBAL("global", true),
    IF("if", true),
    IMPORT("import", true),
    IN("in", true),
    IS("is", true),
    LAMBDA("lambda", true),
    NONLOCAL("nonlocal", true),
    NOT("not", true),
    OR("or", true),
    PASS("pass", true),
    RAISE("raise", true),
    RETURN("return", true),
    TRY("try", true),
    WHILE("while", true),
    WITH("with", true),
    YIELD("yield", true),

    // Soft keywords
    MATCH("match", true),
    CASE("case", true),
    TYPE("type", true),

    // Three-character operators
    LEFTSHIFTEQUAL("<<="),
    RIGHTSHIFTEQUAL(">>="),
    DOUBLESTAREQUAL("**="),
    DOUBLESLASHEQUAL("//="),
    ELLIPSIS("..."),

    // Two-character operators
    EQEQUAL("=="),
    NOTEQUAL("!="),
    LESSEQUAL("<="),
    GREATEREQUAL(">="),
    LEFTSHIFT("<<"),
    RIGHTSHIFT(">>"),
    DOUBLESTAR("**"),
    DOUBLESLASH("//"),
    RARROW("->"),
    COLONEQUAL(":="),
    PLUSEQUAL("+="),
    MINEQUAL("-="),
    STAREQUAL("*="),
    SLASHEQUAL("/="),
    PERCENTEQUAL("%="),
    ATEQUAL("@="),
    AMPEREQUAL("&="),
    VBAREQUAL("|="),
    CIRCUMFLEXEQUAL("^="),

    // One-character operators and delimiters
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    AT("@"),
    AMPER("&"),
    VBAR("|"),
    CIRCUMFLEX("^"),
    TILDE("~"),
    LESS("<"),
    GREATER(">"),
    LPAR("("),
    RPAR(")"),
    LSQB("["),
    RSQB("]"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    COLON(":"),
    DOT("."),
    SEMI(";"),
    EQUAL("=");

    private static final Map<String, LexerTokenType> KEYWORDS;
    private static final Map<String, LexerTokenType> OPERATORS;

    static {
        Map<String, LexerTokenType> keywords = new HashMap<>();
        Map<String, LexerTokenType> operators = new HashMap<>();
        for (LexerTokenType type : values()) {
            if (type.text == null) {
                continue;
            }
            if (type.keyword) {
                keywords.put(type.text, type);
            } else {
                operators.put(type.text, type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
        OPERATORS = Collections.unmodifiableMap(operators);
    }

    private final String text;
    private final boolean keyword;

    LexerTokenType() {
        this(null, false);
    }

    LexerTokenType(String text) {
        this(text, false);
    }

    LexerTokenType(String text, boolean keyword) {
        this.text = text;
        this.keyword = keyword;
    }

    /**
     * Looks up the keyword token type for an identifier.
     *
     * @param word the identifier text
     * @return the keyword type, or null if the word is an ordinary name
     */
    public static LexerTokenType keyword(String word) {
        return KEYWORDS.get(word);
    }

    /**
     * Looks up an operator or delimiter by its exact text.
     *
     * @param text one to three characters of source text
     * @return the operator type, or null if the text is not an operator
     */
    public static LexerTokenType operator(String text) {
        return OPERATORS.get(text);
    }

    /**
     * Returns the fixed source text of this token type, or null for token types
     * whose text varies.
     */
    public String getText() {
        return text;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Soft keywords are reserved only in specific syntactic positions.
     */
    public boolean isSoftKeyword() {
        return this == MATCH || this == CASE || this == TYPE;
    }
}
