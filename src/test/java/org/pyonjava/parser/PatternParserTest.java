package org.pyonjava.parser;

import org.junit.jupiter.api.Test;
import org.pyonjava.frontend.astnode.*;
import org.pyonjava.scriptengine.PyLanguageProvider;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PatternParserTest {

    private static MatchNode match(String source) {
        ModuleNode module = PyLanguageProvider.parse(source);
        return assertInstanceOf(MatchNode.class, module.body.get(0));
    }

    // Parses "match v:" with a single case using the given pattern
    private static PatternNode pattern(String pattern) {
        MatchNode match = match("match v:\n    case " + pattern + ":\n        pass\n");
        assertEquals(1, match.cases.size());
        return match.cases.get(0).pattern;
    }

    @Test
    public void testSequenceWithStar() {
        MatchNode match = match("match v:\n    case [1, *rest]:\n        pass");
        assertEquals("v", ((NameNode) match.subject).id);
        assertEquals(1, match.cases.size());
        MatchCaseNode matchCase = match.cases.get(0);
        assertNull(matchCase.guard);
        assertInstanceOf(PassNode.class, matchCase.body.get(0));

        MatchSequenceNode sequence = assertInstanceOf(MatchSequenceNode.class, matchCase.pattern);
        assertEquals(2, sequence.patterns.size());
        MatchValueNode value = assertInstanceOf(MatchValueNode.class, sequence.patterns.get(0));
        assertEquals(BigInteger.ONE, ((ConstantNode) value.value).value);
        MatchStarNode star = assertInstanceOf(MatchStarNode.class, sequence.patterns.get(1));
        assertEquals("rest", star.name);
    }

    @Test
    public void testOpenSequence() {
        MatchSequenceNode sequence = assertInstanceOf(MatchSequenceNode.class, pattern("a, *_"));
        assertEquals(2, sequence.patterns.size());
        assertNull(((MatchStarNode) sequence.patterns.get(1)).name);

        MatchSequenceNode tuple = assertInstanceOf(MatchSequenceNode.class, pattern("(x,)"));
        assertEquals(1, tuple.patterns.size());
        assertInstanceOf(MatchSequenceNode.class, pattern("()"));
    }

    @Test
    public void testCaptureAndWildcard() {
        MatchAsNode capture = assertInstanceOf(MatchAsNode.class, pattern("x"));
        assertNull(capture.pattern);
        assertEquals("x", capture.name);

        MatchAsNode wildcard = assertInstanceOf(MatchAsNode.class, pattern("_"));
        assertNull(wildcard.pattern);
        assertNull(wildcard.name);

        // a parenthesized pattern is only a group
        assertInstanceOf(MatchAsNode.class, pattern("(y)"));
    }

    @Test
    public void testSingletons() {
        MatchSingletonNode none = assertInstanceOf(MatchSingletonNode.class, pattern("None"));
        assertEquals(ConstantNode.Kind.NONE, ((ConstantNode) none.value).kind);
        assertInstanceOf(MatchSingletonNode.class, pattern("True"));
    }

    @Test
    public void testLiteralValues() {
        MatchValueNode negative = assertInstanceOf(MatchValueNode.class, pattern("-1"));
        assertEquals(UnaryOperator.USUB, assertInstanceOf(UnaryOpNode.class, negative.value).op);

        MatchValueNode complex = assertInstanceOf(MatchValueNode.class, pattern("1 + 2j"));
        BinOpNode sum = assertInstanceOf(BinOpNode.class, complex.value);
        assertEquals(ConstantNode.Kind.COMPLEX, ((ConstantNode) sum.right).kind);

        MatchValueNode string = assertInstanceOf(MatchValueNode.class, pattern("'a' 'b'"));
        assertEquals("ab", ((ConstantNode) string.value).value);

        MatchValueNode dotted = assertInstanceOf(MatchValueNode.class, pattern("Color.RED"));
        assertEquals("RED", assertInstanceOf(AttributeNode.class, dotted.value).attr);
    }

    @Test
    public void testOrAndAs() {
        MatchAsNode as = assertInstanceOf(MatchAsNode.class, pattern("1 | 2 | 3 as n"));
        assertEquals("n", as.name);
        MatchOrNode or = assertInstanceOf(MatchOrNode.class, as.pattern);
        assertEquals(3, or.patterns.size());
    }

    @Test
    public void testMapping() {
        MatchMappingNode mapping = assertInstanceOf(MatchMappingNode.class,
                pattern("{'kind': 'point', 1: x, Key.ID: _, **rest}"));
        assertEquals(3, mapping.keys.size());
        assertEquals(3, mapping.patterns.size());
        assertInstanceOf(AttributeNode.class, mapping.keys.get(2));
        assertEquals("rest", mapping.rest);
    }

    @Test
    public void testClassPattern() {
        MatchClassNode cls = assertInstanceOf(MatchClassNode.class, pattern("geo.Point(0, y=[a, b], z=_)"));
        assertInstanceOf(AttributeNode.class, cls.cls);
        assertEquals(1, cls.patterns.size());
        assertEquals(List.of("y", "z"), cls.kwdAttrs);
        assertInstanceOf(MatchSequenceNode.class, cls.kwdPatterns.get(0));
    }

    @Test
    public void testGuardAndSeveralCases() {
        MatchNode match = match(String.join("\n",
                "match command.split():",
                "    case [action] if action in ACTIONS:",
                "        run(action)",
                "    case [action, obj]:",
                "        run(action, obj)",
                "    case _:",
                "        fail()",
                ""));
        assertInstanceOf(CallNode.class, match.subject);
        assertEquals(3, match.cases.size());
        assertInstanceOf(CompareNode.class, match.cases.get(0).guard);
        assertNull(match.cases.get(1).guard);
    }

    @Test
    public void testTupleSubject() {
        MatchNode match = match("match a, b:\n    case x, y:\n        pass\n");
        assertInstanceOf(TupleNode.class, match.subject);
    }

    @Test
    public void testPatternErrors() {
        ParseException wildcardTarget = assertThrows(ParseException.class, () -> pattern("x as _"));
        assertEquals(ParseException.Kind.INVALID_TARGET, wildcardTarget.getKind());

        ParseException order = assertThrows(ParseException.class, () -> pattern("Point(x=1, 2)"));
        assertTrue(order.getMessage().startsWith("Positional patterns follow keyword patterns"));

        ParseException restLast = assertThrows(ParseException.class, () -> pattern("{**rest, 'a': 1}"));
        assertTrue(restLast.getMessage().startsWith("'**' pattern must be the last in a mapping"));
    }
}
