package astro.asp.parser;

import astro.asp.core.ScriptModel.*;
import astro.asp.errors.ScriptSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionParser 单元测试
 */
class ExpressionParserTest {

  // ============================================================
  // 运算记号
  // ============================================================

  @Test
  void testMathKeepsFlatTokenOrder() throws Exception {
    List<MathToken> tokens = ExpressionParser.parseMath("a + b * 2", 1);
    assertEquals(List.of(new Reference("a"), Operator.ADD, new Reference("b"), Operator.MUL, new Literal(2.0)), tokens,
        "不处理优先级，只保留扁平顺序");
  }

  @Test
  void testMultiCharacterOperatorsMatchFirst() throws Exception {
    assertEquals(List.of(new Reference("c"), Operator.CEQ, new Literal(2.0)), ExpressionParser.parseMath("c == 2", 1));
    assertEquals(List.of(new Reference("x"), Operator.CSE, new Literal(1.0)), ExpressionParser.parseMath("x<=1", 1));
    assertEquals(List.of(new Reference("x"), Operator.CLE, new Literal(1.0)), ExpressionParser.parseMath("x >= 1", 1));
    assertEquals(List.of(new Reference("x"), Operator.NOT, new Reference("y")), ExpressionParser.parseMath("x != y", 1));
  }

  @Test
  void testBracketsAndAllSingleOperators() throws Exception {
    List<MathToken> tokens = ExpressionParser.parseMath("(1 - 2) / 3 < 4 > 5", 1);
    assertEquals(List.of(Operator.BRO, new Literal(1.0), Operator.SUB, new Literal(2.0), Operator.BRC,
        Operator.DIV, new Literal(3.0), Operator.CSM, new Literal(4.0), Operator.CLG, new Literal(5.0)), tokens);
  }

  @Test
  void testExpressionWithoutOperatorIsInvalid() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> ExpressionParser.parseMath("x", 7));
    assertEquals(7, e.getLine());
    assertTrue(e.getMessage().contains("Invalid equation"));
  }

  // ============================================================
  // 参数切分
  // ============================================================

  @Test
  void testArgsSplitOnTopLevelCommasOnly() throws Exception {
    List<Value> args = ExpressionParser.parseArgs("[1,2,3], \"x,y\"", 1);
    assertEquals(2, args.size(), "数组与字符串内的逗号不切分");
    assertEquals(new Array(List.of(new Num(1), new Num(2), new Num(3))), args.get(0));
    assertEquals(new Str("x,y"), args.get(1));
  }

  @Test
  void testBlankArgsAreEmpty() throws Exception {
    assertEquals(List.of(), ExpressionParser.parseArgs("  ", 1));
  }

  @Test
  void testModuleCallArgumentsStayTogether() throws Exception {
    List<Value> args = ExpressionParser.parseArgs("io.fmt(a, 2), 3", 1);
    assertEquals(List.of(
        new CallE("io", "fmt", List.of(new Var("a"), new Num(2))),
        new Num(3)), args);
  }

  // ============================================================
  // 值归类
  // ============================================================

  @Test
  void testScalars() throws Exception {
    assertEquals(new Bool(true), ExpressionParser.parseValue("True", 1));
    assertEquals(new Bool(false), ExpressionParser.parseValue(" False ", 1));
    assertEquals(new Num(3.5), ExpressionParser.parseValue("3.5", 1));
    assertEquals(new Num(-2), ExpressionParser.parseValue("-2", 1));
    assertEquals(new Var("count"), ExpressionParser.parseValue("count", 1));
    assertEquals(new Elm("items", 3), ExpressionParser.parseValue("items[3]", 1));
  }

  @Test
  void testNestedAndEmptyArrays() throws Exception {
    assertEquals(new Array(List.of()), ExpressionParser.parseValue("[]", 1));
    assertEquals(new Array(List.of(new Array(List.of(new Num(1), new Num(2))), new Str("a"))),
        ExpressionParser.parseValue("[[1, 2], \"a\"]", 1));
  }

  @Test
  void testModuleReferenceWithoutParensIsZeroArgCall() throws Exception {
    assertEquals(new CallE("time", "now", List.of()), ExpressionParser.parseValue("time.now", 1));
  }

  @Test
  void testModuleCallWithStringArgument() throws Exception {
    assertEquals(new CallE("io", "read", List.of(new Str("a.txt"))), ExpressionParser.parseValue("io.read(\"a.txt\")", 1));
  }

  @Test
  void testUnquotedNonIdentifierBecomesMath() throws Exception {
    Value v = ExpressionParser.parseValue("x*2", 1);
    assertEquals(new MathE(List.of(new Reference("x"), Operator.MUL, new Literal(2.0))), v);
  }

  @Test
  void testInvalidVariableName() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> ExpressionParser.parseValue("a$b", 4));
    assertEquals(4, e.getLine());
    assertTrue(e.getMessage().contains("Invalid variable name"));
  }

  @Test
  void testEscapeSequences() throws Exception {
    Value v = ExpressionParser.parseValue("\"line1\\nline2\\q\"", 1);
    assertEquals(new Str("line1\nline2\""), v);
    assertEquals(new Str("a\tb\rc\bd"), ExpressionParser.parseValue("\"a\\tb\\rc\\bd\"", 1));
  }

  @Test
  void testStringFollowedByExtraTextIsInvalidFormat() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class,
        () -> ExpressionParser.parseValue("\"a\" + b", 2));
    assertTrue(e.getMessage().contains("Invalid variable format"));
  }

  @Test
  void testUnbalancedQuotesInValue() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class,
        () -> ExpressionParser.parseValue("\"a\" + \"b", 2));
    assertTrue(e.getMessage().contains("Incorrect string formatting"));
  }

  @Test
  void testEnclosedBy() {
    assertTrue(ExpressionParser.enclosedBy("(a, (b))", 0, '(', ')'));
    assertFalse(ExpressionParser.enclosedBy("(1) + g(2)", 0, '(', ')'));
    assertFalse(ExpressionParser.enclosedBy("", 0, '[', ']'));
  }
}
