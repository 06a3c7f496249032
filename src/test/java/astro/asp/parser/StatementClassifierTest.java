package astro.asp.parser;

import astro.asp.core.ScriptModel.*;
import astro.asp.errors.ScriptSyntaxException;
import astro.asp.parser.StatementClassifier.ClassifiedLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatementClassifier 单元测试：每种语句形态及其错误。
 */
class StatementClassifierTest {

  private StatementClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new StatementClassifier("data");
  }

  private Stmt classify(String text) throws Exception {
    return classifier.classify(new SourceLine(5, 0, text));
  }

  @Test
  void testImportAndDelete() throws Exception {
    Import imp = assertInstanceOf(Import.class, classify("import math"));
    assertEquals("math", imp.name);
    assertEquals(5, imp.line);
    Delete del = assertInstanceOf(Delete.class, classify("delete counter"));
    assertEquals("counter", del.var);
  }

  @Test
  void testEmptyImportAndDeleteFail() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> classify("import"));
    assertTrue(e.getMessage().contains("Import statement cannot be empty"));
    assertEquals(5, e.getLine());
    e = assertThrows(ScriptSyntaxException.class, () -> classify("delete"));
    assertTrue(e.getMessage().contains("Delete statement cannot be empty"));
  }

  @Test
  void testIdentifiersStartingWithKeywordsAreNotKeywords() throws Exception {
    assertInstanceOf(Assignment.class, classify("important = 1"));
    assertInstanceOf(Call.class, classify("iffy(2)"));
    assertInstanceOf(Statement.class, classify("deleted"));
  }

  @Test
  void testConditionalHeaders() throws Exception {
    If ifs = assertInstanceOf(If.class, classify("if a > 1:"));
    assertEquals(List.of(new Reference("a"), Operator.CLG, new Literal(1.0)), ifs.condition);
    Elif elif = assertInstanceOf(Elif.class, classify("elif a == 1:"));
    assertEquals(Operator.CEQ, elif.condition.get(1));
    While loop = assertInstanceOf(While.class, classify("while i < 10:"));
    assertEquals(List.of(new Reference("i"), Operator.CSM, new Literal(10.0)), loop.condition);
    assertInstanceOf(Else.class, classify("else:"));
    assertInstanceOf(Try.class, classify("try:"));
  }

  @Test
  void testConditionKeepsKeywordSubstrings() throws Exception {
    If ifs = assertInstanceOf(If.class, classify("if diff > 1:"));
    assertEquals(new Reference("diff"), ifs.condition.get(0), "只去掉开头的关键字");
  }

  @Test
  void testConditionWithoutOperatorFails() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> classify("while running:"));
    assertTrue(e.getMessage().contains("Invalid equation"));
  }

  @Test
  void testTextAfterHeaderColonFails() {
    assertThrows(ScriptSyntaxException.class, () -> classify("if a > 1: b()"));
  }

  @Test
  void testForLoopIsRecognizedButUnimplemented() throws Exception {
    For loop = assertInstanceOf(For.class, classify("for i in items:"));
    assertFalse(loop.implemented, "for 循环节点必须标记为未实现");
  }

  @Test
  void testFunctionHeader() throws Exception {
    Function fn = assertInstanceOf(Function.class, classify("#add(a, b):"));
    assertEquals("add", fn.name);
    assertEquals(List.of("a", "b"), fn.parameters);
    Function none = assertInstanceOf(Function.class, classify("#main():"));
    assertEquals(List.of(), none.parameters);
  }

  @Test
  void testFunctionHeaderRejectsInvalidParameters() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> classify("#f(a, b+1):"));
    assertTrue(e.getMessage().contains("Invalid function parameters"));
    assertThrows(ScriptSyntaxException.class, () -> classify("#f(a,,b):"));
  }

  @Test
  void testAssignment() throws Exception {
    Assignment a = assertInstanceOf(Assignment.class, classify("total = a + b * 2"));
    assertEquals("total", a.var);
    assertEquals("data", a.valueKey);
    assertEquals(new MathE(List.of(new Reference("a"), Operator.ADD, new Reference("b"), Operator.MUL, new Literal(2.0))), a.value);
  }

  @Test
  void testAssignmentOfStringContainingEquals() throws Exception {
    Assignment a = assertInstanceOf(Assignment.class, classify("s = \"k=v\""));
    assertEquals(new Str("k=v"), a.value);
  }

  @Test
  void testAssignmentKeywordIsConfigurable() throws Exception {
    Assignment a = assertInstanceOf(Assignment.class, new StatementClassifier("value").classify(new SourceLine(1, 0, "x = 1")));
    assertEquals("value", a.valueKey);
  }

  @Test
  void testCallAndStatement() throws Exception {
    Call call = assertInstanceOf(Call.class, classify("f([1,2,3], \"x,y\")"));
    assertEquals("f", call.name);
    assertEquals(List.of(new Array(List.of(new Num(1), new Num(2), new Num(3))), new Str("x,y")), call.params);
    assertEquals(List.of(), assertInstanceOf(Call.class, classify("g()")).params);

    Statement st = assertInstanceOf(Statement.class, classify("print \"hi\", name"));
    assertEquals("print", st.name);
    assertEquals(List.of(new Str("hi"), new Var("name")), st.params);
    assertEquals(List.of(), assertInstanceOf(Statement.class, classify("return")).params);
  }

  @Test
  void testMixin() throws Exception {
    Mixin m = assertInstanceOf(Mixin.class, classify("@mixin lib_print"));
    assertEquals("lib_print", m.value);
  }

  @Test
  void testUnknownShapeFails() {
    ScriptSyntaxException e = assertThrows(ScriptSyntaxException.class, () -> classify("???"));
    assertEquals(5, e.getLine());
    assertTrue(e.getMessage().contains("Invalid syntax"));
    assertThrows(ScriptSyntaxException.class, () -> classify("f(1) + g(2)"));
  }

  @Test
  void testClassifyDropsBlankLines() throws Exception {
    List<ClassifiedLine> lines = classifier.classify(List.of(
        new SourceLine(1, 0, "x = 1"),
        new SourceLine(2, 0, ""),
        new SourceLine(3, 1, "y = 2")));
    assertEquals(2, lines.size());
    assertEquals(1, lines.get(1).indentLevel());
    assertEquals(3, lines.get(1).stmt().line);
  }
}
