package astro.asp.core;

import com.fasterxml.jackson.annotation.*;
import java.util.*;

/**
 * pax3 代码对象模型
 * <p>
 * 语句节点序列化为 {@code {"line": N, "type": "...", ...}}，块语句的子语句位于 {@code code} 字段；
 * 值序列化为二元组 {@code [kind, payload]}，与 pax3 解释器的读取格式保持一致。
 */
public final class ScriptModel {
  private ScriptModel() {}

  /** 代码对象格式标识，语句形态变化时必须升级 */
  public static final String FORMAT = "pax3";

  /** 分词器输出：行号（1 起始）、缩进层级、去除首尾空白后的文本 */
  public record SourceLine(int lineNumber, int indentLevel, String text) {
    public boolean isBlank() { return text.isEmpty(); }
  }

  /** 函数定义区间，用于给解释器建立函数索引 */
  public record FunctionRegion(String name, int headerLine, int lastLine) {}

  @JsonPropertyOrder({"line", "type", "format", "info"})
  public static final class Header {
    public final int line = 0;
    public final String type;
    public final String format = FORMAT;
    public final String info;
    public Header(String type, String info) { this.type = type; this.info = info; }
  }

  // ------------------------------------------------------------------
  // 语句
  // ------------------------------------------------------------------

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Import.class, name = "import"),
    @JsonSubTypes.Type(value = Delete.class, name = "delete"),
    @JsonSubTypes.Type(value = If.class, name = "if"),
    @JsonSubTypes.Type(value = Elif.class, name = "elif"),
    @JsonSubTypes.Type(value = Else.class, name = "else"),
    @JsonSubTypes.Type(value = While.class, name = "while"),
    @JsonSubTypes.Type(value = Try.class, name = "try"),
    @JsonSubTypes.Type(value = Function.class, name = "function"),
    @JsonSubTypes.Type(value = For.class, name = "for"),
    @JsonSubTypes.Type(value = Call.class, name = "call"),
    @JsonSubTypes.Type(value = Statement.class, name = "statement"),
    @JsonSubTypes.Type(value = Assignment.class, name = "assignment"),
    @JsonSubTypes.Type(value = Mixin.class, name = "mixin")
  })
  @JsonPropertyOrder({"line", "type"})
  public abstract static sealed class Stmt permits Import, Delete, Block, For, Call, Statement, Assignment, Mixin {
    public final int line;
    protected Stmt(int line) { this.line = line; }

    /** 记录类型名，取自子类的 {@link JsonTypeName} */
    @JsonProperty("type")
    public String type() { return getClass().getAnnotation(JsonTypeName.class).value(); }
  }

  /**
   * 块语句：拥有缩进更深一级的子语句。
   * 子语句由 BlockAssembler 自底向上构建完成后一次性挂接。
   */
  public abstract static sealed class Block extends Stmt permits If, Elif, Else, While, Try, Function {
    public List<Stmt> code;
    protected Block(int line) { super(line); }

    public void attach(List<Stmt> body) {
      if (code != null) throw new IllegalStateException("body already attached to block at line " + line);
      code = List.copyOf(body);
    }
  }

  @JsonTypeName("import") public static final class Import extends Stmt {
    public final String name;
    public Import(int line, String name) { super(line); this.name = name; }
  }
  @JsonTypeName("delete") public static final class Delete extends Stmt {
    public final String var;
    public Delete(int line, String var) { super(line); this.var = var; }
  }
  @JsonTypeName("if") public static final class If extends Block {
    public final List<MathToken> condition;
    public If(int line, List<MathToken> condition) { super(line); this.condition = condition; }
  }
  @JsonTypeName("elif") public static final class Elif extends Block {
    public final List<MathToken> condition;
    public Elif(int line, List<MathToken> condition) { super(line); this.condition = condition; }
  }
  @JsonTypeName("while") public static final class While extends Block {
    public final List<MathToken> condition;
    public While(int line, List<MathToken> condition) { super(line); this.condition = condition; }
  }
  @JsonTypeName("else") public static final class Else extends Block {
    public Else(int line) { super(line); }
  }
  @JsonTypeName("try") public static final class Try extends Block {
    public Try(int line) { super(line); }
  }
  @JsonTypeName("function") public static final class Function extends Block {
    public final String name;
    public final List<String> parameters;
    public Function(int line, String name, List<String> parameters) { super(line); this.name = name; this.parameters = parameters; }
  }
  /** for 循环尚未定义语义：语法上识别，但节点始终标记为未实现 */
  @JsonTypeName("for") public static final class For extends Stmt {
    public final boolean implemented = false;
    public For(int line) { super(line); }
  }
  @JsonTypeName("call") public static final class Call extends Stmt {
    public final String name;
    public final List<Value> params;
    public Call(int line, String name, List<Value> params) { super(line); this.name = name; this.params = params; }
  }
  @JsonTypeName("statement") public static final class Statement extends Stmt {
    public final String name;
    public final List<Value> params;
    public Statement(int line, String name, List<Value> params) { super(line); this.name = name; this.params = params; }
  }
  /** 值所在的字段名由 assignment_kw 选项决定，默认为 data */
  @JsonTypeName("assignment") public static final class Assignment extends Stmt {
    public final String var;
    @JsonIgnore public final String valueKey;
    @JsonIgnore public final Value value;
    public Assignment(int line, String var, String valueKey, Value value) {
      super(line); this.var = var; this.valueKey = valueKey; this.value = value;
    }
    @JsonAnyGetter public Map<String, Object> valueField() { return Map.of(valueKey, value); }
  }
  @JsonTypeName("mixin") public static final class Mixin extends Stmt {
    public final String value;
    public Mixin(int line, String value) { super(line); this.value = value; }
  }

  // ------------------------------------------------------------------
  // 值
  // ------------------------------------------------------------------

  // CallE/MathE 避免与 Stmt.Call 及 java.lang.Math 冲突
  public sealed interface Value permits Bool, Num, Str, Var, Elm, Array, CallE, MathE {}

  public record Bool(boolean value) implements Value {
    @JsonValue public List<Object> pax() { return List.of("bool", value); }
  }
  public record Num(double value) implements Value {
    @JsonValue public List<Object> pax() { return List.of("num", value); }
  }
  public record Str(String value) implements Value {
    @JsonValue public List<Object> pax() { return List.of("str", value); }
  }
  public record Var(String name) implements Value {
    @JsonValue public List<Object> pax() { return List.of("var", name); }
  }
  /** 数组元素访问 name[index] */
  public record Elm(String var, int index) implements Value {
    @JsonValue public List<Object> pax() {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("var", var);
      payload.put("element", index);
      return List.of("elm", payload);
    }
  }
  public record Array(List<Value> elements) implements Value {
    @JsonValue public List<Object> pax() { return List.of("array", elements); }
  }
  /** 函数调用值；module 为 null 表示当前模块 */
  public record CallE(String module, String name, List<Value> params) implements Value {
    @JsonValue public List<Object> pax() {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("module", module);
      payload.put("name", name);
      payload.put("params", params);
      return List.of("call", payload);
    }
  }
  /** 未处理优先级的扁平运算记号序列 */
  public record MathE(List<MathToken> tokens) implements Value {
    @JsonValue public List<Object> pax() { return List.of("math", tokens); }
  }

  // ------------------------------------------------------------------
  // 运算记号
  // ------------------------------------------------------------------

  public sealed interface MathToken permits Literal, Reference, Operator {}

  public record Literal(double value) implements MathToken {
    @JsonValue public double pax() { return value; }
  }
  public record Reference(String name) implements MathToken {
    @JsonValue public String pax() { return name; }
  }

  public enum Operator implements MathToken {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"),
    CSM("<"), CLG(">"), BRO("("), BRC(")"),
    NOT("!="), CEQ("=="), CSE("<="), CLE(">=");

    private final String symbol;

    Operator(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }

    public static Operator fromSymbol(String symbol) {
      for (Operator op : values()) if (op.symbol.equals(symbol)) return op;
      throw new IllegalArgumentException("unknown operator: " + symbol);
    }
  }
}
