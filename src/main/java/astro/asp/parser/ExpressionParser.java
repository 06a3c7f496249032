package astro.asp.parser;

import astro.asp.core.ScriptModel.*;
import astro.asp.errors.ScriptSyntaxException;
import astro.asp.lexer.Preprocessor;
import astro.asp.support.ErrorMessages;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 表达式与参数解析
 * <p>
 * 三个入口：
 * <ul>
 *   <li>{@link #parseMath}：把含运算符的文本拆成扁平运算记号（不处理优先级）</li>
 *   <li>{@link #parseArgs}：按顶层逗号切分参数列表，字符串与括号内的逗号不计</li>
 *   <li>{@link #parseValue}：把单个字面量或引用归类为 {@link Value}</li>
 * </ul>
 */
public final class ExpressionParser {

  // 多字符运算符必须排在单字符之前
  private static final Pattern OPERATOR = Pattern.compile("!=|==|>=|<=|[-+*/<>()]");
  private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern IDENTIFIER = Pattern.compile("\\w+");
  private static final Pattern ELEMENT = Pattern.compile("(\\w+)\\[(\\d+)]");
  private static final Pattern MODULE_CALL = Pattern.compile("(\\w+)\\.(\\w+)(\\(.*\\))?");
  private static final Pattern STRING = Pattern.compile("\"[^\"]*\"");

  private static final String[][] ESCAPES = {
    {"\\n", "\n"},
    {"\\r", "\r"},
    {"\\t", "\t"},
    {"\\b", "\b"},
    {"\\q", "\""}
  };

  private ExpressionParser() {}

  /**
   * 拆分算术/比较表达式。
   *
   * @param text 表达式文本，空格会被忽略
   * @param line 行号
   * @return 数字、运算符与引用组成的记号序列
   * @throws ScriptSyntaxException 记号不足两个（表达式中没有运算符）
   */
  public static List<MathToken> parseMath(String text, int line) throws ScriptSyntaxException {
    String compact = text.replace(" ", "");
    List<MathToken> tokens = new ArrayList<>();
    Matcher m = OPERATOR.matcher(compact);
    int last = 0;
    while (m.find()) {
      addOperand(tokens, compact.substring(last, m.start()));
      tokens.add(Operator.fromSymbol(m.group()));
      last = m.end();
    }
    addOperand(tokens, compact.substring(last));

    if (tokens.size() <= 1) {
      throw new ScriptSyntaxException(ErrorMessages.invalidEquation(line), line);
    }
    return tokens;
  }

  private static void addOperand(List<MathToken> tokens, String operand) {
    if (operand.isEmpty()) return;
    if (NUMBER.matcher(operand).matches()) {
      tokens.add(new Literal(Double.parseDouble(operand)));
    } else {
      tokens.add(new Reference(operand));
    }
  }

  /**
   * 解析逗号分隔的参数列表。空白文本得到空列表。
   */
  public static List<Value> parseArgs(String text, int line) throws ScriptSyntaxException {
    if (text.isBlank()) return List.of();

    String masked = Preprocessor.maskStrings(text, line);
    List<Value> args = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == '[' || c == '(') depth++;
      else if (c == ']' || c == ')') depth--;
      else if (c == ',' && depth == 0) {
        args.add(parseValue(text.substring(start, i), line));
        start = i + 1;
      }
    }
    args.add(parseValue(text.substring(start), line));
    return args;
  }

  /**
   * 归类单个字面量或引用。
   * <p>
   * 顺序：布尔 → 数字 → 数组 → 跨模块调用 → （无引号时）元素访问 / 变量 / 表达式 → 字符串。
   */
  public static Value parseValue(String text, int line) throws ScriptSyntaxException {
    String data = text.strip();

    if (data.equals("True")) return new Bool(true);
    if (data.equals("False")) return new Bool(false);

    if (NUMBER.matcher(data).matches()) return new Num(Double.parseDouble(data));

    if (!data.isEmpty() && enclosedBy(Preprocessor.maskStrings(data, line), 0, '[', ']')) {
      return new Array(parseArgs(data.substring(1, data.length() - 1), line));
    }

    Matcher call = MODULE_CALL.matcher(data);
    if (call.matches()) {
      String args = call.group(3);
      if (args == null) {
        return new CallE(call.group(1), call.group(2), List.of());
      }
      if (enclosedBy(Preprocessor.maskStrings(data, line), call.start(3), '(', ')')) {
        return new CallE(call.group(1), call.group(2), parseArgs(args.substring(1, args.length() - 1), line));
      }
    }

    if (data.indexOf('"') == -1) {
      return parseReference(data, line);
    }
    return parseString(data, line);
  }

  private static Value parseReference(String data, int line) throws ScriptSyntaxException {
    Matcher elm = ELEMENT.matcher(data);
    if (elm.matches()) {
      try {
        return new Elm(elm.group(1), Integer.parseInt(elm.group(2)));
      } catch (NumberFormatException e) {
        throw new ScriptSyntaxException(ErrorMessages.invalidVariableName(line), line, e);
      }
    }
    if (IDENTIFIER.matcher(data).matches()) return new Var(data);

    try {
      return new MathE(parseMath(data, line));
    } catch (ScriptSyntaxException e) {
      throw new ScriptSyntaxException(ErrorMessages.invalidVariableName(line), line, e);
    }
  }

  private static Value parseString(String data, int line) throws ScriptSyntaxException {
    if (!STRING.matcher(data).matches()) {
      // 先区分引号不成对与多余内容
      Preprocessor.maskStrings(data, line);
      throw new ScriptSyntaxException(ErrorMessages.invalidVariableFormat(line), line);
    }
    String value = data.substring(1, data.length() - 1);
    for (String[] escape : ESCAPES) value = value.replace(escape[0], escape[1]);
    return new Str(value);
  }

  /**
   * 判断 {@code masked} 从 {@code from} 处的左括号开始，其配对的右括号恰好是最后一个字符。
   *
   * @param masked 已遮蔽字符串的文本
   */
  static boolean enclosedBy(String masked, int from, char open, char close) {
    if (from >= masked.length() || masked.charAt(from) != open || masked.charAt(masked.length() - 1) != close) {
      return false;
    }
    int depth = 0;
    for (int i = from; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == open) depth++;
      else if (c == close) {
        depth--;
        if (depth == 0) return i == masked.length() - 1;
      }
    }
    return false;
  }
}
