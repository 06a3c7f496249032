package astro.asp.parser;

import astro.asp.core.ScriptModel.*;
import astro.asp.errors.AspException;
import astro.asp.errors.ScriptSyntaxException;
import astro.asp.lexer.Preprocessor;
import astro.asp.support.ErrorMessages;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 语句归类器
 * <p>
 * 按固定优先级依次尝试各语句形态，首个匹配的规则负责转换；
 * 非空文本不匹配任何形态即为语法错误。
 */
public final class StatementClassifier {

  private static final Logger LOGGER = Logger.getLogger(StatementClassifier.class.getName());

  private static final Pattern FUNCTION_PARAMS = Pattern.compile("[A-Za-z0-9_, ]*");

  /** 一行文本经归类后的结果：缩进层级 + 语句节点 */
  public record ClassifiedLine(int indentLevel, Stmt stmt) {}

  @FunctionalInterface
  private interface Handler {
    Stmt convert(Matcher m, int line) throws AspException;
  }

  private record Rule(String kind, Pattern pattern, Handler handler) {}

  private final String assignmentKeyword;
  private final List<Rule> rules;

  /**
   * @param assignmentKeyword 赋值语句中值字段的名称
   */
  public StatementClassifier(String assignmentKeyword) {
    this.assignmentKeyword = assignmentKeyword;
    this.rules = List.of(
        new Rule("import", Pattern.compile("import(?:\\s+(\\S+).*)?"), (m, line) -> {
          if (m.group(1) == null) throw new ScriptSyntaxException(ErrorMessages.emptyImport(line), line);
          return new Import(line, m.group(1));
        }),
        new Rule("delete", Pattern.compile("delete(?:\\s+(\\S+).*)?"), (m, line) -> {
          if (m.group(1) == null) throw new ScriptSyntaxException(ErrorMessages.emptyDelete(line), line);
          return new Delete(line, m.group(1));
        }),
        new Rule("if", Pattern.compile("if (.*):(.*)"), (m, line) -> new If(line, condition(m, line))),
        new Rule("while", Pattern.compile("while (.+):(.*)"), (m, line) -> new While(line, condition(m, line))),
        new Rule("for", Pattern.compile("for .+:.*"), (m, line) -> {
          LOGGER.log(Level.WARNING, "第 {0} 行：for 循环尚未实现，节点将被标记为未实现", line);
          return new For(line);
        }),
        new Rule("elif", Pattern.compile("elif (.*):(.*)"), (m, line) -> new Elif(line, condition(m, line))),
        new Rule("else", Pattern.compile("else\\s*:"), (m, line) -> new Else(line)),
        new Rule("try", Pattern.compile("try\\s*:"), (m, line) -> new Try(line)),
        new Rule("function", Pattern.compile("#([_A-Za-z]\\w*)\\((.*)\\)\\s*:"), StatementClassifier::function),
        new Rule("assignment", Pattern.compile("([_A-Za-z]\\w*) *=(?!=)(.*)"), this::assignment),
        new Rule("call", Pattern.compile("([_A-Za-z]\\w*)(\\(.*\\))"), StatementClassifier::call),
        new Rule("statement", Pattern.compile("([_A-Za-z]\\w*)(?:\\s+(.*))?"),
            (m, line) -> new Statement(line, m.group(1), ExpressionParser.parseArgs(m.group(2) == null ? "" : m.group(2), line))),
        new Rule("mixin", Pattern.compile("@mixin\\s+(.+)"), (m, line) -> new Mixin(line, m.group(1).strip()))
    );
  }

  /**
   * 归类所有非空行，空行在此丢弃。
   *
   * @param lines 分词器输出
   * @return 与非空行一一对应的归类结果，顺序不变
   * @throws AspException 任一行无法归类或内部表达式非法
   */
  public List<ClassifiedLine> classify(List<SourceLine> lines) throws AspException {
    List<ClassifiedLine> result = new ArrayList<>();
    for (SourceLine line : lines) {
      if (line.isBlank()) continue;
      result.add(new ClassifiedLine(line.indentLevel(), classify(line)));
    }
    return result;
  }

  /**
   * 归类单行。
   */
  public Stmt classify(SourceLine line) throws AspException {
    for (Rule rule : rules) {
      Matcher m = rule.pattern().matcher(line.text());
      if (m.matches()) {
        LOGGER.log(Level.FINEST, "line {0}: {1}", new Object[]{line.lineNumber(), rule.kind()});
        return rule.handler().convert(m, line.lineNumber());
      }
    }
    throw new ScriptSyntaxException(ErrorMessages.invalidSyntax(line.lineNumber()), line.lineNumber());
  }

  /** 块头部的条件：关键字与行尾冒号之间的文本 */
  private static List<MathToken> condition(Matcher m, int line) throws ScriptSyntaxException {
    if (!m.group(2).isBlank()) {
      throw new ScriptSyntaxException(ErrorMessages.invalidSyntax(line), line);
    }
    return ExpressionParser.parseMath(m.group(1), line);
  }

  private static Stmt function(Matcher m, int line) throws ScriptSyntaxException {
    String params = m.group(2);
    if (!FUNCTION_PARAMS.matcher(params).matches()) {
      throw new ScriptSyntaxException(ErrorMessages.invalidFunctionParameters(line), line);
    }
    List<String> parameters = new ArrayList<>();
    if (!params.isBlank()) {
      for (String p : params.split(",", -1)) {
        String name = p.strip();
        if (name.isEmpty()) {
          throw new ScriptSyntaxException(ErrorMessages.invalidFunctionParameters(line), line);
        }
        parameters.add(name);
      }
    }
    return new Function(line, m.group(1), List.copyOf(parameters));
  }

  private Stmt assignment(Matcher m, int line) throws ScriptSyntaxException {
    return new Assignment(line, m.group(1), assignmentKeyword, ExpressionParser.parseValue(m.group(2), line));
  }

  private static Stmt call(Matcher m, int line) throws ScriptSyntaxException {
    String args = m.group(2);
    // f(1) + g(2) 这类文本虽然首尾都是括号，但并不是单个调用
    if (!ExpressionParser.enclosedBy(Preprocessor.maskStrings(args, line), 0, '(', ')')) {
      throw new ScriptSyntaxException(ErrorMessages.invalidSyntax(line), line);
    }
    return new Call(line, m.group(1), ExpressionParser.parseArgs(args.substring(1, args.length() - 1), line));
  }
}
