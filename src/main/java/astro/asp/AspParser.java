package astro.asp;

import astro.asp.core.ScriptModel.FunctionRegion;
import astro.asp.core.ScriptModel.SourceLine;
import astro.asp.core.ScriptModel.Stmt;
import astro.asp.errors.AspException;
import astro.asp.lexer.IndentTokenizer;
import astro.asp.lexer.Preprocessor;
import astro.asp.parser.BlockAssembler;
import astro.asp.parser.StatementClassifier;
import astro.asp.parser.StatementClassifier.ClassifiedLine;
import astro.asp.render.Renderer;
import astro.asp.support.AspConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Astro Script (.asx) 解析器入口
 * <p>
 * 解析管道：
 * <pre>
 * 源码行 → Preprocessor（剥离注释） → IndentTokenizer（缩进层级）
 *        → StatementClassifier（语句归类） → BlockAssembler（组装语句树） → pax3 代码对象
 * </pre>
 * <p>
 * 每次调用拥有独立的行缓冲区，不共享可变状态，可在多线程中并行解析不同的源码。
 * 首个错误即中止解析，不返回部分结果。
 */
public final class AspParser {

  private static final Logger LOGGER = Logger.getLogger(AspParser.class.getName());

  private AspParser() {
    // 工具类，禁止实例化
  }

  public static ParsedScript parse(List<String> lines) throws AspException {
    return parse(lines, ParserOptions.defaults());
  }

  /**
   * 解析源码行。
   *
   * @param lines 源码行，行尾换行符会被去除
   * @param options 解析配置
   * @return 解析结果
   * @throws AspException 配置、缩进或语法错误
   */
  public static ParsedScript parse(List<String> lines, ParserOptions options) throws AspException {
    Level stageLevel = AspConfig.DEBUG ? Level.INFO : Level.FINE;

    List<String> buffer = new ArrayList<>(lines.size());
    for (String line : lines) buffer.add(stripNewline(line));

    new Preprocessor(options.strictBlockComments()).process(buffer);

    int unit = IndentTokenizer.detectUnit(buffer);
    List<SourceLine> sourceLines = IndentTokenizer.tokenize(buffer, unit);
    LOGGER.log(stageLevel, "分词完成：{0} 行，缩进单位 {1}", new Object[]{sourceLines.size(), unit});

    List<ClassifiedLine> classified = new StatementClassifier(options.assignmentKeyword()).classify(sourceLines);
    List<FunctionRegion> functions = BlockAssembler.extractFunctions(classified);
    List<Stmt> tree = BlockAssembler.assemble(classified);
    LOGGER.log(stageLevel, "组装完成：{0} 条语句，{1} 个根语句，{2} 个函数",
        new Object[]{classified.size(), tree.size(), functions.size()});

    return new ParsedScript(Renderer.header(options.headerTitle(), options.clock()), tree, functions, unit);
  }

  public static ParsedScript parse(String source) throws AspException {
    return parse(source, ParserOptions.defaults());
  }

  /**
   * 解析整段源码文本，按 {@code \n} 或 {@code \r\n} 分行。
   */
  public static ParsedScript parse(String source, ParserOptions options) throws AspException {
    return parse(Arrays.asList(source.split("\r?\n", -1)), options);
  }

  private static String stripNewline(String line) {
    int end = line.length();
    while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) end--;
    return line.substring(0, end);
  }
}
