package astro.asp.parser;

import astro.asp.core.ScriptModel.Block;
import astro.asp.core.ScriptModel.For;
import astro.asp.core.ScriptModel.Function;
import astro.asp.core.ScriptModel.FunctionRegion;
import astro.asp.core.ScriptModel.Stmt;
import astro.asp.errors.IndentationException;
import astro.asp.parser.StatementClassifier.ClassifiedLine;
import astro.asp.support.ErrorMessages;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 块组装器
 * <p>
 * 把扁平的归类行按缩进折叠成语句树：块语句吸收其后所有缩进更深的连续行作为 {@code code}，
 * 子语句先递归组装完成，再一次性挂接到块头部。
 * <p>
 * 不变量：
 * <ul>
 *   <li>根层级为 0</li>
 *   <li>块体的直接子语句恰好比块头部深一级</li>
 *   <li>非块语句之后不能出现更深的缩进</li>
 *   <li>for 循环体整体丢弃，不进入语句树也不参与函数索引</li>
 * </ul>
 */
public final class BlockAssembler {

  private static final Logger LOGGER = Logger.getLogger(BlockAssembler.class.getName());

  private BlockAssembler() {}

  /**
   * 组装整份脚本。
   *
   * @param lines 归类后的非空行
   * @return 根层级语句列表
   * @throws IndentationException 出现无归属的缩进
   */
  public static List<Stmt> assemble(List<ClassifiedLine> lines) throws IndentationException {
    return fold(lines, 0, lines.size(), 0);
  }

  private static List<Stmt> fold(List<ClassifiedLine> lines, int from, int to, int level) throws IndentationException {
    List<Stmt> out = new ArrayList<>();
    int i = from;
    while (i < to) {
      ClassifiedLine head = lines.get(i);
      if (head.indentLevel() < level) {
        throw new IllegalStateException("line " + head.stmt().line + " escaped its enclosing block");
      }
      if (head.indentLevel() > level) {
        throw new IndentationException(ErrorMessages.unexpectedIndent(head.stmt().line), head.stmt().line);
      }

      int end = i + 1;
      while (end < to && lines.get(end).indentLevel() > level) end++;

      if (head.stmt() instanceof Block block) {
        block.attach(fold(lines, i + 1, end, level + 1));
      } else if (head.stmt() instanceof For) {
        if (end > i + 1) {
          LOGGER.log(Level.WARNING, "第 {0} 行：for 循环体（{1} 行）被忽略",
              new Object[]{head.stmt().line, end - i - 1});
        }
      } else if (end > i + 1) {
        int line = lines.get(i + 1).stmt().line;
        throw new IndentationException(ErrorMessages.unexpectedIndent(line), line);
      }
      out.add(head.stmt());
      i = end;
    }
    return out;
  }

  /**
   * 提取函数定义区间。
   * <p>
   * 函数头部开启一个区间，吸收其后所有缩进更深的行（包括嵌套函数），
   * 遇到缩进不深于头部的行时关闭；该行若本身是函数头部则立即开启新区间。
   * 被丢弃的 for 循环体中的函数不建立索引。
   *
   * @param lines 归类后的非空行
   * @return 按出现顺序排列的最外层函数区间
   */
  public static List<FunctionRegion> extractFunctions(List<ClassifiedLine> lines) {
    List<FunctionRegion> regions = new ArrayList<>();
    Function open = null;
    int openIndent = 0;
    int lastLine = 0;
    int skipAbove = -1;

    for (ClassifiedLine line : lines) {
      if (skipAbove >= 0) {
        if (line.indentLevel() > skipAbove) continue;
        skipAbove = -1;
      }
      if (open != null) {
        if (line.indentLevel() > openIndent) {
          lastLine = line.stmt().line;
          continue;
        }
        regions.add(new FunctionRegion(open.name, open.line, lastLine));
        open = null;
      }
      if (line.stmt() instanceof Function fn) {
        open = fn;
        openIndent = line.indentLevel();
        lastLine = fn.line;
      } else if (line.stmt() instanceof For) {
        skipAbove = line.indentLevel();
      }
    }
    if (open != null) regions.add(new FunctionRegion(open.name, open.line, lastLine));
    return regions;
  }
}
