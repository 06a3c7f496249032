package astro.asp.lexer;

import astro.asp.core.ScriptModel.SourceLine;
import astro.asp.errors.IndentationException;
import astro.asp.support.ErrorMessages;

import java.util.ArrayList;
import java.util.List;

/**
 * 缩进分词器
 * <p>
 * 缩进单位取第一条带前导空格的非空行的空格数（整个文件都没有缩进时为 4），
 * 之后每一非空行的前导空格必须是该单位的整数倍；缩进中不允许出现制表符。
 * 空行不参与单位判定与校验，层级记为 0。
 */
public final class IndentTokenizer {

  public static final int DEFAULT_UNIT = 4;

  private IndentTokenizer() {}

  /**
   * 确定文件的缩进单位。
   *
   * @param buffer 已剥离注释的源码行
   * @return 每级缩进的空格数
   */
  public static int detectUnit(List<String> buffer) {
    for (String line : buffer) {
      if (line.isBlank()) continue;
      int spaces = leadingSpaces(line);
      if (spaces != 0) return spaces;
    }
    return DEFAULT_UNIT;
  }

  /**
   * 将源码行转换为 {@link SourceLine} 序列，行号为 1 起始。
   *
   * @param buffer 已剥离注释的源码行
   * @param unit 缩进单位
   * @return 与输入一一对应的行记录（含空行）
   * @throws IndentationException 前导空格不是单位的整数倍，或缩进中含制表符
   */
  public static List<SourceLine> tokenize(List<String> buffer, int unit) throws IndentationException {
    List<SourceLine> lines = new ArrayList<>(buffer.size());
    for (int i = 0; i < buffer.size(); i++) {
      String line = buffer.get(i);
      int lineNumber = i + 1;
      if (line.isBlank()) {
        lines.add(new SourceLine(lineNumber, 0, ""));
        continue;
      }
      int spaces = leadingSpaces(line);
      if (spaces % unit != 0 || Character.isWhitespace(line.charAt(spaces))) {
        throw new IndentationException(ErrorMessages.invalidTabSize(lineNumber, unit), lineNumber);
      }
      lines.add(new SourceLine(lineNumber, spaces / unit, line.strip()));
    }
    return lines;
  }

  private static int leadingSpaces(String line) {
    int n = 0;
    while (n < line.length() && line.charAt(n) == ' ') n++;
    return n;
  }
}
