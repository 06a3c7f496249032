package astro.asp.lexer;

import astro.asp.errors.ScriptSyntaxException;
import astro.asp.support.ErrorMessages;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 注释剥离器
 * <p>
 * 在原行缓冲区上就地处理：
 * <ol>
 *   <li>块注释 {@code /-- ... --/}：区间内所有行（含首尾）置空</li>
 *   <li>行注释 {@code --}：先用填充字符遮蔽字符串字面量，再在第一个未遮蔽的标记处截断</li>
 * </ol>
 * 未闭合的块注释默认延伸到文件末尾；严格模式下报错。
 */
public final class Preprocessor {

  private static final Logger LOGGER = Logger.getLogger(Preprocessor.class.getName());

  /** 字符串遮蔽使用的填充字符 */
  public static final char FILLER = '#';

  private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");
  private static final String BLOCK_OPEN = "/--";
  private static final String BLOCK_CLOSE = "--/";
  private static final String LINE_COMMENT = "--";

  private final boolean strictBlockComments;

  public Preprocessor(boolean strictBlockComments) {
    this.strictBlockComments = strictBlockComments;
  }

  /**
   * 剥离缓冲区中的所有注释，行数保持不变。
   *
   * @param buffer 可变的源码行列表（已去除换行符）
   * @throws ScriptSyntaxException 字符串引号不成对，或严格模式下块注释未闭合
   */
  public void process(List<String> buffer) throws ScriptSyntaxException {
    stripBlockComments(buffer);
    stripLineComments(buffer);
  }

  private void stripBlockComments(List<String> buffer) throws ScriptSyntaxException {
    boolean inComment = false;
    int openedAt = 0;

    for (int i = 0; i < buffer.size(); i++) {
      String trimmed = buffer.get(i).strip();
      boolean blank = inComment;

      if (trimmed.startsWith(BLOCK_OPEN)) {
        if (!inComment) openedAt = i + 1;
        inComment = true;
        blank = true;
      }
      // 同一行既可开启也可闭合注释
      if (inComment && trimmed.endsWith(BLOCK_CLOSE)) {
        inComment = false;
        blank = true;
      }
      if (blank) buffer.set(i, "");
    }

    if (inComment) {
      if (strictBlockComments) {
        throw new ScriptSyntaxException(ErrorMessages.unterminatedComment(openedAt), openedAt);
      }
      LOGGER.log(Level.WARNING, "块注释从第 {0} 行开始未闭合，已延伸至文件末尾", openedAt);
    }
  }

  private static void stripLineComments(List<String> buffer) throws ScriptSyntaxException {
    for (int i = 0; i < buffer.size(); i++) {
      String line = buffer.get(i);
      int cut = maskStrings(line, i + 1).indexOf(LINE_COMMENT);
      if (cut != -1) buffer.set(i, line.substring(0, cut));
    }
  }

  /**
   * 将所有 {@code "..."} 字符串字面量逐字符替换为 {@link #FILLER}。
   * 遮蔽后仍残留引号说明引号不成对。
   *
   * @param line 原始文本
   * @param lineNumber 1 起始行号，用于报错
   * @return 与原文本等长的遮蔽结果
   * @throws ScriptSyntaxException 引号不成对
   */
  public static String maskStrings(String line, int lineNumber) throws ScriptSyntaxException {
    StringBuilder masked = new StringBuilder(line);
    Matcher m = STRING_LITERAL.matcher(line);
    while (m.find()) {
      for (int i = m.start(); i < m.end(); i++) masked.setCharAt(i, FILLER);
    }
    if (masked.indexOf("\"") != -1) {
      throw new ScriptSyntaxException(ErrorMessages.incorrectStringFormatting(lineNumber), lineNumber);
    }
    return masked.toString();
  }
}
