package astro.asp.support;

/**
 * 错误消息统一生成工具。
 *
 * <p>所有解析错误消息均提供中英文双语描述，英文部分保持 {@code <描述> @ line N} 的固定格式，
 * 脚本作者与下游解释器依赖这些关键词定位问题。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息，英文部分附带行号。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @param line 1 起始的行号
   * @return 按照“中文 (English @ line N)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en, int line) {
    return zh + " (" + en + " @ line " + line + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  public static String invalidSyntax(int line) {
    return bilingual("语法错误", "Invalid syntax", line);
  }

  /**
   * 字符串引号不成对。
   */
  public static String incorrectStringFormatting(int line) {
    String message = bilingual("字符串格式错误", "Incorrect string formatting", line);
    return withHint(message, "检查引号是否成对出现，字符串内的引号请使用 \\q",
        "Make sure quotes are balanced, use \\q for a quote inside a string");
  }

  public static String unterminatedComment(int line) {
    String message = bilingual("块注释未闭合", "Unterminated comment", line);
    return withHint(message, "在注释末尾添加 --/", "Close the comment with --/");
  }

  /**
   * 前导空格不是缩进单位的整数倍。
   *
   * @param line 出错行号
   * @param unit 文件确定的缩进单位
   */
  public static String invalidTabSize(int line, int unit) {
    String message = bilingual("缩进错误", "Invalid tab size", line);
    return withHint(message, "每级缩进必须为 " + unit + " 个空格",
        "Every indent must be a multiple of " + unit + " spaces");
  }

  public static String unexpectedIndent(int line) {
    return bilingual("多余的缩进", "Unexpected indent", line);
  }

  public static String invalidEquation(int line) {
    String message = bilingual("表达式无效", "Invalid equation", line);
    return withHint(message, "表达式至少需要一个运算符", "An expression needs at least one operator");
  }

  public static String invalidVariableName(int line) {
    return bilingual("变量名无效", "Invalid variable name", line);
  }

  public static String invalidVariableFormat(int line) {
    return bilingual("变量格式无效", "Invalid variable format", line);
  }

  public static String invalidFunctionParameters(int line) {
    String message = bilingual("函数参数无效", "Invalid function parameters", line);
    return withHint(message, "参数只能包含字母、数字、下划线、逗号和空格",
        "Parameters may only contain letters, digits, underscores, commas and spaces");
  }

  public static String emptyImport(int line) {
    return bilingual("import 语句不能为空", "Import statement cannot be empty", line);
  }

  public static String emptyDelete(int line) {
    return bilingual("delete 语句不能为空", "Delete statement cannot be empty", line);
  }

  /**
   * 解析选项类型错误，与行号无关。
   *
   * @param option 选项名（如 header_title）
   */
  public static String invalidOptionType(String option) {
    return "选项类型错误 (opt: invalid " + option + " type)";
  }
}
