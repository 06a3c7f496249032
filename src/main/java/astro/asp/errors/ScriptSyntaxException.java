package astro.asp.errors;

/**
 * 语法错误：未知语句形态、字符串引号错误、非法变量名、非法表达式等。
 */
public final class ScriptSyntaxException extends AspException {
  public ScriptSyntaxException(String message, int line) {
    super(message, line);
  }

  public ScriptSyntaxException(String message, int line, Throwable cause) {
    super(message, line, cause);
  }
}
