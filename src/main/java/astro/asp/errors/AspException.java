package astro.asp.errors;

/**
 * 解析器异常基类
 * <p>
 * 所有错误均为致命错误：首个错误即中止整个解析，不产生部分结果。
 * 行号为 1 起始；配置错误与具体行无关，行号为 0。
 */
public class AspException extends Exception {
  private final int line;

  public AspException(String message, int line) {
    super(message);
    this.line = line;
  }

  public AspException(String message, int line, Throwable cause) {
    super(message, cause);
    this.line = line;
  }

  /** 出错的源码行号（1 起始，0 表示与源码行无关） */
  public int getLine() {
    return line;
  }
}
