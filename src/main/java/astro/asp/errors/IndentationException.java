package astro.asp.errors;

/**
 * 缩进错误：前导空格不是缩进单位的整数倍，或出现无归属的多余缩进。
 */
public final class IndentationException extends AspException {
  public IndentationException(String message, int line) {
    super(message, line);
  }
}
