package astro.asp.errors;

/**
 * 解析选项类型错误（如 header_title 不是字符串）
 */
public final class ConfigurationException extends AspException {
  public ConfigurationException(String message) {
    super(message, 0);
  }
}
