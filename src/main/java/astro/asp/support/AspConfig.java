package astro.asp.support;

/**
 * asp 解析器进程级默认配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次，之后只读。
 * 单次解析使用的配置见 {@link astro.asp.ParserOptions}。
 */
public final class AspConfig {
  private AspConfig() {}

  /**
   * 调试模式开关
   * 环境变量：ASP_DEBUG
   * 启用时在每个解析阶段输出统计信息
   */
  public static final boolean DEBUG = System.getenv("ASP_DEBUG") != null;

  /**
   * 头记录的 type 字段
   * 环境变量：ASP_HEADER_TITLE
   * 如果未指定，默认为 "_HEADER"
   */
  public static final String DEFAULT_HEADER_TITLE = getEnvOrDefault("ASP_HEADER_TITLE", "_HEADER");

  /**
   * 赋值语句中存放值的字段名
   * 环境变量：ASP_ASSIGNMENT_KW
   * 如果未指定，默认为 "data"
   */
  public static final String DEFAULT_ASSIGNMENT_KW = getEnvOrDefault("ASP_ASSIGNMENT_KW", "data");

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null && !value.isEmpty() ? value : defaultValue;
  }
}
