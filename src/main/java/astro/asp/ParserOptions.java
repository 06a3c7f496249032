package astro.asp;

import astro.asp.errors.ConfigurationException;
import astro.asp.support.AspConfig;
import astro.asp.support.ErrorMessages;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

/**
 * 单次解析的不可变配置
 * <p>
 * 默认值来自 {@link AspConfig}；构造完成后在整个解析管道中只读传递。
 */
public final class ParserOptions {

  public static final String HEADER_TITLE = "header_title";
  public static final String ASSIGNMENT_KW = "assignment_kw";
  public static final String STRICT_COMMENTS = "strict_comments";

  // 与语句公共字段冲突的赋值字段名
  private static final Set<String> RESERVED_KEYWORDS = Set.of("line", "type", "var");

  private final String headerTitle;
  private final String assignmentKeyword;
  private final boolean strictBlockComments;
  private final Clock clock;

  private ParserOptions(Builder b) {
    this.headerTitle = b.headerTitle;
    this.assignmentKeyword = b.assignmentKeyword;
    this.strictBlockComments = b.strictBlockComments;
    this.clock = b.clock;
  }

  public static ParserOptions defaults() {
    return new ParserOptions(new Builder());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * 从松散类型的选项映射构造配置，键为 header_title / assignment_kw / strict_comments。
   * 缺省、null 或空字符串的选项保留默认值；未知键被忽略。
   *
   * @throws ConfigurationException 选项类型不符
   */
  public static ParserOptions fromMap(Map<String, ?> raw) throws ConfigurationException {
    Builder b = new Builder();
    Object title = raw.get(HEADER_TITLE);
    if (title != null) {
      if (!(title instanceof String s)) throw new ConfigurationException(ErrorMessages.invalidOptionType(HEADER_TITLE));
      if (!s.isEmpty()) b.headerTitle(s);
    }
    Object keyword = raw.get(ASSIGNMENT_KW);
    if (keyword != null) {
      if (!(keyword instanceof String s)) throw new ConfigurationException(ErrorMessages.invalidOptionType(ASSIGNMENT_KW));
      if (!s.isEmpty()) b.assignmentKeyword(s);
    }
    Object strict = raw.get(STRICT_COMMENTS);
    if (strict != null) {
      if (!(strict instanceof Boolean flag)) throw new ConfigurationException(ErrorMessages.invalidOptionType(STRICT_COMMENTS));
      b.strictBlockComments(flag);
    }
    return b.build();
  }

  public String headerTitle() { return headerTitle; }
  public String assignmentKeyword() { return assignmentKeyword; }
  public boolean strictBlockComments() { return strictBlockComments; }
  public Clock clock() { return clock; }

  public static final class Builder {
    private String headerTitle = AspConfig.DEFAULT_HEADER_TITLE;
    private String assignmentKeyword = AspConfig.DEFAULT_ASSIGNMENT_KW;
    private boolean strictBlockComments;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder headerTitle(String headerTitle) { this.headerTitle = headerTitle; return this; }
    public Builder assignmentKeyword(String assignmentKeyword) { this.assignmentKeyword = assignmentKeyword; return this; }
    public Builder strictBlockComments(boolean strict) { this.strictBlockComments = strict; return this; }
    public Builder clock(Clock clock) { this.clock = clock; return this; }

    /**
     * @throws ConfigurationException 标题或字段名为空，或字段名与语句公共字段冲突
     */
    public ParserOptions build() throws ConfigurationException {
      if (headerTitle == null || headerTitle.isEmpty()) {
        throw new ConfigurationException(ErrorMessages.invalidOptionType(HEADER_TITLE));
      }
      if (assignmentKeyword == null || assignmentKeyword.isEmpty() || RESERVED_KEYWORDS.contains(assignmentKeyword)) {
        throw new ConfigurationException(ErrorMessages.invalidOptionType(ASSIGNMENT_KW));
      }
      if (clock == null) throw new IllegalArgumentException("clock");
      return new ParserOptions(this);
    }
  }
}
