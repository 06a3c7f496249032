package astro.asp.render;

import astro.asp.core.ScriptModel.Header;
import astro.asp.core.ScriptModel.Stmt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * pax3 输出
 * <p>
 * 在语句树前插入头记录，并通过 Jackson 转换为解释器读取的代码对象
 * （{@code List<Map<String, Object>>}）或 JSON 文本。
 */
public final class Renderer {

  public static final String GENERATOR = "asp3";
  public static final String VERSION = "3.5.4";

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm:ss").withZone(ZoneOffset.UTC);

  private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {};

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private Renderer() {}

  /**
   * 生成头记录。
   *
   * @param title 头记录的 type 字段
   * @param clock 生成时间来源（UTC）
   */
  public static Header header(String title, Clock clock) {
    String info = "Parsed by " + GENERATOR + " version " + VERSION + ", " + TIMESTAMP.format(clock.instant());
    return new Header(title, info);
  }

  /**
   * 转换为代码对象：首元素为头记录，块语句的子语句嵌套在 code 字段。
   */
  public static List<Map<String, Object>> render(Header header, List<Stmt> statements) {
    List<Map<String, Object>> code = new ArrayList<>(statements.size() + 1);
    code.add(MAPPER.convertValue(header, RECORD));
    for (Stmt stmt : statements) code.add(MAPPER.convertValue(stmt, RECORD));
    return code;
  }

  /**
   * 序列化为 pax3 JSON 文本。
   *
   * @param pretty 是否缩进输出
   */
  public static String toJson(Header header, List<Stmt> statements, boolean pretty) {
    try {
      return (pretty ? PRETTY : MAPPER).writeValueAsString(render(header, statements));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("pax3 序列化失败: " + e.getMessage(), e);
    }
  }
}
