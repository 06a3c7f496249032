package astro.asp;

import astro.asp.errors.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParserOptionsTest {

  @Test
  void testFromMapAppliesOptions() throws Exception {
    ParserOptions options = ParserOptions.fromMap(Map.of(
        "header_title", "SCRIPT",
        "assignment_kw", "value",
        "strict_comments", true));
    assertEquals("SCRIPT", options.headerTitle());
    assertEquals("value", options.assignmentKeyword());
    assertTrue(options.strictBlockComments());
  }

  @Test
  void testMissingNullOrEmptyOptionsKeepDefaults() throws Exception {
    Map<String, Object> raw = new HashMap<>();
    raw.put("header_title", null);
    raw.put("assignment_kw", "");
    raw.put("unrelated", 42);
    ParserOptions options = ParserOptions.fromMap(raw);
    ParserOptions defaults = ParserOptions.defaults();
    assertEquals(defaults.headerTitle(), options.headerTitle());
    assertEquals(defaults.assignmentKeyword(), options.assignmentKeyword());
    assertFalse(options.strictBlockComments());
  }

  @Test
  void testNonStringHeaderTitleFails() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> ParserOptions.fromMap(Map.of("header_title", 5)));
    assertTrue(e.getMessage().contains("opt: invalid header_title type"));
    assertEquals(0, e.getLine(), "配置错误与源码行无关");
  }

  @Test
  void testNonStringAssignmentKeywordFails() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> ParserOptions.fromMap(Map.of("assignment_kw", true)));
    assertTrue(e.getMessage().contains("opt: invalid assignment_kw type"));
  }

  @Test
  void testNonBooleanStrictnessFails() {
    assertThrows(ConfigurationException.class, () -> ParserOptions.fromMap(Map.of("strict_comments", "yes")));
  }

  @Test
  void testReservedAssignmentKeywordFails() {
    assertThrows(ConfigurationException.class, () -> ParserOptions.builder().assignmentKeyword("type").build());
    assertThrows(ConfigurationException.class, () -> ParserOptions.builder().assignmentKeyword("line").build());
  }
}
