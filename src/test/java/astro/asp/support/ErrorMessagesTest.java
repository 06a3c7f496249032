package astro.asp.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorMessagesTest {

  @Test
  void testBilingualKeepsEnglishKeywordAndLine() {
    assertEquals("语法错误 (Invalid syntax @ line 12)", ErrorMessages.invalidSyntax(12));
  }

  @Test
  void testHintIsAppended() {
    String message = ErrorMessages.invalidTabSize(3, 4);
    assertTrue(message.startsWith("缩进错误 (Invalid tab size @ line 3)"));
    assertTrue(message.contains("Hint: Every indent must be a multiple of 4 spaces"));
  }
}
