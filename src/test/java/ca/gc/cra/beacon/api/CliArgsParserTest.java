package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"host=console", "port=4228"});
    assertEquals("console", map.get("host"));
    assertEquals("4228", map.get("port"));
  }

  @Test
  void splitsOnFirstEqualsOnly() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"connection=tcp(host=a,port=1)", "message="});
    assertEquals("tcp(host=a,port=1)", map.get("connection"));
    assertEquals("", map.get("message"));
  }

  @Test
  void rejectsMalformedArgs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k=a\u0007b"}));
  }

  @Test
  void skipsNullAndBlankTokens() {
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
