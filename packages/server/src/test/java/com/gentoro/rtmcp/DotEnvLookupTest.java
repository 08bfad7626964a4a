package com.gentoro.rtmcp;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DotEnvLookupTest {

  @Test
  void readsQuotedExportedAndPlainEntries(@TempDir Path dir) throws Exception {
    Path file = dir.resolve(".env.local");
    Files.writeString(
        file,
        String.join(
            "\n",
            "# RT credentials",
            "RT_MCP_TEST_TOKEN=\"abc 123\"",
            "export RT_MCP_TEST_USER='root'",
            "RT_MCP_TEST_URL=https://rt.example.com/?a=b",
            "not a pair",
            ""),
        StandardCharsets.UTF_8);

    Map<String, String> values = DotEnvLookup.read(file);

    assertEquals("abc 123", values.get("RT_MCP_TEST_TOKEN"));
    assertEquals("root", values.get("RT_MCP_TEST_USER"));
    assertEquals("https://rt.example.com/?a=b", values.get("RT_MCP_TEST_URL"));
    assertEquals(3, values.size());
  }

  @Test
  void fallsBackToTheFirstExistingFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("second.env");
    Files.writeString(file, "RT_MCP_TEST_ONLY_IN_FILE=42\n", StandardCharsets.UTF_8);

    DotEnvLookup lookup = new DotEnvLookup(List.of(dir.resolve("missing.env"), file));

    assertEquals("42", lookup.lookup("RT_MCP_TEST_ONLY_IN_FILE"));
    assertNull(lookup.lookup("RT_MCP_TEST_UNSET_EVERYWHERE"));
  }
}
