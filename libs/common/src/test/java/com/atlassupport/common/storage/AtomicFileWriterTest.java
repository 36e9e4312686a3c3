package com.atlassupport.common.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFileWriterTest {

  @TempDir Path tempDir;

  @Test
  void writeCreatesParentDirectoriesAndFile() throws IOException {
    final Path target = tempDir.resolve("data").resolve("tickets.json");

    AtomicFileWriter.write(target, "[]".getBytes(StandardCharsets.UTF_8));

    assertThat(target).hasContent("[]");
  }

  @Test
  void writeReplacesContentWithoutLeavingTempFiles() throws IOException {
    final Path target = tempDir.resolve("experts.json");
    Files.writeString(target, "[{\"id\":\"old\"}]");

    AtomicFileWriter.write(target, "[{\"id\":\"new\"}]".getBytes(StandardCharsets.UTF_8));

    assertThat(target).hasContent("[{\"id\":\"new\"}]");
    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).containsExactly(target);
    }
  }
}
