package ca.gc.cra.flowstart.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.flowstart.application.output.OutputInitException;
import ca.gc.cra.flowstart.application.port.LogSink;
import ca.gc.cra.flowstart.config.SinkConfig;
import ca.gc.cra.flowstart.config.SinkType;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LogSinksTest {

  @TempDir Path tempDir;

  @Test
  void regularSinkUsesDefaultFilenameUnderLogDir() throws Exception {
    LogSinks sinks = new LogSinks(tempDir);

    try (LogSink sink = sinks.open(new SinkConfig(SinkType.REGULAR, null, true, null, null), "flowstart.json")) {
      FileLogSink file = assertInstanceOf(FileLogSink.class, sink);
      assertEquals(tempDir.resolve("flowstart.json"), file.path());
    }
  }

  @Test
  void absoluteFilenameIgnoresLogDir() throws Exception {
    Path target = tempDir.resolve("elsewhere/out.json");
    LogSinks sinks = new LogSinks(Path.of("/nonexistent-log-dir"));

    try (LogSink sink = sinks.open(
        new SinkConfig(SinkType.REGULAR, target.toString(), false, null, null), "flowstart.json")) {
      assertEquals(target.toString(), sink.describe());
    }
  }

  @Test
  void unixStreamSinkToleratesMissingCollector() throws Exception {
    LogSinks sinks = new LogSinks(tempDir);

    try (LogSink sink = sinks.open(
        new SinkConfig(SinkType.UNIX_STREAM, "collector.sock", true, null, null), "flowstart.json")) {
      assertInstanceOf(UnixSocketLogSink.class, sink);
    }
  }

  @Test
  void kafkaWithoutBootstrapServersFails() {
    LogSinks sinks = new LogSinks(tempDir);

    OutputInitException ex = assertThrows(OutputInitException.class, () -> sinks.open(
        new SinkConfig(SinkType.KAFKA, null, true, null, "flows"), "flowstart.json"));
    assertInstanceOf(IllegalArgumentException.class, ex.getCause());
  }

  @Test
  void kafkaWithoutTopicFails() {
    LogSinks sinks = new LogSinks(tempDir);

    assertThrows(OutputInitException.class, () -> sinks.open(
        new SinkConfig(SinkType.KAFKA, null, true, "localhost:9092", null), "flowstart.json"));
  }
}
