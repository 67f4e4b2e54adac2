package ca.gc.cra.flowstart.application.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flowstart.application.port.LogSink;
import ca.gc.cra.flowstart.application.port.LogSinkFactory;
import ca.gc.cra.flowstart.config.EngineMode;
import ca.gc.cra.flowstart.config.OutputConfig;
import ca.gc.cra.flowstart.config.OutputsConfig;
import ca.gc.cra.flowstart.config.SinkConfig;
import ca.gc.cra.flowstart.domain.packet.PacketView;
import ca.gc.cra.flowstart.support.RecordingLogSink;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OutputSetupTest {
  private final List<RecordingLogSink> opened = new ArrayList<>();
  private final LogSinkFactory sinks = (config, defaultFilename) -> {
    RecordingLogSink sink = new RecordingLogSink(config.filename() != null ? config.filename() : defaultFilename);
    opened.add(sink);
    return sink;
  };
  private final PacketLogger<String> logger = new NamedLogger();

  private OutputModuleRegistry registry() {
    OutputModuleRegistry registry = new OutputModuleRegistry();
    registry.registerParentOutput("eve-log", conf -> JsonOutputContext.open(conf, sinks));
    registry.registerPacketModule(
        "Demo", "demo-log", conf -> ModuleContext.owning("Demo", sinks.open(SinkConfig.from(conf), "demo.json")), logger);
    registry.registerPacketSubModule(
        "eve-log", "Demo", "eve-log.demo", (conf, parent) -> ModuleContext.borrowing("Demo", parent.sink()), logger);
    return registry;
  }

  private static OutputsConfig config(OutputConfig... outputs) {
    return new OutputsConfig(Path.of("/tmp"), EngineMode.IPS, List.of(outputs));
  }

  @Test
  void subModulesBorrowParentSinkAndCloseInOrder() throws Exception {
    OutputConfig eve = new OutputConfig("eve-log", Map.of(), List.of(OutputConfig.of("demo", Map.of())));
    OutputConfig standalone = OutputConfig.of("demo-log", Map.of("filename", "standalone.json"));

    ActiveOutputs outputs = new OutputSetup(registry()).initialize(config(eve, standalone));

    assertEquals(2, outputs.modules().size());
    assertEquals(1, outputs.parents().size());
    ModuleContext sub = outputs.modules().get(0).context();
    ModuleContext root = outputs.modules().get(1).context();
    assertEquals(SinkOwnership.BORROWED, sub.ownership());
    assertSame(outputs.parents().get(0).sink(), sub.sink());
    assertEquals(SinkOwnership.OWNED, root.ownership());
    assertEquals("standalone.json", root.sink().describe());

    outputs.close();
    assertEquals(2, opened.size());
    opened.forEach(sink -> assertEquals(1, sink.closeCount()));
    assertTrue(sub.isClosed());
    assertTrue(root.isClosed());
  }

  @Test
  void reopenRotatesEachOwnedSinkOnceAndSkipsBorrowedContexts() throws Exception {
    OutputConfig eve = new OutputConfig("eve-log", Map.of(), List.of(OutputConfig.of("demo", Map.of())));
    OutputConfig standalone = OutputConfig.of("demo-log", Map.of("filename", "standalone.json"));

    try (ActiveOutputs outputs = new OutputSetup(registry()).initialize(config(eve, standalone))) {
      outputs.reopen();
      outputs.reopen();
    }

    assertEquals(2, opened.size());
    opened.forEach(sink -> assertEquals(2, sink.reopenCount()));
  }

  @Test
  void reopenSkipsClosedContexts() throws Exception {
    RecordingLogSink sink = new RecordingLogSink("flowstart.json");
    ModuleContext context = ModuleContext.owning("Demo", sink);
    context.close();

    context.reopen();

    assertEquals(0, sink.reopenCount());
  }

  @Test
  void reopenReportsFirstFailureAndStillReopensTheRest() throws Exception {
    OutputModuleRegistry registry = registry();
    registry.registerPacketModule(
        "Rotating", "rotating-log", conf -> ModuleContext.owning("Rotating", new UnrotatableSink()), logger);
    OutputConfig eve = new OutputConfig("eve-log", Map.of(), List.of());

    try (ActiveOutputs outputs = new OutputSetup(registry).initialize(
        config(eve, OutputConfig.of("rotating-log", Map.of()), OutputConfig.of("demo-log", Map.of())))) {
      IOException ex = assertThrows(IOException.class, outputs::reopen);
      assertEquals("rotated file is gone", ex.getMessage());
    }

    assertEquals(2, opened.size());
    opened.forEach(sink -> assertEquals(1, sink.reopenCount()));
  }

  @Test
  void disabledAndUnknownOutputsAreSkipped() throws Exception {
    OutputConfig disabled = OutputConfig.of("demo-log", Map.of("enabled", "no"));
    OutputConfig unknown = OutputConfig.of("fast-log", Map.of());
    OutputConfig eve = new OutputConfig("eve-log", Map.of(), List.of(
        OutputConfig.of("alert", Map.of()),
        OutputConfig.of("demo", Map.of("enabled", "off"))));

    try (ActiveOutputs outputs = new OutputSetup(registry()).initialize(config(disabled, unknown, eve))) {
      assertEquals(0, outputs.modules().size());
      assertEquals(1, outputs.parents().size());
    }
  }

  @Test
  void subModuleNameIsNotAcceptedAsRootOutput() throws Exception {
    try (ActiveOutputs outputs = new OutputSetup(registry()).initialize(
        config(OutputConfig.of("eve-log.demo", Map.of())))) {
      assertTrue(outputs.modules().isEmpty());
    }
  }

  @Test
  void failureClosesAlreadyActivatedOutputs() {
    OutputModuleRegistry registry = registry();
    registry.registerPacketModule("Broken", "broken-log", conf -> {
      throw new OutputInitException("cannot open broken.json");
    }, logger);
    OutputConfig eve = new OutputConfig("eve-log", Map.of(), List.of(OutputConfig.of("demo", Map.of())));

    OutputInitException ex = assertThrows(OutputInitException.class,
        () -> new OutputSetup(registry).initialize(config(eve, OutputConfig.of("broken-log", Map.of()))));

    assertEquals("cannot open broken.json", ex.getMessage());
    assertEquals(1, opened.size());
    assertEquals(1, opened.get(0).closeCount());
  }

  @Test
  void closeReportsFirstFailureAndStillClosesTheRest() throws Exception {
    RecordingLogSink healthy = new RecordingLogSink("healthy");

    List<AutoCloseable> resources = List.of(
        () -> {
          throw new IOException("first");
        },
        () -> {
          throw new IllegalStateException("second");
        },
        healthy::close);
    IOException ex = assertThrows(IOException.class, () -> ActiveOutputs.closeAll(resources));
    assertEquals("first", ex.getMessage());
    assertEquals(1, ex.getSuppressed().length);
    assertEquals(1, healthy.closeCount());
  }

  private static final class UnrotatableSink implements LogSink {
    @Override
    public void write(byte[] buffer, int offset, int length) {}

    @Override
    public void reopen() throws IOException {
      throw new IOException("rotated file is gone");
    }

    @Override
    public String describe() {
      return "unrotatable";
    }

    @Override
    public void close() {}
  }

  private static final class NamedLogger implements PacketLogger<String> {
    @Override
    public boolean condition(PacketView packet) {
      return false;
    }

    @Override
    public void log(String thread, PacketView packet) {}

    @Override
    public String threadInit(ModuleContext context) {
      return context.moduleName();
    }

    @Override
    public void threadDeinit(String thread) {}
  }
}
