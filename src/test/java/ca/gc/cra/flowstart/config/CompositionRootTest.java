package ca.gc.cra.flowstart.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flowstart.application.output.ActiveOutputs;
import ca.gc.cra.flowstart.application.output.OutputInitException;
import ca.gc.cra.flowstart.application.output.OutputModuleRegistry;
import ca.gc.cra.flowstart.application.output.OutputSetup;
import ca.gc.cra.flowstart.application.output.SinkOwnership;
import ca.gc.cra.flowstart.application.pipeline.PacketOutputWorker;
import ca.gc.cra.flowstart.application.port.InterfaceNameResolver;
import ca.gc.cra.flowstart.domain.flow.Flow;
import ca.gc.cra.flowstart.infrastructure.sink.LogSinks;
import ca.gc.cra.flowstart.support.Packets;
import ca.gc.cra.flowstart.support.RecordingMetricsPort;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  @TempDir Path tempDir;

  private OutputsConfig load(String engineMode) {
    return OutputConfigLoader.parse("""
        default-log-dir: %s
        engine:
          mode: %s
        outputs:
          - eve-log:
              filename: eve.json
              types:
                - flow_start
          - flow_start-json-log:
              enabled: yes
        """.formatted(tempDir, engineMode));
  }

  @Test
  void inlineEngineWritesFirstPacketToEveAndStandaloneFiles() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CompositionRoot root = new CompositionRoot(load("ips"), metrics, InterfaceNameResolver.NONE);

    try (ActiveOutputs outputs = root.startOutputs()) {
      assertEquals(SinkOwnership.BORROWED, outputs.modules().get(0).context().ownership());
      assertEquals(SinkOwnership.OWNED, outputs.modules().get(1).context().ownership());
      Flow flow = new Flow(314L);
      try (PacketOutputWorker worker = root.newWorker(outputs)) {
        assertEquals(2, worker.process(Packets.next(flow, true)));
        assertEquals(0, worker.process(Packets.next(flow, false)));
      }
    }

    List<String> eve = Files.readAllLines(tempDir.resolve("eve.json"));
    List<String> standalone = Files.readAllLines(tempDir.resolve("flowstart.json"));
    assertEquals(1, eve.size());
    assertEquals(eve, standalone);
    assertTrue(eve.get(0).contains("\"flow_id\":314"));
    assertTrue(eve.get(0).contains("\"event_type\":\"flow_start\""));
    assertEquals(2, metrics.count("flowstart.event.emitted"));
  }

  @Test
  void passiveEngineWritesNothing() throws Exception {
    CompositionRoot root = new CompositionRoot(load("ids"), new RecordingMetricsPort(), InterfaceNameResolver.NONE);

    try (ActiveOutputs outputs = root.startOutputs();
         PacketOutputWorker worker = root.newWorker(outputs)) {
      assertEquals(0, worker.process(Packets.next(new Flow(1L), true)));
    }

    assertEquals(0L, Files.size(tempDir.resolve("flowstart.json")));
  }

  @Test
  void rotatedFilesAreRecreatedAfterReopen() throws Exception {
    CompositionRoot root = new CompositionRoot(load("ips"), new RecordingMetricsPort(), InterfaceNameResolver.NONE);
    Path eve = tempDir.resolve("eve.json");
    Path standalone = tempDir.resolve("flowstart.json");

    try (ActiveOutputs outputs = root.startOutputs();
         PacketOutputWorker worker = root.newWorker(outputs)) {
      worker.process(Packets.next(new Flow(1L), true));
      Files.move(eve, tempDir.resolve("eve.json.1"));
      Files.move(standalone, tempDir.resolve("flowstart.json.1"));

      root.rotateLogs(outputs);
      worker.process(Packets.next(new Flow(2L), true));
    }

    assertTrue(Files.readString(tempDir.resolve("eve.json.1")).contains("\"flow_id\":1,"));
    assertTrue(Files.readString(tempDir.resolve("flowstart.json.1")).contains("\"flow_id\":1,"));
    List<String> eveLines = Files.readAllLines(eve);
    assertEquals(1, eveLines.size());
    assertTrue(eveLines.get(0).contains("\"flow_id\":2,"));
    assertEquals(eveLines, Files.readAllLines(standalone));
  }

  @Test
  void withoutJsonSupportNothingIsRegistered() throws Exception {
    OutputsConfig config = load("ips");
    CompositionRoot root = new CompositionRoot(
        config, new RecordingMetricsPort(), InterfaceNameResolver.NONE, new LogSinks(tempDir), false);

    OutputModuleRegistry registry = root.registry();

    assertEquals(0, registry.moduleCount());
    assertFalse(registry.parent("eve-log").isPresent());
    assertFalse(registry.module("flow_start-json-log").isPresent());
    try (ActiveOutputs outputs = new OutputSetup(registry).initialize(config)) {
      assertTrue(outputs.modules().isEmpty());
      assertTrue(outputs.parents().isEmpty());
    }
    assertFalse(Files.exists(tempDir.resolve("eve.json")));
  }

  @Test
  @SuppressWarnings("unchecked")
  void startsWithoutJsonOutputsWhenJacksonIsMissing() throws Exception {
    ClassLoader loader = new JacksonHidingClassLoader(getClass().getClassLoader());
    Function<Path, List<String>> startup = (Function<Path, List<String>>) Class
        .forName(JsonlessStartup.class.getName(), true, loader)
        .getDeclaredConstructor()
        .newInstance();

    assertEquals(List.of("json=false", "modules=0", "parents=0"), startup.apply(tempDir));
  }

  @Test
  void unopenableSinkAbortsStartup() throws Exception {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
    OutputsConfig config = new OutputsConfig(
        blocker, EngineMode.IPS, load("ips").outputs());
    CompositionRoot root = new CompositionRoot(config, new RecordingMetricsPort(), InterfaceNameResolver.NONE);

    assertThrows(OutputInitException.class, root::startOutputs);
  }
}
