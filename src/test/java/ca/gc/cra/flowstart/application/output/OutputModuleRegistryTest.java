package ca.gc.cra.flowstart.application.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.flowstart.domain.packet.PacketView;
import ca.gc.cra.flowstart.support.RecordingLogSink;
import org.junit.jupiter.api.Test;

class OutputModuleRegistryTest {
  private final PacketLogger<String> logger = new CountingLogger();

  @Test
  void registersRootAndSubModules() {
    OutputModuleRegistry registry = new OutputModuleRegistry();
    registry.registerPacketModule("Demo", "demo-log", conf -> ModuleContext.owning("Demo", new RecordingLogSink()), logger);
    registry.registerPacketSubModule(
        "eve-log", "Demo", "eve-log.demo", (conf, parent) -> ModuleContext.borrowing("Demo", parent.sink()), logger);

    assertEquals(2, registry.moduleCount());
    assertFalse(registry.module("demo-log").orElseThrow().isSubModule());
    PacketModuleRegistration<?> sub = registry.module("eve-log.demo").orElseThrow();
    assertTrue(sub.isSubModule());
    assertEquals("eve-log", sub.parentName());
    assertTrue(registry.module("missing").isEmpty());
  }

  @Test
  void duplicateConfNameIsRejected() {
    OutputModuleRegistry registry = new OutputModuleRegistry();
    registry.registerPacketModule("Demo", "demo-log", conf -> ModuleContext.owning("Demo", new RecordingLogSink()), logger);

    assertThrows(IllegalStateException.class, () -> registry.registerPacketModule(
        "Other", "demo-log", conf -> ModuleContext.owning("Other", new RecordingLogSink()), logger));
  }

  @Test
  void duplicateParentIsRejected() {
    OutputModuleRegistry registry = new OutputModuleRegistry();
    registry.registerParentOutput("eve-log", conf -> new JsonOutputContext("eve-log", new RecordingLogSink()));

    assertThrows(IllegalStateException.class, () -> registry.registerParentOutput(
        "eve-log", conf -> new JsonOutputContext("eve-log", new RecordingLogSink())));
  }

  private static final class CountingLogger implements PacketLogger<String> {
    @Override
    public boolean condition(PacketView packet) {
      return true;
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
