/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.retrohdl.transforms;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.retrohdl.ir.Circuit;
import org.retrohdl.ir.FModule;
import org.retrohdl.ir.HwType;
import org.retrohdl.ir.Location;
import org.retrohdl.ir.OpBuilder;
import org.retrohdl.ir.PortInfo;
import org.retrohdl.ir.WhenOp;
import org.retrohdl.transforms.ExpandWhensPass.CircuitResult;
import org.retrohdl.transforms.ExpandWhensPass.ModuleResult;

@RunWith(TestParameterInjector.class)
public class ExpandWhensPassTest {

  private static final Location TOP_LOC = Location.of("top.fir", 10, 3);

  @After
  public void clearProperties() {
    System.clearProperty("expandWhens.exhaustive");
    System.clearProperty("expandWhens.parallelism");
    System.clearProperty("expandWhens.verbose");
  }

  /** A module whose output is driven on both sides of a when. */
  private static FModule complete(String name) {
    FModule module =
        new FModule(name, PortInfo.in("c", HwType.BOOL), PortInfo.out("y", HwType.BOOL));
    WhenOp when = OpBuilder.atEnd(module.body()).when(module.port("c"), true);
    OpBuilder.atEnd(when.thenBlock()).connect(module.port("y"), module.port("c"));
    OpBuilder e = OpBuilder.atEnd(when.elseBlock());
    e.connect(module.port("y"), e.constant(HwType.BOOL, 0));
    return module;
  }

  /** A module with two outputs, each driven only when {@code c} is set. */
  private static FModule incomplete(String name) {
    FModule module =
        new FModule(
            name,
            TOP_LOC,
            List.of(
                PortInfo.in("c", HwType.BOOL),
                PortInfo.out("y", HwType.BOOL),
                PortInfo.out("z", HwType.BOOL)));
    WhenOp when = OpBuilder.atEnd(module.body()).when(module.port("c"), false);
    OpBuilder t = OpBuilder.atEnd(when.thenBlock());
    t.connect(module.port("y"), module.port("c"));
    t.connect(module.port("z"), module.port("c"));
    return module;
  }

  /** A module with nothing to expand. */
  private static FModule plain(String name) {
    FModule module =
        new FModule(name, PortInfo.in("c", HwType.BOOL), PortInfo.out("y", HwType.BOOL));
    OpBuilder.atEnd(module.body()).connect(module.port("y"), module.port("c"));
    return module;
  }

  @Test
  public void circuit(@TestParameter({"1", "3"}) int parallelism) {
    Circuit circuit = new Circuit("Chip");
    circuit.addModule(complete("A"));
    circuit.addModule(incomplete("B"));
    circuit.addModule(plain("C"));
    circuit.addModule(complete("D"));
    ExpandWhensPass pass =
        new ExpandWhensPass(ExpandWhensOptions.builder().setParallelism(parallelism).build());

    CircuitResult result = pass.runOnCircuit(circuit);

    assertThat(result.modules().stream().map(r -> r.module().name))
        .containsExactly("A", "B", "C", "D")
        .inOrder();
    assertThat(result.modules().stream().map(ModuleResult::changed))
        .containsExactly(true, true, false, true)
        .inOrder();
    assertThat(result.failed()).isTrue();
    assertThat(result.changed()).isTrue();
    assertThat(result.errors()).hasSize(1);
    InitializationError error = result.errors().get(0);
    assertThat(error.moduleName).isEqualTo("B");
    assertThat(error.fieldName).isEqualTo("y");
    // Ports without a location are reported at their module.
    assertThat(error.location).isEqualTo(TOP_LOC);
    assertThat(error)
        .hasMessageThat()
        .isEqualTo("top.fir:10:3: sink \"y\" not fully initialized (in module B)");
  }

  @Test
  public void unchangedCircuit() {
    Circuit circuit = new Circuit("Chip");
    circuit.addModule(plain("A"));
    CircuitResult result = new ExpandWhensPass().runOnCircuit(circuit);
    assertThat(result.changed()).isFalse();
    assertThat(result.failed()).isFalse();
    assertThat(result.errors()).isEmpty();
  }

  @Test
  public void exhaustiveDiagnostics() {
    ExpandWhensPass pass =
        new ExpandWhensPass(ExpandWhensOptions.builder().setExhaustiveDiagnostics(true).build());

    ModuleResult result = pass.runOnModule(incomplete("B"));

    assertThat(result.errors().stream().map(e -> e.fieldName))
        .containsExactly("y", "z")
        .inOrder();
  }

  @Test
  public void firstErrorOnly() {
    ModuleResult result = new ExpandWhensPass().runOnModule(incomplete("B"));
    assertThat(result.errors().stream().map(e -> e.fieldName)).containsExactly("y");
  }

  /** Collects the formatted messages logged to it. */
  private static class CapturingAppender extends AbstractAppender {
    final List<String> messages = new ArrayList<>();

    CapturingAppender() {
      super("Capturing", null, null, true, Property.EMPTY_ARRAY);
    }

    @Override
    public void append(LogEvent event) {
      messages.add(event.getMessage().getFormattedMessage());
    }
  }

  /**
   * Runs {@code pass} on {@code module} with debug logging enabled for ExpandWhensPass, and returns
   * the messages it logged.
   */
  private static List<String> captureDebugLog(ExpandWhensPass pass, FModule module) {
    String loggerName = ExpandWhensPass.class.getName();
    LoggerContext context = LoggerContext.getContext(false);
    Configuration config = context.getConfiguration();
    CapturingAppender appender = new CapturingAppender();
    appender.start();
    LoggerConfig loggerConfig = new LoggerConfig(loggerName, Level.DEBUG, false);
    loggerConfig.addAppender(appender, null, null);
    config.addLogger(loggerName, loggerConfig);
    context.updateLoggers();
    try {
      assertThat(pass.runOnModule(module).failed()).isFalse();
    } finally {
      config.removeLogger(loggerName);
      context.updateLoggers();
      appender.stop();
    }
    return appender.messages;
  }

  @Test
  public void verboseLogsModuleBeforeAndAfter() {
    ExpandWhensPass pass =
        new ExpandWhensPass(ExpandWhensOptions.builder().setVerbose(true).build());

    List<String> messages = captureDebugLog(pass, complete("A"));

    assertThat(messages).hasSize(3);
    assertThat(messages.get(0)).startsWith("Before expanding whens:\nmodule A(");
    assertThat(messages.get(0)).contains("when %c {");
    assertThat(messages.get(1)).startsWith("After expanding whens:\nmodule A(");
    assertThat(messages.get(1)).doesNotContain("when %c");
    assertThat(messages.get(1)).contains("= mux %c, %c, ");
    assertThat(messages.get(2)).isEqualTo("Expanded whens in A: changed=true, errors=0");
  }

  @Test
  public void quietWithoutVerbose() {
    List<String> messages = captureDebugLog(new ExpandWhensPass(), complete("A"));

    assertThat(messages).containsExactly("Expanded whens in A: changed=true, errors=0");
  }

  @Test
  public void internalErrorsPropagate(@TestParameter({"1", "2"}) int parallelism) {
    Circuit circuit = new Circuit("Chip");
    circuit.addModule(complete("A"));
    FModule bad = plain("B");
    OpBuilder.atEnd(bad.body()).partialConnect(bad.port("y"), bad.port("c"));
    circuit.addModule(bad);
    ExpandWhensPass pass =
        new ExpandWhensPass(ExpandWhensOptions.builder().setParallelism(parallelism).build());

    assertThrows(AssertionError.class, () -> pass.runOnCircuit(circuit));
  }

  @Test
  public void optionsFromSystemProperties() {
    assertThat(ExpandWhensOptions.fromSystemProperties().toString())
        .isEqualTo(ExpandWhensOptions.DEFAULT.toString());

    System.setProperty("expandWhens.exhaustive", "true");
    System.setProperty("expandWhens.parallelism", "4");
    System.setProperty("expandWhens.verbose", "true");
    ExpandWhensOptions options = ExpandWhensOptions.fromSystemProperties();
    assertThat(options.exhaustiveDiagnostics).isTrue();
    assertThat(options.parallelism).isEqualTo(4);
    assertThat(options.verbose).isTrue();
  }

  @Test
  public void parallelismMustBePositive() {
    assertThrows(
        IllegalArgumentException.class, () -> ExpandWhensOptions.builder().setParallelism(0));
  }

  @Test
  public void duplicateModules() {
    Circuit circuit = new Circuit("Chip");
    circuit.addModule(plain("A"));
    assertThrows(IllegalArgumentException.class, () -> circuit.addModule(plain("A")));
  }
}
