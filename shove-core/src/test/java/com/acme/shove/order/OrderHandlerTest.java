package com.acme.shove.order;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.shove.config.ShoveConfig;
import com.acme.shove.core.ResultPublishException;
import com.acme.shove.exec.ProcessCommandExecutor;
import com.acme.shove.manifest.ProcfileParser;
import com.acme.shove.resolve.CommandResolver;
import com.acme.shove.spi.ResultPublisher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisabledOnOs(OS.WINDOWS)
@DisplayName("OrderHandler - decode, process, publish")
class OrderHandlerTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir Path root;

  @Mock private ResultPublisher publisher;

  private OrderHandler handler;

  @BeforeEach
  void setUp() throws Exception {
    Path demo = Files.createDirectories(root.resolve("demo/bin"));
    Files.writeString(demo.resolve("commands.procfile"), "deploy: printf done\nfail: echo boom >&2; exit 4\n");

    ShoveConfig config = new ShoveConfig().addProject("demo", root.resolve("demo").toString());
    OrderProcessor processor =
        new OrderProcessor(
            new CommandResolver(config, new ProcfileParser()), new ProcessCommandExecutor(config));
    handler = new OrderHandler(new OrderDecoder(), processor);
  }

  private static byte[] order(String project, String command) {
    return String.format(
            "{\"project\":\"%s\",\"command\":\"%s\",\"log_key\":\"abc123\",\"log_queue\":\"logs.demo\"}",
            project, command)
        .getBytes(StandardCharsets.UTF_8);
  }

  private JsonNode publishedTo(String queue) throws Exception {
    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(publisher).publish(eq(queue), body.capture());
    return MAPPER.readTree(body.getValue());
  }

  @Test
  @DisplayName("handle - should publish the result of a successful command to the order's log queue")
  void testPublishesSuccess() throws Exception {
    // When
    Optional<ResultMessage> result = handler.handle(order("demo", "deploy"), publisher);

    // Then
    assertThat(result).contains(new ResultMessage("1.0", "abc123", 0, "done"));

    InOrder inOrder = inOrder(publisher);
    inOrder.verify(publisher).declareQueue("logs.demo");
    inOrder.verify(publisher).publish(eq("logs.demo"), any(byte[].class));

    JsonNode json = publishedTo("logs.demo");
    assertThat(json.get("version").asText()).isEqualTo("1.0");
    assertThat(json.get("log_key").asText()).isEqualTo("abc123");
    assertThat(json.get("return_code").asInt()).isZero();
    assertThat(json.get("output").asText()).isEqualTo("done");
    assertThat(json.size()).isEqualTo(4);
  }

  @Test
  @DisplayName("handle - should publish the real exit code and stderr of a failing command")
  void testPublishesFailure() throws Exception {
    handler.handle(order("demo", "fail"), publisher);

    JsonNode json = publishedTo("logs.demo");
    assertThat(json.get("return_code").asInt()).isEqualTo(4);
    assertThat(json.get("output").asText()).isEqualTo("boom\n");
  }

  @Test
  @DisplayName("handle - should still publish when the project is unknown")
  void testPublishesResolutionFailure() throws Exception {
    handler.handle(order("ghost", "deploy"), publisher);

    JsonNode json = publishedTo("logs.demo");
    assertThat(json.get("return_code").asInt()).isEqualTo(1);
    assertThat(json.get("output").asText()).isEqualTo("No project `ghost` found.");
  }

  @Test
  @DisplayName("handle - should publish nothing for an undecodable message")
  void testDropsMalformedOrder() {
    byte[] body = "{\"project\":\"demo\",\"command\":\"deploy\"}".getBytes(StandardCharsets.UTF_8);

    Optional<ResultMessage> result = handler.handle(body, publisher);

    assertThat(result).isEmpty();
    verifyNoInteractions(publisher);
  }

  @Test
  @DisplayName("handle - should propagate publish failures")
  void testPropagatesPublishFailure() {
    doThrow(new ResultPublishException("Failed to publish to queue: logs.demo"))
        .when(publisher)
        .publish(anyString(), any(byte[].class));

    assertThatThrownBy(() -> handler.handle(order("demo", "deploy"), publisher))
        .isInstanceOf(ResultPublishException.class)
        .hasMessageContaining("logs.demo");
  }
}
