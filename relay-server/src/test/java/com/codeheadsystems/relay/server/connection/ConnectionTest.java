package com.codeheadsystems.relay.server.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.codeheadsystems.relay.model.Envelope;
import com.codeheadsystems.relay.server.Await;
import com.codeheadsystems.relay.server.event.EventRouter;
import com.codeheadsystems.relay.server.registry.ConnectionRegistry;
import com.codeheadsystems.relay.server.registry.FakeAdmissionRequest;
import com.codeheadsystems.relay.server.registry.OriginPolicy;
import com.codeheadsystems.relay.server.store.InMemoryTokenStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * Liveness, ordering and failure behaviour of a single connection's loops.
 */
class ConnectionTest {

  private static final Duration WAIT = Duration.ofSeconds(5);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final InMemoryTokenStore tokenStore = new InMemoryTokenStore();
  private ConnectionRegistry registry;

  @AfterEach
  void tearDown() {
    if (registry != null) {
      registry.shutdown();
    }
    tokenStore.shutdown();
  }

  @Test
  void pingInterval_isNineTenthsOfPongWait() {
    assertThat(ConnectionSettings.defaults().pingInterval()).isEqualTo(Duration.ofSeconds(9));
    assertThat(new ConnectionSettings(Duration.ofMillis(200), 16, 1).pingInterval())
        .isEqualTo(Duration.ofMillis(180));
  }

  @Test
  void settings_rejectNonPositiveValues() {
    assertThatThrownBy(() -> new ConnectionSettings(Duration.ZERO, 1024, 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ConnectionSettings(Duration.ofSeconds(1), 0, 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ConnectionSettings(Duration.ofSeconds(1), 1024, 1, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ConnectionSettings(Duration.ofSeconds(1), 1024, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  /**
   * A peer that never answers pings is dropped once the pong wait runs out.
   */
  @Test
  void silentPeer_isDroppedAfterPongWait() throws Exception {
    registry = registry(new ConnectionSettings(Duration.ofMillis(200), 1024, 16));
    FakeWebSocketStream stream = new FakeWebSocketStream(false);
    long started = System.nanoTime();
    Connection connection = admit(stream);

    assertThat(connection.awaitTermination(WAIT)).isTrue();
    assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(150));
    assertThat(registry.size()).isZero();
    assertThat(connection.state()).isEqualTo(ConnectionState.REMOVED);
    assertThat(stream.closeCalls()).isEqualTo(1);
  }

  @Test
  void pongingPeer_staysConnected() throws Exception {
    registry = registry(new ConnectionSettings(Duration.ofSeconds(1), 1024, 16));
    FakeWebSocketStream stream = new FakeWebSocketStream(true);
    Connection connection = admit(stream);

    Thread.sleep(2500);

    assertThat(registry.contains(connection)).isTrue();
    assertThat(connection.state()).isEqualTo(ConnectionState.ACTIVE);
    assertThat(stream.pings()).isGreaterThanOrEqualTo(2);
  }

  @Test
  void oversizedMessage_terminatesConnection() throws Exception {
    registry = registry(new ConnectionSettings(Duration.ofSeconds(5), 16, 16));
    FakeWebSocketStream stream = new FakeWebSocketStream(true);
    Connection connection = admit(stream);

    stream.peerSends("{\"type\":\"send_message\",\"payload\":{\"message\":\"far too long\"}}");

    assertThat(connection.awaitTermination(WAIT)).isTrue();
    assertThat(registry.size()).isZero();
  }

  @Test
  void send_writesEnvelopesInOrder() throws Exception {
    registry = registry(new ConnectionSettings(Duration.ofSeconds(5), 1024, 64));
    FakeWebSocketStream stream = new FakeWebSocketStream(true);
    Connection connection = admit(stream);

    for (int i = 0; i < 50; i++) {
      assertThat(connection.send("seq", Map.of("n", i))).isTrue();
    }

    for (int i = 0; i < 50; i++) {
      String frame = stream.nextWritten(WAIT);
      assertThat(frame).isNotNull();
      Envelope envelope = objectMapper.readValue(frame, Envelope.class);
      assertThat(envelope.type()).isEqualTo("seq");
      assertThat(envelope.payload().get("n").asInt()).isEqualTo(i);
    }
  }

  @Test
  void writeFailure_doesNotEndConnection() throws Exception {
    registry = registry(new ConnectionSettings(Duration.ofSeconds(5), 1024, 16));
    FakeWebSocketStream stream = new FakeWebSocketStream(true);
    Connection connection = admit(stream);
    stream.failNextWrite();

    connection.send("first", Map.of());
    connection.send("second", Map.of());

    String frame = stream.nextWritten(WAIT);
    assertThat(frame).contains("second");
    assertThat(registry.contains(connection)).isTrue();
  }

  /**
   * A peer that keeps sending while its handler is stuck is held at the inbound capacity, and
   * everything it sent is handled once the handler frees up.
   */
  @Test
  void floodingPeer_isHeldBackWhileHandlerIsBusy() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger handled = new AtomicInteger();
    EventRouter router = EventRouter.builder()
        .on("work", (envelope, connection) -> {
          try {
            release.await();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          handled.incrementAndGet();
        })
        .build();
    registry = registry(new ConnectionSettings(Duration.ofSeconds(30), 1024, 16, 8), router);
    FakeWebSocketStream stream = new FakeWebSocketStream(true, 8);
    admit(stream);

    AtomicInteger accepted = new AtomicInteger();
    Thread peer = new Thread(() -> {
      for (int i = 0; i < 1000; i++) {
        stream.peerSends("{\"type\":\"work\",\"payload\":{\"n\":" + i + "}}");
        accepted.incrementAndGet();
      }
    });
    peer.setDaemon(true);
    peer.start();

    Await.until(WAIT, () -> stream.backlog() == 8);
    Thread.sleep(200);
    assertThat(stream.backlog()).isEqualTo(8);
    // one message is in the stuck handler, eight are buffered, the next call waits
    assertThat(accepted.get()).isLessThanOrEqualTo(9);
    assertThat(peer.isAlive()).isTrue();

    release.countDown();
    peer.join(WAIT.toMillis());
    assertThat(peer.isAlive()).isFalse();
    Await.until(WAIT, () -> handled.get() == 1000);
  }

  /**
   * Envelopes still queued when the stream is closed are dropped, not written to the dead
   * stream; the close frame is still sent.
   */
  @Test
  void writeLoop_afterStreamClosed_skipsQueuedEnvelopes() throws Exception {
    FakeWebSocketStream stream = new FakeWebSocketStream(true);
    Connection connection = new Connection(ConnectionId.next(), stream,
        mock(ConnectionRegistry.class), ConnectionSettings.defaults(), objectMapper, Clock.systemUTC());
    for (int i = 0; i < 10; i++) {
      connection.send("stale", Map.of("n", i));
    }

    connection.closeStream();
    connection.closeMailbox();
    connection.writeLoop();

    assertThat(stream.nextWritten(Duration.ofMillis(100))).isNull();
    assertThat(stream.closeFrames()).isEqualTo(1);
  }

  @Test
  void send_fullMailbox_dropsEnvelope() {
    Connection connection = new Connection(ConnectionId.next(), new FakeWebSocketStream(true),
        mock(ConnectionRegistry.class), new ConnectionSettings(Duration.ofSeconds(5), 1024, 2),
        objectMapper, Clock.systemUTC());

    assertThat(connection.send(new Envelope("a", null))).isTrue();
    assertThat(connection.send(new Envelope("b", null))).isTrue();
    assertThat(connection.send(new Envelope("c", null))).isFalse();
    assertThat(connection.state()).isEqualTo(ConnectionState.ADMITTED);
  }

  @Test
  void send_afterCloseMailbox_returnsFalse() {
    Connection connection = new Connection(ConnectionId.next(), new FakeWebSocketStream(true),
        mock(ConnectionRegistry.class), ConnectionSettings.defaults(), objectMapper, Clock.systemUTC());

    connection.closeMailbox();
    connection.closeMailbox();

    assertThat(connection.send(new Envelope("a", null))).isFalse();
  }

  @Test
  void start_twice_throws() throws Exception {
    registry = registry(ConnectionSettings.defaults());
    Connection connection = admit(new FakeWebSocketStream(true));

    assertThatThrownBy(() -> connection.start(Thread::new))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void closeStream_closesUnderlyingStreamOnce() {
    FakeWebSocketStream stream = new FakeWebSocketStream(true);
    Connection connection = new Connection(ConnectionId.next(), stream,
        mock(ConnectionRegistry.class), ConnectionSettings.defaults(), objectMapper, Clock.systemUTC());

    connection.closeStream();
    connection.closeStream();

    assertThat(stream.closeCalls()).isEqualTo(1);
  }

  private ConnectionRegistry registry(final ConnectionSettings settings) {
    return registry(settings, EventRouter.builder().build());
  }

  private ConnectionRegistry registry(final ConnectionSettings settings, final EventRouter router) {
    return new ConnectionRegistry(tokenStore, router, OriginPolicy.allowAll(), settings, objectMapper);
  }

  private Connection admit(final FakeWebSocketStream stream) throws Exception {
    return registry.admit(FakeAdmissionRequest.withToken(tokenStore.issue().key()), () -> stream);
  }
}
