package com.codeheadsystems.relay.server.event;

import com.codeheadsystems.relay.model.Envelope;
import com.codeheadsystems.relay.server.connection.Connection;
import com.codeheadsystems.relay.server.exception.EventHandlerException;
import com.codeheadsystems.relay.server.exception.UnsupportedEventException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table from event type to {@link EventHandler}, built once at startup.
 */
public final class EventRouter {

  private final Map<String, EventHandler> handlers;

  private EventRouter(final Map<String, EventHandler> handlers) {
    this.handlers = Map.copyOf(handlers);
  }

  /**
   * Starts a new router definition.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Routes an envelope to the handler registered for its type.
   *
   * @param envelope   the envelope
   * @param connection the connection it arrived on
   * @throws UnsupportedEventException if no handler is registered for the type
   * @throws EventHandlerException     if the handler failed, including unexpected runtime failures
   */
  public void route(final Envelope envelope, final Connection connection)
      throws UnsupportedEventException, EventHandlerException {
    String type = envelope.type();
    EventHandler handler = type == null ? null : handlers.get(type);
    if (handler == null) {
      throw new UnsupportedEventException(type);
    }
    try {
      handler.handle(envelope, connection);
    } catch (RuntimeException e) {
      throw new EventHandlerException("handler for " + type + " failed", e);
    }
  }

  /**
   * The registered event types.
   *
   * @return the types
   */
  public Set<String> types() {
    return handlers.keySet();
  }

  /**
   * Collects handlers. Each type may be registered once.
   */
  public static final class Builder {

    private final Map<String, EventHandler> handlers = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Registers a handler.
     *
     * @param type    the event type
     * @param handler the handler
     * @return this builder
     */
    public Builder on(final String type, final EventHandler handler) {
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("Event type must not be blank");
      }
      if (handlers.putIfAbsent(type, handler) != null) {
        throw new IllegalArgumentException("Handler already registered for " + type);
      }
      return this;
    }

    /**
     * Builds the router.
     *
     * @return the router
     */
    public EventRouter build() {
      return new EventRouter(handlers);
    }
  }
}
