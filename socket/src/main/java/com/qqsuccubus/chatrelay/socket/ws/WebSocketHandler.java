package com.qqsuccubus.chatrelay.socket.ws;

import com.qqsuccubus.chatrelay.core.msg.ClientCommand;
import com.qqsuccubus.chatrelay.core.msg.InvalidCommandException;
import com.qqsuccubus.chatrelay.core.util.BytesUtils;
import com.qqsuccubus.chatrelay.socket.config.SocketConfig;
import com.qqsuccubus.chatrelay.socket.hub.Client;
import com.qqsuccubus.chatrelay.socket.hub.IHub;
import com.qqsuccubus.chatrelay.socket.metrics.MetricsService;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.time.Duration;

/**
 * Reader/writer pump pair of one client connection.
 * <p>
 * Protocol (client → server), one JSON object per text frame:
 * <ul>
 *   <li>message: {content}</li>
 *   <li>typing: {isTyping}</li>
 *   <li>edit: {messageId, content}</li>
 *   <li>delete: {messageId}</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (server → client): chat messages, userList, messageEdited, messageDeleted; a ping frame
 * every {@code pingInterval}; a close frame (1000) once the hub closes the client's queue.
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private final SocketConfig config;
	private final IHub hub;
	private final MetricsService metricsService;

	public WebSocketHandler(SocketConfig config, IHub hub, MetricsService metricsService) {
		this.config = config;
		this.hub = hub;
		this.metricsService = metricsService;
	}

	/**
	 * Handles the connection lifecycle: register, then run both pumps until the connection ends.
	 *
	 * @param inbound  WebSocket inbound
	 * @param outbound WebSocket outbound
	 * @param client   client created by the acceptor, not yet registered
	 * @return Publisher for the connection
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, Client client) {
		ClientConnection connection = new ClientConnection(client, hub);
		handleConnectionStateUpdates(inbound, connection, client);

		return hub.register(client)
				.then(Mono.defer(() -> {
					if (!connection.markRegistered()) {
						log.debug("Connection for {} closed during registration", client);
						return Mono.empty();
					}
					return Mono.when(writePump(outbound, client, connection), readPump(inbound, client, connection));
				}))
				.onErrorResume(err -> {
					log.error("WebSocket error for client {}", client, err);
					return connection.terminate("error: " + err.getMessage());
				});
	}

	private void handleConnectionStateUpdates(WebsocketInbound inbound, ClientConnection connection, Client client) {
		inbound.withConnection(transport -> {
			connection.attach(transport);
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;

			transport.addHandlerLast("chat.writeTimeout", new WriteTimeoutHandler(config.getWriteTimeout()))
					.onReadIdle(idleTimeoutInMillis, () -> {
						log.info("Read timeout for {} after {} ms", client, idleTimeoutInMillis);
						transport.dispose();
					})
					.onDispose(() -> connection.terminate("transport disposed").subscribe());
		});
	}

	/**
	 * Sole consumer of the client's outbound queue, interleaved with periodic pings.
	 */
	private Mono<Void> writePump(WebsocketOutbound outbound, Client client, ClientConnection connection) {
		Duration pingInterval = Duration.ofSeconds(config.getPingInterval());
		Sinks.One<Boolean> drained = Sinks.one();

		Flux<WebSocketFrame> events = client.outboundFlux()
				.doOnSubscribe(s -> log.debug("Write pump started for {}", client))
				.<WebSocketFrame>map(payload -> {
					metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(payload));
					return new TextWebSocketFrame(payload);
				})
				.doFinally(signal -> drained.tryEmitValue(Boolean.TRUE));

		Flux<WebSocketFrame> pings = Flux.interval(pingInterval, pingInterval)
				.<WebSocketFrame>map(tick -> new PingWebSocketFrame())
				.takeUntilOther(drained.asMono());

		return outbound.sendObject(Flux.merge(events, pings))
				.then()
				.then(Mono.defer(() -> {
					log.debug("Send queue closed for {}, sending close frame", client);
					return outbound.sendClose(1000, "closing");
				}))
				.onErrorResume(err -> {
					if (!(err instanceof AbortedException)) {
						log.warn("Write error for {}: {}", client, err.toString());
					}
					return Mono.empty();
				})
				.doFinally(signal -> {
					log.debug("Write pump stopped for {} ({})", client, signal);
					connection.terminate("writer stopped").subscribe();
				});
	}

	/**
	 * Decodes text frames and forwards them to the hub in arrival order.
	 */
	private Mono<Void> readPump(WebsocketInbound inbound, Client client, ClientConnection connection) {
		return inbound.aggregateFrames(config.getMaxFrameBytes())
				.receiveFrames()
				.filter(frame -> frame instanceof TextWebSocketFrame)
				.map(frame -> ((TextWebSocketFrame) frame).text())
				.concatMap(text -> handleFrame(client, text))
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for {}", client, err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then()
				.doFinally(signal -> connection.terminate("reader stopped (" + signal + ")").subscribe());
	}

	/**
	 * Handles one inbound text frame. Invalid frames are dropped, never fatal.
	 *
	 * @param client sender
	 * @param text   frame payload
	 * @return Mono completing once the hub has processed the command
	 */
	Mono<Void> handleFrame(Client client, String text) {
		metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(text));

		ClientCommand command;
		try (MDC.MDCCloseable ignored = MDC.putCloseable("clientId", client.getId())) {
			log.debug("Received frame from {}: {}", client, text);
			try {
				command = ClientCommand.decode(text);
			} catch (InvalidCommandException e) {
				log.warn("Dropping frame from {}: {}", client, e.getMessage());
				metricsService.recordDropInvalid();
				return Mono.empty();
			}
		}

		return dispatch(client, command)
				.onErrorResume(err -> {
					log.warn("Error processing {} from {}: {}",
							command.getClass().getSimpleName(), client, err.getMessage());
					return Mono.empty();
				});
	}

	private Mono<Void> dispatch(Client client, ClientCommand command) {
		if (command instanceof ClientCommand.PostMessage post) {
			return hub.postMessage(client, post.getContent()).then();
		}
		if (command instanceof ClientCommand.SetTyping typing) {
			return hub.updateTyping(client, typing.getTyping());
		}
		if (command instanceof ClientCommand.EditMessage edit) {
			return hub.editMessage(client, edit.getMessageId(), edit.getContent())
					.doOnNext(edited -> {
						if (!edited) {
							log.debug("Edit of {} by {} rejected", edit.getMessageId(), client);
						}
					})
					.then();
		}
		if (command instanceof ClientCommand.DeleteMessage delete) {
			return hub.deleteMessage(client, delete.getMessageId())
					.doOnNext(deleted -> {
						if (!deleted) {
							log.debug("Delete of {} by {} rejected", delete.getMessageId(), client);
						}
					})
					.then();
		}
		return Mono.error(new IllegalArgumentException("Unhandled command " + command.getClass().getSimpleName()));
	}
}
