/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link EventBus} delivering each event to each handler as a task of an {@link Executor}.
 */
@Slf4j
@RequiredArgsConstructor
public class AsyncEventBus implements EventBus {

	private final Executor executor;

	private final Map<Topic<?>, List<Consumer<Object>>> handlers = new ConcurrentHashMap<>();

	@Override
	public <E> void publish(final Topic<E> topic, final E event) {
		final var subscribers = handlers.getOrDefault(topic, List.of());
		log.debug("Publish {} to {} handler(s): {}", topic.getName(), subscribers.size(), event);
		for (final var handler : subscribers) {
			try {
				executor.execute(() -> deliver(topic, handler, event));
			} catch (final RejectedExecutionException e) {
				log.error("Event {} on {} rejected", event, topic.getName(), e);
			}
		}
	}

	private void deliver(final Topic<?> topic, final Consumer<Object> handler, final Object event) {
		try {
			handler.accept(event);
		} catch (final RuntimeException e) {
			log.error("Handler of {} failed for {}", topic.getName(), event, e);
		}
	}

	@Override
	public <E> void subscribe(final Topic<E> topic, final Consumer<E> handler) {
		handlers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>())
				.add(event -> handler.accept(topic.getType().cast(event)));
		log.info("Handler subscribed to {}", topic.getName());
	}
}
