/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import java.util.function.Consumer;

/**
 * In-process publish/subscribe of events. Delivery is asynchronous and unordered, and a handler failure never reaches
 * the publisher nor the other handlers.
 */
public interface EventBus {

	/**
	 * Publish an event to the handlers of a topic.
	 *
	 * @param topic The target topic.
	 * @param event The event.
	 * @param <E>   The event type.
	 */
	<E> void publish(Topic<E> topic, E event);

	/**
	 * Subscribe a handler to a topic.
	 *
	 * @param topic   The source topic.
	 * @param handler The handler.
	 * @param <E>     The event type.
	 */
	<E> void subscribe(Topic<E> topic, Consumer<E> handler);
}
