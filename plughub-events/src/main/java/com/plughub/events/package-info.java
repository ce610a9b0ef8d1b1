/**
 * Event bus for PlugHub.
 * <ul>
 *   <li>{@link com.plughub.events.EventBus} – subscribe/unsubscribe, synchronous, owner-thread and async publish, flush, shutdown</li>
 *   <li>{@link com.plughub.events.EventListener} – listener callback; exceptions are logged, never propagated</li>
 *   <li>{@link com.plughub.events.OwnerThreadDispatcher} – deferred-delivery target</li>
 *   <li>{@link com.plughub.events.EventLoop} – owner-thread dispatcher pumped by the thread that created it</li>
 * </ul>
 */
package com.plughub.events;
