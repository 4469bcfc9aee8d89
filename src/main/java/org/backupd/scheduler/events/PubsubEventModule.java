/**
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
package org.backupd.scheduler.events;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import javax.inject.Inject;
import javax.inject.Qualifier;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionHandler;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.multibindings.Multibinder;

import org.backupd.common.stats.StatsProvider;
import org.backupd.scheduler.app.BackupSchedulerModule;
import org.backupd.scheduler.backup.FailureNotifier;
import org.backupd.scheduler.events.PubsubEvent.EventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

/**
 * Binding module for plumbing event notifications.
 * <p>
 * Events are dispatched synchronously on the posting thread, so a failure notification has been
 * delivered to every subscriber by the time the notifier returns.
 */
public final class PubsubEventModule extends AbstractModule {

  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  private @interface DeadEventHandler { }

  private final Logger log;

  @VisibleForTesting
  static final String EXCEPTIONS_STAT = "event_bus_exceptions";
  @VisibleForTesting
  static final String EVENT_BUS_DEAD_EVENTS = "event_bus_dead_events";
  @VisibleForTesting
  static final String DEAD_EVENT_MESSAGE = "Captured dead event %s";

  public PubsubEventModule() {
    this(LoggerFactory.getLogger(PubsubEventModule.class));
  }

  @VisibleForTesting
  PubsubEventModule(Logger log) {
    this.log = requireNonNull(log);
  }

  @Override
  protected void configure() {
    // Ensure at least an empty binding is present.
    Multibinder.newSetBinder(binder(), EventSubscriber.class);

    bind(FailureNotifier.class).to(EventBusFailureNotifier.class);
    bind(EventBusFailureNotifier.class).in(Singleton.class);

    BackupSchedulerModule.addServiceBinding(binder()).to(RegisterSubscribers.class);
  }

  @Provides
  @Singleton
  SubscriberExceptionHandler provideSubscriberExceptionHandler(StatsProvider statsProvider) {
    AtomicLong subscriberExceptions = statsProvider.makeCounter(EXCEPTIONS_STAT);
    return (exception, context) -> {
      subscriberExceptions.incrementAndGet();
      log.error(
          "Failed to dispatch event to " + context.getSubscriberMethod() + ": " + exception,
          exception);
    };
  }

  @Provides
  @DeadEventHandler
  @Singleton
  Object provideDeadEventHandler(StatsProvider statsProvider) {
    AtomicLong deadEventCounter = statsProvider.makeCounter(EVENT_BUS_DEAD_EVENTS);
    return new Object() {
      @Subscribe
      public void logDeadEvent(DeadEvent event) {
        deadEventCounter.incrementAndGet();
        log.warn(String.format(DEAD_EVENT_MESSAGE, event.getEvent()));
      }
    };
  }

  @Provides
  @Singleton
  EventBus provideEventBus(
      SubscriberExceptionHandler subscriberExceptionHandler,
      @DeadEventHandler Object deadEventHandler) {

    EventBus eventBus = new EventBus(subscriberExceptionHandler);
    eventBus.register(deadEventHandler);
    return eventBus;
  }

  static class RegisterSubscribers extends AbstractIdleService {
    private final EventBus eventBus;
    private final Set<EventSubscriber> subscribers;

    @Inject
    RegisterSubscribers(EventBus eventBus, Set<EventSubscriber> subscribers) {
      this.eventBus = requireNonNull(eventBus);
      this.subscribers = requireNonNull(subscribers);
    }

    @Override
    protected void startUp() {
      subscribers.forEach(eventBus::register);
    }

    @Override
    protected void shutDown() {
      // Nothing to do - await VM shutdown.
    }
  }

  /**
   * Binds a subscriber to receive backup events.
   *
   * @param binder Binder to bind the subscriber with.
   * @param subscriber Subscriber implementation class to register for events.
   */
  public static void bindSubscriber(Binder binder, Class<? extends EventSubscriber> subscriber) {
    Multibinder.newSetBinder(binder, EventSubscriber.class).addBinding().to(subscriber);
  }
}
