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

import javax.inject.Inject;

import com.google.common.eventbus.EventBus;

import org.backupd.common.util.Clock;
import org.backupd.scheduler.backup.FailureNotifier;
import org.backupd.scheduler.events.PubsubEvent.BackupFailed;

import static java.util.Objects.requireNonNull;

/**
 * Publishes backup failures on the event bus as {@link BackupFailed} events.
 */
class EventBusFailureNotifier implements FailureNotifier {
  private final EventBus eventBus;
  private final Clock clock;

  @Inject
  EventBusFailureNotifier(EventBus eventBus, Clock clock) {
    this.eventBus = requireNonNull(eventBus);
    this.clock = requireNonNull(clock);
  }

  @Override
  public void notifyFailure(String connectionId, Throwable cause) {
    eventBus.post(new BackupFailed(connectionId, cause, clock.nowInstant()));
  }
}
