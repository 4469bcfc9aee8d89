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

import java.time.Instant;
import java.util.Objects;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * Event notification interface.
 */
public interface PubsubEvent {

  /**
   * Interface with no functionality, but identifies a class as supporting event subscribers.
   */
  interface EventSubscriber {
  }

  /**
   * Event sent when a scheduled backup of a connection could not be created.
   */
  class BackupFailed implements PubsubEvent {
    private final String connectionId;
    private final Throwable cause;
    private final Instant failedAt;

    public BackupFailed(String connectionId, Throwable cause, Instant failedAt) {
      this.connectionId = requireNonNull(connectionId);
      this.cause = requireNonNull(cause);
      this.failedAt = requireNonNull(failedAt);
    }

    public String getConnectionId() {
      return connectionId;
    }

    public Throwable getCause() {
      return cause;
    }

    public Instant getFailedAt() {
      return failedAt;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof BackupFailed)) {
        return false;
      }

      BackupFailed other = (BackupFailed) o;
      return Objects.equals(connectionId, other.connectionId)
          && Objects.equals(cause, other.cause)
          && Objects.equals(failedAt, other.failedAt);
    }

    @Override
    public int hashCode() {
      return Objects.hash(connectionId, cause, failedAt);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("connectionId", connectionId)
          .add("cause", cause)
          .add("failedAt", failedAt)
          .toString();
    }
  }
}
