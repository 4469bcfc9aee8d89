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
package org.backupd.scheduler.storage.entities;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * An immutable record describing one backup artifact produced for a connection.
 */
public final class BackupRecord {
  private final String id;
  private final String connectionId;
  private final BackupStatus status;
  private final String path;
  private final Optional<String> scheduleId;
  private final Instant createdAt;

  private BackupRecord(Builder builder) {
    this.id = requireNonNull(builder.id);
    this.connectionId = requireNonNull(builder.connectionId);
    this.status = requireNonNull(builder.status);
    this.path = requireNonNull(builder.path);
    this.scheduleId = Optional.ofNullable(builder.scheduleId);
    this.createdAt = requireNonNull(builder.createdAt);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setId(id)
        .setConnectionId(connectionId)
        .setStatus(status)
        .setPath(path)
        .setScheduleId(scheduleId.orElse(null))
        .setCreatedAt(createdAt);
  }

  public String getId() {
    return id;
  }

  public String getConnectionId() {
    return connectionId;
  }

  public BackupStatus getStatus() {
    return status;
  }

  /**
   * Location of the backup artifact on storage.
   */
  public String getPath() {
    return path;
  }

  /**
   * The schedule that produced this backup, absent for backups taken on demand.
   */
  public Optional<String> getScheduleId() {
    return scheduleId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BackupRecord)) {
      return false;
    }
    BackupRecord that = (BackupRecord) o;
    return Objects.equals(id, that.id)
        && Objects.equals(connectionId, that.connectionId)
        && status == that.status
        && Objects.equals(path, that.path)
        && Objects.equals(scheduleId, that.scheduleId)
        && Objects.equals(createdAt, that.createdAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, connectionId, status, path, scheduleId, createdAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("connectionId", connectionId)
        .add("status", status)
        .add("path", path)
        .add("scheduleId", scheduleId)
        .add("createdAt", createdAt)
        .toString();
  }

  public static final class Builder {
    private String id;
    private String connectionId;
    private BackupStatus status;
    private String path;
    private String scheduleId;
    private Instant createdAt;

    private Builder() {
      // Use BackupRecord.builder().
    }

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setConnectionId(String connectionId) {
      this.connectionId = connectionId;
      return this;
    }

    public Builder setStatus(BackupStatus status) {
      this.status = status;
      return this;
    }

    public Builder setPath(String path) {
      this.path = path;
      return this;
    }

    public Builder setScheduleId(String scheduleId) {
      this.scheduleId = scheduleId;
      return this;
    }

    public Builder setCreatedAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public BackupRecord build() {
      return new BackupRecord(this);
    }
  }
}
