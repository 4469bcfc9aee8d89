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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable snapshot of the backup schedule owned by a single connection.
 * <p>
 * Instances are values: every mutation produces a new instance through {@link #toBuilder()}, which
 * allows a snapshot to be handed to an asynchronous execution without later updates leaking into
 * it.
 */
public final class BackupSchedule {
  private final String id;
  private final String connectionId;
  private final boolean enabled;
  private final String cronSchedule;
  private final int retentionDays;
  private final Optional<Instant> nextRunTime;
  private final Optional<Instant> lastBackupTime;
  private final Instant createdAt;
  private final Instant updatedAt;

  private BackupSchedule(Builder builder) {
    checkArgument(builder.retentionDays >= 0,
        "Retention days must be non-negative, got %s", builder.retentionDays);

    this.id = requireNonNull(builder.id);
    this.connectionId = requireNonNull(builder.connectionId);
    this.enabled = builder.enabled;
    this.cronSchedule = requireNonNull(builder.cronSchedule);
    this.retentionDays = builder.retentionDays;
    this.nextRunTime = Optional.ofNullable(builder.nextRunTime);
    this.lastBackupTime = Optional.ofNullable(builder.lastBackupTime);
    this.createdAt = requireNonNull(builder.createdAt);
    this.updatedAt = requireNonNull(builder.updatedAt);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setId(id)
        .setConnectionId(connectionId)
        .setEnabled(enabled)
        .setCronSchedule(cronSchedule)
        .setRetentionDays(retentionDays)
        .setNextRunTime(nextRunTime.orElse(null))
        .setLastBackupTime(lastBackupTime.orElse(null))
        .setCreatedAt(createdAt)
        .setUpdatedAt(updatedAt);
  }

  public String getId() {
    return id;
  }

  public String getConnectionId() {
    return connectionId;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * The six-field cron expression, as accepted from the caller.
   */
  public String getCronSchedule() {
    return cronSchedule;
  }

  /**
   * Number of days backups are kept; 0 disables pruning.
   */
  public int getRetentionDays() {
    return retentionDays;
  }

  public Optional<Instant> getNextRunTime() {
    return nextRunTime;
  }

  public Optional<Instant> getLastBackupTime() {
    return lastBackupTime;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof BackupSchedule)) {
      return false;
    }
    BackupSchedule that = (BackupSchedule) o;
    return enabled == that.enabled
        && retentionDays == that.retentionDays
        && Objects.equals(id, that.id)
        && Objects.equals(connectionId, that.connectionId)
        && Objects.equals(cronSchedule, that.cronSchedule)
        && Objects.equals(nextRunTime, that.nextRunTime)
        && Objects.equals(lastBackupTime, that.lastBackupTime)
        && Objects.equals(createdAt, that.createdAt)
        && Objects.equals(updatedAt, that.updatedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id,
        connectionId,
        enabled,
        cronSchedule,
        retentionDays,
        nextRunTime,
        lastBackupTime,
        createdAt,
        updatedAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("connectionId", connectionId)
        .add("enabled", enabled)
        .add("cronSchedule", cronSchedule)
        .add("retentionDays", retentionDays)
        .add("nextRunTime", nextRunTime)
        .add("lastBackupTime", lastBackupTime)
        .add("createdAt", createdAt)
        .add("updatedAt", updatedAt)
        .toString();
  }

  public static final class Builder {
    private String id;
    private String connectionId;
    private boolean enabled;
    private String cronSchedule;
    private int retentionDays;
    private Instant nextRunTime;
    private Instant lastBackupTime;
    private Instant createdAt;
    private Instant updatedAt;

    private Builder() {
      // Use BackupSchedule.builder().
    }

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setConnectionId(String connectionId) {
      this.connectionId = connectionId;
      return this;
    }

    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder setCronSchedule(String cronSchedule) {
      this.cronSchedule = cronSchedule;
      return this;
    }

    public Builder setRetentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    public Builder setNextRunTime(Instant nextRunTime) {
      this.nextRunTime = nextRunTime;
      return this;
    }

    public Builder setLastBackupTime(Instant lastBackupTime) {
      this.lastBackupTime = lastBackupTime;
      return this;
    }

    public Builder setCreatedAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder setUpdatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public BackupSchedule build() {
      return new BackupSchedule(this);
    }
  }
}
