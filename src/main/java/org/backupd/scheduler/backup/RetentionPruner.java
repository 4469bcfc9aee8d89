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
package org.backupd.scheduler.backup;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

import org.backupd.common.stats.StatsProvider;
import org.backupd.common.util.Clock;
import org.backupd.scheduler.storage.BackupStore;
import org.backupd.scheduler.storage.StorageException;
import org.backupd.scheduler.storage.entities.BackupRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Deletes the backups of a connection that fell out of its retention window.
 * <p>
 * The set of expired backups is fixed before deletion starts. Every backup is processed even if
 * removing an earlier one failed, and removing the artifact and the record are attempted
 * independently of each other.
 */
public class RetentionPruner {
  private static final Logger LOG = LoggerFactory.getLogger(RetentionPruner.class);

  @VisibleForTesting
  static final String BACKUPS_PRUNED = "backups_pruned";
  @VisibleForTesting
  static final String PRUNE_FAILURES = "backup_prune_failures";

  private final BackupStore.Mutable backupStore;
  private final ArtifactStore artifactStore;
  private final Clock clock;
  private final AtomicLong backupsPruned;
  private final AtomicLong pruneFailures;

  @Inject
  RetentionPruner(
      BackupStore.Mutable backupStore,
      ArtifactStore artifactStore,
      Clock clock,
      StatsProvider statsProvider) {

    this.backupStore = requireNonNull(backupStore);
    this.artifactStore = requireNonNull(artifactStore);
    this.clock = requireNonNull(clock);
    this.backupsPruned = statsProvider.makeCounter(BACKUPS_PRUNED);
    this.pruneFailures = statsProvider.makeCounter(PRUNE_FAILURES);
  }

  /**
   * Deletes the backups of a connection created more than {@code retentionDays} days ago.
   *
   * @param connectionId Connection to prune.
   * @param retentionDays Size of the retention window in days, must be positive.
   * @return What was deleted and what failed.
   * @throws StorageException If the expired backups could not be listed.
   */
  public PruneResult pruneBackups(String connectionId, int retentionDays) {
    requireNonNull(connectionId);
    checkArgument(retentionDays > 0, "Retention days must be positive: %s", retentionDays);

    Instant cutoff = clock.nowInstant().minus(Duration.ofDays(retentionDays));
    List<BackupRecord> expired =
        ImmutableList.copyOf(backupStore.fetchBackupsOlderThan(connectionId, cutoff));
    if (expired.isEmpty()) {
      return PruneResult.builder().build();
    }

    LOG.info("Deleting " + expired.size() + " backups of connection " + connectionId
        + " created before " + cutoff);
    PruneResult.Builder result = PruneResult.builder();
    for (BackupRecord backup : expired) {
      prune(backup, result);
    }
    return result.build();
  }

  private void prune(BackupRecord backup, PruneResult.Builder result) {
    try {
      artifactStore.remove(backup.getPath());
    } catch (IOException | RuntimeException e) {
      pruneFailures.incrementAndGet();
      result.artifactFailed(backup.getId());
      LOG.error("Failed to delete backup file " + backup.getPath() + ": " + e, e);
    }

    try {
      backupStore.deleteBackup(backup.getId());
      backupsPruned.incrementAndGet();
      result.deleted(backup.getId());
    } catch (RuntimeException e) {
      pruneFailures.incrementAndGet();
      result.recordFailed(backup.getId());
      LOG.error("Failed to delete backup record " + backup.getId() + ": " + e, e);
    }
  }
}
