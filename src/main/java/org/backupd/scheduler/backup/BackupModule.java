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

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.inject.AbstractModule;

import org.backupd.scheduler.backup.ConnectionLocks.LockStripes;
import org.backupd.scheduler.config.validators.PositiveNumber;
import org.backupd.scheduler.cron.FiringHandler;

/**
 * Binding module for backup schedule management and scheduled backup execution.
 * <p>
 * The host process must bind a {@link BackupCreator}.
 */
public class BackupModule extends AbstractModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-backup_lock_stripes",
        validateValueWith = PositiveNumber.class,
        description = "Number of lock stripes used to serialize schedule changes per connection.")
    public int backupLockStripes = 64;
  }

  private final Options options;

  public BackupModule() {
    this(new Options());
  }

  public BackupModule(Options options) {
    this.options = options;
  }

  @Override
  protected void configure() {
    bind(Integer.class).annotatedWith(LockStripes.class).toInstance(options.backupLockStripes);
    bind(ConnectionLocks.class).in(Singleton.class);

    bind(BackupScheduleManager.class).to(BackupScheduleManagerImpl.class);
    bind(BackupScheduleManagerImpl.class).in(Singleton.class);

    bind(FiringHandler.class).to(ScheduledBackupRunner.class);
    bind(ScheduledBackupRunner.class).in(Singleton.class);

    bind(RetentionPruner.class).in(Singleton.class);
    bind(ArtifactStore.class).to(LocalArtifactStore.class);
    bind(LocalArtifactStore.class).in(Singleton.class);
  }
}
