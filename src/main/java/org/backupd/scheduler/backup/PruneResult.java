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

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * Outcome of a single retention pass, accumulated per expired backup.
 */
public final class PruneResult {
  private final ImmutableList<String> deleted;
  private final ImmutableList<String> artifactFailures;
  private final ImmutableList<String> recordFailures;

  private PruneResult(Builder builder) {
    this.deleted = builder.deleted.build();
    this.artifactFailures = builder.artifactFailures.build();
    this.recordFailures = builder.recordFailures.build();
  }

  static Builder builder() {
    return new Builder();
  }

  /**
   * Ids of backups whose record was removed.
   */
  public ImmutableList<String> getDeleted() {
    return deleted;
  }

  /**
   * Ids of backups whose artifact could not be removed.
   */
  public ImmutableList<String> getArtifactFailures() {
    return artifactFailures;
  }

  /**
   * Ids of backups whose record could not be removed.
   */
  public ImmutableList<String> getRecordFailures() {
    return recordFailures;
  }

  public boolean isClean() {
    return artifactFailures.isEmpty() && recordFailures.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PruneResult)) {
      return false;
    }
    PruneResult that = (PruneResult) o;
    return Objects.equals(deleted, that.deleted)
        && Objects.equals(artifactFailures, that.artifactFailures)
        && Objects.equals(recordFailures, that.recordFailures);
  }

  @Override
  public int hashCode() {
    return Objects.hash(deleted, artifactFailures, recordFailures);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("deleted", deleted)
        .add("artifactFailures", artifactFailures)
        .add("recordFailures", recordFailures)
        .toString();
  }

  static final class Builder {
    private final ImmutableList.Builder<String> deleted = ImmutableList.builder();
    private final ImmutableList.Builder<String> artifactFailures = ImmutableList.builder();
    private final ImmutableList.Builder<String> recordFailures = ImmutableList.builder();

    private Builder() {
      // Use PruneResult.builder().
    }

    Builder deleted(String backupId) {
      deleted.add(backupId);
      return this;
    }

    Builder artifactFailed(String backupId) {
      artifactFailures.add(backupId);
      return this;
    }

    Builder recordFailed(String backupId) {
      recordFailures.add(backupId);
      return this;
    }

    PruneResult build() {
      return new PruneResult(this);
    }
  }
}
