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
import java.nio.file.Files;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Artifact store on the local filesystem.
 */
class LocalArtifactStore implements ArtifactStore {
  private static final Logger LOG = LoggerFactory.getLogger(LocalArtifactStore.class);

  @Override
  public void remove(String path) throws IOException {
    if (Files.deleteIfExists(Paths.get(path))) {
      LOG.info("Deleted backup file " + path);
    } else {
      LOG.warn("Backup file " + path + " was already gone");
    }
  }
}
