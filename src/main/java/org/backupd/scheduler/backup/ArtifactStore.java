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

/**
 * Storage holding backup artifacts.
 */
public interface ArtifactStore {

  /**
   * Removes an artifact. Removing an artifact that does not exist is not an error.
   *
   * @param path Location of the artifact.
   * @throws IOException If the artifact exists but could not be removed.
   */
  void remove(String path) throws IOException;
}
