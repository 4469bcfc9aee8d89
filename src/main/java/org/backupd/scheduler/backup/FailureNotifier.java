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

/**
 * Alerts an operator that a scheduled backup failed.
 */
public interface FailureNotifier {

  /**
   * Reports a failed backup. Implementations may throw unchecked exceptions, which callers log
   * and otherwise ignore.
   *
   * @param connectionId Connection whose backup failed.
   * @param cause The failure.
   */
  void notifyFailure(String connectionId, Throwable cause);
}
