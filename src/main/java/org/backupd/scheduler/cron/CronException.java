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
package org.backupd.scheduler.cron;

/**
 * Indicates a failure to register, remove or trigger a schedule with the cron system.
 */
public class CronException extends Exception {
  public CronException(String msg) {
    super(msg);
  }

  public CronException(String msg, Throwable t) {
    super(msg, t);
  }

  public CronException(Throwable t) {
    super(t);
  }
}
