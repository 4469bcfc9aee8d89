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

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.concurrent.locks.Lock;

import javax.inject.Inject;
import javax.inject.Qualifier;

import com.google.common.util.concurrent.Striped;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Serializes schedule mutations per connection. Distinct connections may share a stripe, which
 * only costs parallelism.
 */
public class ConnectionLocks {

  /**
   * Binding annotation for the number of lock stripes.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  public @interface LockStripes { }

  private final Striped<Lock> locks;

  @Inject
  public ConnectionLocks(@LockStripes int stripes) {
    checkArgument(stripes > 0, "Lock stripes must be positive, got %s", stripes);
    this.locks = Striped.lazyWeakLock(stripes);
  }

  /**
   * Gets the lock guarding a connection's schedule.
   *
   * @param connectionId Connection to lock.
   * @return The connection's lock, always the same instance while it is referenced.
   */
  public Lock forConnection(String connectionId) {
    return locks.get(connectionId);
  }
}
