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
package org.backupd.scheduler.storage.mem;

import javax.inject.Singleton;

import com.google.inject.PrivateModule;

import org.backupd.scheduler.storage.BackupStore;
import org.backupd.scheduler.storage.ScheduleStore;

/**
 * Binding module for in-memory stores.
 */
public final class MemStorageModule extends PrivateModule {

  private <T> void bindStore(Class<T> binding, Class<? extends T> impl) {
    bind(binding).to(impl);
    bind(impl).in(Singleton.class);
    expose(binding);
  }

  @Override
  protected void configure() {
    bindStore(ScheduleStore.Mutable.class, MemScheduleStore.class);
    bindStore(BackupStore.Mutable.class, MemBackupStore.class);
  }
}
