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
package org.backupd.scheduler.app;

import java.util.Set;

import javax.inject.Singleton;

import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.binder.LinkedBindingBuilder;
import com.google.inject.multibindings.Multibinder;

import org.backupd.common.stats.Stats;
import org.backupd.common.stats.StatsProvider;
import org.backupd.common.util.Clock;
import org.backupd.scheduler.backup.BackupModule;
import org.backupd.scheduler.config.CliOptions;
import org.backupd.scheduler.cron.quartz.CronModule;
import org.backupd.scheduler.events.PubsubEventModule;
import org.backupd.scheduler.storage.mem.MemStorageModule;

import static java.util.Objects.requireNonNull;

/**
 * Composes the backup scheduler for a host process.
 * <p>
 * The host binds a {@link org.backupd.scheduler.backup.BackupCreator}, then starts the provided
 * {@link ServiceManager} to start firing schedules.
 */
public class BackupSchedulerModule extends AbstractModule {

  /**
   * Registers a Service to run for the lifetime of the scheduler.
   *
   * Usage: {@code addServiceBinding(binder()).to(YourService.class)}.
   *
   * @param binder Binder for the current non-private module.
   * @return a linked binding builder with the normal Guice EDSL methods.
   */
  public static LinkedBindingBuilder<Service> addServiceBinding(Binder binder) {
    return Multibinder.newSetBinder(binder, Service.class).addBinding();
  }

  private final CliOptions options;

  public BackupSchedulerModule(CliOptions options) {
    this.options = requireNonNull(options);
  }

  @Override
  protected void configure() {
    Multibinder.newSetBinder(binder(), Service.class);

    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);
    bind(StatsProvider.class).toInstance(Stats.STATS_PROVIDER);

    install(new MemStorageModule());
    install(new PubsubEventModule());
    install(new CronModule(options.cron));
    install(new BackupModule(options.backup));
  }

  @Provides
  @Singleton
  ServiceManager provideServiceManager(Set<Service> services) {
    return new ServiceManager(services);
  }
}
