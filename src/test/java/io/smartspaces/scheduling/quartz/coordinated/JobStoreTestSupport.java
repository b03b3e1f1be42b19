/*
 * Copyright (C) 2016 Keith M. Hughes
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package io.smartspaces.scheduling.quartz.coordinated;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.simpl.CascadingClassLoadHelper;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.OperableTrigger;

import com.orientechnologies.orient.core.db.OrientDB;
import com.orientechnologies.orient.core.db.OrientDBConfig;

import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;

/**
 * Support for tests that run job stores against an in-memory OrientDB.
 *
 * <p>
 * Every test gets a database of its own. All stores created by a test share
 * it, so they behave like scheduler instances in separate processes.
 */
public abstract class JobStoreTestSupport {

  private static final AtomicInteger DB_COUNTER = new AtomicInteger();

  protected static OrientDB orientDb;

  protected String dbName;

  private final List<CoordinatedOrientDbJobStore> stores = new ArrayList<>();

  private final List<StandardOrientDbStoreAssembler> assemblers = new ArrayList<>();

  @BeforeAll
  static void startOrientDb() {
    orientDb = new OrientDB("memory:", OrientDBConfig.defaultConfig());
  }

  @AfterAll
  static void stopOrientDb() {
    orientDb.close();
  }

  @BeforeEach
  void createDatabaseName() {
    dbName = "quartzTest" + DB_COUNTER.incrementAndGet();
  }

  @AfterEach
  void shutdownStores() {
    for (CoordinatedOrientDbJobStore store : stores) {
      store.shutdown();
    }
    stores.clear();

    for (StandardOrientDbStoreAssembler assembler : assemblers) {
      assembler.getOrientDbConnector().shutdown();
    }
    assemblers.clear();

    if (orientDb.exists(dbName)) {
      orientDb.drop(dbName);
    }
  }

  /**
   * Create a started store for a new scheduler instance.
   */
  protected CoordinatedOrientDbJobStore createStore(String instanceId, TestClock clock,
      RecordingSchedulerSignaler signaler) throws SchedulerException {
    CoordinatedOrientDbJobStore store = new CoordinatedOrientDbJobStore();
    store.setOrientDb(orientDb);
    store.setDbName(dbName);
    store.setDatabaseType("memory");
    store.setInstanceId(instanceId);
    store.setInstanceName("TestScheduler");
    store.setMisfireThreshold(60000);
    store.setClock(clock);

    ClassLoadHelper loadHelper = new CascadingClassLoadHelper();
    loadHelper.initialize();
    store.initialize(loadHelper, signaler);
    stores.add(store);

    store.schedulerStarted();

    return store;
  }

  /**
   * Wire up the store components without the store facade, for tests that
   * drive a single component.
   */
  protected StandardOrientDbStoreAssembler createAssembler(String instanceId, TestClock clock,
      RecordingSchedulerSignaler signaler, long misfireThreshold) throws SchedulerException {
    CoordinatedOrientDbJobStore config = new CoordinatedOrientDbJobStore();
    config.setOrientDb(orientDb);
    config.setDbName(dbName);
    config.setDatabaseType("memory");
    config.setInstanceId(instanceId);
    config.setInstanceName("TestScheduler");
    config.setMisfireThreshold(misfireThreshold);
    config.setClock(clock);

    ClassLoadHelper loadHelper = new CascadingClassLoadHelper();
    loadHelper.initialize();

    StandardOrientDbStoreAssembler assembler = new StandardOrientDbStoreAssembler();
    assembler.build(config, loadHelper, signaler);
    assemblers.add(assembler);

    return assembler;
  }

  /**
   * Shut a store down before the end of the test.
   */
  protected void shutdownStore(CoordinatedOrientDbJobStore store) {
    stores.remove(store);
    store.shutdown();
  }

  protected JobDetail newJob(String name, Class<? extends Job> jobClass, boolean durable) {
    return JobBuilder.newJob(jobClass).withIdentity(name, "jobs").storeDurably(durable).build();
  }

  /**
   * Create a simple trigger with its first fire time computed, the way the
   * scheduler hands triggers to the store.
   *
   * @param repeatMillis
   *          the repeat interval, 0 for a trigger that fires once
   */
  protected OperableTrigger newTrigger(TriggerKey triggerKey, JobKey jobKey, Date startAt,
      long repeatMillis) {
    SimpleScheduleBuilder schedule = SimpleScheduleBuilder.simpleSchedule();
    if (repeatMillis > 0) {
      schedule = schedule.withIntervalInMilliseconds(repeatMillis).repeatForever();
    }

    OperableTrigger trigger = (OperableTrigger) TriggerBuilder.newTrigger()
        .withIdentity(triggerKey).forJob(jobKey).startAt(startAt).withSchedule(schedule).build();
    trigger.computeFirstFireTime(null);

    return trigger;
  }

  protected Date secondsFromNow(int seconds) {
    return new Date(System.currentTimeMillis() + seconds * 1000L);
  }
}
