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

package io.smartspaces.scheduling.quartz.coordinated.internal;

import java.util.ArrayList;
import java.util.List;

import org.quartz.SchedulerConfigException;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.SchedulerSignaler;

import com.orientechnologies.orient.core.db.ODatabaseType;

import io.smartspaces.scheduling.quartz.coordinated.CoordinatedOrientDbJobStore;
import io.smartspaces.scheduling.quartz.coordinated.internal.cluster.FireInstanceIdGenerator;
import io.smartspaces.scheduling.quartz.coordinated.internal.cluster.InstanceLivenessTracker;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardBlockedJobsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardPausedJobGroupsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardPausedTriggerGroupsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardSchedulerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.CollectionNames;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.StandardOrientDbConnector;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StandardMisfireHandler;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.properties.CalendarIntervalTriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.properties.CronTriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.properties.DailyTimeIntervalTriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.properties.SimpleTriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Clock;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.QueryHelper;

/**
 * This class creates the database connection, does initial database schema
 * building, and wires the components of the job store together.
 */
public class StandardOrientDbStoreAssembler {

  private CollectionNames collectionNames;
  private StandardOrientDbConnector orientDbConnector;

  private JobCompleteHandler jobCompleteHandler;
  private TriggerStateManager triggerStateManager;
  private TriggerRunner triggerRunner;
  private TriggerAndJobPersister persister;
  private MisfireHandler misfireHandler;
  private InstanceLivenessTracker livenessTracker;

  private StandardCalendarDao calendarDao;
  private StandardJobDao jobDao;
  private StandardSchedulerDao schedulerDao;
  private StandardPausedJobGroupsDao pausedJobGroupsDao;
  private StandardPausedTriggerGroupsDao pausedTriggerGroupsDao;
  private StandardBlockedJobsDao blockedJobsDao;
  private StandardTriggerDao triggerDao;

  private final QueryHelper queryHelper = new QueryHelper();

  public void build(CoordinatedOrientDbJobStore jobStore, ClassLoadHelper loadHelper,
      SchedulerSignaler signaler) throws SchedulerConfigException {
    Clock clock = jobStore.getClock();
    String instanceId = jobStore.getInstanceId();

    collectionNames = new CollectionNames(jobStore.getCollectionPrefix());
    orientDbConnector = createOrientDbConnector(jobStore);

    JobConverter jobConverter = new JobConverter(loadHelper);
    TriggerConverter triggerConverter =
        new TriggerConverter(createPropertiesConverters(), collectionNames.getTriggers(),
            loadHelper);

    jobDao = new StandardJobDao(this, queryHelper, jobConverter);
    triggerDao = new StandardTriggerDao(this, queryHelper, triggerConverter);
    calendarDao = new StandardCalendarDao(this);
    pausedJobGroupsDao = new StandardPausedJobGroupsDao(this);
    pausedTriggerGroupsDao = new StandardPausedTriggerGroupsDao(this);
    blockedJobsDao = new StandardBlockedJobsDao(this, queryHelper);
    schedulerDao =
        new StandardSchedulerDao(this, instanceId, jobStore.getInstanceName(), clock);

    misfireHandler = new StandardMisfireHandler(triggerDao, calendarDao, triggerConverter,
        signaler, jobStore.getMisfireThreshold(), clock);

    triggerStateManager = new TriggerStateManager(triggerDao, jobDao, pausedJobGroupsDao,
        pausedTriggerGroupsDao, blockedJobsDao, misfireHandler, queryHelper);

    persister = new TriggerAndJobPersister(triggerDao, jobDao, calendarDao, triggerConverter,
        triggerStateManager, misfireHandler, signaler);

    livenessTracker = new InstanceLivenessTracker(schedulerDao, triggerDao, blockedJobsDao,
        triggerStateManager, jobStore.getInstanceLeaseMillis());

    triggerRunner = new TriggerRunner(triggerDao, jobDao, calendarDao, blockedJobsDao,
        triggerConverter, misfireHandler, triggerStateManager, livenessTracker,
        new FireInstanceIdGenerator(instanceId), instanceId, clock);

    jobCompleteHandler = new JobCompleteHandler(persister, triggerStateManager, signaler, jobDao,
        triggerDao, blockedJobsDao, instanceId);
  }

  public CollectionNames getCollectionNames() {
    return collectionNames;
  }

  public OrientDbConnector getOrientDbConnector() {
    return orientDbConnector;
  }

  public JobCompleteHandler getJobCompleteHandler() {
    return jobCompleteHandler;
  }

  public TriggerStateManager getTriggerStateManager() {
    return triggerStateManager;
  }

  public TriggerRunner getTriggerRunner() {
    return triggerRunner;
  }

  public TriggerAndJobPersister getPersister() {
    return persister;
  }

  public MisfireHandler getMisfireHandler() {
    return misfireHandler;
  }

  public InstanceLivenessTracker getLivenessTracker() {
    return livenessTracker;
  }

  public StandardCalendarDao getCalendarDao() {
    return calendarDao;
  }

  public StandardJobDao getJobDao() {
    return jobDao;
  }

  public StandardSchedulerDao getSchedulerDao() {
    return schedulerDao;
  }

  public StandardPausedJobGroupsDao getPausedJobGroupsDao() {
    return pausedJobGroupsDao;
  }

  public StandardPausedTriggerGroupsDao getPausedTriggerGroupsDao() {
    return pausedTriggerGroupsDao;
  }

  public StandardBlockedJobsDao getBlockedJobsDao() {
    return blockedJobsDao;
  }

  public StandardTriggerDao getTriggerDao() {
    return triggerDao;
  }

  private List<TriggerPropertiesConverter> createPropertiesConverters() {
    List<TriggerPropertiesConverter> converters = new ArrayList<>();
    converters.add(new SimpleTriggerPropertiesConverter());
    converters.add(new CalendarIntervalTriggerPropertiesConverter());
    converters.add(new CronTriggerPropertiesConverter());
    converters.add(new DailyTimeIntervalTriggerPropertiesConverter());

    return converters;
  }

  private StandardOrientDbConnector createOrientDbConnector(CoordinatedOrientDbJobStore jobStore)
      throws SchedulerConfigException {
    return StandardOrientDbConnector.builder().withUri(jobStore.getOrientDbUri())
        .withOrientDb(jobStore.getOrientDb())
        .withCredentials(jobStore.getUsername(), jobStore.getPassword())
        .withDatabaseName(jobStore.getDbName())
        .withDatabaseType(toDatabaseType(jobStore.getDatabaseType()))
        .withCollectionNames(collectionNames).build();
  }

  private ODatabaseType toDatabaseType(String databaseType) throws SchedulerConfigException {
    if (databaseType == null) {
      return null;
    }

    try {
      return ODatabaseType.valueOf(databaseType.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new SchedulerConfigException("Unknown OrientDB database type " + databaseType, e);
    }
  }
}
