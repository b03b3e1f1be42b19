/*
 * Copyright (C) 2016 Keith M. Hughes
 * Forked from code (c) Michael S. Klishin, Alex Petrov, 2011-2015.
 * Forked from code from MuleSoft.
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

import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.quartz.Calendar;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.SchedulerConfigException;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.JobStore;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.quartz.spi.TriggerFiredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.db.OrientDB;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.InternalClassLoaderHelper;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.CollectionNames;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.OrientDbConnector;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.OrientDbConnector.StoreMethod;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Clock;

/**
 * The Quartz Job Store that uses OrientDB and can be shared by several
 * scheduler instances.
 *
 * <p>
 * Instances sharing a database coordinate only through the records in it.
 * Each instance keeps a liveness lease, and work held by an instance whose
 * lease runs out is taken back by the others.
 */
public class CoordinatedOrientDbJobStore implements JobStore {

  private static final Logger LOG = LoggerFactory.getLogger(CoordinatedOrientDbJobStore.class);

  /**
   * The default for the misfire threshold, in milliseconds.
   */
  public static final long DEFAULT_MISFIRE_THRESHOLD = 5000;

  /**
   * The default for how long a liveness lease lasts, in milliseconds.
   */
  public static final long DEFAULT_INSTANCE_LEASE_MILLIS = 10 * 60 * 1000L;

  /**
   * The retry delay after a failed acquisition.
   */
  private static final long ACQUIRE_RETRY_DELAY = 15000L;

  /**
   * The retry delay when an acquisition has not failed yet.
   */
  private static final long ACQUIRE_FIRST_RETRY_DELAY = 20L;

  private String collectionPrefix = CollectionNames.DEFAULT_PREFIX;
  private String dbName = "quartz";
  private String databaseType;
  private String instanceName = "QuartzScheduler";
  private String instanceId;
  private String orientDbUri;
  private String username = "admin";
  private String password = "admin";

  /**
   * An OrientDB context supplied from outside, can be {@code null}.
   */
  private OrientDB orientDb;

  private ClassLoader externalClassLoader;

  /**
   * The threshold for detecting misfires.
   */
  private long misfireThreshold = DEFAULT_MISFIRE_THRESHOLD;

  private long instanceLeaseMillis = DEFAULT_INSTANCE_LEASE_MILLIS;

  /**
   * The clock to use for timing events.
   */
  private Clock clock = Clock.SYSTEM_CLOCK;

  /**
   * The assembler for the job store.
   */
  private final StandardOrientDbStoreAssembler assembler = new StandardOrientDbStoreAssembler();

  /**
   * Construct a job store.
   */
  public CoordinatedOrientDbJobStore() {
  }

  /**
   * Construct a job store.
   *
   * @param orientDbUri
   *          the URI for the OrientDB database
   * @param username
   *          the user name for the database
   * @param password
   *          the password for the database
   */
  public CoordinatedOrientDbJobStore(String orientDbUri, String username, String password) {
    this.orientDbUri = orientDbUri;
    this.username = username;
    this.password = password;
  }

  /**
   * Get the class load helper to use for jobs and triggers.
   *
   * @param original
   *          default provided by Quartz
   *
   * @return loader to use for loading of Quartz Jobs classes
   */
  private ClassLoadHelper getClassLoaderHelper(ClassLoadHelper original) {
    if (externalClassLoader != null) {
      return new InternalClassLoaderHelper(externalClassLoader, original);
    }

    return original;
  }

  @Override
  public void initialize(ClassLoadHelper loadHelper, SchedulerSignaler schedulerSignaler)
      throws SchedulerConfigException {
    if (instanceId == null) {
      throw new SchedulerConfigException("The scheduler instance id must be set");
    }

    LOG.info("Initializing job store for scheduler instance {} of {}", instanceId, instanceName);

    assembler.build(this, getClassLoaderHelper(loadHelper), schedulerSignaler);
  }

  @Override
  public void schedulerStarted() throws SchedulerException {
    LOG.debug("Scheduler {} started, recovering orphaned triggers", instanceId);

    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getLivenessTracker().checkForLiveNamesake();

        // Anything still held under this id is from an earlier run.
        assembler.getLivenessTracker().releaseSelf(true);
        assembler.getLivenessTracker().setSchedulerState(Constants.SCHEDULER_STATE_RUNNING);

        return null;
      }
    });
  }

  @Override
  public void schedulerPaused() {
    LOG.debug("Scheduler {} paused", instanceId);
    changeSchedulerState(Constants.SCHEDULER_STATE_PAUSED);
  }

  @Override
  public void schedulerResumed() {
    LOG.debug("Scheduler {} resumed", instanceId);
    changeSchedulerState(Constants.SCHEDULER_STATE_RESUMING);
  }

  private void changeSchedulerState(final String state) {
    try {
      getConnector().doInLock(new StoreMethod<Void>() {
        @Override
        public Void doInStore() throws JobPersistenceException {
          assembler.getLivenessTracker().setSchedulerState(state);

          return null;
        }
      });
    } catch (JobPersistenceException e) {
      LOG.error("Could not record scheduler state {} for instance {}", state, instanceId, e);
    }
  }

  @Override
  public void shutdown() {
    LOG.debug("Scheduler {} shutting down", instanceId);

    OrientDbConnector orientDbConnector = assembler.getOrientDbConnector();
    if (orientDbConnector == null) {
      return;
    }

    try {
      orientDbConnector.doInLock(new StoreMethod<Void>() {
        @Override
        public Void doInStore() throws JobPersistenceException {
          assembler.getLivenessTracker().releaseSelf(false);
          assembler.getLivenessTracker().removeSelf();

          return null;
        }
      });
    } catch (JobPersistenceException e) {
      LOG.error("Could not release the triggers held by scheduler instance {}", instanceId, e);
    }

    orientDbConnector.shutdown();
  }

  @Override
  public boolean supportsPersistence() {
    return true;
  }

  @Override
  public long getEstimatedTimeToReleaseAndAcquireTrigger() {
    return 100;
  }

  @Override
  public boolean isClustered() {
    return true;
  }

  @Override
  public long getAcquireRetryDelay(int failureCount) {
    return failureCount == 0 ? ACQUIRE_FIRST_RETRY_DELAY : ACQUIRE_RETRY_DELAY;
  }

  @Override
  public void storeJob(final JobDetail newJob, final boolean replaceExisting)
      throws JobPersistenceException {
    LOG.debug("Storing job {}, replacing: {}", newJob, replaceExisting);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getPersister().storeJob(newJob, replaceExisting);

        return null;
      }
    });
  }

  @Override
  public void storeJobAndTrigger(final JobDetail newJob, final OperableTrigger newTrigger)
      throws JobPersistenceException {
    LOG.debug("Storing job {} together with trigger {}", newJob, newTrigger);
    getConnector().doInTransaction(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getPersister().storeJobAndTrigger(newJob, newTrigger);

        return null;
      }
    });
  }

  @Override
  public void storeJobsAndTriggers(final Map<JobDetail, Set<? extends Trigger>> triggersAndJobs,
      final boolean replace) throws JobPersistenceException {
    LOG.debug("Storing {} jobs with their triggers, replacing: {}", triggersAndJobs.size(),
        replace);
    getConnector().doInTransaction(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getPersister().storeJobsAndTriggers(triggersAndJobs, replace);

        return null;
      }
    });
  }

  @Override
  public boolean removeJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Deleting job {} and its triggers", jobKey);
    return getConnector().doInTransaction(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getPersister().removeJob(jobKey);
      }
    }).booleanValue();
  }

  @Override
  public boolean removeJobs(final List<JobKey> jobKeys) throws JobPersistenceException {
    LOG.debug("Deleting jobs {}", jobKeys);
    return getConnector().doInTransaction(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getPersister().removeJobs(jobKeys);
      }
    }).booleanValue();
  }

  @Override
  public JobDetail retrieveJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Loading job {}", jobKey);
    return getConnector().doInLock(new StoreMethod<JobDetail>() {
      @Override
      public JobDetail doInStore() throws JobPersistenceException {
        return assembler.getJobDao().retrieveJob(jobKey);
      }
    });
  }

  @Override
  public void storeTrigger(final OperableTrigger newTrigger, final boolean replaceExisting)
      throws JobPersistenceException {
    LOG.debug("Storing trigger {}, replacing: {}", newTrigger, replaceExisting);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getPersister().storeTrigger(newTrigger, replaceExisting);

        return null;
      }
    });
  }

  @Override
  public boolean removeTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Deleting trigger {}", triggerKey);
    return getConnector().doInLock(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getPersister().removeTrigger(triggerKey);
      }
    }).booleanValue();
  }

  @Override
  public boolean removeTriggers(final List<TriggerKey> triggerKeys) throws JobPersistenceException {
    LOG.debug("Deleting triggers {}", triggerKeys);
    return getConnector().doInLock(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getPersister().removeTriggers(triggerKeys);
      }
    }).booleanValue();
  }

  @Override
  public boolean replaceTrigger(final TriggerKey triggerKey, final OperableTrigger newTrigger)
      throws JobPersistenceException {
    LOG.debug("Swapping trigger {} for {}", triggerKey, newTrigger);
    return getConnector().doInTransaction(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getPersister().replaceTrigger(triggerKey, newTrigger);
      }
    }).booleanValue();
  }

  @Override
  public OperableTrigger retrieveTrigger(final TriggerKey triggerKey)
      throws JobPersistenceException {
    LOG.debug("Loading trigger {}", triggerKey);
    return getConnector().doInLock(new StoreMethod<OperableTrigger>() {
      @Override
      public OperableTrigger doInStore() throws JobPersistenceException {
        return assembler.getTriggerDao().getTrigger(triggerKey);
      }
    });
  }

  @Override
  public boolean checkExists(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Does job {} exist?", jobKey);
    return getConnector().doInLock(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getJobDao().exists(jobKey);
      }
    }).booleanValue();
  }

  @Override
  public boolean checkExists(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Does trigger {} exist?", triggerKey);
    return getConnector().doInLock(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getTriggerDao().exists(triggerKey);
      }
    }).booleanValue();
  }

  @Override
  public void clearAllSchedulingData() throws JobPersistenceException {
    LOG.debug("Wiping jobs, triggers, calendars and group markers");
    getConnector().doInTransaction(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerDao().removeAll();
        assembler.getJobDao().removeAll();
        assembler.getCalendarDao().removeAll();
        assembler.getPausedJobGroupsDao().removeAll();
        assembler.getPausedTriggerGroupsDao().removeAll();
        assembler.getBlockedJobsDao().removeAll();

        return null;
      }
    });
  }

  @Override
  public void storeCalendar(final String name, final Calendar calendar,
      final boolean replaceExisting, final boolean updateTriggers)
      throws JobPersistenceException {
    LOG.debug("Storing calendar {} ({}), replacing: {}", name, calendar, replaceExisting);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getPersister().storeCalendar(name, calendar, replaceExisting, updateTriggers);

        return null;
      }
    });
  }

  @Override
  public boolean removeCalendar(final String calName) throws JobPersistenceException {
    LOG.debug("Deleting calendar {}", calName);
    return getConnector().doInLock(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getPersister().removeCalendar(calName);
      }
    }).booleanValue();
  }

  @Override
  public Calendar retrieveCalendar(final String calName) throws JobPersistenceException {
    LOG.debug("Loading calendar {}", calName);
    return getConnector().doInLock(new StoreMethod<Calendar>() {
      @Override
      public Calendar doInStore() throws JobPersistenceException {
        return assembler.getCalendarDao().retrieveCalendar(calName);
      }
    });
  }

  @Override
  public int getNumberOfJobs() throws JobPersistenceException {
    LOG.debug("Counting jobs");
    return getConnector().doInLock(new StoreMethod<Integer>() {
      @Override
      public Integer doInStore() throws JobPersistenceException {
        return assembler.getJobDao().getCount();
      }
    }).intValue();
  }

  @Override
  public int getNumberOfTriggers() throws JobPersistenceException {
    LOG.debug("Counting triggers");
    return getConnector().doInLock(new StoreMethod<Integer>() {
      @Override
      public Integer doInStore() throws JobPersistenceException {
        return assembler.getTriggerDao().getCount();
      }
    }).intValue();
  }

  @Override
  public int getNumberOfCalendars() throws JobPersistenceException {
    LOG.debug("Counting calendars");
    return getConnector().doInLock(new StoreMethod<Integer>() {
      @Override
      public Integer doInStore() throws JobPersistenceException {
        return assembler.getCalendarDao().getCount();
      }
    }).intValue();
  }

  @Override
  public Set<JobKey> getJobKeys(final GroupMatcher<JobKey> matcher) throws JobPersistenceException {
    LOG.debug("Listing job keys matching {}", matcher);
    return getConnector().doInLock(new StoreMethod<Set<JobKey>>() {
      @Override
      public Set<JobKey> doInStore() throws JobPersistenceException {
        return assembler.getJobDao().getJobKeys(matcher);
      }
    });
  }

  @Override
  public Set<TriggerKey> getTriggerKeys(final GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    LOG.debug("Listing trigger keys matching {}", matcher);
    return getConnector().doInLock(new StoreMethod<Set<TriggerKey>>() {
      @Override
      public Set<TriggerKey> doInStore() throws JobPersistenceException {
        return assembler.getTriggerDao().getTriggerKeys(matcher);
      }
    });
  }

  @Override
  public List<String> getJobGroupNames() throws JobPersistenceException {
    LOG.debug("Listing job groups");
    return getConnector().doInLock(new StoreMethod<List<String>>() {
      @Override
      public List<String> doInStore() throws JobPersistenceException {
        return assembler.getJobDao().getGroupNames();
      }
    });
  }

  @Override
  public List<String> getTriggerGroupNames() throws JobPersistenceException {
    LOG.debug("Listing trigger groups");
    return getConnector().doInLock(new StoreMethod<List<String>>() {
      @Override
      public List<String> doInStore() throws JobPersistenceException {
        return assembler.getTriggerDao().getGroupNames();
      }
    });
  }

  @Override
  public List<String> getCalendarNames() throws JobPersistenceException {
    LOG.debug("Listing calendar names");
    return getConnector().doInLock(new StoreMethod<List<String>>() {
      @Override
      public List<String> doInStore() throws JobPersistenceException {
        return assembler.getCalendarDao().getNames();
      }
    });
  }

  @Override
  public List<OperableTrigger> getTriggersForJob(final JobKey jobKey)
      throws JobPersistenceException {
    LOG.debug("Listing triggers of job {}", jobKey);
    return getConnector().doInLock(new StoreMethod<List<OperableTrigger>>() {
      @Override
      public List<OperableTrigger> doInStore() throws JobPersistenceException {
        return assembler.getPersister().getTriggersForJob(jobKey);
      }
    });
  }

  @Override
  public TriggerState getTriggerState(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Reading state of trigger {}", triggerKey);
    return getConnector().doInLock(new StoreMethod<TriggerState>() {
      @Override
      public TriggerState doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().getState(triggerKey);
      }
    });
  }

  @Override
  public void resetTriggerFromErrorState(final TriggerKey triggerKey)
      throws JobPersistenceException {
    LOG.debug("Clearing error state of trigger {}", triggerKey);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerStateManager().resetTriggerFromErrorState(triggerKey);

        return null;
      }
    });
  }

  @Override
  public void pauseTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Pausing trigger {}", triggerKey);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerStateManager().pause(triggerKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> pauseTriggers(final GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    LOG.debug("Pausing trigger groups matching {}", matcher);
    return getConnector().doInLock(new StoreMethod<Collection<String>>() {
      @Override
      public Collection<String> doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().pause(matcher);
      }
    });
  }

  @Override
  public void resumeTrigger(final TriggerKey triggerKey) throws JobPersistenceException {
    LOG.debug("Resuming trigger {}", triggerKey);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerStateManager().resume(triggerKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> resumeTriggers(final GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    LOG.debug("Resuming trigger groups matching {}", matcher);
    return getConnector().doInLock(new StoreMethod<Collection<String>>() {
      @Override
      public Collection<String> doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().resume(matcher);
      }
    });
  }

  @Override
  public Set<String> getPausedTriggerGroups() throws JobPersistenceException {
    LOG.debug("Listing paused trigger groups");
    return getConnector().doInLock(new StoreMethod<Set<String>>() {
      @Override
      public Set<String> doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().getPausedTriggerGroups();
      }
    });
  }

  /**
   * Is a trigger group paused?
   *
   * @param group
   *          the trigger group
   *
   * @return {@code true} if the group carries a paused marker
   *
   * @throws JobPersistenceException
   *           the database could not be read
   */
  public boolean isTriggerGroupPaused(final String group) throws JobPersistenceException {
    return getConnector().doInLock(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().isTriggerGroupPaused(group);
      }
    });
  }

  /**
   * Is a job group paused?
   *
   * @param group
   *          the job group
   *
   * @return {@code true} if the group carries a paused marker
   *
   * @throws JobPersistenceException
   *           the database could not be read
   */
  public boolean isJobGroupPaused(final String group) throws JobPersistenceException {
    return getConnector().doInLock(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().isJobGroupPaused(group);
      }
    });
  }

  @Override
  public void pauseAll() throws JobPersistenceException {
    LOG.debug("Pausing every trigger group");
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerStateManager().pauseAll();

        return null;
      }
    });
  }

  @Override
  public void resumeAll() throws JobPersistenceException {
    LOG.debug("Resuming every trigger group");
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerStateManager().resumeAll();

        return null;
      }
    });
  }

  @Override
  public void pauseJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Pausing triggers of job {}", jobKey);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerStateManager().pauseJob(jobKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> pauseJobs(final GroupMatcher<JobKey> groupMatcher)
      throws JobPersistenceException {
    LOG.debug("Pausing job groups matching {}", groupMatcher);
    return getConnector().doInLock(new StoreMethod<Collection<String>>() {
      @Override
      public Collection<String> doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().pauseJobs(groupMatcher);
      }
    });
  }

  @Override
  public void resumeJob(final JobKey jobKey) throws JobPersistenceException {
    LOG.debug("Resuming triggers of job {}", jobKey);
    getConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getTriggerStateManager().resume(jobKey);

        return null;
      }
    });
  }

  @Override
  public Collection<String> resumeJobs(final GroupMatcher<JobKey> groupMatcher)
      throws JobPersistenceException {
    LOG.debug("Resuming job groups matching {}", groupMatcher);
    return getConnector().doInLock(new StoreMethod<Collection<String>>() {
      @Override
      public Collection<String> doInStore() throws JobPersistenceException {
        return assembler.getTriggerStateManager().resumeJobs(groupMatcher);
      }
    });
  }

  @Override
  public List<OperableTrigger> acquireNextTriggers(final long noLaterThan, final int maxCount,
      final long timeWindow) throws JobPersistenceException {
    LOG.debug("Acquiring up to {} triggers due by {} ({}), window {} ms", maxCount, noLaterThan,
        new Date(noLaterThan), timeWindow);
    return getConnector().doInLock(new StoreMethod<List<OperableTrigger>>() {
      @Override
      public List<OperableTrigger> doInStore() throws JobPersistenceException {
        return assembler.getTriggerRunner().acquireNext(noLaterThan, maxCount, timeWindow);
      }
    });
  }

  @Override
  public void releaseAcquiredTrigger(final OperableTrigger trigger) {
    LOG.debug("Handing back acquired trigger {}", trigger);
    try {
      getConnector().doInLock(new StoreMethod<Void>() {
        @Override
        public Void doInStore() throws JobPersistenceException {
          assembler.getTriggerRunner().releaseAcquiredTrigger(trigger);

          return null;
        }
      });
    } catch (JobPersistenceException e) {
      LOG.error("Could not release acquired trigger {}", trigger.getKey(), e);
    }
  }

  @Override
  public List<TriggerFiredResult> triggersFired(final List<OperableTrigger> triggers)
      throws JobPersistenceException {
    LOG.debug("Firing triggers {}", triggers);
    return getConnector().doInLock(new StoreMethod<List<TriggerFiredResult>>() {
      @Override
      public List<TriggerFiredResult> doInStore() throws JobPersistenceException {
        return assembler.getTriggerRunner().triggersFired(triggers);
      }
    });
  }

  @Override
  public void triggeredJobComplete(final OperableTrigger trigger, final JobDetail job,
      final CompletedExecutionInstruction triggerInstCode) {
    LOG.debug("Job {} finished for trigger {}, instruction {}", job.getKey(),
        trigger.getKey(), triggerInstCode);
    try {
      getConnector().doInLock(new StoreMethod<Void>() {
        @Override
        public Void doInStore() throws JobPersistenceException {
          assembler.getJobCompleteHandler().jobComplete(trigger, job, triggerInstCode);

          return null;
        }
      });
    } catch (JobPersistenceException e) {
      LOG.error("Could not complete trigger {} for job {}", trigger.getKey(), job.getKey(), e);
    }
  }

  private OrientDbConnector getConnector() {
    return assembler.getOrientDbConnector();
  }

  @Override
  public void setInstanceId(String instanceId) {
    this.instanceId = instanceId;
  }

  public String getInstanceId() {
    return instanceId;
  }

  @Override
  public void setInstanceName(String instanceName) {
    this.instanceName = instanceName;
  }

  public String getInstanceName() {
    return instanceName;
  }

  @Override
  public void setThreadPoolSize(int poolSize) {
    // No-op
  }

  public String getDbName() {
    return dbName;
  }

  public void setDbName(String dbName) {
    this.dbName = dbName;
  }

  public String getDatabaseType() {
    return databaseType;
  }

  /**
   * Set the type of database created when it does not exist yet.
   *
   * @param databaseType
   *          {@code memory} or {@code plocal}
   */
  public void setDatabaseType(String databaseType) {
    this.databaseType = databaseType;
  }

  public String getCollectionPrefix() {
    return collectionPrefix;
  }

  public void setCollectionPrefix(String prefix) {
    collectionPrefix = prefix;
  }

  public void setOrientDbUri(String orientDbUri) {
    this.orientDbUri = orientDbUri;
  }

  public String getOrientDbUri() {
    return orientDbUri;
  }

  /**
   * Share an OrientDB context with the job store. The store will not close it.
   *
   * @param orientDb
   *          the context
   */
  public void setOrientDb(OrientDB orientDb) {
    this.orientDb = orientDb;
  }

  public OrientDB getOrientDb() {
    return orientDb;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getUsername() {
    return username;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getPassword() {
    return password;
  }

  public void setMisfireThreshold(long misfireThreshold) {
    if (misfireThreshold < 1) {
      throw new IllegalArgumentException("Misfire threshold must be larger than 0");
    }
    this.misfireThreshold = misfireThreshold;
  }

  public long getMisfireThreshold() {
    return misfireThreshold;
  }

  public void setInstanceLeaseMillis(long instanceLeaseMillis) {
    if (instanceLeaseMillis < 1) {
      throw new IllegalArgumentException("Instance lease must be larger than 0");
    }
    this.instanceLeaseMillis = instanceLeaseMillis;
  }

  public long getInstanceLeaseMillis() {
    return instanceLeaseMillis;
  }

  public Clock getClock() {
    return clock;
  }

  public void setClock(Clock clock) {
    this.clock = clock;
  }

  public void setExternalClassLoader(ClassLoader externalClassLoader) {
    this.externalClassLoader = externalClassLoader;
  }
}
