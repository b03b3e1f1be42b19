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

package io.smartspaces.scheduling.quartz.coordinated.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.quartz.Calendar;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.TriggerFiredBundle;
import org.quartz.spi.TriggerFiredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.cluster.FireInstanceIdGenerator;
import io.smartspaces.scheduling.quartz.coordinated.internal.cluster.InstanceLivenessTracker;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardBlockedJobsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StoredTriggerState;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Clock;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Keys;

/**
 * Acquires triggers that are due and hands them over to the scheduler for
 * firing.
 *
 * <p>
 * Several scheduler instances can be acquiring from the same database at the
 * same time. A trigger goes to whichever instance moves it out of the waiting
 * state first, the others skip it.
 */
public class TriggerRunner {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerRunner.class);

  /**
   * Earliest fire time first, then highest priority.
   */
  private static final Comparator<OperableTrigger> FIRE_ORDER_COMPARATOR =
      new Comparator<OperableTrigger>() {
        @Override
        public int compare(OperableTrigger o1, OperableTrigger o2) {
          int byTime =
              Long.compare(o1.getNextFireTime().getTime(), o2.getNextFireTime().getTime());
          if (byTime != 0) {
            return byTime;
          }

          return Integer.compare(o2.getPriority(), o1.getPriority());
        }
      };

  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final StandardCalendarDao calendarDao;
  private final StandardBlockedJobsDao blockedJobsDao;
  private final TriggerConverter triggerConverter;
  private final MisfireHandler misfireHandler;
  private final TriggerStateManager triggerStateManager;
  private final InstanceLivenessTracker livenessTracker;
  private final FireInstanceIdGenerator fireInstanceIdGenerator;
  private final String instanceId;
  private final Clock clock;

  public TriggerRunner(StandardTriggerDao triggerDao, StandardJobDao jobDao,
      StandardCalendarDao calendarDao, StandardBlockedJobsDao blockedJobsDao,
      TriggerConverter triggerConverter, MisfireHandler misfireHandler,
      TriggerStateManager triggerStateManager, InstanceLivenessTracker livenessTracker,
      FireInstanceIdGenerator fireInstanceIdGenerator, String instanceId, Clock clock) {
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.calendarDao = calendarDao;
    this.blockedJobsDao = blockedJobsDao;
    this.triggerConverter = triggerConverter;
    this.misfireHandler = misfireHandler;
    this.triggerStateManager = triggerStateManager;
    this.livenessTracker = livenessTracker;
    this.fireInstanceIdGenerator = fireInstanceIdGenerator;
    this.instanceId = instanceId;
    this.clock = clock;
  }

  /**
   * Acquire the triggers that are next to fire.
   *
   * @param noLaterThan
   *          the latest fire time wanted
   * @param maxCount
   *          the most triggers to acquire
   * @param timeWindow
   *          how far past {@code noLaterThan} and past the first acquired
   *          trigger fire times may be
   *
   * @return the acquired triggers in fire order, possibly empty
   *
   * @throws JobPersistenceException
   *           the store could not be read
   */
  public List<OperableTrigger> acquireNext(long noLaterThan, int maxCount, long timeWindow)
      throws JobPersistenceException {
    livenessTracker.runCycle();

    Date noLaterThanDate = new Date(noLaterThan + timeWindow);

    LOG.debug("Finding up to {} triggers which have time less than {}", maxCount,
        noLaterThanDate);

    List<OperableTrigger> candidates = findCandidates(noLaterThanDate);

    List<OperableTrigger> acquired = new ArrayList<>();
    Set<JobKey> acquiredJobKeysForNoConcurrentExec = new HashSet<JobKey>();
    Date firstAcquiredFireTime = null;

    for (OperableTrigger trigger : candidates) {
      if (acquired.size() >= maxCount) {
        break;
      }

      TriggerKey triggerKey = trigger.getKey();
      Date nextFireTime = trigger.getNextFireTime();
      if (nextFireTime == null) {
        continue;
      }

      if (firstAcquiredFireTime != null
          && nextFireTime.getTime() > firstAcquiredFireTime.getTime() + timeWindow) {
        break;
      }

      if (misfireHandler.applyMisfire(trigger, StoredTriggerState.WAITING)) {
        LOG.debug("Misfire trigger {}.", triggerKey);
        if (trigger.getNextFireTime() == null) {
          continue;
        }
      }

      // A misfired trigger may now be scheduled too far out to wait for.
      if (trigger.getNextFireTime().after(noLaterThanDate)) {
        LOG.debug("Skipping trigger {} as it is scheduled for {}.", triggerKey,
            trigger.getNextFireTime());
        continue;
      }

      JobKey jobKey = trigger.getJobKey();
      JobDetail jobDetail = retrieveJobOrMarkError(trigger);
      if (jobDetail == null) {
        continue;
      }

      // If can't run more than once, make sure only ends up in list once
      if (jobDetail.isConcurrentExectionDisallowed()
          && acquiredJobKeysForNoConcurrentExec.contains(jobKey)) {
        continue;
      }

      String fireInstanceId = fireInstanceIdGenerator.nextFireInstanceId();
      if (!triggerDao.acquire(triggerKey, instanceId, fireInstanceId)) {
        LOG.debug("Trigger {} was taken by another scheduler instance", triggerKey);
        continue;
      }

      LOG.debug("Acquired trigger: {}", triggerKey);
      trigger.setFireInstanceId(fireInstanceId);
      acquired.add(trigger);

      if (jobDetail.isConcurrentExectionDisallowed()) {
        acquiredJobKeysForNoConcurrentExec.add(jobKey);
      }
      if (firstAcquiredFireTime == null) {
        firstAcquiredFireTime = trigger.getNextFireTime();
      }
    }

    return acquired;
  }

  /**
   * Fire a batch of acquired triggers.
   *
   * @param triggers
   *          the triggers, as returned from acquisition
   *
   * @return a result for every trigger, in the same order
   */
  public List<TriggerFiredResult> triggersFired(List<OperableTrigger> triggers) {
    List<TriggerFiredResult> results = new ArrayList<TriggerFiredResult>(triggers.size());

    for (OperableTrigger trigger : triggers) {
      LOG.debug("Fired trigger {}", trigger.getKey());

      TriggerFiredResult result;
      try {
        TriggerFiredBundle bundle = createTriggerFiredBundle(trigger);
        result = new TriggerFiredResult(bundle);
      } catch (JobPersistenceException | RuntimeException e) {
        LOG.error("Could not fire trigger {}", trigger.getKey(), e);
        result = new TriggerFiredResult(e);
      }

      results.add(result);
    }

    return results;
  }

  /**
   * Give back a trigger that was acquired and is not going to be fired.
   *
   * @param trigger
   *          the trigger
   */
  public void releaseAcquiredTrigger(OperableTrigger trigger) {
    boolean jobBlocked =
        trigger.getJobKey() != null && blockedJobsDao.isBlocked(trigger.getJobKey());
    StoredTriggerState releasedState = StoredTriggerState.ACQUIRED.released(jobBlocked);
    if (triggerDao.releaseAcquired(trigger.getKey(), instanceId, releasedState)) {
      LOG.debug("Released acquired trigger {} to {}", trigger.getKey(), releasedState);
    }
  }

  private List<OperableTrigger> findCandidates(Date noLaterThanDate) {
    List<OperableTrigger> candidates = new ArrayList<>();
    for (ODocument triggerDoc : triggerDao.findEligibleToRun(noLaterThanDate)) {
      try {
        candidates.add(triggerConverter.toTrigger(triggerDoc));
      } catch (JobPersistenceException e) {
        TriggerKey triggerKey = Keys.toTriggerKey(triggerDoc);
        LOG.error("Could not load trigger {}, setting it to the error state", triggerKey, e);
        triggerDao.transition(triggerKey, StoredTriggerState.WAITING, StoredTriggerState.ERROR);
      }
    }

    Collections.sort(candidates, FIRE_ORDER_COMPARATOR);

    return candidates;
  }

  private JobDetail retrieveJobOrMarkError(OperableTrigger trigger) {
    TriggerKey triggerKey = trigger.getKey();
    JobKey jobKey = trigger.getJobKey();
    try {
      JobDetail jobDetail = jobDao.retrieveJob(jobKey);
      if (jobDetail != null) {
        return jobDetail;
      }

      LOG.error("Job {} of trigger {} does not exist, setting trigger to the error state", jobKey,
          triggerKey);
    } catch (JobPersistenceException e) {
      LOG.error("Error retrieving job {}, setting trigger {} to the error state", jobKey,
          triggerKey, e);
    }

    triggerDao.transition(triggerKey, StoredTriggerState.WAITING, StoredTriggerState.ERROR);
    return null;
  }

  private TriggerFiredBundle createTriggerFiredBundle(OperableTrigger trigger)
      throws JobPersistenceException {
    TriggerKey triggerKey = trigger.getKey();

    ODocument triggerDoc = triggerDao.findTrigger(triggerKey);
    if (!isStillOurs(triggerDoc, trigger)) {
      LOG.debug("Trigger {} is no longer acquired by this instance, skipping", triggerKey);
      return null;
    }

    JobKey jobKey = trigger.getJobKey();
    JobDetail job;
    try {
      job = jobDao.retrieveJob(jobKey);
      if (job == null) {
        return null;
      }
    } catch (JobPersistenceException e) {
      LOG.error("Error retrieving job, setting trigger state to error", e);

      triggerDao.setState(triggerKey, StoredTriggerState.ERROR);

      throw e;
    }

    Calendar cal = null;
    String calName = trigger.getCalendarName();
    if (calName != null) {
      cal = calendarDao.retrieveCalendar(calName);
      if (cal == null) {
        return null;
      }
    }

    boolean nonConcurrent = job.isConcurrentExectionDisallowed();
    if (nonConcurrent && !blockedJobsDao.tryBlock(jobKey, instanceId)) {
      LOG.debug("Job {} is executing elsewhere, blocking trigger {}", jobKey, triggerKey);
      triggerDao.releaseAcquired(triggerKey, instanceId, StoredTriggerState.BLOCKED);
      return null;
    }

    Date prevFireTime = trigger.getPreviousFireTime();

    // This updates the next fire time for the trigger.
    trigger.triggered(cal);

    StoredTriggerState newState;
    if (trigger.getNextFireTime() == null) {
      newState = StoredTriggerState.COMPLETE;
    } else if (nonConcurrent) {
      newState = StoredTriggerState.BLOCKED;
    } else {
      newState = StoredTriggerState.WAITING;
    }

    triggerConverter.populateFireTimes(triggerDoc, trigger);
    triggerDoc.field(Constants.TRIGGER_STATE, newState.getValue());
    triggerDoc.removeField(Constants.TRIGGER_SCHEDULER_INSTANCE_ID);
    triggerDoc.removeField(Constants.TRIGGER_FIRE_INSTANCE_ID);
    if (!triggerDao.save(triggerDoc)) {
      if (nonConcurrent) {
        blockedJobsDao.unblock(jobKey, instanceId);
      }
      return null;
    }

    if (nonConcurrent) {
      triggerStateManager.blockJobTriggers(jobKey);
    }

    LOG.debug("Triggers fired has set trigger {} to {}", triggerKey, newState);

    return new TriggerFiredBundle(job, trigger, cal, false, clock.now(),
        trigger.getPreviousFireTime(), prevFireTime, trigger.getNextFireTime());
  }

  private boolean isStillOurs(ODocument triggerDoc, OperableTrigger trigger) {
    if (triggerDoc == null || triggerDao.getState(triggerDoc) != StoredTriggerState.ACQUIRED) {
      return false;
    }

    String ownerId = triggerDoc.field(Constants.TRIGGER_SCHEDULER_INSTANCE_ID);
    String fireInstanceId = triggerDoc.field(Constants.TRIGGER_FIRE_INSTANCE_ID);

    return instanceId.equals(ownerId) && fireInstanceId != null
        && fireInstanceId.equals(trigger.getFireInstanceId());
  }
}
