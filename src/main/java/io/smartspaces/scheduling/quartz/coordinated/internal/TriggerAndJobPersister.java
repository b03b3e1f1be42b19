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

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.quartz.Calendar;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StoredTriggerState;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Keys;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;

/**
 * Stores and removes jobs, triggers and calendars, keeping the references
 * between them intact.
 */
public class TriggerAndJobPersister {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerAndJobPersister.class);

  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final StandardCalendarDao calendarDao;
  private final TriggerConverter triggerConverter;
  private final TriggerStateManager triggerStateManager;
  private final MisfireHandler misfireHandler;
  private final SchedulerSignaler signaler;

  public TriggerAndJobPersister(StandardTriggerDao triggerDao, StandardJobDao jobDao,
      StandardCalendarDao calendarDao, TriggerConverter triggerConverter,
      TriggerStateManager triggerStateManager, MisfireHandler misfireHandler,
      SchedulerSignaler signaler) {
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.calendarDao = calendarDao;
    this.triggerConverter = triggerConverter;
    this.triggerStateManager = triggerStateManager;
    this.misfireHandler = misfireHandler;
    this.signaler = signaler;
  }

  public List<OperableTrigger> getTriggersForJob(JobKey jobKey) throws JobPersistenceException {
    return triggerDao.getTriggersForJob(jobKey);
  }

  public void storeJob(JobDetail newJob, boolean replaceExisting)
      throws JobPersistenceException {
    jobDao.storeJob(newJob, replaceExisting);
  }

  public void storeJobAndTrigger(JobDetail newJob, OperableTrigger newTrigger)
      throws JobPersistenceException {
    jobDao.storeJob(newJob, false);

    storeTrigger(newTrigger, false);
  }

  /**
   * Store many jobs and their triggers.
   *
   * <p>
   * When nothing is to be replaced, every key is checked before anything is
   * written.
   *
   * @param triggersAndJobs
   *          the jobs and the triggers of each
   * @param replace
   *          {@code true} if existing jobs and triggers should be replaced
   *
   * @throws ObjectAlreadyExistsException
   *           a job or trigger exists and is not to be replaced
   * @throws JobPersistenceException
   *           something could not be stored
   */
  public void storeJobsAndTriggers(Map<JobDetail, Set<? extends Trigger>> triggersAndJobs,
      boolean replace) throws JobPersistenceException {
    if (!replace) {
      for (Map.Entry<JobDetail, Set<? extends Trigger>> entry : triggersAndJobs.entrySet()) {
        if (jobDao.exists(entry.getKey().getKey())) {
          throw new ObjectAlreadyExistsException(entry.getKey());
        }
        for (Trigger trigger : entry.getValue()) {
          if (triggerDao.exists(trigger.getKey())) {
            throw new ObjectAlreadyExistsException(trigger);
          }
        }
      }
    }

    for (Map.Entry<JobDetail, Set<? extends Trigger>> entry : triggersAndJobs.entrySet()) {
      jobDao.storeJob(entry.getKey(), replace);
      for (Trigger trigger : entry.getValue()) {
        storeTrigger((OperableTrigger) trigger, replace);
      }
    }
  }

  /**
   * Store a trigger. Its job must already be stored.
   *
   * <p>
   * The trigger starts out paused if its trigger group or its job group is
   * paused, and blocked if its job is executing.
   *
   * @param newTrigger
   *          the trigger
   * @param replaceExisting
   *          {@code true} if a trigger with the same key should be replaced
   *
   * @throws ObjectAlreadyExistsException
   *           the trigger exists and is not to be replaced
   * @throws JobPersistenceException
   *           the trigger has no job or could not be stored
   */
  public void storeTrigger(OperableTrigger newTrigger, boolean replaceExisting)
      throws JobPersistenceException {
    JobKey jobKey = newTrigger.getJobKey();
    if (jobKey == null) {
      throw new JobPersistenceException(
          "Trigger must be associated with a job. Please specify a JobKey.");
    }

    if (!jobDao.exists(jobKey)) {
      throw new JobPersistenceException("Could not find job with key " + jobKey);
    }

    StoredTriggerState state = triggerStateManager.getInitialState(newTrigger.getKey(), jobKey);

    ODocument oldTriggerDoc = triggerDao.findTrigger(newTrigger.getKey());
    if (oldTriggerDoc != null) {
      if (!replaceExisting) {
        throw new ObjectAlreadyExistsException(newTrigger);
      }

      ODocumentHelper.clearFields(oldTriggerDoc);
      triggerConverter.populateDocument(oldTriggerDoc, newTrigger);
      oldTriggerDoc.field(Constants.TRIGGER_STATE, state.getValue());
      if (!triggerDao.save(oldTriggerDoc)) {
        throw new JobPersistenceException(
            "Trigger " + newTrigger.getKey() + " was changed while it was being replaced");
      }
    } else {
      triggerDao.insert(triggerConverter.toDocument(newTrigger, state), newTrigger);
    }
  }

  public boolean removeJob(JobKey jobKey) {
    triggerDao.removeByJob(jobKey);

    return jobDao.remove(jobKey);
  }

  /**
   * Remove several jobs and all their triggers.
   *
   * @return {@code true} if every job was found
   */
  public boolean removeJobs(List<JobKey> jobKeys) {
    boolean allFound = true;
    for (JobKey key : jobKeys) {
      allFound = removeJob(key) && allFound;
    }

    return allFound;
  }

  /**
   * Remove a trigger. A job that is not durable is removed with its last
   * trigger.
   *
   * @param triggerKey
   *          the trigger
   *
   * @return {@code true} if the trigger was found
   */
  public boolean removeTrigger(TriggerKey triggerKey) {
    ODocument triggerDoc = triggerDao.findTrigger(triggerKey);
    if (triggerDoc == null) {
      return false;
    }

    JobKey jobKey = Keys.toTriggerJobKey(triggerDoc);
    boolean removed = triggerDao.remove(triggerKey);

    removeOrphanedJob(jobKey);

    return removed;
  }

  /**
   * Remove several triggers.
   *
   * @return {@code true} if every trigger was found
   */
  public boolean removeTriggers(List<TriggerKey> triggerKeys) {
    boolean allFound = true;
    for (TriggerKey key : triggerKeys) {
      allFound = removeTrigger(key) && allFound;
    }

    return allFound;
  }

  /**
   * Replace a trigger with a new one for the same job.
   *
   * @param triggerKey
   *          the key of the trigger to replace
   * @param newTrigger
   *          the new trigger
   *
   * @return {@code true} if the old trigger was found and replaced
   *
   * @throws JobPersistenceException
   *           the new trigger is for another job or could not be stored
   */
  public boolean replaceTrigger(TriggerKey triggerKey, OperableTrigger newTrigger)
      throws JobPersistenceException {
    ODocument oldTriggerDoc = triggerDao.findTrigger(triggerKey);
    if (oldTriggerDoc == null) {
      return false;
    }

    if (!Keys.toTriggerJobKey(oldTriggerDoc).equals(newTrigger.getJobKey())) {
      throw new JobPersistenceException(
          "New trigger is not related to the same job as the old trigger.");
    }

    // Not removeTrigger, the job must survive even if it is not durable.
    triggerDao.remove(triggerKey);
    storeTrigger(newTrigger, false);

    return true;
  }

  /**
   * Store a calendar.
   *
   * @param name
   *          the name of the calendar
   * @param calendar
   *          the calendar
   * @param replaceExisting
   *          {@code true} if a calendar with the same name should be replaced
   * @param updateTriggers
   *          {@code true} if triggers using the calendar should have their next
   *          fire time recomputed
   *
   * @throws JobPersistenceException
   *           the calendar could not be stored
   */
  public void storeCalendar(String name, Calendar calendar, boolean replaceExisting,
      boolean updateTriggers) throws JobPersistenceException {
    if (!replaceExisting && calendarDao.exists(name)) {
      throw new ObjectAlreadyExistsException("Calendar with name '" + name + "' already exists.");
    }

    calendarDao.store(name, calendar);

    if (updateTriggers) {
      for (ODocument triggerDoc : triggerDao.findByCalendar(name)) {
        OperableTrigger trigger = triggerConverter.toTrigger(triggerDoc);
        trigger.updateWithNewCalendar(calendar, misfireHandler.getMisfireThreshold());
        triggerConverter.populateFireTimes(triggerDoc, trigger);
        if (!triggerDao.save(triggerDoc)) {
          LOG.debug("Trigger {} changed before its new calendar could be applied",
              trigger.getKey());
        }
      }
    }
  }

  public boolean removeCalendar(String calName) throws JobPersistenceException {
    if (triggerDao.hasTriggersForCalendar(calName)) {
      throw new JobPersistenceException("Calender cannot be removed if it referenced by a trigger!");
    }

    return calendarDao.remove(calName);
  }

  // If removing the trigger left a job that is not durable with no triggers,
  // the job goes too.
  private void removeOrphanedJob(JobKey jobKey) {
    ODocument jobDoc = jobDao.getJob(jobKey);
    if (jobDoc == null) {
      return;
    }

    boolean durable = ODocumentHelper.getBooleanField(jobDoc, Constants.JOB_DURABILITY, false);
    if (!durable && triggerDao.countForJob(jobKey) == 0) {
      LOG.debug("Removing job {} as it is not durable and has no triggers left", jobKey);
      jobDao.remove(jobKey);
      signaler.notifySchedulerListenersJobDeleted(jobKey);
    }
  }
}
