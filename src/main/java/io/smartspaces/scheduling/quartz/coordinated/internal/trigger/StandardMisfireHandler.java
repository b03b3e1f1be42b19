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

package io.smartspaces.scheduling.quartz.coordinated.internal.trigger;

import java.util.Date;

import org.quartz.Calendar;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardCalendarDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Clock;

/**
 * Handle misfires.
 */
public class StandardMisfireHandler implements MisfireHandler {

  /**
   * The logger for this class.
   */
  private static final Logger LOG = LoggerFactory.getLogger(StandardMisfireHandler.class);

  /**
   * The DAO for triggers.
   */
  private final StandardTriggerDao triggerDao;

  /**
   * The DAO for calendars.
   */
  private final StandardCalendarDao calendarDao;

  private final TriggerConverter triggerConverter;

  /**
   * The signaler for the scheduler
   */
  private final SchedulerSignaler schedulerSignaler;

  /**
   * The threshold for misfires, in milliseconds.
   */
  private final long misfireThreshold;

  /**
   * The clock to use for time.
   */
  private final Clock clock;

  public StandardMisfireHandler(StandardTriggerDao triggerDao, StandardCalendarDao calendarDao,
      TriggerConverter triggerConverter, SchedulerSignaler schedulerSignaler,
      long misfireThreshold, Clock clock) {
    this.triggerDao = triggerDao;
    this.calendarDao = calendarDao;
    this.triggerConverter = triggerConverter;
    this.schedulerSignaler = schedulerSignaler;
    this.misfireThreshold = misfireThreshold;
    this.clock = clock;
  }

  @Override
  public boolean applyMisfire(OperableTrigger trigger, StoredTriggerState expectedState)
      throws JobPersistenceException {
    Date fireTime = trigger.getNextFireTime();
    if (misfireIsNotApplicable(trigger, fireTime)) {
      return false;
    }

    Calendar cal = retrieveCalendar(trigger);

    LOG.debug("Trigger {} misfired, scheduled fire time was {}", trigger.getKey(), fireTime);

    schedulerSignaler.notifyTriggerListenersMisfired((OperableTrigger) trigger.clone());

    trigger.updateAfterMisfire(cal);

    Date newFireTime = trigger.getNextFireTime();
    if (newFireTime == null) {
      if (saveMisfiredTrigger(trigger, expectedState, StoredTriggerState.COMPLETE)) {
        schedulerSignaler.notifySchedulerListenersFinalized(trigger);
      }
      return true;
    } else if (fireTime.equals(newFireTime)) {
      return false;
    }

    saveMisfiredTrigger(trigger, expectedState, expectedState);
    return true;
  }

  @Override
  public long getMisfireTime() {
    return clock.millis() - misfireThreshold;
  }

  @Override
  public long getMisfireThreshold() {
    return misfireThreshold;
  }

  /**
   * Write the recomputed trigger back if the stored trigger is still where it
   * was expected to be.
   *
   * @return {@code true} if the trigger was written
   */
  private boolean saveMisfiredTrigger(OperableTrigger trigger, StoredTriggerState expectedState,
      StoredTriggerState newState) throws JobPersistenceException {
    ODocument doc = triggerDao.findTrigger(trigger.getKey());
    if (doc == null || triggerDao.getState(doc) != expectedState) {
      LOG.debug("Trigger {} changed while its misfire was handled, not saving",
          trigger.getKey());
      return false;
    }

    triggerConverter.populateFireTimes(doc, trigger);
    doc.field(Constants.TRIGGER_STATE, newState.getValue());

    return triggerDao.save(doc);
  }

  private boolean misfireIsNotApplicable(OperableTrigger trigger, Date fireTime) {
    return fireTime == null || isNotMisfired(fireTime)
        || trigger.getMisfireInstruction() == Trigger.MISFIRE_INSTRUCTION_IGNORE_MISFIRE_POLICY;
  }

  private boolean isNotMisfired(Date fireTime) {
    return getMisfireTime() < fireTime.getTime();
  }

  private Calendar retrieveCalendar(OperableTrigger trigger) throws JobPersistenceException {
    return calendarDao.retrieveCalendar(trigger.getCalendarName());
  }
}
