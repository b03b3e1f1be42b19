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

import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.SchedulerSignaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardBlockedJobsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StoredTriggerState;

/**
 * The work done after a job has finished executing.
 */
public class JobCompleteHandler {

  private static final Logger LOG = LoggerFactory.getLogger(JobCompleteHandler.class);

  private final TriggerAndJobPersister persister;
  private final TriggerStateManager triggerStateManager;
  private final SchedulerSignaler signaler;
  private final StandardJobDao jobDao;
  private final StandardTriggerDao triggerDao;
  private final StandardBlockedJobsDao blockedJobsDao;
  private final String instanceId;

  public JobCompleteHandler(TriggerAndJobPersister persister,
      TriggerStateManager triggerStateManager, SchedulerSignaler signaler,
      StandardJobDao jobDao, StandardTriggerDao triggerDao,
      StandardBlockedJobsDao blockedJobsDao, String instanceId) {
    this.persister = persister;
    this.triggerStateManager = triggerStateManager;
    this.signaler = signaler;
    this.jobDao = jobDao;
    this.triggerDao = triggerDao;
    this.blockedJobsDao = blockedJobsDao;
    this.instanceId = instanceId;
  }

  public void jobComplete(OperableTrigger trigger, JobDetail job,
      CompletedExecutionInstruction executionInstruction) throws JobPersistenceException {
    LOG.debug("Completing execution of {} fired by {}", job.getKey(), trigger.getKey());

    // Normally a no-op, the trigger left the acquired state when it fired.
    triggerDao.releaseAcquired(trigger.getKey(), instanceId, StoredTriggerState.WAITING);

    if (job.isPersistJobDataAfterExecution() && job.getJobDataMap().isDirty()) {
      LOG.debug("Writing back modified job data of {}", job.getKey());
      jobDao.updateJobData(job);
    }

    if (job.isConcurrentExectionDisallowed()) {
      JobKey jobKey = job.getKey();
      if (blockedJobsDao.unblock(jobKey, instanceId)) {
        triggerStateManager.unblockJobTriggers(jobKey);
      } else {
        LOG.debug("Job {} was no longer blocked by this instance", jobKey);
      }
      signaler.signalSchedulingChange(0L);
    }

    applyInstruction(trigger, executionInstruction);
  }

  private void applyInstruction(OperableTrigger trigger,
      CompletedExecutionInstruction executionInstruction) {
    TriggerKey triggerKey = trigger.getKey();
    JobKey jobKey = trigger.getJobKey();

    switch (executionInstruction) {
      case DELETE_TRIGGER:
        if (trigger.getNextFireTime() != null) {
          persister.removeTrigger(triggerKey);
          signaler.signalSchedulingChange(0L);
        } else if (!wasRescheduledDuringExecution(triggerKey)) {
          persister.removeTrigger(triggerKey);
        }
        break;
      case SET_TRIGGER_COMPLETE:
        triggerDao.setState(triggerKey, StoredTriggerState.COMPLETE);
        signaler.signalSchedulingChange(0L);
        break;
      case SET_TRIGGER_ERROR:
        LOG.info("Trigger {} moved to ERROR by its job", triggerKey);
        triggerDao.setState(triggerKey, StoredTriggerState.ERROR);
        signaler.signalSchedulingChange(0L);
        break;
      case SET_ALL_JOB_TRIGGERS_ERROR:
        LOG.info("Every trigger of job {} moved to ERROR by the job", jobKey);
        triggerDao.setStateForJob(jobKey, StoredTriggerState.ERROR);
        signaler.signalSchedulingChange(0L);
        break;
      case SET_ALL_JOB_TRIGGERS_COMPLETE:
        triggerDao.setStateForJob(jobKey, StoredTriggerState.COMPLETE);
        signaler.signalSchedulingChange(0L);
        break;
      default:
        break;
    }
  }

  /**
   * The job may have rescheduled its own trigger, giving the stored copy a
   * next fire time again. A missing trigger counts as rescheduled.
   */
  private boolean wasRescheduledDuringExecution(TriggerKey triggerKey) {
    ODocument stored = triggerDao.findTrigger(triggerKey);
    return stored == null || stored.field(Constants.TRIGGER_NEXT_FIRE_TIME) != null;
  }
}
