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

package io.smartspaces.scheduling.quartz.coordinated.internal.cluster;

import java.util.Set;

import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.TriggerStateManager;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardBlockedJobsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardSchedulerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StoredTriggerState;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Keys;

/**
 * Keeps this scheduler instance's lease alive and takes work back from
 * instances whose lease has run out.
 *
 * <p>
 * There is no background thread. The scheduler calls into the store on every
 * acquisition cycle, and {@link #runCycle()} is run from there.
 *
 * @author Keith M. Hughes
 */
public class InstanceLivenessTracker {

  private static final Logger LOG = LoggerFactory.getLogger(InstanceLivenessTracker.class);

  private final StandardSchedulerDao schedulerDao;

  private final StandardTriggerDao triggerDao;

  private final StandardBlockedJobsDao blockedJobsDao;

  private final TriggerStateManager triggerStateManager;

  private final long leaseMillis;

  /**
   * The coarse state written with every check in.
   */
  private volatile String schedulerState = Constants.SCHEDULER_STATE_RUNNING;

  public InstanceLivenessTracker(StandardSchedulerDao schedulerDao,
      StandardTriggerDao triggerDao, StandardBlockedJobsDao blockedJobsDao,
      TriggerStateManager triggerStateManager, long leaseMillis) {
    this.schedulerDao = schedulerDao;
    this.triggerDao = triggerDao;
    this.blockedJobsDao = blockedJobsDao;
    this.triggerStateManager = triggerStateManager;
    this.leaseMillis = leaseMillis;
  }

  /**
   * Renew this instance's lease, then reclaim everything held by instances
   * that are no longer alive.
   *
   * @throws JobPersistenceException
   *           the store could not be updated
   */
  public void runCycle() throws JobPersistenceException {
    schedulerDao.checkIn(schedulerState, leaseMillis);
    schedulerDao.removeExpired();

    Set<String> liveInstanceIds = schedulerDao.getLiveInstanceIds();

    int reclaimedTriggers = reclaimTriggers(liveInstanceIds, null);
    int reclaimedJobs = reclaimBlockedJobs(liveInstanceIds, null);

    if (reclaimedTriggers > 0 || reclaimedJobs > 0) {
      LOG.info("Reclaimed {} triggers and {} blocked jobs from dead scheduler instances",
          reclaimedTriggers, reclaimedJobs);
    }

    triggerStateManager.unblockOrphanedTriggers();
  }

  /**
   * Warn when a live scheduler already holds this instance's ID.
   *
   * <p>
   * This is either an earlier run of this scheduler that did not shut down
   * cleanly, or a second scheduler configured with the same ID. The two
   * cannot be told apart, so startup carries on.
   *
   * @return {@code true} if a live record with this ID was found
   */
  public boolean checkForLiveNamesake() {
    SchedulerInstance existing = schedulerDao.findInstance(schedulerDao.getInstanceId());
    if (existing == null || !schedulerDao.isLive(existing)) {
      return false;
    }

    LOG.warn("Scheduler instance ID '{}' is checked in by {} until {}. Unless this is a restart "
        + "after a crash, two schedulers share the ID", existing.getInstanceId(),
        existing.getName(), existing.getExpires());
    return true;
  }

  /**
   * Change the coarse state of this instance and check in with it.
   *
   * @param state
   *          the new state
   */
  public void setSchedulerState(String state) {
    schedulerState = state;
    schedulerDao.checkIn(state, leaseMillis);
  }

  public String getSchedulerState() {
    return schedulerState;
  }

  /**
   * Give back the triggers held by this instance, as is done on startup and
   * shutdown.
   *
   * @param includeBlockedJobs
   *          {@code true} if blocked job markers held by this instance should
   *          also be cleared
   *
   * @throws JobPersistenceException
   *           the store could not be updated
   */
  public void releaseSelf(boolean includeBlockedJobs) throws JobPersistenceException {
    String instanceId = schedulerDao.getInstanceId();

    int releasedTriggers = reclaimTriggers(null, instanceId);
    int releasedJobs = includeBlockedJobs ? reclaimBlockedJobs(null, instanceId) : 0;

    LOG.debug("Scheduler instance {} released {} triggers and {} blocked jobs", instanceId,
        releasedTriggers, releasedJobs);
  }

  /**
   * Delete this instance's liveness record.
   */
  public void removeSelf() {
    schedulerDao.remove(schedulerDao.getInstanceId());
  }

  /**
   * Reclaim triggers from their owners.
   *
   * @param liveInstanceIds
   *          reclaim from every owner not in this set, can be {@code null}
   * @param onlyOwner
   *          reclaim only from this owner, can be {@code null}
   *
   * @return the number of triggers reclaimed
   */
  private int reclaimTriggers(Set<String> liveInstanceIds, String onlyOwner) {
    int reclaimed = 0;
    for (ODocument triggerDoc : triggerDao.findOwned()) {
      String ownerId = triggerDoc.field(Constants.TRIGGER_SCHEDULER_INSTANCE_ID);
      if (!isReclaimableOwner(ownerId, liveInstanceIds, onlyOwner)) {
        continue;
      }

      StoredTriggerState state = triggerDao.getState(triggerDoc);
      if (state == null || !state.isReclaimable()) {
        continue;
      }

      TriggerKey triggerKey = Keys.toTriggerKey(triggerDoc);
      StoredTriggerState released =
          state.released(blockedJobsDao.isBlocked(Keys.toTriggerJobKey(triggerDoc)));
      if (triggerDao.reclaim(triggerKey, ownerId, state, released)) {
        LOG.debug("Trigger {} taken back from scheduler instance {}", triggerKey, ownerId);
        reclaimed++;
      } else {
        LOG.debug("Trigger {} changed before it could be taken back from {}", triggerKey,
            ownerId);
      }
    }

    return reclaimed;
  }

  private int reclaimBlockedJobs(Set<String> liveInstanceIds, String onlyOwner)
      throws JobPersistenceException {
    int reclaimed = 0;
    for (ODocument markerDoc : blockedJobsDao.findAll()) {
      String ownerId = markerDoc.field(Constants.BLOCKED_JOB_INSTANCE_ID);
      if (!isReclaimableOwner(ownerId, liveInstanceIds, onlyOwner)) {
        continue;
      }

      JobKey jobKey = Keys.toJobKey(markerDoc);
      boolean removed =
          ownerId != null ? blockedJobsDao.unblock(jobKey, ownerId) : blockedJobsDao.unblock(jobKey);
      if (removed) {
        LOG.debug("Blocked job {} taken back from scheduler instance {}", jobKey, ownerId);
        triggerStateManager.unblockJobTriggers(jobKey);
        reclaimed++;
      }
    }

    return reclaimed;
  }

  private boolean isReclaimableOwner(String ownerId, Set<String> liveInstanceIds,
      String onlyOwner) {
    if (onlyOwner != null) {
      return onlyOwner.equals(ownerId);
    }

    return ownerId == null || !liveInstanceIds.contains(ownerId);
  }
}
