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

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardBlockedJobsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardJobDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardPausedJobGroupsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardPausedTriggerGroupsDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.dao.StandardTriggerDao;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.MisfireHandler;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StoredTriggerState;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Keys;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.QueryHelper;

/**
 * Pauses, resumes, blocks and unblocks triggers, alone or a group at a time.
 *
 * <p>
 * Group pause and resume is eventually consistent. Group markers are read and
 * then acted on, and a trigger moved by another instance in between is left
 * where that instance put it.
 */
public class TriggerStateManager {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerStateManager.class);

  /**
   * The state changes that are applied to many triggers at once.
   */
  private enum StateChange {
    PAUSE, BLOCK, UNBLOCK;

    StoredTriggerState apply(StoredTriggerState from) {
      switch (this) {
        case PAUSE:
          return from.paused();
        case BLOCK:
          return from.blocked();
        default:
          return from.unblocked();
      }
    }
  }

  private final StandardTriggerDao triggerDao;
  private final StandardJobDao jobDao;
  private final StandardPausedJobGroupsDao pausedJobGroupsDao;
  private final StandardPausedTriggerGroupsDao pausedTriggerGroupsDao;
  private final StandardBlockedJobsDao blockedJobsDao;
  private final MisfireHandler misfireHandler;
  private final QueryHelper queryHelper;

  public TriggerStateManager(StandardTriggerDao triggerDao, StandardJobDao jobDao,
      StandardPausedJobGroupsDao pausedJobGroupsDao,
      StandardPausedTriggerGroupsDao pausedTriggerGroupsDao,
      StandardBlockedJobsDao blockedJobsDao, MisfireHandler misfireHandler,
      QueryHelper queryHelper) {
    this.triggerDao = triggerDao;
    this.jobDao = jobDao;
    this.pausedJobGroupsDao = pausedJobGroupsDao;
    this.pausedTriggerGroupsDao = pausedTriggerGroupsDao;
    this.blockedJobsDao = blockedJobsDao;
    this.misfireHandler = misfireHandler;
    this.queryHelper = queryHelper;
  }

  public Set<String> getPausedTriggerGroups() {
    return new HashSet<String>(pausedTriggerGroupsDao.getPausedGroups());
  }

  public boolean isTriggerGroupPaused(String group) {
    return pausedTriggerGroupsDao.isPaused(group);
  }

  public boolean isJobGroupPaused(String group) {
    return pausedJobGroupsDao.isPaused(group);
  }

  public TriggerState getState(TriggerKey triggerKey) {
    StoredTriggerState state = triggerDao.getState(triggerKey);
    if (state == null) {
      return TriggerState.NONE;
    }

    return state.toTriggerState();
  }

  /**
   * Get the state a new trigger starts in.
   *
   * @param triggerKey
   *          the key of the new trigger
   * @param jobKey
   *          the key of the trigger's job
   *
   * @return the initial state
   */
  public StoredTriggerState getInitialState(TriggerKey triggerKey, JobKey jobKey) {
    boolean paused = pausedTriggerGroupsDao.isPaused(triggerKey.getGroup())
        || pausedJobGroupsDao.isPaused(jobKey.getGroup());

    return StoredTriggerState.initial(paused, blockedJobsDao.isBlocked(jobKey));
  }

  public void pause(TriggerKey triggerKey) {
    StoredTriggerState state = triggerDao.getState(triggerKey);
    if (state == null) {
      return;
    }

    StoredTriggerState pausedState = state.paused();
    if (pausedState != state && !triggerDao.transition(triggerKey, state, pausedState)) {
      LOG.debug("Trigger {} changed state while being paused", triggerKey);
    }
  }

  public Set<String> pause(GroupMatcher<TriggerKey> matcher) {
    Set<String> groups = queryHelper.matchingGroups(matcher, getKnownTriggerGroups());
    for (String group : groups) {
      pauseTriggerGroup(group);
    }

    return groups;
  }

  public void pauseAll() {
    for (String group : triggerDao.getGroupNames()) {
      pauseTriggerGroup(group);
    }
  }

  public void pauseJob(JobKey jobKey) {
    applyToJob(jobKey, StateChange.PAUSE);
  }

  public Collection<String> pauseJobs(GroupMatcher<JobKey> groupMatcher) {
    Set<String> groups = queryHelper.matchingGroups(groupMatcher, getKnownJobGroups());
    for (String group : groups) {
      pausedJobGroupsDao.pauseGroup(group);
      for (JobKey jobKey : jobDao.getJobKeys(GroupMatcher.jobGroupEquals(group))) {
        pauseJob(jobKey);
      }
    }

    return groups;
  }

  /**
   * Resume a single trigger.
   *
   * <p>
   * Only paused triggers are moved. Missed fire times are handled according to
   * the trigger's misfire instruction.
   *
   * @param triggerKey
   *          the trigger
   *
   * @throws JobPersistenceException
   *           the trigger could not be read or written
   */
  public void resume(TriggerKey triggerKey) throws JobPersistenceException {
    ODocument triggerDoc = triggerDao.findTrigger(triggerKey);
    if (triggerDoc != null) {
      resumeTrigger(triggerDoc);
    }
  }

  public Collection<String> resume(GroupMatcher<TriggerKey> matcher)
      throws JobPersistenceException {
    Set<String> groups = queryHelper.matchingGroups(matcher, getKnownTriggerGroups());
    for (String group : groups) {
      resumeTriggerGroup(group);
    }

    return groups;
  }

  /**
   * Resume the triggers of a job. Triggers in a paused trigger group stay
   * paused.
   *
   * @param jobKey
   *          the job
   *
   * @throws JobPersistenceException
   *           the triggers could not be read or written
   */
  public void resume(JobKey jobKey) throws JobPersistenceException {
    for (ODocument triggerDoc : triggerDao.findByJob(jobKey)) {
      String group = triggerDoc.field(Constants.KEY_GROUP);
      if (!pausedTriggerGroupsDao.isPaused(group)) {
        resumeTrigger(triggerDoc);
      }
    }
  }

  public Set<String> resumeJobs(GroupMatcher<JobKey> groupMatcher)
      throws JobPersistenceException {
    Set<String> groups = queryHelper.matchingGroups(groupMatcher, getKnownJobGroups());
    for (String group : groups) {
      pausedJobGroupsDao.unpauseGroup(group);
      for (JobKey jobKey : jobDao.getJobKeys(GroupMatcher.jobGroupEquals(group))) {
        resume(jobKey);
      }
    }

    return groups;
  }

  /**
   * Resume every trigger group. Paused job group markers are left in place, so
   * triggers of those jobs stay paused.
   *
   * @throws JobPersistenceException
   *           the triggers could not be read or written
   */
  public void resumeAll() throws JobPersistenceException {
    for (String group : getKnownTriggerGroups()) {
      resumeTriggerGroup(group);
    }
  }

  /**
   * Move the triggers of a job that just started executing into the blocked
   * states.
   *
   * @param jobKey
   *          the job
   */
  public void blockJobTriggers(JobKey jobKey) {
    applyToJob(jobKey, StateChange.BLOCK);
  }

  /**
   * Move the triggers of a job that is no longer executing out of the blocked
   * states.
   *
   * @param jobKey
   *          the job
   */
  public void unblockJobTriggers(JobKey jobKey) {
    applyToJob(jobKey, StateChange.UNBLOCK);
  }

  /**
   * Move blocked triggers whose job has no blocked job marker out of the
   * blocked states.
   *
   * <p>
   * A trigger can be left blocked without a marker when its job completes on
   * another instance between a failed {@code tryBlock} and the trigger being
   * released as blocked.
   *
   * @return the number of triggers unblocked
   */
  public int unblockOrphanedTriggers() {
    int unblocked = 0;
    for (ODocument triggerDoc : triggerDao.findBlocked()) {
      StoredTriggerState state = triggerDao.getState(triggerDoc);
      JobKey jobKey = Keys.toTriggerJobKey(triggerDoc);
      if (state == null || blockedJobsDao.isBlocked(jobKey)) {
        continue;
      }

      TriggerKey triggerKey = Keys.toTriggerKey(triggerDoc);
      if (triggerDao.transition(triggerKey, state, state.unblocked())) {
        LOG.info("Trigger {} was blocked although job {} is not executing, unblocked it",
            triggerKey, jobKey);
        unblocked++;
      }
    }

    return unblocked;
  }

  /**
   * Put a trigger in the error state back into the state a new trigger would
   * start in.
   *
   * @param triggerKey
   *          the trigger
   */
  public void resetTriggerFromErrorState(TriggerKey triggerKey) {
    ODocument triggerDoc = triggerDao.findTrigger(triggerKey);
    if (triggerDoc == null || triggerDao.getState(triggerDoc) != StoredTriggerState.ERROR) {
      return;
    }

    StoredTriggerState newState =
        getInitialState(triggerKey, Keys.toTriggerJobKey(triggerDoc));
    if (!triggerDao.transition(triggerKey, StoredTriggerState.ERROR, newState)) {
      LOG.debug("Trigger {} left the error state before it could be reset", triggerKey);
    }
  }

  private void pauseTriggerGroup(String group) {
    pausedTriggerGroupsDao.pauseGroup(group);
    for (StoredTriggerState from : StoredTriggerState.values()) {
      StoredTriggerState to = StateChange.PAUSE.apply(from);
      if (to != from) {
        triggerDao.transitionInGroup(group, from, to);
      }
    }
  }

  private void resumeTriggerGroup(String group) throws JobPersistenceException {
    pausedTriggerGroupsDao.unpauseGroup(group);
    for (TriggerKey triggerKey : triggerDao.getTriggerKeysInGroup(group)) {
      ODocument triggerDoc = triggerDao.findTrigger(triggerKey);
      if (triggerDoc == null) {
        continue;
      }

      String jobGroup = triggerDoc.field(Constants.TRIGGER_JOB_GROUP);
      if (!pausedJobGroupsDao.isPaused(jobGroup)) {
        resumeTrigger(triggerDoc);
      }
    }
  }

  private void resumeTrigger(ODocument triggerDoc) throws JobPersistenceException {
    StoredTriggerState state = triggerDao.getState(triggerDoc);
    if (state == null || !state.isPaused()) {
      return;
    }

    TriggerKey triggerKey = Keys.toTriggerKey(triggerDoc);
    StoredTriggerState resumedState =
        state.resumed(blockedJobsDao.isBlocked(Keys.toTriggerJobKey(triggerDoc)));
    if (!triggerDao.transition(triggerKey, state, resumedState)) {
      LOG.debug("Trigger {} changed state while being resumed", triggerKey);
      return;
    }

    // It may have missed fire times while paused.
    OperableTrigger trigger = triggerDao.getTrigger(triggerKey);
    if (trigger != null) {
      misfireHandler.applyMisfire(trigger, resumedState);
    }
  }

  private void applyToJob(JobKey jobKey, StateChange change) {
    for (StoredTriggerState from : StoredTriggerState.values()) {
      StoredTriggerState to = change.apply(from);
      if (to != from) {
        triggerDao.transitionForJob(jobKey, from, to);
      }
    }
  }

  private Set<String> getKnownTriggerGroups() {
    Set<String> groups = new LinkedHashSet<>(triggerDao.getGroupNames());
    groups.addAll(pausedTriggerGroupsDao.getPausedGroups());

    return groups;
  }

  private Set<String> getKnownJobGroups() {
    Set<String> groups = new LinkedHashSet<>(jobDao.getGroupNames());
    groups.addAll(pausedJobGroupsDao.getPausedGroups());

    return groups;
  }
}
