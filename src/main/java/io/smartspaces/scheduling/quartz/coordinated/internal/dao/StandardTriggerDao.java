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

package io.smartspaces.scheduling.quartz.coordinated.internal.dao;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.exception.OConcurrentModificationException;
import com.orientechnologies.orient.core.record.impl.ODocument;
import com.orientechnologies.orient.core.storage.ORecordDuplicatedException;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StoredTriggerState;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Keys;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.QueryHelper;

/**
 * The Data Access Object for triggers.
 *
 * <p>
 * Every state change is a conditional update on the state the caller expects
 * the trigger to be in. A {@code false} or {@code 0} result means some other
 * scheduler instance got there first.
 */
public class StandardTriggerDao {

  private static final Logger LOG = LoggerFactory.getLogger(StandardTriggerDao.class);

  private final StandardOrientDbStoreAssembler storeAssembler;

  private final QueryHelper queryHelper;

  private final TriggerConverter triggerConverter;

  private final String className;
  private final String selectByKey;
  private final String selectByGroup;
  private final String selectAll;
  private final String selectGroups;
  private final String selectByJob;
  private final String selectByCalendar;
  private final String selectEligibleToRun;
  private final String selectOwned;
  private final String selectInBlockedStates;
  private final String countAll;
  private final String countByJob;
  private final String deleteByKey;
  private final String deleteByJob;
  private final String updateState;
  private final String updateStateForJob;
  private final String transitionByKey;
  private final String transitionByGroup;
  private final String transitionByJob;
  private final String acquire;
  private final String releaseOwned;
  private final String reclaim;

  public StandardTriggerDao(StandardOrientDbStoreAssembler storeAssembler, QueryHelper queryHelper,
      TriggerConverter triggerConverter) {
    this.storeAssembler = storeAssembler;
    this.queryHelper = queryHelper;
    this.triggerConverter = triggerConverter;

    className = storeAssembler.getCollectionNames().getTriggers();

    String byKey = queryHelper.keyCondition();
    String byJob = queryHelper.jobOfTriggerCondition();
    String clearOwner = Constants.TRIGGER_SCHEDULER_INSTANCE_ID + " = null, "
        + Constants.TRIGGER_FIRE_INSTANCE_ID + " = null";
    String setState = "UPDATE " + className + " SET " + Constants.TRIGGER_STATE + " = ?, "
        + clearOwner + " WHERE ";

    selectByKey = "SELECT FROM " + className + " WHERE " + byKey;
    selectByGroup = "SELECT FROM " + className + " WHERE " + Constants.KEY_GROUP + " = ?";
    selectAll = "SELECT FROM " + className;
    selectGroups = "SELECT " + Constants.KEY_GROUP + " FROM " + className;
    selectByJob = "SELECT FROM " + className + " WHERE " + byJob;
    selectByCalendar =
        "SELECT FROM " + className + " WHERE " + Constants.TRIGGER_CALENDAR_NAME + " = ?";
    selectEligibleToRun = "SELECT FROM " + className + " WHERE " + Constants.TRIGGER_STATE
        + " = ? AND " + Constants.TRIGGER_NEXT_FIRE_TIME + " <= ?";
    selectOwned = "SELECT FROM " + className + " WHERE "
        + Constants.TRIGGER_SCHEDULER_INSTANCE_ID + " IS NOT NULL";
    selectInBlockedStates = "SELECT FROM " + className + " WHERE " + Constants.TRIGGER_STATE
        + " = ? OR " + Constants.TRIGGER_STATE + " = ?";
    countAll = "SELECT count(*) AS total FROM " + className;
    countByJob = "SELECT count(*) AS total FROM " + className + " WHERE " + byJob;
    deleteByKey = "DELETE FROM " + className + " WHERE " + byKey;
    deleteByJob = "DELETE FROM " + className + " WHERE " + byJob;
    updateState = setState + byKey;
    updateStateForJob = setState + byJob;
    transitionByKey = setState + byKey + " AND " + Constants.TRIGGER_STATE + " = ?";
    transitionByGroup =
        setState + Constants.KEY_GROUP + " = ? AND " + Constants.TRIGGER_STATE + " = ?";
    transitionByJob = setState + byJob + " AND " + Constants.TRIGGER_STATE + " = ?";
    acquire = "UPDATE " + className + " SET " + Constants.TRIGGER_STATE + " = ?, "
        + Constants.TRIGGER_SCHEDULER_INSTANCE_ID + " = ?, " + Constants.TRIGGER_FIRE_INSTANCE_ID
        + " = ? WHERE " + byKey + " AND " + Constants.TRIGGER_STATE + " = ?";
    releaseOwned = setState + byKey + " AND " + Constants.TRIGGER_STATE + " = ? AND "
        + Constants.TRIGGER_SCHEDULER_INSTANCE_ID + " = ?";
    reclaim = releaseOwned;
  }

  public void removeAll() {
    getConnection().command("DELETE FROM " + className).close();
  }

  public boolean exists(TriggerKey triggerKey) {
    return findTrigger(triggerKey) != null;
  }

  /**
   * Find a trigger by its trigger key.
   *
   * @param triggerKey
   *          the trigger key
   *
   * @return the trigger for the key, or {@code null} if no such trigger
   */
  public ODocument findTrigger(TriggerKey triggerKey) {
    return ODocumentHelper.firstDocument(
        getConnection().query(selectByKey, triggerKey.getGroup(), triggerKey.getName()));
  }

  public OperableTrigger getTrigger(TriggerKey triggerKey) throws JobPersistenceException {
    ODocument doc = findTrigger(triggerKey);
    if (doc != null) {
      return triggerConverter.toTrigger(doc);
    } else {
      return null;
    }
  }

  /**
   * Get the stored state of a trigger.
   *
   * @param triggerKey
   *          the trigger key
   *
   * @return the state, or {@code null} if there is no such trigger
   */
  public StoredTriggerState getState(TriggerKey triggerKey) {
    ODocument doc = findTrigger(triggerKey);
    if (doc != null) {
      return getState(doc);
    } else {
      return null;
    }
  }

  public StoredTriggerState getState(ODocument doc) {
    return StoredTriggerState.fromValue((String) doc.field(Constants.TRIGGER_STATE));
  }

  /**
   * Find all triggers that are waiting and due no later than the given time.
   *
   * @param noLaterThanDate
   *          the latest fire time
   *
   * @return the trigger documents, in no particular order
   */
  public List<ODocument> findEligibleToRun(Date noLaterThanDate) {
    List<ODocument> result = ODocumentHelper.toDocuments(getConnection()
        .query(selectEligibleToRun, StoredTriggerState.WAITING.getValue(), noLaterThanDate));

    LOG.debug("Found {} triggers which are eligible to be run.", result.size());

    return result;
  }

  /**
   * Find all triggers currently held by some scheduler instance.
   *
   * @return the trigger documents
   */
  public List<ODocument> findOwned() {
    return ODocumentHelper.toDocuments(getConnection().query(selectOwned));
  }

  /**
   * Find all triggers in {@link StoredTriggerState#BLOCKED} or
   * {@link StoredTriggerState#PAUSED_AND_BLOCKED}.
   *
   * @return the trigger documents
   */
  public List<ODocument> findBlocked() {
    return ODocumentHelper.toDocuments(getConnection().query(selectInBlockedStates,
        StoredTriggerState.BLOCKED.getValue(), StoredTriggerState.PAUSED_AND_BLOCKED.getValue()));
  }

  public int getCount() {
    return (int) ODocumentHelper.getCount(getConnection().query(countAll), "total");
  }

  public List<String> getGroupNames() {
    return new ArrayList<>(
        ODocumentHelper.toDistinctStrings(getConnection().query(selectGroups), Constants.KEY_GROUP));
  }

  public Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) {
    Set<TriggerKey> keys = new HashSet<>();
    if (queryHelper.isEquality(matcher)) {
      keys.addAll(getTriggerKeysInGroup(matcher.getCompareToValue()));
    } else {
      for (ODocument doc : ODocumentHelper.toDocuments(getConnection().query(selectAll))) {
        TriggerKey key = Keys.toTriggerKey(doc);
        if (queryHelper.matches(key.getGroup(), matcher)) {
          keys.add(key);
        }
      }
    }

    return keys;
  }

  public List<TriggerKey> getTriggerKeysInGroup(String group) {
    List<TriggerKey> keys = new ArrayList<>();
    for (ODocument doc : ODocumentHelper.toDocuments(getConnection().query(selectByGroup, group))) {
      keys.add(Keys.toTriggerKey(doc));
    }

    return keys;
  }

  public List<ODocument> findByJob(JobKey jobKey) {
    return ODocumentHelper.toDocuments(
        getConnection().query(selectByJob, jobKey.getGroup(), jobKey.getName()));
  }

  public List<OperableTrigger> getTriggersForJob(JobKey jobKey) throws JobPersistenceException {
    List<OperableTrigger> triggers = new ArrayList<>();
    for (ODocument item : findByJob(jobKey)) {
      triggers.add(triggerConverter.toTrigger(item));
    }

    return triggers;
  }

  public int countForJob(JobKey jobKey) {
    return (int) ODocumentHelper.getCount(
        getConnection().query(countByJob, jobKey.getGroup(), jobKey.getName()), "total");
  }

  public List<ODocument> findByCalendar(String calendarName) {
    return ODocumentHelper.toDocuments(getConnection().query(selectByCalendar, calendarName));
  }

  public boolean hasTriggersForCalendar(String calendarName) {
    return !findByCalendar(calendarName).isEmpty();
  }

  /**
   * Insert a new trigger document.
   *
   * @param trigger
   *          the document
   * @param offendingTrigger
   *          the trigger the document is for
   *
   * @throws ObjectAlreadyExistsException
   *           a trigger with the same key exists
   */
  public void insert(ODocument trigger, OperableTrigger offendingTrigger)
      throws ObjectAlreadyExistsException {
    try {
      trigger.save();
    } catch (ORecordDuplicatedException e) {
      throw new ObjectAlreadyExistsException(offendingTrigger);
    }
  }

  /**
   * Save a trigger document that was read earlier.
   *
   * @param trigger
   *          the document
   *
   * @return {@code true} if saved, {@code false} if the record was changed by
   *         someone else since it was read
   */
  public boolean save(ODocument trigger) {
    try {
      trigger.save();
      return true;
    } catch (OConcurrentModificationException e) {
      LOG.debug("Trigger {} was changed concurrently, not saving", Keys.toTriggerKey(trigger));
      return false;
    }
  }

  public boolean remove(TriggerKey triggerKey) {
    return ODocumentHelper.getChangedCount(
        getConnection().command(deleteByKey, triggerKey.getGroup(), triggerKey.getName())) > 0;
  }

  public int removeByJob(JobKey jobKey) {
    return (int) ODocumentHelper.getChangedCount(
        getConnection().command(deleteByJob, jobKey.getGroup(), jobKey.getName()));
  }

  /**
   * Set the state of a trigger, whatever state it is in now.
   *
   * @param triggerKey
   *          the trigger key
   * @param state
   *          the new state
   *
   * @return {@code true} if the trigger exists
   */
  public boolean setState(TriggerKey triggerKey, StoredTriggerState state) {
    return ODocumentHelper.getChangedCount(getConnection().command(updateState, state.getValue(),
        triggerKey.getGroup(), triggerKey.getName())) > 0;
  }

  /**
   * Set the state of all triggers of a job, whatever state they are in now.
   *
   * @param jobKey
   *          the job key
   * @param state
   *          the new state
   *
   * @return the number of triggers changed
   */
  public int setStateForJob(JobKey jobKey, StoredTriggerState state) {
    return (int) ODocumentHelper.getChangedCount(getConnection().command(updateStateForJob,
        state.getValue(), jobKey.getGroup(), jobKey.getName()));
  }

  /**
   * Move a trigger from one state to another.
   *
   * @param triggerKey
   *          the trigger key
   * @param from
   *          the state the trigger must be in
   * @param to
   *          the new state
   *
   * @return {@code true} if the trigger was in the expected state and moved
   */
  public boolean transition(TriggerKey triggerKey, StoredTriggerState from,
      StoredTriggerState to) {
    return ODocumentHelper.getChangedCount(getConnection().command(transitionByKey, to.getValue(),
        triggerKey.getGroup(), triggerKey.getName(), from.getValue())) > 0;
  }

  /**
   * Move all triggers of a group from one state to another.
   *
   * @param group
   *          the trigger group
   * @param from
   *          the state the triggers must be in
   * @param to
   *          the new state
   *
   * @return the number of triggers moved
   */
  public int transitionInGroup(String group, StoredTriggerState from, StoredTriggerState to) {
    return (int) ODocumentHelper.getChangedCount(getConnection().command(transitionByGroup,
        to.getValue(), group, from.getValue()));
  }

  /**
   * Move all triggers of a job from one state to another.
   *
   * @param jobKey
   *          the job key
   * @param from
   *          the state the triggers must be in
   * @param to
   *          the new state
   *
   * @return the number of triggers moved
   */
  public int transitionForJob(JobKey jobKey, StoredTriggerState from, StoredTriggerState to) {
    return (int) ODocumentHelper.getChangedCount(getConnection().command(transitionByJob,
        to.getValue(), jobKey.getGroup(), jobKey.getName(), from.getValue()));
  }

  /**
   * Acquire a waiting trigger for a scheduler instance.
   *
   * @param triggerKey
   *          the trigger key
   * @param instanceId
   *          the ID of the acquiring scheduler instance
   * @param fireInstanceId
   *          the fire instance ID for the trigger
   *
   * @return {@code true} if the trigger was still waiting and is now acquired
   */
  public boolean acquire(TriggerKey triggerKey, String instanceId, String fireInstanceId) {
    return ODocumentHelper.getChangedCount(getConnection().command(acquire,
        StoredTriggerState.ACQUIRED.getValue(), instanceId, fireInstanceId,
        triggerKey.getGroup(), triggerKey.getName(), StoredTriggerState.WAITING.getValue())) > 0;
  }

  /**
   * Move an acquired trigger out of the acquired state.
   *
   * @param triggerKey
   *          the trigger key
   * @param instanceId
   *          the scheduler instance that must hold the trigger
   * @param to
   *          the new state
   *
   * @return {@code true} if the trigger was held by the instance and moved
   */
  public boolean releaseAcquired(TriggerKey triggerKey, String instanceId,
      StoredTriggerState to) {
    return ODocumentHelper.getChangedCount(getConnection().command(releaseOwned, to.getValue(),
        triggerKey.getGroup(), triggerKey.getName(), StoredTriggerState.ACQUIRED.getValue(),
        instanceId)) > 0;
  }

  /**
   * Take a trigger back from a scheduler instance.
   *
   * @param triggerKey
   *          the trigger key
   * @param ownerId
   *          the instance that must hold the trigger
   * @param from
   *          the state the trigger must be in
   * @param to
   *          the state the reclaimed trigger moves to
   *
   * @return {@code true} if the trigger was reclaimed
   */
  public boolean reclaim(TriggerKey triggerKey, String ownerId, StoredTriggerState from,
      StoredTriggerState to) {
    return ODocumentHelper.getChangedCount(getConnection().command(reclaim, to.getValue(),
        triggerKey.getGroup(), triggerKey.getName(), from.getValue(), ownerId)) > 0;
  }

  private ODatabaseSession getConnection() {
    return storeAssembler.getOrientDbConnector().getConnection();
  }
}
