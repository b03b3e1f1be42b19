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
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.cluster.SchedulerInstance;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Clock;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;

/**
 * The Data Access Object for the liveness records of scheduler instances.
 */
public class StandardSchedulerDao {

  private static final Logger LOG = LoggerFactory.getLogger(StandardSchedulerDao.class);

  private final StandardOrientDbStoreAssembler storeAssembler;

  private final String schedulerName;
  private final String instanceId;
  private final Clock clock;

  private final String selectByInstanceId;
  private final String selectLiveInstanceIds;
  private final String upsertInstance;
  private final String selectExpired;
  private final String deleteIfExpired;
  private final String deleteByInstanceId;

  public StandardSchedulerDao(StandardOrientDbStoreAssembler storeAssembler, String instanceId,
      String schedulerName, Clock clock) {
    this.storeAssembler = storeAssembler;
    this.schedulerName = schedulerName;
    this.instanceId = instanceId;
    this.clock = clock;

    String className = storeAssembler.getCollectionNames().getSchedulers();
    selectByInstanceId = "SELECT FROM " + className + " WHERE "
        + Constants.SCHEDULER_INSTANCE_ID_FIELD + " = ?";
    selectLiveInstanceIds = "SELECT " + Constants.SCHEDULER_INSTANCE_ID_FIELD + " FROM "
        + className + " WHERE " + Constants.SCHEDULER_EXPIRES_FIELD + " >= ?";
    upsertInstance = "UPDATE " + className + " SET " + Constants.SCHEDULER_INSTANCE_ID_FIELD
        + " = ?, " + Constants.SCHEDULER_NAME_FIELD + " = ?, "
        + Constants.SCHEDULER_EXPIRES_FIELD + " = ?, " + Constants.SCHEDULER_STATE_FIELD
        + " = ? UPSERT WHERE " + Constants.SCHEDULER_INSTANCE_ID_FIELD + " = ?";
    selectExpired = "SELECT FROM " + className + " WHERE " + Constants.SCHEDULER_EXPIRES_FIELD
        + " < ?";
    deleteIfExpired = "DELETE FROM " + className + " WHERE "
        + Constants.SCHEDULER_INSTANCE_ID_FIELD + " = ? AND " + Constants.SCHEDULER_EXPIRES_FIELD
        + " < ?";
    deleteByInstanceId = "DELETE FROM " + className + " WHERE "
        + Constants.SCHEDULER_INSTANCE_ID_FIELD + " = ?";
  }

  public String getInstanceId() {
    return instanceId;
  }

  /**
   * Check in to inform other instances that this one is alive.
   *
   * @param state
   *          the coarse state of the scheduler
   * @param leaseMillis
   *          how long the check in is good for
   */
  public void checkIn(String state, long leaseMillis) {
    Date expires = new Date(clock.millis() + leaseMillis);

    LOG.debug("Checking in scheduler instance: name='{}', id='{}', state={}, expires={}",
        schedulerName, instanceId, state, expires);

    getConnection()
        .command(upsertInstance, instanceId, schedulerName, expires, state, instanceId).close();
  }

  /**
   * Delete every liveness record whose lease has run out.
   *
   * <p>
   * A record is only deleted if it is still expired, so an instance checking in
   * at the same moment keeps its record.
   *
   * @return the instances whose records were deleted
   */
  public List<SchedulerInstance> removeExpired() {
    Date now = clock.now();

    List<SchedulerInstance> removed = new ArrayList<>();
    for (ODocument doc : ODocumentHelper.toDocuments(getConnection().query(selectExpired, now))) {
      SchedulerInstance instance = toSchedulerInstance(doc);
      if (ODocumentHelper.getChangedCount(
          getConnection().command(deleteIfExpired, instance.getInstanceId(), now)) > 0) {
        LOG.info("Scheduler instance '{}' of {} stopped checking in, its lease ran out at {}",
            instance.getInstanceId(), instance.getName(), instance.getExpires());
        removed.add(instance);
      }
    }

    return removed;
  }

  /**
   * Has the instance's lease not yet run out?
   *
   * @param instance
   *          the instance record
   *
   * @return {@code true} if the instance still counts as alive
   */
  public boolean isLive(SchedulerInstance instance) {
    return !instance.isExpired(clock.millis());
  }

  /**
   * Get the IDs of all instances whose lease has not run out.
   */
  public Set<String> getLiveInstanceIds() {
    return ODocumentHelper.toDistinctStrings(
        getConnection().query(selectLiveInstanceIds, clock.now()),
        Constants.SCHEDULER_INSTANCE_ID_FIELD);
  }

  /**
   * @return the scheduler instance or {@code null} when not found
   */
  public SchedulerInstance findInstance(String instanceId) {
    ODocument doc =
        ODocumentHelper.firstDocument(getConnection().query(selectByInstanceId, instanceId));
    if (doc != null) {
      return toSchedulerInstance(doc);
    } else {
      LOG.debug("Scheduler instance '{}' not found.", instanceId);
      return null;
    }
  }

  public boolean remove(String instanceId) {
    LOG.debug("Removing scheduler instance: {}", instanceId);

    return ODocumentHelper
        .getChangedCount(getConnection().command(deleteByInstanceId, instanceId)) > 0;
  }

  private SchedulerInstance toSchedulerInstance(ODocument doc) {
    return new SchedulerInstance((String) doc.field(Constants.SCHEDULER_NAME_FIELD),
        (String) doc.field(Constants.SCHEDULER_INSTANCE_ID_FIELD),
        (Date) doc.field(Constants.SCHEDULER_EXPIRES_FIELD),
        (String) doc.field(Constants.SCHEDULER_STATE_FIELD));
  }

  private ODatabaseSession getConnection() {
    return storeAssembler.getOrientDbConnector().getConnection();
  }
}
