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

package io.smartspaces.scheduling.quartz.coordinated.internal.dao;

import java.util.List;

import org.quartz.JobKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.record.impl.ODocument;
import com.orientechnologies.orient.core.storage.ORecordDuplicatedException;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.QueryHelper;

/**
 * The Data Access Object for the markers of non-concurrent jobs that are
 * executing right now.
 *
 * <p>
 * The unique index on the job key makes {@link #tryBlock(JobKey, String)} an
 * insert-if-absent across every scheduler instance sharing the database.
 *
 * @author Keith M. Hughes
 */
public class StandardBlockedJobsDao {

  private static final Logger LOG = LoggerFactory.getLogger(StandardBlockedJobsDao.class);

  private final StandardOrientDbStoreAssembler storeAssembler;

  private final String className;
  private final String selectByKey;
  private final String selectAll;
  private final String deleteByKey;
  private final String deleteByKeyAndOwner;

  public StandardBlockedJobsDao(StandardOrientDbStoreAssembler storeAssembler,
      QueryHelper queryHelper) {
    this.storeAssembler = storeAssembler;

    className = storeAssembler.getCollectionNames().getBlockedJobs();
    selectByKey = "SELECT FROM " + className + " WHERE " + queryHelper.keyCondition();
    selectAll = "SELECT FROM " + className;
    deleteByKey = "DELETE FROM " + className + " WHERE " + queryHelper.keyCondition();
    deleteByKeyAndOwner = deleteByKey + " AND " + Constants.BLOCKED_JOB_INSTANCE_ID + " = ?";
  }

  /**
   * Mark a job as executing on a scheduler instance.
   *
   * @param jobKey
   *          the job
   * @param instanceId
   *          the instance executing the job
   *
   * @return {@code true} if the marker was created, {@code false} if the job
   *         was already marked
   */
  public boolean tryBlock(JobKey jobKey, String instanceId) {
    ODocument marker = new ODocument(className).field(Constants.KEY_NAME, jobKey.getName())
        .field(Constants.KEY_GROUP, jobKey.getGroup())
        .field(Constants.BLOCKED_JOB_INSTANCE_ID, instanceId);
    try {
      marker.save();
      return true;
    } catch (ORecordDuplicatedException e) {
      LOG.debug("Job {} is already blocked by another execution", jobKey);
      return false;
    }
  }

  public boolean unblock(JobKey jobKey) {
    return ODocumentHelper.getChangedCount(
        getConnection().command(deleteByKey, jobKey.getGroup(), jobKey.getName())) > 0;
  }

  /**
   * Remove the marker of a job only if it is held by a given instance.
   *
   * @param jobKey
   *          the job
   * @param ownerId
   *          the instance that must hold the marker
   *
   * @return {@code true} if the marker was removed
   */
  public boolean unblock(JobKey jobKey, String ownerId) {
    return ODocumentHelper.getChangedCount(getConnection().command(deleteByKeyAndOwner,
        jobKey.getGroup(), jobKey.getName(), ownerId)) > 0;
  }

  public boolean isBlocked(JobKey jobKey) {
    return ODocumentHelper.firstDocument(
        getConnection().query(selectByKey, jobKey.getGroup(), jobKey.getName())) != null;
  }

  public List<ODocument> findAll() {
    return ODocumentHelper.toDocuments(getConnection().query(selectAll));
  }

  public void removeAll() {
    getConnection().command("DELETE FROM " + className).close();
  }

  private ODatabaseSession getConnection() {
    return storeAssembler.getOrientDbConnector().getConnection();
  }
}
