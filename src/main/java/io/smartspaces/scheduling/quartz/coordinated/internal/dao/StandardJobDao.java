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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.impl.matchers.GroupMatcher;

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.record.impl.ODocument;
import com.orientechnologies.orient.core.storage.ORecordDuplicatedException;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.JobConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Keys;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.QueryHelper;

/**
 * The Data Access Object for jobs.
 */
public class StandardJobDao {

  private final StandardOrientDbStoreAssembler storeAssembler;
  private final QueryHelper queryHelper;
  private final JobConverter jobConverter;

  private final String className;
  private final String selectByKey;
  private final String selectByGroup;
  private final String selectAll;
  private final String selectGroups;
  private final String deleteByKey;
  private final String countAll;

  public StandardJobDao(StandardOrientDbStoreAssembler storeAssembler, QueryHelper queryHelper,
      JobConverter jobConverter) {
    this.storeAssembler = storeAssembler;
    this.queryHelper = queryHelper;
    this.jobConverter = jobConverter;

    className = storeAssembler.getCollectionNames().getJobs();
    selectByKey = "SELECT FROM " + className + " WHERE " + queryHelper.keyCondition();
    selectByGroup = "SELECT FROM " + className + " WHERE " + Constants.KEY_GROUP + " = ?";
    selectAll = "SELECT FROM " + className;
    selectGroups = "SELECT " + Constants.KEY_GROUP + " FROM " + className;
    deleteByKey = "DELETE FROM " + className + " WHERE " + queryHelper.keyCondition();
    countAll = "SELECT count(*) AS total FROM " + className;
  }

  public void removeAll() {
    getConnection().command("DELETE FROM " + className).close();
  }

  public boolean exists(JobKey jobKey) {
    return getJob(jobKey) != null;
  }

  /**
   * Get the document for a job.
   *
   * @param jobKey
   *          the key of the job
   *
   * @return the document, or {@code null} if no such job
   */
  public ODocument getJob(JobKey jobKey) {
    return ODocumentHelper
        .firstDocument(getConnection().query(selectByKey, jobKey.getGroup(), jobKey.getName()));
  }

  public int getCount() {
    return (int) ODocumentHelper.getCount(getConnection().query(countAll), "total");
  }

  public List<String> getGroupNames() {
    return new ArrayList<>(
        ODocumentHelper.toDistinctStrings(getConnection().query(selectGroups), Constants.KEY_GROUP));
  }

  public Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) {
    Set<JobKey> keys = new HashSet<>();
    if (queryHelper.isEquality(matcher)) {
      for (ODocument doc : ODocumentHelper
          .toDocuments(getConnection().query(selectByGroup, matcher.getCompareToValue()))) {
        keys.add(Keys.toJobKey(doc));
      }
    } else {
      for (ODocument doc : ODocumentHelper.toDocuments(getConnection().query(selectAll))) {
        JobKey key = Keys.toJobKey(doc);
        if (queryHelper.matches(key.getGroup(), matcher)) {
          keys.add(key);
        }
      }
    }

    return keys;
  }

  public boolean remove(JobKey jobKey) {
    return ODocumentHelper.getChangedCount(
        getConnection().command(deleteByKey, jobKey.getGroup(), jobKey.getName())) > 0;
  }

  public JobDetail retrieveJob(JobKey jobKey) throws JobPersistenceException {
    ODocument doc = getJob(jobKey);
    if (doc == null) {
      // Return null if job does not exist, per interface
      return null;
    }
    return jobConverter.toJobDetail(doc);
  }

  /**
   * Store a job.
   *
   * @param newJob
   *          the job to store
   * @param replaceExisting
   *          {@code true} if an existing job with the same key should be
   *          replaced
   *
   * @throws ObjectAlreadyExistsException
   *           the job exists and is not to be replaced
   * @throws JobPersistenceException
   *           the job could not be stored
   */
  public void storeJob(JobDetail newJob, boolean replaceExisting)
      throws JobPersistenceException {
    ODocument oldJobDoc = getJob(newJob.getKey());
    if (oldJobDoc != null) {
      if (!replaceExisting) {
        throw new ObjectAlreadyExistsException(newJob);
      }

      ODocumentHelper.clearFields(oldJobDoc);
      jobConverter.populateDocument(oldJobDoc, newJob);
      oldJobDoc.save();
    } else {
      try {
        jobConverter.toDocument(newJob, className).save();
      } catch (ORecordDuplicatedException e) {
        throw new ObjectAlreadyExistsException(newJob);
      }
    }
  }

  /**
   * Write the data map of a job back to the database.
   *
   * @param job
   *          the job
   *
   * @return {@code true} if the job still existed
   *
   * @throws JobPersistenceException
   *           the data could not be written
   */
  public boolean updateJobData(JobDetail job) throws JobPersistenceException {
    ODocument jobDoc = getJob(job.getKey());
    if (jobDoc == null) {
      return false;
    }

    jobConverter.populateJobData(jobDoc, job);
    jobDoc.save();

    return true;
  }

  private ODatabaseSession getConnection() {
    return storeAssembler.getOrientDbConnector().getConnection();
  }
}
