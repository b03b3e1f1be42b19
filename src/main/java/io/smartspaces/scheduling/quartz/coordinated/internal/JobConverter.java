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

import java.io.IOException;

import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.spi.ClassLoadHelper;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.RecordSerialization;

/**
 * Maps {@link JobDetail} instances to and from job records.
 */
public class JobConverter {

  /**
   * Resolves job class names found in records.
   */
  private final ClassLoadHelper loadHelper;

  public JobConverter(ClassLoadHelper loadHelper) {
    this.loadHelper = loadHelper;
  }

  /**
   * Create an unsaved record for a job.
   *
   * @param jobDetail
   *          the job
   * @param className
   *          the OrientDB class holding job records
   *
   * @return the new record
   *
   * @throws JobPersistenceException
   *           the job data could not be serialized
   */
  public ODocument toDocument(JobDetail jobDetail, String className)
      throws JobPersistenceException {
    ODocument record = new ODocument(className);
    populateDocument(record, jobDetail);

    return record;
  }

  /**
   * Overwrite every job field of a record.
   *
   * @param record
   *          the record to write into
   * @param jobDetail
   *          the job
   *
   * @throws JobPersistenceException
   *           the job data could not be serialized
   */
  public void populateDocument(ODocument record, JobDetail jobDetail)
      throws JobPersistenceException {
    record.field(Constants.KEY_NAME, jobDetail.getKey().getName())
        .field(Constants.KEY_GROUP, jobDetail.getKey().getGroup())
        .field(Constants.JOB_DESCRIPTION, jobDetail.getDescription())
        .field(Constants.JOB_CLASS, jobDetail.getJobClass().getName())
        .field(Constants.JOB_DURABILITY, jobDetail.isDurable())
        .field(Constants.JOB_REQUESTS_RECOVERY, jobDetail.requestsRecovery())
        .field(Constants.JOB_CONCURRENT_EXECUTION_DISALLOWED,
            jobDetail.isConcurrentExectionDisallowed());

    populateJobData(record, jobDetail);
  }

  /**
   * Overwrite only the job data of a record. An empty map removes the field.
   *
   * @param record
   *          the record to write into
   * @param jobDetail
   *          the job
   *
   * @throws JobPersistenceException
   *           the job data could not be serialized
   */
  public void populateJobData(ODocument record, JobDetail jobDetail)
      throws JobPersistenceException {
    JobDataMap jobData = jobDetail.getJobDataMap();
    if (jobData == null || jobData.isEmpty()) {
      record.removeField(Constants.JOB_DATA);
      return;
    }

    try {
      record.field(Constants.JOB_DATA, RecordSerialization.encodeJobData(jobData));
    } catch (IOException e) {
      throw new JobPersistenceException("Job data of " + jobDetail.getKey()
          + " cannot be written to the store", e);
    }
  }

  /**
   * Rebuild a job from its record.
   *
   * @param record
   *          the job record
   *
   * @return the job, with a clean job data map
   *
   * @throws JobPersistenceException
   *           the job class could not be loaded or the job data was unreadable
   */
  public JobDetail toJobDetail(ODocument record) throws JobPersistenceException {
    String jobClassName = record.field(Constants.JOB_CLASS);

    JobDetail jobDetail = JobBuilder.newJob(loadJobClass(jobClassName))
        .withIdentity(record.<String> field(Constants.KEY_NAME),
            record.<String> field(Constants.KEY_GROUP))
        .withDescription(record.<String> field(Constants.JOB_DESCRIPTION))
        .storeDurably(ODocumentHelper.getBooleanField(record, Constants.JOB_DURABILITY, false))
        .requestRecovery(
            ODocumentHelper.getBooleanField(record, Constants.JOB_REQUESTS_RECOVERY, false))
        .usingJobData(readJobData(record, jobClassName)).build();
    jobDetail.getJobDataMap().clearDirtyFlag();

    return jobDetail;
  }

  @SuppressWarnings("unchecked")
  private Class<? extends Job> loadJobClass(String jobClassName)
      throws JobPersistenceException {
    Class<?> jobClass;
    try {
      jobClass = loadHelper.getClassLoader().loadClass(jobClassName);
    } catch (ClassNotFoundException | IllegalArgumentException e) {
      throw new JobPersistenceException("Job class " + jobClassName + " cannot be loaded", e);
    }

    if (!Job.class.isAssignableFrom(jobClass)) {
      throw new JobPersistenceException(jobClassName + " does not implement " + Job.class);
    }
    return (Class<? extends Job>) jobClass;
  }

  private JobDataMap readJobData(ODocument record, String jobClassName)
      throws JobPersistenceException {
    JobDataMap jobData = new JobDataMap();

    String encoded = record.field(Constants.JOB_DATA);
    if (encoded != null) {
      try {
        jobData.putAll(RecordSerialization.decodeJobData(encoded));
      } catch (IOException e) {
        throw new JobPersistenceException("Job data for job class " + jobClassName
            + " cannot be read from the store", e);
      }
    }

    return jobData;
  }
}
