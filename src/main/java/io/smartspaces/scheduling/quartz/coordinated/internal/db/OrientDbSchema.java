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

package io.smartspaces.scheduling.quartz.coordinated.internal.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.metadata.schema.OClass;
import com.orientechnologies.orient.core.metadata.schema.OSchema;
import com.orientechnologies.orient.core.metadata.schema.OType;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;

/**
 * Creates the classes, properties and indexes the job store needs.
 *
 * <p>
 * Classes that already exist are left alone, so any number of scheduler
 * instances can start against the same database.
 *
 * @author Keith M. Hughes
 */
public class OrientDbSchema {

  private static final Logger LOG = LoggerFactory.getLogger(OrientDbSchema.class);

  private final CollectionNames collectionNames;

  public OrientDbSchema(CollectionNames collectionNames) {
    this.collectionNames = collectionNames;
  }

  /**
   * Create whatever part of the schema is missing.
   *
   * @param session
   *          the session to create the schema with, must not be in a
   *          transaction
   */
  public void ensureSchema(ODatabaseSession session) {
    OSchema schema = session.getMetadata().getSchema();

    String schedulersName = collectionNames.getSchedulers();
    if (!schema.existsClass(schedulersName)) {
      OClass schedulerClass = schema.createClass(schedulersName);
      schedulerClass.createProperty(Constants.SCHEDULER_INSTANCE_ID_FIELD, OType.STRING)
          .setNotNull(true);
      schedulerClass.createProperty(Constants.SCHEDULER_NAME_FIELD, OType.STRING);
      schedulerClass.createProperty(Constants.SCHEDULER_EXPIRES_FIELD, OType.DATETIME);
      schedulerClass.createProperty(Constants.SCHEDULER_STATE_FIELD, OType.STRING);

      schedulerClass.createIndex(collectionNames.getKeyIndexName(schedulersName),
          OClass.INDEX_TYPE.UNIQUE, Constants.SCHEDULER_INSTANCE_ID_FIELD);
      created(schedulersName);
    }

    String calendarsName = collectionNames.getCalendars();
    if (!schema.existsClass(calendarsName)) {
      OClass calendarClass = schema.createClass(calendarsName);
      calendarClass.createProperty(Constants.CALENDAR_NAME, OType.STRING).setNotNull(true);
      calendarClass.createProperty(Constants.CALENDAR_SERIALIZED_OBJECT, OType.BINARY);

      calendarClass.createIndex(collectionNames.getKeyIndexName(calendarsName),
          OClass.INDEX_TYPE.UNIQUE, Constants.CALENDAR_NAME);
      created(calendarsName);
    }

    String jobsName = collectionNames.getJobs();
    if (!schema.existsClass(jobsName)) {
      OClass jobClass = schema.createClass(jobsName);
      jobClass.createProperty(Constants.KEY_NAME, OType.STRING).setNotNull(true);
      jobClass.createProperty(Constants.KEY_GROUP, OType.STRING).setNotNull(true);
      jobClass.createProperty(Constants.JOB_DESCRIPTION, OType.STRING);
      jobClass.createProperty(Constants.JOB_CLASS, OType.STRING);
      jobClass.createProperty(Constants.JOB_DATA, OType.STRING);
      jobClass.createProperty(Constants.JOB_DURABILITY, OType.BOOLEAN);
      jobClass.createProperty(Constants.JOB_REQUESTS_RECOVERY, OType.BOOLEAN);
      jobClass.createProperty(Constants.JOB_CONCURRENT_EXECUTION_DISALLOWED, OType.BOOLEAN);

      jobClass.createIndex(collectionNames.getKeyIndexName(jobsName), OClass.INDEX_TYPE.UNIQUE,
          Constants.KEY_GROUP, Constants.KEY_NAME);
      created(jobsName);
    }

    String triggersName = collectionNames.getTriggers();
    if (!schema.existsClass(triggersName)) {
      OClass triggerClass = schema.createClass(triggersName);
      triggerClass.createProperty(Constants.TRIGGER_CLASS, OType.STRING);
      triggerClass.createProperty(Constants.KEY_NAME, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.KEY_GROUP, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.TRIGGER_JOB_NAME, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.TRIGGER_JOB_GROUP, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.TRIGGER_STATE, OType.STRING).setNotNull(true);
      triggerClass.createProperty(Constants.TRIGGER_CALENDAR_NAME, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_DESCRIPTION, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_MISFIRE_INSTRUCTION, OType.INTEGER);
      triggerClass.createProperty(Constants.TRIGGER_PRIORITY, OType.INTEGER);
      triggerClass.createProperty(Constants.TRIGGER_NEXT_FIRE_TIME, OType.DATETIME);
      triggerClass.createProperty(Constants.TRIGGER_PREVIOUS_FIRE_TIME, OType.DATETIME);
      triggerClass.createProperty(Constants.TRIGGER_START_TIME, OType.DATETIME);
      triggerClass.createProperty(Constants.TRIGGER_END_TIME, OType.DATETIME);
      triggerClass.createProperty(Constants.TRIGGER_FINAL_FIRE_TIME, OType.DATETIME);
      triggerClass.createProperty(Constants.TRIGGER_SCHEDULER_INSTANCE_ID, OType.STRING);
      triggerClass.createProperty(Constants.TRIGGER_FIRE_INSTANCE_ID, OType.STRING);
      triggerClass.createProperty(Constants.JOB_DATA, OType.STRING);

      triggerClass.createIndex(collectionNames.getKeyIndexName(triggersName),
          OClass.INDEX_TYPE.UNIQUE, Constants.KEY_GROUP, Constants.KEY_NAME);
      triggerClass.createIndex(triggersName + "_state", OClass.INDEX_TYPE.NOTUNIQUE,
          Constants.TRIGGER_STATE, Constants.TRIGGER_NEXT_FIRE_TIME);
      triggerClass.createIndex(triggersName + "_job", OClass.INDEX_TYPE.NOTUNIQUE,
          Constants.TRIGGER_JOB_GROUP, Constants.TRIGGER_JOB_NAME);
      created(triggersName);
    }

    createGroupMarkerClass(schema, collectionNames.getPausedTriggerGroups());
    createGroupMarkerClass(schema, collectionNames.getPausedJobGroups());

    String blockedJobsName = collectionNames.getBlockedJobs();
    if (!schema.existsClass(blockedJobsName)) {
      OClass blockedJobClass = schema.createClass(blockedJobsName);
      blockedJobClass.createProperty(Constants.KEY_NAME, OType.STRING).setNotNull(true);
      blockedJobClass.createProperty(Constants.KEY_GROUP, OType.STRING).setNotNull(true);
      blockedJobClass.createProperty(Constants.BLOCKED_JOB_INSTANCE_ID, OType.STRING);

      blockedJobClass.createIndex(collectionNames.getKeyIndexName(blockedJobsName),
          OClass.INDEX_TYPE.UNIQUE, Constants.KEY_GROUP, Constants.KEY_NAME);
      created(blockedJobsName);
    }
  }

  private void createGroupMarkerClass(OSchema schema, String className) {
    if (!schema.existsClass(className)) {
      OClass markerClass = schema.createClass(className);
      markerClass.createProperty(Constants.KEY_GROUP, OType.STRING).setNotNull(true);

      markerClass.createIndex(collectionNames.getKeyIndexName(className),
          OClass.INDEX_TYPE.UNIQUE, Constants.KEY_GROUP);
      created(className);
    }
  }

  private void created(String className) {
    LOG.debug("Created OrientDB class {}", className);
  }
}
