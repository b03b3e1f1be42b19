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

import java.io.IOException;
import java.util.Date;
import java.util.List;

import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.JobPersistenceException;
import org.quartz.spi.ClassLoadHelper;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.Keys;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.RecordSerialization;

/**
 * A converter between Quartz triggers and OrientDB records.
 *
 * <p>
 * The stored trigger class name picks both the class to instantiate and the
 * {@link TriggerPropertiesConverter} for the fields only that kind of trigger
 * has.
 */
public class TriggerConverter {

  private static final Logger LOG = LoggerFactory.getLogger(TriggerConverter.class);

  private final List<TriggerPropertiesConverter> propertiesConverters;

  private final String className;

  private final ClassLoadHelper loadHelper;

  public TriggerConverter(List<TriggerPropertiesConverter> propertiesConverters,
      String className, ClassLoadHelper loadHelper) {
    this.propertiesConverters = propertiesConverters;
    this.className = className;
    this.loadHelper = loadHelper;
  }

  /**
   * Create a new document for a trigger.
   *
   * @param newTrigger
   *          the trigger
   * @param state
   *          the state the trigger starts in
   *
   * @return the unsaved document
   *
   * @throws JobPersistenceException
   *           the trigger could not be converted
   */
  public ODocument toDocument(OperableTrigger newTrigger, StoredTriggerState state)
      throws JobPersistenceException {
    ODocument trigger = new ODocument(className);
    populateDocument(trigger, newTrigger);
    trigger.field(Constants.TRIGGER_STATE, state.getValue());

    return trigger;
  }

  /**
   * Write all fields of a trigger into a document. The state and the
   * ownership fields are left alone.
   *
   * @param trigger
   *          the document to write into
   * @param newTrigger
   *          the trigger
   *
   * @throws JobPersistenceException
   *           the trigger could not be converted
   */
  public void populateDocument(ODocument trigger, OperableTrigger newTrigger)
      throws JobPersistenceException {
    trigger.field(Constants.KEY_NAME, newTrigger.getKey().getName());
    trigger.field(Constants.KEY_GROUP, newTrigger.getKey().getGroup());
    trigger.field(Constants.TRIGGER_JOB_NAME, newTrigger.getJobKey().getName());
    trigger.field(Constants.TRIGGER_JOB_GROUP, newTrigger.getJobKey().getGroup());
    trigger.field(Constants.TRIGGER_CLASS, newTrigger.getClass().getName());
    trigger.field(Constants.TRIGGER_CALENDAR_NAME, newTrigger.getCalendarName());
    trigger.field(Constants.TRIGGER_DESCRIPTION, newTrigger.getDescription());
    trigger.field(Constants.TRIGGER_MISFIRE_INSTRUCTION, newTrigger.getMisfireInstruction());
    trigger.field(Constants.TRIGGER_PRIORITY, newTrigger.getPriority());
    trigger.field(Constants.TRIGGER_FINAL_FIRE_TIME, newTrigger.getFinalFireTime());

    JobDataMap jobDataMap = newTrigger.getJobDataMap();
    if (jobDataMap != null && !jobDataMap.isEmpty()) {
      try {
        trigger.field(Constants.JOB_DATA, RecordSerialization.encodeJobData(jobDataMap));
      } catch (IOException e) {
        throw new JobPersistenceException(
            "Job data of trigger " + newTrigger.getKey() + " cannot be written", e);
      }
    } else {
      trigger.removeField(Constants.JOB_DATA);
    }

    populateFireTimes(trigger, newTrigger);
  }

  /**
   * Write the fields a trigger changes each time it fires or misfires.
   *
   * @param trigger
   *          the document to write into
   * @param firedTrigger
   *          the trigger
   *
   * @throws JobPersistenceException
   *           the trigger could not be converted
   */
  public void populateFireTimes(ODocument trigger, OperableTrigger firedTrigger)
      throws JobPersistenceException {
    trigger.field(Constants.TRIGGER_NEXT_FIRE_TIME, firedTrigger.getNextFireTime());
    trigger.field(Constants.TRIGGER_PREVIOUS_FIRE_TIME, firedTrigger.getPreviousFireTime());
    trigger.field(Constants.TRIGGER_START_TIME, firedTrigger.getStartTime());
    trigger.field(Constants.TRIGGER_END_TIME, firedTrigger.getEndTime());

    // Interval counts live in the kind specific fields.
    getConverterFor(firedTrigger).injectExtraPropertiesForInsert(firedTrigger, trigger);
  }

  /**
   * Restore a trigger from its document.
   *
   * @param triggerDoc
   *          the stored document
   *
   * @return the trigger
   *
   * @throws JobPersistenceException
   *           the trigger could not be restored
   */
  public OperableTrigger toTrigger(ODocument triggerDoc) throws JobPersistenceException {
    OperableTrigger trigger = createNewInstance(triggerDoc);

    TriggerPropertiesConverter propertiesConverter = getConverterFor(trigger);

    trigger.setKey(Keys.toTriggerKey(triggerDoc));
    trigger.setJobKey(new JobKey((String) triggerDoc.field(Constants.TRIGGER_JOB_NAME),
        (String) triggerDoc.field(Constants.TRIGGER_JOB_GROUP)));
    trigger.setCalendarName((String) triggerDoc.field(Constants.TRIGGER_CALENDAR_NAME));
    trigger.setDescription((String) triggerDoc.field(Constants.TRIGGER_DESCRIPTION));
    trigger.setFireInstanceId((String) triggerDoc.field(Constants.TRIGGER_FIRE_INSTANCE_ID));

    Integer misfireInstruction =
        ODocumentHelper.getIntegerField(triggerDoc, Constants.TRIGGER_MISFIRE_INSTRUCTION);
    if (misfireInstruction != null) {
      trigger.setMisfireInstruction(misfireInstruction);
    }
    Integer priority = ODocumentHelper.getIntegerField(triggerDoc, Constants.TRIGGER_PRIORITY);
    if (priority != null) {
      trigger.setPriority(priority);
    }

    trigger.setNextFireTime((Date) triggerDoc.field(Constants.TRIGGER_NEXT_FIRE_TIME));
    trigger.setPreviousFireTime((Date) triggerDoc.field(Constants.TRIGGER_PREVIOUS_FIRE_TIME));

    loadJobData(triggerDoc, trigger);
    loadStartAndEndTime(triggerDoc, trigger);

    propertiesConverter.setExtraPropertiesAfterInstantiation(trigger, triggerDoc);

    return trigger;
  }

  private TriggerPropertiesConverter getConverterFor(OperableTrigger trigger)
      throws JobPersistenceException {
    for (TriggerPropertiesConverter converter : propertiesConverters) {
      if (converter.canHandle(trigger)) {
        return converter;
      }
    }

    throw new JobPersistenceException(
        "Trigger class " + trigger.getClass().getName() + " cannot be stored");
  }

  private OperableTrigger createNewInstance(ODocument triggerDoc) throws JobPersistenceException {
    String triggerClassName = triggerDoc.field(Constants.TRIGGER_CLASS);
    try {
      Class<? extends OperableTrigger> triggerClass =
          loadHelper.loadClass(triggerClassName, OperableTrigger.class);
      return triggerClass.getDeclaredConstructor().newInstance();
    } catch (ClassNotFoundException e) {
      throw new JobPersistenceException("Could not find trigger class " + triggerClassName, e);
    } catch (ReflectiveOperationException | ClassCastException e) {
      throw new JobPersistenceException("Could not instantiate trigger class " + triggerClassName,
          e);
    }
  }

  private void loadJobData(ODocument triggerDoc, OperableTrigger trigger)
      throws JobPersistenceException {
    String jobDataString = triggerDoc.field(Constants.JOB_DATA);

    if (jobDataString != null) {
      try {
        JobDataMap jobDataMap = new JobDataMap(RecordSerialization.decodeJobData(jobDataString));
        jobDataMap.clearDirtyFlag();
        trigger.setJobDataMap(jobDataMap);
      } catch (IOException e) {
        throw new JobPersistenceException(
            "Job data of trigger " + trigger.getKey() + " cannot be read", e);
      }
    }
  }

  private void loadStartAndEndTime(ODocument triggerDoc, OperableTrigger trigger) {
    try {
      trigger.setStartTime((Date) triggerDoc.field(Constants.TRIGGER_START_TIME));
      trigger.setEndTime((Date) triggerDoc.field(Constants.TRIGGER_END_TIME));
    } catch (IllegalArgumentException e) {
      // Triggers validate the start and end time as they are set.
      LOG.warn("Trigger had illegal start / end time combination: {}", trigger.getKey(), e);
    }
  }
}
