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

/**
 * Field and collection names used in the OrientDB records of the job store.
 */
public interface Constants {

  String KEY_NAME = "keyName";
  String KEY_GROUP = "keyGroup";

  /**
   * The job field giving the job durability.
   */
  String JOB_DURABILITY = "durability";
  String JOB_CLASS = "jobClass";
  String JOB_DESCRIPTION = "jobDescription";
  String JOB_REQUESTS_RECOVERY = "requestsRecovery";
  String JOB_CONCURRENT_EXECUTION_DISALLOWED = "concurrentExecutionDisallowed";
  String JOB_DATA = "jobData";

  String TRIGGER_STATE = "state";
  String TRIGGER_JOB_NAME = "jobName";
  String TRIGGER_JOB_GROUP = "jobGroup";
  String TRIGGER_CALENDAR_NAME = "calendarName";
  String TRIGGER_CLASS = "class";
  String TRIGGER_DESCRIPTION = "description";
  String TRIGGER_END_TIME = "endTime";
  String TRIGGER_FINAL_FIRE_TIME = "finalFireTime";
  String TRIGGER_MISFIRE_INSTRUCTION = "misfireInstruction";
  String TRIGGER_NEXT_FIRE_TIME = "nextFireTime";
  String TRIGGER_PREVIOUS_FIRE_TIME = "previousFireTime";
  String TRIGGER_PRIORITY = "priority";
  String TRIGGER_START_TIME = "startTime";

  /**
   * The instance holding the trigger while it is acquired.
   */
  String TRIGGER_SCHEDULER_INSTANCE_ID = "schedulerInstanceId";

  /**
   * The fire instance ID given to the trigger when it was acquired.
   */
  String TRIGGER_FIRE_INSTANCE_ID = "fireInstanceId";

  String SCHEDULER_INSTANCE_ID_FIELD = "instanceId";
  String SCHEDULER_NAME_FIELD = "schedulerName";
  String SCHEDULER_EXPIRES_FIELD = "expires";
  String SCHEDULER_STATE_FIELD = "state";

  String SCHEDULER_STATE_RUNNING = "running";
  String SCHEDULER_STATE_PAUSED = "paused";
  String SCHEDULER_STATE_RESUMING = "resuming";

  String CALENDAR_NAME = "name";
  String CALENDAR_SERIALIZED_OBJECT = "serializedObject";

  String BLOCKED_JOB_INSTANCE_ID = "instanceId";

  String COLLECTION_SCHEDULERS = "schedulers";
  String COLLECTION_CALENDARS = "calendars";
  String COLLECTION_TRIGGERS = "triggers";
  String COLLECTION_JOBS = "jobs";
  String COLLECTION_PAUSED_TRIGGER_GROUPS = "pausedTriggerGroups";
  String COLLECTION_PAUSED_JOB_GROUPS = "pausedJobGroups";
  String COLLECTION_BLOCKED_JOBS = "blockedJobs";
}
