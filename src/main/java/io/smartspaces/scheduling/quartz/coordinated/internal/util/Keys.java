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

package io.smartspaces.scheduling.quartz.coordinated.internal.util;

import org.quartz.JobKey;
import org.quartz.TriggerKey;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;

/**
 * Get Quartz keys out of documents.
 */
public class Keys {

  public static JobKey toJobKey(ODocument doc) {
    return new JobKey((String) doc.field(Constants.KEY_NAME),
        (String) doc.field(Constants.KEY_GROUP));
  }

  public static TriggerKey toTriggerKey(ODocument doc) {
    return new TriggerKey((String) doc.field(Constants.KEY_NAME),
        (String) doc.field(Constants.KEY_GROUP));
  }

  /**
   * Get the key of the job a trigger document points at.
   *
   * @param triggerDoc
   *          the trigger document
   *
   * @return the job key
   */
  public static JobKey toTriggerJobKey(ODocument triggerDoc) {
    return new JobKey((String) triggerDoc.field(Constants.TRIGGER_JOB_NAME),
        (String) triggerDoc.field(Constants.TRIGGER_JOB_GROUP));
  }
}
