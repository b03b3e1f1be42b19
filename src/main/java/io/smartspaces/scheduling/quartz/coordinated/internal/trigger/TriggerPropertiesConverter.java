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

import org.quartz.spi.OperableTrigger;

import com.orientechnologies.orient.core.record.impl.ODocument;

/**
 * Converts the properties that only one kind of trigger has.
 */
public abstract class TriggerPropertiesConverter {

  /**
   * Can this converter handle the given trigger?
   *
   * @param trigger
   *          the trigger
   *
   * @return {@code true} if the trigger is of the kind this converter knows
   */
  protected abstract boolean canHandle(OperableTrigger trigger);

  /**
   * Write the kind specific properties of a trigger into its document.
   *
   * @param trigger
   *          the trigger being stored
   * @param doc
   *          the document being written
   */
  public abstract void injectExtraPropertiesForInsert(OperableTrigger trigger, ODocument doc);

  /**
   * Restore the kind specific properties of a trigger from its document.
   *
   * @param trigger
   *          a freshly created trigger
   * @param stored
   *          the stored document
   */
  public abstract void setExtraPropertiesAfterInstantiation(OperableTrigger trigger,
      ODocument stored);
}
