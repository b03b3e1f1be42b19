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

package io.smartspaces.scheduling.quartz.coordinated.internal.trigger.properties;

import org.quartz.impl.triggers.SimpleTriggerImpl;
import org.quartz.spi.OperableTrigger;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;

/**
 * Fixed interval triggers.
 */
public class SimpleTriggerPropertiesConverter extends TriggerPropertiesConverter {

  private static final String TRIGGER_REPEAT_COUNT = "repeatCount";
  private static final String TRIGGER_REPEAT_INTERVAL = "repeatInterval";
  private static final String TRIGGER_TIMES_TRIGGERED = "timesTriggered";

  @Override
  protected boolean canHandle(OperableTrigger trigger) {
    return (trigger instanceof SimpleTriggerImpl)
        && !((SimpleTriggerImpl) trigger).hasAdditionalProperties();
  }

  @Override
  public void injectExtraPropertiesForInsert(OperableTrigger trigger, ODocument doc) {
    SimpleTriggerImpl t = (SimpleTriggerImpl) trigger;

    doc.field(TRIGGER_REPEAT_COUNT, t.getRepeatCount())
        .field(TRIGGER_REPEAT_INTERVAL, t.getRepeatInterval())
        .field(TRIGGER_TIMES_TRIGGERED, t.getTimesTriggered());
  }

  @Override
  public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, ODocument stored) {
    SimpleTriggerImpl t = (SimpleTriggerImpl) trigger;

    Integer repeatCount = ODocumentHelper.getIntegerField(stored, TRIGGER_REPEAT_COUNT);
    if (repeatCount != null) {
      t.setRepeatCount(repeatCount);
    }
    Long repeatInterval = ODocumentHelper.getLongField(stored, TRIGGER_REPEAT_INTERVAL);
    if (repeatInterval != null) {
      t.setRepeatInterval(repeatInterval);
    }
    Integer timesTriggered = ODocumentHelper.getIntegerField(stored, TRIGGER_TIMES_TRIGGERED);
    if (timesTriggered != null) {
      t.setTimesTriggered(timesTriggered);
    }
  }
}
