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

import java.util.TimeZone;

import org.quartz.DateBuilder.IntervalUnit;
import org.quartz.impl.triggers.CalendarIntervalTriggerImpl;
import org.quartz.spi.OperableTrigger;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;

public class CalendarIntervalTriggerPropertiesConverter extends TriggerPropertiesConverter {

  private static final String TRIGGER_REPEAT_INTERVAL_UNIT = "repeatIntervalUnit";
  private static final String TRIGGER_REPEAT_INTERVAL = "repeatInterval";
  private static final String TRIGGER_TIMES_TRIGGERED = "timesTriggered";
  private static final String TRIGGER_TIMEZONE = "timezone";
  private static final String TRIGGER_PRESERVE_HOUR_OF_DAY = "preserveHourOfDayAcrossDaylightSavings";
  private static final String TRIGGER_SKIP_DAY_IF_HOUR_MISSING = "skipDayIfHourDoesNotExist";

  @Override
  protected boolean canHandle(OperableTrigger trigger) {
    return (trigger instanceof CalendarIntervalTriggerImpl)
        && !((CalendarIntervalTriggerImpl) trigger).hasAdditionalProperties();
  }

  @Override
  public void injectExtraPropertiesForInsert(OperableTrigger trigger, ODocument doc) {
    CalendarIntervalTriggerImpl t = (CalendarIntervalTriggerImpl) trigger;

    doc.field(TRIGGER_REPEAT_INTERVAL_UNIT, t.getRepeatIntervalUnit().name())
        .field(TRIGGER_REPEAT_INTERVAL, t.getRepeatInterval())
        .field(TRIGGER_TIMES_TRIGGERED, t.getTimesTriggered())
        .field(TRIGGER_TIMEZONE, t.getTimeZone().getID())
        .field(TRIGGER_PRESERVE_HOUR_OF_DAY, t.isPreserveHourOfDayAcrossDaylightSavings())
        .field(TRIGGER_SKIP_DAY_IF_HOUR_MISSING, t.isSkipDayIfHourDoesNotExist());
  }

  @Override
  public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, ODocument stored) {
    CalendarIntervalTriggerImpl t = (CalendarIntervalTriggerImpl) trigger;

    String repeatIntervalUnit = stored.field(TRIGGER_REPEAT_INTERVAL_UNIT);
    if (repeatIntervalUnit != null) {
      t.setRepeatIntervalUnit(IntervalUnit.valueOf(repeatIntervalUnit));
    }
    Integer repeatInterval = ODocumentHelper.getIntegerField(stored, TRIGGER_REPEAT_INTERVAL);
    if (repeatInterval != null) {
      t.setRepeatInterval(repeatInterval);
    }
    Integer timesTriggered = ODocumentHelper.getIntegerField(stored, TRIGGER_TIMES_TRIGGERED);
    if (timesTriggered != null) {
      t.setTimesTriggered(timesTriggered);
    }
    String tz = stored.field(TRIGGER_TIMEZONE);
    if (tz != null) {
      t.setTimeZone(TimeZone.getTimeZone(tz));
    }
    t.setPreserveHourOfDayAcrossDaylightSavings(
        ODocumentHelper.getBooleanField(stored, TRIGGER_PRESERVE_HOUR_OF_DAY, false));
    t.setSkipDayIfHourDoesNotExist(
        ODocumentHelper.getBooleanField(stored, TRIGGER_SKIP_DAY_IF_HOUR_MISSING, false));
  }
}
