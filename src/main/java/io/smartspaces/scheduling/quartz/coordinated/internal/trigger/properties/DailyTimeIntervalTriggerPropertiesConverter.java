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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.quartz.DateBuilder;
import org.quartz.TimeOfDay;
import org.quartz.impl.triggers.DailyTimeIntervalTriggerImpl;
import org.quartz.spi.OperableTrigger;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerPropertiesConverter;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;

/**
 * Triggers that fire at an interval within a window of each day.
 *
 * <p>
 * Times of day are flattened into separate hour, minute and second fields.
 */
public class DailyTimeIntervalTriggerPropertiesConverter extends TriggerPropertiesConverter {

  private static final String TRIGGER_REPEAT_INTERVAL_UNIT = "repeatIntervalUnit";
  private static final String TRIGGER_REPEAT_INTERVAL = "repeatInterval";
  private static final String TRIGGER_REPEAT_COUNT = "repeatCount";
  private static final String TRIGGER_TIMES_TRIGGERED = "timesTriggered";
  private static final String TRIGGER_DAYS_OF_WEEK = "daysOfWeek";
  private static final String TRIGGER_START_TIME_OF_DAY = "startTimeOfDay";
  private static final String TRIGGER_END_TIME_OF_DAY = "endTimeOfDay";

  private static final String HOUR_SUFFIX = "Hour";
  private static final String MINUTE_SUFFIX = "Minute";
  private static final String SECOND_SUFFIX = "Second";

  @Override
  protected boolean canHandle(OperableTrigger trigger) {
    return (trigger instanceof DailyTimeIntervalTriggerImpl)
        && !((DailyTimeIntervalTriggerImpl) trigger).hasAdditionalProperties();
  }

  @Override
  public void injectExtraPropertiesForInsert(OperableTrigger trigger, ODocument doc) {
    DailyTimeIntervalTriggerImpl t = (DailyTimeIntervalTriggerImpl) trigger;

    doc.field(TRIGGER_REPEAT_INTERVAL_UNIT, t.getRepeatIntervalUnit().name())
        .field(TRIGGER_REPEAT_INTERVAL, t.getRepeatInterval())
        .field(TRIGGER_REPEAT_COUNT, t.getRepeatCount())
        .field(TRIGGER_TIMES_TRIGGERED, t.getTimesTriggered());

    Set<Integer> daysOfWeek = t.getDaysOfWeek();
    if (daysOfWeek != null) {
      doc.field(TRIGGER_DAYS_OF_WEEK, new ArrayList<Integer>(daysOfWeek));
    }

    writeTimeOfDay(doc, TRIGGER_START_TIME_OF_DAY, t.getStartTimeOfDay());
    writeTimeOfDay(doc, TRIGGER_END_TIME_OF_DAY, t.getEndTimeOfDay());
  }

  @Override
  public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, ODocument stored) {
    DailyTimeIntervalTriggerImpl t = (DailyTimeIntervalTriggerImpl) trigger;

    String intervalUnit = stored.field(TRIGGER_REPEAT_INTERVAL_UNIT);
    if (intervalUnit != null) {
      t.setRepeatIntervalUnit(DateBuilder.IntervalUnit.valueOf(intervalUnit));
    }
    Integer repeatInterval = ODocumentHelper.getIntegerField(stored, TRIGGER_REPEAT_INTERVAL);
    if (repeatInterval != null) {
      t.setRepeatInterval(repeatInterval);
    }
    Integer repeatCount = ODocumentHelper.getIntegerField(stored, TRIGGER_REPEAT_COUNT);
    if (repeatCount != null) {
      t.setRepeatCount(repeatCount);
    }
    Integer timesTriggered = ODocumentHelper.getIntegerField(stored, TRIGGER_TIMES_TRIGGERED);
    if (timesTriggered != null) {
      t.setTimesTriggered(timesTriggered);
    }

    Collection<?> daysOfWeek = stored.field(TRIGGER_DAYS_OF_WEEK);
    if (daysOfWeek != null) {
      Set<Integer> days = new HashSet<>();
      for (Object day : daysOfWeek) {
        days.add(((Number) day).intValue());
      }
      t.setDaysOfWeek(days);
    }

    TimeOfDay startTimeOfDay = readTimeOfDay(stored, TRIGGER_START_TIME_OF_DAY);
    if (startTimeOfDay != null) {
      t.setStartTimeOfDay(startTimeOfDay);
    }
    TimeOfDay endTimeOfDay = readTimeOfDay(stored, TRIGGER_END_TIME_OF_DAY);
    if (endTimeOfDay != null) {
      t.setEndTimeOfDay(endTimeOfDay);
    }
  }

  private void writeTimeOfDay(ODocument doc, String prefix, TimeOfDay tod) {
    if (tod != null) {
      doc.field(prefix + HOUR_SUFFIX, tod.getHour()).field(prefix + MINUTE_SUFFIX, tod.getMinute())
          .field(prefix + SECOND_SUFFIX, tod.getSecond());
    }
  }

  private TimeOfDay readTimeOfDay(ODocument doc, String prefix) {
    List<Integer> parts = new ArrayList<>();
    for (String suffix : new String[] { HOUR_SUFFIX, MINUTE_SUFFIX, SECOND_SUFFIX }) {
      Integer part = ODocumentHelper.getIntegerField(doc, prefix + suffix);
      if (part == null) {
        return null;
      }
      parts.add(part);
    }

    return new TimeOfDay(parts.get(0), parts.get(1), parts.get(2));
  }
}
