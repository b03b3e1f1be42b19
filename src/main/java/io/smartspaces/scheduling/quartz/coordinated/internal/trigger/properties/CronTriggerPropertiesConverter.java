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

import java.text.ParseException;
import java.util.TimeZone;

import org.quartz.CronExpression;
import org.quartz.impl.triggers.CronTriggerImpl;
import org.quartz.spi.OperableTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.record.impl.ODocument;

import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.TriggerPropertiesConverter;

public class CronTriggerPropertiesConverter extends TriggerPropertiesConverter {

  private static final Logger LOG = LoggerFactory.getLogger(CronTriggerPropertiesConverter.class);

  private static final String TRIGGER_CRON_EXPRESSION = "cronExpression";
  private static final String TRIGGER_TIMEZONE = "timezone";

  @Override
  protected boolean canHandle(OperableTrigger trigger) {
    return (trigger instanceof CronTriggerImpl)
        && !((CronTriggerImpl) trigger).hasAdditionalProperties();
  }

  @Override
  public void injectExtraPropertiesForInsert(OperableTrigger trigger, ODocument doc) {
    CronTriggerImpl t = (CronTriggerImpl) trigger;

    doc.field(TRIGGER_CRON_EXPRESSION, t.getCronExpression()).field(TRIGGER_TIMEZONE,
        t.getTimeZone().getID());
  }

  @Override
  public void setExtraPropertiesAfterInstantiation(OperableTrigger trigger, ODocument stored) {
    CronTriggerImpl t = (CronTriggerImpl) trigger;

    String tz = stored.field(TRIGGER_TIMEZONE);
    if (tz != null) {
      t.setTimeZone(TimeZone.getTimeZone(tz));
    }

    String expression = stored.field(TRIGGER_CRON_EXPRESSION);
    if (expression != null) {
      try {
        CronExpression cronExpression = new CronExpression(expression);
        cronExpression.setTimeZone(t.getTimeZone());
        t.setCronExpression(cronExpression);
      } catch (ParseException e) {
        // Only expressions that already parsed are ever stored.
        LOG.error("Stored cron expression '{}' for trigger {} could not be parsed", expression,
            trigger.getKey(), e);
      }
    }
  }
}
