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

package io.smartspaces.scheduling.quartz.coordinated.internal.dao;

import java.util.ArrayList;
import java.util.List;

import org.quartz.Calendar;
import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;

import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.record.impl.ODocument;
import com.orientechnologies.orient.core.storage.ORecordDuplicatedException;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.RecordSerialization;

/**
 * The Data Access Object for calendars.
 */
public class StandardCalendarDao {

  private final StandardOrientDbStoreAssembler storeAssembler;

  private final String className;
  private final String selectByName;
  private final String selectNames;
  private final String deleteByName;
  private final String countAll;

  public StandardCalendarDao(StandardOrientDbStoreAssembler storeAssembler) {
    this.storeAssembler = storeAssembler;

    className = storeAssembler.getCollectionNames().getCalendars();
    selectByName = "SELECT FROM " + className + " WHERE " + Constants.CALENDAR_NAME + " = ?";
    selectNames = "SELECT " + Constants.CALENDAR_NAME + " FROM " + className;
    deleteByName = "DELETE FROM " + className + " WHERE " + Constants.CALENDAR_NAME + " = ?";
    countAll = "SELECT count(*) AS total FROM " + className;
  }

  public void removeAll() {
    getConnection().command("DELETE FROM " + className).close();
  }

  public int getCount() {
    return (int) ODocumentHelper.getCount(getConnection().query(countAll), "total");
  }

  public List<String> getNames() {
    return new ArrayList<>(ODocumentHelper.toDistinctStrings(getConnection().query(selectNames),
        Constants.CALENDAR_NAME));
  }

  public boolean exists(String calName) {
    return getCalendarByName(calName) != null;
  }

  public boolean remove(String calName) {
    return ODocumentHelper.getChangedCount(getConnection().command(deleteByName, calName)) > 0;
  }

  public Calendar retrieveCalendar(String calName) throws JobPersistenceException {
    if (calName != null) {
      ODocument doc = getCalendarByName(calName);
      if (doc != null) {
        byte[] serializedCalendar = doc.field(Constants.CALENDAR_SERIALIZED_OBJECT);
        return RecordSerialization.decodeCalendar(serializedCalendar);
      }
    }
    return null;
  }

  /**
   * Store a calendar, replacing any calendar of the same name.
   *
   * @param name
   *          the name of the calendar
   * @param calendar
   *          the calendar
   *
   * @throws JobPersistenceException
   *           the calendar could not be stored
   */
  public void store(String name, Calendar calendar) throws JobPersistenceException {
    byte[] serializedCalendar = RecordSerialization.encodeCalendar(calendar);

    ODocument doc = getCalendarByName(name);
    if (doc == null) {
      doc = new ODocument(className).field(Constants.CALENDAR_NAME, name);
    }
    doc.field(Constants.CALENDAR_SERIALIZED_OBJECT, serializedCalendar);

    try {
      doc.save();
    } catch (ORecordDuplicatedException e) {
      throw new ObjectAlreadyExistsException(
          "Calendar with name '" + name + "' already exists.");
    }
  }

  private ODocument getCalendarByName(String name) {
    return ODocumentHelper.firstDocument(getConnection().query(selectByName, name));
  }

  private ODatabaseSession getConnection() {
    return storeAssembler.getOrientDbConnector().getConnection();
  }
}
