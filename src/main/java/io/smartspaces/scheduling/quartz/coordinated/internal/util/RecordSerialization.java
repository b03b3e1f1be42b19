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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.HashMap;
import java.util.Map;

import org.apache.commons.codec.binary.Base64;
import org.quartz.Calendar;
import org.quartz.JobDataMap;
import org.quartz.JobPersistenceException;

/**
 * Java serialization of the values kept in store records.
 *
 * <p>
 * Calendars are stored as raw bytes. Job data maps are stored as Base64 text
 * so they can live in a string field.
 */
public final class RecordSerialization {

  private RecordSerialization() {
  }

  public static byte[] encodeCalendar(Calendar calendar) throws JobPersistenceException {
    try {
      return writeObject(calendar);
    } catch (IOException e) {
      throw new JobPersistenceException("Calendar " + calendar.getDescription()
          + " cannot be written to the store", e);
    }
  }

  public static Calendar decodeCalendar(byte[] bytes) throws JobPersistenceException {
    Object value;
    try {
      value = readObject(bytes);
    } catch (IOException | ClassNotFoundException e) {
      throw new JobPersistenceException("Stored calendar cannot be read", e);
    }

    if (!(value instanceof Calendar)) {
      throw new JobPersistenceException("Stored calendar record holds a "
          + (value == null ? "null value" : value.getClass().getName()));
    }
    return (Calendar) value;
  }

  /**
   * Encode the entries of a job data map.
   *
   * @param jobData
   *          the map to encode
   *
   * @return Base64 text of the serialized entries
   *
   * @throws IOException
   *           an entry could not be serialized, the message names its key
   */
  public static String encodeJobData(JobDataMap jobData) throws IOException {
    Map<String, Object> entries = new HashMap<>(jobData.getWrappedMap());
    try {
      return Base64.encodeBase64String(writeObject(entries));
    } catch (NotSerializableException e) {
      throw new NotSerializableException("Job data entry '" + findUnserializableKey(entries)
          + "' holds a value that is not serializable: " + e.getMessage());
    }
  }

  /**
   * Decode job data entries written by {@link #encodeJobData(JobDataMap)}.
   *
   * @param encoded
   *          the Base64 text
   *
   * @return the entries
   *
   * @throws IOException
   *           the text could not be decoded
   */
  public static Map<String, Object> decodeJobData(String encoded) throws IOException {
    Object value;
    try {
      value = readObject(Base64.decodeBase64(encoded));
    } catch (ClassNotFoundException e) {
      throw new IOException("Job data refers to a class that cannot be loaded", e);
    }

    if (!(value instanceof Map)) {
      throw new IOException("Job data does not decode to a map");
    }

    Map<String, Object> entries = new HashMap<>();
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
      entries.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return entries;
  }

  private static byte[] writeObject(Object value) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(value);
    }
    return bytes.toByteArray();
  }

  private static Object readObject(byte[] bytes) throws IOException, ClassNotFoundException {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
      return in.readObject();
    }
  }

  private static String findUnserializableKey(Map<String, Object> entries) {
    for (Map.Entry<String, Object> entry : entries.entrySet()) {
      try {
        writeObject(entry.getValue());
      } catch (IOException e) {
        return entry.getKey();
      }
    }
    return null;
  }
}
