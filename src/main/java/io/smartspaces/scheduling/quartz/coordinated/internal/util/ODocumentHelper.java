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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.orientechnologies.orient.core.record.impl.ODocument;
import com.orientechnologies.orient.core.sql.executor.OResult;
import com.orientechnologies.orient.core.sql.executor.OResultSet;

/**
 * A collection of methods to help working with orientDB documents and query
 * results.
 *
 * @author Keith M. Hughes
 */
public class ODocumentHelper {

  /**
   * The property holding the number of records changed by an UPDATE or DELETE.
   */
  public static final String COUNT_PROPERTY = "count";

  /**
   * Get all documents from a result set. The result set is closed.
   *
   * @param resultSet
   *          the result set
   *
   * @return the documents in the result set
   */
  public static List<ODocument> toDocuments(OResultSet resultSet) {
    List<ODocument> documents = new ArrayList<>();
    try {
      while (resultSet.hasNext()) {
        OResult result = resultSet.next();
        if (result.isElement()) {
          documents.add((ODocument) result.getElement().get());
        }
      }
    } finally {
      resultSet.close();
    }

    return documents;
  }

  /**
   * Get the first document from a result set. The result set is closed.
   *
   * @param resultSet
   *          the result set
   *
   * @return the first document, or {@code null} if there are none
   */
  public static ODocument firstDocument(OResultSet resultSet) {
    List<ODocument> documents = toDocuments(resultSet);
    if (documents.isEmpty()) {
      return null;
    } else {
      return documents.get(0);
    }
  }

  /**
   * Get the values of a string property from every row of a result set, with
   * duplicates removed. The result set is closed.
   *
   * @param resultSet
   *          the result set
   * @param propertyName
   *          the property to collect
   *
   * @return the distinct values in the order they were first seen
   */
  public static Set<String> toDistinctStrings(OResultSet resultSet, String propertyName) {
    Set<String> values = new LinkedHashSet<>();
    try {
      while (resultSet.hasNext()) {
        String value = resultSet.next().getProperty(propertyName);
        if (value != null) {
          values.add(value);
        }
      }
    } finally {
      resultSet.close();
    }

    return values;
  }

  /**
   * Get a numeric property from the first row of a result set. The result set
   * is closed.
   *
   * <p>
   * Used for the count returned by UPDATE and DELETE statements and for
   * {@code count(*)} projections.
   *
   * @param resultSet
   *          the result set
   * @param propertyName
   *          the name of the numeric property
   *
   * @return the value, or {@code 0} if there were no rows
   */
  public static long getCount(OResultSet resultSet, String propertyName) {
    try {
      if (resultSet.hasNext()) {
        Number count = resultSet.next().getProperty(propertyName);
        if (count != null) {
          return count.longValue();
        }
      }
      return 0;
    } finally {
      resultSet.close();
    }
  }

  /**
   * Get the number of records changed by an UPDATE or DELETE statement.
   *
   * @param resultSet
   *          the result of the statement
   *
   * @return the number of changed records
   */
  public static long getChangedCount(OResultSet resultSet) {
    return getCount(resultSet, COUNT_PROPERTY);
  }

  /**
   * Get a boolean value from a document, using a default value if it doesn't
   * exist.
   *
   * @param document
   *          the document to get the field from
   * @param fieldName
   *          the name of the field
   * @param defaultValue
   *          the default vale if the field is not in the document
   *
   * @return the boolean value
   */
  public static boolean getBooleanField(ODocument document, String fieldName,
      boolean defaultValue) {
    Object value = document.field(fieldName);
    if (value instanceof Boolean) {
      return (Boolean) value;
    } else if (value instanceof String) {
      return Boolean.parseBoolean((String) value);
    } else {
      return defaultValue;
    }
  }

  public static Integer getIntegerField(ODocument document, String fieldName) {
    Number value = document.field(fieldName);
    return value != null ? value.intValue() : null;
  }

  public static Long getLongField(ODocument document, String fieldName) {
    Number value = document.field(fieldName);
    return value != null ? value.longValue() : null;
  }

  /**
   * Remove every field from a document so it can be refilled.
   *
   * @param document
   *          the document to clear
   */
  public static void clearFields(ODocument document) {
    Collection<String> names = new ArrayList<>();
    for (String name : document.fieldNames()) {
      names.add(name);
    }
    for (String name : names) {
      document.removeField(name);
    }
  }
}
