/*
 * Copyright (C) 2016 Keith M. Hughes
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

package io.smartspaces.scheduling.quartz.coordinated.internal.db;

import org.quartz.JobPersistenceException;

import com.orientechnologies.orient.core.db.ODatabaseSession;

/**
 * The connector to the OrientDB database.
 *
 * <p>
 * All work against the database goes through one of the {@code doIn} methods.
 * They hold a lock that serializes every operation of the job store inside one
 * process. Scheduler instances in other processes are not affected by the
 * lock; they are coordinated through conditional updates in the database.
 *
 * @author Keith M. Hughes
 */
public interface OrientDbConnector {

  /**
   * Shut the connector down.
   */
  void shutdown();

  /**
   * Get the database session of the operation running in the current thread.
   *
   * @return the session
   *
   * @throws IllegalStateException
   *           the current thread is not running an operation
   */
  ODatabaseSession getConnection();

  /**
   * Run a method under the store lock.
   *
   * <p>
   * No transaction is started, every statement is committed on its own.
   *
   * @param method
   *          the method to run
   *
   * @return the result of the method
   *
   * @throws JobPersistenceException
   *           something bad happened
   */
  <T> T doInLock(StoreMethod<T> method) throws JobPersistenceException;

  /**
   * Run a method under the store lock inside a database transaction.
   *
   * <p>
   * The transaction is rolled back if the method throws.
   *
   * @param method
   *          the method to run in the transaction
   *
   * @return the result of the method
   *
   * @throws JobPersistenceException
   *           something bad happened
   */
  <T> T doInTransaction(StoreMethod<T> method) throws JobPersistenceException;

  /**
   * A unit of work against the store.
   *
   * @param <T>
   *          the type of the result
   */
  public interface StoreMethod<T> {
    T doInStore() throws JobPersistenceException;
  }
}
