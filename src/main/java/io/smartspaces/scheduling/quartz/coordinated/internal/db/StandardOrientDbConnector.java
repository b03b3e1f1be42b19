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

import java.util.concurrent.locks.ReentrantLock;

import org.quartz.JobPersistenceException;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.SchedulerConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.orientechnologies.orient.core.config.OGlobalConfiguration;
import com.orientechnologies.orient.core.db.ODatabasePool;
import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.db.ODatabaseType;
import com.orientechnologies.orient.core.db.OrientDB;
import com.orientechnologies.orient.core.db.OrientDBConfig;
import com.orientechnologies.orient.core.storage.ORecordDuplicatedException;

/**
 * The responsibility of this class is create an OrientDB connection with given
 * parameters and to run store operations against it.
 *
 * <p>
 * Operations are serialized by a single {@link ReentrantLock}. The lock only
 * covers this process. Each operation borrows one pooled session for its whole
 * duration, and operations nested inside another operation in the same thread
 * share the outer session.
 */
public class StandardOrientDbConnector implements OrientDbConnector {

  private static final Logger LOG = LoggerFactory.getLogger(StandardOrientDbConnector.class);

  /**
   * The prefix of URIs for databases kept in memory.
   */
  public static final String MEMORY_URI_PREFIX = "memory:";

  /**
   * The prefix of URIs for databases on an OrientDB server.
   */
  public static final String REMOTE_URI_PREFIX = "remote:";

  public static OrientDbConnectorBuilder builder() {
    return new OrientDbConnectorBuilder();
  }

  /**
   * The OrientDB context.
   */
  private OrientDB orientDb;

  /**
   * {@code true} if the context was created by this connector and must be
   * closed with it.
   */
  private boolean ownsOrientDb;

  /**
   * The pool of database connections.
   */
  private ODatabasePool pool;

  /**
   * The lock that serializes all store operations in this process.
   */
  private final ReentrantLock storeLock = new ReentrantLock();

  /**
   * The session of the operation running in a thread.
   */
  private final ThreadLocal<ODatabaseSession> currentSession = new ThreadLocal<>();

  /**
   * Construct a new connector.
   *
   * <p>
   * The builder must be used.
   */
  private StandardOrientDbConnector() {
    // use the builder
  }

  @Override
  public void shutdown() {
    storeLock.lock();
    try {
      pool.close();
      if (ownsOrientDb) {
        orientDb.close();
      }
    } finally {
      storeLock.unlock();
    }
  }

  @Override
  public ODatabaseSession getConnection() {
    ODatabaseSession session = currentSession.get();
    if (session == null) {
      throw new IllegalStateException("No job store operation is running in this thread");
    }

    session.activateOnCurrentThread();

    return session;
  }

  @Override
  public <T> T doInLock(StoreMethod<T> method) throws JobPersistenceException {
    return run(method, false);
  }

  @Override
  public <T> T doInTransaction(StoreMethod<T> method) throws JobPersistenceException {
    return run(method, true);
  }

  private <T> T run(StoreMethod<T> method, boolean transactional)
      throws JobPersistenceException {
    storeLock.lock();
    ODatabaseSession outerSession = currentSession.get();
    ODatabaseSession session = null;
    try {
      if (outerSession != null) {
        session = outerSession;
        session.activateOnCurrentThread();
      } else {
        session = pool.acquire();
        session.getLocalCache().clear();
        currentSession.set(session);
      }

      if (transactional) {
        return runInTransaction(session, method);
      } else {
        return method.doInStore();
      }
    } catch (ORecordDuplicatedException e) {
      throw new ObjectAlreadyExistsException(e.getMessage());
    } catch (RuntimeException e) {
      throw new JobPersistenceException("Job store operation failed", e);
    } finally {
      if (outerSession == null && session != null) {
        currentSession.remove();
        session.close();
      }
      storeLock.unlock();
    }
  }

  private <T> T runInTransaction(ODatabaseSession session, StoreMethod<T> method)
      throws JobPersistenceException {
    session.begin();
    try {
      T result = method.doInStore();

      session.commit();

      return result;
    } catch (JobPersistenceException | RuntimeException e) {
      rollback(session);

      throw e;
    }
  }

  private void rollback(ODatabaseSession session) {
    if (session.getTransaction().isActive()) {
      LOG.debug("Rolling back job store transaction");
      session.rollback();
    }
  }

  /**
   * A builder for connectors.
   */
  public static class OrientDbConnectorBuilder {
    private String orientDbUri;
    private String username = "admin";
    private String password = "admin";
    private String dbName;
    private ODatabaseType databaseType;
    private OrientDB orientDb;
    private CollectionNames collectionNames = new CollectionNames(null);

    public StandardOrientDbConnector build() throws SchedulerConfigException {
      if (dbName == null) {
        throw new SchedulerConfigException("An OrientDB database name must be specified.");
      }

      StandardOrientDbConnector connector = new StandardOrientDbConnector();
      if (orientDb != null) {
        if (orientDbUri != null) {
          throw new SchedulerConfigException(
              "Configure either an OrientDB instance or an OrientDB URI, not both.");
        }
        connector.orientDb = orientDb;
        connector.ownsOrientDb = false;
      } else {
        connector.orientDb = connectToOrientDb();
        connector.ownsOrientDb = true;
      }

      try {
        ODatabaseType type = getDatabaseType();
        if (connector.orientDb.createIfNotExists(dbName, type, createDatabaseConfig())) {
          LOG.info("Created {} OrientDB database {}", type, dbName);
        }

        connector.pool = new ODatabasePool(connector.orientDb, dbName, username, password);

        createSchema(connector.pool);
      } catch (RuntimeException e) {
        if (connector.ownsOrientDb) {
          connector.orientDb.close();
        }
        throw new SchedulerConfigException("OrientDB driver thrown an exception", e);
      }

      return connector;
    }

    public OrientDbConnectorBuilder withUri(String orientDbUri) {
      this.orientDbUri = orientDbUri;
      return this;
    }

    public OrientDbConnectorBuilder withCredentials(String username, String password) {
      this.username = username;
      this.password = password;
      return this;
    }

    public OrientDbConnectorBuilder withDatabaseName(String dbName) {
      this.dbName = dbName;
      return this;
    }

    /**
     * Set the type of the database if it has to be created.
     *
     * @param databaseType
     *          the type, {@code null} to derive it from the URI
     *
     * @return this builder
     */
    public OrientDbConnectorBuilder withDatabaseType(ODatabaseType databaseType) {
      this.databaseType = databaseType;
      return this;
    }

    /**
     * Use an OrientDB context that is owned by someone else.
     *
     * <p>
     * The context will not be closed when the connector shuts down.
     *
     * @param orientDb
     *          the context
     *
     * @return this builder
     */
    public OrientDbConnectorBuilder withOrientDb(OrientDB orientDb) {
      this.orientDb = orientDb;
      return this;
    }

    public OrientDbConnectorBuilder withCollectionNames(CollectionNames collectionNames) {
      this.collectionNames = collectionNames;
      return this;
    }

    private OrientDB connectToOrientDb() throws SchedulerConfigException {
      if (orientDbUri == null) {
        throw new SchedulerConfigException(
            "An OrientDB URI or an OrientDB instance must be specified.");
      }

      try {
        if (orientDbUri.startsWith(REMOTE_URI_PREFIX)) {
          return new OrientDB(orientDbUri, username, password, OrientDBConfig.defaultConfig());
        } else {
          return new OrientDB(orientDbUri, OrientDBConfig.defaultConfig());
        }
      } catch (RuntimeException e) {
        throw new SchedulerConfigException("Could not connect to OrientDB at " + orientDbUri, e);
      }
    }

    private ODatabaseType getDatabaseType() {
      if (databaseType != null) {
        return databaseType;
      }

      if (orientDbUri != null && orientDbUri.startsWith(MEMORY_URI_PREFIX)) {
        return ODatabaseType.MEMORY;
      } else {
        return ODatabaseType.PLOCAL;
      }
    }

    private OrientDBConfig createDatabaseConfig() {
      return OrientDBConfig.builder().addConfig(OGlobalConfiguration.CREATE_DEFAULT_USERS, true)
          .build();
    }

    private void createSchema(ODatabasePool pool) {
      ODatabaseSession session = pool.acquire();
      try {
        new OrientDbSchema(collectionNames).ensureSchema(session);
      } finally {
        session.close();
      }
    }
  }
}
