/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import static java.util.Objects.requireNonNull;

import io.tagstats.api.stats.Measure;
import io.tagstats.api.tag.TagMap;
import io.tagstats.sdk.internal.ThrottlingLogger;
import io.tagstats.sdk.stats.internal.state.ViewStorage;
import io.tagstats.sdk.stats.internal.view.ViewCanonicalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Table of registered {@link View}s. Routes every recorded measurement to the views of its
 * measure and hands out snapshots of their rows.
 *
 * <p>Registration and unregistration are exclusive; recording and snapshotting run concurrently
 * with each other. Snapshots hold the registry lock only while copying the list of views, so a
 * scrape never holds up producers behind a pending registration. Rows are created on the first
 * measurement of each tag combination.
 *
 * <p>Applications normally share {@link #getDefault()}; separate instances from {@link #create()}
 * keep independent sets of views, for example in tests.
 */
@ThreadSafe
public final class ViewManager implements ViewDataProducer {

  private static final Logger logger = Logger.getLogger(ViewManager.class.getName());

  private static final ViewManager DEFAULT = new ViewManager();

  private final ThrottlingLogger throttlingLogger = new ThrottlingLogger(logger);
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @GuardedBy("lock")
  private final Map<String, ViewStorage> storagesByName = new LinkedHashMap<>();

  @GuardedBy("lock")
  private final Map<Measure, List<ViewStorage>> storagesByMeasure = new HashMap<>();

  private ViewManager() {}

  /** Returns a new, empty {@code ViewManager}. */
  public static ViewManager create() {
    return new ViewManager();
  }

  /** Returns the process-wide default {@code ViewManager}. */
  public static ViewManager getDefault() {
    return DEFAULT;
  }

  /**
   * Registers {@code views} in their canonical form. Views start receiving measurements recorded
   * after this call returns. Registering a view equivalent to one already registered under the
   * same name has no effect.
   *
   * <p>Either every view is registered or, when this throws, none is.
   *
   * @throws NegativeBucketBoundsException if a distribution has a negative bucket boundary.
   * @throws ViewRegistrationException if a view is invalid or its name is already bound to a
   *     view that aggregates differently.
   */
  public void register(View... views) {
    List<View> canonicalViews = new ArrayList<>(views.length);
    for (View view : views) {
      canonicalViews.add(ViewCanonicalizer.canonicalize(requireNonNull(view, "view")));
    }
    lock.writeLock().lock();
    try {
      Map<String, View> toInstall = new LinkedHashMap<>();
      for (View view : canonicalViews) {
        ViewStorage registered = storagesByName.get(view.getName());
        View existing = registered != null ? registered.getView() : toInstall.get(view.getName());
        if (existing != null) {
          if (!ViewCanonicalizer.isSameShape(existing, view)) {
            throw new ViewRegistrationException(
                "cannot register view \"" + view.getName()
                    + "\"; a different view with the same name is already registered");
          }
          continue;
        }
        toInstall.put(view.getName(), view);
      }
      for (View view : toInstall.values()) {
        ViewStorage storage = new ViewStorage(view);
        storagesByName.put(view.getName(), storage);
        storagesByMeasure.computeIfAbsent(view.getMeasure(), unused -> new ArrayList<>())
            .add(storage);
        logger.log(Level.FINE, "Registered view {0}", view);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Unregisters the views registered under the names of {@code views} and discards their rows.
   * Names that are not registered are ignored.
   */
  public void unregister(View... views) {
    lock.writeLock().lock();
    try {
      for (View view : views) {
        ViewStorage storage = storagesByName.remove(registeredName(view));
        if (storage == null) {
          continue;
        }
        List<ViewStorage> forMeasure = storagesByMeasure.get(storage.getView().getMeasure());
        if (forMeasure != null) {
          forMeasure.remove(storage);
          if (forMeasure.isEmpty()) {
            storagesByMeasure.remove(storage.getView().getMeasure());
          }
        }
        storage.clear();
        logger.log(Level.FINE, "Unregistered view {0}", storage.getView().getName());
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  // Views registered without a name are registered under their measure's name.
  private static String registeredName(View view) {
    return view.getName().isEmpty() ? view.getMeasure().getName() : view.getName();
  }

  /** Returns the canonical form of the view registered under {@code name}. */
  public Optional<View> find(String name) {
    lock.readLock().lock();
    try {
      ViewStorage storage = storagesByName.get(name);
      return storage == null ? Optional.empty() : Optional.of(storage.getView());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns the canonical forms of all registered views, in registration order. */
  public List<View> getRegisteredViews() {
    lock.readLock().lock();
    try {
      List<View> views = new ArrayList<>(storagesByName.size());
      for (ViewStorage storage : storagesByName.values()) {
        views.add(storage.getView());
      }
      return Collections.unmodifiableList(views);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Folds a measurement into every registered view of {@code measure}. Never throws: invalid
   * input is logged and dropped.
   *
   * @param attachments attached to the exemplar of distribution buckets.
   */
  public void record(
      @Nullable TagMap tags,
      @Nullable Measure measure,
      double value,
      @Nullable Map<String, String> attachments,
      long epochNanos) {
    if (tags == null || measure == null) {
      throttlingLogger.log(Level.WARNING, "Dropping measurement without tags or measure.");
      return;
    }
    if (Double.isNaN(value)) {
      throttlingLogger.log(
          Level.FINE,
          "Measure " + measure.getName() + " has recorded a NaN value with tags " + tags
              + ". Dropping measurement.");
      return;
    }
    Map<String, String> safeAttachments =
        attachments == null ? Collections.emptyMap() : attachments;
    lock.readLock().lock();
    try {
      List<ViewStorage> storages = storagesByMeasure.get(measure);
      if (storages == null) {
        return;
      }
      for (ViewStorage storage : storages) {
        storage.record(tags, value, safeAttachments, epochNanos);
      }
    } catch (RuntimeException e) {
      throttlingLogger.log(
          Level.WARNING, "Failed to record measurement of " + measure.getName() + ".", e);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns a snapshot of the rows of the view registered under {@code name}, empty if there is
   * no such view.
   */
  public List<Row> collectRows(String name) {
    ViewStorage storage = getStorage(name);
    return storage == null ? Collections.emptyList() : storage.collect();
  }

  /**
   * Returns a snapshot of the rows of the view registered under {@code name}.
   *
   * @throws IllegalArgumentException if no view is registered under {@code name}.
   */
  public List<Row> retrieveData(String name) {
    ViewStorage storage = getStorage(name);
    if (storage == null) {
      throw new IllegalArgumentException(
          "cannot retrieve data; view \"" + name + "\" is not registered");
    }
    return storage.collect();
  }

  /** Discards the rows of the view registered under {@code name}, keeping it registered. */
  public void clearRows(String name) {
    ViewStorage storage = getStorage(name);
    if (storage != null) {
      storage.clear();
    }
  }

  @Override
  public List<ViewData> collectAll() {
    List<ViewStorage> storages;
    lock.readLock().lock();
    try {
      storages = new ArrayList<>(storagesByName.values());
    } finally {
      lock.readLock().unlock();
    }
    // Rows are cloned outside the registry lock.
    List<ViewData> result = new ArrayList<>(storages.size());
    for (ViewStorage storage : storages) {
      result.add(ViewData.create(storage.getView(), storage.collect()));
    }
    return result;
  }

  @Nullable
  private ViewStorage getStorage(String name) {
    lock.readLock().lock();
    try {
      return storagesByName.get(name);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public String toString() {
    return "ViewManager{views=" + getRegisteredViews() + "}";
  }
}
