package io.nosqlbench.fabric;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.fabric.scale.ComponentMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/// Collaborating systems registered with a fabric, each with its own
/// integration settings.
///
/// Settings are JSON-compatible maps held as [ComponentMetadata], so they
/// follow the same value rules and survive save and load unchanged.
/// Registration order is kept; registering a name again replaces its
/// settings in place.
public final class IntegrationRegistry {

    private final Map<String, ComponentMetadata> integrations = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /// Registers or replaces a collaborator's settings.
    ///
    /// @param name collaborator name, not blank
    /// @param settings JSON-compatible settings, may be null for none
    /// @return the stored settings
    /// @throws IllegalArgumentException if the name is blank or a value is
    ///     not JSON-compatible
    public ComponentMetadata register(String name, Map<String, ?> settings) {
        requireName(name);
        ComponentMetadata stored = ComponentMetadata.of(settings);
        lock.writeLock().lock();
        try {
            integrations.put(name, stored);
        } finally {
            lock.writeLock().unlock();
        }
        return stored;
    }

    /// Registered names in registration order.
    public List<String> names() {
        lock.readLock().lock();
        try {
            return List.copyOf(integrations.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Copy of every registration, in registration order.
    public Map<String, ComponentMetadata> copyAll() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(integrations));
        } finally {
            lock.readLock().unlock();
        }
    }

    /// Replaces every registration at once. Names are checked before
    /// anything is written.
    public void replaceAll(Map<String, ComponentMetadata> replacement) {
        Map<String, ComponentMetadata> next = new LinkedHashMap<>();
        for (Map.Entry<String, ComponentMetadata> entry : replacement.entrySet()) {
            requireName(entry.getKey());
            next.put(entry.getKey(), Objects.requireNonNull(entry.getValue(), "settings cannot be null"));
        }
        lock.writeLock().lock();
        try {
            integrations.clear();
            integrations.putAll(next);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("integration name cannot be blank");
        }
    }

    @Override
    public String toString() {
        return "IntegrationRegistry" + names();
    }
}
