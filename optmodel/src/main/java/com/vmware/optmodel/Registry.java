/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel;

import com.google.common.annotations.VisibleForTesting;
import com.vmware.optmodel.container.Container;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the mutable state shared by every object of one model-building session: the creation-order
 * counter, the name registry, the stack of active containers and the rendering options.
 *
 * A registry is bound to the calling thread. Objects pick up {@link #current()} when they are created, so
 * a harness that needs independent sessions either calls {@link #reset()} between them or binds a fresh
 * registry with {@link #use(Registry)}. A registry must not be shared by concurrently running threads.
 */
public final class Registry {
    private static final Logger LOG = LoggerFactory.getLogger(Registry.class);
    private static final Registry DEFAULT = new Registry();
    private static final ThreadLocal<Registry> CURRENT = ThreadLocal.withInitial(() -> DEFAULT);
    private static final String GENERATED_PREFIX = "o";
    private static final String TEMPORARY_PREFIX = "TEMP";

    private final Map<String, Object> names = new HashMap<>();
    private final Deque<Container> containers = new ArrayDeque<>();
    private final Config config = new Config();
    private int order = 0;
    private int temporaries = 0;

    public static Registry current() {
        return CURRENT.get();
    }

    /**
     * Binds a registry to the calling thread until the returned scope is closed
     *
     * @param registry the registry to use
     * @return a scope restoring the previously bound registry
     */
    public static Scope use(final Registry registry) {
        final Registry previous = CURRENT.get();
        CURRENT.set(registry);
        return new Scope(previous);
    }

    public int nextOrder() {
        order += 1;
        return order;
    }

    public String nextName() {
        return GENERATED_PREFIX + nextOrder();
    }

    public String nextTemporaryName() {
        temporaries += 1;
        return TEMPORARY_PREFIX + temporaries;
    }

    /**
     * Records a name and returns the creation order assigned to its owner
     */
    public int register(final String name, final Object owner) {
        names.put(name, owner);
        return nextOrder();
    }

    public void unregister(final String name) {
        names.remove(name);
    }

    @Nullable
    public Object lookup(final String name) {
        return names.get(name);
    }

    public boolean contains(final String name) {
        return names.containsKey(name);
    }

    /**
     * Returns a name that is not registered yet. A missing name is generated. A name that is already taken
     * is suffixed with the first free counter and the rename is logged.
     *
     * @param requested the name the caller asked for, may be null
     * @return a name that can be registered without a collision
     */
    public String assignName(@Nullable final String requested) {
        if (requested == null || requested.isEmpty()) {
            String generated = nextName();
            while (names.containsKey(generated)) {
                generated = nextName();
            }
            return generated;
        }
        final String name = requested.replace(' ', '_');
        if (!names.containsKey(name)) {
            return name;
        }
        int suffix = 1;
        while (names.containsKey(name + "_" + suffix)) {
            suffix++;
        }
        final String renamed = name + "_" + suffix;
        LOG.warn("Name {} is changed to {} to prevent a conflict", name, renamed);
        return renamed;
    }

    public Config config() {
        return config;
    }

    public Optional<Container> activeContainer() {
        return Optional.ofNullable(containers.peek());
    }

    public void pushContainer(final Container container) {
        containers.push(container);
    }

    /**
     * Removes the innermost container, which must be {@code expected}.
     */
    public void popContainer(final Container expected) {
        final Container top = containers.peek();
        if (top != expected) {
            throw new ModelException("Container " + expected + " is not the innermost active container");
        }
        containers.pop();
    }

    @VisibleForTesting
    int size() {
        return names.size();
    }

    /**
     * Forgets every registered name, rewinds the counters, leaves every container and restores the default
     * options
     */
    public void reset() {
        names.clear();
        containers.clear();
        config.reset();
        order = 0;
        temporaries = 0;
    }

    /**
     * Restores the registry that was bound before {@link #use(Registry)}
     */
    public static final class Scope implements AutoCloseable {
        private final Registry previous;

        private Scope(final Registry previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            CURRENT.set(previous);
        }
    }
}
