/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.conclave.coordination.registry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Liveness of a peer as seen by the local registry.
 *
 * <pre>
 *   UNKNOWN → ONLINE             (registration)
 *   ONLINE  → ONLINE, OFFLINE    (heartbeat, window elapsed)
 *   OFFLINE → ONLINE             (heartbeat)
 *   ONLINE, OFFLINE → UNKNOWN    (unregistration)
 * </pre>
 *
 * <p>ONLINE to OFFLINE is never applied by a timer. The registry derives it from the time of the
 * last heartbeat whenever the state is queried.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public enum LivenessState {

    /** Never registered, or unregistered since. */
    UNKNOWN("unknown"),

    /** Registered, with a heartbeat inside the liveness window. */
    ONLINE("online"),

    /** Registered, but silent for longer than the liveness window. */
    OFFLINE("offline");

    private static final Map<LivenessState, Set<LivenessState>> TRANSITIONS;

    static {
        var map = new EnumMap<LivenessState, Set<LivenessState>>(LivenessState.class);
        map.put(UNKNOWN, EnumSet.of(ONLINE));
        map.put(ONLINE, EnumSet.of(ONLINE, OFFLINE, UNKNOWN));
        map.put(OFFLINE, EnumSet.of(ONLINE, UNKNOWN));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    LivenessState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(LivenessState target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<LivenessState> getValidTransitions() {
        return TRANSITIONS.get(this);
    }
}
