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

package dev.mars.conclave.coordination.topology;

import java.util.regex.Pattern;

/**
 * Subject names used on the broker and the rules for the tokens embedded in them.
 *
 * <p>Agent ids become single subject tokens ({@code messages.<sender>.<receiver>},
 * {@code tasks.<agentId>}) so they may not contain separators, wildcards or whitespace.
 * {@code available} is reserved for the shared work queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class Subjects {

    public static final String AGENTS_REGISTER = "agents.register";
    public static final String AGENTS_HEARTBEAT = "agents.heartbeat";
    public static final String AGENTS_UNREGISTER = "agents.unregister";
    public static final String AGENTS_UPDATES = "agents.updates";
    public static final String TASKS_AVAILABLE = "tasks.available";

    static final String RESERVED_AGENT_ID = "available";

    private static final Pattern INVALID_TOKEN = Pattern.compile("[.*>\\s]");
    private static final Pattern INVALID_EVENT_TYPE = Pattern.compile("[*>\\s]");

    private Subjects() {
    }

    public static String message(String senderId, String receiverId) {
        return "messages." + requireAgentId(senderId) + "." + requireAgentId(receiverId);
    }

    /**
     * Filter matching every message addressed to the agent, from any sender.
     */
    public static String inbox(String receiverId) {
        return "messages.*." + requireAgentId(receiverId);
    }

    public static String task(String agentId) {
        return "tasks." + requireAgentId(agentId);
    }

    public static String event(String eventType) {
        if (eventType == null || eventType.isEmpty() || INVALID_EVENT_TYPE.matcher(eventType).find()
                || eventType.startsWith(".") || eventType.endsWith(".") || eventType.contains("..")) {
            throw new IllegalArgumentException("Invalid event type: '" + eventType + "'");
        }
        return "events." + eventType;
    }

    /**
     * @throws IllegalArgumentException if the id cannot be used as a subject token
     */
    public static String requireAgentId(String agentId) {
        if (!isValidAgentId(agentId)) {
            throw new IllegalArgumentException("Invalid agent id: '" + agentId + "'");
        }
        return agentId;
    }

    public static boolean isValidAgentId(String agentId) {
        return agentId != null && !agentId.isEmpty()
                && !INVALID_TOKEN.matcher(agentId).find()
                && !RESERVED_AGENT_ID.equals(agentId);
    }

    /**
     * Matches a concrete subject against a pattern where {@code *} stands for exactly one token
     * and a trailing {@code >} for one or more tokens.
     */
    public static boolean matches(String pattern, String subject) {
        String[] p = pattern.split("\\.", -1);
        String[] s = subject.split("\\.", -1);
        for (int i = 0; i < p.length; i++) {
            if (p[i].equals(">")) {
                return i == p.length - 1 && s.length > i;
            }
            if (i >= s.length) {
                return false;
            }
            if (!p[i].equals("*") && !p[i].equals(s[i])) {
                return false;
            }
        }
        return p.length == s.length;
    }
}
