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

package dev.mars.conclave.event;

import dev.mars.conclave.message.MessageType;

/**
 * System event types. The wire value doubles as the last token of the {@code events.<type>} subject.
 */
public enum EventType {
    AGENT_REGISTERED("agent_registered"),
    AGENT_UNREGISTERED("agent_unregistered"),
    AGENT_STATUS_UPDATED("agent_status_updated"),
    TASK_CREATED("task_created"),
    TASK_ASSIGNED("task_assigned"),
    TASK_COMPLETED("task_completed"),
    TASK_FAILED("task_failed"),
    MESSAGE_RECEIVED("message_received"),
    SYSTEM_READY("system_ready"),
    SYSTEM_SHUTDOWN("system_shutdown"),
    ERROR_OCCURRED("error_occurred"),
    RESOURCE_LOW("resource_low"),
    UNRECOGNIZED("unrecognized");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EventType fromValue(String value) {
        if (value != null) {
            for (EventType type : values()) {
                if (type != UNRECOGNIZED && type.value.equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        return UNRECOGNIZED;
    }

    /**
     * The event raised locally when a message of the given type arrives.
     */
    public static EventType forMessageType(MessageType type) {
        switch (type) {
            case TASK:
                return TASK_CREATED;
            case RESPONSE:
                return TASK_COMPLETED;
            case STATUS:
                return AGENT_STATUS_UPDATED;
            case ERROR:
                return ERROR_OCCURRED;
            default:
                return MESSAGE_RECEIVED;
        }
    }
}
