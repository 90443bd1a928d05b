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

package dev.mars.conclave.message;

/**
 * Delivery priority carried on every message.
 */
public enum MessagePriority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    MessagePriority(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the matching priority, or {@code null} if the value is unknown
     */
    public static MessagePriority fromValue(String value) {
        if (value != null) {
            for (MessagePriority priority : values()) {
                if (priority.value.equalsIgnoreCase(value)) {
                    return priority;
                }
            }
        }
        return null;
    }
}
