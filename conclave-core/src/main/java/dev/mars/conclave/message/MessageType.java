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
 * Kinds of message exchanged between agents.
 *
 * <p>{@link #UNRECOGNIZED} is never sent. It stands for a wire value this build does not know
 * and is always routed to the fallback handler.</p>
 */
public enum MessageType {
    TEXT("text"),
    TASK("task"),
    RESPONSE("response"),
    STATUS("status"),
    ERROR("error"),
    DISCOVERY("discovery"),
    HEARTBEAT("heartbeat"),
    UNRECOGNIZED("unrecognized");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isRecognized() {
        return this != UNRECOGNIZED;
    }

    /**
     * Maps a wire value to a type, returning {@link #UNRECOGNIZED} for anything unknown.
     */
    public static MessageType fromValue(String value) {
        if (value != null) {
            for (MessageType type : values()) {
                if (type != UNRECOGNIZED && type.value.equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        return UNRECOGNIZED;
    }
}
