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

package dev.mars.conclave.core.exceptions;

/**
 * Thrown when the message broker is unreachable or a broker operation cannot complete.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ConnectionException extends ConclaveException {

    private final int attempts;

    public ConnectionException(String message) {
        this(message, 1, null);
    }

    public ConnectionException(String message, Throwable cause) {
        this(message, 1, cause);
    }

    public ConnectionException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Number of connection attempts made before this exception was raised.
     */
    public int getAttempts() {
        return attempts;
    }
}
