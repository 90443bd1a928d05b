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
 * Thrown when a delivered message could not be handled. The broker is asked to
 * redeliver the message until its maximum delivery count is reached.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class DeliveryException extends ConclaveException {

    private final String subject;

    public DeliveryException(String subject, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }

    @Override
    public String getMessage() {
        return String.format("Delivery on %s failed: %s", subject, super.getMessage());
    }
}
