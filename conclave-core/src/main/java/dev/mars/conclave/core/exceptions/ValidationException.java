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

import java.util.List;

/**
 * Thrown when a message fails validation. Carries every validation error found,
 * not only the first.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ValidationException extends ConclaveException {

    private final String messageId;
    private final List<String> errors;

    public ValidationException(String messageId, List<String> errors) {
        super(String.format("Message %s rejected: %s", messageId, String.join("; ", errors)));
        this.messageId = messageId;
        this.errors = List.copyOf(errors);
    }

    public String getMessageId() {
        return messageId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
