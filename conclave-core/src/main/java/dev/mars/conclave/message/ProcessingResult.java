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

import java.util.List;

/**
 * Outcome of {@link MessageHandler#process(AgentMessage)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public final class ProcessingResult {

    public enum Status {
        /** Valid and dispatched to at least one registered processor. */
        PROCESSED,
        /** Valid, but no processor was registered so the fallback ran. */
        FALLBACK,
        /** Failed validation; nothing was recorded or dispatched. */
        REJECTED
    }

    private final String messageId;
    private final Status status;
    private final List<String> errors;
    private final int failedProcessors;

    private ProcessingResult(String messageId, Status status, List<String> errors, int failedProcessors) {
        this.messageId = messageId;
        this.status = status;
        this.errors = List.copyOf(errors);
        this.failedProcessors = failedProcessors;
    }

    static ProcessingResult processed(String messageId, int failedProcessors) {
        return new ProcessingResult(messageId, Status.PROCESSED, List.of(), failedProcessors);
    }

    static ProcessingResult fallback(String messageId) {
        return new ProcessingResult(messageId, Status.FALLBACK, List.of(), 0);
    }

    static ProcessingResult rejected(String messageId, List<String> errors) {
        return new ProcessingResult(messageId, Status.REJECTED, errors, 0);
    }

    public boolean isAccepted() {
        return status != Status.REJECTED;
    }

    public boolean isDuplicate() {
        return errors.stream().anyMatch(e -> e.startsWith(MessageHandler.DUPLICATE_PREFIX));
    }

    public String getMessageId() {
        return messageId;
    }

    public Status getStatus() {
        return status;
    }

    public List<String> getErrors() {
        return errors;
    }

    public int getFailedProcessors() {
        return failedProcessors;
    }

    @Override
    public String toString() {
        return "ProcessingResult{messageId='" + messageId + "', status=" + status
                + ", errors=" + errors + ", failedProcessors=" + failedProcessors + "}";
    }
}
