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

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Definition of a durable, limits-retained broker stream.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public final class StreamSpec {

    private final String name;
    private final List<String> subjects;
    private final long maxBytes;
    private final Duration maxAge;

    public StreamSpec(String name, List<String> subjects, long maxBytes, Duration maxAge) {
        this.name = Objects.requireNonNull(name, "name");
        this.subjects = List.copyOf(subjects);
        this.maxBytes = maxBytes;
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
    }

    /**
     * @return true if any of this stream's subject patterns captures the subject
     */
    public boolean captures(String subject) {
        for (String pattern : subjects) {
            if (Subjects.matches(pattern, subject)) {
                return true;
            }
        }
        return false;
    }

    public String getName() {
        return name;
    }

    public List<String> getSubjects() {
        return subjects;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamSpec that = (StreamSpec) o;
        return maxBytes == that.maxBytes && name.equals(that.name)
                && subjects.equals(that.subjects) && maxAge.equals(that.maxAge);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, subjects, maxBytes, maxAge);
    }

    @Override
    public String toString() {
        return "StreamSpec{name='" + name + "', subjects=" + subjects + ", maxBytes=" + maxBytes
                + ", maxAge=" + maxAge + "}";
    }
}
