package me.golemcore.memory.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */
/**
 * A required identifier or argument is missing or out of range. Always raised
 * before any store access.
 */
public class MemoryValidationException extends MemoryException {

    public MemoryValidationException(String message) {
        super(message);
    }

    public static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new MemoryValidationException(name + " is required");
        }
    }
}
