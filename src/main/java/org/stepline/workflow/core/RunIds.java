/*
 * Copyright 2025 Firefly Software Solutions Inc
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

package org.stepline.workflow.core;

import java.security.SecureRandom;

/**
 * Generates run identifiers: a prefix followed by 8 random lowercase alphanumerics.
 */
public final class RunIds {

    public static final String DEFAULT_PREFIX = "run_";

    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final int LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private RunIds() {
    }

    public static String generate() {
        return generate(DEFAULT_PREFIX);
    }

    public static String generate(String prefix) {
        StringBuilder id = new StringBuilder(prefix != null ? prefix : DEFAULT_PREFIX);
        for (int i = 0; i < LENGTH; i++) {
            id.append(ALPHABET[RANDOM.nextInt(ALPHABET.length)]);
        }
        return id.toString();
    }
}
