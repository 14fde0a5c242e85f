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

package org.stepline.workflow.step;

/**
 * How a concurrent group reacts to a failing branch.
 */
public enum FailureStrategy {

    /**
     * The first failure fails the group and cancels in-flight siblings.
     */
    FAIL_FAST,

    /**
     * Every branch runs to completion; the group then fails listing all failed branches.
     */
    WAIT_ALL
}
