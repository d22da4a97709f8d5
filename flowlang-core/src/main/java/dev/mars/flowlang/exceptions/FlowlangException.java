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

package dev.mars.flowlang.exceptions;

/**
 * Base exception class for all flow language tooling exceptions.
 * Problems found inside a well-formed document are reported as diagnostics,
 * not exceptions; this hierarchy covers failures to obtain a document at all.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class FlowlangException extends Exception {

    public FlowlangException(String message) {
        super(message);
    }

    public FlowlangException(String message, Throwable cause) {
        super(message, cause);
    }

    public FlowlangException(Throwable cause) {
        super(cause);
    }
}
