/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.qirt.exceptions;

/**
 * Base class for the errors raised by QIRT. All of them are deterministic input-validation
 * failures, so none are worth retrying.
 */
public abstract class QirtException extends RuntimeException {
    protected QirtException(String message) {
        super(message);
    }

    protected QirtException(String message, Throwable cause) {
        super(message, cause);
    }
}
