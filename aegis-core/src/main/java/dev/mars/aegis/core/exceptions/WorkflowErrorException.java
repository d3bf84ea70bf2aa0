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

package dev.mars.aegis.core.exceptions;

import java.util.Objects;

/**
 * An error raised while a state is being processed that carries an error identifier.
 *
 * <p>The identifier ({@code States.Timeout}, {@code Notification.Unavailable}, ...) is what
 * {@code Retry} and {@code Catch} matchers are compared against. The detail is the
 * human-readable cause that ends up in the payload when the error is caught and on the
 * execution record when it is not.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public abstract class WorkflowErrorException extends AegisException {

    private final String errorName;
    private final String detail;

    protected WorkflowErrorException(String errorName, String detail) {
        super(detail);
        this.errorName = requireErrorName(errorName);
        this.detail = detail != null ? detail : "";
    }

    protected WorkflowErrorException(String errorName, String detail, Throwable cause) {
        super(detail, cause);
        this.errorName = requireErrorName(errorName);
        this.detail = detail != null ? detail : "";
    }

    /**
     * Returns the identifier used for matcher comparisons.
     */
    public String getErrorName() {
        return errorName;
    }

    /**
     * Returns the raw detail message without the error identifier prefix.
     */
    public String getDetail() {
        return detail;
    }

    @Override
    public String getMessage() {
        return errorName + ": " + detail;
    }

    private static String requireErrorName(String errorName) {
        Objects.requireNonNull(errorName, "Error name cannot be null");
        if (errorName.isBlank()) {
            throw new IllegalArgumentException("Error name cannot be blank");
        }
        return errorName;
    }
}
