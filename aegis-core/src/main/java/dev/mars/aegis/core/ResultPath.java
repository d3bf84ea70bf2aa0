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

package dev.mars.aegis.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Location in the payload where a state's result or a caught error is merged.
 *
 * <p>Supported forms:</p>
 * <ul>
 *   <li>{@code $} - the value replaces the whole payload</li>
 *   <li>{@code $.a.b} - the value is stored under {@code a.b}; missing intermediate objects
 *       are created and a non-object payload is replaced by an object first</li>
 *   <li>{@link #DISCARD} (JSON {@code null} in a definition) - the value is dropped and the
 *       input payload passes through unchanged</li>
 * </ul>
 *
 * <p>{@link #apply} never mutates its arguments.</p>
 */
public final class ResultPath {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9_\\-]+");

    public static final ResultPath ROOT = new ResultPath("$", List.of(), false);
    public static final ResultPath DISCARD = new ResultPath(null, List.of(), true);

    private final String expression;
    private final List<String> segments;
    private final boolean discard;

    private ResultPath(String expression, List<String> segments, boolean discard) {
        this.expression = expression;
        this.segments = segments;
        this.discard = discard;
    }

    /**
     * Parses a path expression.
     *
     * @param expression {@code $} or {@code $.field(.field)*}
     * @return the parsed path
     * @throws IllegalArgumentException if the expression is not a supported path
     */
    public static ResultPath of(String expression) {
        Objects.requireNonNull(expression, "Result path cannot be null; use ResultPath.DISCARD");
        if ("$".equals(expression)) {
            return ROOT;
        }
        if (!expression.startsWith("$.")) {
            throw new IllegalArgumentException("Result path must be '$' or start with '$.': " + expression);
        }
        String[] parts = expression.substring(2).split("\\.", -1);
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                throw new IllegalArgumentException("Invalid segment '" + part + "' in result path " + expression);
            }
        }
        return new ResultPath(expression, List.of(parts), false);
    }

    /**
     * Checks an expression without throwing.
     */
    public static boolean isValid(String expression) {
        try {
            of(expression);
            return true;
        } catch (IllegalArgumentException | NullPointerException e) {
            return false;
        }
    }

    /**
     * Merges {@code value} into {@code input} at this path.
     *
     * @param input the payload the state received
     * @param value the result or error detail to merge
     * @return a new payload; the arguments are left untouched
     */
    public JsonNode apply(JsonNode input, JsonNode value) {
        if (discard) {
            return input == null ? JsonNodeFactory.instance.nullNode() : input.deepCopy();
        }
        JsonNode copiedValue = value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy();
        if (segments.isEmpty()) {
            return copiedValue;
        }

        ObjectNode root = input != null && input.isObject()
                ? ((ObjectNode) input).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        ObjectNode current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = current.get(segments.get(i));
            if (child == null || !child.isObject()) {
                child = current.putObject(segments.get(i));
            }
            current = (ObjectNode) child;
        }
        current.set(segments.get(segments.size() - 1), copiedValue);
        return root;
    }

    public boolean isDiscard() {
        return discard;
    }

    public boolean isRoot() {
        return !discard && segments.isEmpty();
    }

    /**
     * Returns the original expression, or {@code null} for {@link #DISCARD}.
     */
    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultPath that = (ResultPath) o;
        return discard == that.discard && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, discard);
    }

    @Override
    public String toString() {
        return discard ? "ResultPath{discard}" : "ResultPath{" + expression + "}";
    }
}
