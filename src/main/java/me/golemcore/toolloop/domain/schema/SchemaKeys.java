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

package me.golemcore.toolloop.domain.schema;

import java.util.Set;

/**
 * JSON Schema keywords used by the schema engine.
 */
public final class SchemaKeys {

    public static final String TYPE = "type";
    public static final String PROPERTIES = "properties";
    public static final String REQUIRED = "required";
    public static final String ITEMS = "items";
    public static final String PREFIX_ITEMS = "prefixItems";
    public static final String ANY_OF = "anyOf";
    public static final String ONE_OF = "oneOf";
    public static final String ALL_OF = "allOf";
    public static final String NOT = "not";
    public static final String ADDITIONAL_PROPERTIES = "additionalProperties";
    public static final String DESCRIPTION = "description";
    public static final String TITLE = "title";
    public static final String ENUM = "enum";
    public static final String FORMAT = "format";
    public static final String DEFAULT = "default";
    public static final String REF = "$ref";
    public static final String DEFS = "$defs";
    public static final String DEFINITIONS = "definitions";
    public static final String SCHEMA = "$schema";
    public static final String ID = "$id";
    public static final String COMMENT = "$comment";

    public static final String TYPE_OBJECT = "object";
    public static final String TYPE_ARRAY = "array";
    public static final String TYPE_STRING = "string";
    public static final String TYPE_INTEGER = "integer";
    public static final String TYPE_NUMBER = "number";
    public static final String TYPE_BOOLEAN = "boolean";
    public static final String TYPE_NULL = "null";

    public static final String DEFS_PREFIX = "#/" + DEFS + "/";

    /** Keys stripped from every schema node by the sanitizer. */
    public static final Set<String> METADATA_KEYS = Set.of(SCHEMA, ID, TITLE, DEFS, DEFINITIONS, COMMENT);

    private SchemaKeys() {
    }
}
