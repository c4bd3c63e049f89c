/*
 * Copyright 2025 Google LLC
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

package com.google.cm.batchmapping.schema;

import static com.google.cm.batchmapping.ErrorCode.INVALID_SCHEMA;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cm.batchmapping.BatchMappingException;
import com.google.cm.batchmapping.models.FieldType;
import com.google.cm.batchmapping.models.SchemaField;
import com.google.cm.batchmapping.models.TargetSchema;
import com.google.common.collect.ImmutableSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map.Entry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses target schema documents.
 *
 * <p>A document is a JSON object with {@code properties} (field name to an object with {@code
 * type}, {@code description} and {@code pattern}) and a {@code required} list of field names,
 * optionally wrapped in an {@code input_schema} member as tool registries publish it. {@code
 * target_id} and {@code version} are read when present.
 */
public final class TargetSchemaParser {

  private static final Logger logger = LoggerFactory.getLogger(TargetSchemaParser.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private TargetSchemaParser() {}

  /** Parses {@code json} into a schema registered under {@code targetId}. */
  public static TargetSchema parse(String json, String targetId) {
    try {
      JsonNode root = MAPPER.readTree(json);
      if (root == null || !root.isObject()) {
        throw invalid(targetId, "document is not a JSON object");
      }
      return toTargetSchema(root, targetId);
    } catch (JsonProcessingException ex) {
      String message = String.format("Schema for target %s is not valid JSON.", targetId);
      logger.error(message);
      throw new BatchMappingException(message, ex, INVALID_SCHEMA);
    }
  }

  private static TargetSchema toTargetSchema(JsonNode root, String targetId)
      throws JsonProcessingException {
    JsonNode body = root.path("input_schema");
    if (body.isTextual()) {
      body = MAPPER.readTree(body.asText());
    }
    if (!body.isObject()) {
      body = root;
    }
    JsonNode properties = body.path("properties");
    if (!properties.isObject()) {
      throw invalid(targetId, "'properties' must be an object");
    }
    ImmutableSet<String> required = readRequired(body.path("required"), targetId);

    var builder =
        TargetSchema.builder()
            .setTargetId(textOrEmpty(root.path("target_id")).orElse(targetId))
            .setVersion(textOrEmpty(root.path("version")));
    Iterator<Entry<String, JsonNode>> fields = properties.fields();
    while (fields.hasNext()) {
      Entry<String, JsonNode> entry = fields.next();
      builder.addField(toField(entry.getKey(), entry.getValue(), required, targetId));
    }
    for (String name : required) {
      if (!properties.has(name)) {
        throw invalid(targetId, String.format("required field '%s' is not a property", name));
      }
    }
    return builder.build();
  }

  private static SchemaField toField(
      String name, JsonNode property, ImmutableSet<String> required, String targetId) {
    if (!property.isObject()) {
      throw invalid(targetId, String.format("property '%s' must be an object", name));
    }
    return SchemaField.builder()
        .setName(name)
        .setRequired(required.contains(name))
        .setType(toFieldType(textOrEmpty(property.path("type")).orElse(""), name, targetId))
        .setDescription(textOrEmpty(property.path("description")))
        .setPattern(textOrEmpty(property.path("pattern")))
        .build();
  }

  private static FieldType toFieldType(String type, String name, String targetId) {
    switch (type.toLowerCase(Locale.ROOT)) {
      case "":
      case "string":
        return FieldType.STRING;
      case "number":
      case "integer":
        return FieldType.NUMBER;
      case "boolean":
        return FieldType.BOOLEAN;
      default:
        throw invalid(
            targetId, String.format("property '%s' has unsupported type '%s'", name, type));
    }
  }

  private static ImmutableSet<String> readRequired(JsonNode required, String targetId) {
    if (required.isMissingNode() || required.isNull()) {
      return ImmutableSet.of();
    }
    if (!required.isArray()) {
      throw invalid(targetId, "'required' must be a list of field names");
    }
    var names = ImmutableSet.<String>builder();
    for (JsonNode name : required) {
      if (!name.isTextual()) {
        throw invalid(targetId, "'required' must be a list of field names");
      }
      names.add(name.asText());
    }
    return names.build();
  }

  private static Optional<String> textOrEmpty(JsonNode node) {
    return node.isValueNode() && !node.isNull() ? Optional.of(node.asText()) : Optional.empty();
  }

  private static BatchMappingException invalid(String targetId, String reason) {
    String message = String.format("Invalid schema for target %s: %s", targetId, reason);
    logger.error(message);
    return new BatchMappingException(message, INVALID_SCHEMA);
  }
}
