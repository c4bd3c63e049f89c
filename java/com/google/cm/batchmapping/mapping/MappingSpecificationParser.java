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

package com.google.cm.batchmapping.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads mapping specifications from JSON.
 *
 * <p>Two document shapes are accepted. The native shape lists one rule object per target field:
 *
 * <pre>{@code
 * {
 *   "free_text_field": "full_address",
 *   "fields": {
 *     "postcode": {"type": "direct", "column": "Postcode", "transformations": ["uk_postcode"]},
 *     "building_number": {"type": "regex_extract", "column": "Address",
 *                         "pattern": "^(\\d+[A-Za-z]?)\\s+", "group": 1}
 *   }
 * }
 * }</pre>
 *
 * <p>The legacy shape has {@code column_mappings} (column to field), {@code static_values} (field
 * to constant) and {@code transformations} (field to a {@code concat} or {@code template} config).
 * Later sections override earlier ones for the same field.
 */
public final class MappingSpecificationParser {

  private static final Logger logger = LoggerFactory.getLogger(MappingSpecificationParser.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private MappingSpecificationParser() {}

  /** Parses a specification document. */
  public static MappingSpecification parse(String json) {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException ex) {
      String message = "Mapping specification is not valid JSON.";
      logger.error(message);
      throw new MappingSpecificationException(message, ex);
    }
    if (root == null || !root.isObject()) {
      throw malformed("document must be a JSON object");
    }
    return root.has("fields") ? parseNative(root) : parseLegacy(root);
  }

  private static MappingSpecification parseNative(JsonNode root) {
    JsonNode fields = root.get("fields");
    if (!fields.isObject()) {
      throw malformed("'fields' must be an object");
    }
    var builder = MappingSpecification.builder();
    optionalText(root, "free_text_field").ifPresent(builder::setFreeTextField);
    Iterator<Entry<String, JsonNode>> entries = fields.fields();
    while (entries.hasNext()) {
      Entry<String, JsonNode> entry = entries.next();
      String field = entry.getKey();
      JsonNode ruleNode = entry.getValue();
      if (!ruleNode.isObject()) {
        throw malformed(String.format("rule of field '%s' must be an object", field));
      }
      builder.putRule(field, toRule(field, requiredText(ruleNode, "type", field), ruleNode));
      for (String id : textList(ruleNode.path("transformations"), "transformations", field)) {
        builder.addTransformation(field, id);
      }
    }
    return builder.build();
  }

  private static MappingRule toRule(String field, String type, JsonNode node) {
    switch (type) {
      case "direct":
        return MappingRule.ofDirect(requiredText(node, "column", field));
      case "regex_extract":
        return MappingRule.ofRegexExtract(
            requiredText(node, "column", field),
            requiredText(node, "pattern", field),
            optionalText(node, "group").orElse(RegexExtractRule.DEFAULT_GROUP));
      case "concat":
        return MappingRule.ofConcat(
            textList(node.path("columns"), "columns", field),
            optionalText(node, "separator").orElse(ConcatRule.DEFAULT_SEPARATOR));
      case "constant":
        return MappingRule.ofConstant(requiredText(node, "value", field));
      case "template":
        return MappingRule.ofTemplate(
            requiredText(node, "template", field), textMap(node.path("variables"), field));
      case "passthrough_unmapped":
        return MappingRule.ofPassthroughUnmapped();
      default:
        throw malformed(String.format("field '%s' has unknown rule type '%s'", field, type));
    }
  }

  private static MappingSpecification parseLegacy(JsonNode root) {
    // Insertion order of the first definition is kept when a later section overrides a field
    Map<String, MappingRule> rules = new LinkedHashMap<>();

    JsonNode columnMappings = root.path("column_mappings");
    if (!columnMappings.isMissingNode()) {
      textMap(columnMappings, "column_mappings")
          .forEach((column, field) -> rules.put(field, MappingRule.ofDirect(column)));
    }

    JsonNode staticValues = root.path("static_values");
    if (!staticValues.isMissingNode()) {
      if (!staticValues.isObject()) {
        throw malformed("'static_values' must be an object");
      }
      Iterator<Entry<String, JsonNode>> values = staticValues.fields();
      while (values.hasNext()) {
        Entry<String, JsonNode> entry = values.next();
        if (!entry.getValue().isValueNode() || entry.getValue().isNull()) {
          throw malformed(String.format("static value of '%s' must be a scalar", entry.getKey()));
        }
        rules.put(entry.getKey(), MappingRule.ofConstant(entry.getValue().asText()));
      }
    }

    JsonNode transformations = root.path("transformations");
    if (!transformations.isMissingNode()) {
      if (!transformations.isObject()) {
        throw malformed("'transformations' must be an object");
      }
      Iterator<Entry<String, JsonNode>> entries = transformations.fields();
      while (entries.hasNext()) {
        Entry<String, JsonNode> entry = entries.next();
        String field = entry.getKey();
        String type = requiredText(entry.getValue(), "type", field);
        if (!type.equals("concat") && !type.equals("template")) {
          throw malformed(
              String.format("field '%s' has unsupported transformation type '%s'", field, type));
        }
        rules.put(field, toRule(field, type, entry.getValue().path("config")));
      }
    }

    var builder = MappingSpecification.builder();
    rules.forEach(builder::putRule);
    optionalText(root, "free_text_field").ifPresent(builder::setFreeTextField);
    return builder.build();
  }

  private static String requiredText(JsonNode node, String key, String field) {
    return optionalText(node, key)
        .orElseThrow(
            () -> malformed(String.format("field '%s' is missing text value '%s'", field, key)));
  }

  private static Optional<String> optionalText(JsonNode node, String key) {
    JsonNode value = node.path(key);
    if (value.isMissingNode() || value.isNull()) {
      return Optional.empty();
    }
    if (!value.isValueNode()) {
      throw malformed(String.format("'%s' must be a scalar value", key));
    }
    return Optional.of(value.asText());
  }

  private static ImmutableList<String> textList(JsonNode node, String key, String field) {
    if (node.isMissingNode() || node.isNull()) {
      return ImmutableList.of();
    }
    if (!node.isArray()) {
      throw malformed(String.format("'%s' of field '%s' must be a list", key, field));
    }
    var values = ImmutableList.<String>builder();
    for (JsonNode value : node) {
      if (!value.isTextual()) {
        throw malformed(String.format("'%s' of field '%s' must contain strings", key, field));
      }
      values.add(value.asText());
    }
    return values.build();
  }

  private static ImmutableMap<String, String> textMap(JsonNode node, String context) {
    if (node.isMissingNode() || node.isNull()) {
      return ImmutableMap.of();
    }
    if (!node.isObject()) {
      throw malformed(String.format("'%s' must be an object of strings", context));
    }
    var values = ImmutableMap.<String, String>builder();
    Iterator<Entry<String, JsonNode>> entries = node.fields();
    while (entries.hasNext()) {
      Entry<String, JsonNode> entry = entries.next();
      if (!entry.getValue().isTextual()) {
        throw malformed(String.format("'%s' must be an object of strings", context));
      }
      values.put(entry.getKey(), entry.getValue().asText());
    }
    return values.buildOrThrow();
  }

  private static MappingSpecificationException malformed(String reason) {
    String message = "Malformed mapping specification: " + reason;
    logger.error(message);
    return new MappingSpecificationException(message);
  }
}
