/*
 * Copyright 2025 The Komrad Authors
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

package org.komrad.impl.system;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.komrad.impl.BoolValue;
import org.komrad.impl.EvalError;
import org.komrad.impl.FloatValue;
import org.komrad.impl.IntValue;
import org.komrad.impl.IntrinsicCall;
import org.komrad.impl.ListValue;
import org.komrad.impl.MappingValue;
import org.komrad.impl.NoneValue;
import org.komrad.impl.StringValue;
import org.komrad.impl.SystemAgent.Intrinsic;
import org.komrad.impl.Value;
import org.komrad.impl.WordValue;

/**
 * {@code Json}: converts between values and JSON text.
 *
 * <p>Ints, floats, strings, booleans, {@code none}, lists and mappings map onto the corresponding
 * JSON types; words are encoded as strings, and mapping keys as the display form of the key.
 * Agents and blocks cannot be encoded.
 */
public final class JsonAgent {

  private JsonAgent() {}

  static final ObjectMapper MAPPER = JsonMapper.builder().build();

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  @Intrinsic("encode _v")
  static Value encode(IntrinsicCall call) throws EvalError {
    try {
      return new StringValue(MAPPER.writeValueAsString(toJson(call, call.arg("v"))));
    } catch (JsonProcessingException e) {
      throw call.failure(e);
    }
  }

  @Intrinsic("decode _s")
  static Value decode(IntrinsicCall call) throws EvalError {
    JsonNode node;
    try {
      node = MAPPER.readTree(call.string("s"));
    } catch (JsonProcessingException e) {
      throw call.failure("invalid JSON (%s)", e.getOriginalMessage());
    }
    return fromJson(node);
  }

  static JsonNode toJson(IntrinsicCall call, Value v) throws EvalError {
    if (v instanceof IntValue i) {
      return NODES.numberNode(i.value());
    } else if (v instanceof FloatValue f) {
      return NODES.numberNode(f.value());
    } else if (v instanceof StringValue s) {
      return NODES.textNode(s.value);
    } else if (v instanceof WordValue w) {
      return NODES.textNode(w.text());
    } else if (v instanceof BoolValue b) {
      return NODES.booleanNode(b.asBoolean());
    } else if (v == NoneValue.NONE) {
      return NODES.nullNode();
    } else if (v instanceof ListValue list) {
      ArrayNode array = NODES.arrayNode(list.size());
      for (Value element : list.elements()) {
        array.add(toJson(call, element));
      }
      return array;
    } else if (v instanceof MappingValue mapping) {
      ObjectNode object = NODES.objectNode();
      for (Map.Entry<Value, Value> entry : mapping.entries().entrySet()) {
        object.set(entry.getKey().display(), toJson(call, entry.getValue()));
      }
      return object;
    }
    throw call.failure("can't encode %s", v);
  }

  static Value fromJson(JsonNode node) {
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return IntValue.of(node.longValue());
    } else if (node.isNumber()) {
      return new FloatValue(node.doubleValue());
    } else if (node.isTextual()) {
      return new StringValue(node.textValue());
    } else if (node.isBoolean()) {
      return BoolValue.of(node.booleanValue());
    } else if (node.isArray()) {
      ImmutableList.Builder<Value> elements = ImmutableList.builderWithExpectedSize(node.size());
      for (JsonNode element : node) {
        elements.add(fromJson(element));
      }
      return new ListValue(elements.build());
    } else if (node.isObject()) {
      Map<Value, Value> entries = new LinkedHashMap<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> field = it.next();
        entries.put(new StringValue(field.getKey()), fromJson(field.getValue()));
      }
      return MappingValue.of(entries);
    }
    return NoneValue.NONE;
  }
}
