/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.json;

import static com.google.common.base.Preconditions.checkArgument;

import us.blanshard.crossword.core.LetterGrid;
import us.blanshard.crossword.core.Slot;
import us.blanshard.crossword.core.Structure;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.reflect.TypeToken;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Map;

/**
 * Static methods that convert crossword solutions and letter grids to and
 * from json.
 *
 * @author Luke Blanshard
 */
public class CrosswordJson {

  /** A Type to use with {@link Gson} for solutions. */
  @SuppressWarnings("serial")
  public static final Type SOLUTION_TYPE = new TypeToken<Map<Slot, String>>(){}.getType();

  /** A convenience for reading/writing solutions. */
  public static final Gson GSON = registerSlot(new GsonBuilder()).create();

  /**
   * Registers a type adapter in the given builder that writes slots in their
   * compact string form, so that maps keyed by slot become json objects.
   */
  public static GsonBuilder registerSlot(GsonBuilder builder) {
    builder.registerTypeAdapter(Slot.class, new TypeAdapter<Slot>() {
      @Override public void write(JsonWriter out, Slot value) throws IOException {
        out.value(value.toJsonValue());
      }
      @Override public Slot read(JsonReader in) throws IOException {
        return Slot.fromJsonValue(in.nextString());
      }
    });
    builder.enableComplexMapKeySerialization();
    return builder;
  }

  /**
   * Writes the given solution as a json object from slot to word, in slot
   * order.
   */
  public static String toJson(Map<Slot, String> solution) {
    JsonObject object = new JsonObject();
    for (Map.Entry<Slot, String> entry : ImmutableSortedMap.copyOf(solution).entrySet())
      object.addProperty(entry.getKey().toJsonValue(), entry.getValue());
    return GSON.toJson(object);
  }

  /**
   * Reads a solution written by {@link #toJson(Map)}, checking that its slots
   * belong to the given structure and its words fit them.
   */
  public static ImmutableSortedMap<Slot, String> fromJson(Structure structure, String json) {
    JsonObject object;
    try {
      object = JsonParser.parseString(json).getAsJsonObject();
    } catch (IllegalStateException e) {
      throw new JsonParseException("Not a json object: " + json, e);
    }
    ImmutableSortedMap.Builder<Slot, String> builder = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      Slot slot = Slot.fromJsonValue(entry.getKey());
      String word = entry.getValue().getAsString();
      checkArgument(structure.contains(slot), "not a slot of this structure: %s", slot);
      checkArgument(word.length() == slot.length, "%s doesn't fit %s", word, slot);
      builder.put(slot, word);
    }
    return builder.build();
  }

  /** Writes the given grid's rows as a json array of strings. */
  public static String toJson(LetterGrid grid) {
    JsonArray array = new JsonArray();
    for (String row : grid.rows())
      array.add(new JsonPrimitive(row));
    return GSON.toJson(array);
  }

  // Static methods only.
  private CrosswordJson() {}
}
