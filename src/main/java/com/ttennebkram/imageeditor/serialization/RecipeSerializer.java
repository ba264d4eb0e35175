package com.ttennebkram.imageeditor.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.processors.FilterProcessor;
import com.ttennebkram.imageeditor.processors.FilterProcessorRegistry;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves and loads {@link EditRecipe}s as JSON.
 *
 * <pre>
 * { "steps": [ { "filter": "Grayscale" },
 *              { "filter": "GaussianBlur", "blurRadius": 5 } ] }
 * </pre>
 * Each processor writes and reads only the parameters it uses; missing fields take defaults.
 */
public class RecipeSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static final String STEPS = "steps";
    private static final String FILTER = "filter";

    public static String toJson(EditRecipe recipe) {
        JsonObject root = new JsonObject();
        JsonArray stepsArray = new JsonArray();
        for (EditRecipe.Step step : recipe.getSteps()) {
            JsonObject stepJson = new JsonObject();
            stepJson.addProperty(FILTER, step.getFilterType().getDisplayName());
            FilterProcessorRegistry.get(step.getFilterType()).serializeProperties(step.getParameters(), stepJson);
            stepsArray.add(stepJson);
        }
        root.add(STEPS, stepsArray);
        return GSON.toJson(root);
    }

    /**
     * Parse a recipe. Accepts either {"steps": [...]} or a bare array of steps.
     *
     * @throws JsonParseException on malformed JSON, a missing filter name or an unknown filter
     */
    public static EditRecipe fromJson(String json) {
        return parse(JsonParser.parseString(json));
    }

    public static EditRecipe fromJson(Reader reader) {
        return parse(JsonParser.parseReader(reader));
    }

    public static EditRecipe load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    public static void save(EditRecipe recipe, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(toJson(recipe));
        }
    }

    private static EditRecipe parse(JsonElement root) {
        JsonArray stepsArray;
        if (root.isJsonArray()) {
            stepsArray = root.getAsJsonArray();
        } else if (root.isJsonObject() && root.getAsJsonObject().has(STEPS)
                && root.getAsJsonObject().get(STEPS).isJsonArray()) {
            stepsArray = root.getAsJsonObject().getAsJsonArray(STEPS);
        } else {
            throw new JsonParseException("Recipe must be an object with a \"steps\" array");
        }

        List<EditRecipe.Step> steps = new ArrayList<>();
        for (int i = 0; i < stepsArray.size(); i++) {
            JsonElement element = stepsArray.get(i);
            if (!element.isJsonObject()) {
                throw new JsonParseException("Step " + i + " is not an object");
            }
            steps.add(parseStep(element.getAsJsonObject(), i));
        }
        return new EditRecipe(steps);
    }

    private static EditRecipe.Step parseStep(JsonObject stepJson, int index) {
        if (!stepJson.has(FILTER) || !stepJson.get(FILTER).isJsonPrimitive()) {
            throw new JsonParseException("Step " + index + " has no \"filter\"");
        }
        FilterType type;
        try {
            type = FilterType.fromName(stepJson.get(FILTER).getAsString());
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Step " + index + ": " + e.getMessage(), e);
        }
        FilterProcessor processor = FilterProcessorRegistry.get(type);
        try {
            FilterParameters params = processor.deserializeProperties(stepJson, FilterParameters.defaults());
            return new EditRecipe.Step(type, params);
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new JsonParseException("Step " + index + " has a malformed parameter: " + e.getMessage(), e);
        }
    }
}
