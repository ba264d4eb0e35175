package com.ttennebkram.imageeditor.serialization;

import com.google.gson.JsonParseException;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipeSerializerTest {

    @Test
    void parsesStepsAndFillsMissingParametersWithDefaults() {
        String json = "{ \"steps\": ["
                + " { \"filter\": \"Grayscale\" },"
                + " { \"filter\": \"BrightnessContrast\", \"brightness\": 20, \"contrast\": 15 },"
                + " { \"filter\": \"GaussianBlur\", \"blurRadius\": 5 } ] }";

        EditRecipe recipe = RecipeSerializer.fromJson(json);

        assertThat(recipe.getSteps()).containsExactly(
                new EditRecipe.Step(FilterType.GRAYSCALE, FilterParameters.defaults()),
                new EditRecipe.Step(FilterType.BRIGHTNESS_CONTRAST, new FilterParameters(20, 15, 3)),
                new EditRecipe.Step(FilterType.GAUSSIAN_BLUR, FilterParameters.defaults().withBlurRadius(5)));
    }

    @Test
    void acceptsBareArrayAndShortRadiusKey() {
        EditRecipe recipe = RecipeSerializer.fromJson("[ { \"filter\": \"gaussian_blur\", \"radius\": 2 } ]");

        assertThat(recipe.size()).isEqualTo(1);
        assertThat(recipe.getSteps().get(0).getParameters().getBlurRadius()).isEqualTo(2);
    }

    @Test
    void writesOnlyTheParametersEachFilterUses() {
        EditRecipe recipe = EditRecipe.of(
                new EditRecipe.Step(FilterType.SEPIA, new FilterParameters(50, 50, 9)),
                new EditRecipe.Step(FilterType.BRIGHTNESS, new FilterParameters(12, 50, 9)));

        String json = RecipeSerializer.toJson(recipe);

        assertThat(json).contains("\"filter\": \"Sepia\"", "\"brightness\": 12.0");
        assertThat(json).doesNotContain("contrast", "blurRadius");
    }

    @Test
    void rejectsUnknownFilter() {
        assertThatThrownBy(() -> RecipeSerializer.fromJson("{\"steps\":[{\"filter\":\"Posterize\"}]}"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("Posterize");
    }

    @Test
    void rejectsMalformedRecipes() {
        assertThatThrownBy(() -> RecipeSerializer.fromJson("{\"filters\": []}"))
                .isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> RecipeSerializer.fromJson("{\"steps\":[{\"brightness\": 3}]}"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("filter");
        assertThatThrownBy(() -> RecipeSerializer.fromJson("{\"steps\":[42]}"))
                .isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> RecipeSerializer.fromJson("{\"steps\": ["))
                .isInstanceOf(JsonParseException.class);
    }

    @Test
    void saveAndLoadThroughFile(@TempDir Path dir) throws Exception {
        EditRecipe recipe = EditRecipe.of(
                new EditRecipe.Step(FilterType.EDGE_DETECTION, null),
                new EditRecipe.Step(FilterType.BRIGHTNESS_CONTRAST, new FilterParameters(-10, 35, 3)));
        Path file = dir.resolve("recipe.json");

        RecipeSerializer.save(recipe, file);

        assertThat(RecipeSerializer.load(file)).isEqualTo(recipe);
    }
}
