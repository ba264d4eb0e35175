package com.ttennebkram.imageeditor.serialization;

import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of filter steps that can be saved, loaded and replayed onto a session.
 */
public final class EditRecipe {

    /**
     * One filter application.
     */
    public static final class Step {
        private final FilterType filterType;
        private final FilterParameters parameters;

        public Step(FilterType filterType, FilterParameters parameters) {
            this.filterType = Objects.requireNonNull(filterType, "filterType");
            this.parameters = parameters != null ? parameters : FilterParameters.defaults();
        }

        public FilterType getFilterType() {
            return filterType;
        }

        public FilterParameters getParameters() {
            return parameters;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Step)) return false;
            Step step = (Step) o;
            return filterType == step.filterType && parameters.equals(step.parameters);
        }

        @Override
        public int hashCode() {
            return Objects.hash(filterType, parameters);
        }

        @Override
        public String toString() {
            return filterType.getDisplayName() + " " + parameters;
        }
    }

    private final List<Step> steps;

    public EditRecipe(List<Step> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static EditRecipe of(Step... steps) {
        return new EditRecipe(List.of(steps));
    }

    public List<Step> getSteps() {
        return steps;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EditRecipe)) return false;
        return steps.equals(((EditRecipe) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }
}
