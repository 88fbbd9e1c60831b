package io.github.sigwasm.api;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import io.github.sigwasm.core.analysis.AnalyzedHandler;
import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.analysis.InputBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which export a page should call for which DOM event, by element key.
 */
public final class HydrationManifest {
    /**
     * A DOM event whose listener calls a handler with no arguments.
     */
    public static final class EventEntry {
        @SerializedName("hk") public final int elementKey;
        @SerializedName("event") public final String event;
        @SerializedName("export") public final String export;

        public EventEntry(int elementKey, String event, String export) {
            this.elementKey = elementKey;
            this.event = event;
            this.export = export;
        }
    }

    /**
     * An input whose value is passed to an input handler.
     */
    public static final class InputEntry {
        @SerializedName("hk") public final int elementKey;
        /**
         * The {@code type} of the input element, which says how to read its value.
         */
        @SerializedName("kind") public final String valueKind;
        @SerializedName("export") public final String export;

        public InputEntry(int elementKey, String valueKind, String export) {
            this.elementKey = elementKey;
            this.valueKind = valueKind;
            this.export = export;
        }
    }

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    @SerializedName("init") private final String init = "init";
    @SerializedName("events") private final List<EventEntry> events;
    @SerializedName("inputs") private final List<InputEntry> inputs;

    public HydrationManifest(List<EventEntry> events, List<InputEntry> inputs) {
        this.events = Collections.unmodifiableList(events);
        this.inputs = Collections.unmodifiableList(inputs);
    }

    public static HydrationManifest of(ComponentAnalysis analysis) {
        List<EventEntry> events = new ArrayList<>();
        for (AnalyzedHandler handler : analysis.getHandlers()) {
            events.add(new EventEntry(handler.elementKey, handler.event(), "handler_" + handler.id));
        }
        List<InputEntry> inputs = new ArrayList<>();
        for (InputBinding input : analysis.getInputBindings()) {
            inputs.add(new InputEntry(input.elementKey, input.valueKind, "input_handler_" + input.handlerId));
        }
        return new HydrationManifest(events, inputs);
    }

    public List<EventEntry> getEvents() {
        return events;
    }

    public List<InputEntry> getInputs() {
        return inputs;
    }

    /**
     * Render this manifest as JSON.
     *
     * @return The JSON text.
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Read a manifest back from its JSON form.
     *
     * @param json The JSON text, as written by {@link #toJson()}.
     * @return The manifest.
     */
    public static HydrationManifest fromJson(String json) {
        HydrationManifest read = GSON.fromJson(json, HydrationManifest.class);
        return new HydrationManifest(read.events, read.inputs);
    }
}
