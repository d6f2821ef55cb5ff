package org.benchlab.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generic prompt plus ground-truth instance.
 */
public final class LabeledInstance extends Instance {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.instances", "LabeledInstance");

    private final String prompt;
    private final String groundTruth;

    public LabeledInstance(String id, String prompt, String groundTruth) {
        this(id, prompt, groundTruth, List.of(), Map.of());
    }

    public LabeledInstance(
        String id,
        String prompt,
        String groundTruth,
        List<Attempt> attempts,
        Map<String, List<Object>> evaluations
    ) {
        super(id, attempts, evaluations);
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        this.groundTruth = groundTruth;
    }

    public String prompt() {
        return prompt;
    }

    @Override
    public String groundTruth() {
        return groundTruth;
    }

    @Override
    public TypeTag typeTag() {
        return TYPE_TAG;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("prompt", prompt);
        fields.put("ground_truth", groundTruth);
        return fields;
    }

    @Override
    protected LabeledInstance rebuild(List<Attempt> attempts, Map<String, List<Object>> evaluations) {
        return new LabeledInstance(id(), prompt, groundTruth, attempts, evaluations);
    }
}
