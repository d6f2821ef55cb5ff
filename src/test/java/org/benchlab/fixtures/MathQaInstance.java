package org.benchlab.fixtures;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.benchlab.model.Attempt;
import org.benchlab.model.Instance;
import org.benchlab.model.TypeTag;
import org.benchlab.registry.InstanceRecord;

public final class MathQaInstance extends Instance {
    public static final TypeTag TYPE_TAG = TypeTag.of("benchlab.fixtures", "MathQaInstance");

    private final String question;
    private final int answer;

    public MathQaInstance(String id, String question, int answer) {
        this(id, question, answer, List.of(), Map.of());
    }

    public MathQaInstance(
        String id,
        String question,
        int answer,
        List<Attempt> attempts,
        Map<String, List<Object>> evaluations
    ) {
        super(id, attempts, evaluations);
        this.question = question;
        this.answer = answer;
    }

    static MathQaInstance fromRecord(InstanceRecord record) {
        Object answer = record.field("answer");
        if (!(answer instanceof Number number)) {
            throw new IllegalArgumentException("answer must be a number");
        }
        return new MathQaInstance(
            record.id(),
            record.stringField("question"),
            number.intValue(),
            record.attempts(),
            record.evaluations()
        );
    }

    public String question() {
        return question;
    }

    @Override
    public Integer groundTruth() {
        return answer;
    }

    @Override
    public TypeTag typeTag() {
        return TYPE_TAG;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("question", question);
        fields.put("answer", answer);
        return fields;
    }

    @Override
    protected MathQaInstance rebuild(List<Attempt> attempts, Map<String, List<Object>> evaluations) {
        return new MathQaInstance(id(), question, answer, attempts, evaluations);
    }
}
