package io.ensightrpc.client.proxy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records expressions and statements; answers expressions from a table.
 */
final class RecordingEvaluator implements RemoteEvaluator {
    final List<String> evaluated = new CopyOnWriteArrayList<>();
    final List<String> executed = new CopyOnWriteArrayList<>();
    private final Map<String, Object> answers = new ConcurrentHashMap<>();

    RecordingEvaluator answer(String expression, Object value) {
        answers.put(expression, value);
        return this;
    }

    @Override
    public Object eval(String expression) {
        evaluated.add(expression);
        return answers.get(expression);
    }

    @Override
    public void exec(String statement) {
        executed.add(statement);
    }
}
