package dev.zhengxiang.multiplexer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Completion that records every result it receives.
 */
class RecordingCallback<T> implements Consumer<Result<T>> {

    final List<Result<T>> results = new CopyOnWriteArrayList<>();

    @Override
    public void accept(Result<T> result) {
        results.add(result);
    }

    Result<T> single() {
        if (results.size() != 1) {
            throw new AssertionError("Expected exactly one result but got " + results);
        }
        return results.get(0);
    }
}
