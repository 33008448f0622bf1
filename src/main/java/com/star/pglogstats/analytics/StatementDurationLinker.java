package com.star.pglogstats.analytics;

import com.star.pglogstats.entity.LogRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies the value of each {@code duration:} record onto the closest preceding
 * statement of the same backend process that has no duration yet.
 *
 * <p>The record list keeps its size and order; linked statements are replaced
 * by enriched copies and the duration records stay where they are.
 */
@Component
@Slf4j
public class StatementDurationLinker {

    public List<LogRecord> link(List<LogRecord> records) {
        List<LogRecord> linked = new ArrayList<>(records);
        Map<String, Deque<Integer>> unresolved = new HashMap<>();
        int linkedCount = 0;

        for (int i = 0; i < linked.size(); i++) {
            LogRecord record = linked.get(i);
            String processId = record.getProcessId() != null ? record.getProcessId() : "";

            if (record.isStatement() && record.getDurationMs() == null) {
                unresolved.computeIfAbsent(processId, k -> new ArrayDeque<>()).push(i);

            } else if (record.isDuration() && record.getDurationMs() != null) {
                Deque<Integer> pending = unresolved.get(processId);
                if (pending != null && !pending.isEmpty()) {
                    int index = pending.pop();
                    linked.set(index, linked.get(index).toBuilder()
                            .durationMs(record.getDurationMs())
                            .build());
                    linkedCount++;
                }
            }
        }

        log.debug("Linked {} durations to statements", linkedCount);
        return linked;
    }
}
