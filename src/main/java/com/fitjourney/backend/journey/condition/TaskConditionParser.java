package com.fitjourney.backend.journey.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * condition_json → List&lt;TaskCondition&gt;。
 *
 * <ul>
 *   <li>物件 → 一個條件；陣列 → 多個條件（AND）</li>
 *   <li>null / {} / [] → 空清單（視為無條件）</li>
 *   <li>壞掉的元素不丟例外，換成一個未知種類的條件（評估時 0 進度），
 *       避免一筆壞資料讓整個任務變成可完成</li>
 * </ul>
 */
@Slf4j
@Component
public class TaskConditionParser {

    static final String INVALID_TYPE = "INVALID";

    private final ObjectMapper om;

    public TaskConditionParser(ObjectMapper om) {
        this.om = om;
    }

    public List<TaskCondition> parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return List.of();

        if (node.isArray()) {
            List<TaskCondition> out = new ArrayList<>(node.size());
            for (JsonNode el : node) out.add(parseOne(el));
            return List.copyOf(out);
        }
        if (node.isObject() && node.isEmpty()) return List.of();
        return List.of(parseOne(node));
    }

    private TaskCondition parseOne(JsonNode el) {
        if (el == null || !el.isObject()) {
            log.warn("invalid condition element. node={}", el);
            return invalid();
        }
        try {
            return om.treeToValue(el, TaskCondition.class);
        } catch (Exception ex) {
            log.warn("invalid condition element. node={} err={}", el, ex.toString());
            return invalid();
        }
    }

    private static TaskCondition invalid() {
        return new TaskCondition(INVALID_TYPE, null, null, null, null, null, null);
    }
}
