package com.firefly.prdagent.entity;

import java.util.Locale;

/**
 * 助手回答视角：产品 / 开发 / 测试。
 */
public enum AnswerRole {
    PM, DEV, QA;

    /**
     * 宽松解析，兼容 pm/dev/qa 小写写法；无法识别时返回 null。
     */
    public static AnswerRole parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AnswerRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
