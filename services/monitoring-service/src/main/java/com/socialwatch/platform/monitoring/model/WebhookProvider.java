package com.socialwatch.platform.monitoring.model;

import lombok.Getter;

@Getter
public enum WebhookProvider {
    FEISHU("feishu"),
    WECHAT_WORK("wechat_work"),
    DINGTALK("dingtalk"),
    CUSTOM("custom");

    private final String code;

    WebhookProvider(String code) {
        this.code = code;
    }
}
