package com.rekindle.rex.core.resource;

/**
 * External providers whose request budgets are rationed.
 */
public enum ApiProvider {
    LLM("openai"),
    EMAIL("sendgrid"),
    SMS("twilio");

    private final String serviceName;

    ApiProvider(String serviceName) {
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
