package com.polychaeta.bot.webhook;

public final class WebhookResponse {
    public final int status;
    public final String body;

    private WebhookResponse(int status, String body) {
        this.status = status;
        this.body = body;
    }

    public static WebhookResponse ok() {
        return new WebhookResponse(200, "OK");
    }

    public static WebhookResponse badRequest(String body) {
        return new WebhookResponse(400, body);
    }

    public static WebhookResponse unauthorized() {
        return new WebhookResponse(401, "Unauthorized");
    }

    public static WebhookResponse serverError() {
        return new WebhookResponse(500, "Internal Server Error");
    }

    @Override
    public String toString() {
        return status + " " + body;
    }
}
