package com.polychaeta.bot.webhook;

import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP listener exposing the webhook route.
 */
public final class WebhookServer {
    private static final Logger log = LoggerFactory.getLogger(WebhookServer.class);

    private final Javalin app;
    private final String path;

    public WebhookServer(WebhookController controller, String path) {
        this.path = path;
        this.app = Javalin.create(config -> config.showJavalinBanner = false);
        app.get(path, ctx -> respond(ctx, controller.handle("GET", ctx::header, ctx.bodyAsBytes())));
        app.post(path, ctx -> respond(ctx, controller.handle("POST", ctx::header, ctx.bodyAsBytes())));
    }

    public void start(int port) {
        app.start(port);
        log.info("Listening for webhooks on :{}{}", port, path);
    }

    public void stop() {
        app.stop();
    }

    private static void respond(Context ctx, WebhookResponse response) {
        ctx.status(response.status);
        ctx.result(response.body);
    }
}
