package regstat;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.javalin.Javalin;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regstat.ml.RegressionException;
import regstat.ml.RegressionResults;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP front end for the estimators.
 * Run with: mvn exec:java -Dexec.mainClass="regstat.WebApp"
 * Then POST a {@link FitRequest} to http://localhost:7000/api/fit
 */
public class WebApp {

    private static final Logger logger = LogManager.getLogger(WebApp.class);

    private static final Gson GSON = new Gson();

    static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid PORT '{}', using 7000", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        Javalin app = create().start("0.0.0.0", port);
        logger.info("Regression web app: http://localhost:{}", app.port());
    }

    static Javalin create() {
        Javalin app = Javalin.create();

        app.post("/api/fit", ctx -> {
            JsonObject out = handleFit(ctx.body());
            int status = out.has("error") ? 400 : 200;
            ctx.status(status).contentType("application/json").result(GSON.toJson(out));
        });

        app.get("/api/sample", ctx -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("columns", SampleData.regressors());
            body.put("response", SampleData.white());
            body.put("regressionType", "logit");
            body.put("createIntercept", true);
            sendJson(ctx, 200, body);
        });

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            sendJson(ctx, 200, h);
        });
        return app;
    }

    /** Fit the model described by {@code body}; failures are reported in an "error" field. */
    static JsonObject handleFit(String body) {
        try {
            FitRequest request = FitRequest.parse(body);
            RegressionResults results = request.toModel().fit();
            return results.toJsonTree();
        } catch (IllegalArgumentException | RegressionException e) {
            logger.info("Rejected fit request: {}", e.getMessage());
            JsonObject err = new JsonObject();
            String msg = e.getMessage();
            err.addProperty("error", msg != null && !msg.isEmpty() ? msg : e.getClass().getSimpleName());
            err.addProperty("type", e.getClass().getSimpleName());
            return err;
        }
    }

    private static void sendJson(io.javalin.http.Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }
}
