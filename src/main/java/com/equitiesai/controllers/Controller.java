package com.equitiesai.controllers;

import io.javalin.Javalin;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Safe error body helper that handles null exception messages.
     * Use this instead of Map.of("error", e.getMessage()) to prevent NPE.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    /**
     * Error body that also names the failure type so clients can render it distinctly.
     */
    static Map<String, Object> errorBody(Exception e, String type) {
        Map<String, Object> body = new LinkedHashMap<>(errorBody(e));
        body.put("type", type);
        return body;
    }
}
